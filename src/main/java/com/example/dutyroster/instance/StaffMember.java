package com.example.dutyroster.instance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * スタッフ1名分の勤務条件。
 * <p>
 * 割当時に強制するのはシフト別上限と {@code maxConsecutiveShifts} のみ。
 * 総シフト数・総勤務時間・最小連続勤務・最小連続休日・週末勤務の条件は
 * 保持だけして監査で報告する。
 */
public class StaffMember {

    private final String id;
    private final Map<String, Integer> shiftLimits;
    private final int maxShifts;
    private final int maxTotalMinutes;
    private final int minTotalMinutes;
    private final int maxConsecutiveShifts;
    private final int minConsecutiveShifts;
    private final int minConsecutiveDaysOff;
    private final Integer maxWeekends;

    public StaffMember(String id, Map<String, Integer> shiftLimits,
                       int maxShifts, int maxTotalMinutes, int minTotalMinutes,
                       int maxConsecutiveShifts, int minConsecutiveShifts,
                       int minConsecutiveDaysOff, Integer maxWeekends) {
        this.id = Objects.requireNonNull(id, "id");
        this.shiftLimits = shiftLimits == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(shiftLimits));
        this.maxShifts = maxShifts;
        this.maxTotalMinutes = maxTotalMinutes;
        this.minTotalMinutes = minTotalMinutes;
        this.maxConsecutiveShifts = maxConsecutiveShifts;
        this.minConsecutiveShifts = minConsecutiveShifts;
        this.minConsecutiveDaysOff = minConsecutiveDaysOff;
        this.maxWeekends = maxWeekends;
    }

    public String getId() { return id; }
    public Map<String, Integer> getShiftLimits() { return shiftLimits; }
    public int getMaxShifts() { return maxShifts; }
    public int getMaxTotalMinutes() { return maxTotalMinutes; }
    public int getMinTotalMinutes() { return minTotalMinutes; }
    public int getMaxConsecutiveShifts() { return maxConsecutiveShifts; }
    public int getMinConsecutiveShifts() { return minConsecutiveShifts; }
    public int getMinConsecutiveDaysOff() { return minConsecutiveDaysOff; }

    public OptionalInt getMaxWeekends() {
        return maxWeekends == null ? OptionalInt.empty() : OptionalInt.of(maxWeekends);
    }

    /**
     * 計画期間全体でのシフト別上限。上限なしの場合は空。
     */
    public OptionalInt shiftLimit(String shiftId) {
        Integer limit = shiftLimits.get(shiftId);
        return limit == null ? OptionalInt.empty() : OptionalInt.of(limit);
    }

    @Override
    public String toString() {
        return "StaffMember{" + id + "}";
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private final Map<String, Integer> shiftLimits = new LinkedHashMap<>();
        private int maxShifts = Integer.MAX_VALUE;
        private int maxTotalMinutes = Integer.MAX_VALUE;
        private int minTotalMinutes = 0;
        private int maxConsecutiveShifts = Integer.MAX_VALUE;
        private int minConsecutiveShifts = 0;
        private int minConsecutiveDaysOff = 0;
        private Integer maxWeekends;

        private Builder(String id) {
            this.id = id;
        }

        public Builder shiftLimit(String shiftId, int max) {
            this.shiftLimits.put(shiftId, max);
            return this;
        }

        public Builder maxShifts(int maxShifts) {
            this.maxShifts = maxShifts;
            return this;
        }

        public Builder maxTotalMinutes(int minutes) {
            this.maxTotalMinutes = minutes;
            return this;
        }

        public Builder minTotalMinutes(int minutes) {
            this.minTotalMinutes = minutes;
            return this;
        }

        public Builder maxConsecutiveShifts(int days) {
            this.maxConsecutiveShifts = days;
            return this;
        }

        public Builder minConsecutiveShifts(int days) {
            this.minConsecutiveShifts = days;
            return this;
        }

        public Builder minConsecutiveDaysOff(int days) {
            this.minConsecutiveDaysOff = days;
            return this;
        }

        public Builder maxWeekends(Integer weekends) {
            this.maxWeekends = weekends;
            return this;
        }

        public StaffMember build() {
            return new StaffMember(id, shiftLimits, maxShifts, maxTotalMinutes, minTotalMinutes,
                    maxConsecutiveShifts, minConsecutiveShifts, minConsecutiveDaysOff, maxWeekends);
        }
    }
}
