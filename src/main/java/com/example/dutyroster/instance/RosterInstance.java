package com.example.dutyroster.instance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 読み込んだインスタンス全体のスナップショット。
 * <p>
 * 読み込み後は変更しないため、複数の割当実行で共有できる。
 * スタッフ・シフト・必要人数は記載順を保持する。
 */
public class RosterInstance {

    private final int horizon;
    private final List<Shift> shifts;
    private final List<StaffMember> staff;
    private final Map<String, Set<Integer>> daysOff;
    private final List<CoverRequirement> coverRequirements;
    private final List<ShiftRequest> shiftRequests;

    private final Map<String, Shift> shiftsById;
    private final Map<String, StaffMember> staffById;

    public RosterInstance(int horizon,
                          List<Shift> shifts,
                          List<StaffMember> staff,
                          Map<String, ? extends Set<Integer>> daysOff,
                          List<CoverRequirement> coverRequirements,
                          List<ShiftRequest> shiftRequests) {
        if (horizon < 0) {
            throw new IllegalArgumentException("計画期間は0以上で指定してください: " + horizon);
        }
        this.horizon = horizon;
        this.shifts = List.copyOf(shifts);
        this.staff = List.copyOf(staff);
        Map<String, Set<Integer>> off = new LinkedHashMap<>();
        if (daysOff != null) {
            daysOff.forEach((staffId, days) -> off.put(staffId, Set.copyOf(days)));
        }
        this.daysOff = Collections.unmodifiableMap(off);
        this.coverRequirements = List.copyOf(coverRequirements);
        this.shiftRequests = shiftRequests == null ? List.of() : List.copyOf(shiftRequests);
        this.shiftsById = indexById(this.shifts, Shift::id, "シフト");
        this.staffById = indexById(this.staff, StaffMember::getId, "スタッフ");
    }

    private static <T> Map<String, T> indexById(List<T> items, Function<T, String> idOf, String kind) {
        return Collections.unmodifiableMap(items.stream().collect(Collectors.toMap(idOf, Function.identity(),
                (a, b) -> {
                    throw new IllegalArgumentException(kind + "IDが重複しています: " + idOf.apply(a));
                },
                LinkedHashMap::new)));
    }

    public int getHorizon() { return horizon; }
    public List<Shift> getShifts() { return shifts; }
    public List<StaffMember> getStaff() { return staff; }
    public Map<String, Set<Integer>> getDaysOff() { return daysOff; }
    public List<CoverRequirement> getCoverRequirements() { return coverRequirements; }
    public List<ShiftRequest> getShiftRequests() { return shiftRequests; }

    public Optional<Shift> findShift(String shiftId) {
        return Optional.ofNullable(shiftsById.get(shiftId));
    }

    public Optional<StaffMember> findStaff(String staffId) {
        return Optional.ofNullable(staffById.get(staffId));
    }

    public Set<Integer> daysOffOf(String staffId) {
        return daysOff.getOrDefault(staffId, Set.of());
    }

    public boolean isDayOff(String staffId, int day) {
        return daysOffOf(staffId).contains(day);
    }

    public List<ShiftRequest> shiftRequests(ShiftRequest.Kind kind) {
        return shiftRequests.stream().filter(r -> r.kind() == kind).toList();
    }
}
