package com.example.dutyroster.schedule;

import com.example.dutyroster.instance.CoverRequirement;
import com.example.dutyroster.instance.RosterInstance;
import com.example.dutyroster.instance.StaffMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 1つの {@link RosterInstance} に対し、1回の貪欲法でシフト表を作る。
 * <p>
 * 追加のみの割当集合を3つの形で保持する: 全体の一覧、スタッフ別 (追加順)、
 * 日×シフト別。書き込みは必ず {@link #commit(Assignment)} で3つ同時に行う。
 * 1インスタンスで1回だけ実行でき、再実行には新しいインスタンスを作る。
 */
public class ScheduleEngine {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleEngine.class);

    private final RosterInstance instance;
    private final FillSettings settings;

    private final List<Assignment> assignments = new ArrayList<>();
    private final Map<String, List<Assignment>> assignmentsByStaff = new HashMap<>();
    private final Map<DayShift, List<Assignment>> assignmentsByDayShift = new HashMap<>();

    private boolean filled;

    public ScheduleEngine(RosterInstance instance) {
        this(instance, FillSettings.DEFAULT);
    }

    public ScheduleEngine(RosterInstance instance, FillSettings settings) {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * {@code candidate} を現在の割当に追加できるか。副作用はない。
     */
    public boolean isValidAssignment(Assignment candidate) {
        return findViolation(candidate).isEmpty();
    }

    /**
     * {@code candidate} が最初に違反するチェック。追加可能なら空。
     * 既存の割当は各チェックが参照する範囲以外では再検証しない。
     */
    public Optional<Violation> findViolation(Assignment candidate) {
        StaffMember staff = instance.findStaff(candidate.staffId())
                .orElseThrow(() -> new IllegalArgumentException("未定義のスタッフIDです: " + candidate.staffId()));
        List<Assignment> own = assignmentsByStaff.getOrDefault(staff.getId(), List.of());
        int day = candidate.day();

        if (instance.isDayOff(staff.getId(), day)) {
            return Optional.of(Violation.DAY_OFF);
        }

        OptionalInt limit = staff.shiftLimit(candidate.shiftId());
        if (limit.isPresent()) {
            long count = own.stream().filter(a -> a.shiftId().equals(candidate.shiftId())).count();
            if (count >= limit.getAsInt()) {
                return Optional.of(Violation.SHIFT_LIMIT);
            }
        }

        if (violatesSuccession(candidate, own)) {
            return Optional.of(Violation.FORBIDDEN_SUCCESSION);
        }

        if (consecutiveRun(day, own) > staff.getMaxConsecutiveShifts()) {
            return Optional.of(Violation.MAX_CONSECUTIVE_SHIFTS);
        }
        return Optional.empty();
    }

    private boolean violatesSuccession(Assignment candidate, List<Assignment> own) {
        if (own.isEmpty()) {
            return false;
        }
        int day = candidate.day();
        if (settings.validityMode() == ValidityMode.INSERTION_ORDER) {
            Assignment last = own.get(own.size() - 1);
            return last.day() == day - 1 && forbids(last.shiftId(), candidate.shiftId());
        }
        for (Assignment existing : own) {
            if (existing.day() == day - 1 && forbids(existing.shiftId(), candidate.shiftId())) {
                return true;
            }
            if (existing.day() == day + 1 && forbids(candidate.shiftId(), existing.shiftId())) {
                return true;
            }
        }
        return false;
    }

    private boolean forbids(String shiftId, String nextShiftId) {
        return instance.findShift(shiftId).map(s -> s.forbids(nextShiftId)).orElse(false);
    }

    // 候補日を含む連続勤務日数
    private int consecutiveRun(int day, List<Assignment> own) {
        if (own.isEmpty()) {
            return 1;
        }
        Set<Integer> worked = own.stream().map(Assignment::day).collect(Collectors.toSet());
        int run = 1;
        for (int prev = day - 1; prev >= 0 && worked.contains(prev); prev--) {
            run++;
        }
        if (settings.validityMode() == ValidityMode.CALENDAR) {
            for (int next = day + 1; worked.contains(next); next++) {
                run++;
            }
        }
        return run;
    }

    /**
     * 貪欲法で割当を行う。必要人数枠は不足時の重みの降順 (同値は記載順)、スタッフは
     * 設定された順に試し、1枠につき1人1回まで割り当てる。不足が出ても巻き戻さない。
     *
     * @throws IllegalStateException 既に実行済みの場合
     */
    public ScheduleResult fill() {
        if (filled) {
            throw new IllegalStateException("この ScheduleEngine は既に実行済みです");
        }
        filled = true;
        long started = System.nanoTime();

        List<CoverRequirement> requirements = new ArrayList<>(instance.getCoverRequirements());
        requirements.sort(Comparator.comparingInt(CoverRequirement::weightUnder).reversed());
        List<StaffMember> staffOrder = settings.staffOrder().apply(instance.getStaff());

        List<UnmetRequirement> unmet = new ArrayList<>();
        int processed = 0;
        for (CoverRequirement requirement : requirements) {
            processed++;
            int needed = requirement.requirement() - assignmentsFor(requirement.day(), requirement.shiftId()).size();
            if (needed <= 0) {
                continue;
            }
            for (StaffMember staff : staffOrder) {
                if (needed <= 0) {
                    break;
                }
                Assignment candidate = new Assignment(staff.getId(), requirement.day(), requirement.shiftId());
                Optional<Violation> violation = findViolation(candidate);
                if (violation.isEmpty()) {
                    commit(candidate);
                    needed--;
                } else if (logger.isTraceEnabled()) {
                    logger.trace("割当不可: {} -> {}", candidate, violation.get());
                }
            }
            if (needed > 0) {
                unmet.add(new UnmetRequirement(requirement, needed));
                logger.debug("必要人数を満たせませんでした: day={} shift={} 不足={}",
                        requirement.day(), requirement.shiftId(), needed);
                if (settings.policy() == FillPolicy.STOP_AT_FIRST_UNMET) {
                    break;
                }
            }
        }

        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
        return new ScheduleResult(unmet.isEmpty(), settings, assignments, unmet,
                processed, requirements.size(), assignmentsPerStaff(), elapsedMillis);
    }

    private void commit(Assignment assignment) {
        assignments.add(assignment);
        assignmentsByStaff.computeIfAbsent(assignment.staffId(), k -> new ArrayList<>()).add(assignment);
        assignmentsByDayShift.computeIfAbsent(new DayShift(assignment.day(), assignment.shiftId()),
                k -> new ArrayList<>()).add(assignment);
    }

    public List<Assignment> getAssignments() {
        return Collections.unmodifiableList(assignments);
    }

    public List<Assignment> assignmentsOf(String staffId) {
        return Collections.unmodifiableList(assignmentsByStaff.getOrDefault(staffId, List.of()));
    }

    public List<Assignment> assignmentsFor(int day, String shiftId) {
        return Collections.unmodifiableList(assignmentsByDayShift.getOrDefault(new DayShift(day, shiftId), List.of()));
    }

    /**
     * スタッフ別・日×シフト別の割当件数。{@link #getAssignments()} との整合確認用。
     */
    int indexedByStaffCount() {
        return assignmentsByStaff.values().stream().mapToInt(List::size).sum();
    }

    int indexedByDayShiftCount() {
        return assignmentsByDayShift.values().stream().mapToInt(List::size).sum();
    }

    public Map<String, Integer> assignmentsPerStaff() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (StaffMember staff : instance.getStaff()) {
            counts.put(staff.getId(), assignmentsByStaff.getOrDefault(staff.getId(), List.of()).size());
        }
        return counts;
    }

    public RosterInstance getInstance() {
        return instance;
    }

    public FillSettings getSettings() {
        return settings;
    }

    private record DayShift(int day, String shiftId) {
    }
}
