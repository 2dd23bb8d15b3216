package com.example.dutyroster.schedule;

import com.example.dutyroster.instance.RosterInstance;
import com.example.dutyroster.instance.Shift;
import com.example.dutyroster.instance.ShiftRequest;
import com.example.dutyroster.instance.StaffMember;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 割当時に強制しない勤務条件を完成したシフト表に照らして確認し、勤務希望の
 * 充足状況を集計する。シフト表は変更しない。
 * <p>
 * 0日目を月曜日とし、{@code 7w + 5} 日目と {@code 7w + 6} 日目を第 {@code w} 週末とする。
 * 最小連続休日は勤務日に挟まれた休みにのみ適用し、計画期間の端に接する休みは数えない。
 */
@Component
public class ScheduleAuditor {

    public AuditReport audit(RosterInstance instance, List<Assignment> assignments) {
        List<RuleFinding> findings = new ArrayList<>();
        for (StaffMember staff : instance.getStaff()) {
            List<Assignment> own = assignments.stream()
                    .filter(a -> a.staffId().equals(staff.getId()))
                    .toList();
            auditStaff(instance, staff, own, findings);
        }

        Set<Assignment> assigned = new HashSet<>(assignments);
        int onGranted = 0;
        int onTotal = 0;
        int ungrantedOnWeight = 0;
        for (ShiftRequest request : instance.shiftRequests(ShiftRequest.Kind.ON)) {
            onTotal++;
            if (assigned.contains(new Assignment(request.staffId(), request.day(), request.shiftId()))) {
                onGranted++;
            } else {
                ungrantedOnWeight += request.weight();
            }
        }
        int offViolated = 0;
        int offTotal = 0;
        int violatedOffWeight = 0;
        for (ShiftRequest request : instance.shiftRequests(ShiftRequest.Kind.OFF)) {
            offTotal++;
            if (assigned.contains(new Assignment(request.staffId(), request.day(), request.shiftId()))) {
                offViolated++;
                violatedOffWeight += request.weight();
            }
        }
        return new AuditReport(findings, onGranted, onTotal, offViolated, offTotal,
                ungrantedOnWeight, violatedOffWeight);
    }

    private void auditStaff(RosterInstance instance, StaffMember staff, List<Assignment> own,
                            List<RuleFinding> findings) {
        String id = staff.getId();
        if (own.size() > staff.getMaxShifts()) {
            findings.add(new RuleFinding(id, RuleFinding.Rule.MAX_SHIFTS, staff.getMaxShifts(), own.size()));
        }

        int minutes = own.stream()
                .mapToInt(a -> instance.findShift(a.shiftId()).map(Shift::lengthMinutes).orElse(0))
                .sum();
        if (minutes > staff.getMaxTotalMinutes()) {
            findings.add(new RuleFinding(id, RuleFinding.Rule.MAX_TOTAL_MINUTES, staff.getMaxTotalMinutes(), minutes));
        }
        if (minutes < staff.getMinTotalMinutes()) {
            findings.add(new RuleFinding(id, RuleFinding.Rule.MIN_TOTAL_MINUTES, staff.getMinTotalMinutes(), minutes));
        }

        TreeSet<Integer> worked = own.stream().map(Assignment::day).collect(Collectors.toCollection(TreeSet::new));
        if (worked.isEmpty()) {
            return;
        }

        int shortestRun = Integer.MAX_VALUE;
        int shortestBreak = Integer.MAX_VALUE;
        int runStart = worked.first();
        int previous = runStart;
        for (int day : worked.tailSet(runStart, false)) {
            if (day != previous + 1) {
                shortestRun = Math.min(shortestRun, previous - runStart + 1);
                shortestBreak = Math.min(shortestBreak, day - previous - 1);
                runStart = day;
            }
            previous = day;
        }
        shortestRun = Math.min(shortestRun, previous - runStart + 1);

        if (shortestRun < staff.getMinConsecutiveShifts()) {
            findings.add(new RuleFinding(id, RuleFinding.Rule.MIN_CONSECUTIVE_SHIFTS,
                    staff.getMinConsecutiveShifts(), shortestRun));
        }
        if (shortestBreak != Integer.MAX_VALUE && shortestBreak < staff.getMinConsecutiveDaysOff()) {
            findings.add(new RuleFinding(id, RuleFinding.Rule.MIN_CONSECUTIVE_DAYS_OFF,
                    staff.getMinConsecutiveDaysOff(), shortestBreak));
        }

        staff.getMaxWeekends().ifPresent(max -> {
            long weekends = worked.stream()
                    .filter(day -> day % 7 >= 5)
                    .map(day -> day / 7)
                    .distinct()
                    .count();
            if (weekends > max) {
                findings.add(new RuleFinding(id, RuleFinding.Rule.MAX_WEEKENDS, max, (int) weekends));
            }
        });
    }
}
