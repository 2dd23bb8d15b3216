package com.example.dutyroster.schedule;

import java.util.List;
import java.util.Map;

public record ScheduleResultDto(
        boolean complete,
        FillPolicy policy,
        ValidityMode validityMode,
        StaffOrder staffOrder,
        List<Assignment> assignments,
        List<UnmetDto> unmet,
        Map<String, Integer> assignmentsPerStaff,
        AuditReport audit) {

    public static ScheduleResultDto from(RosterRun run) {
        ScheduleResult result = run.result();
        return new ScheduleResultDto(
                result.complete(),
                result.settings().policy(),
                result.settings().validityMode(),
                result.settings().staffOrder(),
                result.assignments(),
                result.unmet().stream().map(UnmetDto::from).toList(),
                result.assignmentsPerStaff(),
                run.audit()
        );
    }

    public record UnmetDto(int day, String shiftId, int requirement, int shortfall, int weightUnder) {

        static UnmetDto from(UnmetRequirement unmet) {
            return new UnmetDto(
                    unmet.requirement().day(),
                    unmet.requirement().shiftId(),
                    unmet.requirement().requirement(),
                    unmet.shortfall(),
                    unmet.requirement().weightUnder());
        }
    }
}
