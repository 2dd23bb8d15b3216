package com.example.dutyroster.schedule;

import com.example.dutyroster.exception.InstanceFormatException;
import com.example.dutyroster.instance.RosterInstance;
import com.example.dutyroster.instance.ShiftRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class ScheduleServiceTest {

    @Autowired
    private ScheduleService scheduleService;

    private static Path sample() throws Exception {
        return Path.of(ScheduleServiceTest.class.getResource("/instances/sample.txt").toURI());
    }

    @Test
    void resolveSettings_withoutOverrides_usesConfiguredDefaults() {
        FillSettings settings = scheduleService.resolveSettings(null, null, null);

        assertThat(settings).isEqualTo(FillSettings.DEFAULT);
    }

    @Test
    void resolveSettings_overridesOnlyWhatIsGiven() {
        FillSettings settings = scheduleService.resolveSettings(null, ValidityMode.CALENDAR, StaffOrder.ID_ASCENDING);

        assertThat(settings.policy()).isEqualTo(FillPolicy.CONTINUE);
        assertThat(settings.validityMode()).isEqualTo(ValidityMode.CALENDAR);
        assertThat(settings.staffOrder()).isEqualTo(StaffOrder.ID_ASCENDING);
    }

    @Test
    void generate_sampleInstance_respectsHardRulesAndAuditsRequests() throws Exception {
        RosterRun run = scheduleService.generate(sample(), FillSettings.DEFAULT);
        RosterInstance instance = run.instance();
        ScheduleResult result = run.result();

        assertThat(result.requirementsTotal()).isEqualTo(21);
        assertThat(result.requirementsProcessed()).isEqualTo(21);
        assertThat(result.assignments()).contains(new Assignment("A", 0, "D"), new Assignment("B", 0, "D"));
        assertThat(result.assignments())
                .noneMatch(a -> instance.isDayOff(a.staffId(), a.day()))
                .noneMatch(a -> a.staffId().equals("C") && a.shiftId().equals("N"));
        assertThat(result.assignmentsPerStaff()).containsOnlyKeys("A", "B", "C", "E");
        assertThat(result.assignmentsPerStaff().values().stream().mapToInt(Integer::intValue).sum())
                .isEqualTo(result.assignments().size());

        assertThat(run.audit().onRequestsTotal()).isEqualTo(instance.shiftRequests(ShiftRequest.Kind.ON).size());
        assertThat(run.audit().offRequestsTotal()).isEqualTo(2);
    }

    @Test
    void generate_calendarMode_neverRunsPastTheConsecutiveLimit() throws Exception {
        RosterRun run = scheduleService.generate(sample(),
                FillSettings.DEFAULT.withValidityMode(ValidityMode.CALENDAR));

        for (String staffId : run.result().assignmentsPerStaff().keySet()) {
            Set<Integer> worked = run.result().assignments().stream()
                    .filter(a -> a.staffId().equals(staffId))
                    .map(Assignment::day)
                    .collect(Collectors.toSet());
            for (int start = 0; start + 5 < 14; start++) {
                int from = start;
                boolean sixInARow = IntStream.rangeClosed(from, from + 5).allMatch(worked::contains);
                assertThat(sixInARow).as("%s from day %d", staffId, from).isFalse();
            }
        }
        assertThat(run.result().settings().validityMode()).isEqualTo(ValidityMode.CALENDAR);
    }

    @Test
    void generate_malformedText_raisesFormatError() {
        assertThatThrownBy(() -> scheduleService.generate("SECTION_HORIZON\nseven\n", FillSettings.DEFAULT))
                .isInstanceOf(InstanceFormatException.class);
    }
}
