package com.example.dutyroster;

import com.example.dutyroster.schedule.FillSettings;
import com.example.dutyroster.schedule.ScheduleResult;
import com.example.dutyroster.schedule.ScheduleService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "roster.instance-file=src/test/resources/instances/sample.txt")
@ExtendWith(OutputCaptureExtension.class)
class RosterCommandLineRunnerTest {

    @Autowired
    private RosterCommandLineRunner runner;

    @Autowired
    private ScheduleService scheduleService;

    @Test
    void run_withInstanceFile_logsVerdictAndCountsPerStaff(CapturedOutput output) throws Exception {
        runner.run();

        ScheduleResult expected = scheduleService
                .generate(Path.of("src/test/resources/instances/sample.txt"), FillSettings.DEFAULT)
                .result();
        String verdict = expected.complete()
                ? "シフト表を作成しました。割当数: " + expected.assignments().size()
                : "シフト表を完成できませんでした。割当数: " + expected.assignments().size();

        String out = output.getOut();
        assertThat(out).contains("計画期間: 14日", "スタッフ数: 4", "必要人数: 21件", verdict, "スタッフ別割当数:");

        List<Map.Entry<String, Integer>> listed = expected.assignmentsPerStaff().entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .sorted(Map.Entry.comparingByKey())
                .toList();
        int previous = out.indexOf("スタッフ別割当数:");
        for (Map.Entry<String, Integer> entry : listed) {
            int at = out.indexOf("  " + entry.getKey() + ": " + entry.getValue(), previous);
            assertThat(at).as("%s の行", entry.getKey()).isGreaterThan(previous);
            previous = at;
        }
    }

    @Test
    void run_listsOnlyStaffWithAssignmentsSortedById(CapturedOutput output) throws Exception {
        new RosterCommandLineRunner(scheduleService, "src/test/resources/instances/idle-staff.txt").run();

        String out = output.getOut();
        String summary = out.substring(out.lastIndexOf("計画期間: 1日"));
        assertThat(summary).contains("シフト表を作成しました。割当数: 2");
        assertThat(summary.indexOf("  M: 1")).isPositive()
                .isLessThan(summary.indexOf("  Z: 1"));
        assertThat(summary).doesNotContain("  B: ");
    }
}
