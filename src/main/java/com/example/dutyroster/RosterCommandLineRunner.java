package com.example.dutyroster;

import com.example.dutyroster.instance.RosterInstance;
import com.example.dutyroster.instance.ShiftRequest;
import com.example.dutyroster.schedule.AuditReport;
import com.example.dutyroster.schedule.RosterRun;
import com.example.dutyroster.schedule.RuleFinding;
import com.example.dutyroster.schedule.ScheduleResult;
import com.example.dutyroster.schedule.ScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * {@code roster.instance-file} が指定されていれば起動時に1回割当を実行し、結果をログに出す。
 */
@Component
public class RosterCommandLineRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(RosterCommandLineRunner.class);

    private final ScheduleService scheduleService;
    private final String instanceFile;

    public RosterCommandLineRunner(ScheduleService scheduleService,
                                   @Value("${roster.instance-file:}") String instanceFile) {
        this.scheduleService = scheduleService;
        this.instanceFile = instanceFile;
    }

    @Override
    public void run(String... args) throws Exception {
        if (instanceFile == null || instanceFile.isBlank()) {
            logger.debug("roster.instance-file が未指定のため起動時の割当は行いません");
            return;
        }
        RosterRun run = scheduleService.generate(Path.of(instanceFile.strip()),
                scheduleService.resolveSettings(null, null, null));
        printSummary(run);
    }

    private void printSummary(RosterRun run) {
        RosterInstance instance = run.instance();
        ScheduleResult result = run.result();
        AuditReport audit = run.audit();

        logger.info("計画期間: {}日", instance.getHorizon());
        logger.info("シフト数: {}", instance.getShifts().size());
        logger.info("スタッフ数: {}", instance.getStaff().size());
        logger.info("勤務希望(ON): {}件", instance.shiftRequests(ShiftRequest.Kind.ON).size());
        logger.info("勤務不希望(OFF): {}件", instance.shiftRequests(ShiftRequest.Kind.OFF).size());
        logger.info("必要人数: {}件", instance.getCoverRequirements().size());

        if (result.complete()) {
            logger.info("シフト表を作成しました。割当数: {}", result.assignments().size());
        } else {
            logger.warn("シフト表を完成できませんでした。割当数: {}, 未充足: {}件",
                    result.assignments().size(), result.unmet().size());
        }

        // 割当のあるスタッフのみ、ID順
        logger.info("スタッフ別割当数:");
        result.assignmentsPerStaff().entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> logger.info("  {}: {}", entry.getKey(), entry.getValue()));

        logger.info("勤務希望: ON {}/{} 件充足, OFF {}/{} 件違反",
                audit.onRequestsGranted(), audit.onRequestsTotal(),
                audit.offRequestsViolated(), audit.offRequestsTotal());
        for (RuleFinding finding : audit.findings()) {
            logger.info("  未強制条件 {} {}: 上限/下限={} 実績={}",
                    finding.staffId(), finding.rule(), finding.limit(), finding.actual());
        }
    }
}
