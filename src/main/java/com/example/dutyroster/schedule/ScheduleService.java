package com.example.dutyroster.schedule;

import com.example.dutyroster.config.FillSettingsProperties;
import com.example.dutyroster.instance.InstanceParser;
import com.example.dutyroster.instance.RosterInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * インスタンスの読み込みから割当・監査までをまとめて実行する。
 * <p>
 * 呼び出しごとに {@link ScheduleEngine} を作るため、呼び出し間で可変状態は共有しない。
 */
@Service
public class ScheduleService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final InstanceParser instanceParser;
    private final ScheduleAuditor scheduleAuditor;
    private final FillSettingsProperties fillSettings;

    public ScheduleService(InstanceParser instanceParser,
                           ScheduleAuditor scheduleAuditor,
                           FillSettingsProperties fillSettings) {
        this.instanceParser = instanceParser;
        this.scheduleAuditor = scheduleAuditor;
        this.fillSettings = fillSettings;
    }

    /**
     * 設定ファイルの既定値に、null 以外の引数を優先して上書きした設定。
     */
    public FillSettings resolveSettings(FillPolicy policy, ValidityMode validityMode, StaffOrder staffOrder) {
        FillSettings settings = fillSettings.toSettings();
        if (policy != null) {
            settings = settings.withPolicy(policy);
        }
        if (validityMode != null) {
            settings = settings.withValidityMode(validityMode);
        }
        if (staffOrder != null) {
            settings = settings.withStaffOrder(staffOrder);
        }
        return settings;
    }

    public RosterRun generate(String instanceText, FillSettings settings) {
        return generate(instanceParser.parse(instanceText), settings);
    }

    public RosterRun generate(Path instanceFile, FillSettings settings) {
        return generate(instanceParser.parse(instanceFile), settings);
    }

    public RosterRun generate(RosterInstance instance) {
        return generate(instance, fillSettings.toSettings());
    }

    public RosterRun generate(RosterInstance instance, FillSettings settings) {
        logger.info("シフト割当を開始します: 期間={}日, スタッフ={}名, シフト={}種, 必要人数={}件, 設定={}",
                instance.getHorizon(), instance.getStaff().size(), instance.getShifts().size(),
                instance.getCoverRequirements().size(), settings);

        ScheduleResult result = new ScheduleEngine(instance, settings).fill();
        AuditReport audit = scheduleAuditor.audit(instance, result.assignments());

        if (result.complete()) {
            logger.info("シフト割当が完了しました: 割当{}件 ({}ms)", result.assignments().size(), result.elapsedMillis());
        } else {
            logger.warn("必要人数を満たせない枠があります: 未充足{}件, 不足{}名, 割当{}件, 処理{}/{}件",
                    result.unmet().size(), result.totalShortfall(), result.assignments().size(),
                    result.requirementsProcessed(), result.requirementsTotal());
        }
        if (audit.hasFindings()) {
            logger.info("未強制の勤務条件で{}件の超過・不足があります", audit.findings().size());
        }
        return new RosterRun(instance, result, audit);
    }
}
