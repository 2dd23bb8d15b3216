package com.example.dutyroster.schedule;

import com.example.dutyroster.common.ApiResponse;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

@RestController
@Validated
@RequestMapping("/api/schedule")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleService scheduleService;
    private final ScheduleCsvExporter csvExporter;

    public ScheduleController(ScheduleService scheduleService, ScheduleCsvExporter csvExporter) {
        this.scheduleService = scheduleService;
        this.csvExporter = csvExporter;
    }

    // 設定ファイルの既定値。generate / export でクエリ指定がない項目に使われる。
    @GetMapping("/settings")
    public ResponseEntity<ApiResponse<FillSettings>> defaultSettings() {
        return ResponseEntity.ok(ApiResponse.success("既定の割当設定", scheduleService.resolveSettings(null, null, null)));
    }

    // 必要人数を満たせなくても200を返す。結果は data.complete で判定する。
    @PostMapping(value = "/generate", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<ApiResponse<ScheduleResultDto>> generate(
            @RequestBody @NotBlank(message = "インスタンスを入力してください") String instanceText,
            @RequestParam(name = "policy", required = false) FillPolicy policy,
            @RequestParam(name = "validityMode", required = false) ValidityMode validityMode,
            @RequestParam(name = "staffOrder", required = false) StaffOrder staffOrder) {
        FillSettings settings = scheduleService.resolveSettings(policy, validityMode, staffOrder);
        RosterRun run = scheduleService.generate(instanceText, settings);
        ScheduleResult result = run.result();

        Map<String, Object> meta = new HashMap<>();
        meta.put("assignmentCount", result.assignments().size());
        meta.put("requirementsProcessed", result.requirementsProcessed());
        meta.put("requirementsTotal", result.requirementsTotal());
        meta.put("shortfall", result.totalShortfall());
        meta.put("elapsedMillis", result.elapsedMillis());

        String message = result.complete()
                ? "シフトを生成しました"
                : "必要人数を満たせない枠があります";
        logger.info("シフト生成API: complete={} 割当={}件", result.complete(), result.assignments().size());
        return ResponseEntity.ok(ApiResponse.success(message, ScheduleResultDto.from(run), meta));
    }

    @PostMapping(value = "/export", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<byte[]> export(
            @RequestBody @NotBlank(message = "インスタンスを入力してください") String instanceText,
            @RequestParam(name = "name", required = false)
            @Pattern(regexp = "[A-Za-z0-9_-]{1,64}", message = "ファイル名は英数字・ハイフン・アンダースコアで64文字以内です") String name,
            @RequestParam(name = "policy", required = false) FillPolicy policy,
            @RequestParam(name = "validityMode", required = false) ValidityMode validityMode,
            @RequestParam(name = "staffOrder", required = false) StaffOrder staffOrder) {
        FillSettings settings = scheduleService.resolveSettings(policy, validityMode, staffOrder);
        RosterRun run = scheduleService.generate(instanceText, settings);
        ScheduleCsvExporter.CsvFile csv = csvExporter.export(run.instance(), run.result().assignments(), name);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + csv.filename() + "\"")
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .body(csv.data());
    }
}
