package com.example.dutyroster.schedule;

import java.util.List;

/**
 * 未強制の勤務条件と勤務希望の充足状況。
 *
 * @param onRequestsGranted     (スタッフ, 日, シフト) がそのまま割り当てられた勤務希望の件数
 * @param offRequestsViolated   不希望にもかかわらず割り当てられた件数
 * @param ungrantedOnWeight     満たせなかった勤務希望の重みの合計
 * @param violatedOffWeight     違反した不希望の重みの合計
 */
public record AuditReport(
        List<RuleFinding> findings,
        int onRequestsGranted,
        int onRequestsTotal,
        int offRequestsViolated,
        int offRequestsTotal,
        int ungrantedOnWeight,
        int violatedOffWeight) {

    public AuditReport {
        findings = List.copyOf(findings);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }
}
