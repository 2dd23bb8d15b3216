package com.example.dutyroster.schedule;

import com.example.dutyroster.instance.RosterInstance;

/**
 * 1回の割当結果と、対象インスタンス・監査結果の組。
 */
public record RosterRun(RosterInstance instance, ScheduleResult result, AuditReport audit) {
}
