package com.example.dutyroster.schedule;

/**
 * 割当候補を却下した理由。チェックの実行順に並ぶ。
 */
public enum Violation {
    DAY_OFF,
    SHIFT_LIMIT,
    FORBIDDEN_SUCCESSION,
    MAX_CONSECUTIVE_SHIFTS
}
