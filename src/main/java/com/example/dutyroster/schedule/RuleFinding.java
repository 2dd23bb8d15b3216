package com.example.dutyroster.schedule;

/**
 * 割当時に強制しない勤務条件のうち、完成したシフト表で満たされていないもの。
 */
public record RuleFinding(String staffId, Rule rule, int limit, int actual) {

    public enum Rule {
        MAX_SHIFTS,
        MAX_TOTAL_MINUTES,
        MIN_TOTAL_MINUTES,
        MIN_CONSECUTIVE_SHIFTS,
        MIN_CONSECUTIVE_DAYS_OFF,
        MAX_WEEKENDS
    }
}
