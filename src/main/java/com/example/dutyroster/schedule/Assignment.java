package com.example.dutyroster.schedule;

import java.util.Objects;

/**
 * 1件の割当 (スタッフ, 日, シフト)。{@link ScheduleEngine} だけが生成する。
 */
public record Assignment(String staffId, int day, String shiftId) {

    public Assignment {
        Objects.requireNonNull(staffId, "staffId");
        Objects.requireNonNull(shiftId, "shiftId");
    }
}
