package com.example.dutyroster.instance;

import java.util.Objects;

/**
 * 勤務希望（ON）/ 不希望（OFF）。割当処理では参照せず、監査でのみ集計する。
 */
public record ShiftRequest(Kind kind, String staffId, int day, String shiftId, int weight) {

    public enum Kind {
        ON,
        OFF
    }

    public ShiftRequest {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(staffId, "staffId");
        Objects.requireNonNull(shiftId, "shiftId");
    }
}
