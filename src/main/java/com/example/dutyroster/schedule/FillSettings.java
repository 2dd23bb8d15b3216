package com.example.dutyroster.schedule;

import java.util.Objects;

/**
 * 1回の割当実行の設定。
 */
public record FillSettings(FillPolicy policy, ValidityMode validityMode, StaffOrder staffOrder) {

    public static final FillSettings DEFAULT =
            new FillSettings(FillPolicy.CONTINUE, ValidityMode.INSERTION_ORDER, StaffOrder.LISTED);

    public FillSettings {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(validityMode, "validityMode");
        Objects.requireNonNull(staffOrder, "staffOrder");
    }

    public FillSettings withPolicy(FillPolicy value) {
        return new FillSettings(value, validityMode, staffOrder);
    }

    public FillSettings withValidityMode(ValidityMode value) {
        return new FillSettings(policy, value, staffOrder);
    }

    public FillSettings withStaffOrder(StaffOrder value) {
        return new FillSettings(policy, validityMode, value);
    }
}
