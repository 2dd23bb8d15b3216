package com.example.dutyroster.config;

import com.example.dutyroster.schedule.FillPolicy;
import com.example.dutyroster.schedule.FillSettings;
import com.example.dutyroster.schedule.StaffOrder;
import com.example.dutyroster.schedule.ValidityMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 割当処理の既定設定 ({@code roster.fill.*})。
 */
@Component
public class FillSettingsProperties {
    private final FillPolicy policy;
    private final ValidityMode validityMode;
    private final StaffOrder staffOrder;

    public FillSettingsProperties(
            @Value("${roster.fill.policy:CONTINUE}") FillPolicy policy,
            @Value("${roster.fill.validity-mode:INSERTION_ORDER}") ValidityMode validityMode,
            @Value("${roster.fill.staff-order:LISTED}") StaffOrder staffOrder) {
        this.policy = policy;
        this.validityMode = validityMode;
        this.staffOrder = staffOrder;
    }

    public FillSettings toSettings() {
        return new FillSettings(policy, validityMode, staffOrder);
    }
}
