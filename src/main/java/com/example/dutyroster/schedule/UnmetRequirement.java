package com.example.dutyroster.schedule;

import com.example.dutyroster.instance.CoverRequirement;

/**
 * {@code shortfall} 名不足したまま残った必要人数枠。
 */
public record UnmetRequirement(CoverRequirement requirement, int shortfall) {
}
