package com.example.dutyroster.instance;

import java.util.Objects;

/**
 * 日×シフトごとの必要人数。
 * <p>
 * 割当処理は {@code requirement} を超えて割り当てないため、{@code weightOver} は
 * 保持するだけで参照しない。
 */
public record CoverRequirement(int day, String shiftId, int requirement, int weightUnder, int weightOver) {

    public CoverRequirement {
        Objects.requireNonNull(shiftId, "shiftId");
    }
}
