package com.example.dutyroster.instance;

import java.util.Objects;
import java.util.Set;

/**
 * シフト種別。
 * <p>
 * {@code forbiddenFollowing} は、このシフトの翌日に同じスタッフが
 * 勤務できないシフトIDの一覧。
 */
public record Shift(String id, int lengthMinutes, Set<String> forbiddenFollowing) {

    public Shift {
        Objects.requireNonNull(id, "id");
        forbiddenFollowing = forbiddenFollowing == null ? Set.of() : Set.copyOf(forbiddenFollowing);
    }

    public boolean forbids(String nextShiftId) {
        return forbiddenFollowing.contains(nextShiftId);
    }
}
