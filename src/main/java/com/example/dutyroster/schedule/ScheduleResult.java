package com.example.dutyroster.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 1回の割当処理の結果。
 *
 * @param complete              すべての必要人数を満たした場合 true
 * @param assignments           確定した割当 (追加順)
 * @param unmet                 不足が残った枠 (処理順)
 * @param requirementsProcessed 処理した枠数。途中で打ち切った場合のみ
 *                              {@code requirementsTotal} より小さい
 * @param assignmentsPerStaff   スタッフ別割当数 (記載順、0件を含む)
 */
public record ScheduleResult(
        boolean complete,
        FillSettings settings,
        List<Assignment> assignments,
        List<UnmetRequirement> unmet,
        int requirementsProcessed,
        int requirementsTotal,
        Map<String, Integer> assignmentsPerStaff,
        long elapsedMillis) {

    public ScheduleResult {
        assignments = List.copyOf(assignments);
        unmet = List.copyOf(unmet);
        assignmentsPerStaff = Collections.unmodifiableMap(new LinkedHashMap<>(assignmentsPerStaff));
    }

    public int totalShortfall() {
        return unmet.stream().mapToInt(UnmetRequirement::shortfall).sum();
    }
}
