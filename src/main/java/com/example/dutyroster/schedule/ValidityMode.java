package com.example.dutyroster.schedule;

/**
 * 禁止シフト連続と連続勤務のチェックで、スタッフの既存割当をどう参照するか。
 */
public enum ValidityMode {
    /**
     * 直前に追加した割当とだけ比較し、連続勤務は過去方向にのみ数える。
     * 必要人数枠は日付順ではなく重み順に処理されるため、既存の後日の割当より
     * 前の日に置く候補は、その割当と照合されない。
     */
    INSERTION_ORDER,
    /**
     * 前日と翌日の両方を確認し、連続勤務も前後両方向に数える。
     */
    CALENDAR
}
