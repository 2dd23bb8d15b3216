package com.example.dutyroster.schedule;

/**
 * 必要人数を満たせない枠があったときの割当処理の動作。
 */
public enum FillPolicy {
    /** 残りの枠も処理し、割当できた分を返す。 */
    CONTINUE,
    /** 最初の未充足枠で処理を打ち切る。 */
    STOP_AT_FIRST_UNMET
}
