package com.example.dutyroster.common;

import java.util.Collections;
import java.util.Map;

/**
 * 共通APIレスポンスラッパー。
 * <p>
 * すべてのエンドポイントが {@code success} と {@code data} を返すため、
 * クライアントは同じ形で応答を扱える。
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
