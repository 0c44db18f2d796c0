package com.example.timetable.common;

import java.util.Collections;
import java.util.Map;

/**
 * Response envelope shared by every timetable endpoint.
 * <p>
 * Clients branch on {@code success} and read the payload from {@code data}; run-level
 * figures such as metrics or warning counts travel in {@code meta}.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
