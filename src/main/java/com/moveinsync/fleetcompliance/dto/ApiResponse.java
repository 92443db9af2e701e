package com.moveinsync.fleetcompliance.dto;

import lombok.*;

/**
 * Response envelope shared by every endpoint.
 *
 *   ApiResponse.ok(data, message)
 *   ApiResponse.error(message)
 *   ApiResponse.error(message, details)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {

    private boolean success;
    private String message;
    private T data;

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, message, data);
    }

    public static <T> ApiResponse<T> ok(String message) {
        return new ApiResponse<>(true, message, null);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, message, null);
    }

    /** Error with a payload, e.g. field → message map for validation failures */
    public static <T> ApiResponse<T> error(String message, T details) {
        return new ApiResponse<>(false, message, details);
    }
}
