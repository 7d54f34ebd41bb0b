package com.hrplatform.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Success envelope of the HR API: {@code {success, data, message}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataResponse<T> {

    private boolean success;
    private T data;
    private String message;

    public static <T> DataResponse<T> ok(T data) {
        return new DataResponse<>(true, data, null);
    }

    public static <T> DataResponse<T> ok(T data, String message) {
        return new DataResponse<>(true, data, message);
    }
}
