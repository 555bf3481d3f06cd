package com.localguide.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 공통 응답 봉투 { success, data?, error?, message?, details? }
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private T data;
    private String error; // NotFound, Conflict, ValidationFailure 등
    private String message;
    private List<String> details;

    public static <T> ApiResponse<T> ok(T data) {
        return ApiResponse.<T>builder().success(true).data(data).build();
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return ApiResponse.<T>builder().success(true).data(data).message(message).build();
    }

    public static <T> ApiResponse<T> fail(String error, String message) {
        return ApiResponse.<T>builder().success(false).error(error).message(message).build();
    }

    public static <T> ApiResponse<T> fail(String error, String message, List<String> details) {
        return ApiResponse.<T>builder().success(false).error(error).message(message).details(details).build();
    }
}
