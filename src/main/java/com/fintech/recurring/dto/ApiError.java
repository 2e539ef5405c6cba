package com.fintech.recurring.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Error body returned by every endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiError {

    private boolean success;
    private String message;

    /**
     * Machine-readable error code, e.g. the {@code ValidationError} name.
     */
    private String code;
    private LocalDateTime timestamp;
    private List<String> errors;

    public static ApiError of(String message, String code) {
        return ApiError.builder()
                .success(false)
                .message(message)
                .code(code)
                .timestamp(LocalDateTime.now())
                .errors(List.of(message))
                .build();
    }
}
