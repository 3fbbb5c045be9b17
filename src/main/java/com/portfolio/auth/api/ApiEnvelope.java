package com.portfolio.auth.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Map;

/**
 * Response body shape shared by every endpoint: {@code success} for handled requests,
 * {@code fail} for 4xx and {@code error} for 5xx.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Standard response envelope")
public record ApiEnvelope<T>(
        @Schema(example = "success", allowableValues = {"success", "fail", "error"}) String status,
        @Schema(example = "Login successful") String message,
        T data,
        Map<String, String> errors,
        Instant timestamp,
        String path
) {

    public static <T> ApiEnvelope<T> success(String message, T data) {
        return new ApiEnvelope<>("success", message, data, null, null, null);
    }

    public static ApiEnvelope<Void> success(String message) {
        return new ApiEnvelope<>("success", message, null, null, null, null);
    }

    public static ApiEnvelope<Void> failure(int httpStatus, String message, Map<String, String> errors, String path) {
        String status = httpStatus >= 500 ? "error" : "fail";
        return new ApiEnvelope<>(status, message, null, errors, Instant.now(), path);
    }
}
