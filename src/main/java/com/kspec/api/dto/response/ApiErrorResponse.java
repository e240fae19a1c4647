package com.kspec.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.kspec.exception.ErrorCode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body of the daemon's HTTP surface, the same flat shape dashboard clients read from every route:
 * {@code {"error":"not_found","message":"...","suggestion":"..."}}. Absent fields are omitted.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiErrorResponse {

    static final String LOCALHOST_ONLY = "This server only accepts connections from localhost";

    /** Machine-readable {@link ErrorCode#getCode()}. */
    private final String error;

    private final String message;

    /** Next step for the caller, when there is an obvious one. */
    private final String suggestion;

    private final Map<String, Object> details;

    private final String path;

    private final String timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return base(errorCode, message, path)
                .details(details == null || details.isEmpty() ? null : details)
                .build();
    }

    public static ApiErrorResponse withSuggestion(ErrorCode errorCode, String message, String suggestion, String path) {
        return base(errorCode, message, path).suggestion(suggestion).build();
    }

    /** Rejection written by the localhost filter, before any controller runs. */
    public static ApiErrorResponse localhostOnly(String path) {
        return base(ErrorCode.FORBIDDEN, LOCALHOST_ONLY, path).build();
    }

    private static ApiErrorResponseBuilder base(ErrorCode errorCode, String message, String path) {
        return ApiErrorResponse.builder()
                .error(errorCode.getCode())
                .message(message)
                .path(path)
                .timestamp(Instant.now().truncatedTo(ChronoUnit.MILLIS).toString());
    }
}
