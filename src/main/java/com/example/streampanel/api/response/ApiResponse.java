package com.example.streampanel.api.response;

import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * JSON envelope. {@code code} is {@value #SUCCESS_CODE} on success and an {@link ErrorCode}
 * name otherwise; {@code traceId} is the request id from the access log.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(ErrorCode errorCode, String message) {
        return fail(errorCode, message, null);
    }

    public static <T> ApiResponse<T> fail(ErrorCode errorCode, String message, String userAction) {
        return new ApiResponse<>(errorCode.name(), message, null, userAction, currentTraceId());
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return fail(e.getErrorCode(), e.getMessage(), e.getUserAction());
    }

    private static String currentTraceId() {
        return MDC.get(AccessLogFilter.MDC_REQUEST_ID);
    }
}
