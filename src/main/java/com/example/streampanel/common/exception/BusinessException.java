package com.example.streampanel.common.exception;

public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String userAction;

    public BusinessException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public BusinessException(ErrorCode errorCode, String message, String userAction) {
        super(message);
        this.errorCode = errorCode;
        this.userAction = userAction;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.name();
    }

    public int getHttpStatus() {
        return errorCode.getStatus().value();
    }

    public String getUserAction() {
        return userAction;
    }
}
