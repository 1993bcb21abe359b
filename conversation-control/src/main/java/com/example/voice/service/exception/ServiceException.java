package com.example.voice.service.exception;

import org.springframework.http.HttpStatus;

public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ServiceException(HttpStatus status, String message) {
        this(status, message, null, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public static ServiceException badRequest(String errorCode, String message) {
        return new ServiceException(HttpStatus.BAD_REQUEST, message, errorCode);
    }

    public static ServiceException notFound(String errorCode, String message) {
        return new ServiceException(HttpStatus.NOT_FOUND, message, errorCode);
    }

    public static ServiceException conflict(String errorCode, String message) {
        return new ServiceException(HttpStatus.CONFLICT, message, errorCode);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
