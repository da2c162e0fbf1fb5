package com.netwarden.backend.report.notify;

public class NotificationDispatchException extends RuntimeException {

    private final Integer httpStatus;

    public NotificationDispatchException(String code, Integer httpStatus, Throwable cause) {
        super(code, cause);
        this.httpStatus = httpStatus;
    }

    public NotificationDispatchException(String code, Integer httpStatus) {
        this(code, httpStatus, null);
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }
}
