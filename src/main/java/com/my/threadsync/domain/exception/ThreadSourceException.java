package com.my.threadsync.domain.exception;

/**
 * 스레드 소스(Slack) 호출 실패. {@code errorCode} 는 API 가 돌려준 오류 코드다.
 */
public class ThreadSourceException extends RuntimeException {

    private final String errorCode;

    public ThreadSourceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ThreadSourceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
