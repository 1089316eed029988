package com.my.threadsync.domain.exception;

/**
 * 네트워크 오류, 5xx, rate limit 처럼 다시 시도하면 성공할 수 있는 실패.
 */
public class ThreadSourceUnavailableException extends ThreadSourceException {

    public ThreadSourceUnavailableException(String message) {
        super("unavailable", message);
    }

    public ThreadSourceUnavailableException(String message, Throwable cause) {
        super("unavailable", message, cause);
    }
}
