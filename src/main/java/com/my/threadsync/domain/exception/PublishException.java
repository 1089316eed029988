package com.my.threadsync.domain.exception;

/**
 * 게시 대상(WordPress) 호출 실패.
 */
public class PublishException extends RuntimeException {

    public enum Kind {
        AUTHENTICATION,
        PERMISSION,
        NOT_FOUND,
        REMOTE
    }

    private final Kind kind;
    private final int status;

    public PublishException(Kind kind, int status, String message) {
        super(message);
        this.kind = kind;
        this.status = status;
    }

    public PublishException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = -1;
    }

    public Kind kind() {
        return kind;
    }

    public int status() {
        return status;
    }
}
