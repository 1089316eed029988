package com.my.threadsync.domain.exception;

public class InvalidThreadException extends RuntimeException {
    public InvalidThreadException(String message) {
        super(message);
    }
}
