package com.my.threadsync.domain.exception;

/**
 * 매핑 파일 로드/저장 실패. 저장 실패 시 메모리 상태는 디스크보다 앞서 있다.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
