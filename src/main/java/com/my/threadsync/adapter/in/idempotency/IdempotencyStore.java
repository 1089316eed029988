package com.my.threadsync.adapter.in.idempotency;

/**
 * 처리한 명령 ID 를 TTL 동안 기억해서 같은 명령이 두 번 실행되지 않게 한다.
 */
public interface IdempotencyStore {

    boolean isProcessed(String commandId);

    void markProcessed(String commandId);
}
