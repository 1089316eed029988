package com.my.threadsync.domain.model;

/**
 * 처리한 명령에 대한 응답. 성공이면 {@code payload}, 실패면 {@code error} 를 채운다.
 */
public record CommandReply(String commandId, String action, boolean success, Object payload, String error) {

    public static CommandReply success(String commandId, String action, Object payload) {
        return new CommandReply(commandId, action, true, payload, null);
    }

    public static CommandReply failure(String commandId, String action, String error) {
        return new CommandReply(commandId, action, false, null, error);
    }
}
