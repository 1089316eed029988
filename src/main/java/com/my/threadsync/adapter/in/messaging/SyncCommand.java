package com.my.threadsync.adapter.in.messaging;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;

/**
 * {@code sync-commands} 채널로 들어오는 명령 메시지.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncCommand(String commandId,
                          String action,
                          String threadTs,
                          String prompt,
                          String runId) {

    public SyncCommand {
        if (commandId == null || commandId.isBlank()) {
            throw new InvalidCommandException("commandId 가 비어 있습니다.");
        }
        if (action == null || action.isBlank()) {
            throw new InvalidCommandException("action 이 비어 있습니다.");
        }
    }

    public CommandAction toAction() {
        try {
            return CommandAction.valueOf(action.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidCommandException("지원하지 않는 action 입니다: " + action, e);
        }
    }

    String requireThreadTs() {
        return require(threadTs, "threadTs");
    }

    String requirePrompt() {
        return require(prompt, "prompt");
    }

    boolean hasRunId() {
        return runId != null && !runId.isBlank();
    }

    private String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidCommandException(action + " 명령에는 " + field + " 가 필요합니다.");
        }
        return value;
    }
}
