package com.my.threadsync.adapter.in.messaging;

public enum CommandAction {
    SYNC_ALL,
    SYNC_THREAD,
    PROGRESS,
    STATUS,
    PROMPT,
    SET_PROMPT,
    UNMAP,
    CHECK
}
