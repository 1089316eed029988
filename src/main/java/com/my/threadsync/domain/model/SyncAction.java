package com.my.threadsync.domain.model;

public enum SyncAction {
    CREATED,
    UPDATED,
    SKIPPED
}
