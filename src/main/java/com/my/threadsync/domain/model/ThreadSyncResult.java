package com.my.threadsync.domain.model;

import java.util.Objects;

public record ThreadSyncResult(SyncAction action,
                               String fingerprint,
                               Long documentId,
                               String title,
                               String link) {

    public ThreadSyncResult {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(fingerprint, "fingerprint");
    }

    public static ThreadSyncResult skipped(String fingerprint, String reason) {
        return new ThreadSyncResult(SyncAction.SKIPPED, fingerprint, null, reason, null);
    }
}
