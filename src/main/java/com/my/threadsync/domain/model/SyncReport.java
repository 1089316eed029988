package com.my.threadsync.domain.model;

import java.util.List;

/**
 * 실행 결과 집계. 로컬 저장(transcript/scaffold) 수치와 원격 게시 수치를 따로 보고한다.
 */
public record SyncReport(int threadsFound,
                         List<ThreadSyncResult> created,
                         List<ThreadSyncResult> updated,
                         List<ThreadSyncResult> skipped,
                         List<SyncError> errors,
                         int transcriptsSaved,
                         int scaffoldsCreated,
                         int mediaDownloaded,
                         int mediaCached,
                         List<SyncError> mediaErrors) {

    public SyncReport {
        created = List.copyOf(created);
        updated = List.copyOf(updated);
        skipped = List.copyOf(skipped);
        errors = List.copyOf(errors);
        mediaErrors = List.copyOf(mediaErrors);
    }

    public int published() {
        return created.size() + updated.size();
    }

    public String summary() {
        return String.format(
                "Sync complete: %d created, %d updated, %d skipped, %d errors | artifacts saved: %d transcripts, %d new scaffolds | media: %d downloaded, %d cached, %d failed",
                created.size(), updated.size(), skipped.size(), errors.size(),
                transcriptsSaved, scaffoldsCreated,
                mediaDownloaded, mediaCached, mediaErrors.size());
    }
}
