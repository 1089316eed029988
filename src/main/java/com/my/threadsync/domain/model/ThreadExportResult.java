package com.my.threadsync.domain.model;

public record ThreadExportResult(String fingerprint, Outcome<TranscriptExport> outcome) {
}
