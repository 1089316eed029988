package com.my.threadsync.domain.model;

import java.nio.file.Path;

public record TranscriptExport(String fingerprint,
                               String title,
                               Path transcriptPath,
                               String filename,
                               ScaffoldInfo scaffold) {
}
