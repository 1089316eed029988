package com.my.threadsync.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 로컬에 저장된 이미지. {@code relativePath} 는 트랜스크립트 디렉터리 기준 경로다.
 */
public record DownloadedMedia(Path localPath, String relativePath, String filename, long byteSize, boolean cached) {

    public DownloadedMedia {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(filename, "filename");
    }
}
