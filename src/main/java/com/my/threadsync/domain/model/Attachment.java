package com.my.threadsync.domain.model;

/**
 * 메시지에 첨부된 파일 메타데이터.
 */
public record Attachment(String id,
                         String name,
                         String mimetype,
                         String urlPrivate,
                         String urlPrivateDownload,
                         Long size) {

    public boolean isImage() {
        return mimetype != null && mimetype.startsWith("image/");
    }
}
