package com.my.threadsync.domain.model;

import java.util.Objects;

/**
 * 게시 대상에 보낼 문서 본문.
 */
public record DocumentDraft(String title, String body) {
    public DocumentDraft {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(body, "body");
    }
}
