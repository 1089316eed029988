package com.my.threadsync.domain.model;

import java.util.Objects;

/**
 * 스레드 fingerprint 와 원격 문서의 대응 관계.
 */
public record ThreadMapping(String fingerprint,
                            long documentId,
                            String title,
                            String lastUpdatedAt,
                            String derivedPrompt) {

    public ThreadMapping {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(lastUpdatedAt, "lastUpdatedAt");
        if (fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint는 비어 있을 수 없습니다.");
        }
    }

    public boolean hasPrompt() {
        return derivedPrompt != null && !derivedPrompt.isBlank();
    }

    public ThreadMapping withPrompt(String prompt) {
        return new ThreadMapping(fingerprint, documentId, title, lastUpdatedAt, prompt);
    }
}
