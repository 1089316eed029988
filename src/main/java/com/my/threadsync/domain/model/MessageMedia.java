package com.my.threadsync.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 메시지 하나에 대한 첨부 이미지 다운로드 결과 묶음.
 */
public record MessageMedia(String messageTs, List<Outcome<DownloadedMedia>> results) {

    public MessageMedia {
        Objects.requireNonNull(messageTs, "messageTs");
        results = results == null ? List.of() : List.copyOf(results);
    }

    public boolean allSucceeded() {
        return results.stream().allMatch(Outcome::isOk);
    }

    public List<DownloadedMedia> succeeded() {
        return results.stream()
                .map(Outcome::toOptional)
                .flatMap(Optional::stream)
                .toList();
    }
}
