package com.my.threadsync.domain.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record ThreadExportRequest(String fingerprint,
                                  List<ThreadMessage> messages,
                                  List<MessageMedia> media,
                                  Map<String, String> userNames) {

    public ThreadExportRequest {
        Objects.requireNonNull(fingerprint, "fingerprint");
        messages = messages == null ? List.of() : List.copyOf(messages);
        media = media == null ? List.of() : List.copyOf(media);
        userNames = userNames == null ? Map.of() : Map.copyOf(userNames);
    }
}
