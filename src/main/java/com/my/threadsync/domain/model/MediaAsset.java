package com.my.threadsync.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record MediaAsset(String id, String displayName, String mimeType, List<String> sourceUrls) {

    public MediaAsset {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
        sourceUrls = sourceUrls == null ? List.of() : List.copyOf(sourceUrls);
    }

    public static MediaAsset from(Attachment attachment) {
        String name = attachment.name() == null || attachment.name().isBlank()
                ? "image-" + attachment.id()
                : attachment.name();
        List<String> urls = new ArrayList<>();
        if (attachment.urlPrivateDownload() != null) {
            urls.add(attachment.urlPrivateDownload());
        }
        if (attachment.urlPrivate() != null) {
            urls.add(attachment.urlPrivate());
        }
        return new MediaAsset(attachment.id(), name, attachment.mimetype(), urls);
    }
}
