package com.my.threadsync.domain.model;

import java.util.List;
import java.util.Map;

public record ConnectionReport(boolean sourceReachable,
                               boolean channelAccessible,
                               List<SourceChannel> availableChannels,
                               PublishAccess publishAccess,
                               Map<String, String> errors) {

    public ConnectionReport {
        availableChannels = availableChannels == null ? List.of() : List.copyOf(availableChannels);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public boolean allHealthy() {
        return sourceReachable && channelAccessible && publishAccess != null && publishAccess.canPublish();
    }
}
