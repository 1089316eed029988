package com.my.threadsync.domain.model;

import java.util.List;

public record SyncStatus(int totalMappings, List<ThreadMapping> mappings) {
}
