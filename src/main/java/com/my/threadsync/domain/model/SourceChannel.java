package com.my.threadsync.domain.model;

public record SourceChannel(String id, String name, boolean member, boolean privateChannel) {
}
