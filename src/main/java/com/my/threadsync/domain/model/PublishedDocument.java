package com.my.threadsync.domain.model;

public record PublishedDocument(long id, String title, String link, String status) {
}
