package com.my.threadsync.domain.model;

public record ThreadPrompt(String fingerprint, String prompt, boolean cached) {
}
