package com.my.threadsync.domain.service;

import com.my.threadsync.domain.exception.InvalidThreadException;
import com.my.threadsync.domain.model.SyncStatus;
import com.my.threadsync.domain.model.ThreadMapping;
import com.my.threadsync.domain.model.ThreadMessage;
import com.my.threadsync.domain.model.ThreadPrompt;
import com.my.threadsync.domain.port.in.ManageMappingsUseCase;
import com.my.threadsync.domain.port.out.ThreadMappingStore;
import com.my.threadsync.domain.port.out.ThreadSourcePort;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class MappingService implements ManageMappingsUseCase {

    private final ThreadMappingStore mappingStore;
    private final ThreadSourcePort threadSource;
    private final ThreadPromptBuilder promptBuilder;
    private final String channelId;

    public MappingService(ThreadMappingStore mappingStore,
                          ThreadSourcePort threadSource,
                          ThreadPromptBuilder promptBuilder,
                          String channelId) {
        this.mappingStore = mappingStore;
        this.threadSource = threadSource;
        this.promptBuilder = promptBuilder;
        this.channelId = channelId;
    }

    @Override
    public SyncStatus status() {
        List<ThreadMapping> mappings = mappingStore.all().stream()
                .sorted(Comparator.comparing(ThreadMapping::fingerprint))
                .toList();
        return new SyncStatus(mappings.size(), mappings);
    }

    /**
     * 저장된 프롬프트가 있으면 그대로 쓰고, 없으면 스레드를 다시 읽어 만든다.
     * 새로 만든 프롬프트는 이미 매핑된 스레드일 때만 저장된다.
     */
    @Override
    public ThreadPrompt promptFor(String fingerprint) {
        requireFingerprint(fingerprint);
        Optional<String> stored = mappingStore.getPrompt(fingerprint);
        if (stored.isPresent()) {
            return new ThreadPrompt(fingerprint, stored.get(), true);
        }
        List<ThreadMessage> messages = threadSource.listMessages(channelId, fingerprint);
        String prompt = promptBuilder.build(messages);
        if (mappingStore.isMapped(fingerprint)) {
            mappingStore.setPrompt(fingerprint, prompt);
        }
        return new ThreadPrompt(fingerprint, prompt, false);
    }

    @Override
    public boolean setPrompt(String fingerprint, String prompt) {
        requireFingerprint(fingerprint);
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidThreadException("프롬프트가 비어 있습니다.");
        }
        return mappingStore.setPrompt(fingerprint, prompt);
    }

    @Override
    public boolean unmap(String fingerprint) {
        requireFingerprint(fingerprint);
        return mappingStore.remove(fingerprint);
    }

    private static void requireFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new InvalidThreadException("Invalid thread timestamp");
        }
    }
}
