package com.my.threadsync.adapter.out.state;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.exception.StateStoreException;
import com.my.threadsync.domain.model.ThreadMapping;
import com.my.threadsync.domain.port.out.ClockPort;
import com.my.threadsync.domain.port.out.ThreadMappingStore;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 매핑 테이블 전체를 JSON 파일 하나에 저장한다. 변경마다 임시 파일에 쓰고 교체한다.
 */
@ApplicationScoped
public class JsonFileThreadMappingStore implements ThreadMappingStore {

    private static final Logger log = Logger.getLogger(JsonFileThreadMappingStore.class);

    private final Path stateFile;
    private final ObjectMapper objectMapper;
    private final ClockPort clockPort;
    private final Map<String, ThreadMapping> mappings = new LinkedHashMap<>();

    @Inject
    public JsonFileThreadMappingStore(AppConfig appConfig, ObjectMapper objectMapper, ClockPort clockPort) {
        this(Path.of(appConfig.paths().stateFile()), objectMapper, clockPort);
    }

    public JsonFileThreadMappingStore(Path stateFile, ObjectMapper objectMapper, ClockPort clockPort) {
        this.stateFile = stateFile;
        this.objectMapper = objectMapper;
        this.clockPort = clockPort;
    }

    @PostConstruct
    void init() {
        load();
    }

    @Override
    public synchronized void load() {
        mappings.clear();
        String json;
        try {
            json = Files.readString(stateFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.infof("상태 파일이 없어 빈 상태로 시작합니다: %s", stateFile);
            return;
        } catch (IOException e) {
            throw new StateStoreException("상태 파일 읽기 실패: " + stateFile, e);
        }
        StateFile parsed;
        try {
            parsed = objectMapper.readValue(json, StateFile.class);
        } catch (IOException e) {
            throw new StateStoreException("상태 파일 형식이 올바르지 않습니다: " + stateFile, e);
        }
        if (parsed == null || parsed.mappings() == null) {
            return;
        }
        Map<String, ThreadMapping> loaded = new LinkedHashMap<>();
        parsed.mappings().forEach((fingerprint, entry) -> {
            if (entry == null || entry.remoteDocumentId() == null || entry.remoteDocumentId() <= 0) {
                throw new StateStoreException("상태 파일의 " + fingerprint + " 항목에 원격 문서 ID가 없습니다: " + stateFile);
            }
            loaded.put(fingerprint, new ThreadMapping(
                    fingerprint,
                    entry.remoteDocumentId(),
                    entry.title(),
                    entry.lastUpdatedAt() == null ? "" : entry.lastUpdatedAt(),
                    entry.derivedPrompt()));
        });
        mappings.putAll(loaded);
        log.infof("매핑 %d개를 불러왔습니다.", mappings.size());
    }

    @Override
    public synchronized Optional<Long> getDocumentId(String fingerprint) {
        return Optional.ofNullable(mappings.get(fingerprint)).map(ThreadMapping::documentId);
    }

    @Override
    public synchronized boolean isMapped(String fingerprint) {
        return mappings.containsKey(fingerprint);
    }

    @Override
    public synchronized ThreadMapping upsert(String fingerprint, long documentId, String title, String derivedPrompt) {
        String now = DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(clockPort.now());
        ThreadMapping mapping = new ThreadMapping(fingerprint, documentId, title, now, derivedPrompt);
        mappings.put(fingerprint, mapping);
        persist();
        return mapping;
    }

    @Override
    public synchronized Optional<String> getPrompt(String fingerprint) {
        return Optional.ofNullable(mappings.get(fingerprint))
                .filter(ThreadMapping::hasPrompt)
                .map(ThreadMapping::derivedPrompt);
    }

    @Override
    public synchronized boolean setPrompt(String fingerprint, String prompt) {
        ThreadMapping existing = mappings.get(fingerprint);
        if (existing == null) {
            return false;
        }
        mappings.put(fingerprint, existing.withPrompt(prompt));
        persist();
        return true;
    }

    @Override
    public synchronized boolean remove(String fingerprint) {
        if (mappings.remove(fingerprint) == null) {
            return false;
        }
        persist();
        return true;
    }

    @Override
    public synchronized List<ThreadMapping> all() {
        return new ArrayList<>(mappings.values());
    }

    private void persist() {
        Map<String, MappingEntry> entries = new LinkedHashMap<>();
        mappings.forEach((fingerprint, mapping) -> entries.put(fingerprint, new MappingEntry(
                mapping.documentId(), mapping.title(), mapping.lastUpdatedAt(), mapping.derivedPrompt())));
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(new StateFile(entries));
            Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStoreException("상태 파일 저장 실패: " + stateFile, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StateFile(@JsonProperty("mappings") Map<String, MappingEntry> mappings) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record MappingEntry(@JsonProperty("remoteDocumentId") @JsonAlias("postId") Long remoteDocumentId,
                        @JsonProperty("title") String title,
                        @JsonProperty("lastUpdatedAt") @JsonAlias("lastUpdated") String lastUpdatedAt,
                        @JsonProperty("derivedPrompt") @JsonAlias("llmPrompt") String derivedPrompt) {
    }
}
