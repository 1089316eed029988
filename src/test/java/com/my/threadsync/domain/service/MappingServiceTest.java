package com.my.threadsync.domain.service;

import com.my.threadsync.domain.exception.InvalidThreadException;
import com.my.threadsync.domain.model.SyncStatus;
import com.my.threadsync.domain.model.ThreadMapping;
import com.my.threadsync.domain.model.ThreadMessage;
import com.my.threadsync.domain.model.ThreadPrompt;
import com.my.threadsync.domain.port.out.ThreadMappingStore;
import com.my.threadsync.domain.port.out.ThreadSourcePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MappingServiceTest {

    private ThreadMappingStore store;
    private ThreadSourcePort source;
    private MappingService service;

    @BeforeEach
    void setUp() {
        store = mock(ThreadMappingStore.class);
        source = mock(ThreadSourcePort.class);
        service = new MappingService(store, source, new ThreadPromptBuilder(), "C1");
    }

    @Test
    void status_lists_mappings_by_fingerprint() {
        when(store.all()).thenReturn(List.of(
                new ThreadMapping("2.2", 2L, "B", "2024-05-01T10:00:00Z", null),
                new ThreadMapping("1.1", 1L, "A", "2024-05-01T10:00:00Z", "prompt")));

        SyncStatus status = service.status();

        assertThat(status.totalMappings()).isEqualTo(2);
        assertThat(status.mappings()).extracting(ThreadMapping::fingerprint).containsExactly("1.1", "2.2");
    }

    @Test
    void stored_prompt_is_returned_without_fetching_thread() {
        when(store.getPrompt("1.1")).thenReturn(Optional.of("stored"));

        ThreadPrompt prompt = service.promptFor("1.1");

        assertThat(prompt.cached()).isTrue();
        assertThat(prompt.prompt()).isEqualTo("stored");
        verifyNoInteractions(source);
    }

    @Test
    void generated_prompt_is_saved_only_for_mapped_thread() {
        when(store.getPrompt(anyString())).thenReturn(Optional.empty());
        when(source.listMessages("C1", "1.1")).thenReturn(List.of(new ThreadMessage("1.1", "1.1", "U1", "hi", List.of())));
        when(source.listMessages("C1", "2.2")).thenReturn(List.of(new ThreadMessage("2.2", "2.2", "U1", "yo", List.of())));
        when(store.isMapped("1.1")).thenReturn(true);
        when(store.isMapped("2.2")).thenReturn(false);

        ThreadPrompt mapped = service.promptFor("1.1");
        ThreadPrompt unmapped = service.promptFor("2.2");

        assertThat(mapped.cached()).isFalse();
        assertThat(mapped.prompt()).contains("Original Post:\nhi");
        verify(store).setPrompt("1.1", mapped.prompt());
        verify(store, never()).setPrompt("2.2", unmapped.prompt());
    }

    @Test
    void blank_prompt_is_rejected() {
        assertThatThrownBy(() -> service.setPrompt("1.1", " ")).isInstanceOf(InvalidThreadException.class);
    }

    @Test
    void set_prompt_reports_unmapped_thread() {
        when(store.setPrompt("9.9", "custom")).thenReturn(false);

        assertThat(service.setPrompt("9.9", "custom")).isFalse();
    }

    @Test
    void unmap_removes_mapping() {
        when(store.remove("1.1")).thenReturn(true);

        assertThat(service.unmap("1.1")).isTrue();
        assertThatThrownBy(() -> service.unmap("")).isInstanceOf(InvalidThreadException.class);
    }
}
