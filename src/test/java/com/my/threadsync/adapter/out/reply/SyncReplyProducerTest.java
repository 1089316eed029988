package com.my.threadsync.adapter.out.reply;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.threadsync.domain.model.CommandReply;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SyncReplyProducerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @SuppressWarnings("unchecked")
    private final Emitter<String> emitter = mock(Emitter.class);
    private final SyncReplyProducer producer = new SyncReplyProducer(emitter, objectMapper);

    @Test
    void success_reply_carries_payload_without_error() throws Exception {
        producer.send(CommandReply.success("c-1", "UNMAP", Map.of("removed", true)));

        JsonNode json = objectMapper.readTree(sent());
        assertThat(json.path("commandId").asText()).isEqualTo("c-1");
        assertThat(json.path("success").asBoolean()).isTrue();
        assertThat(json.path("payload").path("removed").asBoolean()).isTrue();
        assertThat(json.has("error")).isFalse();
    }

    @Test
    void failure_reply_carries_error() throws Exception {
        producer.send(CommandReply.failure("c-2", "SYNC_ALL", "Sync already running"));

        JsonNode json = objectMapper.readTree(sent());
        assertThat(json.path("success").asBoolean()).isFalse();
        assertThat(json.path("error").asText()).isEqualTo("Sync already running");
        assertThat(json.has("payload")).isFalse();
    }

    @Test
    void unserializable_payload_still_sends_failure() throws Exception {
        producer.send(CommandReply.success("c-3", "STATUS", new Object()));

        JsonNode json = objectMapper.readTree(sent());
        assertThat(json.path("commandId").asText()).isEqualTo("c-3");
        assertThat(json.path("success").asBoolean()).isFalse();
        assertThat(json.path("error").asText()).startsWith("reply serialization failed");
    }

    private String sent() {
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(emitter).send(captor.capture());
        return captor.getValue();
    }
}
