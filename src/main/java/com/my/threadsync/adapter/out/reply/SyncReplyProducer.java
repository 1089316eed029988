package com.my.threadsync.adapter.out.reply;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.threadsync.domain.model.CommandReply;
import com.my.threadsync.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;
import org.jboss.logging.Logger;

/**
 * 명령 응답을 JSON 으로 직렬화해 {@code sync-replies} 채널로 보낸다.
 */
@ApplicationScoped
public class SyncReplyProducer implements ReplyPort {

    private static final Logger log = Logger.getLogger(SyncReplyProducer.class);

    private final Emitter<String> replyEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public SyncReplyProducer(@Channel("sync-replies") Emitter<String> replyEmitter, ObjectMapper objectMapper) {
        this.replyEmitter = replyEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(CommandReply reply) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(new ReplyPayload(
                    reply.commandId(), reply.action(), reply.success(), reply.payload(), reply.error()));
        } catch (JsonProcessingException e) {
            log.errorf("명령 %s 응답 직렬화 실패: %s", reply.commandId(), e.getMessage());
            payload = objectMapper.createObjectNode()
                    .put("commandId", reply.commandId())
                    .put("action", reply.action())
                    .put("success", false)
                    .put("error", "reply serialization failed: " + e.getOriginalMessage())
                    .toString();
        }
        replyEmitter.send(payload);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record ReplyPayload(@JsonProperty("commandId") String commandId,
                                @JsonProperty("action") String action,
                                @JsonProperty("success") boolean success,
                                @JsonProperty("payload") Object payload,
                                @JsonProperty("error") String error) {
    }
}
