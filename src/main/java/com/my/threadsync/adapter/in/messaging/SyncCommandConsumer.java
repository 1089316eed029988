package com.my.threadsync.adapter.in.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.threadsync.adapter.in.idempotency.IdempotencyStore;
import com.my.threadsync.domain.model.CommandReply;
import com.my.threadsync.domain.port.out.ReplyPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;

/**
 * RabbitMQ 명령 큐 소비자. 같은 commandId 는 한 번만 처리하고 결과를 응답 채널로 보낸다.
 * 명령은 순서 없이 처리되므로 동기화가 도는 동안에도 PROGRESS, STATUS 에 답할 수 있다.
 */
@ApplicationScoped
public class SyncCommandConsumer {

    private static final Logger log = Logger.getLogger(SyncCommandConsumer.class);

    private final SyncCommandHandler handler;
    private final IdempotencyStore idempotencyStore;
    private final ReplyPort replyPort;
    private final ObjectMapper objectMapper;

    @Inject
    public SyncCommandConsumer(SyncCommandHandler handler,
                               IdempotencyStore idempotencyStore,
                               ReplyPort replyPort,
                               ObjectMapper objectMapper) {
        this.handler = handler;
        this.idempotencyStore = idempotencyStore;
        this.replyPort = replyPort;
        this.objectMapper = objectMapper;
    }

    @Incoming("sync-commands")
    @Blocking(ordered = false)
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> {
            process(message.getPayload());
            return null;
        }).replaceWithVoid().chain(() -> Uni.createFrom().completionStage(message.ack()));
    }

    void process(String payload) {
        SyncCommand command;
        try {
            command = objectMapper.readValue(payload, SyncCommand.class);
        } catch (IOException | InvalidCommandException e) {
            log.warnf("명령 파싱 실패로 처리 중단: %s", e.getMessage());
            return;
        }
        MDC.put("commandId", command.commandId());
        try {
            if (idempotencyStore.isProcessed(command.commandId())) {
                log.infof("중복 명령을 건너뜁니다: %s", command.commandId());
                return;
            }
            log.infof("명령 수신: %s", command.action());
            CommandReply reply = handler.handle(command);
            idempotencyStore.markProcessed(command.commandId());
            replyPort.send(reply);
        } finally {
            MDC.remove("commandId");
        }
    }
}
