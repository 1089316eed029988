package com.my.threadsync.adapter.in.messaging;

import com.my.threadsync.domain.model.CommandReply;
import com.my.threadsync.domain.model.PipelineProgress;
import com.my.threadsync.domain.model.PipelineRun;
import com.my.threadsync.domain.model.SyncReport;
import com.my.threadsync.domain.port.in.CheckConnectionsUseCase;
import com.my.threadsync.domain.port.in.ManageMappingsUseCase;
import com.my.threadsync.domain.port.in.SyncThreadsUseCase;
import com.my.threadsync.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 명령을 유스케이스 호출로 바꾸고 결과를 응답으로 감싼다. 예외는 실패 응답이 된다.
 * SYNC_ALL 은 실행을 등록하자마자 runId 를 담은 접수 응답을 먼저 보낸다.
 */
@ApplicationScoped
public class SyncCommandHandler {

    private static final Logger log = Logger.getLogger(SyncCommandHandler.class);

    private final SyncThreadsUseCase syncThreadsUseCase;
    private final ManageMappingsUseCase manageMappingsUseCase;
    private final CheckConnectionsUseCase checkConnectionsUseCase;
    private final ReplyPort replyPort;

    @Inject
    public SyncCommandHandler(SyncThreadsUseCase syncThreadsUseCase,
                              ManageMappingsUseCase manageMappingsUseCase,
                              CheckConnectionsUseCase checkConnectionsUseCase,
                              ReplyPort replyPort) {
        this.syncThreadsUseCase = syncThreadsUseCase;
        this.manageMappingsUseCase = manageMappingsUseCase;
        this.checkConnectionsUseCase = checkConnectionsUseCase;
        this.replyPort = replyPort;
    }

    public CommandReply handle(SyncCommand command) {
        try {
            CommandAction action = command.toAction();
            return CommandReply.success(command.commandId(), action.name(), execute(action, command));
        } catch (RuntimeException e) {
            log.warnf("명령 %s(%s) 처리 실패: %s", command.commandId(), command.action(), e.getMessage());
            String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return CommandReply.failure(command.commandId(), command.action(), error);
        }
    }

    private Object execute(CommandAction action, SyncCommand command) {
        return switch (action) {
            case SYNC_ALL -> syncAll(command);
            case SYNC_THREAD -> syncThreadsUseCase.syncThread(command.requireThreadTs());
            case PROGRESS -> progress(command);
            case STATUS -> manageMappingsUseCase.status();
            case PROMPT -> manageMappingsUseCase.promptFor(command.requireThreadTs());
            case SET_PROMPT -> Map.of("updated",
                    manageMappingsUseCase.setPrompt(command.requireThreadTs(), command.requirePrompt()));
            case UNMAP -> Map.of("removed", manageMappingsUseCase.unmap(command.requireThreadTs()));
            case CHECK -> checkConnectionsUseCase.checkConnections();
        };
    }

    private Map<String, Object> syncAll(SyncCommand command) {
        PipelineRun run = syncThreadsUseCase.begin();
        replyPort.send(CommandReply.success(command.commandId(), CommandAction.SYNC_ALL.name(),
                runPayload(run.runId(), "accepted", null)));
        log.infof("동기화 접수: runId=%s", run.runId());
        SyncReport report = syncThreadsUseCase.syncAll(run);
        return runPayload(run.runId(), "completed", report);
    }

    private PipelineProgress progress(SyncCommand command) {
        if (!command.hasRunId()) {
            return syncThreadsUseCase.liveProgress()
                    .orElseThrow(() -> new InvalidCommandException("진행 중인 동기화가 없습니다."));
        }
        return syncThreadsUseCase.progress(command.runId())
                .orElseThrow(() -> new InvalidCommandException("실행을 찾을 수 없습니다: " + command.runId()));
    }

    private static Map<String, Object> runPayload(String runId, String status, SyncReport report) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", runId);
        payload.put("status", status);
        if (report != null) {
            payload.put("report", report);
        }
        return payload;
    }
}
