package com.my.threadsync.domain.service;

import com.my.threadsync.domain.exception.InvalidThreadException;
import com.my.threadsync.domain.exception.PipelineAbortedException;
import com.my.threadsync.domain.exception.StateStoreException;
import com.my.threadsync.domain.model.DocumentDraft;
import com.my.threadsync.domain.model.DownloadedMedia;
import com.my.threadsync.domain.model.MessageMedia;
import com.my.threadsync.domain.model.Outcome;
import com.my.threadsync.domain.model.PipelineProgress;
import com.my.threadsync.domain.model.PipelineRun;
import com.my.threadsync.domain.model.PipelineStage;
import com.my.threadsync.domain.model.PublishedDocument;
import com.my.threadsync.domain.model.SyncAction;
import com.my.threadsync.domain.model.SyncError;
import com.my.threadsync.domain.model.SyncReport;
import com.my.threadsync.domain.model.ThreadExportRequest;
import com.my.threadsync.domain.model.ThreadExportResult;
import com.my.threadsync.domain.model.ThreadMessage;
import com.my.threadsync.domain.model.ThreadSyncResult;
import com.my.threadsync.domain.model.TranscriptExport;
import com.my.threadsync.domain.port.in.SyncThreadsUseCase;
import com.my.threadsync.domain.port.out.ClockPort;
import com.my.threadsync.domain.port.out.MediaPort;
import com.my.threadsync.domain.port.out.PublishPort;
import com.my.threadsync.domain.port.out.ThreadMappingStore;
import com.my.threadsync.domain.port.out.ThreadSourcePort;
import com.my.threadsync.domain.port.out.TranscriptPort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 스레드 목록 조회부터 게시까지의 단계를 순서대로 실행한다.
 * 트랜스크립트와 scaffold 는 게시 전에 저장을 마치며, 게시 실패가 이를 되돌리지 않는다.
 */
public class SyncPipelineService implements SyncThreadsUseCase {

    private static final Logger log = Logger.getLogger(SyncPipelineService.class);

    private final ThreadSourcePort threadSource;
    private final PublishPort publisher;
    private final ThreadMappingStore mappingStore;
    private final MediaPort mediaPort;
    private final TranscriptPort transcriptPort;
    private final PostFormatter postFormatter;
    private final ThreadPromptBuilder promptBuilder;
    private final PipelineRunRegistry runRegistry;
    private final FanOut fanOut;
    private final ClockPort clockPort;
    private final String channelId;

    public SyncPipelineService(ThreadSourcePort threadSource,
                               PublishPort publisher,
                               ThreadMappingStore mappingStore,
                               MediaPort mediaPort,
                               TranscriptPort transcriptPort,
                               PostFormatter postFormatter,
                               ThreadPromptBuilder promptBuilder,
                               PipelineRunRegistry runRegistry,
                               FanOut fanOut,
                               ClockPort clockPort,
                               String channelId) {
        this.threadSource = threadSource;
        this.publisher = publisher;
        this.mappingStore = mappingStore;
        this.mediaPort = mediaPort;
        this.transcriptPort = transcriptPort;
        this.postFormatter = postFormatter;
        this.promptBuilder = promptBuilder;
        this.runRegistry = runRegistry;
        this.fanOut = fanOut;
        this.clockPort = clockPort;
        this.channelId = channelId;
    }

    @Override
    public PipelineRun begin() {
        return runRegistry.begin(channelId);
    }

    @Override
    public Optional<PipelineProgress> progress(String runId) {
        return runRegistry.find(runId).map(PipelineRun::snapshot);
    }

    @Override
    public Optional<PipelineProgress> liveProgress() {
        return runRegistry.liveRun(channelId)
                .filter(run -> !run.isFinished())
                .map(PipelineRun::snapshot);
    }

    @Override
    public SyncReport syncAll(PipelineRun run) {
        Objects.requireNonNull(run, "run");
        if (run.isFinished()) {
            throw new IllegalStateException("이미 종료된 실행은 다시 시작할 수 없습니다: " + run.runId()
                    + " (stage=" + run.stage().label() + ")");
        }
        MDC.put("runId", run.runId());
        try {
            SyncReport report = runStages(run);
            run.complete(report, clockPort.now());
            log.info(report.summary());
            return report;
        } catch (RuntimeException e) {
            log.errorf("동기화 실패 (stage=%s): %s", run.stage().label(), e.getMessage());
            run.fail(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), clockPort.now());
            throw e;
        } finally {
            runRegistry.finished(run);
            MDC.remove("runId");
        }
    }

    @Override
    public ThreadSyncResult syncThread(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new InvalidThreadException("Invalid thread timestamp");
        }
        FetchedThread thread = fetchThread(fingerprint);
        if (thread.messages().isEmpty()) {
            return ThreadSyncResult.skipped(fingerprint, "thread has no messages");
        }
        List<MessageMedia> media = mediaPort.downloadAllForThread(thread.messages(), fingerprint)
                .await().indefinitely();
        transcriptPort.exportThread(thread.toExportRequest(media));
        return publishThread(thread);
    }

    private SyncReport runStages(PipelineRun run) {
        List<SyncError> errors = new ArrayList<>();
        List<ThreadSyncResult> created = new ArrayList<>();
        List<ThreadSyncResult> updated = new ArrayList<>();
        List<ThreadSyncResult> skipped = new ArrayList<>();

        run.advance(PipelineStage.VALIDATING_ACCESS, "Validating channel access");
        validateAccess();

        run.advance(PipelineStage.FETCHING_THREAD_LIST, "Fetching threads from channel");
        List<String> fingerprints = fetchThreadList();
        log.infof("채널에서 스레드 %d개를 찾았습니다.", fingerprints.size());

        run.advance(PipelineStage.FETCHING_THREAD_MESSAGES,
                "Fetching messages for " + fingerprints.size() + " threads");
        List<FetchedThread> threads = new ArrayList<>();
        List<Outcome<FetchedThread>> fetched = fanOut.all(fingerprints, fp -> fanOut.submit(() -> fetchThread(fp))
                        .map(Outcome::ok)
                        .onFailure().recoverWithItem(error -> Outcome.failed(error)))
                .await().indefinitely();
        for (int i = 0; i < fetched.size(); i++) {
            String fingerprint = fingerprints.get(i);
            Outcome<FetchedThread> outcome = fetched.get(i);
            if (outcome instanceof Outcome.Failed<FetchedThread> failed) {
                log.warnf("스레드 %s 메시지 조회 실패: %s", fingerprint, failed.reason());
                errors.add(new SyncError(fingerprint, PipelineStage.FETCHING_THREAD_MESSAGES, failed.reason()));
            } else if (outcome instanceof Outcome.Ok<FetchedThread> ok) {
                if (ok.value().messages().isEmpty()) {
                    skipped.add(ThreadSyncResult.skipped(fingerprint, "thread has no messages"));
                } else {
                    threads.add(ok.value());
                }
            }
        }

        run.advance(PipelineStage.DOWNLOADING_MEDIA, "Downloading media for " + threads.size() + " threads");
        List<List<MessageMedia>> mediaByThread = fanOut.all(threads, thread ->
                        mediaPort.downloadAllForThread(thread.messages(), thread.fingerprint())
                                .onFailure().recoverWithItem(error -> {
                                    log.warnf("스레드 %s 미디어 다운로드 실패: %s", thread.fingerprint(), error.getMessage());
                                    return List.<MessageMedia>of();
                                }))
                .await().indefinitely();
        int mediaDownloaded = 0;
        int mediaCached = 0;
        List<SyncError> mediaErrors = new ArrayList<>();
        List<ThreadExportRequest> exportRequests = new ArrayList<>();
        for (int i = 0; i < threads.size(); i++) {
            FetchedThread thread = threads.get(i);
            List<MessageMedia> media = mediaByThread.get(i);
            for (MessageMedia messageMedia : media) {
                for (Outcome<DownloadedMedia> result : messageMedia.results()) {
                    if (result instanceof Outcome.Ok<DownloadedMedia> ok) {
                        if (ok.value().cached()) {
                            mediaCached++;
                        } else {
                            mediaDownloaded++;
                        }
                    } else if (result instanceof Outcome.Failed<DownloadedMedia> failed) {
                        mediaErrors.add(new SyncError(thread.fingerprint(), PipelineStage.DOWNLOADING_MEDIA, failed.reason()));
                    }
                }
            }
            exportRequests.add(thread.toExportRequest(media));
        }

        run.advance(PipelineStage.EXPORTING_TRANSCRIPTS, "Saving transcripts for " + threads.size() + " threads");
        int transcriptsSaved = 0;
        int scaffoldsCreated = 0;
        for (ThreadExportResult result : transcriptPort.exportMany(exportRequests).await().indefinitely()) {
            if (result.outcome() instanceof Outcome.Ok<TranscriptExport> ok) {
                transcriptsSaved++;
                if (ok.value().scaffold() != null && ok.value().scaffold().created()) {
                    scaffoldsCreated++;
                }
            } else if (result.outcome() instanceof Outcome.Failed<TranscriptExport> failed) {
                errors.add(new SyncError(result.fingerprint(), PipelineStage.EXPORTING_TRANSCRIPTS, failed.reason()));
            }
        }
        log.infof("트랜스크립트 %d개 저장, 새 scaffold %d개 생성", transcriptsSaved, scaffoldsCreated);

        run.advance(PipelineStage.PUBLISHING, "Publishing " + threads.size() + " threads");
        for (int i = 0; i < threads.size(); i++) {
            FetchedThread thread = threads.get(i);
            run.working(thread.fingerprint(),
                    "Publishing thread " + (i + 1) + "/" + threads.size() + ": " + thread.fingerprint());
            try {
                ThreadSyncResult result = publishThread(thread);
                if (result.action() == SyncAction.CREATED) {
                    created.add(result);
                } else {
                    updated.add(result);
                }
            } catch (RuntimeException e) {
                log.warnf("스레드 %s 게시 실패: %s", thread.fingerprint(), e.getMessage());
                errors.add(new SyncError(thread.fingerprint(), PipelineStage.PUBLISHING, e.getMessage()));
            }
        }

        return new SyncReport(fingerprints.size(), created, updated, skipped, errors,
                transcriptsSaved, scaffoldsCreated, mediaDownloaded, mediaCached, mediaErrors);
    }

    private void validateAccess() {
        if (channelId == null || channelId.isBlank()) {
            throw new PipelineAbortedException(PipelineStage.VALIDATING_ACCESS, "채널 ID가 설정되지 않았습니다.", null);
        }
        try {
            threadSource.validateChannel(channelId);
        } catch (RuntimeException e) {
            throw new PipelineAbortedException(PipelineStage.VALIDATING_ACCESS, e.getMessage(), e);
        }
    }

    private List<String> fetchThreadList() {
        try {
            return threadSource.listThreads(channelId).stream()
                    .filter(ThreadMessage::isThreadRoot)
                    .map(ThreadMessage::ts)
                    .distinct()
                    .toList();
        } catch (RuntimeException e) {
            throw new PipelineAbortedException(PipelineStage.FETCHING_THREAD_LIST, e.getMessage(), e);
        }
    }

    private FetchedThread fetchThread(String fingerprint) {
        List<ThreadMessage> messages = threadSource.listMessages(channelId, fingerprint);
        Map<String, String> names = new LinkedHashMap<>();
        for (ThreadMessage message : messages) {
            String user = message.user();
            if (user == null || user.isBlank() || names.containsKey(user)) {
                continue;
            }
            try {
                threadSource.resolveUserName(user).ifPresent(name -> names.put(user, name));
            } catch (RuntimeException e) {
                log.debugf("사용자 이름 조회 실패 %s: %s", user, e.getMessage());
            }
        }
        return new FetchedThread(fingerprint, messages, names);
    }

    /**
     * 매핑 조회, 원격 생성/수정, 매핑 기록을 한 번에 수행한다. 실행 안에서는 순차로만 호출된다.
     */
    private ThreadSyncResult publishThread(FetchedThread thread) {
        DocumentDraft draft = postFormatter.format(thread.messages());
        String prompt = promptBuilder.build(thread.messages());
        Optional<Long> existing = mappingStore.getDocumentId(thread.fingerprint());

        PublishedDocument document;
        SyncAction action;
        if (existing.isPresent()) {
            document = publisher.update(existing.get(), draft);
            action = SyncAction.UPDATED;
        } else {
            document = publisher.create(draft);
            action = SyncAction.CREATED;
        }
        long documentId = existing.orElse(document.id());
        String title = document.title() == null || document.title().isBlank() ? draft.title() : document.title();
        try {
            mappingStore.upsert(thread.fingerprint(), documentId, title, prompt);
        } catch (StateStoreException e) {
            throw new StateStoreException("원격 문서 " + documentId + " 게시 후 매핑 저장에 실패했습니다: " + e.getMessage(), e);
        }
        log.infof("스레드 %s %s: %s", thread.fingerprint(), action.name().toLowerCase(), title);
        return new ThreadSyncResult(action, thread.fingerprint(), documentId, title, document.link());
    }

    private record FetchedThread(String fingerprint, List<ThreadMessage> messages, Map<String, String> userNames) {

        ThreadExportRequest toExportRequest(List<MessageMedia> media) {
            return new ThreadExportRequest(fingerprint, messages, media, userNames);
        }
    }
}
