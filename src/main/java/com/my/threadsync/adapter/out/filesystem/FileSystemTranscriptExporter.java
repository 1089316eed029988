package com.my.threadsync.adapter.out.filesystem;

import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.model.Outcome;
import com.my.threadsync.domain.model.ScaffoldInfo;
import com.my.threadsync.domain.model.ThreadExportRequest;
import com.my.threadsync.domain.model.ThreadExportResult;
import com.my.threadsync.domain.model.TranscriptExport;
import com.my.threadsync.domain.port.out.TranscriptPort;
import com.my.threadsync.domain.service.FanOut;
import com.my.threadsync.domain.service.TranscriptRenderer;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * 트랜스크립트와 요약 scaffold 를 같은 출력 디렉터리에 쓴다.
 * scaffold 는 CREATE_NEW 로만 열어서 이미 있으면 건드리지 않는다.
 */
@ApplicationScoped
public class FileSystemTranscriptExporter implements TranscriptPort {

    private static final Logger log = Logger.getLogger(FileSystemTranscriptExporter.class);

    private final Path outputRoot;
    private final TranscriptRenderer renderer;
    private final FanOut fanOut;

    @Inject
    public FileSystemTranscriptExporter(AppConfig appConfig, TranscriptRenderer renderer, FanOut fanOut) {
        this(Path.of(appConfig.paths().postsDir()), renderer, fanOut);
    }

    public FileSystemTranscriptExporter(Path outputRoot, TranscriptRenderer renderer, FanOut fanOut) {
        this.outputRoot = outputRoot;
        this.renderer = renderer;
        this.fanOut = fanOut;
    }

    @Override
    public TranscriptExport exportThread(ThreadExportRequest request) {
        String title = TranscriptRenderer.titleOf(request.messages());
        String filename = renderer.filenameFor(title, request.fingerprint());
        Path transcriptPath = outputRoot.resolve(filename);
        String transcript = renderer.renderTranscript(
                request.messages(), request.fingerprint(), request.media(), request.userNames());
        try {
            Files.createDirectories(outputRoot);
            Files.writeString(transcriptPath, transcript, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("트랜스크립트 저장 실패: " + transcriptPath, e);
        }
        log.infof("트랜스크립트 저장: %s", filename);

        ScaffoldInfo scaffold = writeScaffoldOnce(request, title);
        return new TranscriptExport(request.fingerprint(), title, transcriptPath, filename, scaffold);
    }

    @Override
    public Uni<List<ThreadExportResult>> exportMany(List<ThreadExportRequest> requests) {
        return fanOut.all(requests, request -> fanOut.submit(() -> exportSafely(request)));
    }

    private ThreadExportResult exportSafely(ThreadExportRequest request) {
        try {
            return new ThreadExportResult(request.fingerprint(), Outcome.ok(exportThread(request)));
        } catch (RuntimeException e) {
            log.warnf("스레드 %s 내보내기 실패: %s", request.fingerprint(), e.getMessage());
            return new ThreadExportResult(request.fingerprint(), Outcome.failed(e));
        }
    }

    private ScaffoldInfo writeScaffoldOnce(ThreadExportRequest request, String title) {
        String filename = renderer.scaffoldFilenameFor(title, request.fingerprint());
        Path path = outputRoot.resolve(filename);
        if (Files.exists(path)) {
            return new ScaffoldInfo(path, filename, false);
        }
        String content = renderer.renderScaffold(request.messages(), request.fingerprint(), request.media());
        try {
            Files.writeString(path, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            return new ScaffoldInfo(path, filename, false);
        } catch (IOException e) {
            throw new UncheckedIOException("요약 scaffold 생성 실패: " + path, e);
        }
        log.infof("요약 scaffold 생성: %s", filename);
        return new ScaffoldInfo(path, filename, true);
    }
}
