package com.my.threadsync.adapter.out.filesystem;

import com.my.threadsync.domain.model.Outcome;
import com.my.threadsync.domain.model.ThreadExportRequest;
import com.my.threadsync.domain.model.ThreadExportResult;
import com.my.threadsync.domain.model.ThreadMessage;
import com.my.threadsync.domain.model.TranscriptExport;
import com.my.threadsync.domain.service.FanOut;
import com.my.threadsync.domain.service.TranscriptRenderer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileSystemTranscriptExporterTest {

    @TempDir
    Path dir;

    private FanOut fanOut;
    private FileSystemTranscriptExporter exporter;

    @BeforeEach
    void setUp() {
        fanOut = new FanOut(2);
        exporter = new FileSystemTranscriptExporter(dir.resolve("posts"), new TranscriptRenderer(ZoneOffset.UTC), fanOut);
    }

    @AfterEach
    void tearDown() {
        fanOut.close();
    }

    @Test
    void first_export_writes_transcript_and_scaffold() throws IOException {
        TranscriptExport export = exporter.exportThread(request("100.1", "Launch plan", "LGTM"));

        assertThat(export.filename()).isEqualTo("100-1-launch-plan.md");
        assertThat(Files.readString(export.transcriptPath())).contains("## Original Post", "## Reply 1", "LGTM");
        assertThat(export.scaffold().created()).isTrue();
        assertThat(export.scaffold().filename()).isEqualTo("100-1-launch-plan-summary.md");
        assertThat(Files.readString(export.scaffold().path())).startsWith("# Summary: Launch plan");
    }

    @Test
    void scaffold_is_never_rewritten_while_transcript_is() throws IOException {
        TranscriptExport first = exporter.exportThread(request("100.1", "Launch plan", "LGTM"));
        byte[] scaffoldBefore = Files.readAllBytes(first.scaffold().path());

        TranscriptExport second = exporter.exportThread(request("100.1", "Launch plan", "Ship it", "One more reply"));

        assertThat(second.scaffold().created()).isFalse();
        assertThat(Files.readAllBytes(second.scaffold().path())).isEqualTo(scaffoldBefore);
        assertThat(Files.readString(second.transcriptPath())).contains("One more reply").doesNotContain("LGTM");
    }

    @Test
    void hand_edited_scaffold_is_left_alone() throws IOException {
        TranscriptExport first = exporter.exportThread(request("100.1", "Launch plan"));
        Files.writeString(first.scaffold().path(), "my summary");

        exporter.exportThread(request("100.1", "Launch plan"));

        assertThat(Files.readString(first.scaffold().path())).isEqualTo("my summary");
    }

    @Test
    void export_many_isolates_failures_per_thread() {
        ThreadExportRequest empty = new ThreadExportRequest("9.9", List.of(), List.of(), Map.of());

        List<ThreadExportResult> results = exporter.exportMany(List.of(request("1.1", "A"), empty, request("2.2", "B")))
                .await().indefinitely();

        assertThat(results).extracting(ThreadExportResult::fingerprint).containsExactly("1.1", "9.9", "2.2");
        assertThat(results.get(0).outcome().isOk()).isTrue();
        assertThat(results.get(1).outcome()).isEqualTo(Outcome.failed("No messages to format"));
        assertThat(results.get(2).outcome().isOk()).isTrue();
    }

    private static ThreadExportRequest request(String fingerprint, String title, String... replies) {
        List<ThreadMessage> messages = new ArrayList<>();
        messages.add(new ThreadMessage(fingerprint, fingerprint, "U1", title, List.of()));
        for (int i = 0; i < replies.length; i++) {
            messages.add(new ThreadMessage(fingerprint + i, fingerprint, "U2", replies[i], List.of()));
        }
        return new ThreadExportRequest(fingerprint, messages, List.of(), Map.of());
    }
}
