package com.my.threadsync.adapter.out.media;

import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.model.Attachment;
import com.my.threadsync.domain.model.DownloadedMedia;
import com.my.threadsync.domain.model.MediaAsset;
import com.my.threadsync.domain.model.MessageMedia;
import com.my.threadsync.domain.model.Outcome;
import com.my.threadsync.domain.model.ThreadMessage;
import com.my.threadsync.domain.port.out.MediaPort;
import com.my.threadsync.domain.port.out.ThreadSourcePort;
import com.my.threadsync.domain.service.FanOut;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * 메시지 첨부 이미지를 스레드별 디렉터리에 내려받는다.
 * 같은 경로에 파일이 있으면 다시 받지 않는다(이름 기준 캐시).
 */
@ApplicationScoped
public class FileSystemMediaFetcher implements MediaPort {

    private static final Logger log = Logger.getLogger(FileSystemMediaFetcher.class);

    private static final int SNIFF_BYTES = 50;
    private static final int HEADER_BYTES = 100;
    private static final List<String> ERROR_MARKERS = List.of("<!doctype", "<html", "error", "unauthorized", "forbidden");
    private static final Map<String, String> EXTENSIONS = Map.of(
            "image/jpeg", ".jpg",
            "image/jpg", ".jpg",
            "image/png", ".png",
            "image/gif", ".gif",
            "image/webp", ".webp",
            "image/svg+xml", ".svg");

    private final Path mediaRoot;
    private final Path transcriptRoot;
    private final int minBytes;
    private final ThreadSourcePort threadSource;
    private final FanOut fanOut;

    @Inject
    public FileSystemMediaFetcher(AppConfig appConfig, ThreadSourcePort threadSource, FanOut fanOut) {
        this(Path.of(appConfig.paths().mediaDir()), Path.of(appConfig.paths().postsDir()),
                appConfig.media().minBytes(), threadSource, fanOut);
    }

    public FileSystemMediaFetcher(Path mediaRoot, Path transcriptRoot, int minBytes,
                                  ThreadSourcePort threadSource, FanOut fanOut) {
        this.mediaRoot = mediaRoot;
        this.transcriptRoot = transcriptRoot;
        this.minBytes = minBytes;
        this.threadSource = threadSource;
        this.fanOut = fanOut;
    }

    @Override
    public List<MediaAsset> extractAssets(ThreadMessage message) {
        return message.files().stream()
                .filter(Attachment::isImage)
                .map(MediaAsset::from)
                .toList();
    }

    @Override
    public Outcome<DownloadedMedia> download(MediaAsset asset, String fingerprint, String messageTs, int index) {
        try {
            return Outcome.ok(fetch(asset, fingerprint, messageTs, index));
        } catch (IOException | RuntimeException e) {
            log.warnf("이미지 %s 다운로드 실패: %s", asset.id(), e.getMessage());
            return Outcome.failed(e);
        }
    }

    @Override
    public Uni<List<Outcome<DownloadedMedia>>> downloadAllForMessage(ThreadMessage message, String fingerprint) {
        List<MediaAsset> assets = extractAssets(message);
        List<Integer> indexes = IntStream.range(0, assets.size()).boxed().toList();
        return fanOut.all(indexes, index ->
                fanOut.submit(() -> download(assets.get(index), fingerprint, message.ts(), index)));
    }

    @Override
    public Uni<List<MessageMedia>> downloadAllForThread(List<ThreadMessage> messages, String fingerprint) {
        return fanOut.all(messages, message -> downloadAllForMessage(message, fingerprint)
                .map(results -> new MessageMedia(message.ts(), results)));
    }

    private DownloadedMedia fetch(MediaAsset asset, String fingerprint, String messageTs, int index) throws IOException {
        Path threadDir = mediaRoot.resolve(fingerprint.replace('.', '-'));
        String filename = filenameFor(asset, messageTs, index);
        Path target = threadDir.resolve(filename);

        if (Files.exists(target)) {
            log.debugf("이미 받은 이미지입니다: %s", filename);
            return new DownloadedMedia(target, relativize(target), filename, Files.size(target), true);
        }

        Files.createDirectories(threadDir);
        Path partial = threadDir.resolve(filename + ".part");
        try {
            try (InputStream in = threadSource.openDownload(asset)) {
                byte[] head = in.readNBytes(SNIFF_BYTES);
                if (looksLikeErrorPage(head)) {
                    throw new IOException("Received HTML error page instead of image. First bytes: "
                            + preview(head) + ". Check Slack authentication and file permissions.");
                }
                try (OutputStream out = Files.newOutputStream(partial)) {
                    out.write(head);
                    in.transferTo(out);
                }
            }
            verify(partial, filename);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(partial);
        }

        long size = Files.size(target);
        log.infof("이미지 다운로드 완료: %s (%.2f KB)", filename, size / 1024.0);
        return new DownloadedMedia(target, relativize(target), filename, size, false);
    }

    private void verify(Path file, String filename) throws IOException {
        long size = Files.size(file);
        if (size < minBytes) {
            throw new IOException("Downloaded file is too small (" + size + " bytes), likely an error page");
        }
        byte[] header;
        try (InputStream in = Files.newInputStream(file)) {
            header = in.readNBytes(HEADER_BYTES);
        }
        if (hasImageSignature(header)) {
            return;
        }
        if (looksLikeErrorPage(header)) {
            throw new IOException("Downloaded file is not a valid image - appears to be HTML error page. File size: "
                    + size + " bytes. First 100 chars: " + preview(header)
                    + ". Check Slack authentication and ensure bot has 'files:read' permission.");
        }
        log.warnf("%s 의 헤더가 알려진 이미지 형식과 다릅니다. Header: %s", filename, hex(header, 12));
    }

    static boolean hasImageSignature(byte[] h) {
        boolean jpeg = h.length >= 3 && (h[0] & 0xFF) == 0xFF && (h[1] & 0xFF) == 0xD8 && (h[2] & 0xFF) == 0xFF;
        boolean png = h.length >= 4 && (h[0] & 0xFF) == 0x89 && h[1] == 'P' && h[2] == 'N' && h[3] == 'G';
        boolean gif = h.length >= 4 && h[0] == 'G' && h[1] == 'I' && h[2] == 'F' && (h[3] == '8' || h[3] == '9');
        boolean webp = h.length >= 12 && h[0] == 'R' && h[1] == 'I' && h[2] == 'F' && h[3] == 'F'
                && h[8] == 'W' && h[9] == 'E' && h[10] == 'B' && h[11] == 'P';
        return jpeg || png || gif || webp;
    }

    static boolean looksLikeErrorPage(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.ISO_8859_1).toLowerCase(Locale.ROOT);
        return ERROR_MARKERS.stream().anyMatch(text::contains);
    }

    static String filenameFor(MediaAsset asset, String messageTs, int index) {
        String safeName = asset.displayName()
                .replaceAll("[^a-zA-Z0-9.-]", "_")
                .replaceFirst("\\.[^.]+$", "");
        return messageTs.replace('.', '-') + "-" + index + "-" + safeName + extensionFor(asset);
    }

    private static String extensionFor(MediaAsset asset) {
        String name = asset.displayName();
        int dot = name.lastIndexOf('.');
        if (dot > 0 && dot < name.length() - 1) {
            return name.substring(dot).toLowerCase(Locale.ROOT);
        }
        return EXTENSIONS.getOrDefault(asset.mimeType(), ".jpg");
    }

    private String relativize(Path file) {
        Path from = transcriptRoot.toAbsolutePath().normalize();
        return from.relativize(file.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static String preview(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8).replaceAll("\\s+", " ").trim();
    }

    private static String hex(byte[] bytes, int limit) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < Math.min(limit, bytes.length); i++) {
            if (i > 0) {
                out.append(' ');
            }
            out.append(String.format("0x%02x", bytes[i] & 0xFF));
        }
        return out.toString();
    }
}
