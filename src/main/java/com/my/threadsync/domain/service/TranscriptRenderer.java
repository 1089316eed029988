package com.my.threadsync.domain.service;

import com.my.threadsync.domain.exception.InvalidThreadException;
import com.my.threadsync.domain.model.DownloadedMedia;
import com.my.threadsync.domain.model.MessageMedia;
import com.my.threadsync.domain.model.ThreadMessage;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스레드를 Markdown 트랜스크립트와 요약 scaffold 로 렌더링한다. 입력이 같으면 출력도 같다.
 */
public class TranscriptRenderer {

    public static final int TITLE_MAX_LENGTH = 100;
    public static final int SLUG_MAX_LENGTH = 50;
    static final String UNTITLED = "Untitled";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final Pattern USER_MENTION_LABELED = Pattern.compile("<@([A-Z0-9]+)\\|([^>]+)>");
    private static final Pattern USER_MENTION = Pattern.compile("<@([A-Z0-9]+)>");
    private static final Pattern CHANNEL_LABELED = Pattern.compile("<#([A-Z0-9]+)\\|([^>]+)>");
    private static final Pattern CHANNEL = Pattern.compile("<#([A-Z0-9]+)>");
    private static final Pattern LINK_LABELED = Pattern.compile("<([^|>]+)\\|([^>]+)>");
    private static final Pattern LINK = Pattern.compile("<([^>]+)>");
    private static final Pattern CODE_BLOCK = Pattern.compile("```([^`]+)```");

    private final ZoneId zoneId;

    public TranscriptRenderer(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    /**
     * 첫 줄에서 제목을 뽑는다. Markdown 헤더 기호는 지우고 길면 말줄임표를 붙인다.
     */
    public static String extractTitle(String text) {
        if (text == null) {
            return UNTITLED;
        }
        String firstLine = text.split("\n", -1)[0].trim();
        String cleaned = firstLine.replaceFirst("^#+\\s*", "").trim();
        if (cleaned.isEmpty()) {
            return UNTITLED;
        }
        return cleaned.length() > TITLE_MAX_LENGTH
                ? cleaned.substring(0, TITLE_MAX_LENGTH) + "..."
                : cleaned;
    }

    public static String titleOf(List<ThreadMessage> messages) {
        requireMessages(messages);
        return extractTitle(messages.get(0).text());
    }

    public String renderTranscript(List<ThreadMessage> messages,
                                   String fingerprint,
                                   List<MessageMedia> mediaByMessageIndex,
                                   Map<String, String> userDisplayNames) {
        requireMessages(messages);
        Map<String, String> names = userDisplayNames == null ? Map.of() : userDisplayNames;
        StringBuilder markdown = new StringBuilder();
        appendHeader(markdown, titleOf(messages), fingerprint, messages.size());
        markdown.append("---\n\n");

        for (int i = 0; i < messages.size(); i++) {
            ThreadMessage message = messages.get(i);
            markdown.append(i == 0 ? "## Original Post\n\n" : "## Reply " + i + "\n\n");
            markdown.append("**User:** ").append(displayName(message.user(), names)).append('\n');
            markdown.append("**Time:** ").append(formatTimestamp(message.ts(), DATE_TIME)).append('\n');
            markdown.append('\n').append(formatMessageText(message.text(), names)).append("\n\n");
            for (DownloadedMedia media : mediaAt(mediaByMessageIndex, i)) {
                markdown.append(imageLink(media)).append("\n\n");
            }
        }
        return markdown.toString();
    }

    public String renderScaffold(List<ThreadMessage> messages,
                                 String fingerprint,
                                 List<MessageMedia> mediaByMessageIndex) {
        requireMessages(messages);
        String title = titleOf(messages);
        List<DownloadedMedia> allMedia = mediaByMessageIndex == null
                ? List.of()
                : mediaByMessageIndex.stream().flatMap(m -> m.succeeded().stream()).toList();

        StringBuilder markdown = new StringBuilder();
        markdown.append("# Summary: ").append(title).append("\n\n");
        markdown.append("**Thread ID:** ").append(fingerprint).append('\n');
        markdown.append("**Date:** ").append(formatTimestamp(fingerprint, DATE)).append('\n');
        markdown.append("**Messages:** ").append(messages.size()).append('\n');
        markdown.append("**Transcript:** ").append(filenameFor(title, fingerprint)).append('\n');
        markdown.append("**Media:** ").append(allMedia.size()).append("\n\n");
        markdown.append("---\n\n");
        markdown.append("## Summary\n\n");
        markdown.append("<!-- Write the summary of this thread here. -->\n\n");
        markdown.append("## Media\n\n");
        if (allMedia.isEmpty()) {
            markdown.append("_No media in this thread._\n");
        } else {
            for (DownloadedMedia media : allMedia) {
                markdown.append("- ").append(imageLink(media)).append('\n');
            }
        }
        return markdown.toString();
    }

    /**
     * {@code <fingerprint>-<slug>.md}. slug 는 소문자 영숫자와 하이픈만 남긴 제목 앞부분이다.
     */
    public String filenameFor(String title, String fingerprint) {
        return baseNameFor(title, fingerprint) + ".md";
    }

    public String scaffoldFilenameFor(String title, String fingerprint) {
        return baseNameFor(title, fingerprint) + "-summary.md";
    }

    String formatMessageText(String text, Map<String, String> names) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String formatted = USER_MENTION_LABELED.matcher(text).replaceAll("@$2");
        Matcher mention = USER_MENTION.matcher(formatted);
        StringBuilder resolved = new StringBuilder();
        while (mention.find()) {
            String name = names.getOrDefault(mention.group(1), "user");
            mention.appendReplacement(resolved, Matcher.quoteReplacement("@" + name));
        }
        mention.appendTail(resolved);
        formatted = resolved.toString();
        formatted = CHANNEL_LABELED.matcher(formatted).replaceAll("#$2");
        formatted = CHANNEL.matcher(formatted).replaceAll("#channel");
        formatted = LINK_LABELED.matcher(formatted).replaceAll("[$2]($1)");
        formatted = LINK.matcher(formatted).replaceAll("$1");
        formatted = CODE_BLOCK.matcher(formatted).replaceAll("```\n$1\n```");
        return formatted;
    }

    private void appendHeader(StringBuilder markdown, String title, String fingerprint, int messageCount) {
        markdown.append("# ").append(title).append("\n\n");
        markdown.append("**Thread ID:** ").append(fingerprint).append('\n');
        markdown.append("**Date:** ").append(formatTimestamp(fingerprint, DATE)).append('\n');
        markdown.append("**Messages:** ").append(messageCount).append("\n\n");
    }

    private String baseNameFor(String title, String fingerprint) {
        String slug = (title == null ? "" : title)
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        if (slug.length() > SLUG_MAX_LENGTH) {
            slug = slug.substring(0, SLUG_MAX_LENGTH).replaceAll("-+$", "");
        }
        if (slug.isEmpty()) {
            slug = "untitled";
        }
        return fingerprint.replace('.', '-') + "-" + slug;
    }

    private String formatTimestamp(String ts, DateTimeFormatter formatter) {
        try {
            long millis = new BigDecimal(ts).movePointRight(3).longValue();
            return formatter.format(Instant.ofEpochMilli(millis).atZone(zoneId));
        } catch (NumberFormatException e) {
            return ts;
        }
    }

    private static String displayName(String userId, Map<String, String> names) {
        if (userId == null || userId.isBlank()) {
            return "Unknown";
        }
        return names.getOrDefault(userId, userId);
    }

    private static List<DownloadedMedia> mediaAt(List<MessageMedia> media, int index) {
        if (media == null || index >= media.size() || media.get(index) == null) {
            return List.of();
        }
        return media.get(index).succeeded();
    }

    private static String imageLink(DownloadedMedia media) {
        return "![" + media.filename() + "](" + media.relativePath() + ")";
    }

    private static void requireMessages(List<ThreadMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new InvalidThreadException("No messages to format");
        }
    }
}
