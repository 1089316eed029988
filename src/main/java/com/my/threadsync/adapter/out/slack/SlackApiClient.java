package com.my.threadsync.adapter.out.slack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.exception.ThreadSourceException;
import com.my.threadsync.domain.exception.ThreadSourceUnavailableException;
import com.my.threadsync.domain.model.Attachment;
import com.my.threadsync.domain.model.MediaAsset;
import com.my.threadsync.domain.model.SourceChannel;
import com.my.threadsync.domain.model.ThreadMessage;
import com.my.threadsync.domain.port.out.ThreadSourcePort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Slack Web API 호출을 감싼다. 응답의 {@code ok=false} 는 오류 코드를 담은 {@link ThreadSourceException} 이 된다.
 */
@ApplicationScoped
public class SlackApiClient implements ThreadSourcePort {

    private static final Logger log = Logger.getLogger(SlackApiClient.class);

    private static final int PAGE_SIZE = 100;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBase;
    private final String botToken;
    private final Map<String, String> userNames = new ConcurrentHashMap<>();

    @Inject
    public SlackApiClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(5))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                objectMapper,
                appConfig.slack().apiBase(),
                appConfig.slack().botToken().orElse(""));
    }

    SlackApiClient(HttpClient httpClient, ObjectMapper objectMapper, String apiBase, String botToken) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase.replaceAll("/+$", "");
        this.botToken = botToken;
    }

    @Override
    public void checkAuth() {
        call("auth.test", Map.of(), JsonNode.class);
    }

    @Override
    @Retry(maxRetries = 2, delay = 1000, retryOn = ThreadSourceUnavailableException.class)
    public List<SourceChannel> listChannels() {
        List<SourceChannel> channels = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("types", "public_channel,private_channel");
            params.put("exclude_archived", "true");
            params.put("limit", String.valueOf(PAGE_SIZE));
            putCursor(params, cursor);
            ChannelsResponse page = call("conversations.list", params, ChannelsResponse.class);
            Optional.ofNullable(page.channels()).orElse(List.of()).stream()
                    .map(c -> new SourceChannel(c.id(), c.name(), c.member(), c.privateChannel()))
                    .forEach(channels::add);
            cursor = nextCursor(page.metadata());
        } while (cursor != null);
        return channels;
    }

    @Override
    public void validateChannel(String channelId) {
        try {
            call("conversations.info", Map.of("channel", channelId), JsonNode.class);
        } catch (ThreadSourceUnavailableException e) {
            throw e;
        } catch (ThreadSourceException e) {
            throw new ThreadSourceException(e.errorCode(), channelMessage(e.errorCode(), channelId), e);
        }
    }

    @Override
    @Retry(maxRetries = 2, delay = 1000, retryOn = ThreadSourceUnavailableException.class)
    public List<ThreadMessage> listThreads(String channelId) {
        return paginateMessages("conversations.history", Map.of("channel", channelId));
    }

    @Override
    @Retry(maxRetries = 2, delay = 1000, retryOn = ThreadSourceUnavailableException.class)
    public List<ThreadMessage> listMessages(String channelId, String threadTs) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channelId);
        params.put("ts", threadTs);
        params.put("include_all_metadata", "true");
        return paginateMessages("conversations.replies", params);
    }

    @Override
    public Optional<String> resolveUserName(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        String cached = userNames.get(userId);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            UserResponse response = call("users.info", Map.of("user", userId), UserResponse.class);
            Optional<String> name = Optional.ofNullable(response.user()).flatMap(SlackUser::bestName);
            name.ifPresent(n -> userNames.put(userId, n));
            return name;
        } catch (ThreadSourceException e) {
            log.warnf("사용자 %s 이름 조회 실패: %s", userId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public InputStream openDownload(MediaAsset asset) throws IOException {
        Set<String> urls = new LinkedHashSet<>();
        refreshedDownloadUrl(asset.id()).ifPresent(urls::add);
        urls.addAll(asset.sourceUrls());
        if (urls.isEmpty()) {
            throw new IOException("No download URL for file " + asset.id());
        }

        IOException last = null;
        for (String url : urls) {
            try {
                return stream(url);
            } catch (IOException e) {
                log.warnf("파일 %s 다운로드 실패 (%s): %s", asset.id(), url, e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    private InputStream stream(String url) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Authorization", "Bearer " + botToken)
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Download interrupted", e);
        }
        if (response.statusCode() >= 400) {
            response.body().close();
            throw new IOException("HTTP " + response.statusCode());
        }
        return response.body();
    }

    private Optional<String> refreshedDownloadUrl(String fileId) {
        try {
            FileResponse response = call("files.info", Map.of("file", fileId), FileResponse.class);
            return Optional.ofNullable(response.file())
                    .map(f -> f.urlPrivateDownload() != null ? f.urlPrivateDownload() : f.urlPrivate());
        } catch (ThreadSourceException e) {
            log.debugf("files.info 실패, 메시지의 URL 을 사용합니다: %s", e.getMessage());
            return Optional.empty();
        }
    }

    private List<ThreadMessage> paginateMessages(String method, Map<String, String> baseParams) {
        List<ThreadMessage> messages = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, String> params = new LinkedHashMap<>(baseParams);
            params.put("limit", String.valueOf(PAGE_SIZE));
            putCursor(params, cursor);
            MessagesResponse page = call(method, params, MessagesResponse.class);
            Optional.ofNullable(page.messages()).orElse(List.of()).stream()
                    .map(SlackMessage::toDomain)
                    .forEach(messages::add);
            cursor = nextCursor(page.metadata());
        } while (cursor != null);
        return messages;
    }

    private <T> T call(String method, Map<String, String> params, Class<T> type) {
        if (botToken.isBlank()) {
            throw new ThreadSourceException("not_configured", "Slack 봇 토큰이 설정되지 않았습니다.");
        }
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/" + method + (query.isEmpty() ? "" : "?" + query)))
                .header("Authorization", "Bearer " + botToken)
                .timeout(Duration.ofSeconds(15))
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ThreadSourceUnavailableException("Slack " + method + " 호출 실패: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThreadSourceUnavailableException("Slack " + method + " 호출이 중단되었습니다.", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new ThreadSourceUnavailableException("Slack " + method + " status=" + status);
        }
        try {
            JsonNode node = objectMapper.readTree(response.body());
            if (node == null || !node.path("ok").asBoolean(false)) {
                String code = node == null ? "invalid_response" : node.path("error").asText("unknown_error");
                throw new ThreadSourceException(code, describe(code));
            }
            return objectMapper.treeToValue(node, type);
        } catch (IOException e) {
            throw new ThreadSourceException("invalid_response", "Slack " + method + " 응답을 해석할 수 없습니다.", e);
        }
    }

    static String describe(String code) {
        return switch (code) {
            case "channel_not_found" -> "Channel not found. Please verify the channel ID is correct, "
                    + "the bot has been invited to the channel and has the required permissions";
            case "not_in_channel" -> "Bot is not a member of the channel. "
                    + "Invite the bot using: /invite @YourBotName in the channel";
            case "missing_scope" -> "Bot is missing required permissions. "
                    + "Add scopes: channels:read, channels:history in Slack App settings";
            default -> "Slack API error: " + code;
        };
    }

    private static String channelMessage(String code, String channelId) {
        if ("channel_not_found".equals(code)) {
            return "Channel not found or bot doesn't have access. Please verify the channel ID \"" + channelId
                    + "\" is correct, the bot has been invited (/invite @YourBotName) and has the scopes "
                    + "channels:read, channels:history";
        }
        return describe(code);
    }

    private static void putCursor(Map<String, String> params, String cursor) {
        if (cursor != null) {
            params.put("cursor", cursor);
        }
    }

    private static String nextCursor(ResponseMetadata metadata) {
        if (metadata == null || metadata.nextCursor() == null || metadata.nextCursor().isBlank()) {
            return null;
        }
        return metadata.nextCursor();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ResponseMetadata(@JsonProperty("next_cursor") String nextCursor) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChannelsResponse(@JsonProperty("channels") List<SlackChannel> channels,
                                    @JsonProperty("response_metadata") ResponseMetadata metadata) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SlackChannel(@JsonProperty("id") String id,
                                @JsonProperty("name") String name,
                                @JsonProperty("is_member") boolean member,
                                @JsonProperty("is_private") boolean privateChannel) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record MessagesResponse(@JsonProperty("messages") List<SlackMessage> messages,
                                    @JsonProperty("response_metadata") ResponseMetadata metadata) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SlackMessage(@JsonProperty("ts") String ts,
                                @JsonProperty("thread_ts") String threadTs,
                                @JsonProperty("user") String user,
                                @JsonProperty("text") String text,
                                @JsonProperty("files") List<SlackFile> files) {

        ThreadMessage toDomain() {
            List<Attachment> attachments = Optional.ofNullable(files).orElse(List.of()).stream()
                    .map(SlackFile::toDomain)
                    .toList();
            return new ThreadMessage(ts, threadTs, user, text, attachments);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SlackFile(@JsonProperty("id") String id,
                             @JsonProperty("name") String name,
                             @JsonProperty("mimetype") String mimetype,
                             @JsonProperty("url_private") String urlPrivate,
                             @JsonProperty("url_private_download") String urlPrivateDownload,
                             @JsonProperty("size") Long size) {

        Attachment toDomain() {
            return new Attachment(id, name, mimetype, urlPrivate, urlPrivateDownload, size);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record FileResponse(@JsonProperty("file") SlackFile file) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record UserResponse(@JsonProperty("user") SlackUser user) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SlackUser(@JsonProperty("id") String id,
                             @JsonProperty("name") String name,
                             @JsonProperty("real_name") String realName,
                             @JsonProperty("profile") SlackProfile profile) {

        Optional<String> bestName() {
            List<String> candidates = new ArrayList<>();
            if (profile != null) {
                candidates.add(profile.displayName());
                candidates.add(profile.realName());
            }
            candidates.add(realName);
            candidates.add(name);
            return candidates.stream().filter(s -> s != null && !s.isBlank()).findFirst();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SlackProfile(@JsonProperty("display_name") String displayName,
                                @JsonProperty("real_name") String realName) {
    }
}
