package com.my.threadsync.adapter.out.wordpress;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.exception.PublishException;
import com.my.threadsync.domain.model.DocumentDraft;
import com.my.threadsync.domain.model.PublishAccess;
import com.my.threadsync.domain.model.PublishedDocument;
import com.my.threadsync.domain.port.out.PublishPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * WordPress REST API(v2) 로 글을 만들고 고친다. 인증은 애플리케이션 비밀번호 Basic 인증.
 */
@ApplicationScoped
public class WordPressClient implements PublishPort {

    private static final Logger log = Logger.getLogger(WordPressClient.class);

    private static final List<String> PERMISSION_KEYWORDS = List.of(
            "not authorized", "berechtigt", "permission", "role", "capability",
            "cannot create", "cannot edit", "insufficient permissions");
    private static final List<String> PUBLISHING_ROLES = List.of("administrator", "editor", "author");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String siteUrl;
    private final String apiBase;
    private final String authorization;
    private final String postStatus;

    @Inject
    public WordPressClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                objectMapper,
                appConfig.wordpress().url().orElse(""),
                appConfig.wordpress().username().orElse(""),
                appConfig.wordpress().password().orElse(""),
                appConfig.wordpress().postStatus());
    }

    WordPressClient(HttpClient httpClient, ObjectMapper objectMapper, String url,
                    String username, String password, String postStatus) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.siteUrl = url.replaceAll("/+$", "");
        this.apiBase = siteUrl + "/wp-json/wp/v2";
        this.authorization = "Basic " + Base64.getEncoder()
                .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        this.postStatus = postStatus;
        if (!siteUrl.isBlank()) {
            log.infof("WordPress 대상: %s (user=%s)", siteUrl, username);
        }
    }

    @Override
    public PublishedDocument create(DocumentDraft draft) {
        PostPayload payload = new PostPayload(draft.title(), draft.body(), postStatus);
        PostResponse post = send("POST", "/posts", payload, "create posts", PostResponse.class);
        log.infof("WordPress 글 생성: id=%d", post.id());
        return post.toDomain();
    }

    @Override
    public PublishedDocument update(long documentId, DocumentDraft draft) {
        PostPayload payload = new PostPayload(draft.title(), draft.body(), null);
        PostResponse post = send("POST", "/posts/" + documentId, payload, "update posts", PostResponse.class);
        log.infof("WordPress 글 갱신: id=%d", post.id());
        return post.toDomain();
    }

    @Override
    public PublishAccess checkAccess() {
        UserResponse user;
        try {
            user = send("GET", "/users/me?context=edit", null, "access WordPress API", UserResponse.class);
        } catch (PublishException e) {
            if (e.kind() == PublishException.Kind.AUTHENTICATION) {
                return PublishAccess.denied(e.getMessage());
            }
            throw e;
        }
        List<String> roles = Optional.ofNullable(user.roles()).orElse(List.of());
        Map<String, Boolean> capabilities = Optional.ofNullable(user.capabilities()).orElse(Map.of());
        boolean canPublish = Boolean.TRUE.equals(capabilities.get("publish_posts"))
                || Boolean.TRUE.equals(capabilities.get("edit_posts"))
                || roles.stream().anyMatch(PUBLISHING_ROLES::contains);
        log.infof("WordPress 사용자 %s, roles=%s, 글 작성 가능=%s", user.username(), roles, canPublish);
        return new PublishAccess(true, canPublish, user.username(), roles, null);
    }

    private <T> T send(String method, String path, Object payload, String operation, Class<T> type) {
        if (siteUrl.isBlank()) {
            throw new PublishException(PublishException.Kind.REMOTE, -1, "WordPress URL이 설정되지 않았습니다.");
        }
        HttpResponse<String> response;
        try {
            HttpRequest.BodyPublisher body = payload == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiBase + path))
                    .header("Authorization", authorization)
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(30))
                    .method(method, body)
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PublishException(PublishException.Kind.REMOTE, "WordPress 호출 실패: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException(PublishException.Kind.REMOTE, "WordPress 호출이 중단되었습니다.", e);
        }

        if (response.statusCode() >= 300) {
            log.warnf("WordPress %s %s 실패 status=%d body=%s", method, path, response.statusCode(), response.body());
            throw toException(response.statusCode(), errorMessage(response.body()), operation);
        }
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (IOException e) {
            throw new PublishException(PublishException.Kind.REMOTE, "WordPress 응답을 해석할 수 없습니다.", e);
        }
    }

    PublishException toException(int status, String detail, String operation) {
        if (status == 401 && isPermissionError(detail)) {
            return new PublishException(PublishException.Kind.PERMISSION, status,
                    "WordPress permission denied (401). Your user role doesn't have permission to " + operation
                            + ". Required roles: Administrator, Editor, or Author. Error details: " + detail);
        }
        if (status == 401) {
            return new PublishException(PublishException.Kind.AUTHENTICATION, status,
                    "WordPress authentication failed (401). Verify the username and the application password "
                            + "(not the regular password). Error details: " + detail);
        }
        if (status == 403) {
            return new PublishException(PublishException.Kind.PERMISSION, status,
                    "WordPress permission denied (403). Your user doesn't have permission to " + operation
                            + ". Required roles: Administrator, Editor, or Author");
        }
        if (status == 404) {
            return new PublishException(PublishException.Kind.NOT_FOUND, status,
                    "WordPress endpoint not found (404). Please verify your WordPress URL is correct: " + siteUrl);
        }
        return new PublishException(PublishException.Kind.REMOTE, status,
                "WordPress API error (" + status + "): " + detail);
    }

    static boolean isPermissionError(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return PERMISSION_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            return node.path("message").asText(body);
        } catch (IOException e) {
            return body;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record PostPayload(@JsonProperty("title") String title,
                               @JsonProperty("content") String content,
                               @JsonProperty("status") String status) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Rendered(@JsonProperty("rendered") String rendered) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record PostResponse(@JsonProperty("id") long id,
                                @JsonProperty("title") Rendered title,
                                @JsonProperty("link") String link,
                                @JsonProperty("status") String status) {

        PublishedDocument toDomain() {
            return new PublishedDocument(id, title == null ? null : title.rendered(), link, status);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record UserResponse(@JsonProperty("id") long id,
                                @JsonProperty("username") String username,
                                @JsonProperty("name") String name,
                                @JsonProperty("roles") List<String> roles,
                                @JsonProperty("capabilities") Map<String, Boolean> capabilities) {
    }
}
