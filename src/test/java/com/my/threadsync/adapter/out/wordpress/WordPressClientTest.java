package com.my.threadsync.adapter.out.wordpress;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.threadsync.domain.exception.PublishException;
import com.my.threadsync.domain.model.DocumentDraft;
import com.my.threadsync.domain.model.PublishAccess;
import com.my.threadsync.domain.model.PublishedDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WordPressClientTest {

    private HttpClient httpClient;
    private WordPressClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        client = new WordPressClient(httpClient, new ObjectMapper(), "https://blog.test/", "editor", "app pass", "draft");
    }

    @Test
    void create_posts_to_collection_with_basic_auth() throws Exception {
        respond(201, "{\"id\":42,\"title\":{\"rendered\":\"Launch plan\"},\"link\":\"https://blog.test/?p=42\",\"status\":\"draft\"}");

        PublishedDocument document = client.create(new DocumentDraft("Launch plan", "<p>Launch plan</p>"));

        assertThat(document).isEqualTo(new PublishedDocument(42L, "Launch plan", "https://blog.test/?p=42", "draft"));
        HttpRequest request = lastRequest();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.uri().toString()).isEqualTo("https://blog.test/wp-json/wp/v2/posts");
        String expected = "Basic " + Base64.getEncoder().encodeToString("editor:app pass".getBytes(StandardCharsets.UTF_8));
        assertThat(request.headers().firstValue("Authorization")).contains(expected);
    }

    @Test
    void update_targets_existing_post() throws Exception {
        respond(200, "{\"id\":42,\"title\":{\"rendered\":\"New\"},\"link\":\"l\",\"status\":\"publish\"}");

        PublishedDocument document = client.update(42L, new DocumentDraft("New", "<p>New</p>"));

        assertThat(document.id()).isEqualTo(42L);
        assertThat(lastRequest().uri().getPath()).isEqualTo("/wp-json/wp/v2/posts/42");
    }

    @Test
    void unauthorized_with_permission_wording_is_a_permission_problem() throws Exception {
        respond(401, "{\"code\":\"rest_cannot_create\",\"message\":\"Sorry, you are not allowed to create posts as this user. Insufficient permissions.\"}");

        assertThatThrownBy(() -> client.create(new DocumentDraft("t", "b")))
                .isInstanceOfSatisfying(PublishException.class, e -> {
                    assertThat(e.kind()).isEqualTo(PublishException.Kind.PERMISSION);
                    assertThat(e.status()).isEqualTo(401);
                });
    }

    @Test
    void status_codes_map_to_error_kinds() {
        assertThat(client.toException(401, "Invalid application password.", "create posts").kind())
                .isEqualTo(PublishException.Kind.AUTHENTICATION);
        assertThat(client.toException(403, "", "create posts").kind()).isEqualTo(PublishException.Kind.PERMISSION);
        assertThat(client.toException(404, "", "create posts").kind()).isEqualTo(PublishException.Kind.NOT_FOUND);
        assertThat(client.toException(500, "boom", "create posts"))
                .hasMessage("WordPress API error (500): boom")
                .extracting(PublishException::kind).isEqualTo(PublishException.Kind.REMOTE);
    }

    @Test
    void network_failure_is_remote_error() throws Exception {
        when(httpClient.send(any(), any())).thenThrow(new IOException("connection refused"));

        assertThatThrownBy(() -> client.create(new DocumentDraft("t", "b")))
                .isInstanceOfSatisfying(PublishException.class,
                        e -> assertThat(e.kind()).isEqualTo(PublishException.Kind.REMOTE));
    }

    @Test
    void access_probe_reads_roles_and_capabilities() throws Exception {
        respond(200, "{\"id\":3,\"username\":\"writer\",\"roles\":[\"contributor\"],\"capabilities\":{\"edit_posts\":true}}");

        PublishAccess access = client.checkAccess();

        assertThat(access.authenticated()).isTrue();
        assertThat(access.canPublish()).isTrue();
        assertThat(access.username()).isEqualTo("writer");
        assertThat(lastRequest().uri().getQuery()).isEqualTo("context=edit");
    }

    @Test
    void subscriber_cannot_publish() throws Exception {
        respond(200, "{\"id\":4,\"username\":\"reader\",\"roles\":[\"subscriber\"],\"capabilities\":{\"read\":true}}");

        assertThat(client.checkAccess().canPublish()).isFalse();
    }

    @Test
    void bad_credentials_give_unauthenticated_access() throws Exception {
        respond(401, "{\"code\":\"incorrect_password\",\"message\":\"The provided password is an invalid application password.\"}");

        PublishAccess access = client.checkAccess();

        assertThat(access.authenticated()).isFalse();
        assertThat(access.error()).contains("authentication failed");
    }

    @Test
    void permission_keywords_are_case_insensitive() {
        assertThat(WordPressClient.isPermissionError("Sie sind nicht BERECHTIGT")).isTrue();
        assertThat(WordPressClient.isPermissionError("Invalid username")).isFalse();
        assertThat(WordPressClient.isPermissionError(null)).isFalse();
    }

    @SuppressWarnings("unchecked")
    private void respond(int status, String body) throws Exception {
        HttpResponse<Object> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        when(httpClient.send(any(), any())).thenReturn(response);
    }

    private HttpRequest lastRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }
}
