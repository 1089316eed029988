package com.my.threadsync.domain.service;

import com.my.threadsync.domain.exception.InvalidThreadException;
import com.my.threadsync.domain.model.DocumentDraft;
import com.my.threadsync.domain.model.ThreadMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PostFormatterTest {

    private final PostFormatter formatter = new PostFormatter();

    @Test
    void first_message_is_body_and_replies_are_blocks() {
        DocumentDraft draft = formatter.format(List.of(
                new ThreadMessage("1.1", "1.1", "U1", "Launch plan", List.of()),
                new ThreadMessage("1.2", "1.1", "U2", "LGTM", List.of())));

        assertThat(draft.title()).isEqualTo("Launch plan");
        assertThat(draft.body()).isEqualTo("<p>Launch plan</p>\n"
                + "<div class=\"thread-reply\">\n"
                + "<p><strong>Reply:</strong></p>\n"
                + "<p>LGTM</p>\n"
                + "</div>\n");
    }

    @Test
    void html_is_escaped_and_newlines_become_breaks() {
        assertThat(PostFormatter.escapeHtml("a & <b> \"q\" 'x'\nnext"))
                .isEqualTo("a &amp; &lt;b&gt; &quot;q&quot; &#039;x&#039;<br>next");
    }

    @Test
    void empty_thread_is_rejected() {
        assertThatThrownBy(() -> formatter.format(List.of())).isInstanceOf(InvalidThreadException.class);
    }
}
