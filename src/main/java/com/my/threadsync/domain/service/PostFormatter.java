package com.my.threadsync.domain.service;

import com.my.threadsync.domain.exception.InvalidThreadException;
import com.my.threadsync.domain.model.DocumentDraft;
import com.my.threadsync.domain.model.ThreadMessage;

import java.util.List;

/**
 * 게시용 HTML 본문. 첫 메시지는 본문, 이후 메시지는 reply 블록이 된다.
 */
public class PostFormatter {

    public DocumentDraft format(List<ThreadMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new InvalidThreadException("No messages to format");
        }
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < messages.size(); i++) {
            String text = escapeHtml(messages.get(i).text());
            if (i == 0) {
                content.append("<p>").append(text).append("</p>\n");
            } else {
                content.append("<div class=\"thread-reply\">\n")
                        .append("<p><strong>Reply:</strong></p>\n")
                        .append("<p>").append(text).append("</p>\n")
                        .append("</div>\n");
            }
        }
        return new DocumentDraft(TranscriptRenderer.titleOf(messages), content.toString());
    }

    static String escapeHtml(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append("&quot;");
                case '\'' -> escaped.append("&#039;");
                case '\n' -> escaped.append("<br>");
                default -> escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
