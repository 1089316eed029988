package com.my.threadsync.domain.service;

import com.my.threadsync.domain.exception.InvalidThreadException;
import com.my.threadsync.domain.model.ThreadMessage;

import java.util.List;

public class ThreadPromptBuilder {

    public String build(List<ThreadMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new InvalidThreadException("No messages to generate prompt from");
        }
        StringBuilder prompt = new StringBuilder();
        prompt.append("Please write a professional blog post based on the following Slack thread conversation:\n\n");
        prompt.append("=== THREAD START ===\n\n");
        for (int i = 0; i < messages.size(); i++) {
            if (i == 0) {
                prompt.append("Original Post:\n");
            } else {
                prompt.append("Reply ").append(i).append(":\n");
            }
            prompt.append(messages.get(i).text()).append("\n\n");
        }
        prompt.append("=== THREAD END ===\n\n");
        prompt.append("Instructions:\n");
        prompt.append("1. Create an engaging blog post title\n");
        prompt.append("2. Write a well-structured blog post with proper paragraphs\n");
        prompt.append("3. Include relevant headings if appropriate\n");
        prompt.append("4. Maintain a professional yet approachable tone\n");
        prompt.append("5. Incorporate insights from all the replies in the thread\n");
        prompt.append("6. Format the output in HTML suitable for WordPress\n");
        return prompt.toString();
    }
}
