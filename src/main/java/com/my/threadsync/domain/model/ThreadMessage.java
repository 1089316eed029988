package com.my.threadsync.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 스레드를 구성하는 메시지 하나. {@code ts == threadTs} 이면 스레드 루트다.
 */
public record ThreadMessage(String ts,
                            String threadTs,
                            String user,
                            String text,
                            List<Attachment> files) {

    public ThreadMessage {
        Objects.requireNonNull(ts, "ts");
        text = text == null ? "" : text;
        files = files == null ? List.of() : List.copyOf(files);
    }

    public boolean isThreadRoot() {
        return threadTs != null && threadTs.equals(ts);
    }
}
