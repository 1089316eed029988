package com.my.threadsync.domain.port.out;

import com.my.threadsync.domain.model.MediaAsset;
import com.my.threadsync.domain.model.SourceChannel;
import com.my.threadsync.domain.model.ThreadMessage;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * 대화 스레드를 제공하는 메시징 소스.
 */
public interface ThreadSourcePort {

    void checkAuth();

    List<SourceChannel> listChannels();

    void validateChannel(String channelId);

    /**
     * 채널의 루트 메시지 후보를 돌려준다. 스레드 여부는 호출자가 판단한다.
     */
    List<ThreadMessage> listThreads(String channelId);

    List<ThreadMessage> listMessages(String channelId, String threadTs);

    Optional<String> resolveUserName(String userId);

    /**
     * 인증된 요청으로 첨부 파일 바이트 스트림을 연다. 스트림은 호출자가 닫는다.
     */
    InputStream openDownload(MediaAsset asset) throws IOException;
}
