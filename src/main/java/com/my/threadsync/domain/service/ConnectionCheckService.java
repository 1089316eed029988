package com.my.threadsync.domain.service;

import com.my.threadsync.domain.model.ConnectionReport;
import com.my.threadsync.domain.model.PublishAccess;
import com.my.threadsync.domain.model.SourceChannel;
import com.my.threadsync.domain.port.in.CheckConnectionsUseCase;
import com.my.threadsync.domain.port.out.PublishPort;
import com.my.threadsync.domain.port.out.ThreadSourcePort;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 스레드 소스와 게시 대상의 연결 상태를 점검한다. 실패는 보고서에 담고 던지지 않는다.
 */
public class ConnectionCheckService implements CheckConnectionsUseCase {

    private static final Logger log = Logger.getLogger(ConnectionCheckService.class);

    private final ThreadSourcePort threadSource;
    private final PublishPort publisher;
    private final String channelId;

    public ConnectionCheckService(ThreadSourcePort threadSource, PublishPort publisher, String channelId) {
        this.threadSource = threadSource;
        this.publisher = publisher;
        this.channelId = channelId;
    }

    @Override
    public ConnectionReport checkConnections() {
        Map<String, String> errors = new LinkedHashMap<>();
        boolean sourceReachable = false;
        boolean channelAccessible = false;
        List<SourceChannel> channels = List.of();

        try {
            threadSource.checkAuth();
            sourceReachable = true;
        } catch (RuntimeException e) {
            log.warnf("스레드 소스 연결 점검 실패: %s", e.getMessage());
            errors.put("source", messageOf(e));
        }

        if (sourceReachable) {
            try {
                channels = threadSource.listChannels();
            } catch (RuntimeException e) {
                errors.put("channels", messageOf(e));
            }
            if (channelId == null || channelId.isBlank()) {
                errors.put("channel", "채널 ID가 설정되지 않았습니다.");
            } else {
                try {
                    threadSource.validateChannel(channelId);
                    channelAccessible = true;
                } catch (RuntimeException e) {
                    errors.put("channel", messageOf(e));
                }
            }
        }

        PublishAccess access;
        try {
            access = publisher.checkAccess();
            if (!access.authenticated()) {
                errors.put("publish", access.error() == null ? "authentication failed" : access.error());
            } else if (!access.canPublish()) {
                errors.put("publish", "사용자 " + access.username() + " 에게 글 작성 권한이 없습니다. (roles: " + access.roles() + ")");
            }
        } catch (RuntimeException e) {
            log.warnf("게시 대상 연결 점검 실패: %s", e.getMessage());
            access = PublishAccess.denied(messageOf(e));
            errors.put("publish", messageOf(e));
        }

        return new ConnectionReport(sourceReachable, channelAccessible, channels, access, errors);
    }

    private static String messageOf(RuntimeException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
