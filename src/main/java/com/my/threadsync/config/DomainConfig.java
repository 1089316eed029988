package com.my.threadsync.config;

import com.my.threadsync.adapter.out.clock.OffsetClockAdapter;
import com.my.threadsync.domain.port.in.CheckConnectionsUseCase;
import com.my.threadsync.domain.port.in.ManageMappingsUseCase;
import com.my.threadsync.domain.port.in.SyncThreadsUseCase;
import com.my.threadsync.domain.port.out.ClockPort;
import com.my.threadsync.domain.port.out.MediaPort;
import com.my.threadsync.domain.port.out.PublishPort;
import com.my.threadsync.domain.port.out.ThreadMappingStore;
import com.my.threadsync.domain.port.out.ThreadSourcePort;
import com.my.threadsync.domain.port.out.TranscriptPort;
import com.my.threadsync.domain.service.ConnectionCheckService;
import com.my.threadsync.domain.service.FanOut;
import com.my.threadsync.domain.service.MappingService;
import com.my.threadsync.domain.service.PipelineRunRegistry;
import com.my.threadsync.domain.service.PostFormatter;
import com.my.threadsync.domain.service.SyncPipelineService;
import com.my.threadsync.domain.service.ThreadPromptBuilder;
import com.my.threadsync.domain.service.TranscriptRenderer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.time.Duration;
import java.time.ZoneId;

/**
 * 도메인 서비스와 포트 구현을 연결한다.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public SyncThreadsUseCase syncThreadsUseCase(ThreadSourcePort threadSourcePort,
                                                 PublishPort publishPort,
                                                 ThreadMappingStore mappingStore,
                                                 MediaPort mediaPort,
                                                 TranscriptPort transcriptPort,
                                                 PipelineRunRegistry runRegistry,
                                                 FanOut fanOut,
                                                 ClockPort clockPort,
                                                 AppConfig appConfig) {
        return new SyncPipelineService(threadSourcePort, publishPort, mappingStore, mediaPort, transcriptPort,
                new PostFormatter(), new ThreadPromptBuilder(), runRegistry, fanOut, clockPort,
                appConfig.slack().channelId().orElse(null));
    }

    @Produces
    @ApplicationScoped
    public ManageMappingsUseCase manageMappingsUseCase(ThreadMappingStore mappingStore,
                                                       ThreadSourcePort threadSourcePort,
                                                       AppConfig appConfig) {
        return new MappingService(mappingStore, threadSourcePort, new ThreadPromptBuilder(),
                appConfig.slack().channelId().orElse(null));
    }

    @Produces
    @ApplicationScoped
    public CheckConnectionsUseCase checkConnectionsUseCase(ThreadSourcePort threadSourcePort,
                                                           PublishPort publishPort,
                                                           AppConfig appConfig) {
        return new ConnectionCheckService(threadSourcePort, publishPort, appConfig.slack().channelId().orElse(null));
    }

    @Produces
    @Singleton
    public FanOut fanOut(AppConfig appConfig) {
        return new FanOut(appConfig.pipeline().maxConcurrency());
    }

    void closeFanOut(@Disposes FanOut fanOut) {
        fanOut.close();
    }

    @Produces
    @Singleton
    public PipelineRunRegistry pipelineRunRegistry(ClockPort clockPort, AppConfig appConfig) {
        return new PipelineRunRegistry(clockPort, Duration.ofSeconds(appConfig.pipeline().progressRetentionSeconds()));
    }

    void closeRunRegistry(@Disposes PipelineRunRegistry registry) {
        registry.close();
    }

    @Produces
    @Singleton
    public TranscriptRenderer transcriptRenderer(AppConfig appConfig) {
        return new TranscriptRenderer(ZoneId.of(appConfig.pipeline().timezone()));
    }

    @Produces
    @ApplicationScoped
    public ClockPort clockPort(AppConfig appConfig) {
        return OffsetClockAdapter.of(ZoneId.of(appConfig.pipeline().timezone()));
    }
}
