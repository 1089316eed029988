package com.my.threadsync.adapter.out.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.threadsync.config.AppConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 출력 디렉터리에 쓸 수 있고 상태 파일을 읽을 수 있으면 준비 완료.
 */
@Readiness
@ApplicationScoped
public class PipelineReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;
    private final ObjectMapper objectMapper;

    public PipelineReadinessCheck(AppConfig appConfig, ObjectMapper objectMapper) {
        this.appConfig = appConfig;
        this.objectMapper = objectMapper;
    }

    @Override
    public HealthCheckResponse call() {
        Path posts = Path.of(appConfig.paths().postsDir());
        Path media = Path.of(appConfig.paths().mediaDir());
        Path state = Path.of(appConfig.paths().stateFile());
        boolean postsOk = writable(posts);
        boolean mediaOk = writable(media);
        boolean stateOk = stateReadable(state);
        return HealthCheckResponse.named("thread-sync-readiness")
                .withData("postsDir", posts.toString())
                .withData("mediaDir", media.toString())
                .withData("stateFile", state.toString())
                .withData("postsWritable", postsOk)
                .withData("mediaWritable", mediaOk)
                .withData("stateReadable", stateOk)
                .status(postsOk && mediaOk && stateOk)
                .build();
    }

    private static boolean writable(Path dir) {
        try {
            Files.createDirectories(dir);
            return Files.isWritable(dir);
        } catch (IOException e) {
            return false;
        }
    }

    private boolean stateReadable(Path state) {
        if (!Files.exists(state)) {
            return true;
        }
        try {
            objectMapper.readTree(state.toFile());
            return true;
        } catch (IOException e) {
            return false;
        }
    }
}
