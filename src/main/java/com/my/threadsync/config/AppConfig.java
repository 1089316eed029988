package com.my.threadsync.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    SlackConfig slack();

    WordPressConfig wordpress();

    PathsConfig paths();

    PipelineConfig pipeline();

    MediaConfig media();

    IdempotencyConfig idempotency();

    ScheduleConfig schedule();

    interface SlackConfig {
        @WithName("bot-token")
        Optional<String> botToken();

        @WithName("channel-id")
        Optional<String> channelId();

        @WithName("api-base")
        @WithDefault("https://slack.com/api")
        String apiBase();
    }

    interface WordPressConfig {
        Optional<String> url();

        Optional<String> username();

        Optional<String> password();

        @WithName("post-status")
        @WithDefault("draft")
        String postStatus();
    }

    interface PathsConfig {
        @WithName("state-file")
        @WithDefault("./data/state.json")
        String stateFile();

        @WithName("posts-dir")
        @WithDefault("./data/posts")
        String postsDir();

        @WithName("media-dir")
        @WithDefault("./data/images")
        String mediaDir();
    }

    interface PipelineConfig {
        @WithName("max-concurrency")
        @WithDefault("8")
        int maxConcurrency();

        @WithName("progress-retention-seconds")
        @WithDefault("60")
        int progressRetentionSeconds();

        @WithDefault("Etc/UTC")
        String timezone();
    }

    interface MediaConfig {
        @WithName("min-bytes")
        @WithDefault("100")
        int minBytes();
    }

    interface IdempotencyConfig {
        @WithName("backend")
        @WithDefault("file")
        String backend();

        @WithName("path")
        @WithDefault("./data/idempotency.log")
        String path();

        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }

    interface ScheduleConfig {
        @WithName("interval-minutes")
        @WithDefault("0")
        int intervalMinutes();
    }
}
