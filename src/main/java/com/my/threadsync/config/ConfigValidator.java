package com.my.threadsync.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.configuration.ConfigUtils;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = ConfigUtils.getProfiles().contains("prod");
        validateRequired("SLACK_BOT_TOKEN", appConfig.slack().botToken().orElse(null), isProd);
        validateRequired("SLACK_CHANNEL_ID", appConfig.slack().channelId().orElse(null), isProd);
        validateRequired("WORDPRESS_URL", appConfig.wordpress().url().orElse(null), isProd);
        validateRequired("WORDPRESS_USERNAME", appConfig.wordpress().username().orElse(null), isProd);
        validateRequired("WORDPRESS_PASSWORD", appConfig.wordpress().password().orElse(null), isProd);
        if (appConfig.pipeline().maxConcurrency() < 1) {
            throw new IllegalStateException("app.pipeline.max-concurrency는 1 이상이어야 합니다.");
        }
        try {
            ZoneId.of(appConfig.pipeline().timezone());
        } catch (DateTimeException e) {
            throw new IllegalStateException("잘못된 시간대 설정: " + appConfig.pipeline().timezone(), e);
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }
}
