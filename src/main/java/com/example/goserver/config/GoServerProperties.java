package com.example.goserver.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Server settings under {@code goserver.*}, overridable through application.yml or the environment.
 */
@Data
@Component
@ConfigurationProperties(prefix = "goserver")
public class GoServerProperties {

    private final Clock clock = new Clock();
    private final Session session = new Session();
    private final Ai ai = new Ai();
    private final Scoring scoring = new Scoring();

    @Data
    public static class Clock {
        /** Period of the background clock ticker. */
        private long tickIntervalMs = 1000;
    }

    @Data
    public static class Session {
        /** How long a game with no connected client survives. */
        private Duration evictionGrace = Duration.ofMinutes(5);
    }

    @Data
    public static class Ai {
        /** Engine executable. */
        private String command = "katago";
        /** Arguments placed before the per-level overrides, e.g. gtp -model ... -config ... */
        private List<String> args = new ArrayList<>(List.of("gtp"));
        private Duration commandTimeout = Duration.ofSeconds(10);
        private int maxRetries = 2;
        /** Pause before the AI starts thinking after a human move. */
        private Duration moveDelay = Duration.ofMillis(500);
        private int poolSize = 4;
    }

    @Data
    public static class Scoring {
        /** Extend a dead-group toggle to small same-colored groups that look dead. */
        private boolean autoDetectDeadGroups = false;
    }
}
