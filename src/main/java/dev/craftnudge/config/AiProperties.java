package dev.craftnudge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * analysisTimeout bounds every analysis call; a call that exceeds it counts as
 * a transient failure.
 */
@ConfigurationProperties(prefix = "craftnudge.ai")
public record AiProperties(Duration analysisTimeout, int maxOutputTokens, int analysisThreads) {
    public AiProperties {
        if (analysisTimeout == null) analysisTimeout = Duration.ofSeconds(120);
        if (maxOutputTokens <= 0) maxOutputTokens = 2048;
        if (analysisThreads <= 0) analysisThreads = 8;
    }
}
