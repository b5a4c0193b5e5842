package dev.craftnudge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * repositories are "owner/name" seeds polled in addition to every repository
 * already in the store.
 */
@ConfigurationProperties(prefix = "craftnudge.poller")
public record PollerProperties(boolean enabled, int commitsPerRepository, List<String> repositories) {
    public PollerProperties {
        if (commitsPerRepository <= 0) commitsPerRepository = 20;
        if (commitsPerRepository > 100) commitsPerRepository = 100;
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
    }
}
