package dev.craftnudge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * webhookSecret signs inbound deliveries; apiToken authenticates the poller
 * against the REST API at apiBaseUrl.
 */
@ConfigurationProperties(prefix = "craftnudge.github")
public record GitHubProperties(String webhookSecret, String apiToken, String apiBaseUrl) {
    public GitHubProperties {
        if (apiBaseUrl == null || apiBaseUrl.isBlank()) apiBaseUrl = "https://api.github.com";
    }
}
