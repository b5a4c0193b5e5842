package dev.craftnudge.infrastructure.github;

import dev.craftnudge.config.GitHubProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 verification of {@code X-Hub-Signature-256} over the raw body.
 * Comparison is constant-time. A missing secret rejects every delivery.
 */
@Component
public class WebhookSignatureVerifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
    private static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final GitHubProperties properties;

    public WebhookSignatureVerifier(GitHubProperties properties) { this.properties = properties; }

    public boolean isValid(byte[] payload, String signature) {
        if (payload == null || signature == null || !signature.startsWith(PREFIX)) return false;
        String secret = properties.webhookSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("Webhook secret is not configured, rejecting delivery");
            return false;
        }
        return MessageDigest.isEqual(
                sign(payload, secret).getBytes(StandardCharsets.UTF_8),
                signature.toLowerCase().getBytes(StandardCharsets.UTF_8));
    }

    /** Signature header value for {@code payload}, as the notifier computes it. */
    public static String sign(byte[] payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return PREFIX + HexFormat.of().formatHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
