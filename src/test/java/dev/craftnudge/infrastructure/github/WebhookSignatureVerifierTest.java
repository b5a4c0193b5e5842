package dev.craftnudge.infrastructure.github;

import dev.craftnudge.config.GitHubProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final byte[] BODY = "{\"ref\":\"refs/heads/main\"}".getBytes(StandardCharsets.UTF_8);

    private final WebhookSignatureVerifier verifier =
            new WebhookSignatureVerifier(new GitHubProperties("It's a Secret to Everybody", null, null));

    @Test
    @DisplayName("matches the documented GitHub example signature")
    void knownVector() {
        byte[] body = "Hello, World!".getBytes(StandardCharsets.UTF_8);
        String expected = "sha256=757107ea0eb2509fc211221cce984b8a37570b6d7586c22c46f4379c8b043e17";

        assertThat(WebhookSignatureVerifier.sign(body, "It's a Secret to Everybody")).isEqualTo(expected);
        assertThat(verifier.isValid(body, expected)).isTrue();
    }

    @Test
    @DisplayName("accepts upper-case hex")
    void upperCaseHex() {
        String signature = WebhookSignatureVerifier.sign(BODY, "It's a Secret to Everybody");
        assertThat(verifier.isValid(BODY, "sha256=" + signature.substring(7).toUpperCase())).isTrue();
    }

    @Test
    @DisplayName("rejects a tampered body")
    void tamperedBody() {
        String signature = WebhookSignatureVerifier.sign(BODY, "It's a Secret to Everybody");
        byte[] tampered = "{\"ref\":\"refs/heads/evil\"}".getBytes(StandardCharsets.UTF_8);

        assertThat(verifier.isValid(tampered, signature)).isFalse();
    }

    @Test
    @DisplayName("rejects missing, unprefixed or foreign signatures")
    void malformedSignatures() {
        String hex = WebhookSignatureVerifier.sign(BODY, "It's a Secret to Everybody").substring(7);

        assertThat(verifier.isValid(BODY, null)).isFalse();
        assertThat(verifier.isValid(BODY, hex)).isFalse();
        assertThat(verifier.isValid(BODY, "sha1=" + hex)).isFalse();
        assertThat(verifier.isValid(BODY, WebhookSignatureVerifier.sign(BODY, "another secret"))).isFalse();
    }

    @Test
    @DisplayName("rejects everything when no secret is configured")
    void noSecret() {
        WebhookSignatureVerifier unconfigured = new WebhookSignatureVerifier(new GitHubProperties("", null, null));

        assertThat(unconfigured.isValid(BODY, WebhookSignatureVerifier.sign(BODY, ""))).isFalse();
    }
}
