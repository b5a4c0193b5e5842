package dev.craftnudge.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

  private final RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(30), Duration.ofMinutes(30), 5);

  @Test
  @DisplayName("backoff doubles per attempt starting from the base")
  void doublesPerAttempt() {
    assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofSeconds(30));
    assertThat(policy.backoffFor(2)).isEqualTo(Duration.ofSeconds(60));
    assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofSeconds(120));
    assertThat(policy.backoffFor(4)).isEqualTo(Duration.ofSeconds(240));
  }

  @Test
  @DisplayName("backoff is capped at the maximum, including for huge attempt numbers")
  void capsAtMaximum() {
    assertThat(policy.backoffFor(7)).isEqualTo(Duration.ofMinutes(30));
    assertThat(policy.backoffFor(63)).isEqualTo(Duration.ofMinutes(30));
    assertThat(policy.backoffFor(Integer.MAX_VALUE)).isEqualTo(Duration.ofMinutes(30));
  }

  @Test
  @DisplayName("attempt numbers below one are treated as the first attempt")
  void clampsLowAttempts() {
    assertThat(policy.backoffFor(0)).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  @DisplayName("attempts are exhausted at the cap")
  void exhaustedAtCap() {
    assertThat(policy.exhausted(4)).isFalse();
    assertThat(policy.exhausted(5)).isTrue();
    assertThat(policy.exhausted(6)).isTrue();
  }

  @Test
  @DisplayName("rejects a maximum below the base")
  void rejectsInvertedBounds() {
    assertThatThrownBy(() -> new RetryPolicy(Duration.ofMinutes(5), Duration.ofMinutes(1), 3))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
