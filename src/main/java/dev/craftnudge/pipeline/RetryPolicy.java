package dev.craftnudge.pipeline;

import dev.craftnudge.config.PipelineProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Exponential backoff with a ceiling: {@code min(base * 2^(attempt-1), max)}.
 */
@Component
public class RetryPolicy {

    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final int maxAttempts;

    public RetryPolicy(PipelineProperties properties) {
        this(properties.baseBackoff(), properties.maxBackoff(), properties.maxAttempts());
    }

    RetryPolicy(Duration baseBackoff, Duration maxBackoff, int maxAttempts) {
        if (baseBackoff.isNegative() || baseBackoff.isZero())
            throw new IllegalArgumentException("baseBackoff must be positive");
        if (maxBackoff.compareTo(baseBackoff) < 0)
            throw new IllegalArgumentException("maxBackoff must not be below baseBackoff");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        this.baseBackoff = baseBackoff;
        this.maxBackoff = maxBackoff;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the retry that follows the given (1-based) attempt.
     */
    public Duration backoffFor(int attempt) {
        int exponent = Math.max(attempt, 1) - 1;
        if (exponent >= 62) return maxBackoff;
        try {
            long millis = Math.multiplyExact(baseBackoff.toMillis(), 1L << exponent);
            Duration delay = Duration.ofMillis(millis);
            return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
        } catch (ArithmeticException overflow) {
            return maxBackoff;
        }
    }

    /** True once an event has used every attempt it is allowed. */
    public boolean exhausted(int attempts) {
        return attempts >= maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
