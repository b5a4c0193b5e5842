package dev.craftnudge.pipeline;

import dev.craftnudge.config.AiProperties;
import dev.craftnudge.domain.enums.AgentKind;
import dev.craftnudge.domain.valueobject.AnalysisOutcome;
import dev.craftnudge.domain.valueobject.CommitSnapshot;
import dev.craftnudge.exception.AnalysisException;
import dev.craftnudge.infrastructure.ai.AnalysisEngine;
import dev.craftnudge.infrastructure.ai.AnalysisText;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the analysis engine on the analysis pool with a hard timeout and
 * classifies whatever comes back into an {@link AnalysisOutcome}. Never throws.
 *
 * <p>A call that outlives the timeout is cancelled with interruption, so a
 * hung engine call holds its pool thread no longer than the timeout.
 */
@Component
public class AnalysisGateway {

    private static final Logger log = LoggerFactory.getLogger(AnalysisGateway.class);

    private final AnalysisEngine engine;
    private final ExecutorService analysisExecutor;
    private final Duration timeout;

    public AnalysisGateway(AnalysisEngine engine,
                           @Qualifier("analysisExecutorService") ExecutorService analysisExecutor,
                           AiProperties aiProperties) {
        this.engine = engine;
        this.analysisExecutor = analysisExecutor;
        this.timeout = aiProperties.analysisTimeout();
    }

    public AnalysisOutcome analyze(CommitSnapshot commit, AgentKind kind) {
        long start = System.nanoTime();
        Future<AnalysisText> call;
        try {
            call = analysisExecutor.submit(() -> engine.analyze(commit, commit.diffSummary(), kind));
        } catch (RejectedExecutionException e) {
            return AnalysisOutcome.transientFailure("Analysis pool rejected the call", elapsedSince(start));
        }
        try {
            AnalysisText text = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return AnalysisOutcome.success(text.text(), text.model(), elapsedSince(start));
        } catch (TimeoutException e) {
            // interrupts the engine call and frees its pool thread
            call.cancel(true);
            log.warn("{} of commit {} timed out after {}", kind, commit.shortHash(), timeout);
            return AnalysisOutcome.transientFailure("Analysis timed out after " + timeout, elapsedSince(start));
        } catch (ExecutionException e) {
            return classify(e.getCause() != null ? e.getCause() : e, commit, kind, elapsedSince(start));
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return AnalysisOutcome.transientFailure("Analysis interrupted", elapsedSince(start));
        }
    }

    private AnalysisOutcome classify(Throwable cause, CommitSnapshot commit, AgentKind kind, Duration elapsed) {
        if (cause instanceof AnalysisException ae) {
            if (ae.isRetryable()) {
                log.warn("{} of commit {} failed transiently: {}", kind, commit.shortHash(), ae.getMessage());
                return AnalysisOutcome.transientFailure(ae.getMessage(), elapsed);
            }
            log.error("{} of commit {} failed permanently: {}", kind, commit.shortHash(), ae.getMessage());
            return AnalysisOutcome.permanentFailure(ae.getMessage(), elapsed);
        }
        if (cause instanceof CallNotPermittedException) {
            log.warn("{} of commit {} skipped, circuit open", kind, commit.shortHash());
            return AnalysisOutcome.transientFailure("Analysis engine circuit open", elapsed);
        }
        if (cause instanceof RequestNotPermitted) {
            log.warn("{} of commit {} rate limited", kind, commit.shortHash());
            return AnalysisOutcome.transientFailure("Analysis engine rate limited", elapsed);
        }
        log.error("{} of commit {} failed unexpectedly", kind, commit.shortHash(), cause);
        return AnalysisOutcome.transientFailure("Unexpected analysis failure: " + cause.getMessage(), elapsed);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
