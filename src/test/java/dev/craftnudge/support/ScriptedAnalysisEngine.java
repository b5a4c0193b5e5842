package dev.craftnudge.support;

import dev.craftnudge.domain.enums.AgentKind;
import dev.craftnudge.domain.valueobject.CommitSnapshot;
import dev.craftnudge.exception.AnalysisPermanentException;
import dev.craftnudge.exception.AnalysisTransientException;
import dev.craftnudge.infrastructure.ai.AnalysisEngine;
import dev.craftnudge.infrastructure.ai.AnalysisText;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Analysis engine that answers from a script: queued responses first, then
 * the default (success). Records every call.
 */
public class ScriptedAnalysisEngine implements AnalysisEngine {

    public record Call(String hash, AgentKind kind) {}

    private final Deque<Supplier<AnalysisText>> script = new ArrayDeque<>();
    private final List<Call> calls = new ArrayList<>();
    private Supplier<AnalysisText> fallback = () -> new AnalysisText("Looks good.", "test-model");

    public synchronized ScriptedAnalysisEngine thenSucceed(String text) {
        script.add(() -> new AnalysisText(text, "test-model"));
        return this;
    }

    /** Runs {@code sideEffect} while the call is in flight, then succeeds. */
    public synchronized ScriptedAnalysisEngine thenSucceedAfter(Runnable sideEffect, String text) {
        script.add(() -> {
            sideEffect.run();
            return new AnalysisText(text, "test-model");
        });
        return this;
    }

    public synchronized ScriptedAnalysisEngine thenTimeOut() {
        script.add(() -> { throw new AnalysisTransientException("Analysis timed out"); });
        return this;
    }

    public synchronized ScriptedAnalysisEngine thenReject() {
        script.add(() -> { throw new AnalysisPermanentException("Input rejected"); });
        return this;
    }

    public synchronized void alwaysTimeOut() {
        fallback = () -> { throw new AnalysisTransientException("Analysis timed out"); };
    }

    @Override
    public AnalysisText analyze(CommitSnapshot commit, String diffSummary, AgentKind kind) {
        Supplier<AnalysisText> next;
        synchronized (this) {
            calls.add(new Call(commit.hash(), kind));
            next = script.isEmpty() ? fallback : script.poll();
        }
        return next.get();
    }

    public synchronized List<Call> calls() {
        return List.copyOf(calls);
    }
}
