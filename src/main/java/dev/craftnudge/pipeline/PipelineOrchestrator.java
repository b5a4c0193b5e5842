package dev.craftnudge.pipeline;

import dev.craftnudge.config.PipelineProperties;
import dev.craftnudge.domain.enums.EventState;
import dev.craftnudge.exception.StoreUnavailableException;
import dev.craftnudge.service.PollReport;
import dev.craftnudge.service.ReconciliationPoller;
import dev.craftnudge.store.EntityStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the pipeline lifecycle: a timer that periodically reclaims stale
 * claims, runs a reconciliation pass and drains the event queue.
 *
 * <p>Cycles hold {@code cycleLock}, so a timer cycle, a nudge and
 * {@link #runOnce()} never overlap. {@link #stop()} cancels the timer, halts
 * the dispatcher and waits for the in-flight cycle to finish.
 */
@Component
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);
    private static final String MDC_CORRELATION_ID = "correlationId";

    private final EventDispatcher dispatcher;
    private final ReconciliationPoller poller;
    private final EntityStore store;
    private final PipelineProperties properties;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicBoolean nudgeQueued = new AtomicBoolean(false);
    private ScheduledFuture<?> timer;
    private volatile Duration interval;
    private volatile Instant lastCycleAt;

    public PipelineOrchestrator(EventDispatcher dispatcher,
                                ReconciliationPoller poller,
                                EntityStore store,
                                PipelineProperties properties,
                                @Qualifier("pipelineScheduler") TaskScheduler scheduler,
                                Clock clock) {
        this.dispatcher = dispatcher;
        this.poller = poller;
        this.store = store;
        this.properties = properties;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    // ── Lifecycle ─────────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        try {
            int reclaimed = reclaimStale(clock.instant());
            if (reclaimed > 0) log.info("Reclaimed {} abandoned events at startup", reclaimed);
        } catch (StoreUnavailableException e) {
            log.error("Startup reclaim failed, cycles will retry it: {}", e.getMessage());
        }
        if (properties.autoStart()) start(properties.cycleInterval());
    }

    /**
     * Schedules cycles at a fixed delay. Returns false when already running.
     */
    public synchronized boolean start(Duration requestedInterval) {
        if (timer != null) {
            log.info("Pipeline already running every {}", interval);
            return false;
        }
        Duration effective = requestedInterval == null || requestedInterval.isNegative() || requestedInterval.isZero()
                ? properties.cycleInterval() : requestedInterval;
        dispatcher.resume();
        interval = effective;
        timer = scheduler.scheduleWithFixedDelay(this::timerCycle, effective);
        log.info("Pipeline started, cycle every {}", effective);
        return true;
    }

    /**
     * Cancels the timer and waits up to the drain timeout for the in-flight
     * cycle. Returns false when not running.
     */
    public boolean stop() {
        ScheduledFuture<?> current;
        synchronized (this) {
            current = timer;
            timer = null;
            interval = null;
        }
        if (current == null) return false;
        current.cancel(false);
        dispatcher.halt();
        try {
            if (cycleLock.tryLock(properties.drainTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                try {
                    dispatcher.resume();
                } finally {
                    cycleLock.unlock();
                }
                log.info("Pipeline stopped");
            } else {
                log.warn("In-flight cycle still running after {}; dispatcher stays halted", properties.drainTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the in-flight cycle");
        }
        return true;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    public synchronized boolean isRunning() {
        return timer != null;
    }

    // ── Cycles ────────────────────────────────────────────────────

    /**
     * Runs one full cycle on the calling thread, waiting for any cycle in
     * progress to finish first.
     */
    public CycleReport runOnce() {
        cycleLock.lock();
        try {
            return runCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Asks for an early drain after new events were queued. Coalesces: at most
     * one nudge is waiting at any time.
     */
    public void nudge() {
        if (!isRunning() || !nudgeQueued.compareAndSet(false, true)) return;
        scheduler.schedule(() -> {
            nudgeQueued.set(false);
            if (!cycleLock.tryLock()) return;
            try {
                dispatcher.drain();
            } catch (RuntimeException e) {
                log.error("Nudged drain failed: {}", e.getMessage(), e);
            } finally {
                cycleLock.unlock();
            }
        }, clock.instant());
    }

    private void timerCycle() {
        if (!cycleLock.tryLock()) {
            log.debug("Previous cycle still running, skipping");
            return;
        }
        try {
            runCycle();
        } catch (RuntimeException e) {
            // must not escape, the scheduler would cancel the timer
            log.error("Pipeline cycle failed: {}", e.getMessage(), e);
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleReport runCycle() {
        MDC.put(MDC_CORRELATION_ID, "cycle-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            Instant startedAt = clock.instant();
            int reclaimed = reclaimStale(startedAt);
            PollReport poll = pollIfEnabled();
            DrainReport drain = dispatcher.drain();
            Instant finishedAt = clock.instant();
            lastCycleAt = finishedAt;
            CycleReport report = new CycleReport(startedAt, finishedAt, reclaimed, poll, drain);
            log.info("Cycle finished: reclaimed={}, queuedByPoll={}, processed={}",
                    reclaimed, poll.queued(), drain.processed());
            return report;
        } finally {
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private int reclaimStale(Instant now) {
        int reclaimed = store.reclaimStale(now.minus(properties.staleClaimThreshold()));
        if (reclaimed > 0) log.warn("Returned {} stale IN_PROGRESS events to PENDING", reclaimed);
        return reclaimed;
    }

    private PollReport pollIfEnabled() {
        if (!poller.isEnabled()) return PollReport.skipped();
        try {
            return poller.poll();
        } catch (RuntimeException e) {
            log.error("Reconciliation pass failed, draining anyway: {}", e.getMessage());
            return PollReport.skipped();
        }
    }

    // ── Status ────────────────────────────────────────────────────

    public PipelineStatus status() {
        boolean running;
        Duration currentInterval;
        synchronized (this) {
            running = timer != null;
            currentInterval = interval;
        }
        return new PipelineStatus(
                running,
                lastCycleAt,
                currentInterval,
                store.countEvents(EventState.PENDING),
                store.countEvents(EventState.IN_PROGRESS),
                store.countEvents(EventState.FAILED_TRANSIENT),
                store.countEvents(EventState.FAILED_PERMANENT),
                store.countEvents(EventState.DONE));
    }
}
