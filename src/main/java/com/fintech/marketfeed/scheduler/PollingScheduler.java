package com.fintech.marketfeed.scheduler;

import com.fintech.marketfeed.connector.ConnectorRegistry;
import com.fintech.marketfeed.domain.PollState;
import com.fintech.marketfeed.domain.PollTarget;
import com.fintech.marketfeed.ingestion.TickerEventPublisher;
import com.fintech.marketfeed.normalization.MarketDataNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one independent polling loop per (source, symbol) target.
 *
 * A single timer thread arms ticks; fetches run on a dedicated pool with one
 * thread per target, so a slow vendor never holds up unrelated targets. A
 * target's next tick is armed only after its current tick finishes, with delay
 * {@code max(0, interval - elapsed)}: intervals are measured start to start and
 * a tick that overruns its interval is followed immediately, never overlapped.
 *
 * The target set is fixed at construction. {@link #stop()} cancels every armed
 * timer, interrupts in-flight fetches and waits for the pool to terminate.
 */
public class PollingScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollingScheduler.class);

    private final Map<String, PollTask> tasks;
    private final InitialDelay initialDelay;
    private final Duration shutdownTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService timer;
    private ExecutorService fetchPool;

    public PollingScheduler(List<PollTarget> targets,
                            ConnectorRegistry connectors,
                            MarketDataNormalizer normalizer,
                            TickerEventPublisher publisher,
                            InitialDelay initialDelay,
                            Duration shutdownTimeout,
                            MeterRegistry meterRegistry) {
        Map<String, PollTask> built = new LinkedHashMap<>();
        for (PollTarget target : targets) {
            built.put(target.key(), new PollTask(target, connectors.forTarget(target), normalizer, publisher, meterRegistry));
        }
        this.tasks = Collections.unmodifiableMap(built);
        this.initialDelay = initialDelay;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Arms the first tick of every target. All targets start together; the first
     * tick is immediate or one interval away depending on {@link InitialDelay}.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Polling scheduler already running");
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(namedThreads("poll-timer"));
        fetchPool = Executors.newFixedThreadPool(Math.max(1, tasks.size()), namedThreads("poll-fetch"));

        for (PollTask task : tasks.values()) {
            long delayMs = initialDelay == InitialDelay.IMMEDIATE ? 0 : task.target().interval().toMillis();
            arm(task, delayMs);
        }
        log.info("Polling scheduler started: {} targets, initialDelay={}", tasks.size(), initialDelay);
    }

    /**
     * Cancels pending ticks and in-flight fetches and waits for the fetch pool to
     * terminate, at most the configured shutdown timeout.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping polling scheduler...");

        for (PollTask task : tasks.values()) {
            ScheduledFuture<?> pending = task.pendingTimer;
            if (pending != null) {
                pending.cancel(false);
            }
            Future<?> inFlight = task.inFlight;
            if (inFlight != null) {
                inFlight.cancel(true);
            }
        }
        timer.shutdownNow();
        fetchPool.shutdownNow();

        try {
            if (!fetchPool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Poll fetches did not terminate within {}", shutdownTimeout);
            }
            timer.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for poll fetches to terminate");
        }
        log.info("Polling scheduler stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs one tick for the target on the calling thread, outside the timer.
     * Subject to the same in-flight guard as scheduled ticks.
     *
     * @return false if the tick was skipped because another one is in flight
     * @throws IllegalArgumentException if the target is not scheduled here
     */
    public boolean pollOnce(PollTarget target) {
        return task(target).runTick();
    }

    public PollState state(PollTarget target) {
        return task(target).state();
    }

    public long completedTicks(PollTarget target) {
        return task(target).completedTicks();
    }

    public long failedTicks(PollTarget target) {
        return task(target).failedTicks();
    }

    public List<PollTarget> targets() {
        List<PollTarget> targets = new ArrayList<>(tasks.size());
        tasks.values().forEach(task -> targets.add(task.target()));
        return targets;
    }

    private PollTask task(PollTarget target) {
        PollTask task = tasks.get(target.key());
        if (task == null) {
            throw new IllegalArgumentException("Not a scheduled poll target: " + target.key());
        }
        return task;
    }

    private void arm(PollTask task, long delayMs) {
        if (!running.get()) {
            return;
        }
        try {
            task.pendingTimer = timer.schedule(() -> submit(task), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Timer rejected {} during shutdown", task.target().key());
        }
    }

    private void submit(PollTask task) {
        if (!running.get()) {
            return;
        }
        try {
            task.inFlight = fetchPool.submit(() -> tick(task));
        } catch (RejectedExecutionException e) {
            log.debug("Fetch pool rejected {} during shutdown", task.target().key());
        }
    }

    private void tick(PollTask task) {
        long startedAt = System.nanoTime();
        try {
            task.runTick();
        } finally {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            arm(task, Math.max(0, task.target().interval().toMillis() - elapsedMs));
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };
    }
}
