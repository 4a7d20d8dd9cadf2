package com.fintech.marketfeed.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.marketfeed.connector.ExchangeConnector;
import com.fintech.marketfeed.domain.PollState;
import com.fintech.marketfeed.domain.PollTarget;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.error.ConnectorException;
import com.fintech.marketfeed.error.NormalizationException;
import com.fintech.marketfeed.ingestion.TickerEventPublisher;
import com.fintech.marketfeed.normalization.MarketDataNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One poll target's state machine:
 * IDLE -> FETCHING -> NORMALIZING -> PERSISTING -> IDLE, or FETCHING/NORMALIZING -> FAILED -> IDLE.
 *
 * Entry into FETCHING is a compare-and-set from IDLE, so a tick that finds the
 * previous one still in flight is skipped rather than overlapped.
 */
final class PollTask {

    private static final Logger log = LoggerFactory.getLogger(PollTask.class);

    private final PollTarget target;
    private final ExchangeConnector connector;
    private final MarketDataNormalizer normalizer;
    private final TickerEventPublisher publisher;

    private final AtomicReference<PollState> state = new AtomicReference<>(PollState.IDLE);
    private final AtomicLong completedTicks = new AtomicLong(0);
    private final AtomicLong failedTicks = new AtomicLong(0);

    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter skippedCounter;
    private final Timer fetchTimer;
    private final MeterRegistry meterRegistry;

    // Written by the scheduler thread, read on shutdown
    volatile ScheduledFuture<?> pendingTimer;
    volatile Future<?> inFlight;

    PollTask(PollTarget target,
             ExchangeConnector connector,
             MarketDataNormalizer normalizer,
             TickerEventPublisher publisher,
             MeterRegistry meterRegistry) {
        this.target = target;
        this.connector = connector;
        this.normalizer = normalizer;
        this.publisher = publisher;
        this.meterRegistry = meterRegistry;

        this.successCounter = tickCounter(meterRegistry, "success");
        this.failureCounter = tickCounter(meterRegistry, "failed");
        this.skippedCounter = tickCounter(meterRegistry, "skipped");
        this.fetchTimer = Timer.builder("marketfeed.poll.fetch.time")
            .tag("source", target.source())
            .description("Vendor ticker fetch latency")
            .register(meterRegistry);
    }

    /**
     * Runs one tick on the calling thread.
     *
     * @return false if the tick was skipped because another one is in flight
     */
    boolean runTick() {
        if (!state.compareAndSet(PollState.IDLE, PollState.FETCHING)) {
            skippedCounter.increment();
            log.debug("Skipping tick for {}: previous tick still {}", target.key(), state.get());
            return false;
        }

        try {
            Timer.Sample sample = Timer.start(meterRegistry);
            JsonNode raw;
            try {
                raw = connector.fetchTicker(target.symbol());
            } finally {
                sample.stop(fetchTimer);
            }

            state.set(PollState.NORMALIZING);
            Ticker ticker = normalizer.toTicker(raw, target.source(), target.symbol());

            state.set(PollState.PERSISTING);
            if (!publisher.tryPublish(ticker)) {
                log.warn("Ticker for {} dropped: persistence buffer full", target.key());
            }

            completedTicks.incrementAndGet();
            successCounter.increment();
            if (log.isDebugEnabled()) {
                log.debug("Polled {} last={}", target.key(), ticker.last());
            }

        } catch (ConnectorException | NormalizationException e) {
            fail();
            log.warn("Poll {} failed: {}", target.key(), e.getMessage());

        } catch (RuntimeException e) {
            fail();
            log.error("Unexpected error polling {}", target.key(), e);

        } finally {
            state.set(PollState.IDLE);
        }
        return true;
    }

    private void fail() {
        state.set(PollState.FAILED);
        failedTicks.incrementAndGet();
        failureCounter.increment();
    }

    PollTarget target() {
        return target;
    }

    PollState state() {
        return state.get();
    }

    long completedTicks() {
        return completedTicks.get();
    }

    long failedTicks() {
        return failedTicks.get();
    }

    private Counter tickCounter(MeterRegistry registry, String outcome) {
        return Counter.builder("marketfeed.poll.ticks")
            .tag("source", target.source())
            .tag("outcome", outcome)
            .description("Poll ticks by outcome")
            .register(registry);
    }
}
