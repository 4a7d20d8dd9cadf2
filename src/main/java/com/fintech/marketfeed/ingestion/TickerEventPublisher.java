package com.fintech.marketfeed.ingestion;

import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.error.PersistenceException;
import com.fintech.marketfeed.storage.TickerSink;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventFactory;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands normalized tickers from fetch threads to the persistence sink and then
 * to any registered {@link TickerListener}s.
 *
 * Many producers (poll tasks, on-demand fetches), exactly one consumer thread:
 * the sink is only ever written from that thread, so a fetch being cancelled
 * on shutdown can never interrupt a file write halfway. Shutdown drains every
 * event already published before returning.
 */
public class TickerEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(TickerEventPublisher.class);

    private final TickerSink sink;
    private final List<TickerListener> listeners;
    private final FeedConfiguration.PersistenceSettings settings;

    private final AtomicLong ringBufferEventsDropped = new AtomicLong(0);

    private Disruptor<TickerEventWrapper> disruptor;
    private RingBuffer<TickerEventWrapper> ringBuffer;

    public TickerEventPublisher(TickerSink sink, FeedConfiguration.PersistenceSettings settings, MeterRegistry meterRegistry) {
        this(sink, List.of(), settings, meterRegistry);
    }

    public TickerEventPublisher(TickerSink sink,
                                List<TickerListener> listeners,
                                FeedConfiguration.PersistenceSettings settings,
                                MeterRegistry meterRegistry) {
        this.sink = sink;
        this.listeners = List.copyOf(listeners);
        this.settings = settings;

        meterRegistry.gauge("marketfeed.ringbuffer.events.dropped", ringBufferEventsDropped);
    }

    @PostConstruct
    public void start() {
        int bufferSize = settings.ringBufferSize();

        EventFactory<TickerEventWrapper> eventFactory = TickerEventWrapper::new;

        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("ticker-persistence-" + counter.incrementAndGet());
                thread.setDaemon(false);
                return thread;
            }
        };

        WaitStrategy waitStrategy = createWaitStrategy();

        disruptor = new Disruptor<>(
            eventFactory,
            bufferSize,
            threadFactory,
            ProducerType.MULTI,
            waitStrategy
        );

        disruptor.handleEventsWith(this::handleEvent);

        disruptor.setDefaultExceptionHandler(new ExceptionHandler<TickerEventWrapper>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, TickerEventWrapper event) {
                log.error("Exception persisting event at sequence {}: {}", sequence, event.ticker, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Exception during Disruptor startup", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Exception during Disruptor shutdown", ex);
            }
        });

        ringBuffer = disruptor.start();

        log.info("Persistence Disruptor started: bufferSize={}, waitStrategy={}",
            bufferSize, waitStrategy.getClass().getSimpleName());
    }

    /**
     * Attempts to publish without blocking.
     *
     * @return true if published, false if the buffer is full and the ticker was dropped
     */
    public boolean tryPublish(Ticker ticker) {
        try {
            long sequence = ringBuffer.tryNext();
            try {
                ringBuffer.get(sequence).ticker = ticker;
                return true;
            } finally {
                ringBuffer.publish(sequence);
            }
        } catch (InsufficientCapacityException e) {
            ringBufferEventsDropped.incrementAndGet();
            log.warn("Persistence buffer full, dropped ticker {} {}", ticker.source(), ticker.symbol());
            return false;
        }
    }

    private void handleEvent(TickerEventWrapper wrapper, long sequence, boolean endOfBatch) {
        Ticker ticker = wrapper.ticker;
        wrapper.ticker = null;
        if (ticker == null) {
            return;
        }
        try {
            sink.appendTicker(ticker);
        } catch (PersistenceException e) {
            // Already logged with escalation by the sink; the next ticker is attempted as usual
            log.debug("Ticker {} {} not persisted at sequence {}", ticker.source(), ticker.symbol(), sequence);
        }
        for (TickerListener listener : listeners) {
            try {
                listener.onTicker(ticker);
            } catch (RuntimeException e) {
                log.warn("Ticker listener {} failed for {} {}: {}",
                    listener.getClass().getSimpleName(), ticker.source(), ticker.symbol(), e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (disruptor != null) {
            log.info("Draining persistence Disruptor...");
            disruptor.shutdown();
            log.info("Persistence Disruptor shutdown complete");
        }
    }

    private WaitStrategy createWaitStrategy() {
        String strategy = settings.waitStrategy();

        return switch (strategy.toUpperCase()) {
            case "BLOCKING" -> new BlockingWaitStrategy();
            case "SLEEPING" -> new SleepingWaitStrategy();
            case "YIELDING" -> new YieldingWaitStrategy();
            case "BUSY_SPIN" -> new BusySpinWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy: {}, using BLOCKING", strategy);
                yield new BlockingWaitStrategy();
            }
        };
    }

    /**
     * Ring buffer slot.
     */
    private static class TickerEventWrapper {
        Ticker ticker;
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public long getRingBufferEventsDropped() {
        return ringBufferEventsDropped.get();
    }
}
