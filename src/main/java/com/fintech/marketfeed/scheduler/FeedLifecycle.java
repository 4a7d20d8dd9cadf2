package com.fintech.marketfeed.scheduler;

import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.error.PersistenceException;
import com.fintech.marketfeed.storage.TickerSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Process start and stop sequence for the continuous path.
 *
 * Start: reset every configured source's destination exactly once, then arm
 * the polling scheduler, so no tick can reach a file before it was cleared.
 * Runs in an early phase, ahead of the embedded web server, and therefore stops
 * after it.
 */
public class FeedLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(FeedLifecycle.class);

    static final int PHASE = 0;

    private final FeedConfiguration configuration;
    private final TickerSink sink;
    private final PollingScheduler scheduler;

    private volatile boolean running;

    public FeedLifecycle(FeedConfiguration configuration, TickerSink sink, PollingScheduler scheduler) {
        this.configuration = configuration;
        this.sink = sink;
        this.scheduler = scheduler;
    }

    @Override
    public void start() {
        for (String source : configuration.sourceIds()) {
            try {
                sink.reset(source);
            } catch (PersistenceException e) {
                // Logged by the sink; polling still runs and later appends retry the destination
                log.warn("Destination for {} could not be reset: {}", source, e.getMessage());
            }
        }

        if (configuration.polling().enabled()) {
            scheduler.start();
        } else {
            log.info("Polling disabled; {} sources available for on-demand queries only", configuration.sources().size());
        }
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
