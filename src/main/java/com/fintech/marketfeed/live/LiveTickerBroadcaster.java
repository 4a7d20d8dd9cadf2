package com.fintech.marketfeed.live;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.marketfeed.config.FeedConfiguration;
import com.fintech.marketfeed.domain.Ticker;
import com.fintech.marketfeed.ingestion.TickerListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Pushes every persisted ticker to the clients subscribed to its instrument.
 *
 * Sends run on one dedicated thread behind a bounded queue, so a slow client
 * never holds up the persistence consumer. When the queue is full the event is
 * dropped and counted.
 */
public class LiveTickerBroadcaster implements TickerListener {

    private static final Logger log = LoggerFactory.getLogger(LiveTickerBroadcaster.class);

    private final LiveSubscriptions subscriptions;
    private final ObjectMapper objectMapper;
    private final ThreadPoolExecutor sender;

    private final Counter sent;
    private final Counter dropped;
    private final Counter failed;

    public LiveTickerBroadcaster(LiveSubscriptions subscriptions,
                                 ObjectMapper objectMapper,
                                 FeedConfiguration.LiveSettings settings,
                                 MeterRegistry meterRegistry) {
        this.subscriptions = subscriptions;
        this.objectMapper = objectMapper;
        this.sender = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(settings.sendQueueSize()),
            r -> {
                Thread thread = new Thread(r, "live-sender");
                thread.setDaemon(true);
                return thread;
            });

        this.sent = events(meterRegistry, "sent");
        this.dropped = events(meterRegistry, "dropped");
        this.failed = events(meterRegistry, "failed");
    }

    private static Counter events(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("marketfeed.live.events")
            .tag("outcome", outcome)
            .description("Live ticker events by delivery outcome")
            .register(meterRegistry);
    }

    @Override
    public void onTicker(Ticker ticker) {
        if (!subscriptions.hasSubscribers(ticker.symbol())) {
            return;
        }
        try {
            sender.execute(() -> deliver(LiveEvent.ticker(ticker)));
        } catch (RejectedExecutionException e) {
            dropped.increment();
            log.debug("Live send queue full, dropped {} {}", ticker.source(), ticker.symbol());
        }
    }

    void deliver(LiveEvent event) {
        List<WebSocketSession> targets = subscriptions.subscribers(event.instrument());
        if (targets.isEmpty()) {
            return;
        }
        TextMessage message;
        try {
            message = new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            failed.increment();
            log.error("Cannot serialize live event for {} {}", event.exchange(), event.instrument(), e);
            return;
        }
        for (WebSocketSession session : targets) {
            try {
                session.sendMessage(message);
                sent.increment();
            } catch (IOException | IllegalStateException e) {
                failed.increment();
                log.warn("Dropping live client {}: {}", session.getId(), e.getMessage());
                subscriptions.unregister(session.getId());
                closeQuietly(session);
            }
        }
    }

    private static void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SERVER_ERROR);
        } catch (IOException e) {
            log.debug("Close of live client {} failed: {}", session.getId(), e.getMessage());
        }
    }

    public void shutdown() {
        sender.shutdownNow();
    }
}
