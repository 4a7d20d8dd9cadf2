package com.fintech.marketfeed.live;

import com.fintech.marketfeed.config.FeedConfiguration;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Which live clients follow which instrument.
 *
 * Sessions are wrapped on registration so that concurrent sends are serialized
 * and a client that stops reading is closed once it exceeds the configured
 * send time or buffer limit.
 */
public class LiveSubscriptions {

    private final FeedConfiguration.LiveSettings settings;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> instrumentsBySession = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByInstrument = new ConcurrentHashMap<>();

    public LiveSubscriptions(FeedConfiguration.LiveSettings settings) {
        this.settings = settings;
    }

    /** Canonical instrument key: upper case, {@code BTC-USDT} and {@code BTC/USDT} are the same. */
    public static String normalize(String instrument) {
        return instrument.trim().toUpperCase(Locale.ROOT).replace('-', '/');
    }

    public WebSocketSession register(WebSocketSession session) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(
            session, (int) settings.sendTimeLimit().toMillis(), settings.sendBufferSizeLimit());
        sessions.put(session.getId(), decorated);
        instrumentsBySession.put(session.getId(), ConcurrentHashMap.newKeySet());
        return decorated;
    }

    public void unregister(String sessionId) {
        sessions.remove(sessionId);
        Set<String> instruments = instrumentsBySession.remove(sessionId);
        if (instruments != null) {
            for (String instrument : instruments) {
                removeFromInstrument(instrument, sessionId);
            }
        }
    }

    /**
     * @return the normalized instrument key, or null if the session is not registered
     */
    public String subscribe(String sessionId, String instrument) {
        Set<String> instruments = instrumentsBySession.get(sessionId);
        if (instruments == null) {
            return null;
        }
        String key = normalize(instrument);
        instruments.add(key);
        sessionsByInstrument.compute(key, (k, ids) -> {
            Set<String> updated = ids != null ? ids : ConcurrentHashMap.newKeySet();
            updated.add(sessionId);
            return updated;
        });
        return key;
    }

    public String unsubscribe(String sessionId, String instrument) {
        String key = normalize(instrument);
        Set<String> instruments = instrumentsBySession.get(sessionId);
        if (instruments != null) {
            instruments.remove(key);
        }
        removeFromInstrument(key, sessionId);
        return key;
    }

    /** Registered (decorated) session, or null once it has been unregistered. */
    public WebSocketSession session(String sessionId) {
        return sessions.get(sessionId);
    }

    public boolean hasSubscribers(String instrument) {
        return sessionsByInstrument.containsKey(normalize(instrument));
    }

    /** Open sessions following the instrument. */
    public List<WebSocketSession> subscribers(String instrument) {
        Set<String> ids = sessionsByInstrument.get(normalize(instrument));
        if (ids == null) {
            return List.of();
        }
        return ids.stream()
            .map(sessions::get)
            .filter(session -> session != null && session.isOpen())
            .toList();
    }

    public Set<String> instrumentsOf(String sessionId) {
        Set<String> instruments = instrumentsBySession.get(sessionId);
        return instruments == null ? Set.of() : Collections.unmodifiableSet(instruments);
    }

    public int connectedClients() {
        return sessions.size();
    }

    private void removeFromInstrument(String instrument, String sessionId) {
        sessionsByInstrument.computeIfPresent(instrument, (k, ids) -> {
            ids.remove(sessionId);
            return ids.isEmpty() ? null : ids;
        });
    }
}
