package com.fintech.marketfeed.live;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Live ticker endpoint.
 *
 * Clients send {@code {"action":"subscribe","instrument":"BTC/USDT"}} (or
 * {@code "instruments":[...]}) and {@code "unsubscribe"} with the same shape.
 * Every request is acknowledged; malformed requests get an {@code error} reply
 * and leave the connection open.
 */
public class LiveFeedWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(LiveFeedWebSocketHandler.class);

    private final LiveSubscriptions subscriptions;
    private final ObjectMapper objectMapper;

    public LiveFeedWebSocketHandler(LiveSubscriptions subscriptions, ObjectMapper objectMapper) {
        this.subscriptions = subscriptions;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        subscriptions.register(session);
        log.info("Live client connected: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        JsonNode request;
        try {
            request = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            reply(session, error("Malformed JSON"));
            return;
        }

        String action = request.path("action").asText("");
        List<String> instruments = instruments(request);
        if (instruments.isEmpty()) {
            reply(session, error("instrument or instruments is required"));
            return;
        }

        List<String> keys = new ArrayList<>();
        if ("subscribe".equalsIgnoreCase(action)) {
            for (String instrument : instruments) {
                keys.add(subscriptions.subscribe(session.getId(), instrument));
            }
            log.info("Live client {} subscribed to {}", session.getId(), keys);
            reply(session, ack("subscribed", keys));
        } else if ("unsubscribe".equalsIgnoreCase(action)) {
            for (String instrument : instruments) {
                keys.add(subscriptions.unsubscribe(session.getId(), instrument));
            }
            log.info("Live client {} unsubscribed from {}", session.getId(), keys);
            reply(session, ack("unsubscribed", keys));
        } else {
            reply(session, error("Unknown action '" + action + "'"));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        subscriptions.unregister(session.getId());
        log.info("Live client disconnected: {} ({})", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        subscriptions.unregister(session.getId());
        log.warn("Transport error for live client {}: {}", session.getId(), exception.getMessage());
    }

    private static List<String> instruments(JsonNode request) {
        List<String> instruments = new ArrayList<>();
        JsonNode single = request.get("instrument");
        if (single != null && single.isTextual() && !single.asText().isBlank()) {
            instruments.add(single.asText());
        }
        JsonNode many = request.get("instruments");
        if (many != null && many.isArray()) {
            for (JsonNode node : many) {
                if (node.isTextual() && !node.asText().isBlank()) {
                    instruments.add(node.asText());
                }
            }
        }
        return instruments;
    }

    private ObjectNode ack(String type, List<String> instruments) {
        ObjectNode node = objectMapper.createObjectNode().put("type", type);
        ArrayNode array = node.putArray("instruments");
        for (String instrument : instruments) {
            array.add(instrument);
        }
        return node;
    }

    private ObjectNode error(String message) {
        return objectMapper.createObjectNode().put("type", "error").put("message", message);
    }

    // Replies go through the registered decorator so they never interleave with broadcasts
    private void reply(WebSocketSession session, ObjectNode body) throws IOException {
        WebSocketSession target = subscriptions.session(session.getId());
        (target != null ? target : session).sendMessage(new TextMessage(objectMapper.writeValueAsString(body)));
    }
}
