package com.fintech.marketfeed.config;

import com.fintech.marketfeed.live.LiveFeedWebSocketHandler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "marketfeed.live", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WebSocketConfig implements WebSocketConfigurer {

    private final LiveFeedWebSocketHandler handler;
    private final FeedConfiguration configuration;

    public WebSocketConfig(LiveFeedWebSocketHandler handler, FeedConfiguration configuration) {
        this.handler = handler;
        this.configuration = configuration;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, configuration.live().path())
            .setAllowedOrigins(configuration.live().allowedOrigins().toArray(String[]::new));
    }
}
