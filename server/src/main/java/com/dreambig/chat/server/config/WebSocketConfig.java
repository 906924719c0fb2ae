package com.dreambig.chat.server.config;

import com.dreambig.chat.server.ws.ChatWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatHandler;

    @Value("${chat.ws.path:/api/v1/chat/ws/{token}}")
    private String path;

    @Value("${chat.ws.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${chat.ws.max-text-message-size:65536}")
    private int maxTextMessageSize;

    @Value("${chat.ws.idle-timeout-ms:300000}")
    private long idleTimeoutMs;

    public WebSocketConfig(ChatWebSocketHandler chatHandler) {
        this.chatHandler = chatHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // the token segment is parsed by the handler itself
        registry.addHandler(chatHandler, path.replace("{token}", "*"))
                .setAllowedOrigins(allowedOrigins);
    }

    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxTextMessageSize);
        container.setMaxSessionIdleTimeout(idleTimeoutMs);
        return container;
    }
}
