package com.tenantgate.dispatch.ws;

import com.tenantgate.tenant.TenantControllerRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@ConditionalOnWebApplication
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    static final String CHAT_PATH = "/ws/chat";

    private final TenantControllerRegistry registry;

    public WebSocketConfig(TenantControllerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry handlers) {
        handlers.addHandler(new ChatWebSocketHandler(), CHAT_PATH)
                .addInterceptors(new TunnelHandshakeInterceptor(registry, CHAT_PATH))
                .setAllowedOrigins("*");
    }
}
