package com.ciro.gatemux.spring;

import com.ciro.gatemux.spi.AccessPolicy;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

@Configuration
@EnableWebSocket
public class GatemuxWebSocketConfig implements WebSocketConfigurer {

    private final TerminalSocketHandler handler;
    private final AccessPolicy access;

    public GatemuxWebSocketConfig(TerminalSocketHandler handler, AccessPolicy access) {
        this.handler = handler;
        this.access = access;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws/terminal")
                .setAllowedOrigins("*")
                .addInterceptors(new AccessCheck());
    }

    /** Mismo control que {@link AccessInterceptor}, antes del upgrade. */
    private final class AccessCheck implements HandshakeInterceptor {

        @Override
        public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                       WebSocketHandler wsHandler, Map<String, Object> attributes) {
            String token = AccessInterceptor.presentedToken(
                    request.getHeaders().getFirst("Authorization"),
                    request.getHeaders().getFirst("Cookie"));
            if (access.permits(token)) return true;
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        @Override
        public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Exception exception) {
        }
    }
}
