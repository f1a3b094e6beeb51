package xyz.vvrf.reactor.gateway.server.websocket;

import org.springframework.core.Ordered;
import org.springframework.web.reactive.handler.AbstractHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Objects;

/**
 * 只把带 {@code Upgrade: websocket} 头的请求交给 WebSocket 处理器，任意路径均可，
 * 其余请求继续由注解控制器处理。
 */
public class WebSocketUpgradeHandlerMapping extends AbstractHandlerMapping {

    private static final String WEBSOCKET = "websocket";

    private final WebSocketHandler handler;

    public WebSocketUpgradeHandlerMapping(WebSocketHandler handler) {
        this.handler = Objects.requireNonNull(handler, "WebSocketHandler 不能为空");
        setOrder(Ordered.HIGHEST_PRECEDENCE);
    }

    @Override
    protected Mono<?> getHandlerInternal(ServerWebExchange exchange) {
        String upgrade = exchange.getRequest().getHeaders().getUpgrade();
        if (upgrade != null && WEBSOCKET.equalsIgnoreCase(upgrade)) {
            return Mono.just(handler);
        }
        return Mono.empty();
    }
}
