package xyz.vvrf.reactor.gateway.server.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 记录当前打开的 WebSocket 会话，关闭网关时统一发送正常关闭帧。
 */
@Slf4j
public class WebSocketSessionRegistry {

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public void register(WebSocketSession session) {
        sessions.put(session.getId(), session);
    }

    public void unregister(WebSocketSession session) {
        sessions.remove(session.getId());
    }

    public int size() {
        return sessions.size();
    }

    /**
     * 以 1000 (正常关闭) 关闭所有会话。
     */
    public Mono<Void> closeAll(Duration timeout) {
        if (sessions.isEmpty()) {
            return Mono.empty();
        }
        log.info("正在关闭 {} 个 WebSocket 会话", sessions.size());
        return Flux.fromIterable(new ArrayList<>(sessions.values()))
                .flatMap(session -> session.close(CloseStatus.NORMAL)
                        .onErrorResume(e -> {
                            log.debug("关闭 WebSocket 会话 {} 失败: {}", session.getId(), e.getMessage());
                            return Mono.empty();
                        }))
                .then()
                .timeout(timeout, Mono.fromRunnable(() -> log.warn("关闭 WebSocket 会话超时 ({})", timeout)))
                .doFinally(signal -> sessions.clear());
    }
}
