package xyz.vvrf.reactor.gateway.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import xyz.vvrf.reactor.gateway.pool.ConnectionPool;
import xyz.vvrf.reactor.gateway.server.grpc.GatewayGrpcServer;
import xyz.vvrf.reactor.gateway.server.websocket.WebSocketSessionRegistry;
import xyz.vvrf.reactor.gateway.streaming.RequestStreamer;

import java.time.Duration;
import java.util.Objects;

/**
 * 网关的启动与优雅关闭。
 * <p>
 * 启动：连接池开始探测，gRPC 服务器开始监听，健康状态置为 SERVING。<br>
 * 关闭：健康状态置为 NOT_SERVING，停止接收新请求并等待在途请求 (最多 drain 时长)，
 * 关闭 WebSocket 会话，立即停止 gRPC 服务器，最后关闭连接池。
 * 使用默认 phase，因此先于 Web 服务器停止。
 */
@Slf4j
public class GatewayLifecycle implements SmartLifecycle {

    private static final Duration SESSION_CLOSE_TIMEOUT = Duration.ofSeconds(1);

    private final ConnectionPool connectionPool;
    private final GatewayGrpcServer grpcServer;
    private final RequestStreamer streamer;
    private final WebSocketSessionRegistry sessions;
    private volatile boolean running;

    /**
     * @param grpcServer 未启用 gRPC 时为 null
     */
    public GatewayLifecycle(ConnectionPool connectionPool,
                            GatewayGrpcServer grpcServer,
                            RequestStreamer streamer,
                            WebSocketSessionRegistry sessions) {
        this.connectionPool = Objects.requireNonNull(connectionPool, "ConnectionPool 不能为空");
        this.grpcServer = grpcServer;
        this.streamer = Objects.requireNonNull(streamer, "RequestStreamer 不能为空");
        this.sessions = Objects.requireNonNull(sessions, "WebSocketSessionRegistry 不能为空");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        connectionPool.start();
        if (grpcServer != null) {
            grpcServer.start();
            grpcServer.markServing();
        }
        running = true;
        log.info("网关已启动。gRPC: {}", grpcServer != null ? "端口 " + grpcServer.getPort() : "未启用");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Duration drain = streamer.getSettings().getDrain();
        log.info("网关开始优雅关闭。在途请求数: {}，drain: {}", streamer.getInFlight(), drain);

        if (grpcServer != null) {
            grpcServer.markNotServing();
        }
        streamer.beginShutdown();
        Boolean drained = streamer.awaitDrained(drain).block();
        if (!Boolean.TRUE.equals(drained)) {
            log.warn("drain 时间内仍有 {} 个在途请求，全部取消", streamer.getInFlight());
            streamer.cancelAll();
        }
        sessions.closeAll(SESSION_CLOSE_TIMEOUT).block();
        if (grpcServer != null) {
            grpcServer.shutdownNow();
        }
        streamer.close();
        connectionPool.close();
        log.info("网关已关闭");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
