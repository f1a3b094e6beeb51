package xyz.vvrf.reactor.gateway.server.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.codec.CompressionAlgorithm;
import xyz.vvrf.reactor.gateway.codec.JinaMethods;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 网关 gRPC 服务器：Jina 的四个服务加上标准健康检查服务。
 * <p>
 * 健康服务中登记 {@code jina.JinaRPC}、{@code jina.JinaSingleDataRequestRPC} 与整体服务 {@code ""}。
 * 启动后需显式调用 {@link #markServing()}。
 */
@Slf4j
public class GatewayGrpcServer {

    static final long KEEPALIVE_TIME_MS = 10_000;
    static final long KEEPALIVE_TIMEOUT_MS = 5_000;

    static final List<String> HEALTH_SERVICES = Arrays.asList(
            JinaMethods.JINA_RPC, JinaMethods.SINGLE_DATA_REQUEST_RPC, HealthStatusManager.SERVICE_NAME_ALL_SERVICES);

    private final Server server;
    private final HealthStatusManager health;
    private volatile boolean started;

    public GatewayGrpcServer(ServerBuilder<?> serverBuilder, GatewayGrpcService service) {
        Objects.requireNonNull(serverBuilder, "ServerBuilder 不能为空");
        Objects.requireNonNull(service, "GatewayGrpcService 不能为空");
        this.health = new HealthStatusManager();
        service.serviceDefinitions().forEach(serverBuilder::addService);
        serverBuilder.addService(health.getHealthService());
        this.server = serverBuilder.build();
        for (String name : HEALTH_SERVICES) {
            health.setStatus(name, ServingStatus.NOT_SERVING);
        }
    }

    /**
     * 基于 Netty 的服务器构建器，与出站 channel 使用相同的消息大小、keepalive 与压缩配置。
     */
    public static ServerBuilder<?> netty(int port) {
        return NettyServerBuilder.forPort(port)
                .maxInboundMessageSize(Integer.MAX_VALUE)
                .keepAliveTime(KEEPALIVE_TIME_MS, TimeUnit.MILLISECONDS)
                .keepAliveTimeout(KEEPALIVE_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .permitKeepAliveWithoutCalls(true)
                .permitKeepAliveTime(KEEPALIVE_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .compressorRegistry(CompressionAlgorithm.compressorRegistry())
                .decompressorRegistry(CompressionAlgorithm.decompressorRegistry());
    }

    /**
     * 启动服务器。绑定失败时抛出 GatewayException，原始 IOException 保留为 cause。
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        try {
            server.start();
        } catch (IOException e) {
            throw new GatewayException(GatewayErrorCode.INTERNAL, "gRPC 服务器启动失败: " + e.getMessage(), e);
        }
        started = true;
        log.info("gRPC 服务器已启动，端口: {}", server.getPort());
    }

    public void markServing() {
        for (String name : HEALTH_SERVICES) {
            health.setStatus(name, ServingStatus.SERVING);
        }
        log.debug("gRPC 健康状态: SERVING");
    }

    /**
     * 标记 NOT_SERVING 并让健康服务进入终态，此后状态不再改变。
     */
    public void markNotServing() {
        for (String name : HEALTH_SERVICES) {
            health.setStatus(name, ServingStatus.NOT_SERVING);
        }
        health.enterTerminalState();
        log.debug("gRPC 健康状态: NOT_SERVING (终态)");
    }

    /**
     * 立即关闭 (无宽限期)，在途调用被取消。
     */
    public synchronized void shutdownNow() {
        if (!started || server.isShutdown()) {
            return;
        }
        server.shutdownNow();
        try {
            if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("gRPC 服务器在 5s 内未完全终止");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待 gRPC 服务器终止时被中断");
        }
        log.info("gRPC 服务器已关闭");
    }

    public boolean isStarted() {
        return started;
    }

    public int getPort() {
        return server.getPort();
    }
}
