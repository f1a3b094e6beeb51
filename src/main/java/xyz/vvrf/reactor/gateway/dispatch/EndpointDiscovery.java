package xyz.vvrf.reactor.gateway.dispatch;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.pool.ConnectionPool;
import xyz.vvrf.reactor.gateway.pool.ExecutorClient;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按 deployment 查询并缓存 executor 暴露的端点，用于跳过不处理当前 exec_endpoint 的节点。
 * <p>
 * 每个 deployment 只成功查询一次 (任取分片 0 的一个 READY 副本)。以下情况视为接受任意端点：
 * 列表为空、包含 {@value #DEFAULT_ENDPOINT}、executor 未实现该 RPC。其它查询失败不缓存，
 * 本次按接受处理，下一个请求重新查询。
 */
@Slf4j
public class EndpointDiscovery {

    public static final String DEFAULT_ENDPOINT = "/default";

    private final ConnectionPool connectionPool;
    private final ExecutorClient executorClient;
    private final Duration timeout;
    private final boolean enabled;
    private final Map<String, Mono<Set<String>>> discovered = new ConcurrentHashMap<>();

    public EndpointDiscovery(ConnectionPool connectionPool, ExecutorClient executorClient, Duration timeout, boolean enabled) {
        this.connectionPool = Objects.requireNonNull(connectionPool, "ConnectionPool 不能为空");
        this.executorClient = Objects.requireNonNull(executorClient, "ExecutorClient 不能为空");
        this.timeout = Objects.requireNonNull(timeout, "端点查询超时不能为空");
        this.enabled = enabled;
        log.info("EndpointDiscovery 初始化。启用: {}, 超时: {}", enabled, timeout);
    }

    /**
     * 不做端点过滤的实例。
     */
    public static EndpointDiscovery disabled(ConnectionPool connectionPool, ExecutorClient executorClient) {
        return new EndpointDiscovery(connectionPool, executorClient, Duration.ZERO, false);
    }

    /**
     * deployment 是否处理端点 endpoint。
     */
    public Mono<Boolean> exposes(String deployment, String endpoint) {
        if (!enabled || endpoint == null || endpoint.isEmpty()) {
            return Mono.just(true);
        }
        return discovered.computeIfAbsent(deployment, this::discover)
                .map(endpoints -> endpoints.isEmpty()
                        || endpoints.contains(DEFAULT_ENDPOINT)
                        || endpoints.contains(endpoint));
    }

    private Mono<Set<String>> discover(String deployment) {
        return connectionPool.acquire(deployment, 0, null, null)
                .flatMap(replica -> executorClient.discoverEndpoints(replica, timeout)
                        .doFinally(signal -> connectionPool.release(replica)))
                .<Set<String>>map(LinkedHashSet::new)
                .defaultIfEmpty(Collections.emptySet())
                .doOnNext(endpoints -> log.info("Deployment '{}' 暴露的端点: {}", deployment,
                        endpoints.isEmpty() ? "(全部)" : endpoints))
                .onErrorResume(error -> {
                    if (isUnimplemented(error)) {
                        log.debug("Deployment '{}' 未实现端点查询，视为接受全部端点。", deployment);
                        return Mono.just(Collections.emptySet());
                    }
                    log.warn("查询 deployment '{}' 的端点失败，本次不做过滤: {}", deployment, error.getMessage());
                    discovered.remove(deployment);
                    return Mono.just(Collections.emptySet());
                })
                .cache();
    }

    private static boolean isUnimplemented(Throwable error) {
        return error instanceof StatusRuntimeException
                && ((StatusRuntimeException) error).getStatus().getCode() == Status.Code.UNIMPLEMENTED;
    }
}
