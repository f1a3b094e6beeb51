package xyz.vvrf.reactor.gateway.dispatch;

import com.google.protobuf.Value;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;
import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.core.HopContext;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.core.PollingType;
import xyz.vvrf.reactor.gateway.core.Routes;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.join.ReducerRegistry;
import xyz.vvrf.reactor.gateway.monitor.MonitorNotifier;
import xyz.vvrf.reactor.gateway.pool.ConnectionPool;
import xyz.vvrf.reactor.gateway.pool.ExecutorClient;
import xyz.vvrf.reactor.gateway.pool.ReplicaConnection;
import xyz.vvrf.reactor.gateway.proto.RouteProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;
import xyz.vvrf.reactor.gateway.topology.DeploymentDescription;
import xyz.vvrf.reactor.gateway.topology.TopologyGraph;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

/**
 * Dispatcher 的标准实现。
 * 应用 target_executor 与端点过滤，选择分片与副本，带超时与重试地调用 executor，
 * 并把结果 (包括最终失败) 统一表示为 Partial。
 */
@Slf4j
public class StandardDispatcher implements Dispatcher {

    /** ANY 模式下用于固定分片的参数名 */
    public static final String SHARD_KEY_PARAMETER = "__shard_key__";

    private static final XXHash64 XX_HASH = XXHashFactory.fastestInstance().hash64();
    private static final long XX_HASH_SEED = 0L;

    private final TopologyGraph graph;
    private final ConnectionPool connectionPool;
    private final ExecutorClient executorClient;
    private final ReducerRegistry reducerRegistry;
    private final LeaderResolver leaderResolver;
    private final TargetExecutorMatcher targetMatcher;
    private final EndpointDiscovery endpointDiscovery;
    private final DispatchSettings settings;
    private final MonitorNotifier monitor;
    private final Map<String, AtomicLong> roundRobin = new ConcurrentHashMap<>();

    public StandardDispatcher(TopologyGraph graph,
                              ConnectionPool connectionPool,
                              ExecutorClient executorClient,
                              ReducerRegistry reducerRegistry,
                              LeaderResolver leaderResolver,
                              TargetExecutorMatcher targetMatcher,
                              EndpointDiscovery endpointDiscovery,
                              DispatchSettings settings,
                              MonitorNotifier monitor) {
        this.graph = Objects.requireNonNull(graph, "TopologyGraph 不能为空");
        this.connectionPool = Objects.requireNonNull(connectionPool, "ConnectionPool 不能为空");
        this.executorClient = Objects.requireNonNull(executorClient, "ExecutorClient 不能为空");
        this.reducerRegistry = Objects.requireNonNull(reducerRegistry, "ReducerRegistry 不能为空");
        this.leaderResolver = (leaderResolver != null) ? leaderResolver : (deployment, shard) -> null;
        this.targetMatcher = Objects.requireNonNull(targetMatcher, "TargetExecutorMatcher 不能为空");
        this.endpointDiscovery = (endpointDiscovery != null)
                ? endpointDiscovery
                : EndpointDiscovery.disabled(connectionPool, executorClient);
        this.settings = Objects.requireNonNull(settings, "派发参数不能为空");
        this.monitor = (monitor != null) ? monitor : MonitorNotifier.none();
        log.info("为 Flow '{}' 初始化了 StandardDispatcher。参数: {}, 监听器数量: {}",
                graph.getName(), settings, this.monitor.size());
    }

    @Override
    public Mono<Partial> dispatch(String node, Partial input, HopContext context) {
        return Mono.defer(() -> {
                    DeploymentDescription deployment = graph.getDeployment(node);
                    LazyDataRequest request = input.getRequest();

                    if (!targetMatcher.matches(request.getTargetExecutor(), node)) {
                        log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 不匹配 target_executor '{}'，直接透传。",
                                context.getRequestId(), context.getFlowName(), node, request.getTargetExecutor());
                        return Mono.just(input);
                    }

                    String endpoint = request.getExecEndpoint();
                    return endpointDiscovery.exposes(node, endpoint).flatMap(exposed -> {
                        if (!exposed) {
                            log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 不处理端点 '{}'，直接透传。",
                                    context.getRequestId(), context.getFlowName(), node, endpoint);
                            return Mono.just(input);
                        }
                        if (deployment.getPolling() == PollingType.ALL && deployment.getShards() > 1) {
                            return dispatchAllShards(deployment, input, context);
                        }
                        int shard = selectShard(deployment, request);
                        return dispatchShard(deployment, shard, input, context);
                    });
                })
                .onErrorResume(error -> {
                    // 派发前的准备阶段失败 (例如非法的 target_executor 正则)
                    log.warn("[RequestId: {}][Flow: '{}'] 节点 '{}' 派发准备失败: {}",
                            context.getRequestId(), context.getFlowName(), node, error.getMessage());
                    return Mono.just(Partial.error(input, Statuses.fromThrowable(error, node)));
                });
    }

    /**
     * polling = ALL：并行发往每个分片，结果按分片顺序交给该节点的合并策略。
     */
    private Mono<Partial> dispatchAllShards(DeploymentDescription deployment, Partial input, HopContext context) {
        log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 以 ALL 模式发往 {} 个分片",
                context.getRequestId(), context.getFlowName(), deployment.getName(), deployment.getShards());
        return Flux.fromStream(IntStream.range(0, deployment.getShards()).boxed())
                .flatMapSequential(shard -> dispatchShard(deployment, shard, input, context))
                .collectList()
                .flatMap(partials -> reducerRegistry.get(deployment.getReduce())
                        .reduce(deployment.getName(), partials, context));
    }

    /**
     * polling = ANY 时选择唯一的目标分片。
     */
    int selectShard(DeploymentDescription deployment, LazyDataRequest request) {
        int shards = deployment.getShards();
        if (shards <= 1) {
            return 0;
        }
        Value shardKey = request.getParameters().getFieldsMap().get(SHARD_KEY_PARAMETER);
        String key = shardKeyText(shardKey);
        if (key != null) {
            byte[] bytes = key.getBytes(StandardCharsets.UTF_8);
            long hash = XX_HASH.hash(bytes, 0, bytes.length, XX_HASH_SEED);
            return (int) Math.floorMod(hash, (long) shards);
        }
        long next = roundRobin.computeIfAbsent(deployment.getName(), k -> new AtomicLong()).getAndIncrement();
        return (int) Math.floorMod(next, (long) shards);
    }

    private static String shardKeyText(Value value) {
        if (value == null) {
            return null;
        }
        switch (value.getKindCase()) {
            case STRING_VALUE:
                return value.getStringValue();
            case NUMBER_VALUE:
                double number = value.getNumberValue();
                if (number == Math.rint(number) && !Double.isInfinite(number)) {
                    return Long.toString((long) number);
                }
                return Double.toString(number);
            default:
                return null;
        }
    }

    /**
     * 发往单个分片：获取副本、调用、按需在其它副本上重试。
     */
    private Mono<Partial> dispatchShard(DeploymentDescription deployment, int shard, Partial input, HopContext context) {
        String node = deployment.getName();
        LazyDataRequest request = input.getRequest();
        String execEndpoint = request.getExecEndpoint();
        String requiredPodId = (deployment.isStateful() && deployment.getWriteEndpoints().contains(execEndpoint))
                ? leaderResolver.leader(node, shard)
                : null;
        int retries = deployment.getRetries() != null ? deployment.getRetries() : settings.getMaxRetries();

        Set<String> triedPodIds = ConcurrentHashMap.newKeySet();
        AtomicReference<String> lastPodId = new AtomicReference<>("");
        Instant dispatchStart = Instant.now();

        return Mono.defer(() -> {
                    Duration timeout = effectiveTimeout(deployment, context);
                    if (timeout.isZero() || timeout.isNegative()) {
                        return Mono.error(new GatewayException(GatewayErrorCode.TIMEOUT,
                                String.format("请求在调用节点 '%s' 之前已超过截止时间", node)));
                    }
                    return connectionPool.acquire(node, shard, triedPodIds, requiredPodId)
                            .flatMap(replica -> callReplica(replica, input, execEndpoint, timeout, context,
                                    triedPodIds, lastPodId))
                            .timeout(timeout, Mono.error(() -> new GatewayException(GatewayErrorCode.TIMEOUT,
                                    String.format("调用节点 '%s' 超过 %dms 未完成", node, timeout.toMillis()))));
                })
                .retryWhen(Retry.max(Math.max(0, retries))
                        .filter(error -> isRetryable(error) && !context.isExpired())
                        .doBeforeRetry(signal -> log.info("[RequestId: {}][Flow: '{}'] 节点 '{}' 分片 {} 第 {} 次重试，原因: {}",
                                context.getRequestId(), context.getFlowName(), node, shard,
                                signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                .onErrorResume(error -> {
                    String description = describe(error);
                    log.warn("[RequestId: {}][Flow: '{}'] 节点 '{}' 分片 {} 在重试后最终失败: {}",
                            context.getRequestId(), context.getFlowName(), node, shard, description);
                    StatusProto status = Statuses.fromThrowable(error, node).toBuilder()
                            .setDescription(description)
                            .build();
                    RouteProto route = Routes.finish(Routes.start(node, lastPodId.get(), dispatchStart), Instant.now(), status);
                    String podId = lastPodId.get();
                    Duration elapsed = Duration.between(dispatchStart, Instant.now());
                    monitor.publish(l -> l.onExecutorCallFailure(context.getRequestId(), node, podId, elapsed, description));
                    return Mono.just(Partial.error(input, status).withRoute(route));
                });
    }

    private Mono<Partial> callReplica(ReplicaConnection replica,
                                      Partial input,
                                      String execEndpoint,
                                      Duration timeout,
                                      HopContext context,
                                      Set<String> triedPodIds,
                                      AtomicReference<String> lastPodId) {
        String node = replica.getDeployment();
        String podId = replica.getPodId();
        triedPodIds.add(podId);
        lastPodId.set(podId);
        Instant start = Instant.now();
        log.debug("[RequestId: {}][Flow: '{}'] 调用节点 '{}' 副本 {} (分片 {}, 端点 '{}', 超时 {})",
                context.getRequestId(), context.getFlowName(), node, podId, replica.getShard(), execEndpoint, timeout);

        return executorClient.send(replica, input.getRequest(), execEndpoint, timeout)
                .switchIfEmpty(Mono.error(() -> new GatewayException(GatewayErrorCode.EXECUTOR_ERROR,
                        String.format("executor '%s' (%s) 没有返回响应", node, podId))))
                .map(response -> {
                    Instant end = Instant.now();
                    Duration latency = Duration.between(start, end);
                    StatusProto status = response.getStatus();
                    RouteProto route = Routes.finish(Routes.start(node, podId, start), end, status);
                    if (Statuses.isSuccess(status)) {
                        monitor.publish(l -> l.onExecutorCallSuccess(context.getRequestId(), node, podId, latency));
                    } else {
                        log.warn("[RequestId: {}][Flow: '{}'] 节点 '{}' 副本 {} 返回了非 SUCCESS 状态 {}: {}",
                                context.getRequestId(), context.getFlowName(), node, podId, status.getCode(), status.getDescription());
                        monitor.publish(l -> l.onExecutorCallFailure(context.getRequestId(), node, podId, latency, status.getDescription()));
                    }
                    // executor 响应里自带的路由并入旁路日志
                    List<RouteProto> routes = Routes.merge(Arrays.asList(input.getRoutes(), response.getRoutes()));
                    return Partial.of(response, routes).withRoute(route);
                })
                .doOnError(error -> {
                    log.warn("[RequestId: {}][Flow: '{}'] 调用节点 '{}' 副本 {} 失败: {}",
                            context.getRequestId(), context.getFlowName(), node, podId, error.getMessage());
                    if (isConnectionFailure(error)) {
                        connectionPool.reportFailure(replica, error);
                    }
                })
                .doFinally(signal -> connectionPool.release(replica));
    }

    /**
     * 单次调用的超时：deployment 覆盖值或全局 send-timeout，且不超过请求剩余时间。
     */
    private Duration effectiveTimeout(DeploymentDescription deployment, HopContext context) {
        Duration timeout = deployment.getTimeout() != null ? deployment.getTimeout() : settings.getSendTimeout();
        Duration remaining = context.remaining();
        if (remaining != null && remaining.compareTo(timeout) < 0) {
            return remaining;
        }
        return timeout;
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof StatusRuntimeException) {
            Status.Code code = ((StatusRuntimeException) error).getStatus().getCode();
            return code == Status.Code.UNAVAILABLE || code == Status.Code.DEADLINE_EXCEEDED;
        }
        if (error instanceof GatewayException) {
            GatewayErrorCode code = ((GatewayException) error).getErrorCode();
            return code == GatewayErrorCode.NO_AVAILABLE_REPLICA || code == GatewayErrorCode.TIMEOUT;
        }
        return false;
    }

    private static boolean isConnectionFailure(Throwable error) {
        return error instanceof StatusRuntimeException
                && ((StatusRuntimeException) error).getStatus().getCode() == Status.Code.UNAVAILABLE;
    }

    /**
     * 最终失败的描述，以 gRPC 状态码名开头，例如 "UNAVAILABLE: ..."。
     */
    static String describe(Throwable error) {
        if (error instanceof StatusRuntimeException) {
            Status status = ((StatusRuntimeException) error).getStatus();
            return status.getCode() + ": " + (status.getDescription() != null ? status.getDescription() : "");
        }
        if (error instanceof GatewayException) {
            GatewayErrorCode code = ((GatewayException) error).getErrorCode();
            return code.getGrpcCode() + ": " + error.getMessage();
        }
        return Status.Code.UNKNOWN + ": " + error.getMessage();
    }

    @Override
    public String toString() {
        return "StandardDispatcher{flow='" + graph.getName() + "', nodes=" + graph.getNodeNames() + '}';
    }
}
