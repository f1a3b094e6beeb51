package xyz.vvrf.reactor.gateway.pool;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.topology.DeploymentDescription;
import xyz.vvrf.reactor.gateway.topology.EndpointDescription;
import xyz.vvrf.reactor.gateway.topology.TopologyGraph;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * executor 副本连接池，按 (deployment, shard) 组织。
 * <p>
 * 后台按固定间隔探测每个副本；探测失败的副本进入 TRANSIENT_FAILURE，
 * 按指数退避 (带抖动) 重建 channel 后再次探测。选择副本时只考虑 READY 的副本，
 * 取在途调用最少者，相同时轮询。
 */
@Slf4j
public class ConnectionPool implements AutoCloseable {

    /** reducer_exec 的合并 executor 以 "deployment/reducer" 的名义入池，只有分片 0 */
    public static final String REDUCER_SUFFIX = "/reducer";

    private static final Duration ACQUIRE_POLL_INTERVAL = Duration.ofMillis(10);

    private final ChannelFactory channelFactory;
    private final HealthProbe healthProbe;
    private final ConnectionPoolSettings settings;
    private final Map<String, ReplicaList> shards = new LinkedHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Disposable probeLoop;

    public ConnectionPool(TopologyGraph graph,
                          ChannelFactory channelFactory,
                          HealthProbe healthProbe,
                          ConnectionPoolSettings settings) {
        Objects.requireNonNull(graph, "TopologyGraph 不能为空");
        this.channelFactory = Objects.requireNonNull(channelFactory, "ChannelFactory 不能为空");
        this.healthProbe = Objects.requireNonNull(healthProbe, "HealthProbe 不能为空");
        this.settings = Objects.requireNonNull(settings, "连接池参数不能为空");

        for (DeploymentDescription deployment : graph.getDeployments().values()) {
            for (EndpointDescription endpoint : deployment.getEndpoints()) {
                register(deployment.getName(), endpoint.getShardId(), endpoint);
            }
            if (deployment.getReducer() != null) {
                register(deployment.getName() + REDUCER_SUFFIX, 0, deployment.getReducer());
            }
        }
        log.info("ConnectionPool 初始化完成。Flow: '{}', 分片组数: {}, 副本总数: {}, 参数: {}",
                graph.getName(), shards.size(), allReplicas().size(), settings);
    }

    private void register(String deployment, int shard, EndpointDescription endpoint) {
        ReplicaConnection replica = new ReplicaConnection(deployment, shard, endpoint, channelFactory.create(endpoint));
        shards.computeIfAbsent(key(deployment, shard), k -> new ReplicaList()).add(replica);
        log.debug("注册副本: {}", replica);
    }

    /**
     * 启动后台探测循环，第一次探测立即执行。
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        probeLoop = Flux.interval(Duration.ZERO, settings.getProbeInterval(), Schedulers.parallel())
                .onBackpressureDrop()
                .concatMap(tick -> probeAll(), 1)
                .subscribe(
                        v -> { },
                        error -> log.error("副本探测循环意外终止: {}", error.getMessage(), error));
        log.info("ConnectionPool 探测循环已启动，间隔 {}", settings.getProbeInterval());
    }

    /**
     * 探测全部副本一次。处于退避期内的副本被跳过。
     */
    public Mono<Void> probeAll() {
        Instant now = Instant.now();
        return Flux.fromIterable(allReplicas())
                .filter(replica -> replica.getState() != ReplicaState.SHUTDOWN)
                .flatMap(replica -> probeReplica(replica, now))
                .then();
    }

    private Mono<Void> probeReplica(ReplicaConnection replica, Instant now) {
        if (replica.getState() == ReplicaState.TRANSIENT_FAILURE) {
            if (now.isBefore(replica.getBackoffDeadline())) {
                return Mono.empty();
            }
            log.debug("副本 {} 退避到期，重建 channel", replica.getPodId());
            replica.replaceChannel(channelFactory.create(replica.getEndpoint()));
        }
        return Mono.defer(() -> healthProbe.probe(replica, settings.getProbeTimeout()))
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    log.debug("副本 {} 探测异常: {}", replica.getPodId(), error.getMessage());
                    return Mono.just(false);
                })
                .doOnNext(healthy -> {
                    replica.markProbed(Instant.now());
                    if (healthy) {
                        reportSuccess(replica);
                    } else {
                        markFailure(replica, "健康探测失败");
                    }
                })
                .then();
    }

    /**
     * 获取一个可用副本并预留一个在途名额，调用结束后必须 {@link #release(ReplicaConnection)}。
     * 没有 READY 副本时最多等待 replica-wait，之后以 NO_AVAILABLE_REPLICA 失败；
     * 所有 READY 副本都已达到在途上限时立即以 RESOURCE_EXHAUSTED 失败。
     *
     * @param deployment    deployment 名称
     * @param shard         分片编号
     * @param excludePodIds 优先避开的副本 (重试时为已尝试过的副本)
     * @param requiredPodId 非空时只接受该副本 (有状态写请求的 leader)
     */
    public Mono<ReplicaConnection> acquire(String deployment, int shard, Set<String> excludePodIds, String requiredPodId) {
        ReplicaList list = shards.get(key(deployment, shard));
        if (list == null) {
            return Mono.error(new GatewayException(GatewayErrorCode.INTERNAL,
                    String.format("连接池中不存在 deployment '%s' 的分片 %d", deployment, shard)));
        }
        Set<String> exclude = excludePodIds != null ? excludePodIds : Collections.emptySet();
        return Mono.defer(() -> Mono.justOrEmpty(list.select(exclude, requiredPodId, settings.getMaxOutstandingPerReplica())))
                .repeatWhenEmpty(repeats -> repeats.delayElements(ACQUIRE_POLL_INTERVAL))
                .timeout(settings.getReplicaWait(), Mono.error(() -> new GatewayException(GatewayErrorCode.NO_AVAILABLE_REPLICA,
                        String.format("deployment '%s' 分片 %d 在 %dms 内没有可用副本", deployment, shard,
                                settings.getReplicaWait().toMillis()))));
    }

    public void release(ReplicaConnection replica) {
        replica.releaseReservation();
    }

    /**
     * 调用方观察到连接级错误 (UNAVAILABLE 等) 时上报，副本立即进入 TRANSIENT_FAILURE。
     */
    public void reportFailure(ReplicaConnection replica, Throwable error) {
        markFailure(replica, error != null ? error.getMessage() : "unknown");
    }

    public void reportSuccess(ReplicaConnection replica) {
        if (replica.markReady()) {
            log.info("副本 {} (deployment '{}', 分片 {}) 进入 READY", replica.getPodId(), replica.getDeployment(), replica.getShard());
        }
    }

    private void markFailure(ReplicaConnection replica, String reason) {
        Duration backoff = computeBackoff(replica.getConsecutiveFailures() + 1);
        int failures = replica.markFailure(Instant.now().plus(backoff));
        log.warn("副本 {} (deployment '{}', 分片 {}) 进入 TRANSIENT_FAILURE: {}。连续失败 {} 次，{}ms 后重连。",
                replica.getPodId(), replica.getDeployment(), replica.getShard(), reason, failures, backoff.toMillis());
    }

    /**
     * 第 n 次连续失败后的退避时长：initial * 2^(n-1)，不超过 max，再叠加 ±jitter 的随机抖动。
     */
    Duration computeBackoff(int failures) {
        int exponent = Math.min(Math.max(failures, 1) - 1, 20);
        long baseMs = Math.min(settings.getInitialBackoff().toMillis() << exponent, settings.getMaxBackoff().toMillis());
        double jitter = settings.getBackoffJitter() * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
        return Duration.ofMillis(Math.max(0, Math.round(baseMs * (1 + jitter))));
    }

    public List<ReplicaConnection> getReplicas(String deployment, int shard) {
        ReplicaList list = shards.get(key(deployment, shard));
        return list != null ? list.view() : Collections.emptyList();
    }

    public List<ReplicaConnection> allReplicas() {
        return shards.values().stream()
                .flatMap(list -> list.view().stream())
                .collect(Collectors.toList());
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Disposable loop = probeLoop;
        if (loop != null) {
            loop.dispose();
        }
        allReplicas().forEach(ReplicaConnection::shutdown);
        log.info("ConnectionPool 已关闭，所有 channel 已释放。");
    }

    private static String key(String deployment, int shard) {
        return deployment + "#" + shard;
    }

    /**
     * 单个分片的副本列表与轮询游标。
     */
    private static final class ReplicaList {

        private final List<ReplicaConnection> replicas = new ArrayList<>();
        private final AtomicInteger cursor = new AtomicInteger(0);

        void add(ReplicaConnection replica) {
            replicas.add(replica);
        }

        List<ReplicaConnection> view() {
            return Collections.unmodifiableList(replicas);
        }

        ReplicaConnection select(Set<String> exclude, String requiredPodId, int maxOutstanding) {
            List<ReplicaConnection> ready = new ArrayList<>();
            for (ReplicaConnection replica : replicas) {
                if (replica.isReady() && (requiredPodId == null || requiredPodId.equals(replica.getPodId()))) {
                    ready.add(replica);
                }
            }
            if (ready.isEmpty()) {
                return null;
            }
            List<ReplicaConnection> candidates = ready.stream()
                    .filter(replica -> !exclude.contains(replica.getPodId()))
                    .collect(Collectors.toCollection(ArrayList::new));
            if (candidates.isEmpty()) {
                // 只剩已尝试过的副本时仍允许再次使用
                candidates = ready;
            }
            int offset = cursor.getAndIncrement();
            while (!candidates.isEmpty()) {
                int n = candidates.size();
                ReplicaConnection best = null;
                for (int i = 0; i < n; i++) {
                    ReplicaConnection replica = candidates.get(Math.floorMod(offset + i, n));
                    if (best == null || replica.getOutstanding() < best.getOutstanding()) {
                        best = replica;
                    }
                }
                if (best.tryReserve(maxOutstanding)) {
                    return best;
                }
                candidates.remove(best);
            }
            throw new GatewayException(GatewayErrorCode.RESOURCE_EXHAUSTED,
                    String.format("所有 READY 副本的在途调用都已达到上限 %d", maxOutstanding));
        }
    }
}
