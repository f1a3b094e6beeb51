package xyz.vvrf.reactor.gateway.streaming;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.core.Routes;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.dispatch.TargetExecutorMatcher;
import xyz.vvrf.reactor.gateway.monitor.MonitorNotifier;
import xyz.vvrf.reactor.gateway.proto.DataRequest;
import xyz.vvrf.reactor.gateway.proto.RouteProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 把客户端的请求流送入拓扑执行，并按完成顺序产出响应。
 * <p>
 * 每个客户端流最多 prefetch 个在途请求 (0 表示不限)；响应中的 request_id 与请求一致。
 * 客户端流出错时停止接收，尚未完成的请求以 "CANCELLED" 错误响应结束；
 * 网关关闭时停止接收新请求，给在途请求 drain 时长，之后取消剩余请求。
 */
@Slf4j
public class RequestStreamer {

    /** 空跑请求使用的端点，executor 对其只做连通性响应 */
    public static final String DRY_RUN_ENDPOINT = "_jina_dry_run_";
    public static final String CANCELLED_DESCRIPTION = "CANCELLED";

    /** 请求级截止时间的兜底余量，各跳自身在截止时间处结束 */
    private static final Duration DEADLINE_GRACE = Duration.ofMillis(50);
    private static final Duration DRAIN_POLL_INTERVAL = Duration.ofMillis(10);

    private final TopologyExecutor topologyExecutor;
    private final TargetExecutorMatcher targetMatcher;
    private final StreamerSettings settings;
    private final MonitorNotifier monitor;
    private final String flowName;

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger activeStreams = new AtomicInteger(0);
    private final Set<Sinks.One<Boolean>> streamCancels = ConcurrentHashMap.newKeySet();
    private final Sinks.One<Boolean> acceptingStopped = Sinks.one();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private volatile Disposable drainTimer;

    public RequestStreamer(TopologyExecutor topologyExecutor,
                           TargetExecutorMatcher targetMatcher,
                           StreamerSettings settings,
                           MonitorNotifier monitor) {
        this.topologyExecutor = Objects.requireNonNull(topologyExecutor, "TopologyExecutor 不能为空");
        this.targetMatcher = Objects.requireNonNull(targetMatcher, "TargetExecutorMatcher 不能为空");
        this.settings = Objects.requireNonNull(settings, "请求流参数不能为空");
        this.monitor = (monitor != null) ? monitor : MonitorNotifier.none();
        this.flowName = topologyExecutor.getGraph().getName();
        if (settings.getPrefetch() < 0 || settings.getPrefetch() > settings.getMaxPrefetch()) {
            throw new IllegalArgumentException(String.format("prefetch 必须在 0 到 %d 之间，当前为 %d",
                    settings.getMaxPrefetch(), settings.getPrefetch()));
        }
        if (settings.getMaxConcurrentStreams() <= 0) {
            throw new IllegalArgumentException("max-concurrent-streams 必须为正数");
        }
        log.info("RequestStreamer 初始化完成。Flow: '{}', 参数: {}", flowName, settings);
    }

    /**
     * 处理一个客户端请求流。响应按完成顺序产出。
     */
    public Flux<LazyDataRequest> stream(Flux<LazyDataRequest> ingress) {
        return Flux.defer(() -> {
            if (shuttingDown.get()) {
                return Flux.error(new GatewayException(GatewayErrorCode.CANCELLED, "网关正在关闭，不再接受新的请求流"));
            }
            int streams = activeStreams.incrementAndGet();
            if (streams > settings.getMaxConcurrentStreams()) {
                activeStreams.decrementAndGet();
                log.warn("[Flow: '{}'] 并发请求流数量达到上限 {}，拒绝新的请求流。", flowName, settings.getMaxConcurrentStreams());
                return Flux.error(new GatewayException(GatewayErrorCode.RESOURCE_EXHAUSTED,
                        String.format("并发请求流数量已达上限 %d", settings.getMaxConcurrentStreams())));
            }

            Sinks.One<Boolean> streamCancel = Sinks.one();
            streamCancels.add(streamCancel);
            StreamWindow window = new StreamWindow(settings.getPrefetch());
            int concurrency = settings.getPrefetch() > 0 ? settings.getPrefetch() : Integer.MAX_VALUE;
            log.debug("[Flow: '{}'] 新的请求流开始，当前请求流数: {}", flowName, streams);

            return ingress
                    .takeUntilOther(acceptingStopped.asMono())
                    .onErrorResume(error -> {
                        log.warn("[Flow: '{}'] 客户端请求流出错，停止接收并取消未完成的请求: {}", flowName, error.getMessage());
                        streamCancel.tryEmitValue(Boolean.TRUE);
                        return Flux.empty();
                    })
                    .flatMap(request -> Mono.defer(() -> {
                        Duration waited = window.admit();
                        if (waited != null) {
                            monitor.publish(l -> l.onPrefetchWait(waited));
                        }
                        return process(request, streamCancel.asMono()).doFinally(signal -> window.release());
                    }), concurrency)
                    .doFinally(signal -> {
                        streamCancels.remove(streamCancel);
                        int remaining = activeStreams.decrementAndGet();
                        log.debug("[Flow: '{}'] 请求流结束 (信号: {})，剩余请求流数: {}", flowName, signal, remaining);
                    });
        });
    }

    /**
     * 处理单个请求，等价于只含一个请求的流。
     */
    public Mono<LazyDataRequest> processSingle(LazyDataRequest request) {
        return stream(Flux.just(request)).next();
    }

    /**
     * 发送一个不含文档的请求经过整个 Flow，返回出口状态。
     */
    public Mono<StatusProto> dryRun() {
        DataRequest.Builder builder = DataRequest.newBuilder().setExecEndpoint(DRY_RUN_ENDPOINT);
        builder.getHeaderBuilder().setRequestId(newRequestId());
        return processSingle(LazyDataRequest.fromProto(builder.build()))
                .map(LazyDataRequest::getStatus)
                .defaultIfEmpty(Statuses.error(CANCELLED_DESCRIPTION))
                .onErrorResume(error -> Mono.just(Statuses.fromThrowable(error, Routes.GATEWAY_EXECUTOR)));
    }

    private Mono<LazyDataRequest> process(LazyDataRequest raw, Mono<Boolean> streamCancel) {
        Instant receivedAt = Instant.now();
        LazyDataRequest request;
        try {
            request = ensureRequestId(raw);
        } catch (GatewayException e) {
            log.warn("[Flow: '{}'] 无法解析请求: {}", flowName, e.getMessage());
            return Mono.just(rejected(e, receivedAt));
        }

        RequestExecution execution = new RequestExecution(request, flowName, receivedAt, monitor);
        String requestId = execution.getRequestId();
        int current = inFlight.incrementAndGet();
        monitor.publish(l -> l.onInFlightChanged(current));
        monitor.publish(l -> l.onRequestStart(requestId, flowName, execution.getEndpoint()));
        log.debug("[RequestId: {}][Flow: '{}'] 请求进入网关，端点 '{}'，在途请求数 {}",
                requestId, flowName, execution.getEndpoint(), current);

        Mono<Partial> pipeline;
        try {
            targetMatcher.validate(request.getTargetExecutor());
            pipeline = topologyExecutor.execute(execution).doOnCancel(execution::cancel);
        } catch (GatewayException e) {
            pipeline = Mono.just(Partial.error(execution.getIngress(), Statuses.fromThrowable(e, Routes.GATEWAY_EXECUTOR)));
        }

        if (execution.getDeadline() != null) {
            Duration budget = Duration.between(receivedAt, execution.getDeadline()).plus(DEADLINE_GRACE);
            pipeline = pipeline.timeout(budget, Mono.fromCallable(() -> {
                log.warn("[RequestId: {}][Flow: '{}'] 请求超过截止时间，取消未完成的子调用。", requestId, flowName);
                execution.cancel();
                return Partial.error(execution.getIngress(), Statuses.error(
                        String.format("DEADLINE_EXCEEDED: 请求在 %dms 内未完成", budget.minus(DEADLINE_GRACE).toMillis())));
            }));
        }

        return pipeline
                .takeUntilOther(streamCancel)
                .map(result -> complete(execution, result))
                .onErrorResume(error -> {
                    log.error("[RequestId: {}][Flow: '{}'] 请求处理中出现意外错误: {}", requestId, flowName, error.getMessage(), error);
                    GatewayException wrapped = GatewayException.wrap(error);
                    return Mono.just(complete(execution, Partial.error(execution.getIngress(),
                            Statuses.fromThrowable(wrapped, Routes.GATEWAY_EXECUTOR))));
                })
                .switchIfEmpty(Mono.fromCallable(() -> cancelled(execution)))
                .doOnCancel(() -> {
                    execution.cancel();
                    if (execution.transition(RequestState.CANCELLED)) {
                        log.debug("[RequestId: {}][Flow: '{}'] 客户端取消了请求。", requestId, flowName);
                        publishComplete(execution, Statuses.error(CANCELLED_DESCRIPTION));
                    }
                })
                .doFinally(signal -> {
                    int remaining = inFlight.decrementAndGet();
                    monitor.publish(l -> l.onInFlightChanged(remaining));
                    execution.clear();
                });
    }

    /**
     * 写入出口路由 (请求带入的路由在前，然后是网关路由，其余按开始时间排序) 并恢复 request_id。
     */
    private LazyDataRequest complete(RequestExecution execution, Partial result) {
        LazyDataRequest response = egress(execution, result);
        RequestState terminal = result.isSuccess() ? RequestState.COMPLETE : RequestState.ERRORED;
        if (execution.transition(terminal)) {
            publishComplete(execution, response.getStatus());
        }
        log.debug("[RequestId: {}][Flow: '{}'] 请求完成，状态 {}，路由数 {}",
                execution.getRequestId(), flowName, response.getStatus().getCode(), response.getRoutes().size());
        return response;
    }

    private LazyDataRequest cancelled(RequestExecution execution) {
        StatusProto status = Statuses.error(CANCELLED_DESCRIPTION);
        LazyDataRequest response = egress(execution, Partial.error(execution.getIngress(), status));
        if (execution.transition(RequestState.CANCELLED)) {
            log.info("[RequestId: {}][Flow: '{}'] 请求被取消。", execution.getRequestId(), flowName);
            publishComplete(execution, status);
        }
        return response;
    }

    private LazyDataRequest egress(RequestExecution execution, Partial result) {
        Instant end = Instant.now();
        RouteProto gatewayRoute = Routes.finish(
                Routes.start(Routes.GATEWAY_EXECUTOR, "", execution.getReceivedAt()), end, null);
        List<RouteProto> routes = Routes.egress(execution.getIngress().getRoutes(), gatewayRoute, result.getRoutes());
        String requestId = execution.getRequestId();
        return result.getRequest().mutate(builder -> {
            builder.clearRoutes().addAllRoutes(routes);
            builder.getHeaderBuilder().setRequestId(requestId);
        });
    }

    private void publishComplete(RequestExecution execution, StatusProto status) {
        Duration latency = Duration.between(execution.getReceivedAt(), Instant.now());
        monitor.publish(l -> l.onRequestComplete(execution.getRequestId(), flowName, execution.getEndpoint(), latency, status));
    }

    /**
     * 无法解析的请求：返回只带错误状态和网关路由的响应。
     */
    private LazyDataRequest rejected(GatewayException error, Instant receivedAt) {
        DataRequest.Builder builder = DataRequest.newBuilder()
                .setStatus(Statuses.fromThrowable(error, Routes.GATEWAY_EXECUTOR))
                .addRoutes(Routes.finish(Routes.start(Routes.GATEWAY_EXECUTOR, "", receivedAt), Instant.now(), null));
        return LazyDataRequest.fromProto(builder.build());
    }

    private static LazyDataRequest ensureRequestId(LazyDataRequest request) {
        if (!request.getRequestId().isEmpty()) {
            return request;
        }
        String requestId = newRequestId();
        return request.mutate(builder -> builder.getHeaderBuilder().setRequestId(requestId));
    }

    static String newRequestId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * 停止接收新请求；drain 时长之后取消所有仍在途的请求。
     */
    public void beginShutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        log.info("[Flow: '{}'] 开始关闭请求流。在途请求数: {}，drain: {}", flowName, inFlight.get(), settings.getDrain());
        acceptingStopped.tryEmitValue(Boolean.TRUE);
        drainTimer = Mono.delay(settings.getDrain())
                .subscribe(tick -> {
                    if (inFlight.get() > 0) {
                        log.warn("[Flow: '{}'] drain 时间已到，取消剩余 {} 个在途请求。", flowName, inFlight.get());
                    }
                    cancelAll();
                });
    }

    /**
     * 立即取消所有请求流中未完成的请求，它们以 "CANCELLED" 错误响应结束。
     */
    public void cancelAll() {
        streamCancels.forEach(cancel -> cancel.tryEmitValue(Boolean.TRUE));
    }

    /**
     * 等待在途请求数归零。
     *
     * @return 在 timeout 内归零时为 true
     */
    public Mono<Boolean> awaitDrained(Duration timeout) {
        return Flux.interval(Duration.ZERO, DRAIN_POLL_INTERVAL)
                .filter(tick -> inFlight.get() == 0)
                .next()
                .map(tick -> Boolean.TRUE)
                .timeout(timeout, Mono.just(Boolean.FALSE));
    }

    public void close() {
        Disposable timer = drainTimer;
        if (timer != null) {
            timer.dispose();
        }
        cancelAll();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public int getInFlight() {
        return inFlight.get();
    }

    public int getActiveStreams() {
        return activeStreams.get();
    }

    public StreamerSettings getSettings() {
        return settings;
    }

    /**
     * 单个客户端流的在途窗口。admit 只在 flatMap 的串行 onNext 中调用。
     */
    private static final class StreamWindow {

        private final int limit;
        private final AtomicInteger inFlight = new AtomicInteger(0);
        private volatile Instant saturatedSince;

        StreamWindow(int limit) {
            this.limit = limit;
        }

        /**
         * @return 窗口此前处于已满状态时，从变满到本次放行的等待时长；否则为 null
         */
        Duration admit() {
            Duration waited = null;
            Instant since = saturatedSince;
            if (since != null) {
                waited = Duration.between(since, Instant.now());
                saturatedSince = null;
            }
            if (limit > 0 && inFlight.incrementAndGet() >= limit) {
                saturatedSince = Instant.now();
            }
            return waited;
        }

        void release() {
            if (limit > 0) {
                inFlight.decrementAndGet();
            }
        }
    }
}
