package xyz.vvrf.reactor.gateway.streaming;

import com.google.protobuf.Value;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.gateway.core.HopContext;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.monitor.MonitorNotifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 管理单个请求在拓扑中执行时的状态。
 * 每个节点的执行 Mono 只创建一次并缓存，保证同一请求内每个节点最多派发一次。
 */
@Slf4j
public class RequestExecution {

    /** 请求级截止时间 (毫秒，相对于进入网关的时刻) 的参数名 */
    public static final String DEADLINE_PARAMETER = "deadline_ms";

    @Getter private final String requestId;
    @Getter private final String flowName;
    @Getter private final String endpoint;
    @Getter private final Partial ingress;
    @Getter private final Instant receivedAt;
    @Getter private final Instant deadline;
    private final MonitorNotifier monitor;

    private final AtomicReference<RequestState> state = new AtomicReference<>(RequestState.RECEIVED);
    private final AtomicInteger illegalTransitions = new AtomicInteger(0);
    private final Map<String, Mono<Partial>> nodeMonos = new ConcurrentHashMap<>();
    private final Sinks.One<Boolean> cancelSignal = Sinks.one();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final HopContext hopContext;

    public RequestExecution(LazyDataRequest request, String flowName, Instant receivedAt, MonitorNotifier monitor) {
        this.ingress = Partial.of(request);
        this.requestId = request.getRequestId();
        this.endpoint = request.getExecEndpoint();
        this.flowName = flowName;
        this.receivedAt = receivedAt;
        this.deadline = resolveDeadline(request, receivedAt);
        this.monitor = (monitor != null) ? monitor : MonitorNotifier.none();
        this.hopContext = new HopContext(requestId, flowName, deadline);
    }

    /**
     * 截止时间取自 parameters.deadline_ms，其次取 header.timeout (毫秒)；都没有时不限。
     */
    static Instant resolveDeadline(LazyDataRequest request, Instant receivedAt) {
        Value value = request.getParameters().getFieldsMap().get(DEADLINE_PARAMETER);
        if (value != null && value.getKindCase() == Value.KindCase.NUMBER_VALUE && value.getNumberValue() > 0) {
            return receivedAt.plusMillis((long) value.getNumberValue());
        }
        int headerTimeout = request.getProto().getHeader().getTimeout();
        if (headerTimeout > 0) {
            return receivedAt.plusMillis(Integer.toUnsignedLong(headerTimeout));
        }
        return null;
    }

    public HopContext hopContext() {
        return hopContext;
    }

    /**
     * 距截止时间的剩余时长；不限时返回 null。
     */
    public Duration remaining() {
        return hopContext.remaining();
    }

    public RequestState getState() {
        return state.get();
    }

    public int getIllegalTransitions() {
        return illegalTransitions.get();
    }

    /**
     * 尝试迁移到 next。迁移到当前状态视为成功的空操作；非法迁移被丢弃并计数。
     *
     * @return 迁移是否生效
     */
    public boolean transition(RequestState next) {
        while (true) {
            RequestState current = state.get();
            if (current == next) {
                return true;
            }
            if (!current.canTransitionTo(next)) {
                int count = illegalTransitions.incrementAndGet();
                log.debug("[RequestId: {}][Flow: '{}'] 丢弃非法状态迁移 {} -> {} (累计 {} 次)",
                        requestId, flowName, current, next, count);
                monitor.publish(l -> l.onIllegalTransition(requestId, current.name(), next.name()));
                return false;
            }
            if (state.compareAndSet(current, next)) {
                log.trace("[RequestId: {}][Flow: '{}'] 状态 {} -> {}", requestId, flowName, current, next);
                return true;
            }
        }
    }

    /**
     * 获取或创建节点的执行 Mono。创建出的 Mono 会在请求取消时停止，并缓存其结果。
     */
    public Mono<Partial> getOrCreateNodeMono(String node, Supplier<Mono<Partial>> supplier) {
        Mono<Partial> existing = nodeMonos.get(node);
        if (existing != null) {
            return existing;
        }
        return nodeMonos.computeIfAbsent(node, key -> {
            log.trace("[RequestId: {}][Flow: '{}'] 为节点 '{}' 创建执行 Mono", requestId, flowName, node);
            return supplier.get()
                    .takeUntilOther(cancelSignal.asMono())
                    .cache();
        });
    }

    /**
     * 取消请求：正在进行的子调用被取消，尚未完成的节点 Mono 以空结束。
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancelSignal.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int getCreatedNodeCount() {
        return nodeMonos.size();
    }

    void clear() {
        nodeMonos.clear();
    }
}
