package xyz.vvrf.reactor.gateway.pool;

import io.grpc.ManagedChannel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.topology.EndpointDescription;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 连接池中的一个副本条目：端点、底层 channel、健康状态与在途调用计数。
 * channel 是多路复用的，同一副本可同时承载多个调用。
 */
@Slf4j
public class ReplicaConnection {

    @Getter private final String deployment;
    @Getter private final int shard;
    @Getter private final EndpointDescription endpoint;
    @Getter private final String podId;

    private final AtomicReference<ReplicaState> state = new AtomicReference<>(ReplicaState.CONNECTING);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger outstanding = new AtomicInteger(0);
    private volatile ManagedChannel channel;
    @Getter private volatile Instant lastProbe;
    @Getter private volatile Instant backoffDeadline = Instant.EPOCH;

    public ReplicaConnection(String deployment, int shard, EndpointDescription endpoint, ManagedChannel channel) {
        this.deployment = deployment;
        this.shard = shard;
        this.endpoint = endpoint;
        this.podId = endpoint.address();
        this.channel = channel;
    }

    public ManagedChannel getChannel() {
        return channel;
    }

    public ReplicaState getState() {
        return state.get();
    }

    public boolean isReady() {
        return state.get() == ReplicaState.READY;
    }

    public int getOutstanding() {
        return outstanding.get();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    /**
     * 在不超过上限的前提下预留一个在途名额。
     *
     * @return 预留成功返回 true
     */
    boolean tryReserve(int maxOutstanding) {
        while (true) {
            int current = outstanding.get();
            if (current >= maxOutstanding) {
                return false;
            }
            if (outstanding.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    void releaseReservation() {
        outstanding.updateAndGet(v -> v > 0 ? v - 1 : 0);
    }

    void markProbed(Instant now) {
        this.lastProbe = now;
    }

    /**
     * @return 状态是否发生了变化
     */
    boolean markReady() {
        consecutiveFailures.set(0);
        ReplicaState previous = state.getAndUpdate(s -> s == ReplicaState.SHUTDOWN ? s : ReplicaState.READY);
        return previous != ReplicaState.READY && previous != ReplicaState.SHUTDOWN;
    }

    /**
     * 记录一次连接级失败并设置下次重连的时间点。
     *
     * @return 累计连续失败次数
     */
    int markFailure(Instant nextAttempt) {
        ReplicaState previous = state.getAndUpdate(s -> s == ReplicaState.SHUTDOWN ? s : ReplicaState.TRANSIENT_FAILURE);
        if (previous == ReplicaState.SHUTDOWN) {
            return consecutiveFailures.get();
        }
        this.backoffDeadline = nextAttempt;
        return consecutiveFailures.incrementAndGet();
    }

    /**
     * 退避到期后替换底层 channel，旧 channel 立即关闭。
     */
    void replaceChannel(ManagedChannel newChannel) {
        ManagedChannel old = this.channel;
        this.channel = newChannel;
        state.compareAndSet(ReplicaState.TRANSIENT_FAILURE, ReplicaState.CONNECTING);
        if (old != null && old != newChannel) {
            old.shutdownNow();
        }
    }

    void shutdown() {
        state.set(ReplicaState.SHUTDOWN);
        ManagedChannel current = this.channel;
        if (current != null) {
            current.shutdownNow();
            try {
                current.awaitTermination(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("等待副本 {} 的 channel 关闭时被中断", podId);
            }
        }
    }

    @Override
    public String toString() {
        return "ReplicaConnection{" +
                "deployment='" + deployment + '\'' +
                ", shard=" + shard +
                ", podId='" + podId + '\'' +
                ", state=" + state.get() +
                ", outstanding=" + outstanding.get() +
                ", failures=" + consecutiveFailures.get() +
                '}';
    }
}
