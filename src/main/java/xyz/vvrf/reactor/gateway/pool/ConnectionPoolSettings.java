package xyz.vvrf.reactor.gateway.pool;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 连接池参数。
 */
@Getter
@Builder
@ToString
public class ConnectionPoolSettings {

    @Builder.Default
    private final Duration probeInterval = Duration.ofSeconds(5);
    @Builder.Default
    private final Duration probeTimeout = Duration.ofMillis(100);
    @Builder.Default
    private final Duration initialBackoff = Duration.ofSeconds(1);
    @Builder.Default
    private final Duration maxBackoff = Duration.ofSeconds(30);
    @Builder.Default
    private final double backoffJitter = 0.2;
    @Builder.Default
    private final Duration replicaWait = Duration.ofMillis(500);
    @Builder.Default
    private final int maxOutstandingPerReplica = 100;

    public static ConnectionPoolSettings defaults() {
        return ConnectionPoolSettings.builder().build();
    }
}
