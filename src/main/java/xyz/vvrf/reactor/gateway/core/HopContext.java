package xyz.vvrf.reactor.gateway.core;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * 单次派发 (一跳) 所需的请求级信息。
 */
@Getter
public final class HopContext {

    private final String requestId;
    private final String flowName;
    /** 请求级截止时间，null 表示不限 */
    private final Instant deadline;

    public HopContext(String requestId, String flowName, Instant deadline) {
        this.requestId = requestId;
        this.flowName = flowName;
        this.deadline = deadline;
    }

    /**
     * 距截止时间的剩余时长；没有截止时间时返回 null。
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        return Duration.between(Instant.now(), deadline);
    }

    public boolean isExpired() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }
}
