package xyz.vvrf.reactor.gateway.streaming;

import java.util.EnumSet;
import java.util.Set;

/**
 * 单个请求在网关内的生命周期状态。
 */
public enum RequestState {

    RECEIVED,
    DISPATCHING,
    AWAITING_JOINS,
    COMPLETE,
    ERRORED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETE || this == ERRORED || this == CANCELLED;
    }

    /**
     * 终态之后不允许任何迁移；DISPATCHING 与 AWAITING_JOINS 之间可以往返 (汇合之后继续派发下游)。
     */
    public boolean canTransitionTo(RequestState next) {
        return allowedTargets().contains(next);
    }

    private Set<RequestState> allowedTargets() {
        switch (this) {
            case RECEIVED:
                return EnumSet.of(DISPATCHING, ERRORED, CANCELLED);
            case DISPATCHING:
                return EnumSet.of(AWAITING_JOINS, COMPLETE, ERRORED, CANCELLED);
            case AWAITING_JOINS:
                return EnumSet.of(DISPATCHING, COMPLETE, ERRORED, CANCELLED);
            default:
                return EnumSet.noneOf(RequestState.class);
        }
    }
}
