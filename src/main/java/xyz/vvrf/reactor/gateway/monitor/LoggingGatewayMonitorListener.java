package xyz.vvrf.reactor.gateway.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.time.Duration;

@Slf4j
public class LoggingGatewayMonitorListener implements GatewayMonitorListener {

    @Override
    public void onRequestStart(String requestId, String flowName, String endpoint) {
        log.debug("[MONITOR] 请求:[{}] Flow:[{}] 端点:[{}] 开始。", requestId, flowName, endpoint);
    }

    @Override
    public void onRequestComplete(String requestId, String flowName, String endpoint, Duration latency, StatusProto status) {
        if (Statuses.isError(status)) {
            log.warn("[MONITOR] 请求:[{}] Flow:[{}] 端点:[{}] 失败。 耗时:[{}ms], 状态:[{}], 描述:[{}]",
                    requestId, flowName, endpoint, latency.toMillis(), status.getCode(), status.getDescription());
        } else {
            log.debug("[MONITOR] 请求:[{}] Flow:[{}] 端点:[{}] 完成。 耗时:[{}ms]",
                    requestId, flowName, endpoint, latency.toMillis());
        }
    }

    @Override
    public void onExecutorCallSuccess(String requestId, String executor, String podId, Duration latency) {
        log.debug("[MONITOR] 请求:[{}] Executor:[{}] 副本:[{}] 成功。 耗时:[{}ms]",
                requestId, executor, podId, latency.toMillis());
    }

    @Override
    public void onExecutorCallFailure(String requestId, String executor, String podId, Duration latency, String description) {
        log.warn("[MONITOR] 请求:[{}] Executor:[{}] 副本:[{}] 失败。 耗时:[{}ms], 错误:[{}]",
                requestId, executor, podId, latency.toMillis(), description);
    }

    @Override
    public void onIllegalTransition(String requestId, String from, String to) {
        log.warn("[MONITOR] 请求:[{}] 非法状态迁移 {} -> {}，已丢弃。", requestId, from, to);
    }

    @Override
    public void onInFlightChanged(int inFlight) {
        log.trace("[MONITOR] 在途请求数: {}", inFlight);
    }

    @Override
    public void onPrefetchWait(Duration waited) {
        log.trace("[MONITOR] prefetch 等待 {}ms", waited.toMillis());
    }
}
