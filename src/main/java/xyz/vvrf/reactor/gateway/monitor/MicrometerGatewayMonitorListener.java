package xyz.vvrf.reactor.gateway.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 将监控事件记录为 Micrometer 指标。
 * Prometheus 导出名分别为 requests_total、request_latency_seconds、executor_calls_total、
 * executor_latency_seconds、in_flight、prefetch_wait_seconds、request_illegal_transitions_total。
 */
@Slf4j
public class MicrometerGatewayMonitorListener implements GatewayMonitorListener {

    // 指标名称
    static final String METRIC_REQUESTS_TOTAL = "requests.total";
    static final String METRIC_REQUEST_LATENCY = "request.latency";
    static final String METRIC_EXECUTOR_CALLS_TOTAL = "executor.calls.total";
    static final String METRIC_EXECUTOR_LATENCY = "executor.latency";
    static final String METRIC_IN_FLIGHT = "in.flight";
    static final String METRIC_PREFETCH_WAIT = "prefetch.wait";
    static final String METRIC_ILLEGAL_TRANSITIONS = "request.illegal.transitions";

    // 标签键
    private static final String TAG_ENDPOINT = "endpoint";
    private static final String TAG_EXECUTOR = "executor";
    private static final String TAG_STATUS = "status";

    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger inFlight;

    public MicrometerGatewayMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.inFlight = meterRegistry.gauge(METRIC_IN_FLIGHT, new AtomicInteger(0));
    }

    @Override
    public void onRequestStart(String requestId, String flowName, String endpoint) {
        // 请求计数在完成时按状态记录
    }

    @Override
    public void onRequestComplete(String requestId, String flowName, String endpoint, Duration latency, StatusProto status) {
        String endpointTag = endpoint == null || endpoint.isEmpty() ? "/" : endpoint;
        Tags tags = Tags.of(Tag.of(TAG_ENDPOINT, endpointTag), Tag.of(TAG_STATUS, status.getCode().name()));
        incrementCounter(METRIC_REQUESTS_TOTAL, "按端点与状态统计的请求总数", tags);
        recordTimer(METRIC_REQUEST_LATENCY, "请求端到端耗时", Tags.of(TAG_ENDPOINT, endpointTag), latency);
    }

    @Override
    public void onExecutorCallSuccess(String requestId, String executor, String podId, Duration latency) {
        incrementCounter(METRIC_EXECUTOR_CALLS_TOTAL, "按 executor 与状态统计的调用总数",
                Tags.of(Tag.of(TAG_EXECUTOR, executor), Tag.of(TAG_STATUS, STATUS_SUCCESS)));
        recordTimer(METRIC_EXECUTOR_LATENCY, "executor 调用耗时", Tags.of(TAG_EXECUTOR, executor), latency);
    }

    @Override
    public void onExecutorCallFailure(String requestId, String executor, String podId, Duration latency, String description) {
        incrementCounter(METRIC_EXECUTOR_CALLS_TOTAL, "按 executor 与状态统计的调用总数",
                Tags.of(Tag.of(TAG_EXECUTOR, executor), Tag.of(TAG_STATUS, STATUS_FAILURE)));
        recordTimer(METRIC_EXECUTOR_LATENCY, "executor 调用耗时", Tags.of(TAG_EXECUTOR, executor), latency);
    }

    @Override
    public void onIllegalTransition(String requestId, String from, String to) {
        incrementCounter(METRIC_ILLEGAL_TRANSITIONS, "被丢弃的非法请求状态迁移次数", Tags.empty());
    }

    @Override
    public void onInFlightChanged(int current) {
        if (inFlight != null) {
            inFlight.set(current);
        }
    }

    @Override
    public void onPrefetchWait(Duration waited) {
        recordTimer(METRIC_PREFETCH_WAIT, "prefetch 窗口已满时的等待时长", Tags.empty(), waited);
    }

    private void recordTimer(String name, String description, Tags tags, Duration duration) {
        try {
            Timer.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry)
                    .record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }

    private void incrementCounter(String name, String description, Tags tags) {
        try {
            Counter.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加计数器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }
}
