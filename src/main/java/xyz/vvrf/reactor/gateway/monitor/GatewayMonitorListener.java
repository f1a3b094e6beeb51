package xyz.vvrf.reactor.gateway.monitor;

import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.time.Duration;

/**
 * 用于监控网关请求处理事件的监听器接口。
 * 包括请求级别、executor 调用级别以及流控相关事件。
 * 实现必须是线程安全的；抛出的异常会被调用方记录并忽略。
 */
public interface GatewayMonitorListener {

    /**
     * 请求进入网关时调用。
     *
     * @param requestId 请求 ID
     * @param flowName  Flow 名称
     * @param endpoint  exec_endpoint
     */
    void onRequestStart(String requestId, String flowName, String endpoint);

    /**
     * 请求离开网关时调用 (无论成功或失败)。
     *
     * @param requestId 请求 ID
     * @param flowName  Flow 名称
     * @param endpoint  exec_endpoint
     * @param latency   从进入到离开的总耗时
     * @param status    出口请求的最终状态
     */
    void onRequestComplete(String requestId, String flowName, String endpoint, Duration latency, StatusProto status);

    /**
     * 一次 executor 调用成功返回 (executor 返回 SUCCESS 状态)。
     *
     * @param requestId 请求 ID
     * @param executor  deployment 名称
     * @param podId     副本地址
     * @param latency   调用耗时
     */
    void onExecutorCallSuccess(String requestId, String executor, String podId, Duration latency);

    /**
     * 一次 executor 调用失败 (传输错误或 executor 返回错误状态)。
     *
     * @param requestId   请求 ID
     * @param executor    deployment 名称
     * @param podId       副本地址，未能获取副本时为空串
     * @param latency     调用耗时
     * @param description 错误描述
     */
    void onExecutorCallFailure(String requestId, String executor, String podId, Duration latency, String description);

    /**
     * 请求状态机收到非法迁移 (已被丢弃)。
     */
    void onIllegalTransition(String requestId, String from, String to);

    /**
     * 在途请求数变化。
     *
     * @param inFlight 当前在途请求数
     */
    void onInFlightChanged(int inFlight);

    /**
     * 因 prefetch 窗口已满，请求在进入派发前等待的时长。
     */
    void onPrefetchWait(Duration waited);
}
