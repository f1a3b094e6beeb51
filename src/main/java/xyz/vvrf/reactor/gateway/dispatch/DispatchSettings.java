package xyz.vvrf.reactor.gateway.dispatch;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 派发参数。deployment 上配置的 timeout / retries 优先。
 */
@Getter
@Builder
@ToString
public class DispatchSettings {

    @Builder.Default
    private final Duration sendTimeout = Duration.ofSeconds(10);
    @Builder.Default
    private final int maxRetries = 2;
    /** 启用后跳过未暴露请求端点的 deployment */
    @Builder.Default
    private final boolean endpointDiscovery = true;
    @Builder.Default
    private final Duration discoveryTimeout = Duration.ofSeconds(5);

    public static DispatchSettings defaults() {
        return DispatchSettings.builder().build();
    }
}
