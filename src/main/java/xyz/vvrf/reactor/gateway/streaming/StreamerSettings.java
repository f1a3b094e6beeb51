package xyz.vvrf.reactor.gateway.streaming;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 请求流参数。
 */
@Getter
@Builder
@ToString
public class StreamerSettings {

    /** 每个客户端流的最大在途请求数，0 表示不限 */
    @Builder.Default
    private final int prefetch = 0;
    @Builder.Default
    private final int maxPrefetch = 1000;
    @Builder.Default
    private final int maxConcurrentStreams = 1024;
    /** 关闭时允许在途请求完成的时长 */
    @Builder.Default
    private final Duration drain = Duration.ofSeconds(5);

    public static StreamerSettings defaults() {
        return StreamerSettings.builder().build();
    }
}
