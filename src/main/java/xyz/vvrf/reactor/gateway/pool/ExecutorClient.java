package xyz.vvrf.reactor.gateway.pool;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * 向某个副本发送一次单请求调用。取消订阅即取消底层调用。
 */
public interface ExecutorClient {

    /**
     * @param replica      已预留名额的副本
     * @param request      待发送请求 (原样发送其字节)
     * @param execEndpoint 端点，随调用头一并发送
     * @param timeout      本次调用的截止时长
     * @return executor 的响应；传输错误以 {@link io.grpc.StatusRuntimeException} 结束
     */
    Mono<LazyDataRequest> send(ReplicaConnection replica, LazyDataRequest request, String execEndpoint, Duration timeout);

    /**
     * 查询副本暴露的端点。空列表表示不做限制。
     */
    default Mono<List<String>> discoverEndpoints(ReplicaConnection replica, Duration timeout) {
        return Mono.just(Collections.emptyList());
    }
}
