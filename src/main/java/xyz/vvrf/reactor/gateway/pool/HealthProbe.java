package xyz.vvrf.reactor.gateway.pool;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 副本健康探测。返回 true 表示副本可用；false 或错误表示不可用。
 */
@FunctionalInterface
public interface HealthProbe {

    Mono<Boolean> probe(ReplicaConnection replica, Duration timeout);
}
