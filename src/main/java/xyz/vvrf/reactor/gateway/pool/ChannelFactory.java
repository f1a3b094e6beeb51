package xyz.vvrf.reactor.gateway.pool;

import io.grpc.ManagedChannel;
import xyz.vvrf.reactor.gateway.topology.EndpointDescription;

/**
 * 为 executor 端点创建 gRPC channel。
 */
@FunctionalInterface
public interface ChannelFactory {

    ManagedChannel create(EndpointDescription endpoint);
}
