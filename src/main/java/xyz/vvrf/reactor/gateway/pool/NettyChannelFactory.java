package xyz.vvrf.reactor.gateway.pool;

import io.grpc.ManagedChannel;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.codec.CompressionAlgorithm;
import xyz.vvrf.reactor.gateway.topology.EndpointDescription;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Netty 的默认 channel 工厂。
 * 入站消息大小不设上限；keepalive 10s，超时 5s，空闲时也发送。
 */
@Slf4j
public class NettyChannelFactory implements ChannelFactory {

    static final long KEEPALIVE_TIME_MS = 10_000;
    static final long KEEPALIVE_TIMEOUT_MS = 5_000;

    @Override
    public ManagedChannel create(EndpointDescription endpoint) {
        NettyChannelBuilder builder = NettyChannelBuilder.forAddress(endpoint.getHost(), endpoint.getPort())
                .maxInboundMessageSize(Integer.MAX_VALUE)
                .keepAliveTime(KEEPALIVE_TIME_MS, TimeUnit.MILLISECONDS)
                .keepAliveTimeout(KEEPALIVE_TIMEOUT_MS, TimeUnit.MILLISECONDS)
                .keepAliveWithoutCalls(true)
                .compressorRegistry(CompressionAlgorithm.compressorRegistry())
                .decompressorRegistry(CompressionAlgorithm.decompressorRegistry());
        if (endpoint.getProtocol() == EndpointDescription.Protocol.GRPCS) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        log.debug("创建到 {} 的 gRPC channel", endpoint);
        return builder.build();
    }
}
