package xyz.vvrf.reactor.gateway.pool;

import com.google.protobuf.Empty;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptors;
import io.grpc.Metadata;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.MetadataUtils;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.codec.CompressionAlgorithm;
import xyz.vvrf.reactor.gateway.codec.JinaMethods;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.proto.EndpointsProto;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 通过 jina.JinaSingleDataRequestRPC/process_single_data 调用 executor。
 * 端点名放在调用头 "endpoint" 中；配置了默认工作目录时一并放入 "workspace-base"。
 */
@Slf4j
public class GrpcExecutorClient implements ExecutorClient {

    public static final Metadata.Key<String> ENDPOINT_HEADER =
            Metadata.Key.of("endpoint", Metadata.ASCII_STRING_MARSHALLER);
    public static final Metadata.Key<String> WORKSPACE_BASE_HEADER =
            Metadata.Key.of("workspace-base", Metadata.ASCII_STRING_MARSHALLER);

    private final CompressionAlgorithm compression;
    private final String workspaceBase;

    public GrpcExecutorClient(CompressionAlgorithm compression, String workspaceBase) {
        this.compression = compression != null ? compression : CompressionAlgorithm.NONE;
        this.workspaceBase = (workspaceBase != null && !workspaceBase.isEmpty()) ? workspaceBase : null;
        log.info("GrpcExecutorClient 初始化。压缩: {}, workspace-base: {}", this.compression, this.workspaceBase);
    }

    @Override
    public Mono<LazyDataRequest> send(ReplicaConnection replica, LazyDataRequest request, String execEndpoint, Duration timeout) {
        return Mono.create(sink -> {
            Metadata headers = new Metadata();
            headers.put(ENDPOINT_HEADER, execEndpoint != null ? execEndpoint : "");
            if (workspaceBase != null) {
                headers.put(WORKSPACE_BASE_HEADER, workspaceBase);
            }
            Channel channel = ClientInterceptors.intercept(replica.getChannel(), MetadataUtils.newAttachHeadersInterceptor(headers));

            CallOptions options = CallOptions.DEFAULT.withDeadlineAfter(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            if (compression.getEncoding() != null) {
                options = options.withCompression(compression.getEncoding());
            }
            ClientCall<LazyDataRequest, LazyDataRequest> call = channel.newCall(JinaMethods.PROCESS_SINGLE_DATA, options);
            sink.onCancel(() -> call.cancel("网关取消了调用", null));

            ClientCalls.asyncUnaryCall(call, request, new StreamObserver<LazyDataRequest>() {
                @Override
                public void onNext(LazyDataRequest response) {
                    sink.success(response);
                }

                @Override
                public void onError(Throwable t) {
                    sink.error(t);
                }

                @Override
                public void onCompleted() {
                    sink.success();
                }
            });
        });
    }

    /**
     * 调用 jina.JinaDiscoverEndpointsRPC/endpoint_discovery。
     */
    @Override
    public Mono<List<String>> discoverEndpoints(ReplicaConnection replica, Duration timeout) {
        return Mono.create(sink -> {
            CallOptions options = CallOptions.DEFAULT.withDeadlineAfter(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            ClientCall<Empty, EndpointsProto> call = replica.getChannel().newCall(JinaMethods.ENDPOINT_DISCOVERY, options);
            sink.onCancel(() -> call.cancel("网关取消了端点查询", null));

            ClientCalls.asyncUnaryCall(call, Empty.getDefaultInstance(), new StreamObserver<EndpointsProto>() {
                @Override
                public void onNext(EndpointsProto response) {
                    sink.success(response.getEndpointsList());
                }

                @Override
                public void onError(Throwable t) {
                    sink.error(t);
                }

                @Override
                public void onCompleted() {
                    sink.success();
                }
            });
        });
    }
}
