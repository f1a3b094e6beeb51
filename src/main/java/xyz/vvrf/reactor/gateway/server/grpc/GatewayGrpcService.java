package xyz.vvrf.reactor.gateway.server.grpc;

import com.google.protobuf.Empty;
import io.grpc.ServerServiceDefinition;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import xyz.vvrf.reactor.gateway.codec.JinaMethods;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.proto.JinaInfoProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;
import xyz.vvrf.reactor.gateway.server.GatewayInfo;
import xyz.vvrf.reactor.gateway.streaming.RequestStreamer;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 网关对外的 gRPC 服务：JinaRPC/Call (双向流)、JinaSingleDataRequestRPC/process_single_data、
 * JinaGatewayDryRunRPC/dry_run 与 JinaInfoRPC/_status。
 * <p>
 * 双向流关闭了自动 request：只有 {@link RequestStreamer} 产生需求时才从客户端读取下一个请求，
 * 从而把 prefetch 的背压传递到传输层。
 */
@Slf4j
public class GatewayGrpcService {

    private final RequestStreamer streamer;
    private final GatewayInfo gatewayInfo;

    public GatewayGrpcService(RequestStreamer streamer, GatewayInfo gatewayInfo) {
        this.streamer = Objects.requireNonNull(streamer, "RequestStreamer 不能为空");
        this.gatewayInfo = Objects.requireNonNull(gatewayInfo, "GatewayInfo 不能为空");
    }

    public List<ServerServiceDefinition> serviceDefinitions() {
        return Arrays.asList(
                ServerServiceDefinition.builder(JinaMethods.JINA_RPC)
                        .addMethod(JinaMethods.CALL, ServerCalls.asyncBidiStreamingCall(this::call))
                        .build(),
                ServerServiceDefinition.builder(JinaMethods.SINGLE_DATA_REQUEST_RPC)
                        .addMethod(JinaMethods.PROCESS_SINGLE_DATA, ServerCalls.asyncUnaryCall(this::processSingleData))
                        .build(),
                ServerServiceDefinition.builder(JinaMethods.DRY_RUN_RPC)
                        .addMethod(JinaMethods.DRY_RUN, ServerCalls.asyncUnaryCall(this::dryRun))
                        .build(),
                ServerServiceDefinition.builder(JinaMethods.INFO_RPC)
                        .addMethod(JinaMethods.STATUS, ServerCalls.asyncUnaryCall(this::status))
                        .build());
    }

    StreamObserver<LazyDataRequest> call(StreamObserver<LazyDataRequest> responseObserver) {
        ServerCallStreamObserver<LazyDataRequest> serverObserver = (ServerCallStreamObserver<LazyDataRequest>) responseObserver;
        serverObserver.disableAutoRequest();

        Sinks.Many<LazyDataRequest> inbound = Sinks.many().unicast().onBackpressureBuffer();
        Flux<LazyDataRequest> ingress = inbound.asFlux()
                .doOnRequest(n -> serverObserver.request((int) Math.min(n, Integer.MAX_VALUE)));

        Disposable.Swap subscription = Disposables.swap();
        serverObserver.setOnCancelHandler(() -> {
            log.debug("客户端取消了 Call 流");
            subscription.dispose();
        });
        subscription.update(streamer.stream(ingress).subscribe(
                response -> {
                    if (!serverObserver.isCancelled()) {
                        serverObserver.onNext(response);
                    }
                },
                error -> {
                    log.warn("Call 流以错误结束: {}", error.getMessage());
                    if (!serverObserver.isCancelled()) {
                        serverObserver.onError(GatewayException.wrap(error).toStatusRuntimeException());
                    }
                },
                () -> {
                    if (!serverObserver.isCancelled()) {
                        serverObserver.onCompleted();
                    }
                }));

        return new StreamObserver<LazyDataRequest>() {
            @Override
            public void onNext(LazyDataRequest request) {
                Sinks.EmitResult result = inbound.tryEmitNext(request);
                if (result.isFailure()) {
                    log.warn("无法接收 Call 流中的请求: {}", result);
                }
            }

            @Override
            public void onError(Throwable t) {
                inbound.tryEmitError(t);
            }

            @Override
            public void onCompleted() {
                inbound.tryEmitComplete();
            }
        };
    }

    void processSingleData(LazyDataRequest request, StreamObserver<LazyDataRequest> responseObserver) {
        bindUnary(streamer.processSingle(request), responseObserver);
    }

    void dryRun(Empty empty, StreamObserver<StatusProto> responseObserver) {
        bindUnary(streamer.dryRun(), responseObserver);
    }

    void status(Empty empty, StreamObserver<JinaInfoProto> responseObserver) {
        responseObserver.onNext(gatewayInfo.toProto());
        responseObserver.onCompleted();
    }

    private static <T> void bindUnary(Mono<T> result, StreamObserver<T> responseObserver) {
        ServerCallStreamObserver<T> serverObserver = (ServerCallStreamObserver<T>) responseObserver;
        Disposable.Swap subscription = Disposables.swap();
        serverObserver.setOnCancelHandler(subscription::dispose);
        subscription.update(result.subscribe(
                value -> {
                    if (!serverObserver.isCancelled()) {
                        serverObserver.onNext(value);
                    }
                },
                error -> {
                    if (!serverObserver.isCancelled()) {
                        serverObserver.onError(GatewayException.wrap(error).toStatusRuntimeException());
                    }
                },
                () -> {
                    if (!serverObserver.isCancelled()) {
                        serverObserver.onCompleted();
                    }
                }));
    }
}
