package xyz.vvrf.reactor.gateway.test.util;

import com.google.protobuf.Empty;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.codec.CompressionAlgorithm;
import xyz.vvrf.reactor.gateway.codec.JinaMethods;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.pool.GrpcExecutorClient;
import xyz.vvrf.reactor.gateway.proto.DocumentProto;
import xyz.vvrf.reactor.gateway.proto.EndpointsProto;
import xyz.vvrf.reactor.gateway.topology.EndpointDescription;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * 进程内的假 executor：实现 process_single_data 与健康检查。
 * <p>
 * 默认原样返回收到的请求 (不解码)。可配置延迟、按文档打标签、返回应用错误、
 * 以及前 n 次调用返回传输错误。端点查询默认返回 UNIMPLEMENTED，{@link #exposing(String...)} 后返回给定端点。{@link #startNetty(String)} 改用本机 Netty 端口，消息压缩会真正作用在线上字节。
 */
public class FakeExecutor implements AutoCloseable {

    private static final Context.Key<String> ENDPOINT = Context.key("endpoint");
    private static final Context.Key<String> WORKSPACE = Context.key("workspace-base");
    private static final Context.Key<String> ENCODING = Context.key("grpc-encoding");
    private static final Metadata.Key<String> ENCODING_HEADER =
            Metadata.Key.of("grpc-encoding", Metadata.ASCII_STRING_MARSHALLER);

    private final String name;
    private EndpointDescription endpoint;
    private final Server server;
    private final HealthStatusManager health = new HealthStatusManager();

    private final List<LazyDataRequest> received = new CopyOnWriteArrayList<>();
    private final List<String> endpoints = new CopyOnWriteArrayList<>();
    private final List<String> workspaces = new CopyOnWriteArrayList<>();
    private final List<String> encodings = new CopyOnWriteArrayList<>();
    private final AtomicInteger cancelled = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger transportFailures = new AtomicInteger();
    private final AtomicInteger discoveryCalls = new AtomicInteger();
    private volatile List<String> exposedEndpoints;

    private volatile Status.Code failureCode = Status.Code.UNAVAILABLE;
    private volatile Duration delay = Duration.ZERO;
    private volatile UnaryOperator<LazyDataRequest> behavior = UnaryOperator.identity();

    private FakeExecutor(String name, int shard, int replica, boolean netty) {
        this.name = name;
        ServerBuilder<?> builder;
        if (netty) {
            builder = NettyServerBuilder.forAddress(new InetSocketAddress("localhost", 0));
        } else {
            this.endpoint = EndpointDescription.of("fake-" + name + "-" + UUID.randomUUID(), 1000 + replica);
            builder = InProcessServerBuilder.forName(endpoint.address()).directExecutor();
        }

        ServerServiceDefinition service = ServerServiceDefinition.builder(JinaMethods.SINGLE_DATA_REQUEST_RPC)
                .addMethod(JinaMethods.PROCESS_SINGLE_DATA, ServerCalls.asyncUnaryCall(this::process))
                .build();
        ServerServiceDefinition discovery = ServerServiceDefinition.builder(JinaMethods.DISCOVER_ENDPOINTS_RPC)
                .addMethod(JinaMethods.ENDPOINT_DISCOVERY, ServerCalls.asyncUnaryCall(this::discover))
                .build();
        this.server = builder
                .addService(ServerInterceptors.intercept(service, new HeaderCapture()))
                .addService(discovery)
                .addService(health.getHealthService())
                .compressorRegistry(CompressionAlgorithm.compressorRegistry())
                .decompressorRegistry(CompressionAlgorithm.decompressorRegistry())
                .build();
        health.setStatus(HealthStatusManager.SERVICE_NAME_ALL_SERVICES, ServingStatus.SERVING);
        try {
            server.start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (netty) {
            this.endpoint = EndpointDescription.of("localhost", server.getPort());
        }
        endpoint.setShardId(shard).setReplicaId(replica);
    }

    public static FakeExecutor start(String name) {
        return new FakeExecutor(name, 0, 0, false);
    }

    public static FakeExecutor start(String name, int shard, int replica) {
        return new FakeExecutor(name, shard, replica, false);
    }

    public static FakeExecutor startNetty(String name) {
        return new FakeExecutor(name, 0, 0, true);
    }

    private void process(LazyDataRequest request, StreamObserver<LazyDataRequest> responseObserver) {
        ServerCallStreamObserver<LazyDataRequest> observer = (ServerCallStreamObserver<LazyDataRequest>) responseObserver;
        received.add(request);
        endpoints.add(ENDPOINT.get() != null ? ENDPOINT.get() : "");
        if (WORKSPACE.get() != null) {
            workspaces.add(WORKSPACE.get());
        }
        encodings.add(ENCODING.get() != null ? ENCODING.get() : "");

        if (transportFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            observer.onError(Status.fromCode(failureCode).withDescription(name + " 模拟传输错误").asRuntimeException());
            return;
        }

        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        Disposable pending = Mono.delay(delay)
                .subscribe(tick -> {
                    inFlight.decrementAndGet();
                    if (observer.isCancelled()) {
                        return;
                    }
                    observer.onNext(behavior.apply(request));
                    observer.onCompleted();
                });
        observer.setOnCancelHandler(() -> {
            if (!pending.isDisposed()) {
                pending.dispose();
                inFlight.decrementAndGet();
            }
            cancelled.incrementAndGet();
        });
    }

    private void discover(Empty request, StreamObserver<EndpointsProto> observer) {
        discoveryCalls.incrementAndGet();
        List<String> exposed = exposedEndpoints;
        if (exposed == null) {
            observer.onError(Status.UNIMPLEMENTED.withDescription(name + " 未实现端点查询").asRuntimeException());
            return;
        }
        observer.onNext(EndpointsProto.newBuilder().addAllEndpoints(exposed).build());
        observer.onCompleted();
    }

    // ---------------------------------------------------------------- 行为配置

    /**
     * 端点查询返回给定端点。
     */
    public FakeExecutor exposing(String... endpoints) {
        this.exposedEndpoints = Arrays.asList(endpoints);
        return this;
    }

    public FakeExecutor delay(Duration delay) {
        this.delay = delay;
        return this;
    }

    /**
     * 把每个文档的 id 改写为 "name(id)"。
     */
    public FakeExecutor tagging() {
        this.behavior = request -> request.mutate(builder -> {
            List<DocumentProto> docs = builder.getDataList();
            builder.clearData();
            for (DocumentProto doc : docs) {
                builder.addData(doc.toBuilder().setId(name + "(" + doc.getId() + ")"));
            }
        });
        return this;
    }

    /**
     * 追加一个 id 为 name 的文档。
     */
    public FakeExecutor appending() {
        this.behavior = request -> request.mutate(builder -> builder.addData(DocumentProto.newBuilder().setId(name)));
        return this;
    }

    /**
     * 返回应用层错误 (响应状态 ERROR)。
     */
    public FakeExecutor failing(String description) {
        this.behavior = request -> request.mutate(builder -> builder.setStatus(Statuses.error(description)));
        return this;
    }

    public FakeExecutor behavior(UnaryOperator<LazyDataRequest> behavior) {
        this.behavior = behavior;
        return this;
    }

    /**
     * 接下来的 times 次调用返回指定的传输错误码。
     */
    public FakeExecutor failTransport(Status.Code code, int times) {
        this.failureCode = code;
        this.transportFailures.set(times);
        return this;
    }

    public void markNotServing() {
        health.setStatus(HealthStatusManager.SERVICE_NAME_ALL_SERVICES, ServingStatus.NOT_SERVING);
    }

    // ---------------------------------------------------------------- 观察

    public String getName() {
        return name;
    }

    public EndpointDescription getEndpoint() {
        return endpoint;
    }

    public String getPodId() {
        return endpoint.address();
    }

    public List<LazyDataRequest> getReceived() {
        return received;
    }

    public int getCallCount() {
        return received.size();
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    public List<String> getWorkspaces() {
        return workspaces;
    }

    /**
     * 每次调用收到的 grpc-encoding 头，未压缩时为空串。
     */
    public List<String> getEncodings() {
        return encodings;
    }

    public int getDiscoveryCallCount() {
        return discoveryCalls.get();
    }

    public int getCancelledCount() {
        return cancelled.get();
    }

    public int getMaxInFlight() {
        return maxInFlight.get();
    }

    @Override
    public void close() {
        server.shutdownNow();
    }

    private static final class HeaderCapture implements ServerInterceptor {
        @Override
        public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
                                                                     Metadata headers,
                                                                     ServerCallHandler<ReqT, RespT> next) {
            Context context = Context.current()
                    .withValue(ENDPOINT, headers.get(GrpcExecutorClient.ENDPOINT_HEADER))
                    .withValue(WORKSPACE, headers.get(GrpcExecutorClient.WORKSPACE_BASE_HEADER))
                    .withValue(ENCODING, headers.get(ENCODING_HEADER));
            return Contexts.interceptCall(context, call, headers, next);
        }
    }
}
