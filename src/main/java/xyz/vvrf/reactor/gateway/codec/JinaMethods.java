package xyz.vvrf.reactor.gateway.codec;

import com.google.protobuf.Empty;
import io.grpc.MethodDescriptor;
import io.grpc.protobuf.ProtoUtils;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.proto.EndpointsProto;
import xyz.vvrf.reactor.gateway.proto.JinaInfoProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

/**
 * jina.proto 中各服务方法的 gRPC 描述符。
 * DataRequest 使用 {@link DataRequestMarshaller}，以便请求字节原样透传；其余消息使用 protobuf marshaller。
 */
public final class JinaMethods {

    public static final String JINA_RPC = "jina.JinaRPC";
    public static final String SINGLE_DATA_REQUEST_RPC = "jina.JinaSingleDataRequestRPC";
    public static final String DISCOVER_ENDPOINTS_RPC = "jina.JinaDiscoverEndpointsRPC";
    public static final String DRY_RUN_RPC = "jina.JinaGatewayDryRunRPC";
    public static final String INFO_RPC = "jina.JinaInfoRPC";

    public static final MethodDescriptor<LazyDataRequest, LazyDataRequest> CALL =
            MethodDescriptor.<LazyDataRequest, LazyDataRequest>newBuilder()
                    .setType(MethodDescriptor.MethodType.BIDI_STREAMING)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(JINA_RPC, "Call"))
                    .setRequestMarshaller(DataRequestMarshaller.INSTANCE)
                    .setResponseMarshaller(DataRequestMarshaller.INSTANCE)
                    .build();

    public static final MethodDescriptor<LazyDataRequest, LazyDataRequest> PROCESS_SINGLE_DATA =
            MethodDescriptor.<LazyDataRequest, LazyDataRequest>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(SINGLE_DATA_REQUEST_RPC, "process_single_data"))
                    .setRequestMarshaller(DataRequestMarshaller.INSTANCE)
                    .setResponseMarshaller(DataRequestMarshaller.INSTANCE)
                    .build();

    public static final MethodDescriptor<Empty, EndpointsProto> ENDPOINT_DISCOVERY =
            MethodDescriptor.<Empty, EndpointsProto>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(DISCOVER_ENDPOINTS_RPC, "endpoint_discovery"))
                    .setRequestMarshaller(ProtoUtils.marshaller(Empty.getDefaultInstance()))
                    .setResponseMarshaller(ProtoUtils.marshaller(EndpointsProto.getDefaultInstance()))
                    .build();

    public static final MethodDescriptor<Empty, StatusProto> DRY_RUN =
            MethodDescriptor.<Empty, StatusProto>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(DRY_RUN_RPC, "dry_run"))
                    .setRequestMarshaller(ProtoUtils.marshaller(Empty.getDefaultInstance()))
                    .setResponseMarshaller(ProtoUtils.marshaller(StatusProto.getDefaultInstance()))
                    .build();

    public static final MethodDescriptor<Empty, JinaInfoProto> STATUS =
            MethodDescriptor.<Empty, JinaInfoProto>newBuilder()
                    .setType(MethodDescriptor.MethodType.UNARY)
                    .setFullMethodName(MethodDescriptor.generateFullMethodName(INFO_RPC, "_status"))
                    .setRequestMarshaller(ProtoUtils.marshaller(Empty.getDefaultInstance()))
                    .setResponseMarshaller(ProtoUtils.marshaller(JinaInfoProto.getDefaultInstance()))
                    .build();

    private JinaMethods() {}
}
