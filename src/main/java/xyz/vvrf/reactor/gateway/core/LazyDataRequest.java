package xyz.vvrf.reactor.gateway.core;

import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Struct;
import xyz.vvrf.reactor.gateway.proto.DataRequest;
import xyz.vvrf.reactor.gateway.proto.RouteProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 延迟解码的 DataRequest。
 * <p>
 * 从线上收到的请求只保存原始字节，第一次读取字段时才解码并缓存；读取不会使原始字节失效。
 * 实例不可变：任何修改都通过 {@link #mutate(Consumer)} 产生一个新的 dirty 实例，
 * 其序列化结果重新编码。未被修改的请求在转发时原样输出原始字节。
 * <p>
 * {@link #toByteArray()} 返回的数组可能是内部缓冲区本身，调用方不得修改。
 */
public final class LazyDataRequest {

    private final byte[] buffer;
    private final boolean dirty;
    private volatile DataRequest decoded;
    private volatile byte[] encodedCache;

    private LazyDataRequest(byte[] buffer, DataRequest decoded, boolean dirty) {
        this.buffer = buffer;
        this.decoded = decoded;
        this.dirty = dirty;
    }

    /**
     * 包装线上收到的字节，不做任何解码。
     */
    public static LazyDataRequest fromBytes(byte[] bytes) {
        return new LazyDataRequest(Objects.requireNonNull(bytes, "请求字节不能为空"), null, false);
    }

    /**
     * 由网关自行构造的请求，没有可复用的原始字节。
     */
    public static LazyDataRequest fromProto(DataRequest proto) {
        return new LazyDataRequest(null, Objects.requireNonNull(proto, "DataRequest 不能为空"), true);
    }

    /**
     * 返回解码后的消息，首次调用时解码。
     *
     * @throws GatewayException BAD_REQUEST，当字节不是合法的 DataRequest
     */
    public DataRequest getProto() {
        DataRequest local = decoded;
        if (local == null) {
            synchronized (this) {
                local = decoded;
                if (local == null) {
                    try {
                        local = DataRequest.parseFrom(buffer);
                    } catch (InvalidProtocolBufferException e) {
                        throw new GatewayException(GatewayErrorCode.BAD_REQUEST, "无法解析 DataRequest: " + e.getMessage(), e);
                    }
                    decoded = local;
                }
            }
        }
        return local;
    }

    /**
     * 产生一个修改后的新实例，当前实例保持不变。
     */
    public LazyDataRequest mutate(Consumer<DataRequest.Builder> mutator) {
        DataRequest.Builder builder = getProto().toBuilder();
        mutator.accept(builder);
        return new LazyDataRequest(null, builder.build(), true);
    }

    public byte[] toByteArray() {
        if (!dirty && buffer != null) {
            return buffer;
        }
        byte[] local = encodedCache;
        if (local == null) {
            local = getProto().toByteArray();
            encodedCache = local;
        }
        return local;
    }

    public int getSerializedSize() {
        if (!dirty && buffer != null) {
            return buffer.length;
        }
        return getProto().getSerializedSize();
    }

    public boolean isDirty() {
        return dirty;
    }

    public boolean isDecoded() {
        return decoded != null;
    }

    public String getRequestId() {
        return getProto().getHeader().getRequestId();
    }

    /**
     * 顶层 exec_endpoint，为空时回退到 header 中的同名字段。
     */
    public String getExecEndpoint() {
        DataRequest proto = getProto();
        return !proto.getExecEndpoint().isEmpty() ? proto.getExecEndpoint() : proto.getHeader().getExecEndpoint();
    }

    /**
     * 顶层 target_executor，为空时回退到 header 中的同名字段。
     */
    public String getTargetExecutor() {
        DataRequest proto = getProto();
        return !proto.getTargetExecutor().isEmpty() ? proto.getTargetExecutor() : proto.getHeader().getTargetExecutor();
    }


    public Struct getParameters() {
        return getProto().getParameters();
    }

    public StatusProto getStatus() {
        return getProto().getStatus();
    }

    public boolean isSuccess() {
        return getStatus().getCode() == StatusProto.StatusCode.SUCCESS;
    }

    public int getDocsCount() {
        return getProto().getDataCount();
    }

    public List<RouteProto> getRoutes() {
        return getProto().getRoutesList();
    }

    @Override
    public String toString() {
        return "LazyDataRequest{" +
                "size=" + getSerializedSize() +
                ", dirty=" + dirty +
                ", decoded=" + isDecoded() +
                '}';
    }
}
