package xyz.vvrf.reactor.gateway.codec;

import io.grpc.MethodDescriptor;
import io.grpc.Status;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * gRPC 消息编解码：只搬运字节，不在传输路径上解码 DataRequest。
 */
public final class DataRequestMarshaller implements MethodDescriptor.Marshaller<LazyDataRequest> {

    public static final DataRequestMarshaller INSTANCE = new DataRequestMarshaller();

    private DataRequestMarshaller() {}

    @Override
    public InputStream stream(LazyDataRequest value) {
        return new ByteArrayInputStream(value.toByteArray());
    }

    @Override
    public LazyDataRequest parse(InputStream stream) {
        try {
            return LazyDataRequest.fromBytes(stream.readAllBytes());
        } catch (IOException e) {
            throw Status.INTERNAL
                    .withDescription("读取 DataRequest 字节失败: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException();
        }
    }
}
