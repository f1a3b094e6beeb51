package xyz.vvrf.reactor.gateway.codec;

import io.grpc.Codec;
import io.grpc.CompressorRegistry;
import io.grpc.DecompressorRegistry;

/**
 * 发送方可选的消息压缩算法。算法名随 gRPC 消息头 (grpc-encoding) 传递，接收方据此解压，不做协商。
 */
public enum CompressionAlgorithm {

    NONE(null),
    GZIP(new Codec.Gzip().getMessageEncoding()),
    LZ4(Lz4Codec.ENCODING);

    private static final CompressorRegistry COMPRESSORS;
    private static final DecompressorRegistry DECOMPRESSORS;

    static {
        Lz4Codec lz4 = new Lz4Codec();
        COMPRESSORS = CompressorRegistry.newEmptyInstance();
        COMPRESSORS.register(Codec.Identity.NONE);
        COMPRESSORS.register(new Codec.Gzip());
        COMPRESSORS.register(lz4);
        DECOMPRESSORS = DecompressorRegistry.getDefaultInstance().with(lz4, true);
    }

    private final String encoding;

    CompressionAlgorithm(String encoding) {
        this.encoding = encoding;
    }

    /**
     * gRPC 消息编码名；NONE 返回 null。
     */
    public String getEncoding() {
        return encoding;
    }

    public static CompressorRegistry compressorRegistry() {
        return COMPRESSORS;
    }

    public static DecompressorRegistry decompressorRegistry() {
        return DECOMPRESSORS;
    }
}
