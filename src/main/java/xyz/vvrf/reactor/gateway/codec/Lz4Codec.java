package xyz.vvrf.reactor.gateway.codec;

import io.grpc.Codec;
import net.jpountz.lz4.LZ4FrameInputStream;
import net.jpountz.lz4.LZ4FrameOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * gRPC 消息级 LZ4 压缩 (LZ4 frame 格式)，消息编码名为 "lz4"。
 */
public class Lz4Codec implements Codec {

    public static final String ENCODING = "lz4";

    @Override
    public String getMessageEncoding() {
        return ENCODING;
    }

    @Override
    public OutputStream compress(OutputStream os) throws IOException {
        return new LZ4FrameOutputStream(os);
    }

    @Override
    public InputStream decompress(InputStream is) throws IOException {
        return new LZ4FrameInputStream(is);
    }
}
