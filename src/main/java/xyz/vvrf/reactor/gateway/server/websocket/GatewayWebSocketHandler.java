package xyz.vvrf.reactor.gateway.server.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.codec.DataRequestJsonConverter;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Routes;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.proto.DataRequest;
import xyz.vvrf.reactor.gateway.streaming.RequestStreamer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * WebSocket 前端。一条消息即一个请求，响应按完成顺序发送。
 * <p>
 * 子协议 {@code json}：文本帧，请求与响应使用 HTTP 的 JSON 模型；
 * 子协议 {@code bytes}：二进制帧，内容为序列化的 DataRequest。
 * 客户端发送 {@code {}} (文本) 或单字节 {@code 0x01} (二进制) 表示不再有请求，
 * 网关在全部响应发出后以 1000 关闭连接。内部错误以 1011 关闭，原因截断到 123 字节。
 */
@Slf4j
public class GatewayWebSocketHandler implements WebSocketHandler {

    public static final String JSON_PROTOCOL = "json";
    public static final String BYTES_PROTOCOL = "bytes";

    static final String JSON_SENTINEL = "{}";
    static final byte BYTES_SENTINEL = 0x01;
    /** 关闭帧原因的最大字节数 (控制帧 125 字节减去 2 字节状态码) */
    static final int MAX_CLOSE_REASON_BYTES = 123;

    private final RequestStreamer streamer;
    private final DataRequestJsonConverter converter;
    private final WebSocketSessionRegistry registry;

    public GatewayWebSocketHandler(RequestStreamer streamer,
                                   DataRequestJsonConverter converter,
                                   WebSocketSessionRegistry registry) {
        this.streamer = Objects.requireNonNull(streamer, "RequestStreamer 不能为空");
        this.converter = Objects.requireNonNull(converter, "DataRequestJsonConverter 不能为空");
        this.registry = Objects.requireNonNull(registry, "WebSocketSessionRegistry 不能为空");
    }

    @Override
    public List<String> getSubProtocols() {
        return Arrays.asList(JSON_PROTOCOL, BYTES_PROTOCOL);
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        boolean binary = BYTES_PROTOCOL.equals(session.getHandshakeInfo().getSubProtocol());
        String endpoint = session.getHandshakeInfo().getUri().getPath();
        registry.register(session);
        log.debug("WebSocket 会话 {} 已建立，端点 '{}'，子协议 {}", session.getId(), endpoint, binary ? BYTES_PROTOCOL : JSON_PROTOCOL);

        Flux<LazyDataRequest> ingress = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT
                        || message.getType() == WebSocketMessage.Type.BINARY)
                .map(InboundFrame::read)
                .takeWhile(frame -> !frame.isSentinel())
                .map(frame -> decode(frame, endpoint));

        Flux<WebSocketMessage> outbound = streamer.stream(ingress)
                .map(response -> binary
                        ? session.binaryMessage(factory -> factory.wrap(response.toByteArray()))
                        : session.textMessage(converter.toJsonString(response)));

        return session.send(outbound)
                .then(Mono.defer(() -> session.close(CloseStatus.NORMAL)))
                .onErrorResume(error -> {
                    log.warn("WebSocket 会话 {} 出错: {}", session.getId(), error.getMessage());
                    return session.isOpen() ? session.close(closeStatusFor(error)) : Mono.empty();
                })
                .doFinally(signal -> {
                    registry.unregister(session);
                    log.debug("WebSocket 会话 {} 结束 (信号: {})", session.getId(), signal);
                });
    }

    private LazyDataRequest decode(InboundFrame frame, String endpoint) {
        if (frame.bytes != null) {
            return LazyDataRequest.fromBytes(frame.bytes);
        }
        try {
            return converter.fromJson(frame.text, endpoint);
        } catch (GatewayException e) {
            // 无法解析的消息按错误请求处理，仍然得到一个响应
            log.debug("WebSocket 消息无法解析: {}", e.getMessage());
            DataRequest.Builder builder = DataRequest.newBuilder()
                    .setStatus(Statuses.fromThrowable(e, Routes.GATEWAY_EXECUTOR))
                    .setExecEndpoint(endpoint);
            return LazyDataRequest.fromProto(builder.build());
        }
    }

    static CloseStatus closeStatusFor(Throwable error) {
        if (error instanceof GatewayException) {
            GatewayErrorCode code = ((GatewayException) error).getErrorCode();
            if (code == GatewayErrorCode.CANCELLED) {
                return CloseStatus.NORMAL;
            }
            if (code == GatewayErrorCode.RESOURCE_EXHAUSTED) {
                return CloseStatus.SERVICE_OVERLOAD.withReason(truncateReason(error.getMessage()));
            }
        }
        return CloseStatus.SERVER_ERROR.withReason(truncateReason(error.getMessage()));
    }

    /**
     * 按 UTF-8 字节截断，不拆开多字节字符。
     */
    static String truncateReason(String reason) {
        if (reason == null) {
            return "";
        }
        byte[] bytes = reason.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_CLOSE_REASON_BYTES) {
            return reason;
        }
        int end = MAX_CLOSE_REASON_BYTES;
        while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    /**
     * 入站帧内容的拷贝，必须在收到消息的回调内读取。
     */
    private static final class InboundFrame {

        private final String text;
        private final byte[] bytes;

        private InboundFrame(String text, byte[] bytes) {
            this.text = text;
            this.bytes = bytes;
        }

        static InboundFrame read(WebSocketMessage message) {
            if (message.getType() == WebSocketMessage.Type.TEXT) {
                return new InboundFrame(message.getPayloadAsText(), null);
            }
            DataBuffer payload = message.getPayload();
            byte[] bytes = new byte[payload.readableByteCount()];
            payload.read(bytes);
            return new InboundFrame(null, bytes);
        }

        boolean isSentinel() {
            if (text != null) {
                return JSON_SENTINEL.equals(text.trim());
            }
            return bytes.length == 1 && bytes[0] == BYTES_SENTINEL;
        }
    }
}
