package xyz.vvrf.reactor.gateway.server.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBufAllocator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.NettyDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.adapter.ReactorNettyWebSocketSession;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.WebsocketServerSpec;
import xyz.vvrf.reactor.gateway.codec.DataRequestJsonConverter;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.test.util.GatewayTestHarness;
import xyz.vvrf.reactor.gateway.test.util.TestRequests;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GatewayTestHarness harness;
    private WebSocketSessionRegistry registry;
    private DisposableServer server;

    @BeforeEach
    void setUp() {
        harness = new GatewayTestHarness("ws");
        harness.executor("A").tagging();
        harness.start();

        registry = new WebSocketSessionRegistry();
        GatewayWebSocketHandler handler = new GatewayWebSocketHandler(harness.streamer(),
                new DataRequestJsonConverter(objectMapper), registry);
        server = HttpServer.create()
                .port(0)
                .route(routes -> routes.ws("/search", (in, out) -> {
                    HandshakeInfo info = new HandshakeInfo(URI.create("/search"), new HttpHeaders(), Mono.empty(),
                            out.selectedSubprotocol());
                    return handler.handle(new ReactorNettyWebSocketSession(in, out, info,
                            new NettyDataBufferFactory(ByteBufAllocator.DEFAULT)));
                }, WebsocketServerSpec.builder().protocols("json,bytes").build()))
                .bindNow();
    }

    @AfterEach
    void tearDown() {
        server.disposeNow();
        harness.close();
    }

    private void exchange(String protocol,
                          Function<WebSocketSession, Flux<WebSocketMessage>> outbound,
                          List<WebSocketMessage.Type> types,
                          List<byte[]> payloads) {
        WebSocketHandler client = new WebSocketHandler() {
            @Override
            public List<String> getSubProtocols() {
                return Collections.singletonList(protocol);
            }

            @Override
            public Mono<Void> handle(WebSocketSession session) {
                Mono<Void> receive = session.receive()
                        .doOnNext(message -> {
                            types.add(message.getType());
                            byte[] bytes = new byte[message.getPayload().readableByteCount()];
                            message.getPayload().read(bytes);
                            payloads.add(bytes);
                        })
                        .then();
                return session.send(outbound.apply(session)).and(receive);
            }
        };
        new ReactorNettyWebSocketClient()
                .execute(URI.create("ws://localhost:" + server.port() + "/search"), client)
                .block(Duration.ofSeconds(10));
    }

    @Test
    void jsonMessagesAreAnsweredUntilSentinel() throws Exception {
        List<WebSocketMessage.Type> types = new CopyOnWriteArrayList<>();
        List<byte[]> payloads = new CopyOnWriteArrayList<>();

        exchange(GatewayWebSocketHandler.JSON_PROTOCOL, session -> Flux.just(
                session.textMessage("{\"data\":[{\"id\":\"d1\"}],\"request_id\":\"w1\"}"),
                session.textMessage("{not json"),
                session.textMessage(GatewayWebSocketHandler.JSON_SENTINEL)), types, payloads);

        assertThat(types).containsOnly(WebSocketMessage.Type.TEXT);
        assertThat(payloads).hasSize(2);
        JsonNode ok = null;
        JsonNode failed = null;
        for (byte[] payload : payloads) {
            JsonNode node = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8));
            if ("w1".equals(node.path("header").path("request_id").asText())) {
                ok = node;
            } else {
                failed = node;
            }
        }
        assertThat(ok).isNotNull();
        assertThat(ok.path("data").get(0).path("id").asText()).isEqualTo("A(d1)");
        assertThat(ok.path("header").path("exec_endpoint").asText()).isEqualTo("/search");
        assertThat(failed).isNotNull();
        assertThat(failed.path("status").path("code").asText()).isEqualTo("ERROR");
        assertThat(registry.size()).isZero();
    }

    @Test
    void bytesProtocolCarriesSerializedRequests() {
        List<WebSocketMessage.Type> types = new CopyOnWriteArrayList<>();
        List<byte[]> payloads = new CopyOnWriteArrayList<>();
        byte[] request = TestRequests.wire("b1", "d1").toByteArray();

        exchange(GatewayWebSocketHandler.BYTES_PROTOCOL, session -> Flux.just(
                session.binaryMessage(factory -> factory.wrap(request)),
                session.binaryMessage(factory -> factory.wrap(new byte[]{GatewayWebSocketHandler.BYTES_SENTINEL}))),
                types, payloads);

        assertThat(types).containsExactly(WebSocketMessage.Type.BINARY);
        LazyDataRequest response = LazyDataRequest.fromBytes(payloads.get(0));
        assertThat(response.getRequestId()).isEqualTo("b1");
        assertThat(TestRequests.docIds(response)).containsExactly("A(d1)");
    }

    @Test
    void closeStatusMapping() {
        assertThat(GatewayWebSocketHandler.closeStatusFor(new GatewayException(GatewayErrorCode.CANCELLED, "bye")))
                .isEqualTo(CloseStatus.NORMAL);
        assertThat(GatewayWebSocketHandler.closeStatusFor(new GatewayException(GatewayErrorCode.RESOURCE_EXHAUSTED, "full"))
                .getCode()).isEqualTo(1013);
        CloseStatus internal = GatewayWebSocketHandler.closeStatusFor(new IllegalStateException("kaputt"));
        assertThat(internal.getCode()).isEqualTo(1011);
        assertThat(internal.getReason()).isEqualTo("kaputt");
    }

    @Test
    void closeReasonIsTruncatedOnCharacterBoundary() {
        String ascii = "x".repeat(200);
        String wide = "错".repeat(100);

        assertThat(GatewayWebSocketHandler.truncateReason(ascii)).hasSize(GatewayWebSocketHandler.MAX_CLOSE_REASON_BYTES);
        String truncated = GatewayWebSocketHandler.truncateReason(wide);
        assertThat(truncated.getBytes(StandardCharsets.UTF_8).length).isEqualTo(GatewayWebSocketHandler.MAX_CLOSE_REASON_BYTES);
        assertThat(truncated).hasSize(41);
        assertThat(GatewayWebSocketHandler.truncateReason(null)).isEmpty();
        assertThat(GatewayWebSocketHandler.truncateReason("short")).isEqualTo("short");
    }
}
