package xyz.vvrf.reactor.gateway.lifecycle;

import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.server.PortInUseException;
import xyz.vvrf.reactor.gateway.core.GatewayErrorCode;
import xyz.vvrf.reactor.gateway.core.GatewayException;
import xyz.vvrf.reactor.gateway.core.InvalidTopologyException;
import xyz.vvrf.reactor.gateway.server.GatewayInfo;
import xyz.vvrf.reactor.gateway.server.grpc.GatewayGrpcServer;
import xyz.vvrf.reactor.gateway.server.grpc.GatewayGrpcService;
import xyz.vvrf.reactor.gateway.server.websocket.WebSocketSessionRegistry;
import xyz.vvrf.reactor.gateway.test.util.GatewayTestHarness;

import java.net.BindException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayLifecycleTest {

    private GatewayTestHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    @Test
    void startAndStopInOrder() {
        harness = new GatewayTestHarness("lifecycle");
        harness.executor("A");
        harness.start();
        GatewayGrpcServer grpcServer = new GatewayGrpcServer(InProcessServerBuilder.forName("lifecycle-" + UUID.randomUUID()),
                new GatewayGrpcService(harness.streamer(), new GatewayInfo("lifecycle")));
        GatewayLifecycle lifecycle = new GatewayLifecycle(harness.pool(), grpcServer, harness.streamer(),
                new WebSocketSessionRegistry());

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(grpcServer.isStarted()).isTrue();

        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(harness.streamer().isShuttingDown()).isTrue();
        assertThat(harness.pool().isClosed()).isTrue();

        lifecycle.stop();
    }

    @Test
    void startupFailuresMapToExitCodes() {
        assertThat(ExitCodes.fromStartupFailure(new IllegalStateException("wrapped",
                new InvalidTopologyException("cycle")))).isEqualTo(ExitCodes.INVALID_TOPOLOGY);
        assertThat(ExitCodes.fromStartupFailure(new GatewayException(GatewayErrorCode.INTERNAL, "bind",
                new BindException("Address already in use")))).isEqualTo(ExitCodes.BIND_FAILURE);
        assertThat(ExitCodes.fromStartupFailure(new PortInUseException(8080))).isEqualTo(ExitCodes.BIND_FAILURE);
        assertThat(ExitCodes.fromStartupFailure(new RuntimeException("other"))).isEqualTo(1);
        assertThat(ExitCodes.fromStartupFailure(null)).isEqualTo(1);
    }

    @Test
    void firstSignalDecidesExitCode() throws InterruptedException {
        GatewaySignalHandler handler = new GatewaySignalHandler();
        assertThat(handler.isTriggered()).isFalse();

        handler.trigger(ExitCodes.SIGTERM);
        handler.trigger(ExitCodes.SIGINT);

        assertThat(handler.isTriggered()).isTrue();
        assertThat(handler.awaitSignal()).isEqualTo(ExitCodes.SIGTERM);
    }
}
