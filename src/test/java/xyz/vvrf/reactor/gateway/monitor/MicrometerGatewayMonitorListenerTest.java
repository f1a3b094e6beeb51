package xyz.vvrf.reactor.gateway.monitor;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerGatewayMonitorListenerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerGatewayMonitorListener listener = new MicrometerGatewayMonitorListener(registry);

    @Test
    void requestsAreCountedByEndpointAndStatus() {
        listener.onRequestComplete("r1", "f", "/search", Duration.ofMillis(5), Statuses.success());
        listener.onRequestComplete("r2", "f", "/search", Duration.ofMillis(7), Statuses.error("x"));
        listener.onRequestComplete("r3", "f", "", Duration.ofMillis(1), Statuses.success());

        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_REQUESTS_TOTAL)
                .tags("endpoint", "/search", "status", "SUCCESS").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_REQUESTS_TOTAL)
                .tags("endpoint", "/search", "status", StatusProto.StatusCode.ERROR.name()).counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_REQUESTS_TOTAL)
                .tags("endpoint", "/").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_REQUEST_LATENCY)
                .tags("endpoint", "/search").timer().count()).isEqualTo(2);
    }

    @Test
    void executorCallsAndGauges() {
        listener.onExecutorCallSuccess("r1", "A", "h:1", Duration.ofMillis(3));
        listener.onExecutorCallFailure("r1", "A", "h:1", Duration.ofMillis(3), "UNAVAILABLE");
        listener.onInFlightChanged(4);
        listener.onPrefetchWait(Duration.ofMillis(2));
        listener.onIllegalTransition("r1", "COMPLETE", "ERRORED");

        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_EXECUTOR_CALLS_TOTAL)
                .tags("executor", "A", "status", "FAILURE").counter().count()).isEqualTo(1.0);
        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_EXECUTOR_LATENCY).timer().count()).isEqualTo(2);
        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_IN_FLIGHT).gauge().value()).isEqualTo(4.0);
        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_PREFETCH_WAIT).timer().count()).isEqualTo(1);
        assertThat(registry.get(MicrometerGatewayMonitorListener.METRIC_ILLEGAL_TRANSITIONS).counter().count()).isEqualTo(1.0);
    }

    @Test
    void notifierIsolatesFailingListeners() {
        AtomicInteger calls = new AtomicInteger();
        GatewayMonitorListener failing = new LoggingGatewayMonitorListener() {
            @Override
            public void onInFlightChanged(int inFlight) {
                throw new IllegalStateException("broken listener");
            }
        };
        GatewayMonitorListener counting = new LoggingGatewayMonitorListener() {
            @Override
            public void onInFlightChanged(int inFlight) {
                calls.incrementAndGet();
            }
        };
        MonitorNotifier notifier = new MonitorNotifier(Arrays.asList(failing, counting));

        notifier.publish(l -> l.onInFlightChanged(1));

        assertThat(calls).hasValue(1);
        assertThat(notifier.size()).isEqualTo(2);
        assertThat(MonitorNotifier.none().size()).isZero();
    }
}
