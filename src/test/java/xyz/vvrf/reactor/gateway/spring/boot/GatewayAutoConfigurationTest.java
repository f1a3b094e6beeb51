package xyz.vvrf.reactor.gateway.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import xyz.vvrf.reactor.gateway.core.InvalidTopologyException;
import xyz.vvrf.reactor.gateway.join.ReducerRegistry;
import xyz.vvrf.reactor.gateway.lifecycle.ExitCodes;
import xyz.vvrf.reactor.gateway.monitor.MonitorNotifier;
import xyz.vvrf.reactor.gateway.server.grpc.GatewayGrpcServer;
import xyz.vvrf.reactor.gateway.streaming.RequestStreamer;
import xyz.vvrf.reactor.gateway.topology.TopologyGraph;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(GatewayAutoConfiguration.class))
            .withPropertyValues(
                    "gateway.grpc.enabled=false",
                    "gateway.pool.probe-interval=1h",
                    "gateway.flow.name=search",
                    "gateway.flow.deployments[0].name=encoder",
                    "gateway.flow.deployments[0].endpoints[0].port=65001",
                    "gateway.flow.deployments[1].name=indexer",
                    "gateway.flow.deployments[1].needs[0]=encoder",
                    "gateway.flow.deployments[1].polling=ALL",
                    "gateway.flow.deployments[1].shards=2",
                    "gateway.flow.deployments[1].endpoints[0].port=65002",
                    "gateway.flow.deployments[1].endpoints[0].shard-id=0",
                    "gateway.flow.deployments[1].endpoints[1].port=65003",
                    "gateway.flow.deployments[1].endpoints[1].shard-id=1");

    @Test
    void wiresTheGatewayFromProperties() {
        runner.withPropertyValues("gateway.streamer.prefetch=8").run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(RequestStreamer.class);
            assertThat(context).hasSingleBean(ReducerRegistry.class);
            assertThat(context).doesNotHaveBean(GatewayGrpcServer.class);

            TopologyGraph graph = context.getBean(TopologyGraph.class);
            assertThat(graph.getName()).isEqualTo("search");
            assertThat(graph.getTopologicalOrder()).containsExactly("encoder", "indexer");
            assertThat(graph.getExitPredecessors()).containsExactly("indexer");
            assertThat(context.getBean(RequestStreamer.class).getSettings().getPrefetch()).isEqualTo(8);
            assertThat(context.getBean(MonitorNotifier.class).size()).isEqualTo(1);
        });
    }

    @Test
    void invalidTopologyFailsStartup() {
        runner.withPropertyValues("gateway.flow.deployments[1].needs[0]=missing").run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(InvalidTopologyException.class);
            assertThat(ExitCodes.fromStartupFailure(context.getStartupFailure())).isEqualTo(ExitCodes.INVALID_TOPOLOGY);
        });
    }

    @Test
    void invalidSettingsAreRejected() {
        runner.withPropertyValues("gateway.streamer.max-prefetch=0").run(context ->
                assertThat(context).hasFailed());
    }
}
