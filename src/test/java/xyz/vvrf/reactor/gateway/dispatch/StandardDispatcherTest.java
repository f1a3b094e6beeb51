package xyz.vvrf.reactor.gateway.dispatch;

import io.grpc.Status;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.PollingType;
import xyz.vvrf.reactor.gateway.pool.ReplicaState;
import xyz.vvrf.reactor.gateway.proto.StatusProto;
import xyz.vvrf.reactor.gateway.test.util.FakeExecutor;
import xyz.vvrf.reactor.gateway.test.util.GatewayTestHarness;
import xyz.vvrf.reactor.gateway.test.util.TestRequests;
import xyz.vvrf.reactor.gateway.topology.DeploymentDescription;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.reactor.gateway.test.util.TestRequests.docIds;

class StandardDispatcherTest {

    private GatewayTestHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    private LazyDataRequest send(LazyDataRequest request) {
        return harness.streamer().processSingle(request).block(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("UNAVAILABLE 在另一个副本上重试成功，失败副本进入 TRANSIENT_FAILURE")
    void retriesTransportFailureOnAnotherReplica() {
        harness = new GatewayTestHarness("retry");
        List<FakeExecutor> replicas = harness.deployment(DeploymentDescription.named("A"), 1, 2);
        replicas.get(0).failTransport(Status.Code.UNAVAILABLE, 1);
        harness.start();

        LazyDataRequest response = send(TestRequests.wire("r1", "d1"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(replicas.get(0).getCallCount()).isEqualTo(1);
        assertThat(replicas.get(1).getCallCount()).isEqualTo(1);
        assertThat(harness.pool().getReplicas("A", 0).get(0).getState()).isEqualTo(ReplicaState.TRANSIENT_FAILURE);
        assertThat(response.getRoutes().get(1).getPodId()).isEqualTo(replicas.get(1).getPodId());
    }

    @Test
    @DisplayName("executor 返回的应用错误不重试")
    void applicationErrorsAreNotRetried() {
        harness = new GatewayTestHarness("no-retry");
        List<FakeExecutor> replicas = harness.deployment(DeploymentDescription.named("A"), 1, 2);
        replicas.forEach(replica -> replica.failing("bad input"));
        harness.start();

        LazyDataRequest response = send(TestRequests.wire("r1", "d1"));

        assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.ERROR);
        assertThat(response.getStatus().getDescription()).isEqualTo("bad input");
        assertThat(replicas.stream().mapToInt(FakeExecutor::getCallCount).sum()).isEqualTo(1);
    }

    @Test
    @DisplayName("重试耗尽后出口状态为 ERROR，描述以 UNAVAILABLE 开头")
    void exhaustedRetriesYieldUnavailableError() {
        harness = new GatewayTestHarness("exhausted");
        FakeExecutor a = harness.executor("A").failTransport(Status.Code.UNAVAILABLE, 100);
        harness.dispatchSettings(DispatchSettings.builder().maxRetries(2).build()).start();

        LazyDataRequest response = send(TestRequests.wire("r1", "d1"));

        assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.ERROR);
        assertThat(response.getStatus().getDescription()).startsWith("UNAVAILABLE");
        assertThat(response.getStatus().getException().getExecutor()).isEqualTo("A");
        assertThat(a.getCallCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("ALL 轮询时一个分片不可用：ERROR_CHAINED，数据为其余分片的拼接")
    void allPollingWithOneShardDown() {
        harness = new GatewayTestHarness("all-shards");
        List<FakeExecutor> shards = harness.deployment(
                DeploymentDescription.named("A").setPolling(PollingType.ALL), 3, 1);
        shards.forEach(FakeExecutor::appending);
        shards.get(1).failTransport(Status.Code.UNAVAILABLE, 100);
        harness.dispatchSettings(DispatchSettings.builder().maxRetries(0).build()).start();

        LazyDataRequest response = send(TestRequests.wire("r1", "d1"));

        assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.ERROR_CHAINED);
        assertThat(docIds(response)).containsExactly("d1", "A", "d1", "A");
        assertThat(shards).allSatisfy(shard -> assertThat(shard.getCallCount()).isEqualTo(1));
    }

    @Test
    @DisplayName("ANY 轮询：相同分片键总是落在同一分片，没有分片键时轮询")
    void shardKeySelectsStableShard() {
        harness = new GatewayTestHarness("shard-key");
        List<FakeExecutor> shards = harness.deployment(DeploymentDescription.named("A"), 2, 1);
        harness.start();

        Flux.range(0, 4)
                .map(i -> TestRequests.withParameter(TestRequests.request("k" + i, "d"),
                        StandardDispatcher.SHARD_KEY_PARAMETER, TestRequests.string("tenant-42")))
                .concatMap(harness.streamer()::processSingle)
                .blockLast(Duration.ofSeconds(5));

        assertThat(shards.stream().mapToInt(FakeExecutor::getCallCount)).containsExactlyInAnyOrder(0, 4);

        Flux.range(0, 4)
                .map(i -> TestRequests.wire("rr" + i, "d"))
                .concatMap(harness.streamer()::processSingle)
                .blockLast(Duration.ofSeconds(5));

        assertThat(shards.stream().mapToInt(FakeExecutor::getCallCount).sum()).isEqualTo(8);
        assertThat(shards).allSatisfy(shard -> assertThat(shard.getCallCount()).isGreaterThanOrEqualTo(2));
    }

    @Test
    @DisplayName("有状态 deployment 的写端点只发往 leader 副本")
    void statefulWritesGoToLeader() {
        harness = new GatewayTestHarness("leader");
        DeploymentDescription deployment = DeploymentDescription.named("A").setStateful(true);
        deployment.getWriteEndpoints().add("/index");
        List<FakeExecutor> replicas = harness.deployment(deployment, 1, 3);
        replicas.get(2).getEndpoint().getMetadata().put(StaticLeaderResolver.LEADER_METADATA_KEY, "true");
        harness.start();

        Flux.range(0, 3)
                .map(i -> TestRequests.withEndpoint(TestRequests.request("w" + i, "d"), "/index"))
                .concatMap(harness.streamer()::processSingle)
                .blockLast(Duration.ofSeconds(5));

        assertThat(replicas.get(2).getCallCount()).isEqualTo(3);
        assertThat(replicas.get(2).getEndpoints()).containsOnly("/index");
        assertThat(replicas.get(0).getCallCount() + replicas.get(1).getCallCount()).isZero();
    }

    @Test
    @DisplayName("deployment 上的 timeout 覆盖全局 send-timeout")
    void deploymentTimeoutOverridesSendTimeout() {
        harness = new GatewayTestHarness("timeout");
        DeploymentDescription deployment = DeploymentDescription.named("A").setTimeout(Duration.ofMillis(100)).setRetries(0);
        harness.deployment(deployment, 1, 1).get(0).delay(Duration.ofSeconds(2));
        harness.start();

        StepVerifier.create(harness.streamer().processSingle(TestRequests.wire("t1", "d1")))
                .assertNext(response -> {
                    assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.ERROR);
                    assertThat(response.getStatus().getDescription()).startsWith("DEADLINE_EXCEEDED");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("只有连接级错误与超时可以重试")
    void retryableErrors() {
        assertThat(StandardDispatcher.isRetryable(Status.UNAVAILABLE.asRuntimeException())).isTrue();
        assertThat(StandardDispatcher.isRetryable(Status.DEADLINE_EXCEEDED.asRuntimeException())).isTrue();
        assertThat(StandardDispatcher.isRetryable(Status.INVALID_ARGUMENT.asRuntimeException())).isFalse();
        assertThat(StandardDispatcher.isRetryable(new IllegalStateException("x"))).isFalse();
        assertThat(StandardDispatcher.describe(Status.UNAVAILABLE.withDescription("down").asRuntimeException()))
                .isEqualTo("UNAVAILABLE: down");
    }
}
