package xyz.vvrf.reactor.gateway.streaming;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Routes;
import xyz.vvrf.reactor.gateway.proto.RouteProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;
import xyz.vvrf.reactor.gateway.test.util.FakeExecutor;
import xyz.vvrf.reactor.gateway.test.util.GatewayTestHarness;
import xyz.vvrf.reactor.gateway.test.util.TestRequests;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static xyz.vvrf.reactor.gateway.test.util.TestRequests.docIds;
import static xyz.vvrf.reactor.gateway.test.util.TestRequests.routeExecutors;

class RequestStreamerTest {

    private GatewayTestHarness harness;

    @AfterEach
    void tearDown() {
        if (harness != null) {
            harness.close();
        }
    }

    @Test
    @DisplayName("A → B 串行：文档原样返回，路由为 gateway, A, B")
    void linearFlowEchoesDocuments() {
        harness = new GatewayTestHarness("linear");
        FakeExecutor a = harness.executor("A");
        FakeExecutor b = harness.executor("B", "A");
        harness.start();

        StepVerifier.create(harness.streamer().processSingle(TestRequests.wire("r1", "d1", "d2")))
                .assertNext(response -> {
                    assertThat(response.getRequestId()).isEqualTo("r1");
                    assertThat(docIds(response)).containsExactly("d1", "d2");
                    assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.SUCCESS);
                    assertThat(routeExecutors(response)).containsExactly("gateway", "A", "B");
                    List<RouteProto> routes = response.getRoutes();
                    assertThat(routes.get(1).getPodId()).isEqualTo(a.getPodId());
                    assertThat(routes.get(2).getPodId()).isEqualTo(b.getPodId());
                    assertThat(routes.get(0).hasEndTime()).isTrue();
                })
                .verifyComplete();

        assertThat(a.getCallCount()).isEqualTo(1);
        assertThat(b.getCallCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A 与 B 并行后在出口以 concat_docs 汇合，按前驱顺序拼接")
    void parallelBranchesConcatenateInPredecessorOrder() {
        harness = new GatewayTestHarness("parallel");
        harness.executor("A").tagging().delay(Duration.ofMillis(30));
        harness.executor("B").tagging();
        harness.start();

        StepVerifier.create(harness.streamer().processSingle(TestRequests.wire("r2", "d1")))
                .assertNext(response -> {
                    assertThat(response.getRequestId()).isEqualTo("r2");
                    assertThat(docIds(response)).containsExactly("A(d1)", "B(d1)");
                    assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.SUCCESS);
                    assertThat(routeExecutors(response)).containsExactlyInAnyOrder("gateway", "A", "B");
                    assertThat(routeExecutors(response).get(0)).isEqualTo("gateway");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("prefetch = 2 时任何时刻在途请求不超过 2")
    void prefetchBoundsInFlightRequests() {
        harness = new GatewayTestHarness("prefetch");
        FakeExecutor a = harness.executor("A").delay(Duration.ofMillis(10));
        harness.streamerSettings(StreamerSettings.builder().prefetch(2).build()).start();

        List<String> ids = IntStream.range(0, 50).mapToObj(i -> "p" + i).collect(Collectors.toList());
        Flux<LazyDataRequest> ingress = Flux.fromIterable(ids).map(id -> TestRequests.wire(id, "d"));

        Instant start = Instant.now();
        List<LazyDataRequest> responses = harness.streamer().stream(ingress)
                .collectList()
                .block(Duration.ofSeconds(10));
        Duration elapsed = Duration.between(start, Instant.now());

        assertThat(responses).hasSize(50);
        assertThat(responses.stream().map(LazyDataRequest::getRequestId)).containsExactlyInAnyOrderElementsOf(ids);
        assertThat(a.getMaxInFlight()).isLessThanOrEqualTo(2);
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("客户端流出错后，未完成的请求以 CANCELLED 结束，子调用被取消")
    void clientErrorCancelsOutstandingRequests() {
        harness = new GatewayTestHarness("cancel");
        FakeExecutor a = harness.executor("A").delay(Duration.ofSeconds(1));
        harness.start();

        Sinks.Many<LazyDataRequest> ingress = Sinks.many().unicast().onBackpressureBuffer();

        StepVerifier.create(harness.streamer().stream(ingress.asFlux()).collectList())
                .then(() -> {
                    for (int i = 0; i < 5; i++) {
                        ingress.tryEmitNext(TestRequests.wire("c" + i, "d"));
                    }
                })
                .then(() -> await().atMost(Duration.ofSeconds(2)).until(() -> a.getCallCount() == 5))
                .then(() -> ingress.tryEmitError(new IllegalStateException("客户端断开")))
                .assertNext(responses -> {
                    assertThat(responses).hasSize(5).allSatisfy(response -> {
                        assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.ERROR);
                        assertThat(response.getStatus().getDescription()).isEqualTo(RequestStreamer.CANCELLED_DESCRIPTION);
                    });
                    assertThat(responses.stream().map(LazyDataRequest::getRequestId))
                            .containsExactlyInAnyOrder("c0", "c1", "c2", "c3", "c4");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        await().atMost(Duration.ofSeconds(2)).until(() -> a.getCancelledCount() == 5);
        assertThat(harness.streamer().getInFlight()).isZero();
    }

    @Test
    @DisplayName("target_executor = ^B$ 时只调用 B")
    void targetExecutorBypassesOtherNodes() {
        harness = new GatewayTestHarness("target");
        FakeExecutor a = harness.executor("A");
        FakeExecutor b = harness.executor("B", "A");
        FakeExecutor c = harness.executor("C", "B");
        harness.start();

        LazyDataRequest request = TestRequests.withTarget(TestRequests.request("t1", "d1"), "^B$");

        StepVerifier.create(harness.streamer().processSingle(request))
                .assertNext(response -> {
                    assertThat(routeExecutors(response)).containsExactly("gateway", "B");
                    assertThat(response.isSuccess()).isTrue();
                })
                .verifyComplete();

        assertThat(a.getCallCount()).isZero();
        assertThat(b.getCallCount()).isEqualTo(1);
        assertThat(c.getCallCount()).isZero();
    }

    @Test
    @DisplayName("请求带入的路由原样保留在最前，之后是 gateway 与本次访问的 executor")
    void carriedRoutesArePreserved() {
        harness = new GatewayTestHarness("carried-routes");
        harness.executor("A");
        harness.executor("B", "A");
        harness.start();

        Instant clientStart = Instant.now().minusSeconds(1);
        RouteProto upstream = Routes.finish(Routes.start("upstream-client", "client:1", clientStart),
                clientStart.plusMillis(10), null);
        LazyDataRequest request = LazyDataRequest.fromBytes(
                TestRequests.builder("rt1", "d1").addRoutes(upstream).build().toByteArray());

        StepVerifier.create(harness.streamer().processSingle(request))
                .assertNext(response -> {
                    assertThat(routeExecutors(response)).containsExactly("upstream-client", "gateway", "A", "B");
                    assertThat(response.getRoutes().get(0)).isEqualTo(upstream);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("executor 在响应中追加的路由进入出口路由")
    void executorAddedRoutesArePreserved() {
        harness = new GatewayTestHarness("inner-routes");
        harness.executor("A").behavior(request -> request.mutate(builder -> {
            Instant now = Instant.now();
            builder.addRoutes(Routes.finish(Routes.start("A-inner", "inner:1", now), now, null));
        }));
        harness.executor("B", "A");
        harness.start();

        StepVerifier.create(harness.streamer().processSingle(TestRequests.wire("rt2", "d1")))
                .assertNext(response -> {
                    List<String> executors = routeExecutors(response);
                    assertThat(executors).containsExactlyInAnyOrder("gateway", "A", "A-inner", "B");
                    assertThat(executors.get(0)).isEqualTo("gateway");
                    assertThat(executors.indexOf("A-inner")).isLessThan(executors.indexOf("B"));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("B 返回应用错误时 C 不被调用，错误描述传到出口")
    void applicationErrorShortCircuitsDownstream() {
        harness = new GatewayTestHarness("error");
        harness.executor("A");
        FakeExecutor b = harness.executor("B", "A").failing("boom");
        FakeExecutor c = harness.executor("C", "B");
        harness.start();

        StepVerifier.create(harness.streamer().processSingle(TestRequests.wire("e1", "d1")))
                .assertNext(response -> {
                    assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.ERROR);
                    assertThat(response.getStatus().getDescription()).contains("boom");
                    assertThat(routeExecutors(response)).contains("A", "B").doesNotContain("C");
                })
                .verifyComplete();

        assertThat(b.getCallCount()).isEqualTo(1);
        assertThat(c.getCallCount()).isZero();
    }

    @Test
    @DisplayName("三节点串行、零文档请求：三条 executor 路由按拓扑序排列")
    void zeroDocRequestThroughLinearFlow() {
        harness = new GatewayTestHarness("three");
        harness.executor("A");
        harness.executor("B", "A");
        harness.executor("C", "B");
        harness.start();

        StepVerifier.create(harness.streamer().processSingle(TestRequests.wire("z1")))
                .assertNext(response -> {
                    assertThat(response.isSuccess()).isTrue();
                    assertThat(response.getDocsCount()).isZero();
                    List<String> executors = routeExecutors(response);
                    assertThat(executors.subList(1, executors.size())).containsExactly("A", "B", "C");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("空的请求流得到空的响应流")
    void emptyIngressCompletesCleanly() {
        harness = new GatewayTestHarness("empty-ingress");
        FakeExecutor a = harness.executor("A");
        harness.start();

        StepVerifier.create(harness.streamer().stream(Flux.empty()))
                .verifyComplete();

        assertThat(a.getCallCount()).isZero();
        assertThat(harness.streamer().getActiveStreams()).isZero();
    }

    @Test
    @DisplayName("没有 request_id 的请求由网关分配，且同一 ID 贯穿各跳")
    void missingRequestIdIsAssigned() {
        harness = new GatewayTestHarness("assign-id");
        FakeExecutor a = harness.executor("A");
        harness.start();

        LazyDataRequest response = harness.streamer().processSingle(TestRequests.wire("", "d1")).block(Duration.ofSeconds(5));

        assertThat(response).isNotNull();
        assertThat(response.getRequestId()).hasSize(32).matches("[0-9a-f]+");
        assertThat(a.getReceived().get(0).getRequestId()).isEqualTo(response.getRequestId());
    }

    @Test
    @DisplayName("未被修改的请求在各跳之间保持原始字节")
    void untouchedRequestKeepsWireBytes() {
        harness = new GatewayTestHarness("bytes");
        FakeExecutor a = harness.executor("A");
        FakeExecutor b = harness.executor("B", "A");
        harness.start();

        LazyDataRequest request = TestRequests.wire("b1", "d1", "d2");
        harness.streamer().processSingle(request).block(Duration.ofSeconds(5));

        assertThat(a.getReceived().get(0).toByteArray()).isEqualTo(request.toByteArray());
        assertThat(b.getReceived().get(0).toByteArray()).isEqualTo(request.toByteArray());
    }

    @Test
    @DisplayName("超过 deadline_ms 的请求以 DEADLINE_EXCEEDED 结束")
    void deadlineExceededYieldsError() {
        harness = new GatewayTestHarness("deadline");
        FakeExecutor a = harness.executor("A").delay(Duration.ofSeconds(2));
        harness.start();

        LazyDataRequest request = TestRequests.withParameter(TestRequests.request("dl", "d1"),
                RequestExecution.DEADLINE_PARAMETER, TestRequests.number(100));

        StepVerifier.create(harness.streamer().processSingle(request))
                .assertNext(response -> {
                    assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.ERROR);
                    assertThat(response.getStatus().getDescription()).contains("DEADLINE_EXCEEDED");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(2));

        await().atMost(Duration.ofSeconds(2)).until(() -> a.getCancelledCount() >= 1);
    }

    @Test
    @DisplayName("非法的 target_executor 正则得到错误响应而不是流错误")
    void invalidTargetRegexProducesErrorResponse() {
        harness = new GatewayTestHarness("bad-target");
        FakeExecutor a = harness.executor("A");
        harness.start();

        LazyDataRequest request = TestRequests.withTarget(TestRequests.request("bt", "d1"), "([");

        StepVerifier.create(harness.streamer().processSingle(request))
                .assertNext(response -> {
                    assertThat(response.getStatus().getCode()).isEqualTo(StatusProto.StatusCode.ERROR);
                    assertThat(response.getRequestId()).isEqualTo("bt");
                })
                .verifyComplete();
        assertThat(a.getCallCount()).isZero();
    }

    @Test
    @DisplayName("空跑经过整个 Flow 并返回出口状态")
    void dryRunReturnsExitStatus() {
        harness = new GatewayTestHarness("dry-run");
        FakeExecutor a = harness.executor("A");
        harness.start();

        StepVerifier.create(harness.streamer().dryRun())
                .assertNext(status -> assertThat(status.getCode()).isEqualTo(StatusProto.StatusCode.SUCCESS))
                .verifyComplete();

        assertThat(a.getEndpoints()).containsExactly(RequestStreamer.DRY_RUN_ENDPOINT);
    }

    @Test
    @DisplayName("关闭开始后拒绝新的请求流，在途请求在 drain 内完成")
    void shutdownDrainsInFlightRequests() {
        harness = new GatewayTestHarness("shutdown");
        harness.executor("A").delay(Duration.ofMillis(100));
        harness.streamerSettings(StreamerSettings.builder().drain(Duration.ofSeconds(2)).build()).start();
        RequestStreamer streamer = harness.streamer();

        Sinks.Many<LazyDataRequest> ingress = Sinks.many().unicast().onBackpressureBuffer();
        List<LazyDataRequest> responses = new CopyOnWriteArrayList<>();
        streamer.stream(ingress.asFlux()).subscribe(responses::add);
        ingress.tryEmitNext(TestRequests.wire("s1", "d1"));
        await().atMost(Duration.ofSeconds(1)).until(() -> streamer.getInFlight() == 1);

        streamer.beginShutdown();

        assertThat(streamer.awaitDrained(Duration.ofSeconds(2)).block()).isTrue();
        assertThat(responses).hasSize(1);
        assertThat(responses.get(0).isSuccess()).isTrue();
        StepVerifier.create(streamer.stream(Flux.just(TestRequests.wire("s2", "d1"))))
                .expectError()
                .verify(Duration.ofSeconds(1));
    }
}
