package xyz.vvrf.reactor.gateway.streaming;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.core.HopContext;
import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.core.ReduceStrategy;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.dispatch.Dispatcher;
import xyz.vvrf.reactor.gateway.join.JoinAccumulator;
import xyz.vvrf.reactor.gateway.join.ReducerRegistry;
import xyz.vvrf.reactor.gateway.join.RequestReducer;
import xyz.vvrf.reactor.gateway.topology.TopologyGraph;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * 按拓扑编排单个请求的执行。
 * <p>
 * 每个节点对应一个缓存的 Mono：等待全部前驱完成 (汇合节点先合并)，输入成功时派发，
 * 输入出错时跳过派发并把错误原样向下游传递。出口前驱的结果经过终端汇合 (concat_docs) 得到出口结果。
 */
@Slf4j
public class TopologyExecutor {

    /** 终端汇合在结果中使用的节点名 */
    static final String EXIT_NODE = "gateway/exit";

    private final TopologyGraph graph;
    private final Dispatcher dispatcher;
    private final ReducerRegistry reducerRegistry;

    public TopologyExecutor(TopologyGraph graph, Dispatcher dispatcher, ReducerRegistry reducerRegistry) {
        this.graph = Objects.requireNonNull(graph, "TopologyGraph 不能为空");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher 不能为空");
        this.reducerRegistry = Objects.requireNonNull(reducerRegistry, "ReducerRegistry 不能为空");
        log.info("TopologyExecutor 初始化完成。Flow: '{}', 节点数: {}, 拓扑序: {}",
                graph.getName(), graph.size(), graph.getTopologicalOrder());
    }

    public TopologyGraph getGraph() {
        return graph;
    }

    /**
     * 执行请求，返回出口结果。请求被取消时以空结束。
     */
    public Mono<Partial> execute(RequestExecution execution) {
        final String requestId = execution.getRequestId();
        final String flowName = execution.getFlowName();

        if (graph.size() == 0) {
            log.debug("[RequestId: {}][Flow: '{}'] Flow 为空，原样返回请求。", requestId, flowName);
            return Mono.just(execution.getIngress());
        }

        return Mono.defer(() -> {
            execution.transition(RequestState.DISPATCHING);
            List<String> exits = graph.getExitPredecessors();
            if (exits.size() == 1) {
                return getNodeMono(exits.get(0), execution);
            }
            execution.transition(RequestState.AWAITING_JOINS);
            RequestReducer concat = reducerRegistry.get(ReduceStrategy.CONCAT_DOCS);
            return awaitPredecessors(EXIT_NODE, exits, execution)
                    .flatMap(partials -> concat.reduce(EXIT_NODE, partials, execution.hopContext())
                            .map(merged -> finalizeExit(merged, partials)));
        });
    }

    /**
     * 所有出口分支都失败时，出口状态为 ERROR 并附带第一个错误的描述；路由保留。
     */
    static Partial finalizeExit(Partial merged, List<Partial> branches) {
        boolean allFailed = branches.stream().noneMatch(Partial::isSuccess);
        if (!allFailed) {
            return merged;
        }
        String description = branches.stream()
                .map(p -> p.getStatus().getDescription())
                .filter(d -> !d.isEmpty())
                .findFirst()
                .orElse("所有出口分支均失败");
        return Partial.error(merged, Statuses.error(description));
    }

    /**
     * 获取或创建节点的执行 Mono，保证同一请求内每个节点只执行一次。
     */
    Mono<Partial> getNodeMono(String node, RequestExecution execution) {
        return execution.getOrCreateNodeMono(node, () -> Mono.defer(() -> {
            List<String> predecessors = graph.predecessors(node);
            Mono<Partial> input;
            if (predecessors.size() == 1) {
                input = upstream(predecessors.get(0), execution);
            } else {
                execution.transition(RequestState.AWAITING_JOINS);
                RequestReducer reducer = reducerRegistry.get(graph.getDeployment(node).getReduce());
                input = awaitPredecessors(node, predecessors, execution)
                        .flatMap(partials -> reducer.reduce(node, partials, execution.hopContext()))
                        .doOnNext(merged -> execution.transition(RequestState.DISPATCHING));
            }
            return input.flatMap(in -> {
                if (!in.isSuccess()) {
                    log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 的输入状态为 {}，跳过派发。",
                            execution.getRequestId(), execution.getFlowName(), node, in.getStatus().getCode());
                    return Mono.just(in);
                }
                return dispatcher.dispatch(node, in, execution.hopContext());
            });
        }));
    }

    private Mono<Partial> upstream(String predecessor, RequestExecution execution) {
        if (TopologyGraph.GATEWAY.equals(predecessor)) {
            return Mono.just(execution.getIngress());
        }
        return getNodeMono(predecessor, execution);
    }

    /**
     * 等待全部前驱到达或请求截止时间到达，返回按前驱声明顺序排列的结果。
     * 截止时未到达的前驱以 ERROR_CHAINED 占位。请求被取消时以空结束。
     */
    private Mono<List<Partial>> awaitPredecessors(String node, List<String> predecessors, RequestExecution execution) {
        HopContext context = execution.hopContext();
        JoinAccumulator accumulator = new JoinAccumulator(node, predecessors, execution.getRequestId());

        Mono<Void> arrivals = Flux.fromIterable(predecessors)
                .flatMap(predecessor -> upstream(predecessor, execution)
                        .doOnNext(partial -> accumulator.offer(predecessor, partial)))
                .then();

        Duration remaining = context.remaining();
        if (remaining != null) {
            arrivals = arrivals
                    .timeout(remaining.isNegative() ? Duration.ZERO : remaining)
                    .onErrorResume(TimeoutException.class, e -> {
                        log.warn("[RequestId: {}][Flow: '{}'] 汇合节点 '{}' 在截止时间前缺少前驱: {}",
                                execution.getRequestId(), execution.getFlowName(), node, accumulator.getMissing());
                        accumulator.fillMissing(missing -> Partial.error(execution.getIngress(), Statuses.chained(
                                String.format("DEADLINE_EXCEEDED: 分支 '%s' 在截止时间前未完成", missing))));
                        return Mono.empty();
                    });
        }

        return arrivals.then(Mono.defer(() -> {
            if (execution.isCancelled() || !accumulator.isComplete()) {
                // 前驱因取消而没有结果
                return Mono.empty();
            }
            List<Partial> partials = accumulator.drain();
            log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 的 {} 个前驱全部就绪。",
                    execution.getRequestId(), execution.getFlowName(), node, partials.size());
            return Mono.just(partials);
        }));
    }
}
