package xyz.vvrf.reactor.gateway.join;

import com.google.protobuf.ListValue;
import com.google.protobuf.Value;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.core.HopContext;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.core.ReduceStrategy;
import xyz.vvrf.reactor.gateway.core.Routes;
import xyz.vvrf.reactor.gateway.core.Statuses;
import xyz.vvrf.reactor.gateway.pool.ConnectionPool;
import xyz.vvrf.reactor.gateway.pool.ExecutorClient;
import xyz.vvrf.reactor.gateway.proto.DataRequest;
import xyz.vvrf.reactor.gateway.proto.RouteProto;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 把各分支文档组成矩阵交给 deployment 配置的 reducer executor 合并。
 * <p>
 * 文档按分支顺序拼接，每个分支的文档数写入参数 {@value #MATRIX_PARAMETER}，端点为 {@value #REDUCE_ENDPOINT}。
 * 该策略是严格的：任何一个分支失败或缺失，合并即失败。
 */
@Slf4j
public class ReducerExecReducer implements RequestReducer {

    public static final String MATRIX_PARAMETER = "__reduce_matrix__";
    public static final String REDUCE_ENDPOINT = "/reduce";

    private final ConnectionPool connectionPool;
    private final ExecutorClient executorClient;
    private final Duration sendTimeout;

    public ReducerExecReducer(ConnectionPool connectionPool, ExecutorClient executorClient, Duration sendTimeout) {
        this.connectionPool = Objects.requireNonNull(connectionPool, "ConnectionPool 不能为空");
        this.executorClient = Objects.requireNonNull(executorClient, "ExecutorClient 不能为空");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "发送超时不能为空");
    }

    @Override
    public ReduceStrategy strategy() {
        return ReduceStrategy.REDUCER_EXEC;
    }

    @Override
    public Mono<Partial> reduce(String node, List<Partial> partials, HopContext context) {
        Partial first = partials.get(0);
        for (Partial partial : partials) {
            if (!partial.isSuccess()) {
                StatusProto status = Statuses.error(String.format("reducer_exec: 节点 '%s' 的输入分支失败: %s",
                        node, partial.getStatus().getDescription()));
                return Mono.just(Partial.error(Partial.of(first.getRequest(), ReducerSupport.mergeRoutes(partials)), status));
            }
        }

        DataRequest original = first.getRequest().getProto();
        ListValue.Builder rows = ListValue.newBuilder();
        LazyDataRequest matrix = first.getRequest().mutate(builder -> {
            builder.clearData();
            for (Partial partial : partials) {
                DataRequest proto = partial.getRequest().getProto();
                builder.addAllData(proto.getDataList());
                rows.addValues(Value.newBuilder().setNumberValue(proto.getDataCount()));
            }
            builder.getParametersBuilder().putFields(MATRIX_PARAMETER, Value.newBuilder().setListValue(rows).build());
            builder.setExecEndpoint(REDUCE_ENDPOINT);
        });

        String reducerName = node + ConnectionPool.REDUCER_SUFFIX;
        List<RouteProto> routes = new ArrayList<>(ReducerSupport.mergeRoutes(partials));
        Duration remaining = context.remaining();
        Duration timeout = (remaining != null && remaining.compareTo(sendTimeout) < 0) ? remaining : sendTimeout;

        return connectionPool.acquire(reducerName, 0, null, null)
                .flatMap(replica -> {
                    Instant start = Instant.now();
                    RouteProto route = Routes.start(reducerName, replica.getPodId(), start);
                    return executorClient.send(replica, matrix, REDUCE_ENDPOINT, timeout)
                            .map(response -> {
                                StatusProto status = response.getStatus();
                                routes.add(Routes.finish(route, Instant.now(), status));
                                LazyDataRequest restored = response.mutate(builder -> {
                                    builder.setHeader(original.getHeader());
                                    builder.setExecEndpoint(original.getExecEndpoint());
                                    builder.setParameters(original.getParameters());
                                });
                                log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 经 reducer {} 合并完成，状态 {}",
                                        context.getRequestId(), context.getFlowName(), node, replica.getPodId(), status.getCode());
                                return Partial.of(restored, Routes.merge(Arrays.asList(routes, response.getRoutes())));
                            })
                            .doFinally(signal -> connectionPool.release(replica));
                })
                .onErrorResume(error -> {
                    log.warn("[RequestId: {}][Flow: '{}'] 节点 '{}' 调用 reducer 失败: {}",
                            context.getRequestId(), context.getFlowName(), node, error.getMessage());
                    StatusProto status = Statuses.fromThrowable(error, reducerName);
                    return Mono.just(Partial.error(Partial.of(first.getRequest(), routes), status));
                });
    }
}
