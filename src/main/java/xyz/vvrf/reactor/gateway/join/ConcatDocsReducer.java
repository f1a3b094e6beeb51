package xyz.vvrf.reactor.gateway.join;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.gateway.core.HopContext;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.core.ReduceStrategy;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.util.List;
import java.util.Objects;

/**
 * 默认合并策略：按顺序拼接各成功分支的文档，路由取并集并按开始时间排序。
 * 只有一个分支时原样返回。多个分支的合并在 mergeScheduler 上进行。
 */
@Slf4j
public class ConcatDocsReducer implements RequestReducer {

    private final Scheduler mergeScheduler;

    public ConcatDocsReducer() {
        this(Schedulers.immediate());
    }

    public ConcatDocsReducer(Scheduler mergeScheduler) {
        this.mergeScheduler = Objects.requireNonNull(mergeScheduler, "合并调度器不能为空");
    }

    @Override
    public ReduceStrategy strategy() {
        return ReduceStrategy.CONCAT_DOCS;
    }

    @Override
    public Mono<Partial> reduce(String node, List<Partial> partials, HopContext context) {
        if (partials.size() == 1) {
            return Mono.just(partials.get(0));
        }
        return Mono.fromCallable(() -> {
            StatusProto status = ReducerSupport.mergeStatus(partials);
            LazyDataRequest merged = partials.get(0).getRequest().mutate(builder -> {
                builder.clearData();
                for (Partial partial : partials) {
                    if (partial.isSuccess()) {
                        builder.addAllData(partial.getRequest().getProto().getDataList());
                    }
                }
                builder.setStatus(status);
            });
            log.debug("[RequestId: {}][Flow: '{}'] 节点 '{}' 以 concat_docs 合并了 {} 个分支，文档数 {}，状态 {}",
                    context.getRequestId(), context.getFlowName(), node, partials.size(), merged.getDocsCount(), status.getCode());
            return Partial.of(merged, ReducerSupport.mergeRoutes(partials));
        }).subscribeOn(mergeScheduler);
    }
}
