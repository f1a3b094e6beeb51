package xyz.vvrf.reactor.gateway.join;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.core.HopContext;
import xyz.vvrf.reactor.gateway.core.LazyDataRequest;
import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.core.ReduceStrategy;
import xyz.vvrf.reactor.gateway.proto.StatusProto;

import java.util.List;

/**
 * 取第一个文档非空的成功分支作为结果；都为空时取第一个分支。路由仍取并集。
 */
public class FirstNonEmptyReducer implements RequestReducer {

    @Override
    public ReduceStrategy strategy() {
        return ReduceStrategy.FIRST_NON_EMPTY;
    }

    @Override
    public Mono<Partial> reduce(String node, List<Partial> partials, HopContext context) {
        if (partials.size() == 1) {
            return Mono.just(partials.get(0));
        }
        return Mono.fromCallable(() -> {
            Partial chosen = partials.stream()
                    .filter(p -> p.isSuccess() && p.getRequest().getDocsCount() > 0)
                    .findFirst()
                    .orElse(partials.get(0));
            StatusProto status = ReducerSupport.mergeStatus(partials);
            LazyDataRequest request = status.equals(chosen.getStatus())
                    ? chosen.getRequest()
                    : chosen.getRequest().mutate(builder -> builder.setStatus(status));
            return Partial.of(request, ReducerSupport.mergeRoutes(partials));
        });
    }
}
