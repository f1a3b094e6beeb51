package xyz.vvrf.reactor.gateway.join;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.gateway.core.HopContext;
import xyz.vvrf.reactor.gateway.core.Partial;
import xyz.vvrf.reactor.gateway.core.ReduceStrategy;

import java.util.List;

/**
 * 将汇合节点 (或 ALL 轮询的各分片) 的多个中间结果合并为一个。
 * partials 按前驱声明顺序 (或分片编号) 排列，且不为空。
 */
public interface RequestReducer {

    ReduceStrategy strategy();

    Mono<Partial> reduce(String node, List<Partial> partials, HopContext context);
}
