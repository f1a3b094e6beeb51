package xyz.vvrf.reactor.gateway.join;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.core.ReduceStrategy;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * 按合并策略查找 {@link RequestReducer}。
 */
@Slf4j
public class ReducerRegistry {

    private final Map<ReduceStrategy, RequestReducer> reducers = new EnumMap<>(ReduceStrategy.class);

    public ReducerRegistry(Collection<RequestReducer> reducers) {
        for (RequestReducer reducer : reducers) {
            RequestReducer previous = this.reducers.put(reducer.strategy(), reducer);
            if (previous != null) {
                log.warn("合并策略 {} 的实现 {} 被 {} 覆盖", reducer.strategy(),
                        previous.getClass().getSimpleName(), reducer.getClass().getSimpleName());
            }
        }
        log.info("ReducerRegistry 初始化完成，已注册策略: {}", this.reducers.keySet());
    }

    /**
     * @throws IllegalStateException 如果该策略没有注册实现
     */
    public RequestReducer get(ReduceStrategy strategy) {
        RequestReducer reducer = reducers.get(strategy != null ? strategy : ReduceStrategy.CONCAT_DOCS);
        if (reducer == null) {
            throw new IllegalStateException("没有为合并策略 " + strategy + " 注册实现");
        }
        return reducer;
    }
}
