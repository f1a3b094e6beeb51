package xyz.vvrf.reactor.gateway.core;

/**
 * 汇合节点 (以及 ALL 轮询的分片结果) 的合并策略。
 */
public enum ReduceStrategy {
    CONCAT_DOCS,
    FIRST_NON_EMPTY,
    REDUCER_EXEC
}
