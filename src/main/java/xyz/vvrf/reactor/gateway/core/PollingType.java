package xyz.vvrf.reactor.gateway.core;

/**
 * 分片轮询方式。
 */
public enum PollingType {
    /** 只发往一个分片 */
    ANY,
    /** 发往全部分片并合并结果 */
    ALL
}
