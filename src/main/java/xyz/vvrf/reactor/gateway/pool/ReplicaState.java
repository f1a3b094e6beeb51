package xyz.vvrf.reactor.gateway.pool;

/**
 * 副本连接状态。只有 READY 的副本参与选择。
 */
public enum ReplicaState {
    CONNECTING,
    READY,
    TRANSIENT_FAILURE,
    SHUTDOWN
}
