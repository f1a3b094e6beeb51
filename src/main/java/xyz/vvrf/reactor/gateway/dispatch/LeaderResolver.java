package xyz.vvrf.reactor.gateway.dispatch;

/**
 * 提供有状态 deployment 某个分片当前的 leader 副本。网关本身不参与选主。
 */
@FunctionalInterface
public interface LeaderResolver {

    /**
     * @return leader 副本的 pod_id (host:port)；未知时返回 null，此时写请求可发往任意 READY 副本
     */
    String leader(String deployment, int shard);
}
