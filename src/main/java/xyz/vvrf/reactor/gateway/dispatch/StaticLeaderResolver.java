package xyz.vvrf.reactor.gateway.dispatch;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.topology.DeploymentDescription;
import xyz.vvrf.reactor.gateway.topology.EndpointDescription;
import xyz.vvrf.reactor.gateway.topology.TopologyGraph;

import java.util.HashMap;
import java.util.Map;

/**
 * 从拓扑描述中静态确定 leader：端点 metadata 中 leader=true 的副本，否则取该分片声明的第一个端点。
 */
@Slf4j
public class StaticLeaderResolver implements LeaderResolver {

    public static final String LEADER_METADATA_KEY = "leader";

    private final Map<String, String> leaders = new HashMap<>();

    public StaticLeaderResolver(TopologyGraph graph) {
        for (DeploymentDescription deployment : graph.getDeployments().values()) {
            if (!deployment.isStateful()) {
                continue;
            }
            for (EndpointDescription endpoint : deployment.getEndpoints()) {
                String key = key(deployment.getName(), endpoint.getShardId());
                boolean flagged = "true".equalsIgnoreCase(endpoint.getMetadata().get(LEADER_METADATA_KEY));
                if (flagged || !leaders.containsKey(key)) {
                    leaders.put(key, endpoint.address());
                }
            }
        }
        log.info("StaticLeaderResolver 初始化完成，leader: {}", leaders);
    }

    @Override
    public String leader(String deployment, int shard) {
        return leaders.get(key(deployment, shard));
    }

    private static String key(String deployment, int shard) {
        return deployment + "#" + shard;
    }
}
