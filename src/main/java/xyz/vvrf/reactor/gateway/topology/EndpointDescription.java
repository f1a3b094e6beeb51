package xyz.vvrf.reactor.gateway.topology;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个 executor 副本的网络端点。
 */
@Getter
@Setter
@NoArgsConstructor
@Accessors(chain = true)
public class EndpointDescription {

    public enum Protocol {
        GRPC, GRPCS, HTTP, WEBSOCKET
    }

    private String host = "127.0.0.1";
    private int port;
    private Protocol protocol = Protocol.GRPC;
    private int shardId = 0;
    private int replicaId = 0;
    private Map<String, String> metadata = new LinkedHashMap<>();

    public static EndpointDescription of(String host, int port) {
        return new EndpointDescription().setHost(host).setPort(port);
    }

    /**
     * 副本地址 host:port，同时用作路由记录中的 pod_id。
     */
    public String address() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return protocol.name().toLowerCase() + "://" + address() + " (shard " + shardId + ", replica " + replicaId + ")";
    }
}
