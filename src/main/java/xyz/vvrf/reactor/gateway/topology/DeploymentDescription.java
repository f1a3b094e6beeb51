package xyz.vvrf.reactor.gateway.topology;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;
import xyz.vvrf.reactor.gateway.core.PollingType;
import xyz.vvrf.reactor.gateway.core.ReduceStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Flow 中的一个 Deployment (一个 executor 的全部分片与副本)。
 * <p>
 * needs 为空表示直接接在网关入口之后。
 */
@Getter
@Setter
@NoArgsConstructor
@Accessors(chain = true)
public class DeploymentDescription {

    private String name;
    private int shards = 1;
    private int replicas = 1;
    private PollingType polling = PollingType.ANY;
    private ReduceStrategy reduce = ReduceStrategy.CONCAT_DOCS;
    private List<String> needs = new ArrayList<>();
    private List<EndpointDescription> endpoints = new ArrayList<>();

    /** 有状态 deployment 的写端点发往 leader 副本 */
    private boolean stateful = false;
    private Set<String> writeEndpoints = new LinkedHashSet<>();

    /** reduce = REDUCER_EXEC 时使用的合并 executor */
    private EndpointDescription reducer;

    /** 覆盖全局 send-timeout */
    private Duration timeout;
    /** 覆盖全局 max-retries */
    private Integer retries;

    public static DeploymentDescription named(String name) {
        return new DeploymentDescription().setName(name);
    }

    public DeploymentDescription addEndpoint(EndpointDescription endpoint) {
        this.endpoints.add(endpoint);
        return this;
    }

    public DeploymentDescription needs(String... upstream) {
        this.needs = new ArrayList<>(List.of(upstream));
        return this;
    }
}
