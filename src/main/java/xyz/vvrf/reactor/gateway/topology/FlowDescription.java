package xyz.vvrf.reactor.gateway.topology;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;

/**
 * 解析后的 Flow 描述。由 Spring 属性绑定 (gateway.flow) 或以编程方式构造。
 * exitNeeds 为空时，所有没有后继的节点都汇入出口。
 */
@Getter
@Setter
@NoArgsConstructor
@Accessors(chain = true)
public class FlowDescription {

    private String name = "flow";
    private List<DeploymentDescription> deployments = new ArrayList<>();
    private List<String> exitNeeds = new ArrayList<>();

    public FlowDescription add(DeploymentDescription deployment) {
        this.deployments.add(deployment);
        return this;
    }
}
