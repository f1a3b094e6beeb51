package xyz.vvrf.reactor.gateway.topology;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 不可变的 Flow 拓扑图，构建后在所有请求之间只读共享。
 * <p>
 * 入口节点固定命名为 {@link #GATEWAY}，它作为前驱出现在入口后继的 predecessors 中；
 * 出口是隐式的，由 {@link #getExitPredecessors()} 描述。
 */
public final class TopologyGraph {

    /** 入口伪节点名称，也是 needs 中表示"接在网关之后"的保留名 */
    public static final String GATEWAY = "gateway";

    @Getter private final String name;
    @Getter private final List<String> nodeNames;
    @Getter private final List<String> entrySuccessors;
    @Getter private final List<String> exitPredecessors;
    @Getter private final List<String> topologicalOrder;
    private final Map<String, DeploymentDescription> deployments;
    private final Map<String, List<String>> successors;
    private final Map<String, List<String>> predecessors;
    private final String dot;

    TopologyGraph(String name,
                  List<String> nodeNames,
                  Map<String, DeploymentDescription> deployments,
                  Map<String, List<String>> successors,
                  Map<String, List<String>> predecessors,
                  List<String> entrySuccessors,
                  List<String> exitPredecessors,
                  List<String> topologicalOrder,
                  String dot) {
        this.name = name;
        this.nodeNames = Collections.unmodifiableList(nodeNames);
        this.deployments = Collections.unmodifiableMap(deployments);
        this.successors = Collections.unmodifiableMap(successors);
        this.predecessors = Collections.unmodifiableMap(predecessors);
        this.entrySuccessors = Collections.unmodifiableList(entrySuccessors);
        this.exitPredecessors = Collections.unmodifiableList(exitPredecessors);
        this.topologicalOrder = topologicalOrder;
        this.dot = dot;
    }

    public DeploymentDescription getDeployment(String node) {
        DeploymentDescription deployment = deployments.get(node);
        if (deployment == null) {
            throw new IllegalArgumentException(String.format("Flow '%s' 中不存在节点 '%s'", name, node));
        }
        return deployment;
    }

    public Map<String, DeploymentDescription> getDeployments() {
        return deployments;
    }

    /**
     * 下游节点，按声明顺序。入口伪节点的后继即 {@link #getEntrySuccessors()}。
     */
    public List<String> successors(String node) {
        if (GATEWAY.equals(node)) {
            return entrySuccessors;
        }
        return successors.getOrDefault(node, Collections.emptyList());
    }

    /**
     * 上游节点，按 needs 声明顺序；可能包含 {@link #GATEWAY}。
     */
    public List<String> predecessors(String node) {
        return predecessors.getOrDefault(node, Collections.emptyList());
    }

    /**
     * 有多个前驱的节点需要先汇合再派发。
     */
    public boolean isJoin(String node) {
        return predecessors(node).size() > 1;
    }

    public boolean contains(String node) {
        return deployments.containsKey(node);
    }

    public int size() {
        return nodeNames.size();
    }

    /**
     * Graphviz DOT 描述。
     */
    public String toDot() {
        return dot;
    }

    @Override
    public String toString() {
        return "TopologyGraph{" +
                "name='" + name + '\'' +
                ", nodes=" + nodeNames +
                ", entry=" + entrySuccessors +
                ", exit=" + exitPredecessors +
                '}';
    }
}
