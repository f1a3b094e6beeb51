package xyz.vvrf.reactor.gateway.topology;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.core.InvalidTopologyException;
import xyz.vvrf.reactor.gateway.core.ReduceStrategy;
import xyz.vvrf.reactor.gateway.util.GraphUtils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 由 Flow 描述构建不可变的 {@link TopologyGraph}，并做完整校验。
 * 构建成功后输出文本结构与 DOT 图形描述。
 */
@Slf4j
public class TopologyGraphBuilder {

    private final String flowName;
    private final Map<String, DeploymentDescription> deployments = new LinkedHashMap<>();
    private final List<String> exitNeeds = new ArrayList<>();

    public TopologyGraphBuilder(String flowName) {
        this.flowName = Objects.requireNonNull(flowName, "Flow 名称不能为空");
        log.info("为 Flow '{}' 创建 TopologyGraphBuilder", flowName);
    }

    public static TopologyGraph fromFlow(FlowDescription flow) {
        Objects.requireNonNull(flow, "Flow 描述不能为空");
        TopologyGraphBuilder builder = new TopologyGraphBuilder(flow.getName());
        if (flow.getDeployments() != null) {
            flow.getDeployments().forEach(builder::addDeployment);
        }
        if (flow.getExitNeeds() != null) {
            builder.exitNeeds(flow.getExitNeeds());
        }
        return builder.build();
    }

    public TopologyGraphBuilder addDeployment(DeploymentDescription deployment) {
        Objects.requireNonNull(deployment, "Deployment 描述不能为空");
        String name = deployment.getName();
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidTopologyException(String.format("Flow '%s': Deployment 名称不能为空。", flowName));
        }
        if (TopologyGraph.GATEWAY.equals(name)) {
            throw new InvalidTopologyException(String.format("Flow '%s': '%s' 是保留名称，不能用作 Deployment 名称。", flowName, name));
        }
        if (deployments.containsKey(name)) {
            throw new InvalidTopologyException(String.format("Flow '%s': Deployment 名称 '%s' 重复。", flowName, name));
        }
        deployments.put(name, deployment);
        log.debug("Flow '{}': 添加了 Deployment '{}' (shards: {}, replicas: {}, needs: {})",
                flowName, name, deployment.getShards(), deployment.getReplicas(), deployment.getNeeds());
        return this;
    }

    public TopologyGraphBuilder exitNeeds(Collection<String> needs) {
        this.exitNeeds.clear();
        this.exitNeeds.addAll(needs);
        return this;
    }

    public TopologyGraph build() {
        log.info("开始为 '{}' 构建 TopologyGraph...", flowName);

        List<String> nodeNames = new ArrayList<>(deployments.keySet());
        Map<String, List<String>> predecessors = new LinkedHashMap<>();
        Map<String, List<String>> successors = new LinkedHashMap<>();
        List<String> entrySuccessors = new ArrayList<>();

        for (DeploymentDescription deployment : deployments.values()) {
            validateDeployment(deployment);
            String name = deployment.getName();
            List<String> needs = normalizeNeeds(deployment);
            predecessors.put(name, Collections.unmodifiableList(needs));
            for (String upstream : needs) {
                if (TopologyGraph.GATEWAY.equals(upstream)) {
                    entrySuccessors.add(name);
                } else {
                    successors.computeIfAbsent(upstream, k -> new ArrayList<>()).add(name);
                }
            }
        }

        GraphUtils.detectCycles(nodeNames, successors, flowName);
        List<String> topologicalOrder = GraphUtils.topologicalSort(nodeNames, successors, flowName);

        List<String> exitPredecessors = resolveExit(nodeNames, successors);
        checkEveryNodeReachesExit(nodeNames, predecessors, exitPredecessors);

        Map<String, List<String>> frozenSuccessors = new LinkedHashMap<>();
        successors.forEach((k, v) -> frozenSuccessors.put(k, Collections.unmodifiableList(v)));

        String dot;
        try {
            dot = generateDotRepresentation(predecessors, exitPredecessors);
        } catch (Exception e) {
            log.error("Flow '{}': 生成 DOT 图形描述时发生错误: {}", flowName, e.getMessage(), e);
            dot = "";
        }

        log.info("Flow '{}' 构建成功。{} 个节点。拓扑顺序: {}, 入口后继: {}, 出口前驱: {}",
                flowName, nodeNames.size(), topologicalOrder, entrySuccessors, exitPredecessors);
        printTopologyStructure(predecessors);
        if (log.isDebugEnabled()) {
            log.debug("Flow '{}' DOT 图形描述:\n--- DOT BEGIN ---\n{}\n--- DOT END ---", flowName, dot);
        }

        return new TopologyGraph(flowName, nodeNames, new LinkedHashMap<>(deployments), frozenSuccessors,
                predecessors, entrySuccessors, exitPredecessors, topologicalOrder, dot);
    }

    private void validateDeployment(DeploymentDescription deployment) {
        String name = deployment.getName();
        if (deployment.getShards() < 1) {
            throw new InvalidTopologyException(String.format("Flow '%s': Deployment '%s' 的 shards 必须 >= 1，实际为 %d。",
                    flowName, name, deployment.getShards()));
        }
        if (deployment.getReplicas() < 1) {
            throw new InvalidTopologyException(String.format("Flow '%s': Deployment '%s' 的 replicas 必须 >= 1，实际为 %d。",
                    flowName, name, deployment.getReplicas()));
        }
        List<EndpointDescription> endpoints = deployment.getEndpoints() != null ? deployment.getEndpoints() : Collections.emptyList();
        Map<Integer, Integer> perShard = new HashMap<>();
        for (EndpointDescription endpoint : endpoints) {
            checkProtocol(name, endpoint);
            if (endpoint.getShardId() < 0 || endpoint.getShardId() >= deployment.getShards()) {
                throw new InvalidTopologyException(String.format("Flow '%s': Deployment '%s' 的端点 %s 分片编号越界 (shards = %d)。",
                        flowName, name, endpoint.address(), deployment.getShards()));
            }
            perShard.merge(endpoint.getShardId(), 1, Integer::sum);
        }
        for (int shard = 0; shard < deployment.getShards(); shard++) {
            int count = perShard.getOrDefault(shard, 0);
            if (count == 0) {
                throw new InvalidTopologyException(String.format("Flow '%s': Deployment '%s' 的分片 %d 没有任何端点。",
                        flowName, name, shard));
            }
            if (count < deployment.getReplicas()) {
                log.warn("Flow '{}': Deployment '{}' 分片 {} 只有 {} 个端点，少于声明的 replicas = {}。",
                        flowName, name, shard, count, deployment.getReplicas());
            }
        }
        if (deployment.getReduce() == ReduceStrategy.REDUCER_EXEC) {
            if (deployment.getReducer() == null) {
                throw new InvalidTopologyException(String.format("Flow '%s': Deployment '%s' 使用 reducer_exec 但未配置 reducer 端点。",
                        flowName, name));
            }
            checkProtocol(name, deployment.getReducer());
        }
    }

    private void checkProtocol(String deployment, EndpointDescription endpoint) {
        EndpointDescription.Protocol protocol = endpoint.getProtocol();
        if (protocol != EndpointDescription.Protocol.GRPC && protocol != EndpointDescription.Protocol.GRPCS) {
            throw new InvalidTopologyException(String.format("Flow '%s': Deployment '%s' 的端点 %s 使用了不支持的协议 %s。",
                    flowName, deployment, endpoint.address(), protocol));
        }
    }

    private List<String> normalizeNeeds(DeploymentDescription deployment) {
        List<String> declared = deployment.getNeeds();
        if (declared == null || declared.isEmpty()) {
            return Collections.singletonList(TopologyGraph.GATEWAY);
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String upstream : declared) {
            if (!TopologyGraph.GATEWAY.equals(upstream) && !deployments.containsKey(upstream)) {
                throw new InvalidTopologyException(String.format("Flow '%s': Deployment '%s' 依赖了不存在的节点 '%s'。",
                        flowName, deployment.getName(), upstream));
            }
            if (!unique.add(upstream)) {
                log.warn("Flow '{}': Deployment '{}' 的 needs 中重复声明了 '{}'，已忽略重复项。",
                        flowName, deployment.getName(), upstream);
            }
        }
        return new ArrayList<>(unique);
    }

    private List<String> resolveExit(List<String> nodeNames, Map<String, List<String>> successors) {
        if (exitNeeds.isEmpty()) {
            return nodeNames.stream()
                    .filter(node -> successors.getOrDefault(node, Collections.emptyList()).isEmpty())
                    .collect(Collectors.toList());
        }
        LinkedHashSet<String> exit = new LinkedHashSet<>();
        for (String node : exitNeeds) {
            if (!deployments.containsKey(node)) {
                throw new InvalidTopologyException(String.format("Flow '%s': 出口依赖了不存在的节点 '%s'。", flowName, node));
            }
            exit.add(node);
        }
        return new ArrayList<>(exit);
    }

    private void checkEveryNodeReachesExit(List<String> nodeNames,
                                           Map<String, List<String>> predecessors,
                                           List<String> exitPredecessors) {
        Set<String> reachesExit = GraphUtils.reachableFrom(exitPredecessors, predecessors);
        List<String> dangling = nodeNames.stream()
                .filter(node -> !reachesExit.contains(node))
                .collect(Collectors.toList());
        if (!dangling.isEmpty()) {
            throw new InvalidTopologyException(String.format("Flow '%s': 节点 %s 没有通往出口的路径。", flowName, dangling));
        }
    }

    private void printTopologyStructure(Map<String, List<String>> predecessors) {
        if (!log.isInfoEnabled() || deployments.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder("\n节点:\n");
        builder.append(String.format("%-30s | %-8s | %-8s | %-8s | %-16s | %s%n", "名称", "shards", "replicas", "polling", "reduce", "needs"));
        deployments.forEach((name, d) -> builder.append(String.format("%-30s | %-8d | %-8d | %-8s | %-16s | %s%n",
                name, d.getShards(), d.getReplicas(), d.getPolling(), d.getReduce(), predecessors.get(name))));
        log.info("Flow '{}' 最终结构 (文本):{}", flowName, builder);
    }

    private String generateDotRepresentation(Map<String, List<String>> predecessors, List<String> exitPredecessors) {
        StringBuilder dot = new StringBuilder();
        String safeFlowName = escapeDotString(flowName);

        dot.append(String.format("digraph \"%s\" {\n", safeFlowName));
        dot.append("  rankdir=LR;\n");
        dot.append(String.format("  label=\"%s\";\n", safeFlowName));
        dot.append("  node [shape=box, style=rounded];\n");
        dot.append("  \"start-gateway\" [shape=oval];\n");
        dot.append("  \"end-gateway\" [shape=oval];\n");

        for (DeploymentDescription d : deployments.values()) {
            String name = escapeDotString(d.getName());
            String label = String.format("%s\\n(shards=%d, replicas=%d, %s)", name, d.getShards(), d.getReplicas(), d.getPolling());
            List<String> attributes = new ArrayList<>();
            attributes.add(String.format("label=\"%s\"", label));
            if (predecessors.getOrDefault(d.getName(), Collections.emptyList()).size() > 1) {
                attributes.add("color=blue");
            }
            dot.append(String.format("  \"%s\" [%s];\n", name, String.join(", ", attributes)));
        }

        predecessors.forEach((node, ups) -> ups.forEach(up -> dot.append(String.format("  \"%s\" -> \"%s\";\n",
                TopologyGraph.GATEWAY.equals(up) ? "start-gateway" : escapeDotString(up), escapeDotString(node)))));
        if (exitPredecessors.isEmpty()) {
            dot.append("  \"start-gateway\" -> \"end-gateway\";\n");
        }
        exitPredecessors.forEach(node -> dot.append(String.format("  \"%s\" -> \"end-gateway\";\n", escapeDotString(node))));

        dot.append("}\n");
        return dot.toString();
    }

    private String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
