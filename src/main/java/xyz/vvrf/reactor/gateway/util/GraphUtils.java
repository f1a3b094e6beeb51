package xyz.vvrf.reactor.gateway.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.gateway.core.InvalidTopologyException;

import java.util.*;

/**
 * 拓扑图的循环检测、拓扑排序与可达性计算。
 * 邻接表均为 上游 -> 有序下游列表。
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 使用深度优先搜索 (DFS) 检测循环。
     *
     * @param allNodeNames 图中所有节点名称 (有序)
     * @param adjacency    邻接表
     * @param flowName     Flow 名称，用于错误消息
     * @throws InvalidTopologyException 如果检测到循环
     */
    public static void detectCycles(Collection<String> allNodeNames,
                                    Map<String, List<String>> adjacency,
                                    String flowName) {
        log.debug("Flow '{}': Starting cycle detection...", flowName);
        Set<String> visited = new HashSet<>(); // 完全访问过的节点
        Set<String> visiting = new LinkedHashSet<>(); // 当前递归路径上的节点

        for (String nodeName : allNodeNames) {
            if (!visited.contains(nodeName)) {
                hasCycleDFS(nodeName, visited, visiting, adjacency, flowName);
            }
        }
        log.debug("Flow '{}': No cycles detected.", flowName);
    }

    private static void hasCycleDFS(String nodeName,
                                    Set<String> visited,
                                    Set<String> visiting,
                                    Map<String, List<String>> adjacency,
                                    String flowName) {
        visited.add(nodeName);
        visiting.add(nodeName);

        for (String neighbor : adjacency.getOrDefault(nodeName, Collections.emptyList())) {
            if (visiting.contains(neighbor)) {
                List<String> path = new ArrayList<>(visiting);
                path = path.subList(path.indexOf(neighbor), path.size());
                throw new InvalidTopologyException(String.format("Flow '%s': Cycle detected! Path: %s -> %s",
                        flowName, String.join(" -> ", path), neighbor));
            }
            if (!visited.contains(neighbor)) {
                hasCycleDFS(neighbor, visited, visiting, adjacency, flowName);
            }
        }

        visiting.remove(nodeName); // 回溯
    }

    /**
     * 使用 Kahn 算法计算拓扑排序。入度同时为 0 的节点按声明顺序出队，保证结果确定。
     *
     * @param allNodeNames 图中所有节点名称 (声明顺序)
     * @param adjacency    邻接表
     * @param flowName     Flow 名称
     * @return 按拓扑顺序排列的节点名称列表
     * @throws InvalidTopologyException 如果图包含循环
     */
    public static List<String> topologicalSort(List<String> allNodeNames,
                                               Map<String, List<String>> adjacency,
                                               String flowName) {
        log.debug("Flow '{}': Starting topological sort...", flowName);
        Map<String, Integer> declarationIndex = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (int i = 0; i < allNodeNames.size(); i++) {
            declarationIndex.put(allNodeNames.get(i), i);
            inDegree.put(allNodeNames.get(i), 0);
        }
        for (List<String> neighbors : adjacency.values()) {
            for (String neighbor : neighbors) {
                inDegree.merge(neighbor, 1, Integer::sum);
            }
        }

        PriorityQueue<String> queue = new PriorityQueue<>(Comparator.comparingInt(declarationIndex::get));
        for (String nodeName : allNodeNames) {
            if (inDegree.get(nodeName) == 0) {
                queue.offer(nodeName);
            }
        }

        List<String> sortedOrder = new ArrayList<>();
        while (!queue.isEmpty()) {
            String u = queue.poll();
            sortedOrder.add(u);
            for (String v : adjacency.getOrDefault(u, Collections.emptyList())) {
                if (inDegree.merge(v, -1, Integer::sum) == 0) {
                    queue.offer(v);
                }
            }
        }

        if (sortedOrder.size() != allNodeNames.size()) {
            Set<String> remainingNodes = new LinkedHashSet<>(allNodeNames);
            remainingNodes.removeAll(sortedOrder);
            throw new InvalidTopologyException(String.format("Flow '%s': Topological sort failed. Graph contains a cycle. Unsorted nodes: %s",
                    flowName, remainingNodes));
        }

        log.debug("Flow '{}': Topological sort successful: {}", flowName, sortedOrder);
        return Collections.unmodifiableList(sortedOrder);
    }

    /**
     * 计算从 sources 出发沿邻接表可达的全部节点 (含 sources 本身)。
     */
    public static Set<String> reachableFrom(Collection<String> sources, Map<String, List<String>> adjacency) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(sources);
        while (!stack.isEmpty()) {
            String node = stack.pop();
            if (reached.add(node)) {
                for (String next : adjacency.getOrDefault(node, Collections.emptyList())) {
                    stack.push(next);
                }
            }
        }
        return reached;
    }
}
