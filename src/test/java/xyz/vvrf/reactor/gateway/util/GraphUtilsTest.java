package xyz.vvrf.reactor.gateway.util;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.gateway.core.InvalidTopologyException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphUtilsTest {

    private static Map<String, List<String>> edges(String... pairs) {
        Map<String, List<String>> adjacency = new HashMap<>();
        for (String pair : pairs) {
            String[] parts = pair.split("->");
            adjacency.computeIfAbsent(parts[0], k -> new ArrayList<>()).add(parts[1]);
        }
        return adjacency;
    }

    @Test
    void topologicalSortKeepsDeclarationOrderForIndependentNodes() {
        List<String> nodes = Arrays.asList("C", "A", "B", "D");
        Map<String, List<String>> adjacency = edges("A->D", "B->D", "C->D");

        assertThat(GraphUtils.topologicalSort(nodes, adjacency, "f")).containsExactly("C", "A", "B", "D");
    }

    @Test
    void topologicalSortRespectsEdges() {
        List<String> nodes = Arrays.asList("D", "C", "B", "A");
        Map<String, List<String>> adjacency = edges("A->B", "B->C", "C->D");

        assertThat(GraphUtils.topologicalSort(nodes, adjacency, "f")).containsExactly("A", "B", "C", "D");
    }

    @Test
    void detectsCycleWithPath() {
        List<String> nodes = Arrays.asList("A", "B", "C");
        Map<String, List<String>> adjacency = edges("A->B", "B->C", "C->A");

        assertThatThrownBy(() -> GraphUtils.detectCycles(nodes, adjacency, "f"))
                .isInstanceOf(InvalidTopologyException.class)
                .hasMessageContaining("A -> B -> C -> A");
        assertThatThrownBy(() -> GraphUtils.topologicalSort(nodes, adjacency, "f"))
                .isInstanceOf(InvalidTopologyException.class);
    }

    @Test
    void acyclicGraphPasses() {
        assertThatCode(() -> GraphUtils.detectCycles(Arrays.asList("A", "B"), edges("A->B"), "f"))
                .doesNotThrowAnyException();
    }

    @Test
    void reachability() {
        Map<String, List<String>> adjacency = edges("A->B", "B->C", "X->Y");

        assertThat(GraphUtils.reachableFrom(Collections.singletonList("A"), adjacency))
                .containsExactlyInAnyOrder("A", "B", "C");
        assertThat(GraphUtils.reachableFrom(Collections.emptyList(), adjacency)).isEmpty();
    }
}
