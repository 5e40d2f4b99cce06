package com.docbinder.core.source;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NavigationGraphTest {

    @Test
    void reachableFrom_cycle_visitsEachDocumentOnce() {
        // Given
        NavigationGraph graph = new NavigationGraph(Map.of(
            "a", List.of("b"),
            "b", List.of("c", "a"),
            "c", List.of()));

        // When / Then
        assertThat(graph.reachableFrom("a")).containsExactly("a", "b", "c");
        assertThat(graph.includersOf("a")).containsExactly("b");
        assertThat(NavigationGraph.empty().reachableFrom("x")).containsExactly("x");
    }
}
