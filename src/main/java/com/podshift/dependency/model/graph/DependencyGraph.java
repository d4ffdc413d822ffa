package com.podshift.dependency.model.graph;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Immutable directed multigraph over container ids.
 * Every edge references nodes present in the graph; edges are kept in sorted order.
 */
@Getter
public final class DependencyGraph {

    private final SortedSet<String> nodes;
    private final List<DependencyEdge> edges;

    // Precomputed adjacency over ordering edges only, dependent -> dependencies
    private final Map<String, SortedSet<String>> orderingSuccessors;

    public DependencyGraph(SortedSet<String> nodes, List<DependencyEdge> edges) {
        for (DependencyEdge edge : edges) {
            if (!nodes.contains(edge.getSource()) || !nodes.contains(edge.getTarget())) {
                throw new IllegalArgumentException("Edge references unknown node: " + edge.key());
            }
        }
        this.nodes = Collections.unmodifiableSortedSet(new TreeSet<>(nodes));
        this.edges = edges.stream().sorted().collect(Collectors.toUnmodifiableList());

        Map<String, SortedSet<String>> successors = new TreeMap<>();
        for (String node : this.nodes) {
            successors.put(node, new TreeSet<>());
        }
        for (DependencyEdge edge : this.edges) {
            if (edge.isOrdering()) {
                successors.get(edge.getSource()).add(edge.getTarget());
            }
        }
        successors.replaceAll((k, v) -> Collections.unmodifiableSortedSet(v));
        this.orderingSuccessors = Collections.unmodifiableMap(successors);
    }

    public List<DependencyEdge> getOrderingEdges() {
        return edges.stream().filter(DependencyEdge::isOrdering).collect(Collectors.toList());
    }

    public SortedSet<String> dependenciesOf(String node) {
        return orderingSuccessors.getOrDefault(node, Collections.emptySortedSet());
    }

    public List<DependencyEdge> edgesFrom(String node) {
        return edges.stream().filter(e -> e.getSource().equals(node)).collect(Collectors.toList());
    }

    public List<DependencyEdge> edgesTo(String node) {
        return edges.stream().filter(e -> e.getTarget().equals(node)).collect(Collectors.toList());
    }
}
