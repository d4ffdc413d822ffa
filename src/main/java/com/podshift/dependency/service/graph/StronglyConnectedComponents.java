package com.podshift.dependency.service.graph;

import com.podshift.dependency.model.graph.DependencyGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tarjan's strongly connected components over ordering edges.
 *
 * Iterative, so long dependency chains do not exhaust the call stack. Nodes and successors
 * are visited in ascending id order, which makes the component order deterministic.
 */
final class StronglyConnectedComponents {

    private final DependencyGraph graph;
    private final Set<String> within;
    private final Map<String, Integer> indexOf = new HashMap<>();
    private final Map<String, Integer> lowLink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<SortedSet<String>> components = new ArrayList<>();
    private int counter;

    private StronglyConnectedComponents(DependencyGraph graph, Set<String> within) {
        this.graph = graph;
        this.within = within;
    }

    /** Every node appears in exactly one component; dependencies come before their dependents. */
    static List<SortedSet<String>> of(DependencyGraph graph) {
        return of(graph, graph.getNodes());
    }

    /** Components of the subgraph induced by {@code within}; edges leaving it are ignored. */
    static List<SortedSet<String>> of(DependencyGraph graph, SortedSet<String> within) {
        StronglyConnectedComponents tarjan = new StronglyConnectedComponents(graph, within);
        for (String node : within) {
            if (!tarjan.indexOf.containsKey(node)) {
                tarjan.strongConnect(node);
            }
        }
        return Collections.unmodifiableList(tarjan.components);
    }

    /** Components with more than one member, i.e. the ones holding at least one cycle. */
    static List<SortedSet<String>> cyclic(DependencyGraph graph) {
        return cyclic(graph, graph.getNodes());
    }

    static List<SortedSet<String>> cyclic(DependencyGraph graph, SortedSet<String> within) {
        List<SortedSet<String>> cyclic = new ArrayList<>();
        for (SortedSet<String> component : of(graph, within)) {
            if (component.size() > 1) {
                cyclic.add(component);
            }
        }
        return cyclic;
    }

    private void strongConnect(String root) {
        Deque<Frame> work = new ArrayDeque<>();
        work.push(visit(root));

        while (!work.isEmpty()) {
            Frame frame = work.peek();
            if (frame.successors.hasNext()) {
                String next = frame.successors.next();
                if (!indexOf.containsKey(next)) {
                    work.push(visit(next));
                } else if (onStack.contains(next)) {
                    lowLink.put(frame.node, Math.min(lowLink.get(frame.node), indexOf.get(next)));
                }
                continue;
            }

            work.pop();
            if (lowLink.get(frame.node).equals(indexOf.get(frame.node))) {
                SortedSet<String> component = new TreeSet<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(frame.node));
                components.add(Collections.unmodifiableSortedSet(component));
            }
            if (!work.isEmpty()) {
                String parent = work.peek().node;
                lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node)));
            }
        }
    }

    private Frame visit(String node) {
        indexOf.put(node, counter);
        lowLink.put(node, counter);
        counter++;
        stack.push(node);
        onStack.add(node);
        Iterator<String> successors = graph.dependenciesOf(node).stream().filter(within::contains).iterator();
        return new Frame(node, successors);
    }

    private static final class Frame {
        private final String node;
        private final Iterator<String> successors;

        private Frame(String node, Iterator<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
