package com.podshift.dependency.service.graph;

import com.podshift.dependency.model.graph.Cycle;
import com.podshift.dependency.model.graph.CycleReport;
import com.podshift.dependency.model.graph.DependencyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Enumerates simple cycles in the dependency graph using DFS.
 *
 * Only ordering edges are followed; network and undirected volume sharing never form a cycle.
 * Every cycle lies inside one strongly connected component, so the search runs per component
 * with more than one member and never leaves it. Acyclic parts of the graph cost nothing.
 *
 * Inside a component the smallest member is taken as start node and every cycle through it is
 * collected. The start node is then removed, the rest of the component is split into its own
 * strongly connected components again, and each non-trivial one is searched the same way.
 * Every cycle is thereby met from its smallest member. Revisiting a node on the active path
 * yields the path slice from that node onward, which is then canonicalized and de-duplicated.
 *
 * A dense component can hold exponentially many simple cycles, so the number of explored path
 * extensions is capped per component. When a component hits the cap the report is flagged
 * truncated and the search moves on to the next component; cycles already found stay valid.
 */
@Service
@Slf4j
public class CircularDependencyDetector {

    public CycleReport detectCycles(DependencyGraph graph, long maxExploredPaths) {
        List<SortedSet<String>> components = StronglyConnectedComponents.cyclic(graph);
        log.info("[cycle-detector] start nodes={} orderingEdges={} cyclicComponents={} cap={}",
                graph.getNodes().size(), graph.getOrderingEdges().size(), components.size(), maxExploredPaths);

        TreeSet<Cycle> found = new TreeSet<>();
        long explored = 0;
        boolean truncated = false;
        for (SortedSet<String> component : components) {
            Search search = new Search(graph, maxExploredPaths, found);
            Deque<SortedSet<String>> pending = new ArrayDeque<>();
            pending.push(component);
            while (!pending.isEmpty() && !search.truncated) {
                SortedSet<String> members = pending.pop();
                String start = members.first();
                search.explore(start, members);

                SortedSet<String> rest = new TreeSet<>(members);
                rest.remove(start);
                StronglyConnectedComponents.cyclic(graph, rest).forEach(pending::push);
            }
            explored += search.explored;
            if (search.truncated) {
                truncated = true;
                log.warn("[cycle-detector] cycle enumeration truncated in component of {} containers starting at '{}'"
                        + " after {} explored paths", component.size(), component.first(), search.explored);
            }
        }

        List<Cycle> cycles = new ArrayList<>(found);
        for (Cycle cycle : cycles) {
            log.warn("[cycle-detector] circular dependency: {}", cycle.describe());
        }
        log.info("[cycle-detector] end cycles={} explored={} truncated={}", cycles.size(), explored, truncated);
        return new CycleReport(cycles, truncated, explored);
    }

    /**
     * Mutable state of the enumeration inside one component; never shared between runs.
     */
    private static final class Search {
        private final DependencyGraph graph;
        private final long cap;
        private final Set<Cycle> found;
        private final List<String> path = new ArrayList<>();
        private final Set<String> onPath = new HashSet<>();
        private final Deque<Iterator<String>> successors = new ArrayDeque<>();
        private long explored;
        private boolean truncated;

        private Search(DependencyGraph graph, long cap, Set<Cycle> found) {
            this.graph = graph;
            this.cap = cap;
            this.found = found;
        }

        private void explore(String start, Set<String> members) {
            if (!enter(start)) {
                return;
            }
            while (!successors.isEmpty() && !truncated) {
                Iterator<String> next = successors.peek();
                if (!next.hasNext()) {
                    leave();
                    continue;
                }
                String node = next.next();
                if (!members.contains(node)) {
                    continue;
                }
                if (onPath.contains(node)) {
                    found.add(Cycle.canonical(path.subList(path.indexOf(node), path.size())));
                } else {
                    enter(node);
                }
            }
            while (!successors.isEmpty()) {
                leave();
            }
        }

        private boolean enter(String node) {
            if (explored >= cap) {
                truncated = true;
                return false;
            }
            explored++;
            path.add(node);
            onPath.add(node);
            successors.push(graph.dependenciesOf(node).iterator());
            return true;
        }

        private void leave() {
            successors.pop();
            onPath.remove(path.remove(path.size() - 1));
        }
    }
}
