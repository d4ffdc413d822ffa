package com.podshift.dependency.service.graph;

import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyGraph;
import com.podshift.dependency.model.graph.MigrationPhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Splits the graph into ordered migration phases.
 *
 * 1. Strongly connected components over ordering edges (Tarjan). A component with more than
 *    one member is a cyclic cluster and is scheduled as a single unit.
 * 2. The condensation is acyclic; it is layered Kahn-style. Layer 0 holds the units with no
 *    dependency, layer k the units whose dependencies all sit in earlier layers.
 * 3. Within a layer, plain containers share one parallel phase and every cyclic cluster gets
 *    a phase of its own. Phases are ordered by layer, then by smallest member id.
 *
 * Dependencies always land in an earlier phase than their dependents.
 */
@Service
@Slf4j
public class PhaseScheduler {

    private static final String CLUSTER_DESCRIPTION =
            "Containers with circular dependencies (%s) - migrate together, manual intervention required";
    private static final String LEVEL_DESCRIPTION = "Migrate %d container%s with dependency level %d";

    public List<MigrationPhase> schedule(DependencyGraph graph) {
        List<SortedSet<String>> components = StronglyConnectedComponents.of(graph);
        log.info("[phase-scheduler] start nodes={} components={} cyclicClusters={}", graph.getNodes().size(),
                components.size(), components.stream().filter(c -> c.size() > 1).count());

        Map<String, SortedSet<String>> unitOf = new HashMap<>();
        Map<String, SortedSet<String>> unitsById = new TreeMap<>();
        for (SortedSet<String> component : components) {
            unitsById.put(component.first(), component);
            for (String member : component) {
                unitOf.put(member, component);
            }
        }

        // Precedence between units: dependency unit -> dependent units
        Map<String, SortedSet<String>> dependents = new TreeMap<>();
        Map<String, Integer> pending = new TreeMap<>();
        unitsById.keySet().forEach(id -> {
            dependents.put(id, new TreeSet<>());
            pending.put(id, 0);
        });
        for (DependencyEdge edge : graph.getOrderingEdges()) {
            String dependentUnit = unitOf.get(edge.getSource()).first();
            String dependencyUnit = unitOf.get(edge.getTarget()).first();
            if (dependentUnit.equals(dependencyUnit)) {
                continue; // internal to a cluster
            }
            if (dependents.get(dependencyUnit).add(dependentUnit)) {
                pending.merge(dependentUnit, 1, Integer::sum);
            }
        }

        List<MigrationPhase> phases = new ArrayList<>();
        TreeSet<String> layer = new TreeSet<>();
        pending.forEach((id, count) -> {
            if (count == 0) {
                layer.add(id);
            }
        });

        int level = 0;
        int scheduledUnits = 0;
        while (!layer.isEmpty()) {
            emitLayer(level, layer, unitsById, phases);
            scheduledUnits += layer.size();

            TreeSet<String> next = new TreeSet<>();
            for (String unit : layer) {
                for (String dependent : dependents.get(unit)) {
                    if (pending.merge(dependent, -1, Integer::sum) == 0) {
                        next.add(dependent);
                    }
                }
            }
            layer.clear();
            layer.addAll(next);
            level++;
        }

        if (scheduledUnits != unitsById.size()) {
            throw new IllegalStateException("Condensation graph is not acyclic: scheduled "
                    + scheduledUnits + " of " + unitsById.size() + " units");
        }

        log.info("[phase-scheduler] end phases={} levels={}", phases.size(), level);
        return Collections.unmodifiableList(phases);
    }

    private void emitLayer(int level, SortedSet<String> layer, Map<String, SortedSet<String>> unitsById,
                           List<MigrationPhase> phases) {
        List<SortedSet<String>> groups = new ArrayList<>();
        SortedSet<String> plain = new TreeSet<>();
        for (String unitId : layer) {
            SortedSet<String> unit = unitsById.get(unitId);
            if (unit.size() > 1) {
                groups.add(unit);
            } else {
                plain.addAll(unit);
            }
        }
        if (!plain.isEmpty()) {
            groups.add(plain);
        }
        groups.sort(Comparator.comparing((SortedSet<String> g) -> g.first()));

        for (SortedSet<String> group : groups) {
            boolean cluster = group != plain;
            int index = phases.size();
            List<String> members = List.copyOf(group);
            phases.add(MigrationPhase.builder()
                    .index(index)
                    .name("Phase " + (index + 1))
                    .level(level)
                    .containers(members)
                    .parallel(!cluster)
                    .cyclicCluster(cluster)
                    .manualReview(cluster)
                    .description(cluster
                            ? String.format(CLUSTER_DESCRIPTION, String.join(", ", members))
                            : String.format(LEVEL_DESCRIPTION, members.size(), members.size() == 1 ? "" : "s", level))
                    .build());
        }
    }
}
