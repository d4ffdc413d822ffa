package com.podshift.dependency.service.graph;

import com.podshift.dependency.model.Diagnostic;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyGraph;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.service.extractor.ExtractionResult;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Merges extractor output into one {@link DependencyGraph}.
 *
 * Edges are sorted before merging so the result does not depend on the order extractors
 * finished in. Edges equal in (source, target, kind) collapse into one, keeping all their
 * evidence; edges that differ only in kind are kept apart.
 */
@Service
@Slf4j
public class DependencyGraphBuilder {

    private static final Comparator<DependencyEdge> IDENTITY = Comparator
            .comparing(DependencyEdge::getSource)
            .thenComparing(DependencyEdge::getTarget)
            .thenComparing(DependencyEdge::getKind);

    @Value
    public static class BuildOutcome {
        DependencyGraph graph;
        List<Diagnostic> diagnostics;
    }

    public BuildOutcome build(SortedSet<String> nodes, Collection<ExtractionResult> results) {
        List<DependencyEdge> candidates = new ArrayList<>();
        for (ExtractionResult result : results) {
            candidates.addAll(result.getEdges());
        }
        candidates.sort(DependencyEdge.ORDER);
        log.info("[graph-builder] start nodes={} candidateEdges={}", nodes.size(), candidates.size());

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<DependencyEdge> merged = new ArrayList<>();
        int dangling = 0;
        int duplicates = 0;

        DependencyEdge current = null;
        for (DependencyEdge edge : candidates) {
            if (!nodes.contains(edge.getSource()) || !nodes.contains(edge.getTarget())) {
                dangling++;
                String missing = !nodes.contains(edge.getSource()) ? edge.getSource() : edge.getTarget();
                log.warn("[graph-builder] dropping edge {} - unknown container '{}'", edge.key(), missing);
                diagnostics.add(Diagnostic.dangling("graph-builder", edge.key(),
                        "Edge references unknown container '" + missing + "' and was dropped"));
                continue;
            }
            if (edge.getSource().equals(edge.getTarget())) {
                diagnostics.add(Diagnostic.malformed("graph-builder", edge.key(), "Self-referencing edge dropped"));
                continue;
            }
            if (current != null && IDENTITY.compare(current, edge) == 0) {
                current = mergeInto(current, edge);
                duplicates++;
            } else {
                if (current != null) {
                    merged.add(current);
                }
                current = edge;
            }
        }
        if (current != null) {
            merged.add(current);
        }

        DependencyGraph graph = new DependencyGraph(nodes, merged);
        log.info("[graph-builder] end nodes={} edges={} orderingEdges={} merged={} dangling={}",
                graph.getNodes().size(), graph.getEdges().size(), graph.getOrderingEdges().size(), duplicates, dangling);
        return new BuildOutcome(graph, diagnostics);
    }

    private DependencyEdge mergeInto(DependencyEdge kept, DependencyEdge duplicate) {
        SortedSet<EdgeEvidence> evidence = new TreeSet<>(kept.getProvenance());
        evidence.addAll(duplicate.getProvenance());
        return kept.toBuilder()
                .ordering(kept.isOrdering() || duplicate.isOrdering())
                .clearProvenance()
                .provenance(evidence)
                .build();
    }
}
