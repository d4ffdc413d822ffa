package com.podshift.dependency.model;

import com.podshift.dependency.model.graph.CycleReport;
import com.podshift.dependency.model.graph.DependencyGraph;
import com.podshift.dependency.model.graph.MigrationSequence;
import com.podshift.dependency.model.snapshot.Snapshot;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything one run produces: the merged graph, its cycles, the plan, and the
 * accumulated diagnostics.
 */
@Value
@Builder
public class ResolutionResult {
    Snapshot snapshot;
    ResolverSettings settings;
    DependencyGraph graph;
    CycleReport cycleReport;
    MigrationSequence sequence;
    List<Diagnostic> diagnostics;   // Sorted
}
