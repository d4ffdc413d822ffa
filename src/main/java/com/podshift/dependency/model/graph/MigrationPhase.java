package com.podshift.dependency.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One step of the migration order.
 *
 * Phases on the same level have no ordering edge between them and may run side by side.
 * A cyclic cluster always gets a phase of its own, migrated one container at a time.
 */
@Value
@Builder(toBuilder = true)
public class MigrationPhase {
    int index;                      // 0-based position in the sequence
    String name;                    // "Phase 1", ...
    int level;                      // Dependency layer of the condensation graph
    List<String> containers;        // Sorted ids
    boolean parallel;               // Members can be migrated concurrently
    boolean cyclicCluster;
    boolean manualReview;
    String description;
    double estimatedMinutes;
}
