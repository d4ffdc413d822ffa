package com.podshift.dependency.model.graph;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The computed plan. Built once per run and never modified afterwards.
 */
@Value
@Builder
public class MigrationSequence {
    List<MigrationPhase> phases;
    List<String> startupOrder;      // Phase members flattened in phase order
    DurationEstimate estimatedDuration;

    public int phaseIndexOf(String containerId) {
        for (MigrationPhase phase : phases) {
            if (phase.getContainers().contains(containerId)) {
                return phase.getIndex();
            }
        }
        return -1;
    }
}
