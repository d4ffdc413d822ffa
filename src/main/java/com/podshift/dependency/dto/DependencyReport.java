package com.podshift.dependency.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.podshift.dependency.dto.graph.DependencyGraphView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Serializable result of one resolution run, consumed by report renderers.
 * The top-level grouping (containers, dependency_graph, migration_sequence) is the
 * compatibility contract with those renderers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"metadata", "containers", "dependency_graph", "migration_sequence", "diagnostics"})
public class DependencyReport {

    private Metadata metadata;

    private Map<String, ContainerSummary> containers;   // Keyed by container id, sorted

    @JsonProperty("dependency_graph")
    private DependencyGraphView dependencyGraph;

    @JsonProperty("migration_sequence")
    private MigrationSequenceView migrationSequence;

    private List<DiagnosticView> diagnostics;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"snapshot_id", "captured_at", "generator_version", "settings"})
    public static class Metadata {

        @JsonProperty("snapshot_id")
        private String snapshotId;

        @JsonProperty("captured_at")
        private String capturedAt;

        @JsonProperty("generator_version")
        private String generatorVersion;

        private Map<String, Object> settings;
    }
}
