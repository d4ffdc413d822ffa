package com.podshift.dependency.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-container view of the graph: what it waits for, what waits for it, and
 * which containers it is related to by each signal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "name", "image", "status", "depends_on", "depended_by", "compose_dependencies",
        "link_dependencies", "network_dependencies", "volume_dependencies", "environment_dependencies",
        "startup_order", "migration_priority"})
public class ContainerSummary {

    private String id;
    private String name;
    private String image;
    private String status;

    @JsonProperty("depends_on")
    private List<String> dependsOn;             // Ordering edges only

    @JsonProperty("depended_by")
    private List<String> dependedBy;

    @JsonProperty("compose_dependencies")
    private List<String> composeDependencies;

    @JsonProperty("link_dependencies")
    private List<String> linkDependencies;

    @JsonProperty("network_dependencies")
    private List<String> networkDependencies;

    @JsonProperty("volume_dependencies")
    private List<String> volumeDependencies;

    @JsonProperty("environment_dependencies")
    private List<String> environmentDependencies;

    @JsonProperty("startup_order")
    private int startupOrder;                   // 1-based phase number

    @JsonProperty("migration_priority")
    private String migrationPriority;           // normal, manual_review
}
