package com.podshift.dependency.dto.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An edge of the dependency graph as exposed to report renderers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"from", "to", "type", "ordering", "evidence"})
public class GraphEdge {

    private String from;            // Dependent container id
    private String to;              // Dependency container id
    private String type;            // compose_depends_on, legacy_link, network_shared, volume_shared, env_reference
    private boolean ordering;       // Constrains migration order

    @JsonProperty("evidence")
    private List<String> evidence;  // Provenance, one entry per signal
}
