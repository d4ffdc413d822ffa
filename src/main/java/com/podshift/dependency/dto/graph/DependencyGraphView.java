package com.podshift.dependency.dto.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"nodes", "edges", "cycles", "startup_order", "cycle_enumeration_truncated"})
public class DependencyGraphView {

    private List<String> nodes;
    private List<GraphEdge> edges;
    private List<List<String>> cycles;      // Canonical, each starting at its smallest id

    @JsonProperty("startup_order")
    private List<String> startupOrder;

    @JsonProperty("cycle_enumeration_truncated")
    private boolean cycleEnumerationTruncated;
}
