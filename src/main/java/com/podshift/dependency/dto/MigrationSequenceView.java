package com.podshift.dependency.dto;

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
@JsonPropertyOrder({"phases", "parallel_groups", "sequential_order", "total_phases", "estimated_duration"})
public class MigrationSequenceView {

    private List<PhaseView> phases;

    @JsonProperty("parallel_groups")
    private List<ParallelGroupView> parallelGroups;

    @JsonProperty("sequential_order")
    private List<String> sequentialOrder;

    @JsonProperty("total_phases")
    private int totalPhases;

    @JsonProperty("estimated_duration")
    private DurationView estimatedDuration;
}
