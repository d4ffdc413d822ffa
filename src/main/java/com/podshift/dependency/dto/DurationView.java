package com.podshift.dependency.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"total_containers", "estimated_sequential_minutes", "estimated_parallel_minutes",
        "estimated_sequential_hours", "estimated_parallel_hours", "time_savings_percent"})
public class DurationView {

    @JsonProperty("total_containers")
    private int totalContainers;

    @JsonProperty("estimated_sequential_minutes")
    private double estimatedSequentialMinutes;

    @JsonProperty("estimated_parallel_minutes")
    private double estimatedParallelMinutes;

    @JsonProperty("estimated_sequential_hours")
    private double estimatedSequentialHours;

    @JsonProperty("estimated_parallel_hours")
    private double estimatedParallelHours;

    @JsonProperty("time_savings_percent")
    private double timeSavingsPercent;
}
