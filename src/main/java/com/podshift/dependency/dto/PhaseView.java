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
@JsonPropertyOrder({"name", "level", "containers", "parallel", "manual_review", "description", "estimated_minutes"})
public class PhaseView {

    private String name;
    private int level;
    private List<String> containers;
    private boolean parallel;

    @JsonProperty("manual_review")
    private boolean manualReview;

    private String description;

    @JsonProperty("estimated_minutes")
    private double estimatedMinutes;
}
