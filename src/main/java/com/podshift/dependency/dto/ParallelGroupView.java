package com.podshift.dependency.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Phases that can run at the same time because no ordering edge connects them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"level", "phases", "containers", "reason"})
public class ParallelGroupView {
    private int level;
    private List<String> phases;
    private List<String> containers;
    private String reason;
}
