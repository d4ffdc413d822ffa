package com.podshift.dependency.model.graph;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DurationEstimate {
    int totalContainers;
    double sequentialMinutes;
    double parallelMinutes;
    double sequentialHours;         // Rounded to one decimal
    double parallelHours;           // Rounded to one decimal
    double timeSavingsPercent;      // Clamped to [0, 100], one decimal
}
