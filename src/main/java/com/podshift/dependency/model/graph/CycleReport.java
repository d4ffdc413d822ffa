package com.podshift.dependency.model.graph;

import lombok.Value;

import java.util.List;

@Value
public class CycleReport {
    List<Cycle> cycles;             // Sorted, canonical, unique
    boolean truncated;              // Exploration cap reached before the search finished
    long exploredPaths;
}
