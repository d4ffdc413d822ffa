package com.podshift.dependency.model.graph;

import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Provenance of an edge: which extractor emitted it and the signal it saw.
 */
@Value
public class EdgeEvidence implements Comparable<EdgeEvidence> {

    String extractor;
    SortedMap<String, String> details;

    public static EdgeEvidence of(String extractor, Map<String, String> details) {
        return new EdgeEvidence(extractor, Collections.unmodifiableSortedMap(new TreeMap<>(details)));
    }

    public static EdgeEvidence of(String extractor, String key, String value) {
        return of(extractor, Map.of(key, value == null ? "" : value));
    }

    public String describe() {
        return details.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", extractor + "(", ")"));
    }

    @Override
    public int compareTo(EdgeEvidence other) {
        return describe().compareTo(other.describe());
    }
}
