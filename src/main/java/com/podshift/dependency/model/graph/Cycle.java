package com.podshift.dependency.model.graph;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A simple cycle over ordering edges, canonicalized to start at its smallest id.
 * Consecutive members (wrapping around) are joined by an ordering edge.
 */
@Getter
@EqualsAndHashCode
public final class Cycle implements Comparable<Cycle> {

    private static final Comparator<Cycle> ORDER = Comparator
            .comparingInt((Cycle c) -> c.members.size())
            .thenComparing(c -> String.join("\u0000", c.members));

    private final List<String> members;

    private Cycle(List<String> members) {
        this.members = Collections.unmodifiableList(members);
    }

    /**
     * Build the canonical form of a cycle: rotate so the smallest id comes first.
     * [B, C, A] and [A, B, C] produce equal instances.
     */
    public static Cycle canonical(List<String> path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("A cycle needs at least one member");
        }
        String min = Collections.min(path);
        int minIdx = path.indexOf(min);
        List<String> rotated = new ArrayList<>(path.size());
        for (int i = 0; i < path.size(); i++) {
            rotated.add(path.get((minIdx + i) % path.size()));
        }
        return new Cycle(rotated);
    }

    /** e.g. "a -> b -> c -> a" */
    public String describe() {
        return String.join(" -> ", members) + " -> " + members.get(0);
    }

    @Override
    public int compareTo(Cycle other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
