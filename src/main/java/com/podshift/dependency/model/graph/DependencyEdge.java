package com.podshift.dependency.model.graph;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Comparator;
import java.util.List;

/**
 * Directed relationship between two containers: source depends on target.
 *
 * Ordering edges constrain migration order (the target migrates first). Sharing edges
 * (network co-location, volumes without a clear writer) only record that the two
 * containers belong together.
 */
@Value
@Builder(toBuilder = true)
public class DependencyEdge implements Comparable<DependencyEdge> {

    public static final Comparator<DependencyEdge> ORDER = Comparator
            .comparing(DependencyEdge::getSource)
            .thenComparing(DependencyEdge::getTarget)
            .thenComparing(DependencyEdge::getKind)
            .thenComparing(DependencyEdge::isOrdering);

    String source;
    String target;
    DependencyKind kind;
    boolean ordering;

    @Singular("evidence")
    List<EdgeEvidence> provenance;

    public static DependencyEdge ordering(String source, String target, DependencyKind kind, EdgeEvidence evidence) {
        return DependencyEdge.builder().source(source).target(target).kind(kind).ordering(true).evidence(evidence).build();
    }

    public static DependencyEdge sharing(String source, String target, DependencyKind kind, EdgeEvidence evidence) {
        return DependencyEdge.builder().source(source).target(target).kind(kind).ordering(false).evidence(evidence).build();
    }

    /** Identity used for de-duplication; evidence and the ordering flag are merged, not compared. */
    public String key() {
        return kind.getWireName() + ":" + source + "->" + target;
    }

    @Override
    public int compareTo(DependencyEdge other) {
        return ORDER.compare(this, other);
    }
}
