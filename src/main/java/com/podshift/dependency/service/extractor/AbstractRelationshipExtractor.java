package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.Diagnostic;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-node isolation shared by the extractors: a node that cannot be read is skipped
 * for this extractor only and reported, and edges are committed only when the whole
 * node was processed.
 */
@Slf4j
public abstract class AbstractRelationshipExtractor implements RelationshipExtractor {

    @FunctionalInterface
    protected interface NodeScanner<T> {
        void scan(T node, List<DependencyEdge> sink);
    }

    protected void forEachContainer(SnapshotIndex index, ExtractionResult.ExtractionResultBuilder result,
                                    NodeScanner<ContainerNode> scanner) {
        int position = 0;
        for (ContainerNode container : index.rawContainers()) {
            String subject = container == null ? "#" + position : describe(container, position);
            position++;
            if (container == null || SnapshotIndex.isBlank(container.getId())) {
                result.diagnostic(Diagnostic.malformed(getName(), subject, "Container has no id"));
                continue;
            }
            scanNode(container, subject, scanner, result);
        }
    }

    protected <T> void scanNode(T node, String subject, NodeScanner<T> scanner,
                                ExtractionResult.ExtractionResultBuilder result) {
        List<DependencyEdge> sink = new ArrayList<>();
        try {
            scanner.scan(node, sink);
            result.edges(sink);
        } catch (MalformedNodeException e) {
            log.debug("[{}] skipping {}: {}", getName(), subject, e.getMessage());
            result.diagnostic(Diagnostic.malformed(getName(), subject, e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("[{}] unexpected failure on {}, node skipped", getName(), subject, e);
            result.diagnostic(Diagnostic.malformed(getName(), subject,
                    "Unreadable node: " + e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    protected static String describe(ContainerNode container, int position) {
        if (!SnapshotIndex.isBlank(container.getId())) {
            return container.getId();
        }
        return SnapshotIndex.isBlank(container.getName()) ? "#" + position : container.getName();
    }

    /**
     * Thrown by a scanner when the node it is reading is malformed.
     */
    protected static class MalformedNodeException extends RuntimeException {
        MalformedNodeException(String message) {
            super(message);
        }
    }
}
