package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.ExtractorCategory;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.snapshot.SnapshotIndex;

/**
 * Scans a snapshot for one relationship category and emits typed edges.
 *
 * Implementations hold no mutable state and only read the index, so the resolver
 * may run them concurrently.
 */
public interface RelationshipExtractor {

    ExtractorCategory getCategory();

    /** Name recorded as edge provenance and diagnostic source. */
    String getName();

    ExtractionResult extract(SnapshotIndex index, ResolverSettings settings);
}
