package com.podshift.dependency.model;

import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * Effective knobs for one resolution run.
 */
@Value
@Builder(toBuilder = true)
public class ResolverSettings {

    public static final double DEFAULT_MINUTES_PER_CONTAINER = 5.0;
    public static final double DEFAULT_COMPLEXITY_MULTIPLIER = 1.5;
    public static final long DEFAULT_MAX_EXPLORED_PATHS = 100_000L;

    @Builder.Default
    double minutesPerContainer = DEFAULT_MINUTES_PER_CONTAINER;

    // Applied to containers in at least one ordering volume/env_reference edge
    @Builder.Default
    double complexityMultiplier = DEFAULT_COMPLEXITY_MULTIPLIER;

    @Builder.Default
    long maxExploredPaths = DEFAULT_MAX_EXPLORED_PATHS;

    @Builder.Default
    Set<ExtractorCategory> enabledExtractors = EnumSet.allOf(ExtractorCategory.class);

    @Builder.Default
    Set<String> ignoredNetworks = Set.of("bridge", "host", "none");

    public static ResolverSettings defaults() {
        return ResolverSettings.builder().build();
    }

    public boolean isEnabled(ExtractorCategory category) {
        return enabledExtractors != null && enabledExtractors.contains(category);
    }
}
