package com.podshift.dependency.model;

/**
 * Relationship categories that can be switched on or off per run,
 * e.g. COMPOSE is pointless when no compose files were found.
 */
public enum ExtractorCategory {
    COMPOSE,
    LINKS,
    NETWORK,
    VOLUME,
    ENVIRONMENT
}
