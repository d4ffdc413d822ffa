package com.podshift.dependency.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Relationship categories an edge can carry. The wire name is what the report shows as the edge type.
 */
public enum DependencyKind {
    COMPOSE_DEPENDS_ON("compose_depends_on"),
    LEGACY_LINK("legacy_link"),
    NETWORK_SHARED("network_shared"),
    VOLUME_SHARED("volume_shared"),
    ENV_REFERENCE("env_reference");

    private final String wireName;

    DependencyKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Whether containers in this relationship carry a higher integration risk
     * and get the complexity multiplier in duration estimates.
     */
    public boolean isIntegrationRisk() {
        return this == VOLUME_SHARED || this == ENV_REFERENCE;
    }
}
