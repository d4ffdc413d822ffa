package com.podshift.dependency.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A service definition from an already-parsed compose file.
 * Containers belong to a service through their composeProject/composeService fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComposeService {

    private String project;
    private String service;

    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    @Builder.Default
    private List<String> links = new ArrayList<>();      // "service" or "service:alias"

    @Builder.Default
    private List<String> volumesFrom = new ArrayList<>();

    @Builder.Default
    private List<String> networks = new ArrayList<>();
}
