package com.podshift.dependency.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single container as captured by the inventory collector.
 * Treated as read-only for the duration of one resolution run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContainerNode {

    private String id;              // Stable runtime id (short id is fine)
    private String name;
    private String image;
    private String status;          // running, exited, created, ...

    @Builder.Default
    private Map<String, String> environment = new LinkedHashMap<>();

    @Builder.Default
    private List<VolumeMount> mounts = new ArrayList<>();

    // network name -> alias this container answers to on that network
    @Builder.Default
    private Map<String, String> networks = new LinkedHashMap<>();

    // Legacy --link declarations, e.g. "/db:/web/db" or "db:database"
    @Builder.Default
    private List<String> links = new ArrayList<>();

    @Builder.Default
    private Map<String, String> labels = new LinkedHashMap<>();

    private String composeProject;
    private String composeService;
}
