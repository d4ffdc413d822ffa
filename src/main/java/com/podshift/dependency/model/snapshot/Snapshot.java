package com.podshift.dependency.model.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time capture of the runtime inventory handed to the resolver.
 * Fully populated by the collection layer before resolution starts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Snapshot {

    private String snapshotId;
    private String capturedAt;      // Opaque timestamp supplied by the collector

    @Builder.Default
    private List<ContainerNode> containers = new ArrayList<>();

    @Builder.Default
    private List<ComposeService> composeServices = new ArrayList<>();
}
