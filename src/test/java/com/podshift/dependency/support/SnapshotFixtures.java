package com.podshift.dependency.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyGraph;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.model.snapshot.ComposeService;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.Snapshot;
import com.podshift.dependency.service.DependencyResolver;
import com.podshift.dependency.service.extractor.ComposeDependencyExtractor;
import com.podshift.dependency.service.extractor.EnvironmentReferenceExtractor;
import com.podshift.dependency.service.extractor.LegacyLinkExtractor;
import com.podshift.dependency.service.extractor.NetworkSharingExtractor;
import com.podshift.dependency.service.extractor.RelationshipExtractor;
import com.podshift.dependency.service.extractor.VolumeSharingExtractor;
import com.podshift.dependency.service.graph.CircularDependencyDetector;
import com.podshift.dependency.service.graph.DependencyGraphBuilder;
import com.podshift.dependency.service.graph.DurationEstimator;
import com.podshift.dependency.service.graph.PhaseScheduler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.Executor;

/**
 * Builders for snapshots and graphs used across the test suite.
 */
public final class SnapshotFixtures {

    public static final String PROJECT = "shop";

    private SnapshotFixtures() {
    }

    public static ContainerNode container(String id) {
        return ContainerNode.builder()
                .id(id)
                .name(id)
                .image(id + ":latest")
                .status("running")
                .build();
    }

    /** A container started by compose for the given service; id equals the service name. */
    public static ContainerNode composeContainer(String service) {
        return ContainerNode.builder()
                .id(service)
                .name(PROJECT + "-" + service + "-1")
                .image(service + ":latest")
                .status("running")
                .composeProject(PROJECT)
                .composeService(service)
                .build();
    }

    public static ComposeService service(String name, String... dependsOn) {
        return ComposeService.builder()
                .project(PROJECT)
                .service(name)
                .dependsOn(new ArrayList<>(Arrays.asList(dependsOn)))
                .build();
    }

    public static Snapshot snapshot(List<ContainerNode> containers, List<ComposeService> services) {
        return Snapshot.builder()
                .snapshotId("snap-1")
                .capturedAt("2024-01-01T12:00:00Z")
                .containers(new ArrayList<>(containers))
                .composeServices(new ArrayList<>(services))
                .build();
    }

    public static Snapshot snapshot(ContainerNode... containers) {
        return snapshot(Arrays.asList(containers), List.of());
    }

    public static DependencyEdge dependsOn(String source, String target) {
        return DependencyEdge.ordering(source, target, DependencyKind.COMPOSE_DEPENDS_ON,
                EdgeEvidence.of("test", "depends_on", target));
    }

    public static DependencyEdge edge(String source, String target, DependencyKind kind, boolean ordering) {
        EdgeEvidence evidence = EdgeEvidence.of("test", "kind", kind.getWireName());
        return ordering
                ? DependencyEdge.ordering(source, target, kind, evidence)
                : DependencyEdge.sharing(source, target, kind, evidence);
    }

    public static DependencyGraph graph(List<String> nodes, DependencyEdge... edges) {
        return new DependencyGraph(new TreeSet<>(nodes), Arrays.asList(edges));
    }

    public static List<RelationshipExtractor> allExtractors() {
        return List.of(
                new ComposeDependencyExtractor(new ObjectMapper()),
                new LegacyLinkExtractor(),
                new NetworkSharingExtractor(),
                new VolumeSharingExtractor(),
                new EnvironmentReferenceExtractor());
    }

    public static DependencyResolver resolver(List<RelationshipExtractor> extractors, ResolverSettings settings,
                                              Executor executor) {
        return new DependencyResolver(extractors, new DependencyGraphBuilder(), new CircularDependencyDetector(),
                new PhaseScheduler(), new DurationEstimator(), settings, executor);
    }
}
