package com.podshift.dependency.service.report;

import com.podshift.dependency.dto.ContainerSummary;
import com.podshift.dependency.dto.DependencyReport;
import com.podshift.dependency.dto.DiagnosticView;
import com.podshift.dependency.dto.DurationView;
import com.podshift.dependency.dto.MigrationSequenceView;
import com.podshift.dependency.dto.ParallelGroupView;
import com.podshift.dependency.dto.PhaseView;
import com.podshift.dependency.dto.graph.DependencyGraphView;
import com.podshift.dependency.dto.graph.GraphEdge;
import com.podshift.dependency.model.Diagnostic;
import com.podshift.dependency.model.ResolutionResult;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyGraph;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.graph.DurationEstimate;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.model.graph.MigrationPhase;
import com.podshift.dependency.model.graph.MigrationSequence;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Converts a {@link ResolutionResult} into the plain report structure handed to renderers.
 * Every list and map is emitted in a fixed order so equal results serialize identically.
 */
@Service
@Slf4j
public class DependencyReportAssembler {

    static final String GENERATOR_VERSION = "1.0.0";

    public DependencyReport assemble(ResolutionResult result) {
        DependencyGraph graph = result.getGraph();
        MigrationSequence sequence = result.getSequence();

        DependencyReport report = DependencyReport.builder()
                .metadata(buildMetadata(result))
                .containers(buildContainers(result))
                .dependencyGraph(DependencyGraphView.builder()
                        .nodes(List.copyOf(graph.getNodes()))
                        .edges(graph.getEdges().stream().map(this::toGraphEdge).collect(Collectors.toList()))
                        .cycles(result.getCycleReport().getCycles().stream()
                                .map(cycle -> List.copyOf(cycle.getMembers()))
                                .collect(Collectors.toList()))
                        .startupOrder(sequence.getStartupOrder())
                        .cycleEnumerationTruncated(result.getCycleReport().isTruncated())
                        .build())
                .migrationSequence(buildSequence(sequence))
                .diagnostics(result.getDiagnostics().stream().map(this::toDiagnosticView).collect(Collectors.toList()))
                .build();

        log.debug("Assembled report for snapshot {} with {} containers", result.getSnapshot().getSnapshotId(),
                report.getContainers().size());
        return report;
    }

    private DependencyReport.Metadata buildMetadata(ResolutionResult result) {
        ResolverSettings settings = result.getSettings();
        Map<String, Object> effective = new TreeMap<>();
        effective.put("minutes_per_container", settings.getMinutesPerContainer());
        effective.put("complexity_multiplier", settings.getComplexityMultiplier());
        effective.put("max_explored_paths", settings.getMaxExploredPaths());
        effective.put("enabled_extractors", settings.getEnabledExtractors().stream()
                .map(Enum::name).sorted().collect(Collectors.toList()));
        effective.put("ignored_networks", new TreeSet<>(settings.getIgnoredNetworks()));

        return DependencyReport.Metadata.builder()
                .snapshotId(result.getSnapshot().getSnapshotId())
                .capturedAt(result.getSnapshot().getCapturedAt())
                .generatorVersion(GENERATOR_VERSION)
                .settings(effective)
                .build();
    }

    private Map<String, ContainerSummary> buildContainers(ResolutionResult result) {
        DependencyGraph graph = result.getGraph();
        MigrationSequence sequence = result.getSequence();
        SnapshotIndex index = SnapshotIndex.of(result.getSnapshot());

        Map<String, ContainerSummary> containers = new TreeMap<>();
        for (String id : graph.getNodes()) {
            ContainerNode node = index.container(id).orElseThrow();
            List<DependencyEdge> outgoing = graph.edgesFrom(id);
            int phaseIndex = sequence.phaseIndexOf(id);
            boolean manualReview = phaseIndex >= 0 && sequence.getPhases().get(phaseIndex).isManualReview();

            containers.put(id, ContainerSummary.builder()
                    .id(id)
                    .name(node.getName())
                    .image(node.getImage())
                    .status(node.getStatus())
                    .dependsOn(targets(outgoing, DependencyEdge::isOrdering))
                    .dependedBy(sources(graph.edgesTo(id), DependencyEdge::isOrdering))
                    .composeDependencies(targets(outgoing, ofKind(DependencyKind.COMPOSE_DEPENDS_ON)))
                    .linkDependencies(targets(outgoing, ofKind(DependencyKind.LEGACY_LINK)))
                    .networkDependencies(targets(outgoing, ofKind(DependencyKind.NETWORK_SHARED)))
                    .volumeDependencies(targets(outgoing, ofKind(DependencyKind.VOLUME_SHARED)))
                    .environmentDependencies(targets(outgoing, ofKind(DependencyKind.ENV_REFERENCE)))
                    .startupOrder(phaseIndex + 1)
                    .migrationPriority(manualReview ? "manual_review" : "normal")
                    .build());
        }
        return containers;
    }

    private MigrationSequenceView buildSequence(MigrationSequence sequence) {
        List<PhaseView> phases = sequence.getPhases().stream()
                .map(phase -> PhaseView.builder()
                        .name(phase.getName())
                        .level(phase.getLevel())
                        .containers(phase.getContainers())
                        .parallel(phase.isParallel())
                        .manualReview(phase.isManualReview())
                        .description(phase.getDescription())
                        .estimatedMinutes(phase.getEstimatedMinutes())
                        .build())
                .collect(Collectors.toList());

        DurationEstimate duration = sequence.getEstimatedDuration();
        return MigrationSequenceView.builder()
                .phases(phases)
                .parallelGroups(buildParallelGroups(sequence.getPhases()))
                .sequentialOrder(sequence.getStartupOrder())
                .totalPhases(phases.size())
                .estimatedDuration(DurationView.builder()
                        .totalContainers(duration.getTotalContainers())
                        .estimatedSequentialMinutes(duration.getSequentialMinutes())
                        .estimatedParallelMinutes(duration.getParallelMinutes())
                        .estimatedSequentialHours(duration.getSequentialHours())
                        .estimatedParallelHours(duration.getParallelHours())
                        .timeSavingsPercent(duration.getTimeSavingsPercent())
                        .build())
                .build();
    }

    /**
     * One group per dependency level that holds more than one container; the phases in it
     * share no ordering edge.
     */
    private List<ParallelGroupView> buildParallelGroups(List<MigrationPhase> phases) {
        Map<Integer, List<MigrationPhase>> byLevel = new LinkedHashMap<>();
        for (MigrationPhase phase : phases) {
            byLevel.computeIfAbsent(phase.getLevel(), k -> new ArrayList<>()).add(phase);
        }
        List<ParallelGroupView> groups = new ArrayList<>();
        byLevel.forEach((level, levelPhases) -> {
            List<String> containers = levelPhases.stream()
                    .flatMap(p -> p.getContainers().stream())
                    .collect(Collectors.toList());
            if (containers.size() < 2) {
                return;
            }
            groups.add(ParallelGroupView.builder()
                    .level(level)
                    .phases(levelPhases.stream().map(MigrationPhase::getName).collect(Collectors.toList()))
                    .containers(containers)
                    .reason(levelPhases.size() > 1
                            ? "No interdependencies between these phases; cyclic clusters inside stay sequential"
                            : "No interdependencies within group")
                    .build());
        });
        return groups;
    }

    private GraphEdge toGraphEdge(DependencyEdge edge) {
        return GraphEdge.builder()
                .from(edge.getSource())
                .to(edge.getTarget())
                .type(edge.getKind().getWireName())
                .ordering(edge.isOrdering())
                .evidence(edge.getProvenance().stream().map(EdgeEvidence::describe).collect(Collectors.toList()))
                .build();
    }

    private DiagnosticView toDiagnosticView(Diagnostic diagnostic) {
        return DiagnosticView.builder()
                .severity(diagnostic.getSeverity().name())
                .code(diagnostic.getCode().name())
                .source(diagnostic.getSource())
                .subject(diagnostic.getSubject())
                .message(diagnostic.getMessage())
                .build();
    }

    private static Predicate<DependencyEdge> ofKind(DependencyKind kind) {
        return edge -> edge.getKind() == kind;
    }

    private static List<String> targets(Collection<DependencyEdge> edges, Predicate<DependencyEdge> filter) {
        SortedSet<String> ids = edges.stream().filter(filter).map(DependencyEdge::getTarget)
                .collect(Collectors.toCollection(TreeSet::new));
        return List.copyOf(ids);
    }

    private static List<String> sources(Collection<DependencyEdge> edges, Predicate<DependencyEdge> filter) {
        SortedSet<String> ids = edges.stream().filter(filter).map(DependencyEdge::getSource)
                .collect(Collectors.toCollection(TreeSet::new));
        return List.copyOf(ids);
    }
}
