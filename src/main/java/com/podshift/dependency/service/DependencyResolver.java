package com.podshift.dependency.service;

import com.podshift.dependency.exception.InvalidSnapshotException;
import com.podshift.dependency.exception.ResolutionException;
import com.podshift.dependency.model.Diagnostic;
import com.podshift.dependency.model.ResolutionResult;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.CycleReport;
import com.podshift.dependency.model.graph.MigrationPhase;
import com.podshift.dependency.model.graph.MigrationSequence;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.Snapshot;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import com.podshift.dependency.service.extractor.ExtractionResult;
import com.podshift.dependency.service.extractor.RelationshipExtractor;
import com.podshift.dependency.service.graph.CircularDependencyDetector;
import com.podshift.dependency.service.graph.DependencyGraphBuilder;
import com.podshift.dependency.service.graph.DurationEstimator;
import com.podshift.dependency.service.graph.PhaseScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Runs the full pipeline for one snapshot:
 * extractors (concurrently) -> graph builder -> cycle detector -> phase scheduler -> duration estimator.
 *
 * Synchronous from the caller's view. The result carries every non-fatal issue as a diagnostic;
 * an unusable snapshot fails with {@link InvalidSnapshotException}.
 */
@Service
@Slf4j
public class DependencyResolver {

    private final List<RelationshipExtractor> extractors;
    private final DependencyGraphBuilder graphBuilder;
    private final CircularDependencyDetector cycleDetector;
    private final PhaseScheduler phaseScheduler;
    private final DurationEstimator durationEstimator;
    private final ResolverSettings defaultSettings;
    private final Executor extractorExecutor;

    public DependencyResolver(List<RelationshipExtractor> extractors,
                              DependencyGraphBuilder graphBuilder,
                              CircularDependencyDetector cycleDetector,
                              PhaseScheduler phaseScheduler,
                              DurationEstimator durationEstimator,
                              ResolverSettings defaultSettings,
                              @Qualifier("extractorExecutor") Executor extractorExecutor) {
        this.extractors = extractors.stream()
                .sorted(Comparator.comparing(RelationshipExtractor::getCategory))
                .collect(Collectors.toList());
        this.graphBuilder = graphBuilder;
        this.cycleDetector = cycleDetector;
        this.phaseScheduler = phaseScheduler;
        this.durationEstimator = durationEstimator;
        this.defaultSettings = defaultSettings;
        this.extractorExecutor = extractorExecutor;
    }

    public ResolverSettings getDefaultSettings() {
        return defaultSettings;
    }

    public ResolutionResult resolve(Snapshot snapshot) {
        return resolve(snapshot, defaultSettings);
    }

    public ResolutionResult resolve(Snapshot snapshot, ResolverSettings settings) {
        validate(snapshot);
        SnapshotIndex index = SnapshotIndex.of(snapshot);
        log.info("[resolver] start snapshot={} containers={} composeServices={}", snapshot.getSnapshotId(),
                snapshot.getContainers().size(), index.composeServices().size());

        List<Diagnostic> diagnostics = new ArrayList<>();
        List<ExtractionResult> extracted = runExtractors(index, settings, diagnostics);
        extracted.forEach(result -> diagnostics.addAll(result.getDiagnostics()));

        DependencyGraphBuilder.BuildOutcome outcome = graphBuilder.build(index.containerIds(), extracted);
        diagnostics.addAll(outcome.getDiagnostics());

        CycleReport cycleReport = cycleDetector.detectCycles(outcome.getGraph(), settings.getMaxExploredPaths());
        if (cycleReport.isTruncated()) {
            diagnostics.add(Diagnostic.truncated("cycle-detector", "Cycle enumeration truncated after "
                    + cycleReport.getExploredPaths() + " explored paths; " + cycleReport.getCycles().size()
                    + " cycles reported, more may exist"));
        }

        List<MigrationPhase> phases = phaseScheduler.schedule(outcome.getGraph());
        MigrationSequence sequence = durationEstimator.estimate(outcome.getGraph(), phases, settings);

        List<Diagnostic> sortedDiagnostics = diagnostics.stream().sorted().collect(Collectors.toUnmodifiableList());
        log.info("[resolver] end snapshot={} edges={} cycles={} phases={} diagnostics={}", snapshot.getSnapshotId(),
                outcome.getGraph().getEdges().size(), cycleReport.getCycles().size(),
                sequence.getPhases().size(), sortedDiagnostics.size());

        return ResolutionResult.builder()
                .snapshot(snapshot)
                .settings(settings)
                .graph(outcome.getGraph())
                .cycleReport(cycleReport)
                .sequence(sequence)
                .diagnostics(sortedDiagnostics)
                .build();
    }

    private List<ExtractionResult> runExtractors(SnapshotIndex index, ResolverSettings settings,
                                                 List<Diagnostic> diagnostics) {
        List<CompletableFuture<ExtractionResult>> futures = new ArrayList<>();
        for (RelationshipExtractor extractor : extractors) {
            if (!settings.isEnabled(extractor.getCategory())) {
                log.info("[resolver] extractor {} disabled", extractor.getName());
                diagnostics.add(Diagnostic.disabled(extractor.getName(),
                        "Extractor category " + extractor.getCategory() + " disabled for this run"));
                continue;
            }
            try {
                futures.add(CompletableFuture.supplyAsync(() -> extractor.extract(index, settings), extractorExecutor));
            } catch (RejectedExecutionException e) {
                futures.forEach(future -> future.cancel(false));
                throw new ResolutionException("Extractor " + extractor.getName() + " could not be scheduled", e);
            }
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw new ResolutionException("Relationship extraction failed", e.getCause() != null ? e.getCause() : e);
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private void validate(Snapshot snapshot) {
        if (snapshot == null) {
            throw new InvalidSnapshotException("No snapshot supplied");
        }
        if (snapshot.getContainers() == null || snapshot.getContainers().isEmpty()) {
            throw new InvalidSnapshotException("Snapshot " + snapshot.getSnapshotId() + " contains no containers");
        }
        Set<String> ids = new HashSet<>();
        for (ContainerNode container : snapshot.getContainers()) {
            if (container == null || SnapshotIndex.isBlank(container.getId())) {
                continue; // reported per extractor as malformed
            }
            if (!ids.add(container.getId())) {
                throw new InvalidSnapshotException("Duplicate container id '" + container.getId() + "' in snapshot");
            }
        }
        if (ids.isEmpty()) {
            throw new InvalidSnapshotException("Snapshot " + snapshot.getSnapshotId() + " has no container with an id");
        }
    }
}
