package com.podshift.dependency.service.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.podshift.dependency.model.ExtractorCategory;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.model.snapshot.ComposeService;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Startup-order dependencies declared through compose.
 *
 * Two sources are read:
 * - depends_on of the parsed compose services
 * - dependency labels on the containers themselves (stack deployments, hand-made labels)
 *
 * Edges run from every container of the dependent service to every container of the
 * dependency. Unknown dependencies are emitted verbatim and dropped later as dangling.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ComposeDependencyExtractor extends AbstractRelationshipExtractor {

    static final List<String> DEPENDENCY_LABELS = List.of(
            "com.docker.compose.depends_on",
            "com.docker.stack.depends_on",
            "depends_on",
            "requires"
    );

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Override
    public ExtractorCategory getCategory() {
        return ExtractorCategory.COMPOSE;
    }

    @Override
    public String getName() {
        return "compose";
    }

    @Override
    public ExtractionResult extract(SnapshotIndex index, ResolverSettings settings) {
        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder().extractor(getName());

        int position = 0;
        for (ComposeService service : index.composeServices()) {
            String subject = service == null || SnapshotIndex.isBlank(service.getService())
                    ? "compose-service#" + position
                    : SnapshotIndex.serviceKey(service.getProject(), service.getService());
            position++;
            scanNode(service, subject, (svc, sink) -> scanService(index, svc, sink), result);
        }

        forEachContainer(index, result, (container, sink) -> scanLabels(index, container, sink));

        ExtractionResult extracted = result.build();
        log.info("[compose] edges={} diagnostics={}", extracted.getEdges().size(), extracted.getDiagnostics().size());
        return extracted;
    }

    private void scanService(SnapshotIndex index, ComposeService service, List<DependencyEdge> sink) {
        if (service == null || SnapshotIndex.isBlank(service.getService())) {
            throw new MalformedNodeException("Compose service has no name");
        }
        if (service.getDependsOn() == null) {
            return;
        }
        SortedSet<String> dependents = serviceContainers(index, service.getProject(), service.getService());
        for (String dependency : service.getDependsOn()) {
            if (SnapshotIndex.isBlank(dependency)) {
                throw new MalformedNodeException("Blank depends_on entry");
            }
            String dependencyService = dependency.trim();
            SortedSet<String> targets = serviceContainers(index, service.getProject(), dependencyService);
            EdgeEvidence evidence = EdgeEvidence.of(getName(), Map.of(
                    "project", nullToEmpty(service.getProject()),
                    "service", service.getService(),
                    "depends_on", dependencyService));
            for (String source : dependents) {
                for (String target : targets) {
                    if (!source.equals(target)) {
                        sink.add(DependencyEdge.ordering(source, target, DependencyKind.COMPOSE_DEPENDS_ON, evidence));
                    }
                }
            }
        }
    }

    private void scanLabels(SnapshotIndex index, ContainerNode container, List<DependencyEdge> sink) {
        Map<String, String> labels = container.getLabels();
        if (labels == null) {
            return;
        }
        for (String labelKey : DEPENDENCY_LABELS) {
            String raw = labels.get(labelKey);
            if (SnapshotIndex.isBlank(raw)) {
                continue;
            }
            for (String dependency : parseLabel(labelKey, raw)) {
                Set<String> targets = resolveLabelTarget(index, container, dependency);
                EdgeEvidence evidence = EdgeEvidence.of(getName(), Map.of("label", labelKey, "depends_on", dependency));
                for (String target : targets) {
                    if (!target.equals(container.getId())) {
                        sink.add(DependencyEdge.ordering(container.getId(), target,
                                DependencyKind.COMPOSE_DEPENDS_ON, evidence));
                    }
                }
            }
        }
    }

    /**
     * Label values come as a JSON array or a comma-separated list. Compose writes entries as
     * "service:condition:restart"; only the service part is kept.
     */
    List<String> parseLabel(String labelKey, String raw) {
        String value = raw.trim();
        List<String> entries;
        if (value.startsWith("[")) {
            try {
                entries = objectMapper.readValue(value, STRING_LIST);
            } catch (JsonProcessingException e) {
                throw new MalformedNodeException("Label " + labelKey + " is not a valid JSON list: " + e.getOriginalMessage());
            }
        } else {
            entries = Arrays.asList(value.split(","));
        }
        return entries.stream()
                .filter(entry -> !SnapshotIndex.isBlank(entry))
                .map(entry -> entry.trim().split(":", 2)[0])
                .filter(entry -> !entry.isEmpty())
                .distinct()
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private Set<String> resolveLabelTarget(SnapshotIndex index, ContainerNode owner, String dependency) {
        SortedSet<String> sameProject = index.resolveComposeService(owner.getComposeProject(), dependency);
        if (!sameProject.isEmpty()) {
            return sameProject;
        }
        return index.resolveContainer(dependency)
                .map(id -> (Set<String>) Set.of(id))
                .orElseGet(() -> Set.of(dependency));
    }

    private SortedSet<String> serviceContainers(SnapshotIndex index, String project, String service) {
        SortedSet<String> ids = index.resolveComposeService(project, service);
        if (!ids.isEmpty()) {
            return ids;
        }
        SortedSet<String> unresolved = new TreeSet<>();
        unresolved.add(SnapshotIndex.serviceKey(project, service));
        return unresolved;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
