package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.ExtractorCategory;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.model.snapshot.ComposeService;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Co-location on user-defined networks. Emits sharing edges in both directions between
 * every pair of members; these never constrain migration order.
 *
 * Members come from the networks a container is attached to at runtime and from the
 * networks its compose service declares. Compose networks are scoped to their project.
 */
@Component
@Slf4j
public class NetworkSharingExtractor extends AbstractRelationshipExtractor {

    @Override
    public ExtractorCategory getCategory() {
        return ExtractorCategory.NETWORK;
    }

    @Override
    public String getName() {
        return "network";
    }

    @Override
    public ExtractionResult extract(SnapshotIndex index, ResolverSettings settings) {
        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder().extractor(getName());
        Set<String> ignored = settings.getIgnoredNetworks() == null ? Set.of() : settings.getIgnoredNetworks();
        Map<String, SortedSet<String>> members = new TreeMap<>();
        // project -> declared network -> container ids
        Map<String, Map<String, SortedSet<String>>> composeMembers = new TreeMap<>();

        forEachContainer(index, result, (container, sink) -> {
            if (container.getNetworks() == null) {
                return;
            }
            List<String> joined = joinedNetworks(container.getNetworks().keySet(), ignored,
                    "Container joins a network without a name");
            // only reached when every entry of this container was readable
            joined.forEach(network -> members.computeIfAbsent(network, k -> new TreeSet<>()).add(container.getId()));
        });

        int position = 0;
        for (ComposeService service : index.composeServices()) {
            String subject = service == null || SnapshotIndex.isBlank(service.getService())
                    ? "compose-service#" + position
                    : SnapshotIndex.serviceKey(service.getProject(), service.getService());
            position++;
            scanNode(service, subject, (svc, sink) -> {
                if (SnapshotIndex.isBlank(svc.getService())) {
                    throw new MalformedNodeException("Compose service has no name");
                }
                if (svc.getNetworks() == null) {
                    return;
                }
                List<String> declared = joinedNetworks(svc.getNetworks(), ignored,
                        "Compose service declares a network without a name");
                SortedSet<String> ids = index.resolveComposeService(svc.getProject(), svc.getService());
                String project = svc.getProject() == null ? "" : svc.getProject();
                declared.forEach(network -> composeMembers
                        .computeIfAbsent(project, k -> new TreeMap<>())
                        .computeIfAbsent(network, k -> new TreeSet<>())
                        .addAll(ids));
            }, result);
        }

        members.forEach((network, ids) ->
                connect(ids, EdgeEvidence.of(getName(), "network", network), result));
        composeMembers.forEach((project, networks) -> networks.forEach((network, ids) ->
                connect(ids, EdgeEvidence.of(getName(), Map.of("compose_project", project, "network", network)),
                        result)));

        ExtractionResult extracted = result.build();
        log.info("[network] networks={} composeProjects={} edges={} diagnostics={}", members.size(),
                composeMembers.size(), extracted.getEdges().size(), extracted.getDiagnostics().size());
        return extracted;
    }

    private static List<String> joinedNetworks(Iterable<String> networks, Set<String> ignored, String blankMessage) {
        List<String> joined = new ArrayList<>();
        for (String network : networks) {
            if (SnapshotIndex.isBlank(network)) {
                throw new MalformedNodeException(blankMessage);
            }
            if (!ignored.contains(network)) {
                joined.add(network);
            }
        }
        return joined;
    }

    private static void connect(SortedSet<String> ids, EdgeEvidence evidence,
                                ExtractionResult.ExtractionResultBuilder result) {
        if (ids.size() < 2) {
            return;
        }
        for (String a : ids) {
            for (String b : ids) {
                if (!a.equals(b)) {
                    result.edge(DependencyEdge.sharing(a, b, DependencyKind.NETWORK_SHARED, evidence));
                }
            }
        }
    }
}
