package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.ExtractorCategory;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.model.snapshot.ComposeService;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Legacy --link declarations, on containers and in compose "links".
 * A link makes the owner depend on the linked container, same direction as depends_on.
 */
@Component
@Slf4j
public class LegacyLinkExtractor extends AbstractRelationshipExtractor {

    @Override
    public ExtractorCategory getCategory() {
        return ExtractorCategory.LINKS;
    }

    @Override
    public String getName() {
        return "links";
    }

    @Override
    public ExtractionResult extract(SnapshotIndex index, ResolverSettings settings) {
        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder().extractor(getName());

        forEachContainer(index, result, (container, sink) -> scanContainerLinks(index, container, sink));

        int position = 0;
        for (ComposeService service : index.composeServices()) {
            String subject = service == null || SnapshotIndex.isBlank(service.getService())
                    ? "compose-service#" + position
                    : SnapshotIndex.serviceKey(service.getProject(), service.getService());
            position++;
            scanNode(service, subject, (svc, sink) -> scanComposeLinks(index, svc, sink), result);
        }

        ExtractionResult extracted = result.build();
        log.info("[links] edges={} diagnostics={}", extracted.getEdges().size(), extracted.getDiagnostics().size());
        return extracted;
    }

    private void scanContainerLinks(SnapshotIndex index, ContainerNode container, List<DependencyEdge> sink) {
        if (container.getLinks() == null) {
            return;
        }
        for (String link : container.getLinks()) {
            String linked = linkedName(link);
            String target = index.resolveContainer(linked).orElse(linked);
            if (!target.equals(container.getId())) {
                sink.add(DependencyEdge.ordering(container.getId(), target, DependencyKind.LEGACY_LINK,
                        EdgeEvidence.of(getName(), "link", link)));
            }
        }
    }

    private void scanComposeLinks(SnapshotIndex index, ComposeService service, List<DependencyEdge> sink) {
        if (service == null || SnapshotIndex.isBlank(service.getService())) {
            throw new MalformedNodeException("Compose service has no name");
        }
        if (service.getLinks() == null || service.getLinks().isEmpty()) {
            return;
        }
        SortedSet<String> owners = orUnresolved(
                index.resolveComposeService(service.getProject(), service.getService()),
                SnapshotIndex.serviceKey(service.getProject(), service.getService()));
        for (String link : service.getLinks()) {
            String linked = linkedName(link);
            SortedSet<String> targets = index.resolveComposeService(service.getProject(), linked);
            if (targets.isEmpty()) {
                targets = orUnresolved(index.resolveContainer(linked).map(this::single).orElse(new TreeSet<>()), linked);
            }
            EdgeEvidence evidence = EdgeEvidence.of(getName(), Map.of("service", service.getService(), "link", link));
            for (String owner : owners) {
                for (String target : targets) {
                    if (!owner.equals(target)) {
                        sink.add(DependencyEdge.ordering(owner, target, DependencyKind.LEGACY_LINK, evidence));
                    }
                }
            }
        }
    }

    /**
     * Accepts "/db:/web/db" (runtime form), "db:alias" and "db" (compose form).
     */
    static String linkedName(String link) {
        if (SnapshotIndex.isBlank(link)) {
            throw new MalformedNodeException("Blank link declaration");
        }
        String name = SnapshotIndex.stripSlash(link.trim().split(":", 2)[0]);
        if (name.isEmpty()) {
            throw new MalformedNodeException("Link declaration names no container: " + link);
        }
        return name;
    }

    private SortedSet<String> single(String id) {
        SortedSet<String> ids = new TreeSet<>();
        ids.add(id);
        return ids;
    }

    private SortedSet<String> orUnresolved(SortedSet<String> ids, String reference) {
        return ids.isEmpty() ? single(reference) : ids;
    }
}
