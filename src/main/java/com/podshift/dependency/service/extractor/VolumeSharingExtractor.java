package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.ExtractorCategory;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.model.snapshot.ComposeService;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import com.podshift.dependency.model.snapshot.VolumeMount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Storage shared between containers: named volumes, bind mounts of the same host path,
 * and compose volumes_from.
 *
 * When the consumers of one storage are a single read-write writer plus read-only readers,
 * each reader depends on the writer. Any other mix gives no usable direction and only
 * sharing edges are emitted.
 */
@Component
@Slf4j
public class VolumeSharingExtractor extends AbstractRelationshipExtractor {

    @Override
    public ExtractorCategory getCategory() {
        return ExtractorCategory.VOLUME;
    }

    @Override
    public String getName() {
        return "volume";
    }

    @Override
    public ExtractionResult extract(SnapshotIndex index, ResolverSettings settings) {
        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder().extractor(getName());

        // storage key -> container id -> consumer; a container mounting the same storage twice counts once
        Map<String, Map<String, Consumer>> consumers = new TreeMap<>();

        forEachContainer(index, result, (container, sink) -> {
            if (container.getMounts() == null) {
                return;
            }
            List<VolumeMount> shareable = new ArrayList<>();
            for (VolumeMount mount : container.getMounts()) {
                if (mount == null) {
                    throw new MalformedNodeException("Null mount entry");
                }
                if (mount.sharingKey() == null) {
                    throw new MalformedNodeException("Mount of " + mount.getDestination() + " names no volume or source");
                }
                shareable.add(mount);
            }
            for (VolumeMount mount : shareable) {
                consumers.computeIfAbsent(mount.sharingKey(), k -> new TreeMap<>())
                        .merge(container.getId(), new Consumer(container.getId(), mount.isReadOnly(), mount.getDestination()),
                                Consumer::widen);
            }
        });

        consumers.forEach((key, byContainer) -> emitForStorage(key, new ArrayList<>(byContainer.values()), result));

        int position = 0;
        for (ComposeService service : index.composeServices()) {
            String subject = service == null || SnapshotIndex.isBlank(service.getService())
                    ? "compose-service#" + position
                    : SnapshotIndex.serviceKey(service.getProject(), service.getService());
            position++;
            scanNode(service, subject, (svc, sink) -> scanVolumesFrom(index, svc, sink), result);
        }

        ExtractionResult extracted = result.build();
        log.info("[volume] storages={} edges={} diagnostics={}", consumers.size(),
                extracted.getEdges().size(), extracted.getDiagnostics().size());
        return extracted;
    }

    private void emitForStorage(String key, List<Consumer> consumers, ExtractionResult.ExtractionResultBuilder result) {
        if (consumers.size() < 2) {
            return;
        }
        List<Consumer> writers = new ArrayList<>();
        List<Consumer> readers = new ArrayList<>();
        for (Consumer consumer : consumers) {
            (consumer.readOnly ? readers : writers).add(consumer);
        }

        if (writers.size() == 1 && !readers.isEmpty()) {
            Consumer writer = writers.get(0);
            for (Consumer reader : readers) {
                result.edge(DependencyEdge.ordering(reader.id, writer.id, DependencyKind.VOLUME_SHARED,
                        EdgeEvidence.of(getName(), Map.of(
                                "storage", key,
                                "access", "read-only -> read-write",
                                "reader_path", nullToEmpty(reader.path),
                                "writer_path", nullToEmpty(writer.path)))));
            }
            emitSharing(key, readers, result);
            return;
        }
        emitSharing(key, consumers, result);
    }

    private void emitSharing(String key, List<Consumer> consumers, ExtractionResult.ExtractionResultBuilder result) {
        EdgeEvidence evidence = EdgeEvidence.of(getName(), Map.of("storage", key, "access", "undirected"));
        for (Consumer a : consumers) {
            for (Consumer b : consumers) {
                if (!a.id.equals(b.id)) {
                    result.edge(DependencyEdge.sharing(a.id, b.id, DependencyKind.VOLUME_SHARED, evidence));
                }
            }
        }
    }

    /**
     * volumes_from entries: "service", "service:ro", "container:name" or "container:name:ro".
     * The consumer depends on the provider of the volumes.
     */
    private void scanVolumesFrom(SnapshotIndex index, ComposeService service, List<DependencyEdge> sink) {
        if (service == null || SnapshotIndex.isBlank(service.getService())) {
            throw new MalformedNodeException("Compose service has no name");
        }
        if (service.getVolumesFrom() == null || service.getVolumesFrom().isEmpty()) {
            return;
        }
        SortedSet<String> owners = index.resolveComposeService(service.getProject(), service.getService());
        if (owners.isEmpty()) {
            owners = single(SnapshotIndex.serviceKey(service.getProject(), service.getService()));
        }
        for (String entry : service.getVolumesFrom()) {
            if (SnapshotIndex.isBlank(entry)) {
                throw new MalformedNodeException("Blank volumes_from entry");
            }
            SortedSet<String> providers = resolveProvider(index, service.getProject(), entry.trim());
            EdgeEvidence evidence = EdgeEvidence.of(getName(), Map.of("service", service.getService(), "volumes_from", entry));
            for (String owner : owners) {
                for (String provider : providers) {
                    if (!owner.equals(provider)) {
                        sink.add(DependencyEdge.ordering(owner, provider, DependencyKind.VOLUME_SHARED, evidence));
                    }
                }
            }
        }
    }

    private SortedSet<String> resolveProvider(SnapshotIndex index, String project, String entry) {
        if (entry.startsWith("container:")) {
            String name = entry.substring("container:".length()).split(":", 2)[0];
            return single(index.resolveContainer(name).orElse(name));
        }
        String providerService = entry.split(":", 2)[0];
        SortedSet<String> ids = index.resolveComposeService(project, providerService);
        return ids.isEmpty() ? single(SnapshotIndex.serviceKey(project, providerService)) : ids;
    }

    private static SortedSet<String> single(String id) {
        SortedSet<String> ids = new TreeSet<>();
        ids.add(id);
        return ids;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static final class Consumer {
        private final String id;
        private final boolean readOnly;
        private final String path;

        private Consumer(String id, boolean readOnly, String path) {
            this.id = id;
            this.readOnly = readOnly;
            this.path = path;
        }

        // Read-write wins when the same container mounts the storage twice
        private static Consumer widen(Consumer existing, Consumer other) {
            return existing.readOnly && !other.readOnly ? other : existing;
        }
    }
}
