package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.ExtractorCategory;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Hostnames referenced from environment variable values, e.g. DATABASE_URL=postgres://db:5432/app.
 *
 * Values are split into hostname-shaped tokens; a token must equal another container's name,
 * network alias or compose service name exactly (case-sensitive). "db" inside "db-replica" or
 * "db.internal" is not a match.
 */
@Component
@Slf4j
public class EnvironmentReferenceExtractor extends AbstractRelationshipExtractor {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^A-Za-z0-9_.\\-]+");

    @Override
    public ExtractorCategory getCategory() {
        return ExtractorCategory.ENVIRONMENT;
    }

    @Override
    public String getName() {
        return "environment";
    }

    @Override
    public ExtractionResult extract(SnapshotIndex index, ResolverSettings settings) {
        ExtractionResult.ExtractionResultBuilder result = ExtractionResult.builder().extractor(getName());

        forEachContainer(index, result, (container, sink) -> scanEnvironment(index, container, sink));

        ExtractionResult extracted = result.build();
        log.info("[environment] edges={} diagnostics={}", extracted.getEdges().size(), extracted.getDiagnostics().size());
        return extracted;
    }

    private void scanEnvironment(SnapshotIndex index, ContainerNode container, List<DependencyEdge> sink) {
        if (container.getEnvironment() == null) {
            return;
        }
        for (Map.Entry<String, String> variable : container.getEnvironment().entrySet()) {
            if (SnapshotIndex.isBlank(variable.getKey())) {
                throw new MalformedNodeException("Environment variable without a name");
            }
            if (variable.getValue() == null) {
                continue;
            }
            for (String token : TOKEN_SEPARATOR.split(variable.getValue())) {
                if (token.isEmpty()) {
                    continue;
                }
                for (String target : index.resolveHost(token)) {
                    if (target.equals(container.getId())) {
                        continue;
                    }
                    // variable values never go into evidence
                    sink.add(DependencyEdge.ordering(container.getId(), target, DependencyKind.ENV_REFERENCE,
                            EdgeEvidence.of(getName(), Map.of("variable", variable.getKey(), "host", token))));
                }
            }
        }
    }
}
