package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.Diagnostic;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import org.junit.jupiter.api.Test;

import static com.podshift.dependency.support.SnapshotFixtures.container;
import static com.podshift.dependency.support.SnapshotFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class EnvironmentReferenceExtractorTest {

    private final EnvironmentReferenceExtractor extractor = new EnvironmentReferenceExtractor();

    @Test
    void matchesHostnameTokensExactly() {
        ContainerNode api = container("api");
        api.getEnvironment().put("DATABASE_URL", "postgres://app:secret@db:5432/app");
        api.getEnvironment().put("REPLICA_HOST", "db-replica");
        api.getEnvironment().put("DNS_NAME", "db.internal");
        api.getEnvironment().put("UPPER", "DB");
        ContainerNode db = container("db");
        db.getEnvironment().put("HOSTNAME", "db");

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(api, db)), ResolverSettings.defaults());

        assertThat(result.getEdges()).singleElement().satisfies(edge -> {
            assertThat(edge.getSource()).isEqualTo("api");
            assertThat(edge.getTarget()).isEqualTo("db");
            assertThat(edge.getKind()).isEqualTo(DependencyKind.ENV_REFERENCE);
            assertThat(edge.isOrdering()).isTrue();
            assertThat(edge.getProvenance().get(0).getDetails())
                    .containsEntry("variable", "DATABASE_URL")
                    .containsEntry("host", "db")
                    .doesNotContainValue("postgres://app:secret@db:5432/app");
        });
    }

    @Test
    void resolvesNetworkAliases() {
        ContainerNode redis = container("redis-7f3a");
        redis.setName("redis");
        redis.getNetworks().put("backend", "cache");
        ContainerNode worker = container("worker");
        worker.getEnvironment().put("QUEUE_HOST", "cache");

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(redis, worker)), ResolverSettings.defaults());

        assertThat(result.getEdges())
                .extracting(DependencyEdge::getSource, DependencyEdge::getTarget)
                .containsExactly(tuple("worker", "redis-7f3a"));
    }

    @Test
    void skipsContainerWithUnnamedVariable() {
        ContainerNode broken = container("broken");
        broken.getEnvironment().put("DB", "db");
        broken.getEnvironment().put(" ", "db");

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(broken, container("db"))),
                ResolverSettings.defaults());

        assertThat(result.getEdges()).isEmpty();
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getCode, Diagnostic::getSubject)
                .containsExactly(tuple(Diagnostic.Code.MALFORMED_INPUT, "broken"));
    }
}
