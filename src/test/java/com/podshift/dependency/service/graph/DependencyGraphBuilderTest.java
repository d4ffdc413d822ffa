package com.podshift.dependency.service.graph;

import com.podshift.dependency.model.Diagnostic;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyGraph;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.graph.EdgeEvidence;
import com.podshift.dependency.service.extractor.ExtractionResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import static com.podshift.dependency.support.SnapshotFixtures.dependsOn;
import static com.podshift.dependency.support.SnapshotFixtures.edge;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class DependencyGraphBuilderTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();
    private final SortedSet<String> nodes = new TreeSet<>(List.of("api", "db", "web"));

    @Test
    void mergesEdgesIdenticalInSourceTargetAndKind() {
        DependencyEdge viaUrl = DependencyEdge.ordering("api", "db", DependencyKind.ENV_REFERENCE,
                EdgeEvidence.of("environment", "variable", "DATABASE_URL"));
        DependencyEdge viaHost = DependencyEdge.ordering("api", "db", DependencyKind.ENV_REFERENCE,
                EdgeEvidence.of("environment", "variable", "DB_HOST"));

        DependencyGraph graph = builder.build(nodes, List.of(result("environment", viaHost, viaUrl))).getGraph();

        assertThat(graph.getEdges()).singleElement().satisfies(edge ->
                assertThat(edge.getProvenance())
                        .extracting(evidence -> evidence.getDetails().get("variable"))
                        .containsExactly("DATABASE_URL", "DB_HOST"));
    }

    @Test
    void keepsEdgesThatDifferOnlyByKind() {
        DependencyGraph graph = builder.build(nodes, List.of(
                result("compose", dependsOn("api", "db")),
                result("environment", edge("api", "db", DependencyKind.ENV_REFERENCE, true)))).getGraph();

        assertThat(graph.getEdges())
                .extracting(DependencyEdge::getKind)
                .containsExactly(DependencyKind.COMPOSE_DEPENDS_ON, DependencyKind.ENV_REFERENCE);
    }

    @Test
    void orderingWinsWhenSharingAndOrderingEdgesCollapse() {
        DependencyGraph graph = builder.build(nodes, List.of(result("volume",
                edge("web", "db", DependencyKind.VOLUME_SHARED, false),
                edge("web", "db", DependencyKind.VOLUME_SHARED, true)))).getGraph();

        assertThat(graph.getEdges()).singleElement().satisfies(edge -> assertThat(edge.isOrdering()).isTrue());
    }

    @Test
    void dropsDanglingEdgesWithDiagnostic() {
        DependencyGraphBuilder.BuildOutcome outcome = builder.build(nodes, List.of(
                result("compose", dependsOn("api", "db"), dependsOn("api", "shop/ghost"), dependsOn("removed", "db"))));

        assertThat(outcome.getGraph().getEdges())
                .extracting(DependencyEdge::getSource, DependencyEdge::getTarget)
                .containsExactly(tuple("api", "db"));
        assertThat(outcome.getDiagnostics())
                .extracting(Diagnostic::getCode, Diagnostic::getSubject)
                .containsExactlyInAnyOrder(
                        tuple(Diagnostic.Code.DANGLING_REFERENCE, "compose_depends_on:api->shop/ghost"),
                        tuple(Diagnostic.Code.DANGLING_REFERENCE, "compose_depends_on:removed->db"));
    }

    @Test
    void dropsSelfLoopsWithDiagnostic() {
        DependencyGraphBuilder.BuildOutcome outcome = builder.build(nodes, List.of(result("compose", dependsOn("db", "db"))));

        assertThat(outcome.getGraph().getEdges()).isEmpty();
        assertThat(outcome.getDiagnostics()).extracting(Diagnostic::getCode)
                .containsExactly(Diagnostic.Code.MALFORMED_INPUT);
    }

    @Test
    void resultDoesNotDependOnExtractorCompletionOrder() {
        List<ExtractionResult> results = new ArrayList<>(List.of(
                result("compose", dependsOn("web", "api"), dependsOn("api", "db")),
                result("network", edge("web", "db", DependencyKind.NETWORK_SHARED, false),
                        edge("db", "web", DependencyKind.NETWORK_SHARED, false)),
                result("environment", edge("web", "api", DependencyKind.ENV_REFERENCE, true))));

        DependencyGraph first = builder.build(nodes, results).getGraph();
        Collections.reverse(results);
        DependencyGraph second = builder.build(nodes, results).getGraph();

        assertThat(second.getEdges()).isEqualTo(first.getEdges());
        assertThat(first.getEdges()).isSorted();
    }

    @Test
    void graphRejectsEdgesToUnknownNodes() {
        assertThatThrownBy(() -> new DependencyGraph(nodes, List.of(dependsOn("api", "ghost"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");
    }

    private static ExtractionResult result(String extractor, DependencyEdge... edges) {
        return ExtractionResult.builder().extractor(extractor).edges(List.of(edges)).build();
    }
}
