package com.podshift.dependency.service.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.podshift.dependency.dto.ContainerSummary;
import com.podshift.dependency.dto.DependencyReport;
import com.podshift.dependency.dto.ParallelGroupView;
import com.podshift.dependency.dto.PhaseView;
import com.podshift.dependency.dto.graph.GraphEdge;
import com.podshift.dependency.model.ResolutionResult;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.service.DependencyResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.podshift.dependency.support.SnapshotFixtures.allExtractors;
import static com.podshift.dependency.support.SnapshotFixtures.composeContainer;
import static com.podshift.dependency.support.SnapshotFixtures.resolver;
import static com.podshift.dependency.support.SnapshotFixtures.service;
import static com.podshift.dependency.support.SnapshotFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DependencyReportAssemblerTest {

    private final DependencyReportAssembler assembler = new DependencyReportAssembler();
    private ResolutionResult result;

    @BeforeEach
    void setUp() {
        DependencyResolver resolver = resolver(allExtractors(), ResolverSettings.defaults(), Runnable::run);
        List<ContainerNode> containers = List.of(
                composeContainer("a"), composeContainer("b"), composeContainer("c"), composeContainer("d"));
        result = resolver.resolve(snapshot(containers,
                List.of(service("a", "b"), service("b", "c"), service("c", "a"), service("d"))));
    }

    @Test
    void assemble_containerSummariesCarryPhaseAndPriority() {
        DependencyReport report = assembler.assemble(result);

        assertThat(report.getContainers()).containsOnlyKeys("a", "b", "c", "d");
        ContainerSummary a = report.getContainers().get("a");
        assertThat(a.getName()).isEqualTo("shop-a-1");
        assertThat(a.getDependsOn()).containsExactly("b");
        assertThat(a.getDependedBy()).containsExactly("c");
        assertThat(a.getComposeDependencies()).containsExactly("b");
        assertThat(a.getStartupOrder()).isEqualTo(1);
        assertThat(a.getMigrationPriority()).isEqualTo("manual_review");

        ContainerSummary d = report.getContainers().get("d");
        assertThat(d.getDependsOn()).isEmpty();
        assertThat(d.getStartupOrder()).isEqualTo(2);
        assertThat(d.getMigrationPriority()).isEqualTo("normal");
    }

    @Test
    void assemble_graphSectionListsEdgesAndCycles() {
        DependencyReport report = assembler.assemble(result);

        assertThat(report.getDependencyGraph().getNodes()).containsExactly("a", "b", "c", "d");
        assertThat(report.getDependencyGraph().getEdges())
                .extracting(GraphEdge::getFrom, GraphEdge::getTo)
                .containsExactly(
                        tuple("a", "b"),
                        tuple("b", "c"),
                        tuple("c", "a"));
        assertThat(report.getDependencyGraph().getEdges().get(0).getType()).isEqualTo("compose_depends_on");
        assertThat(report.getDependencyGraph().getEdges().get(0).getEvidence())
                .singleElement().satisfies(evidence -> assertThat(evidence).startsWith("compose("));
        assertThat(report.getDependencyGraph().getCycles()).containsExactly(List.of("a", "b", "c"));
        assertThat(report.getDependencyGraph().getStartupOrder()).containsExactly("a", "b", "c", "d");
        assertThat(report.getDependencyGraph().isCycleEnumerationTruncated()).isFalse();
    }

    @Test
    void assemble_sequenceGroupsPhasesOfTheSameLevel() {
        DependencyReport report = assembler.assemble(result);

        assertThat(report.getMigrationSequence().getTotalPhases()).isEqualTo(2);
        assertThat(report.getMigrationSequence().getPhases())
                .extracting(PhaseView::getName, PhaseView::isParallel, PhaseView::getEstimatedMinutes)
                .containsExactly(
                        tuple("Phase 1", false, 15.0),
                        tuple("Phase 2", true, 5.0));
        assertThat(report.getMigrationSequence().getParallelGroups()).singleElement().satisfies(group -> {
            assertThat(group.getLevel()).isZero();
            assertThat(group.getPhases()).containsExactly("Phase 1", "Phase 2");
            assertThat(group.getContainers()).containsExactly("a", "b", "c", "d");
        });
        assertThat(report.getMigrationSequence().getEstimatedDuration().getEstimatedParallelMinutes()).isEqualTo(20.0);
    }

    @Test
    void assemble_serializesWithSnakeCaseGrouping() throws Exception {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(assembler.assemble(result)));

        assertThat(json.path("metadata").path("snapshot_id").asText()).isEqualTo("snap-1");
        assertThat(json.path("metadata").path("generator_version").asText())
                .isEqualTo(DependencyReportAssembler.GENERATOR_VERSION);
        assertThat(json.path("metadata").path("settings").path("minutes_per_container").asDouble()).isEqualTo(5.0);
        assertThat(json.path("dependency_graph").path("edges").get(0).path("from").asText()).isEqualTo("a");
        assertThat(json.path("dependency_graph").has("cycle_enumeration_truncated")).isTrue();
        assertThat(json.path("migration_sequence").path("sequential_order")).hasSize(4);
        assertThat(json.path("migration_sequence").path("phases").get(0).path("manual_review").asBoolean()).isTrue();
        assertThat(json.path("migration_sequence").path("estimated_duration").path("time_savings_percent").asDouble())
                .isZero();
        assertThat(json.path("containers").path("a").path("startup_order").asInt()).isEqualTo(1);
        assertThat(json.path("diagnostics").isArray()).isTrue();
    }

    @Test
    void assemble_levelWithSingleContainerHasNoParallelGroup() {
        DependencyResolver resolver = resolver(allExtractors(), ResolverSettings.defaults(), Runnable::run);
        ResolutionResult chain = resolver.resolve(snapshot(
                List.of(composeContainer("db"), composeContainer("api")),
                List.of(service("db"), service("api", "db"))));

        List<ParallelGroupView> groups = assembler.assemble(chain).getMigrationSequence().getParallelGroups();

        assertThat(groups).isEmpty();
    }
}
