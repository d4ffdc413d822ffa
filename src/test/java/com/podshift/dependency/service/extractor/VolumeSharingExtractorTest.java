package com.podshift.dependency.service.extractor;

import com.podshift.dependency.model.Diagnostic;
import com.podshift.dependency.model.ResolverSettings;
import com.podshift.dependency.model.graph.DependencyEdge;
import com.podshift.dependency.model.graph.DependencyKind;
import com.podshift.dependency.model.snapshot.ComposeService;
import com.podshift.dependency.model.snapshot.ContainerNode;
import com.podshift.dependency.model.snapshot.SnapshotIndex;
import com.podshift.dependency.model.snapshot.VolumeMount;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.podshift.dependency.support.SnapshotFixtures.PROJECT;
import static com.podshift.dependency.support.SnapshotFixtures.composeContainer;
import static com.podshift.dependency.support.SnapshotFixtures.container;
import static com.podshift.dependency.support.SnapshotFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class VolumeSharingExtractorTest {

    private final VolumeSharingExtractor extractor = new VolumeSharingExtractor();

    @Test
    void readerDependsOnSingleWriter() {
        ContainerNode db = mount(container("db"), volume("pgdata", "/var/lib/postgresql/data", false));
        ContainerNode backup = mount(container("backup"), volume("pgdata", "/backup/source", true));

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(db, backup)), ResolverSettings.defaults());

        assertThat(result.getEdges()).singleElement().satisfies(edge -> {
            assertThat(edge.getSource()).isEqualTo("backup");
            assertThat(edge.getTarget()).isEqualTo("db");
            assertThat(edge.getKind()).isEqualTo(DependencyKind.VOLUME_SHARED);
            assertThat(edge.isOrdering()).isTrue();
            assertThat(edge.getProvenance().get(0).getDetails())
                    .containsEntry("storage", "volume:pgdata")
                    .containsEntry("writer_path", "/var/lib/postgresql/data");
        });
    }

    @Test
    void twoWritersGiveOnlySharingEdges() {
        ContainerNode a = mount(container("a"), volume("shared", "/data", false));
        ContainerNode b = mount(container("b"), volume("shared", "/data", false));

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(a, b)), ResolverSettings.defaults());

        assertThat(result.getEdges())
                .extracting(DependencyEdge::getSource, DependencyEdge::getTarget, DependencyEdge::isOrdering)
                .containsExactlyInAnyOrder(tuple("a", "b", false), tuple("b", "a", false));
    }

    @Test
    void bindMountsAreGroupedByHostPath() {
        ContainerNode x = mount(container("x"), bind("/srv/config", true));
        ContainerNode y = mount(container("y"), bind("/srv/config", true));
        ContainerNode z = mount(container("z"), bind("/srv/config", false));
        ContainerNode other = mount(container("other"), bind("/srv/other", false));

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(x, y, z, other)),
                ResolverSettings.defaults());

        assertThat(result.getEdges())
                .extracting(DependencyEdge::getSource, DependencyEdge::getTarget, DependencyEdge::isOrdering)
                .containsExactlyInAnyOrder(
                        tuple("x", "z", true),
                        tuple("y", "z", true),
                        tuple("x", "y", false),
                        tuple("y", "x", false));
    }

    @Test
    void containerMountingSameVolumeTwiceCountsAsWriter() {
        ContainerNode db = mount(container("db"), volume("pgdata", "/ro-view", true), volume("pgdata", "/data", false));
        ContainerNode backup = mount(container("backup"), volume("pgdata", "/backup", true));

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(db, backup)), ResolverSettings.defaults());

        assertThat(result.getEdges())
                .extracting(DependencyEdge::getSource, DependencyEdge::getTarget)
                .containsExactly(tuple("backup", "db"));
    }

    @Test
    void volumesFromMakesConsumerDependOnProvider() {
        ComposeService app = ComposeService.builder()
                .project(PROJECT)
                .service("app")
                .volumesFrom(List.of("data:ro"))
                .build();

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(
                List.of(composeContainer("app"), composeContainer("data")), List.of(app))), ResolverSettings.defaults());

        assertThat(result.getEdges()).singleElement().satisfies(edge -> {
            assertThat(edge.getSource()).isEqualTo("app");
            assertThat(edge.getTarget()).isEqualTo("data");
            assertThat(edge.isOrdering()).isTrue();
            assertThat(edge.getProvenance().get(0).getDetails()).containsEntry("volumes_from", "data:ro");
        });
    }

    @Test
    void skipsContainerWithUnidentifiedMount() {
        ContainerNode broken = mount(container("broken"), volume("pgdata", "/x", false), volume(null, "/y", false));
        ContainerNode db = mount(container("db"), volume("pgdata", "/data", false));

        ExtractionResult result = extractor.extract(SnapshotIndex.of(snapshot(broken, db)), ResolverSettings.defaults());

        assertThat(result.getEdges()).isEmpty();
        assertThat(result.getDiagnostics())
                .extracting(Diagnostic::getCode, Diagnostic::getSubject)
                .containsExactly(tuple(Diagnostic.Code.MALFORMED_INPUT, "broken"));
    }

    private static ContainerNode mount(ContainerNode container, VolumeMount... mounts) {
        container.getMounts().addAll(List.of(mounts));
        return container;
    }

    private static VolumeMount volume(String name, String destination, boolean readOnly) {
        return VolumeMount.builder().type(VolumeMount.Type.VOLUME).name(name)
                .destination(destination).readOnly(readOnly).build();
    }

    private static VolumeMount bind(String source, boolean readOnly) {
        return VolumeMount.builder().type(VolumeMount.Type.BIND).source(source)
                .destination("/etc/app").readOnly(readOnly).build();
    }
}
