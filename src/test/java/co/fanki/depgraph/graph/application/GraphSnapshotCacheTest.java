package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.graph.domain.DependencyGraph;
import co.fanki.depgraph.graph.domain.FileDependencyGraph;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphSnapshotCache}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphSnapshotCacheTest {

    @Test
    void whenReading_givenNothingPublished_shouldBeEmpty() {
        assertTrue(new GraphSnapshotCache().latest().isEmpty());
    }

    @Test
    void whenPublishing_givenTwoSnapshots_shouldKeepTheNewest() {
        final GraphSnapshotCache cache = new GraphSnapshotCache();
        cache.publish(snapshot("first"));
        cache.publish(snapshot("second"));

        assertEquals("second", cache.latest().orElseThrow().signature());
    }

    @Test
    void whenPublishing_givenNull_shouldReject() {
        assertThrows(IllegalArgumentException.class,
                () -> new GraphSnapshotCache().publish(null));
    }

    private static GraphSnapshot snapshot(final String signature) {
        final GraphAnalysis analysis = new GraphAnalysis(
                FileDependencyGraph.create(DependencyGraph.empty(), null,
                        path -> false),
                Map.of(), List.of(), List.of(), "working tree", "/repo");
        return new GraphSnapshot(analysis, signature, Instant.now());
    }

}
