package co.fanki.depgraph.graph.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link CycleAnalyzer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class CycleAnalyzerTest {

    @Test
    void whenAnalyzing_givenTriangleAndLoneNode_shouldReportOneCycle() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/a", List.of("/b"),
                "/b", List.of("/c"),
                "/c", List.of("/a"),
                "/d", List.of()));

        final CycleAnalysis analysis = CycleAnalyzer.analyze(graph);

        assertEquals(1, analysis.cycles().size());
        assertEquals(List.of("/a", "/b", "/c"),
                analysis.cycles().get(0).path());
        assertTrue(analysis.isInCycle(new FileEdge("/a", "/b")));
        assertTrue(analysis.isInCycle(new FileEdge("/b", "/c")));
        assertTrue(analysis.isInCycle(new FileEdge("/c", "/a")));
        assertTrue(analysis.isInCycle("/a"));
        assertFalse(analysis.isInCycle("/d"));
    }

    @Test
    void whenAnalyzing_givenAcyclicChain_shouldReportNothing() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/a", List.of("/b"),
                "/b", List.of("/c"),
                "/c", List.of()));

        final CycleAnalysis analysis = CycleAnalyzer.analyze(graph);

        assertFalse(analysis.hasCycles());
        assertFalse(analysis.edgeCycleFlags().containsValue(true));
        assertFalse(analysis.nodeCycleFlags().containsValue(true));
        assertEquals(2, analysis.edgeCycleFlags().size());
        assertEquals(3, analysis.nodeCycleFlags().size());
    }

    @Test
    void whenAnalyzing_givenSelfImport_shouldReportSingleNodeCycle() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/a", List.of("/a"),
                "/b", List.of("/a")));

        final CycleAnalysis analysis = CycleAnalyzer.analyze(graph);

        assertEquals(1, analysis.cycles().size());
        assertEquals(List.of("/a"), analysis.cycles().get(0).path());
        assertTrue(analysis.isInCycle(new FileEdge("/a", "/a")));
        assertFalse(analysis.isInCycle(new FileEdge("/b", "/a")));
        assertFalse(analysis.isInCycle("/b"));
    }

    @Test
    void whenAnalyzing_givenTwoCycles_shouldOrderBySmallestMember() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/y", List.of("/x"),
                "/x", List.of("/y"),
                "/b", List.of("/a"),
                "/a", List.of("/b"),
                "/c", List.of("/a")));

        final CycleAnalysis analysis = CycleAnalyzer.analyze(graph);

        assertEquals(2, analysis.cycles().size());
        assertEquals(List.of("/a", "/b"), analysis.cycles().get(0).path());
        assertEquals(List.of("/x", "/y"), analysis.cycles().get(1).path());
        assertFalse(analysis.isInCycle(new FileEdge("/c", "/a")));
    }

    @Test
    void whenAnalyzing_givenBranchingCycle_shouldFollowSortedDiscovery() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/a", List.of("/c", "/b"),
                "/b", List.of("/a"),
                "/c", List.of("/b")));

        final CycleAnalysis analysis = CycleAnalyzer.analyze(graph);

        assertEquals(List.of("/a", "/b", "/c"),
                analysis.cycles().get(0).path());
    }

    @Test
    void whenAnalyzing_givenEdgeBetweenCycles_shouldNotFlagIt() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/a", List.of("/b"),
                "/b", List.of("/a", "/x"),
                "/x", List.of("/y"),
                "/y", List.of("/x")));

        final CycleAnalysis analysis = CycleAnalyzer.analyze(graph);

        assertEquals(2, analysis.cycles().size());
        assertFalse(analysis.isInCycle(new FileEdge("/b", "/x")));
        assertTrue(analysis.isInCycle(new FileEdge("/x", "/y")));
    }

    @Test
    void whenAnalyzing_givenVeryLongCycle_shouldNotOverflowTheStack() {
        final int size = 20_000;
        final DependencyGraph.Builder builder = DependencyGraph.builder();
        for (int i = 0; i < size; i++) {
            builder.addNode(node(i), List.of(node((i + 1) % size)));
        }

        final CycleAnalysis analysis = CycleAnalyzer.analyze(builder.build());

        assertEquals(1, analysis.cycles().size());
        assertEquals(size, analysis.cycles().get(0).size());
        assertEquals(node(0), analysis.cycles().get(0).start());
    }

    @Test
    void whenComputingComponents_givenMixedGraph_shouldPartitionAllNodes() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/a", List.of("/b"),
                "/b", List.of("/a", "/c"),
                "/c", List.of(),
                "/d", List.of("/d")));

        final List<Set<String>> components =
                CycleAnalyzer.stronglyConnectedComponents(graph);

        assertEquals(3, components.size());
        assertTrue(components.contains(Set.of("/a", "/b")));
        assertTrue(components.contains(Set.of("/c")));
        assertTrue(components.contains(Set.of("/d")));
    }

    @Test
    void whenAnalyzingTwice_givenSameGraph_shouldReturnEqualResults() {
        final DependencyGraph graph = DependencyGraph.of(Map.of(
                "/q", List.of("/p"),
                "/p", List.of("/r"),
                "/r", List.of("/q")));

        assertEquals(CycleAnalyzer.analyze(graph),
                CycleAnalyzer.analyze(graph));
    }

    private static String node(final int i) {
        return String.format("/src/f%05d.js", i);
    }

}
