package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A dependency graph enriched with cycle, test and change metadata.
 *
 * <p>This is the unit handed to every consumer that renders or publishes
 * a graph. It is derived once from a finished {@link DependencyGraph} and
 * never changes afterwards. Iteration over {@link #edges()} and
 * {@link #files()} follows path order.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FileDependencyGraph {

    private final DependencyGraph graph;

    private final List<Cycle> cycles;

    private final Map<FileEdge, EdgeMetadata> edges;

    private final Map<String, FileMetadata> files;

    private final Set<String> cycleNodes;

    private FileDependencyGraph(final DependencyGraph theGraph,
            final List<Cycle> theCycles,
            final Map<FileEdge, EdgeMetadata> theEdges,
            final Map<String, FileMetadata> theFiles,
            final Set<String> theCycleNodes) {
        graph = theGraph;
        cycles = theCycles;
        edges = theEdges;
        files = theFiles;
        cycleNodes = theCycleNodes;
    }

    /**
     * Enriches a graph.
     *
     * <p>Runs the cycle analysis once, classifies every node with the
     * given classifier and attaches the statistics found for it. Paths in
     * the statistics map that are not nodes are ignored.</p>
     *
     * @param graph the graph to enrich
     * @param stats per-file statistics, or null when none are available
     * @param classifier the test file classifier
     * @return the enriched graph
     */
    public static FileDependencyGraph create(final DependencyGraph graph,
            final Map<String, FileStats> stats,
            final TestFileClassifier classifier) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(classifier, "Classifier is required");

        final CycleAnalysis analysis = CycleAnalyzer.analyze(graph);

        final Map<FileEdge, EdgeMetadata> edges = new LinkedHashMap<>();
        for (final FileEdge edge : graph.edges()) {
            edges.put(edge, new EdgeMetadata(analysis.isInCycle(edge)));
        }

        final Map<String, FileMetadata> files = new LinkedHashMap<>();
        final Set<String> cycleNodes = new TreeSet<>();
        for (final String node : graph.sortedNodes()) {
            final FileStats fileStats = stats == null ? null : stats.get(node);
            files.put(node, new FileMetadata(classifier.isTest(node),
                    ImportResolverRegistry.extensionOf(node), fileStats));
            if (analysis.isInCycle(node)) {
                cycleNodes.add(node);
            }
        }

        return new FileDependencyGraph(graph, analysis.cycles(),
                Collections.unmodifiableMap(edges),
                Collections.unmodifiableMap(files),
                Collections.unmodifiableSet(cycleNodes));
    }

    public DependencyGraph graph() {
        return graph;
    }

    public List<Cycle> cycles() {
        return cycles;
    }

    public Map<FileEdge, EdgeMetadata> edges() {
        return edges;
    }

    public Map<String, FileMetadata> files() {
        return files;
    }

    /** Returns the nodes belonging to any cycle, sorted. */
    public Set<String> cycleNodes() {
        return cycleNodes;
    }

    /**
     * Returns the metadata of one edge.
     *
     * @param edge the edge
     * @return the metadata, or null if the edge is not in the graph
     */
    public EdgeMetadata edge(final FileEdge edge) {
        return edges.get(edge);
    }

    /**
     * Returns the metadata of one file.
     *
     * @param path the node path
     * @return the metadata, or null if the file is not in the graph
     */
    public FileMetadata file(final String path) {
        return files.get(path);
    }

    public boolean isInCycle(final String path) {
        return cycleNodes.contains(path);
    }

    /** Returns true if any node carries version control statistics. */
    public boolean hasStats() {
        for (final FileMetadata metadata : files.values()) {
            if (metadata.hasStats()) {
                return true;
            }
        }
        return false;
    }

}
