package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Closed, immutable directed graph of files.
 *
 * <p>Maps every file path to the ordered list of files it depends on.
 * Every path appearing in a dependency list is itself a node; a file
 * without resolvable dependencies is present with an empty list, never
 * absent. Self-references are kept and represent a one-node cycle.</p>
 *
 * <p>Instances are never modified after construction. Queries that need
 * a different scope produce a new graph through
 * {@link #inducedSubgraph(Set)}.</p>
 *
 * <p>Equality compares the node set and, per node, the <em>set</em> of
 * dependencies; the order of a dependency list is preserved for
 * presentation but does not take part in equality.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY =
            new DependencyGraph(new LinkedHashMap<>());

    /** Node to dependency targets, in construction order. */
    private final Map<String, List<String>> adjacency;

    private DependencyGraph(final Map<String, List<String>> theAdjacency) {
        this.adjacency = theAdjacency;
    }

    /**
     * Returns the graph without nodes.
     *
     * @return the empty graph
     */
    public static DependencyGraph empty() {
        return EMPTY;
    }

    /**
     * Creates a graph from an adjacency map.
     *
     * <p>Dependency lists are copied and de-duplicated preserving first
     * occurrence. The closure invariant is validated.</p>
     *
     * @param adjacency node to dependency targets
     * @return the new graph
     * @throws GraphClosureException if a target is not a key
     */
    public static DependencyGraph of(
            final Map<String, ? extends Collection<String>> adjacency) {
        Preconditions.requireNonNull(adjacency, "Adjacency map is required");

        final Builder builder = builder();
        for (final Map.Entry<String, ? extends Collection<String>> entry
                : adjacency.entrySet()) {
            builder.addNode(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    /**
     * Creates a new graph builder.
     *
     * @return an empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks if the graph contains a given file.
     *
     * @param path the file path
     * @return true if the path is a node of this graph
     */
    public boolean containsNode(final String path) {
        return path != null && adjacency.containsKey(path);
    }

    /**
     * Returns the outgoing dependencies of a file.
     *
     * @param path the file path
     * @return unmodifiable dependency list, empty if the node is unknown
     */
    public List<String> dependencies(final String path) {
        if (path == null) {
            return List.of();
        }
        return adjacency.getOrDefault(path, List.of());
    }

    /**
     * Returns all nodes in construction order.
     *
     * @return unmodifiable set of node paths
     */
    public Set<String> nodes() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    /**
     * Returns all nodes sorted by path.
     *
     * @return unmodifiable sorted list of node paths
     */
    public List<String> sortedNodes() {
        return List.copyOf(new TreeSet<>(adjacency.keySet()));
    }

    /**
     * Returns a read-only adjacency view with nodes sorted by path.
     *
     * <p>Dependency lists keep their construction order. Consumers that
     * iterate the result get a stable order without depending on the
     * internal representation.</p>
     *
     * @return unmodifiable sorted adjacency map
     */
    public Map<String, List<String>> adjacencyList() {
        return Collections.unmodifiableMap(new TreeMap<>(adjacency));
    }

    /**
     * Returns every edge, sources sorted by path, targets in dependency
     * order.
     *
     * @return unmodifiable list of edges
     */
    public List<FileEdge> edges() {
        final List<FileEdge> edges = new ArrayList<>();
        for (final String from : sortedNodes()) {
            for (final String to : adjacency.get(from)) {
                edges.add(new FileEdge(from, to));
            }
        }
        return Collections.unmodifiableList(edges);
    }

    /**
     * Returns the reverse adjacency: for every node, who depends on it.
     *
     * @return unmodifiable map from node to its dependents
     */
    public Map<String, List<String>> dependents() {
        final Map<String, List<String>> reverse = new LinkedHashMap<>();
        for (final String node : adjacency.keySet()) {
            reverse.put(node, new ArrayList<>());
        }
        for (final Map.Entry<String, List<String>> entry
                : adjacency.entrySet()) {
            for (final String target : entry.getValue()) {
                reverse.get(target).add(entry.getKey());
            }
        }
        final Map<String, List<String>> result = new LinkedHashMap<>();
        for (final Map.Entry<String, List<String>> entry
                : reverse.entrySet()) {
            result.put(entry.getKey(),
                    Collections.unmodifiableList(entry.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Builds the subgraph induced by a node subset.
     *
     * <p>Only edges whose both endpoints are in the subset are kept.
     * Paths in the subset that are not nodes of this graph are added as
     * isolated nodes.</p>
     *
     * @param keep the nodes to keep
     * @return a new graph, this graph is not modified
     */
    public DependencyGraph inducedSubgraph(final Set<String> keep) {
        Preconditions.requireNoNulls(keep, "Node subset is required");

        final Builder builder = builder();
        for (final String node : adjacency.keySet()) {
            if (!keep.contains(node)) {
                continue;
            }
            final List<String> kept = new ArrayList<>();
            for (final String target : adjacency.get(node)) {
                if (keep.contains(target)) {
                    kept.add(target);
                }
            }
            builder.addNode(node, kept);
        }
        for (final String node : new TreeSet<>(keep)) {
            if (!adjacency.containsKey(node)) {
                builder.addNode(node);
            }
        }
        return builder.build();
    }

    /**
     * Returns the number of nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return adjacency.size();
    }

    /**
     * Returns the number of edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        int count = 0;
        for (final List<String> targets : adjacency.values()) {
            count += targets.size();
        }
        return count;
    }

    /**
     * Checks if the graph has no nodes.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return adjacency.isEmpty();
    }

    private Map<String, Set<String>> asSets() {
        final Map<String, Set<String>> sets = new HashMap<>();
        for (final Map.Entry<String, List<String>> entry
                : adjacency.entrySet()) {
            sets.put(entry.getKey(), new LinkedHashSet<>(entry.getValue()));
        }
        return sets;
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DependencyGraph)) {
            return false;
        }
        return asSets().equals(((DependencyGraph) other).asSets());
    }

    @Override
    public int hashCode() {
        return asSets().hashCode();
    }

    @Override
    public String toString() {
        return "DependencyGraph" + adjacencyList();
    }

    /**
     * Accumulates nodes and validates the closure invariant on
     * {@link #build()}.
     *
     * <p>Not thread-safe; one builder belongs to one build.</p>
     */
    public static final class Builder {

        private final Map<String, LinkedHashSet<String>> nodes =
                new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds a node without dependencies, keeping any existing list.
         *
         * @param path the file path
         * @return this builder
         */
        public Builder addNode(final String path) {
            Preconditions.requireNonBlank(path, "Node path is required");
            nodes.computeIfAbsent(path, k -> new LinkedHashSet<>());
            return this;
        }

        /**
         * Adds a node and appends dependencies to its list.
         *
         * @param path the file path
         * @param dependencies the dependency targets, duplicates ignored
         * @return this builder
         */
        public Builder addNode(final String path,
                final Collection<String> dependencies) {
            Preconditions.requireNonBlank(path, "Node path is required");
            Preconditions.requireNoNulls(dependencies,
                    "Dependencies of " + path + " must not contain null");
            nodes.computeIfAbsent(path, k -> new LinkedHashSet<>())
                    .addAll(dependencies);
            return this;
        }

        /**
         * Builds the graph.
         *
         * @return the immutable graph
         * @throws GraphClosureException if a dependency target is not a
         *         node
         */
        public DependencyGraph build() {
            final Map<String, Set<String>> dangling = new TreeMap<>();
            for (final Map.Entry<String, LinkedHashSet<String>> entry
                    : nodes.entrySet()) {
                for (final String target : entry.getValue()) {
                    if (!nodes.containsKey(target)) {
                        dangling.computeIfAbsent(entry.getKey(),
                                k -> new TreeSet<>()).add(target);
                    }
                }
            }
            if (!dangling.isEmpty()) {
                throw new GraphClosureException(dangling);
            }

            final Map<String, List<String>> adjacency = new LinkedHashMap<>();
            for (final Map.Entry<String, LinkedHashSet<String>> entry
                    : nodes.entrySet()) {
                adjacency.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
            return new DependencyGraph(
                    Collections.unmodifiableMap(adjacency));
        }
    }

}
