package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;

/**
 * Structural queries over an already built {@link DependencyGraph}.
 *
 * <p>Both queries are pure: they return a new graph induced by the
 * selected nodes and leave the input untouched. Parameter validation
 * that must be reported to the user (level below one, fewer than two
 * targets, unknown files) happens before calling into this class.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphQueries {

    private GraphQueries() {
    }

    /**
     * Extracts the neighborhood of a file up to a number of hops.
     *
     * <p>Edges are followed in both directions: files the target imports
     * and files that import the target. Hop zero is the target itself.
     * An edge of the original graph is kept when both endpoints were
     * visited.</p>
     *
     * @param graph the graph to query
     * @param target the file at the center of the neighborhood
     * @param level the number of hops, at least one
     * @return the induced neighborhood graph
     */
    public static DependencyGraph filterByLevel(final DependencyGraph graph,
            final String target, final int level) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonBlank(target, "Target file is required");
        Preconditions.requirePositive(level, "Level must be at least 1");

        final Map<String, List<String>> reverse = graph.dependents();

        final Set<String> visited = new LinkedHashSet<>();
        visited.add(target);

        List<String> frontier = List.of(target);
        for (int hop = 0; hop < level && !frontier.isEmpty(); hop++) {
            final List<String> next = new ArrayList<>();
            for (final String file : frontier) {
                for (final String dependency : graph.dependencies(file)) {
                    if (visited.add(dependency)) {
                        next.add(dependency);
                    }
                }
                for (final String dependent
                        : reverse.getOrDefault(file, List.of())) {
                    if (visited.add(dependent)) {
                        next.add(dependent);
                    }
                }
            }
            frontier = next;
        }

        return graph.inducedSubgraph(visited);
    }

    /**
     * Extracts every file lying on a directed path between targets.
     *
     * <p>For each ordered pair (A, B) of distinct targets the nodes
     * reachable from A that can also reach B are kept. All targets are
     * always part of the result, including targets that no path
     * connects.</p>
     *
     * @param graph the graph to query
     * @param targets the files to connect, at least two
     * @return the induced path graph
     */
    public static DependencyGraph findPathNodes(final DependencyGraph graph,
            final List<String> targets) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNoNulls(targets, "Targets are required");

        final List<String> distinct = new ArrayList<>(
                new LinkedHashSet<>(targets));
        Preconditions.require(distinct.size() >= 2,
                "At least two distinct targets are required");

        final Map<String, List<String>> reverse = graph.dependents();

        final List<Set<String>> forward = new ArrayList<>();
        final List<Set<String>> backward = new ArrayList<>();
        for (final String target : distinct) {
            forward.add(reachable(graph.adjacencyList(), target));
            backward.add(reachable(reverse, target));
        }

        final Set<String> keep = new LinkedHashSet<>(distinct);
        for (int from = 0; from < distinct.size(); from++) {
            for (int to = 0; to < distinct.size(); to++) {
                if (from == to) {
                    continue;
                }
                for (final String node : forward.get(from)) {
                    if (backward.get(to).contains(node)) {
                        keep.add(node);
                    }
                }
            }
        }

        return graph.inducedSubgraph(keep);
    }

    /** Breadth-first reachability, including the source itself. */
    private static Set<String> reachable(
            final Map<String, List<String>> adjacency, final String source) {
        final Set<String> seen = new HashSet<>();
        seen.add(source);

        final Queue<String> queue = new ArrayDeque<>();
        queue.add(source);
        while (!queue.isEmpty()) {
            final String current = queue.poll();
            for (final String next
                    : adjacency.getOrDefault(current, List.of())) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen;
    }

}
