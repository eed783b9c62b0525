package co.fanki.depgraph.graph.domain;

import java.util.List;
import java.util.Map;

/**
 * Result of a cycle analysis over one {@link DependencyGraph}.
 *
 * @param cycles the cycles, ordered by their smallest member
 * @param edgeCycleFlags every edge of the graph to its cycle membership
 * @param nodeCycleFlags every node of the graph to its cycle membership
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CycleAnalysis(
        List<Cycle> cycles,
        Map<FileEdge, Boolean> edgeCycleFlags,
        Map<String, Boolean> nodeCycleFlags) {

    /** Copies the components. */
    public CycleAnalysis {
        cycles = List.copyOf(cycles);
        edgeCycleFlags = Map.copyOf(edgeCycleFlags);
        nodeCycleFlags = Map.copyOf(nodeCycleFlags);
    }

    /** Returns true if at least one cycle was found. */
    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    /**
     * Checks if an edge lies inside a cycle.
     *
     * @param edge the edge
     * @return true if both endpoints share a cycle
     */
    public boolean isInCycle(final FileEdge edge) {
        return edgeCycleFlags.getOrDefault(edge, false);
    }

    /**
     * Checks if a node belongs to a cycle.
     *
     * @param node the node path
     * @return true if the node is part of a cycle
     */
    public boolean isInCycle(final String node) {
        return nodeCycleFlags.getOrDefault(node, false);
    }

}
