package co.fanki.depgraph.graph.domain;

/**
 * Derived metadata of one edge.
 *
 * @param inCycle true if the edge lies inside a dependency cycle
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EdgeMetadata(boolean inCycle) {
}
