package co.fanki.depgraph.graph.application;

import java.time.Instant;

/**
 * A graph built by the watcher, with the repository state it reflects.
 *
 * @param analysis the analysis
 * @param signature the repository state signature at build time
 * @param builtAt when the analysis finished
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphSnapshot(GraphAnalysis analysis, String signature,
        Instant builtAt) {
}
