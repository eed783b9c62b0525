package co.fanki.depgraph.graph.domain;

import java.util.List;

/**
 * Outcome of one {@link GraphBuilder} run.
 *
 * @param graph the closed dependency graph
 * @param warnings files whose content could not be read or decoded
 * @param unsupportedFiles files without a registered resolver, present
 *                         in the graph as standalone nodes
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BuildResult(
        DependencyGraph graph,
        List<BuildWarning> warnings,
        List<String> unsupportedFiles) {

    /** Copies the lists. */
    public BuildResult {
        warnings = List.copyOf(warnings);
        unsupportedFiles = List.copyOf(unsupportedFiles);
    }

    /** Returns true if any file was degraded. */
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

}
