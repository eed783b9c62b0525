package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.graph.domain.BuildWarning;
import co.fanki.depgraph.graph.domain.FileDependencyGraph;

import java.util.List;
import java.util.Map;

/**
 * The outcome of one analysis request.
 *
 * @param graph the enriched graph, already filtered when a view was asked
 * @param nodeNames display name of every node
 * @param warnings files that were degraded while building
 * @param unsupportedFiles files without a registered resolver
 * @param label short description of what was analyzed
 * @param root the analyzed directory
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphAnalysis(
        FileDependencyGraph graph,
        Map<String, String> nodeNames,
        List<BuildWarning> warnings,
        List<String> unsupportedFiles,
        String label,
        String root) {

    /** Copies the collections. */
    public GraphAnalysis {
        nodeNames = Map.copyOf(nodeNames);
        warnings = List.copyOf(warnings);
        unsupportedFiles = List.copyOf(unsupportedFiles);
    }

}
