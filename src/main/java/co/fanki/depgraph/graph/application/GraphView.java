package co.fanki.depgraph.graph.application;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON view of an analyzed graph.
 *
 * @param label what was analyzed
 * @param root the analyzed directory
 * @param summary node, edge and cycle counts
 * @param nodes the files, sorted by path
 * @param edges the dependencies, sorted by source then target
 * @param cycles the dependency cycles
 * @param warnings files degraded while building
 * @param unsupportedFiles files without a registered resolver
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphView(
        String label,
        String root,
        Summary summary,
        List<NodeView> nodes,
        List<EdgeView> edges,
        List<CycleView> cycles,
        List<WarningView> warnings,
        List<String> unsupportedFiles) {

    /**
     * Graph counters.
     *
     * @param nodes number of files
     * @param edges number of dependencies
     * @param cycles number of cycles
     */
    public record Summary(int nodes, int edges, int cycles) {}

    /**
     * One file.
     *
     * @param id the absolute path
     * @param name the short display name
     * @param extension the lower-case extension
     * @param attributes boolean flags of the file
     * @param stats line statistics, omitted when not requested
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record NodeView(
            String id,
            String name,
            String extension,
            NodeAttributes attributes,
            StatsView stats) {}

    /**
     * Flags of one file.
     *
     * @param test the file is a test
     * @param isNew the file did not exist before the analyzed change
     * @param cycle the file belongs to a cycle
     */
    public record NodeAttributes(
            boolean test,
            @JsonProperty("new") boolean isNew,
            boolean cycle) {}

    /**
     * Line statistics.
     *
     * @param additions added lines
     * @param deletions deleted lines
     */
    public record StatsView(int additions, int deletions) {}

    /**
     * One dependency.
     *
     * @param from the importing file
     * @param to the imported file
     * @param inCycle the edge lies inside a cycle
     */
    public record EdgeView(String from, String to, boolean inCycle) {}

    /**
     * One cycle.
     *
     * @param files the member files, starting at the smallest path
     */
    public record CycleView(List<String> files) {}

    /**
     * One degraded file.
     *
     * @param file the file
     * @param reason why it has no dependencies
     */
    public record WarningView(String file, String reason) {}

    /**
     * Cycles only.
     *
     * @param label what was analyzed
     * @param count number of cycles
     * @param cycles the cycles
     */
    public record CyclesView(String label, int count,
            List<CycleView> cycles) {}

    /**
     * A supported language.
     *
     * @param language the language name
     * @param extensions the handled extensions, sorted
     */
    public record LanguageView(String language, List<String> extensions) {}

}
