package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.graph.application.GraphView.CycleView;
import co.fanki.depgraph.graph.application.GraphView.CyclesView;
import co.fanki.depgraph.graph.application.GraphView.EdgeView;
import co.fanki.depgraph.graph.application.GraphView.LanguageView;
import co.fanki.depgraph.graph.application.GraphView.NodeAttributes;
import co.fanki.depgraph.graph.application.GraphView.NodeView;
import co.fanki.depgraph.graph.application.GraphView.StatsView;
import co.fanki.depgraph.graph.application.GraphView.Summary;
import co.fanki.depgraph.graph.application.GraphView.WarningView;
import co.fanki.depgraph.graph.domain.BuildWarning;
import co.fanki.depgraph.graph.domain.Cycle;
import co.fanki.depgraph.graph.domain.EdgeMetadata;
import co.fanki.depgraph.graph.domain.FileDependencyGraph;
import co.fanki.depgraph.graph.domain.FileEdge;
import co.fanki.depgraph.graph.domain.FileMetadata;
import co.fanki.depgraph.graph.domain.ImportResolver;
import co.fanki.depgraph.graph.domain.ImportResolverRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Turns analyses into their JSON views.
 *
 * <p>All lists come out in path order so identical analyses serialize
 * identically.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphViewAssembler {

    /**
     * Builds the full graph view.
     *
     * @param analysis the analysis
     * @return the view
     */
    public GraphView toView(final GraphAnalysis analysis) {
        final FileDependencyGraph graph = analysis.graph();

        final List<NodeView> nodes = new ArrayList<>();
        for (final Map.Entry<String, FileMetadata> entry
                : graph.files().entrySet()) {
            final String path = entry.getKey();
            final FileMetadata metadata = entry.getValue();
            final StatsView stats = metadata.hasStats()
                    ? new StatsView(metadata.stats().additions(),
                            metadata.stats().deletions())
                    : null;
            nodes.add(new NodeView(path,
                    analysis.nodeNames().getOrDefault(path, path),
                    metadata.extension(),
                    new NodeAttributes(metadata.isTest(), metadata.isNew(),
                            graph.isInCycle(path)),
                    stats));
        }

        final List<EdgeView> edges = new ArrayList<>();
        for (final Map.Entry<FileEdge, EdgeMetadata> entry
                : graph.edges().entrySet()) {
            edges.add(new EdgeView(entry.getKey().from(),
                    entry.getKey().to(), entry.getValue().inCycle()));
        }

        final List<WarningView> warnings = new ArrayList<>();
        for (final BuildWarning warning : analysis.warnings()) {
            warnings.add(new WarningView(warning.path(), warning.reason()));
        }

        return new GraphView(analysis.label(), analysis.root(),
                new Summary(nodes.size(), edges.size(),
                        graph.cycles().size()),
                nodes, edges, cycles(graph), warnings,
                analysis.unsupportedFiles());
    }

    /**
     * Builds the cycles-only view.
     *
     * @param analysis the analysis
     * @return the view
     */
    public CyclesView toCyclesView(final GraphAnalysis analysis) {
        final List<CycleView> cycles = cycles(analysis.graph());
        return new CyclesView(analysis.label(), cycles.size(), cycles);
    }

    /**
     * Lists the languages of a registry.
     *
     * @param registry the registry
     * @return one entry per resolver, in registration order
     */
    public List<LanguageView> toLanguageViews(
            final ImportResolverRegistry registry) {
        final List<LanguageView> languages = new ArrayList<>();
        for (final ImportResolver resolver : registry.resolvers()) {
            languages.add(new LanguageView(resolver.language(),
                    List.copyOf(new TreeSet<>(resolver.extensions()))));
        }
        return languages;
    }

    private static List<CycleView> cycles(final FileDependencyGraph graph) {
        final List<CycleView> cycles = new ArrayList<>();
        for (final Cycle cycle : graph.cycles()) {
            cycles.add(new CycleView(cycle.path()));
        }
        return cycles;
    }

}
