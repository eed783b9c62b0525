package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.graph.domain.BuildResult;
import co.fanki.depgraph.graph.domain.ContentSource;
import co.fanki.depgraph.graph.domain.DependencyGraph;
import co.fanki.depgraph.graph.domain.FileDependencyGraph;
import co.fanki.depgraph.graph.domain.FileStats;
import co.fanki.depgraph.graph.domain.GraphBuilder;
import co.fanki.depgraph.graph.domain.GraphQueries;
import co.fanki.depgraph.graph.domain.NodeNamer;
import co.fanki.depgraph.graph.domain.TestFileClassifier;
import co.fanki.depgraph.shared.DomainException;
import co.fanki.depgraph.shared.Preconditions;
import co.fanki.depgraph.vcs.domain.CommitRange;
import co.fanki.depgraph.vcs.domain.FileSystemContentSource;
import co.fanki.depgraph.vcs.domain.GitRepository;
import co.fanki.depgraph.vcs.domain.GitRevisionContentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the analysis pipeline for a {@link GraphRequest}.
 *
 * <p>Selects the files, builds the graph, applies the neighborhood or
 * between view when asked, and enriches the result. Each call builds a
 * new graph from scratch and shares nothing with previous calls.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class GraphAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphAnalysisService.class);

    /** Error code for a repository or file that could not be read. */
    public static final String SOURCE_UNAVAILABLE = "SOURCE_UNAVAILABLE";

    private final GraphBuilder graphBuilder;

    private final TestFileClassifier testFileClassifier;

    private final SourceFileCollector sourceFileCollector;

    /**
     * Creates a new GraphAnalysisService.
     *
     * @param theGraphBuilder the graph builder
     * @param theTestFileClassifier the test file classifier
     * @param theSourceFileCollector the directory walker
     */
    public GraphAnalysisService(final GraphBuilder theGraphBuilder,
            final TestFileClassifier theTestFileClassifier,
            final SourceFileCollector theSourceFileCollector) {
        this.graphBuilder = theGraphBuilder;
        this.testFileClassifier = theTestFileClassifier;
        this.sourceFileCollector = theSourceFileCollector;
    }

    /**
     * Analyzes the files selected by a request.
     *
     * @param request the request
     * @return the analysis
     * @throws DomainException if the request is invalid, a target is not
     *         part of the graph, or the sources cannot be read
     */
    public GraphAnalysis analyze(final GraphRequest request) {
        Preconditions.requireNonNull(request, "Request is required");
        request.validate();

        final Path root = Path.of(request.repositoryPath())
                .toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new DomainException("Not a directory: "
                    + request.repositoryPath(), GraphRequest.INVALID_REQUEST);
        }

        try {
            if (needsRepository(request)) {
                try (final GitRepository repository = GitRepository.open(root)) {
                    return analyze(request, root, repository);
                }
            }
            return analyze(request, root, null);
        } catch (final IOException e) {
            LOG.warn("Analysis of {} failed: {}", root, e.getMessage());
            throw new DomainException("Could not read sources: "
                    + e.getMessage(), SOURCE_UNAVAILABLE, e);
        }
    }

    private GraphAnalysis analyze(final GraphRequest request,
            final Path root, final GitRepository repository)
            throws IOException {

        final Selection selection = select(request, root, repository);
        final List<String> files = sourceFileCollector.filterByExtension(
                selection.files(), request.includeExtensions(),
                request.excludeExtensions());

        LOG.info("Analyzing {} files ({})", files.size(), selection.label());

        final BuildResult result = graphBuilder.build(files,
                selection.source());

        final DependencyGraph graph = applyView(request, root,
                result.graph());

        final Map<String, FileStats> stats = request.includeStats()
                ? stats(request, repository) : null;

        final FileDependencyGraph enriched = FileDependencyGraph.create(
                graph, stats, testFileClassifier);

        LOG.info("Analysis of {} done: {} nodes, {} edges, {} cycles",
                root, graph.nodeCount(), graph.edgeCount(),
                enriched.cycles().size());

        return new GraphAnalysis(enriched,
                NodeNamer.buildNodeNames(graph.sortedNodes()),
                result.warnings(), result.unsupportedFiles(),
                selection.label(), root.toString());
    }

    private Selection select(final GraphRequest request, final Path root,
            final GitRepository repository) throws IOException {
        final ContentSource workingTree = new FileSystemContentSource();

        if (request.hasCommit()) {
            final CommitRange range = repository.resolveRange(
                    request.commit());
            final List<String> files = request.paths().isEmpty()
                    ? repository.commitFiles(request.commit())
                    : within(root, request.paths(),
                            repository.treeFiles(range.to()));
            return new Selection(under(root, files),
                    new GitRevisionContentSource(repository, range.to()),
                    "commit " + range);
        }
        if (request.uncommittedOnly()) {
            final List<String> files = request.paths().isEmpty()
                    ? repository.uncommittedFiles()
                    : within(root, request.paths(),
                            repository.uncommittedFiles());
            return new Selection(under(root, files), workingTree,
                    "uncommitted changes");
        }
        if (!request.paths().isEmpty()) {
            return new Selection(sourceFileCollector.expand(root,
                    request.paths()), workingTree, "selected paths");
        }
        return new Selection(sourceFileCollector.collect(root), workingTree,
                "working tree");
    }

    /** Keeps the files equal to or below one of the requested paths. */
    private static List<String> within(final Path root,
            final List<String> paths, final List<String> files) {
        final List<Path> selected = new ArrayList<>();
        for (final String raw : paths) {
            selected.add(SourceFileCollector.resolve(root, raw));
        }
        final List<String> kept = new ArrayList<>();
        for (final String file : files) {
            final Path path = Path.of(file);
            for (final Path prefix : selected) {
                if (path.startsWith(prefix)) {
                    kept.add(file);
                    break;
                }
            }
        }
        if (kept.isEmpty()) {
            throw new DomainException("No files found in " + paths,
                    GraphRequest.INVALID_REQUEST);
        }
        return kept;
    }

    private DependencyGraph applyView(final GraphRequest request,
            final Path root, final DependencyGraph graph) {
        if (request.hasTarget()) {
            final String target = requireNode(graph, root,
                    request.targetFile());
            return GraphQueries.filterByLevel(graph, target,
                    request.effectiveLevel());
        }
        if (request.hasBetween()) {
            final List<String> targets = new ArrayList<>();
            for (final String file : request.betweenFiles()) {
                targets.add(requireNode(graph, root, file));
            }
            return GraphQueries.findPathNodes(graph, targets);
        }
        return graph;
    }

    private static String requireNode(final DependencyGraph graph,
            final Path root, final String file) {
        final String path = SourceFileCollector.resolve(root, file)
                .toString();
        if (!graph.containsNode(path)) {
            throw new DomainException("File is not part of the graph: "
                    + file, GraphRequest.FILE_NOT_IN_GRAPH);
        }
        return path;
    }

    private static Map<String, FileStats> stats(final GraphRequest request,
            final GitRepository repository) throws IOException {
        if (request.hasCommit()) {
            return repository.commitStats(request.commit());
        }
        return repository.uncommittedStats();
    }

    /** Keeps the files below the analyzed directory. */
    private static List<String> under(final Path root,
            final List<String> files) {
        final List<String> kept = new ArrayList<>();
        for (final String file : files) {
            if (Path.of(file).startsWith(root)) {
                kept.add(file);
            }
        }
        return kept;
    }

    private static boolean needsRepository(final GraphRequest request) {
        return request.hasCommit() || request.uncommittedOnly()
                || request.includeStats();
    }

    /** The files to analyze and where their content comes from. */
    private record Selection(List<String> files, ContentSource source,
            String label) {
    }

}
