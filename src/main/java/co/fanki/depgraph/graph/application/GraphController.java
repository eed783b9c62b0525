package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.graph.application.GraphView.LanguageView;
import co.fanki.depgraph.graph.domain.GraphClosureException;
import co.fanki.depgraph.graph.domain.ImportResolverRegistry;
import co.fanki.depgraph.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for building and querying file dependency graphs.
 *
 * <p>Every request rebuilds the graph from the sources on disk or in
 * Git. Only the watcher's latest snapshot is kept between requests.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/graph")
@Tag(name = "Dependency Graph",
        description = "Build file dependency graphs and find cycles")
public class GraphController {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphController.class);

    private final GraphAnalysisService analysisService;

    private final GraphViewAssembler viewAssembler;

    private final ImportResolverRegistry registry;

    private final GraphSnapshotCache snapshotCache;

    /**
     * Creates a new GraphController.
     *
     * @param theAnalysisService the analysis service
     * @param theViewAssembler the view assembler
     * @param theRegistry the registered import resolvers
     * @param theSnapshotCache the watcher's snapshot cache
     */
    public GraphController(final GraphAnalysisService theAnalysisService,
            final GraphViewAssembler theViewAssembler,
            final ImportResolverRegistry theRegistry,
            final GraphSnapshotCache theSnapshotCache) {
        this.analysisService = theAnalysisService;
        this.viewAssembler = theViewAssembler;
        this.registry = theRegistry;
        this.snapshotCache = theSnapshotCache;
    }

    /**
     * Builds the graph described by the request.
     *
     * @param request the analysis request
     * @return the graph view
     */
    @PostMapping
    @Operation(summary = "Build a dependency graph",
            description = "Builds the file dependency graph of a directory,"
                    + " a commit or the uncommitted changes. Optionally"
                    + " narrows it to the neighborhood of targetFile or to"
                    + " the files between betweenFiles.")
    public ResponseEntity<?> graph(@RequestBody final GraphRequest request) {
        LOG.info("Graph request for {}", request.repositoryPath());
        try {
            return ResponseEntity.ok(viewAssembler.toView(
                    analysisService.analyze(request)));
        } catch (final GraphClosureException e) {
            return internalError(e);
        } catch (final DomainException e) {
            return badRequest(e);
        } catch (final IllegalArgumentException e) {
            return invalidArgument(e);
        }
    }

    /**
     * Builds the graph described by the request and returns its cycles.
     *
     * @param request the analysis request
     * @return the cycles view
     */
    @PostMapping("/cycles")
    @Operation(summary = "Find dependency cycles",
            description = "Builds the graph like POST /api/graph and"
                    + " returns only its cycles.")
    public ResponseEntity<?> cycles(@RequestBody final GraphRequest request) {
        LOG.info("Cycle request for {}", request.repositoryPath());
        try {
            return ResponseEntity.ok(viewAssembler.toCyclesView(
                    analysisService.analyze(request)));
        } catch (final GraphClosureException e) {
            return internalError(e);
        } catch (final DomainException e) {
            return badRequest(e);
        } catch (final IllegalArgumentException e) {
            return invalidArgument(e);
        }
    }

    /**
     * Lists the languages whose imports are resolved.
     *
     * @return the languages and their extensions
     */
    @GetMapping("/languages")
    @Operation(summary = "List supported languages")
    public List<LanguageView> languages() {
        return viewAssembler.toLanguageViews(registry);
    }

    /**
     * Returns the latest graph built by the watcher.
     *
     * @return the graph view, or 404 when nothing was built yet
     */
    @GetMapping("/latest")
    @Operation(summary = "Latest watched graph",
            description = "Returns the graph last rebuilt by the repository"
                    + " watcher. Requires watch.enabled=true.")
    public ResponseEntity<GraphView> latest() {
        return snapshotCache.latest()
                .map(snapshot -> ResponseEntity.ok(
                        viewAssembler.toView(snapshot.analysis())))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static ResponseEntity<Map<String, String>> internalError(
            final GraphClosureException e) {
        LOG.error("Resolver returned a file outside the input set: {}",
                e.danglingTargets());
        return ResponseEntity.internalServerError().body(
                Map.of("error", e.getMessage(),
                        "errorCode", e.getErrorCode()));
    }

    private static ResponseEntity<Map<String, String>> invalidArgument(
            final IllegalArgumentException e) {
        LOG.warn("Invalid graph request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(
                Map.of("error", String.valueOf(e.getMessage()),
                        "errorCode", GraphRequest.INVALID_REQUEST));
    }

    private static ResponseEntity<Map<String, String>> badRequest(
            final DomainException e) {
        LOG.warn("Graph request failed: {}", e.getMessage());
        return ResponseEntity.badRequest().body(
                Map.of("error", e.getMessage(),
                        "errorCode", e.getErrorCode()));
    }

}
