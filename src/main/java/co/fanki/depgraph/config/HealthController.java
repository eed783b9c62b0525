package co.fanki.depgraph.config;

import co.fanki.depgraph.graph.application.GraphSnapshotCache;
import co.fanki.depgraph.graph.domain.ImportResolverRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Liveness and readiness endpoints for the dependency graph server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthController {

    private final ImportResolverRegistry registry;

    private final GraphSnapshotCache snapshotCache;

    private final boolean watchEnabled;

    /**
     * Creates a new HealthController.
     *
     * @param theRegistry the registered import resolvers
     * @param theSnapshotCache the watcher's snapshot cache
     * @param theWatchEnabled whether the repository watcher runs
     */
    public HealthController(final ImportResolverRegistry theRegistry,
            final GraphSnapshotCache theSnapshotCache,
            @Value("${watch.enabled:false}") final boolean theWatchEnabled) {
        this.registry = theRegistry;
        this.snapshotCache = theSnapshotCache;
        this.watchEnabled = theWatchEnabled;
    }

    /**
     * Liveness check.
     *
     * @return "up" while the server accepts requests
     */
    @GetMapping("/health")
    public String health() {
        return "up";
    }

    /**
     * Readiness check.
     *
     * <p>With the watcher enabled the server is ready once the first
     * graph was published, so {@code /api/graph/latest} answers.</p>
     *
     * @return status map, 503 while the first watched graph is pending
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean published = snapshotCache.latest().isPresent();
        final boolean ready = !watchEnabled || published;

        final Map<String, Object> status = Map.of(
                "status", ready ? "ready" : "not_ready",
                "languages", registry.resolvers().size(),
                "watch", !watchEnabled ? "disabled"
                        : published ? "published" : "pending");

        if (ready) {
            return ResponseEntity.ok(status);
        }
        return ResponseEntity.status(503).body(status);
    }

}
