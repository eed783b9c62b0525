package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.vcs.domain.GitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Rebuilds the graph of a watched repository whenever it changes.
 *
 * <p>Polls the repository state with a fixed delay, so a poll never
 * starts before the previous one finished. When the state signature
 * differs from the last built one, the whole graph is rebuilt and
 * published to the {@link GraphSnapshotCache}. Failures are logged and
 * the previous snapshot stays in place.</p>
 *
 * <p>Opt-in via {@code watch.enabled=true}. Disabled by default.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "watch.enabled",
        havingValue = "true",
        matchIfMissing = false)
public class GraphWatchScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphWatchScheduler.class);

    private final GraphAnalysisService analysisService;

    private final GraphSnapshotCache snapshotCache;

    private final String repositoryPath;

    private final boolean uncommittedOnly;

    private String lastSignature;

    /**
     * Creates a new GraphWatchScheduler.
     *
     * @param theAnalysisService the analysis service
     * @param theSnapshotCache where rebuilt graphs are published
     * @param theRepositoryPath the watched work tree
     * @param theUncommittedOnly only graph files with uncommitted changes
     */
    public GraphWatchScheduler(
            final GraphAnalysisService theAnalysisService,
            final GraphSnapshotCache theSnapshotCache,
            @Value("${watch.repository-path:.}") final String theRepositoryPath,
            @Value("${watch.uncommitted-only:false}")
            final boolean theUncommittedOnly) {
        this.analysisService = theAnalysisService;
        this.snapshotCache = theSnapshotCache;
        this.repositoryPath = theRepositoryPath;
        this.uncommittedOnly = theUncommittedOnly;
    }

    /**
     * Checks the repository and rebuilds the graph if it changed.
     */
    @Scheduled(fixedDelayString = "${watch.interval-ms:2000}")
    public void poll() {
        final String signature;
        try (final GitRepository repository = GitRepository.open(
                Path.of(repositoryPath))) {
            signature = repository.stateSignature();
        } catch (final Exception e) {
            LOG.warn("Could not read state of {}: {}", repositoryPath,
                    e.getMessage());
            return;
        }

        if (signature.equals(lastSignature)) {
            LOG.trace("No changes in {}", repositoryPath);
            return;
        }

        LOG.info("Change detected in {}, rebuilding graph", repositoryPath);

        try {
            final GraphAnalysis analysis = analysisService.analyze(
                    new GraphRequest(repositoryPath, null, null,
                            uncommittedOnly, null, null, null, null, null,
                            true));
            snapshotCache.publish(new GraphSnapshot(analysis, signature,
                    Instant.now()));
            lastSignature = signature;
            LOG.info("Published graph of {}: {} nodes, {} cycles",
                    repositoryPath, analysis.graph().graph().nodeCount(),
                    analysis.graph().cycles().size());
        } catch (final Exception e) {
            LOG.error("Rebuild of {} failed, keeping previous graph: {}",
                    repositoryPath, e.getMessage(), e);
        }
    }

}
