package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest graph built by the watcher.
 *
 * <p>Readers always see a complete snapshot. Publishing replaces the
 * previous snapshot, so slow readers simply get the newest one.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class GraphSnapshotCache {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphSnapshotCache.class);

    private final AtomicReference<GraphSnapshot> latest =
            new AtomicReference<>();

    /**
     * Publishes a new snapshot.
     *
     * @param snapshot the snapshot
     */
    public void publish(final GraphSnapshot snapshot) {
        Preconditions.requireNonNull(snapshot, "Snapshot is required");
        latest.set(snapshot);
        LOG.debug("Published snapshot {}", snapshot.signature());
    }

    /**
     * Returns the latest snapshot.
     *
     * @return the snapshot, or empty if nothing was published yet
     */
    public Optional<GraphSnapshot> latest() {
        return Optional.ofNullable(latest.get());
    }

}
