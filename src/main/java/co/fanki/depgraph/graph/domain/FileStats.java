package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;
import co.fanki.depgraph.shared.ValueObject;

/**
 * Line statistics of a changed file.
 *
 * @param additions number of added lines
 * @param deletions number of deleted lines
 * @param isNew true if the file did not exist before the change
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileStats(int additions, int deletions, boolean isNew)
        implements ValueObject {

    /** Validates the counters. */
    public FileStats {
        Preconditions.require(additions >= 0, "Additions must be >= 0");
        Preconditions.require(deletions >= 0, "Deletions must be >= 0");
    }

}
