package co.fanki.depgraph.graph.domain;

/**
 * Derived and supplied metadata of one file node.
 *
 * @param isTest true if the file follows a test naming convention
 * @param extension the lower-case extension including the dot, or an
 *                  empty string
 * @param stats the version-control statistics, or null if none were
 *              supplied for this file
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileMetadata(boolean isTest, String extension, FileStats stats) {

    /** Checks if statistics are attached. */
    public boolean hasStats() {
        return stats != null;
    }

    /** Checks if the file is new according to its statistics. */
    public boolean isNew() {
        return stats != null && stats.isNew();
    }

}
