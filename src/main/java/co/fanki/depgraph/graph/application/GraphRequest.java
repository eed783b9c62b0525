package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.shared.DomainException;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Describes which files to analyze and which view of the graph to return.
 *
 * <p>Files are selected by the first option present: {@code commit},
 * {@code uncommittedOnly}, explicit {@code paths}, or every file under
 * the repository path. With a commit and paths, the files of the
 * commit's tree below those paths are analyzed as of that commit. With
 * uncommitted-only and paths, the uncommitted files below those paths
 * are analyzed. Relative paths resolve against the repository path.
 * Paths cannot be combined with a target file or between files.</p>
 *
 * @param repositoryPath the directory to analyze, usually a Git work tree
 * @param paths explicit files or directories, may be empty
 * @param commit a revision, or a range {@code A..B} / {@code A...B},
 *               whose changed files are analyzed as of its newest
 *               revision, may be null
 * @param uncommittedOnly analyze only files with uncommitted changes
 * @param targetFile center of a neighborhood view, may be null
 * @param level the neighborhood radius, defaults to 1
 * @param betweenFiles files to connect in a between view, may be empty
 * @param includeExtensions keep only these extensions, may be empty
 * @param excludeExtensions drop these extensions, may be empty
 * @param includeStats attach line statistics from Git
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphRequest(
        String repositoryPath,
        List<String> paths,
        String commit,
        boolean uncommittedOnly,
        String targetFile,
        Integer level,
        List<String> betweenFiles,
        List<String> includeExtensions,
        List<String> excludeExtensions,
        boolean includeStats) {

    /** Error code for malformed requests. */
    public static final String INVALID_REQUEST = "INVALID_REQUEST";

    /** Error code for a target that is not a node of the built graph. */
    public static final String FILE_NOT_IN_GRAPH = "FILE_NOT_IN_GRAPH";

    /** Replaces missing lists with empty ones. */
    public GraphRequest {
        paths = paths == null ? List.of() : List.copyOf(paths);
        betweenFiles = betweenFiles == null
                ? List.of() : List.copyOf(betweenFiles);
        includeExtensions = includeExtensions == null
                ? List.of() : List.copyOf(includeExtensions);
        excludeExtensions = excludeExtensions == null
                ? List.of() : List.copyOf(excludeExtensions);
    }

    /**
     * Creates a request analyzing every file of a directory.
     *
     * @param repositoryPath the directory
     * @return the request
     */
    public static GraphRequest forDirectory(final String repositoryPath) {
        return new GraphRequest(repositoryPath, null, null, false, null,
                null, null, null, null, false);
    }

    /**
     * Checks the request before any file is read.
     *
     * @throws DomainException with {@link #INVALID_REQUEST} when options
     *         are missing or contradict each other
     */
    public void validate() {
        require(repositoryPath != null && !repositoryPath.isBlank(),
                "Repository path is required");
        require(!hasCommit() || !uncommittedOnly,
                "Commit and uncommitted-only are mutually exclusive");
        require(!hasTarget() || betweenFiles.isEmpty(),
                "Target file and between files are mutually exclusive");
        require(!hasTarget() || paths.isEmpty(),
                "Target file cannot be combined with paths");
        require(betweenFiles.isEmpty() || paths.isEmpty(),
                "Between files cannot be combined with paths");
        require(level == null || level >= 1, "Level must be at least 1");
        require(betweenFiles.isEmpty()
                        || new LinkedHashSet<>(betweenFiles).size() >= 2,
                "Between needs at least two distinct files");
        for (final String file : betweenFiles) {
            require(file != null && !file.isBlank(),
                    "Between files must not be blank");
        }
    }

    public boolean hasCommit() {
        return commit != null && !commit.isBlank();
    }

    public boolean hasTarget() {
        return targetFile != null && !targetFile.isBlank();
    }

    public boolean hasBetween() {
        return !betweenFiles.isEmpty();
    }

    /** Returns the neighborhood radius, 1 when not given. */
    public int effectiveLevel() {
        return level == null ? 1 : level;
    }

    private static void require(final boolean condition,
            final String message) {
        if (!condition) {
            throw new DomainException(message, INVALID_REQUEST);
        }
    }

}
