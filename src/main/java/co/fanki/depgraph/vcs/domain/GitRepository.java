package co.fanki.depgraph.vcs.domain;

import co.fanki.depgraph.graph.domain.FileStats;
import co.fanki.depgraph.shared.DomainException;
import co.fanki.depgraph.shared.Preconditions;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.FileTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.PathFilterGroup;
import org.eclipse.jgit.util.io.DisabledOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only access to a local Git repository.
 *
 * <p>Lists changed files, reads file content at a revision and computes
 * per-file line statistics. All paths going in and out are absolute
 * paths inside the work tree; JGit's repository relative paths never
 * leave this class.</p>
 *
 * <p>Not thread-safe. Open one instance per unit of work and close it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GitRepository implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(
            GitRepository.class);

    /** Error code for a revision that does not name a commit. */
    public static final String UNKNOWN_REVISION = "UNKNOWN_REVISION";

    /** Error code for a path outside of any Git work tree. */
    public static final String NOT_A_REPOSITORY = "NOT_A_REPOSITORY";

    private final Git git;

    private final Repository repository;

    private final Path workTree;

    private GitRepository(final Repository theRepository) {
        repository = theRepository;
        git = new Git(theRepository);
        workTree = theRepository.getWorkTree().toPath()
                .toAbsolutePath().normalize();
    }

    /**
     * Opens the repository containing a path.
     *
     * <p>The path may be the work tree root or any directory below it.</p>
     *
     * @param path a path inside the work tree
     * @return the opened repository
     * @throws DomainException if no repository contains the path
     * @throws IOException if the repository cannot be read
     */
    public static GitRepository open(final Path path) throws IOException {
        Preconditions.requireNonNull(path, "Path is required");

        final FileRepositoryBuilder builder = new FileRepositoryBuilder()
                .readEnvironment()
                .findGitDir(path.toAbsolutePath().normalize().toFile());
        if (builder.getGitDir() == null) {
            throw new DomainException("Not a git repository: " + path,
                    NOT_A_REPOSITORY);
        }
        final Repository repository = builder.setMustExist(true).build();
        if (repository.isBare()) {
            repository.close();
            throw new DomainException("Bare repositories have no work tree: "
                    + path, NOT_A_REPOSITORY);
        }
        LOG.debug("Opened repository at {}", repository.getWorkTree());
        return new GitRepository(repository);
    }

    /** Returns the absolute, normalized work tree root. */
    public Path workTree() {
        return workTree;
    }

    /**
     * Lists the files with uncommitted changes that still exist.
     *
     * <p>Covers staged, modified, untracked and conflicting files. Deleted
     * files are left out since there is no content to analyze.</p>
     *
     * @return absolute paths, sorted
     * @throws IOException if the status cannot be computed
     */
    public List<String> uncommittedFiles() throws IOException {
        return toAbsolute(uncommittedRelativePaths(status()));
    }

    /**
     * Lists the files added or modified by a commit selection.
     *
     * <p>A single commit is compared with its first parent, a root commit
     * with an empty tree. A range {@code A..B} or {@code A...B} compares
     * the trees of both ends, oldest first.</p>
     *
     * @param commit a revision or a range of two revisions
     * @return absolute paths, sorted
     * @throws IOException if the repository cannot be read
     */
    public List<String> commitFiles(final String commit) throws IOException {
        final Set<String> files = new TreeSet<>();
        try (final DiffFormatter formatter = newFormatter()) {
            for (final DiffEntry entry : diff(formatter, commit)) {
                if (entry.getChangeType() != DiffEntry.ChangeType.DELETE) {
                    files.add(entry.getNewPath());
                }
            }
        }
        return toAbsolute(files);
    }

    /**
     * Parses a commit selection and puts a range in chronological order.
     *
     * <p>When the second end is an ancestor of the first the ends are
     * swapped. Ranges over unrelated histories keep the given order.</p>
     *
     * @param commit a revision or a range of two revisions
     * @return the ordered selection; its {@code to} end is the newest
     * @throws DomainException if a revision does not resolve
     * @throws IOException if the repository cannot be read
     */
    public CommitRange resolveRange(final String commit) throws IOException {
        final CommitRange range = CommitRange.parse(commit);
        if (!range.isRange()) {
            resolveId(range.to());
            return range;
        }
        try (final RevWalk walk = new RevWalk(repository)) {
            final RevCommit from = walk.parseCommit(resolveId(range.from()));
            final RevCommit to = walk.parseCommit(resolveId(range.to()));
            if (!walk.isMergedInto(from, to) && walk.isMergedInto(to, from)) {
                LOG.debug("Range {} is reversed, swapping its ends", range);
                return range.reversed();
            }
            return range;
        }
    }

    /**
     * Lists every file of the tree at a revision.
     *
     * @param revision any revision string JGit understands
     * @return absolute paths, sorted
     * @throws IOException if the repository cannot be read
     */
    public List<String> treeFiles(final String revision) throws IOException {
        final RevCommit commit = resolveCommit(revision);
        final Set<String> files = new TreeSet<>();
        try (final TreeWalk walk = new TreeWalk(repository)) {
            walk.addTree(commit.getTree());
            walk.setRecursive(true);
            while (walk.next()) {
                files.add(walk.getPathString());
            }
        }
        return toAbsolute(files);
    }

    /**
     * Reads a file as it was at a revision.
     *
     * @param revision any revision string JGit understands
     * @param path the absolute path of the file in the work tree
     * @return the file bytes
     * @throws FileNotFoundException if the file is not in that revision
     * @throws IOException if the repository cannot be read
     */
    public byte[] readFile(final String revision, final String path)
            throws IOException {
        final String relative = toRelative(path);
        final RevCommit commit = resolveCommit(revision);
        try (final TreeWalk walk = TreeWalk.forPath(repository, relative,
                commit.getTree())) {
            if (walk == null) {
                throw new FileNotFoundException(relative + " not found at "
                        + revision);
            }
            return repository.open(walk.getObjectId(0), Constants.OBJ_BLOB)
                    .getBytes();
        }
    }

    /**
     * Computes line statistics of the uncommitted changes, against HEAD.
     *
     * @return absolute path to statistics
     * @throws IOException if the diff cannot be computed
     */
    public Map<String, FileStats> uncommittedStats() throws IOException {
        final Set<String> changed = uncommittedRelativePaths(status());
        if (changed.isEmpty()) {
            return Map.of();
        }

        final AbstractTreeIterator oldTree = headTreeOrEmpty();
        final FileTreeIterator newTree = new FileTreeIterator(repository);

        try (final DiffFormatter formatter = newFormatter()) {
            formatter.setPathFilter(PathFilterGroup.createFromStrings(changed));
            return stats(formatter, formatter.scan(oldTree, newTree));
        }
    }

    /**
     * Computes line statistics of a commit selection, with the same
     * comparison as {@link #commitFiles(String)}.
     *
     * @param commit a revision or a range of two revisions
     * @return absolute path to statistics
     * @throws IOException if the diff cannot be computed
     */
    public Map<String, FileStats> commitStats(final String commit)
            throws IOException {
        try (final DiffFormatter formatter = newFormatter()) {
            return stats(formatter, diff(formatter, commit));
        }
    }

    /**
     * Computes a value that changes whenever HEAD moves or the working
     * tree changes.
     *
     * <p>Combines the HEAD commit with the status of every uncommitted
     * file and its size and modification time, so edits to an already
     * modified file are noticed too.</p>
     *
     * @return an opaque signature
     * @throws IOException if the status cannot be computed
     */
    public String stateSignature() throws IOException {
        final Status status = status();
        final ObjectId head = repository.resolve(Constants.HEAD);

        final MessageDigest digest = sha256();
        for (final String relative : uncommittedRelativePaths(status)) {
            final Path file = workTree.resolve(relative);
            digest.update(relative.getBytes(StandardCharsets.UTF_8));
            if (Files.exists(file)) {
                digest.update(Long.toString(Files.size(file))
                        .getBytes(StandardCharsets.UTF_8));
                digest.update(Long.toString(
                        Files.getLastModifiedTime(file).toMillis())
                        .getBytes(StandardCharsets.UTF_8));
            }
        }
        for (final String removed : new TreeSet<>(status.getMissing())) {
            digest.update(("-" + removed).getBytes(StandardCharsets.UTF_8));
        }
        for (final String removed : new TreeSet<>(status.getRemoved())) {
            digest.update(("-" + removed).getBytes(StandardCharsets.UTF_8));
        }

        final String headName = head == null ? "none" : head.name();
        return headName + ":" + HexFormat.of().formatHex(digest.digest());
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }

    // -- internals -------------------------------------------------------

    private Status status() throws IOException {
        try {
            return git.status().call();
        } catch (final GitAPIException e) {
            throw new IOException("Failed to compute status of " + workTree, e);
        }
    }

    private static Set<String> uncommittedRelativePaths(final Status status) {
        final Set<String> files = new TreeSet<>();
        files.addAll(status.getAdded());
        files.addAll(status.getChanged());
        files.addAll(status.getModified());
        files.addAll(status.getUntracked());
        files.addAll(status.getConflicting());
        files.removeAll(status.getMissing());
        files.removeAll(status.getRemoved());
        return files;
    }

    private RevCommit resolveCommit(final String revision) throws IOException {
        final ObjectId id = resolveId(revision);
        try (final RevWalk walk = new RevWalk(repository)) {
            return walk.parseCommit(id);
        }
    }

    private ObjectId resolveId(final String revision) throws IOException {
        Preconditions.requireNonBlank(revision, "Revision is required");
        final ObjectId id = repository.resolve(revision);
        if (id == null) {
            throw new DomainException("Unknown revision: " + revision,
                    UNKNOWN_REVISION);
        }
        return id;
    }

    private List<DiffEntry> diff(final DiffFormatter formatter,
            final String commit) throws IOException {
        final CommitRange range = resolveRange(commit);
        if (!range.isRange()) {
            final RevCommit single = resolveCommit(range.to());
            return formatter.scan(parentTree(single), treeParser(single));
        }
        return formatter.scan(treeParser(resolveCommit(range.from())),
                treeParser(resolveCommit(range.to())));
    }

    private AbstractTreeIterator parentTree(final RevCommit commit)
            throws IOException {
        if (commit.getParentCount() == 0) {
            return new EmptyTreeIterator();
        }
        try (final RevWalk walk = new RevWalk(repository)) {
            return treeParser(walk.parseCommit(commit.getParent(0)));
        }
    }

    private AbstractTreeIterator headTreeOrEmpty() throws IOException {
        final ObjectId head = repository.resolve(Constants.HEAD);
        if (head == null) {
            return new EmptyTreeIterator();
        }
        try (final RevWalk walk = new RevWalk(repository)) {
            return treeParser(walk.parseCommit(head));
        }
    }

    private AbstractTreeIterator treeParser(final RevCommit commit)
            throws IOException {
        final CanonicalTreeParser parser = new CanonicalTreeParser();
        try (final ObjectReader reader = repository.newObjectReader()) {
            parser.reset(reader, commit.getTree().getId());
        }
        return parser;
    }

    private DiffFormatter newFormatter() {
        final DiffFormatter formatter = new DiffFormatter(
                DisabledOutputStream.INSTANCE);
        formatter.setRepository(repository);
        formatter.setDetectRenames(false);
        return formatter;
    }

    private Map<String, FileStats> stats(final DiffFormatter formatter,
            final List<DiffEntry> entries) throws IOException {
        final Map<String, FileStats> stats = new LinkedHashMap<>();
        for (final DiffEntry entry : entries) {
            if (entry.getChangeType() == DiffEntry.ChangeType.DELETE) {
                continue;
            }
            final EditList edits = formatter.toFileHeader(entry).toEditList();
            int additions = 0;
            int deletions = 0;
            for (final Edit edit : edits) {
                additions += edit.getLengthB();
                deletions += edit.getLengthA();
            }
            stats.put(absolute(entry.getNewPath()), new FileStats(additions,
                    deletions,
                    entry.getChangeType() == DiffEntry.ChangeType.ADD));
        }
        return Collections.unmodifiableMap(stats);
    }

    private List<String> toAbsolute(final Set<String> relativePaths) {
        final List<String> files = new ArrayList<>();
        for (final String relative : relativePaths) {
            files.add(absolute(relative));
        }
        return List.copyOf(files);
    }

    private String absolute(final String relative) {
        return workTree.resolve(relative).normalize().toString();
    }

    private String toRelative(final String path) {
        Preconditions.requireNonBlank(path, "Path is required");
        final Path file = Path.of(path).toAbsolutePath().normalize();
        Preconditions.require(file.startsWith(workTree),
                "Path is outside of the work tree: " + path);
        return workTree.relativize(file).toString().replace('\\', '/');
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

}
