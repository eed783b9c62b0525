package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The input file set of one build, indexed for import resolution.
 *
 * <p>Resolvers may only ever return members of this set, which keeps the
 * resulting graph closed. Lookups by suffix go through a file name index
 * and package lookups through a directory index, so a resolver never
 * scans the whole set.</p>
 *
 * <p>Not thread-safe. One instance serves one build.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CandidateFiles {

    private static final Logger LOG = LoggerFactory.getLogger(
            CandidateFiles.class);

    private final Set<String> paths;

    private final Map<String, List<String>> byFileName;

    private final Map<String, List<String>> byDirectory;

    private final ContentSource source;

    private final Map<String, Optional<String>> texts = new HashMap<>();

    /**
     * Creates an index that cannot read supporting files.
     *
     * @param thePaths the normalized input paths
     */
    public CandidateFiles(final Collection<String> thePaths) {
        this(thePaths, null);
    }

    /**
     * Creates the index.
     *
     * @param thePaths the normalized input paths
     * @param theSource where supporting files are read from, may be null
     */
    public CandidateFiles(final Collection<String> thePaths,
            final ContentSource theSource) {
        Preconditions.requireNoNulls(thePaths, "Candidate paths are required");
        final TreeSet<String> sorted = new TreeSet<>(thePaths);
        paths = Collections.unmodifiableSet(sorted);
        source = theSource;

        final Map<String, List<String>> names = new HashMap<>();
        final Map<String, List<String>> directories = new HashMap<>();
        for (final String path : sorted) {
            names.computeIfAbsent(fileName(path), k -> new ArrayList<>())
                    .add(path);
            final Path parent = Path.of(path).getParent();
            if (parent != null) {
                directories.computeIfAbsent(parent.toString(),
                        k -> new ArrayList<>()).add(path);
            }
        }
        byFileName = names;
        byDirectory = directories;
    }

    /**
     * Checks if a path is part of the input set.
     *
     * @param path the normalized path
     * @return true if the path is a candidate
     */
    public boolean contains(final String path) {
        return path != null && paths.contains(path);
    }

    /**
     * Finds the first candidate, in path order, that ends with the given
     * relative path at a segment boundary.
     *
     * @param relativePath a slash separated relative path, such as
     *                     {@code com/acme/Order.java}
     * @return the matching candidate, or empty
     */
    public Optional<String> findBySuffix(final String relativePath) {
        Preconditions.requireNonBlank(relativePath,
                "Relative path is required");
        final String suffix = "/" + relativePath;
        for (final String path : byFileName.getOrDefault(
                fileName(relativePath), List.of())) {
            if (path.replace('\\', '/').endsWith(suffix)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the file declaring a dot separated qualified name.
     *
     * <p>The name is tried in full first, then with trailing segments
     * removed, so {@code com.acme.Order.Line} and
     * {@code com.acme.Order.create} both land on {@code com/acme/Order.*}.
     * At least two segments are kept for names that have them.</p>
     *
     * @param qualifiedName the qualified name, such as {@code com.acme.Order}
     * @param extensions the file extensions to try, in order
     * @return the matching candidate, or empty
     */
    public Optional<String> findByQualifiedName(final String qualifiedName,
            final List<String> extensions) {
        Preconditions.requireNonBlank(qualifiedName,
                "Qualified name is required");
        Preconditions.requireNoNulls(extensions, "Extensions are required");

        final String[] segments = qualifiedName.split("\\.");
        final int shortest = Math.min(2, segments.length);
        for (int length = segments.length; length >= shortest; length--) {
            final String relative = String.join("/",
                    Arrays.copyOfRange(segments, 0, length));
            if (relative.isEmpty()) {
                continue;
            }
            for (final String extension : extensions) {
                final Optional<String> found = findBySuffix(
                        relative + extension);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Lists the candidates directly inside a directory.
     *
     * @param directory the absolute, normalized directory
     * @return the files of that directory, sorted, never null
     */
    public List<String> inDirectory(final String directory) {
        Preconditions.requireNonBlank(directory, "Directory is required");
        return byDirectory.getOrDefault(directory, List.of());
    }

    /**
     * Reads a file that supports resolution, such as a module descriptor.
     *
     * <p>The file does not need to be a candidate. It is read from the
     * same source as the candidates, so a build at a commit sees the
     * descriptor of that commit. Results are cached for the lifetime of
     * this index.</p>
     *
     * @param path the absolute, normalized path
     * @return the file content, or empty if it cannot be read
     */
    public Optional<String> readText(final String path) {
        Preconditions.requireNonBlank(path, "Path is required");
        if (source == null) {
            return Optional.empty();
        }
        return texts.computeIfAbsent(path, this::load);
    }

    private Optional<String> load(final String path) {
        try {
            return Optional.of(new String(source.read(path),
                    StandardCharsets.UTF_8));
        } catch (final IOException e) {
            LOG.trace("No readable file at {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static String fileName(final String path) {
        final String normalized = path.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

}
