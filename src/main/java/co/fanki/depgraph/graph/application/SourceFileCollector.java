package co.fanki.depgraph.graph.application;

import co.fanki.depgraph.graph.domain.ImportResolverRegistry;
import co.fanki.depgraph.shared.DomainException;
import co.fanki.depgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the files of a directory tree and filters them by extension.
 *
 * <p>Directory walks skip version control metadata, dependency folders
 * and build output.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SourceFileCollector {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceFileCollector.class);

    private static final Set<String> EXCLUDED_DIRS = Set.of(
            ".git", "node_modules", "vendor", "target", "build", "dist",
            ".idea", ".gradle");

    /**
     * Lists every regular file below a directory.
     *
     * @param root the directory
     * @return absolute paths, sorted
     * @throws IOException if the directory cannot be walked
     */
    public List<String> collect(final Path root) throws IOException {
        Preconditions.requireNonNull(root, "Root is required");
        final Path base = root.toAbsolutePath().normalize();

        try (final Stream<Path> walk = Files.walk(base)) {
            final List<String> files = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> isNotInExcludedDir(base, path))
                    .map(path -> path.normalize().toString())
                    .sorted()
                    .collect(Collectors.toList());
            LOG.debug("Found {} files under {}", files.size(), base);
            return files;
        }
    }

    /**
     * Expands explicit paths into files.
     *
     * <p>Files are kept as given; directories are walked. Relative paths
     * resolve against the root.</p>
     *
     * @param root the directory relative paths resolve against
     * @param paths the files or directories
     * @return absolute paths, in input order, without duplicates
     * @throws DomainException if a path does not exist
     * @throws IOException if a directory cannot be walked
     */
    public List<String> expand(final Path root, final List<String> paths)
            throws IOException {
        Preconditions.requireNonNull(root, "Root is required");
        Preconditions.requireNoNulls(paths, "Paths are required");

        final Set<String> files = new LinkedHashSet<>();
        for (final String raw : paths) {
            final Path path = resolve(root, raw);
            if (Files.isDirectory(path)) {
                files.addAll(collect(path));
            } else if (Files.isRegularFile(path)) {
                files.add(path.toString());
            } else {
                throw new DomainException("Path not found: " + raw,
                        GraphRequest.INVALID_REQUEST);
            }
        }
        return new ArrayList<>(files);
    }

    /**
     * Applies extension filters.
     *
     * <p>An empty include list keeps every extension. Extensions match
     * case-insensitively, with or without the leading dot.</p>
     *
     * @param files the files
     * @param include the extensions to keep
     * @param exclude the extensions to drop
     * @return the remaining files, in input order
     */
    public List<String> filterByExtension(final Collection<String> files,
            final Collection<String> include,
            final Collection<String> exclude) {
        final Set<String> included = normalizeExtensions(include);
        final Set<String> excluded = normalizeExtensions(exclude);

        final List<String> result = new ArrayList<>();
        for (final String file : files) {
            final String extension = ImportResolverRegistry.extensionOf(file);
            if (!included.isEmpty() && !included.contains(extension)) {
                continue;
            }
            if (excluded.contains(extension)) {
                continue;
            }
            result.add(file);
        }
        return result;
    }

    /**
     * Resolves a path against a root and normalizes it.
     *
     * @param root the base directory
     * @param raw the path, absolute or relative
     * @return the absolute, normalized path
     */
    public static Path resolve(final Path root, final String raw) {
        Preconditions.requireNonBlank(raw, "Path must not be blank");
        return root.toAbsolutePath().resolve(raw).normalize();
    }

    private static Set<String> normalizeExtensions(
            final Collection<String> extensions) {
        final Set<String> normalized = new LinkedHashSet<>();
        if (extensions == null) {
            return normalized;
        }
        for (final String extension : extensions) {
            if (extension == null || extension.isBlank()) {
                continue;
            }
            final String trimmed = extension.trim().toLowerCase(Locale.ROOT);
            normalized.add(trimmed.startsWith(".") ? trimmed : "." + trimmed);
        }
        return normalized;
    }

    private static boolean isNotInExcludedDir(final Path base,
            final Path path) {
        final Path directory = base.relativize(path).getParent();
        if (directory == null) {
            return true;
        }
        for (final Path component : directory) {
            if (EXCLUDED_DIRS.contains(component.toString())) {
                return false;
            }
        }
        return true;
    }

}
