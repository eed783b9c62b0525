package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.graph.domain.golang.GoImportResolver;
import co.fanki.depgraph.graph.domain.java.JavaImportResolver;
import co.fanki.depgraph.graph.domain.javascript.JavaScriptImportResolver;
import co.fanki.depgraph.graph.domain.kotlin.KotlinImportResolver;
import co.fanki.depgraph.graph.domain.python.PythonImportResolver;
import co.fanki.depgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps file extensions to the {@link ImportResolver} handling them.
 *
 * <p>The registry is filled once at construction and is read-only
 * afterwards. When two resolvers claim the same extension the first one
 * wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ImportResolverRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImportResolverRegistry.class);

    private final Map<String, ImportResolver> byExtension;

    private final List<ImportResolver> resolvers;

    /**
     * Creates a registry.
     *
     * @param theResolvers the resolvers, in priority order
     */
    public ImportResolverRegistry(final List<ImportResolver> theResolvers) {
        Preconditions.requireNoNulls(theResolvers, "Resolvers are required");

        final Map<String, ImportResolver> index = new LinkedHashMap<>();
        final List<ImportResolver> registered = new ArrayList<>();
        for (final ImportResolver resolver : theResolvers) {
            boolean used = false;
            for (final String extension : resolver.extensions()) {
                final String key = extension.toLowerCase(Locale.ROOT);
                final ImportResolver existing = index.putIfAbsent(key,
                        resolver);
                if (existing != null) {
                    LOG.warn("Extension {} already handled by {}, ignoring {}",
                            key, existing.language(), resolver.language());
                } else {
                    used = true;
                }
            }
            if (used) {
                registered.add(resolver);
            }
        }
        byExtension = Collections.unmodifiableMap(index);
        resolvers = List.copyOf(registered);
    }

    /**
     * Creates a registry with the built-in resolvers for Java, Kotlin,
     * JavaScript/TypeScript, Python and Go.
     *
     * @return the default registry
     */
    public static ImportResolverRegistry defaults() {
        return new ImportResolverRegistry(List.of(
                new JavaImportResolver(),
                new KotlinImportResolver(),
                new JavaScriptImportResolver(),
                new PythonImportResolver(),
                new GoImportResolver()));
    }

    /**
     * Finds the resolver for an extension.
     *
     * @param extension the extension including the dot, any case
     * @return the resolver, or empty if the extension is unsupported
     */
    public Optional<ImportResolver> forExtension(final String extension) {
        if (extension == null || extension.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(
                byExtension.get(extension.toLowerCase(Locale.ROOT)));
    }

    /**
     * Finds the resolver for a file.
     *
     * @param path the file path
     * @return the resolver, or empty if the extension is unsupported
     */
    public Optional<ImportResolver> forPath(final String path) {
        return forExtension(extensionOf(path));
    }

    public boolean supportsExtension(final String extension) {
        return forExtension(extension).isPresent();
    }

    /** Returns the supported extensions, sorted. */
    public Set<String> supportedExtensions() {
        return Collections.unmodifiableSet(
                new TreeSet<>(byExtension.keySet()));
    }

    /** Returns the registered resolvers in registration order. */
    public List<ImportResolver> resolvers() {
        return resolvers;
    }

    /**
     * Extracts the lower-case extension of a file, including the dot.
     *
     * <p>Hidden files without a further dot, such as {@code .gitignore},
     * have no extension.</p>
     *
     * @param path the file path
     * @return the extension, or an empty string
     */
    public static String extensionOf(final String path) {
        if (path == null) {
            return "";
        }
        final String normalized = path.replace('\\', '/');
        final String name = normalized.substring(
                normalized.lastIndexOf('/') + 1);
        final int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

}
