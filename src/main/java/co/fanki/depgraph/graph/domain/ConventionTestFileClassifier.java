package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;

import java.util.Locale;
import java.util.Optional;

/**
 * Classifies test files by naming conventions.
 *
 * <p>Files of a registered language are classified by their resolver.
 * Everything else falls back to generic rules: a {@code _test.},
 * {@code .test.} or {@code .spec.} infix in the file name, or a
 * {@code test} or {@code tests} ancestor directory.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ConventionTestFileClassifier implements TestFileClassifier {

    private final ImportResolverRegistry registry;

    /**
     * Creates the classifier.
     *
     * @param theRegistry the registry used to find language conventions
     */
    public ConventionTestFileClassifier(
            final ImportResolverRegistry theRegistry) {
        registry = Preconditions.requireNonNull(theRegistry,
                "Resolver registry is required");
    }

    @Override
    public boolean isTest(final String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        final Optional<ImportResolver> resolver = registry.forPath(path);
        if (resolver.isPresent()) {
            return resolver.get().isTestFile(path);
        }
        return matchesGenericRules(path);
    }

    /**
     * Applies the language independent test rules.
     *
     * @param path the file path
     * @return true if the path looks like a test
     */
    public static boolean matchesGenericRules(final String path) {
        final String normalized = path.replace('\\', '/')
                .toLowerCase(Locale.ROOT);
        final String name = normalized.substring(
                normalized.lastIndexOf('/') + 1);
        if (name.contains("_test.") || name.contains(".test.")
                || name.contains(".spec.")) {
            return true;
        }
        return hasTestDirectory(normalized);
    }

    /**
     * Checks if any directory of the path is named {@code test} or
     * {@code tests}.
     *
     * @param path a slash separated path
     * @return true if a test directory is an ancestor
     */
    public static boolean hasTestDirectory(final String path) {
        final String[] parts = path.replace('\\', '/').split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            final String part = parts[i].toLowerCase(Locale.ROOT);
            if (part.equals("test") || part.equals("tests")) {
                return true;
            }
        }
        return false;
    }

}
