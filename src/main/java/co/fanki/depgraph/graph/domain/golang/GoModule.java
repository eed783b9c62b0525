package co.fanki.depgraph.graph.domain.golang;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The parts of a {@code go.mod} file that map import paths to
 * directories: the module path and its local {@code replace} targets.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class GoModule {

    private final Path root;

    private final String name;

    private final Map<String, Path> replacements;

    private GoModule(final Path theRoot, final String theName,
            final Map<String, Path> theReplacements) {
        root = theRoot;
        name = theName;
        replacements = theReplacements;
    }

    /**
     * Parses a module descriptor.
     *
     * @param root the directory holding the descriptor
     * @param content the descriptor content
     * @return the module, or empty if it declares no module path
     */
    static Optional<GoModule> parse(final Path root, final String content) {
        String name = null;
        final Map<String, Path> replacements = new LinkedHashMap<>();
        boolean inReplaceBlock = false;

        for (final String raw : content.split("\\R")) {
            String line = raw;
            final int comment = line.indexOf("//");
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();

            if (inReplaceBlock) {
                if (line.startsWith(")")) {
                    inReplaceBlock = false;
                } else {
                    addReplacement(root, line, replacements);
                }
            } else if (line.startsWith("module ")) {
                name = unquote(line.substring("module ".length()));
            } else if (line.startsWith("replace")) {
                final String rest = line.substring("replace".length()).trim();
                if (rest.startsWith("(")) {
                    inReplaceBlock = true;
                } else {
                    addReplacement(root, rest, replacements);
                }
            }
        }

        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new GoModule(root, name, replacements));
    }

    /**
     * Maps an import path to the directory of its package.
     *
     * @param importPath the import path
     * @return the directory, or empty if the package is not local
     */
    Optional<Path> packageDirectory(final String importPath) {
        if (importPath.equals(name)) {
            return Optional.of(root);
        }
        if (importPath.startsWith(name + "/")) {
            return Optional.of(root.resolve(
                    importPath.substring(name.length() + 1)).normalize());
        }

        String best = null;
        for (final String replaced : replacements.keySet()) {
            final boolean matches = importPath.equals(replaced)
                    || importPath.startsWith(replaced + "/");
            if (matches && (best == null || replaced.length() > best.length())) {
                best = replaced;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        final String suffix = importPath.substring(best.length());
        final Path target = replacements.get(best);
        return Optional.of(suffix.isEmpty()
                ? target
                : target.resolve(suffix.substring(1)).normalize());
    }

    /** Parses {@code old [version] => new [version]}, keeping local targets. */
    private static void addReplacement(final Path root, final String line,
            final Map<String, Path> replacements) {
        final int arrow = line.indexOf("=>");
        if (arrow < 0) {
            return;
        }
        final String[] from = line.substring(0, arrow).trim().split("\\s+");
        final String[] to = line.substring(arrow + 2).trim().split("\\s+");
        if (from[0].isEmpty() || to[0].isEmpty()) {
            return;
        }
        final String target = unquote(to[0]);
        if (target.startsWith("./") || target.startsWith("../")
                || target.startsWith("/")) {
            replacements.put(unquote(from[0]),
                    root.resolve(target).normalize());
        }
    }

    private static String unquote(final String value) {
        return value.trim().replace("\"", "");
    }

}
