package co.fanki.depgraph.graph.domain.javascript;

import co.fanki.depgraph.graph.domain.CandidateFiles;
import co.fanki.depgraph.graph.domain.ImportResolver;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Import resolver for JavaScript and TypeScript modules.
 *
 * <p>Recognizes ES module imports and re-exports, side-effect imports,
 * dynamic {@code import()} and CommonJS {@code require()}. Only relative
 * specifiers are resolved; bare specifiers name packages. A specifier is
 * tried as written, with each known extension appended and as a directory
 * with an {@code index} file. A {@code .js} specifier also matches the
 * TypeScript source it is compiled from.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JavaScriptImportResolver implements ImportResolver {

    /** Matches import/export statements, with or without bindings. */
    private static final Pattern STATIC_IMPORT_PATTERN = Pattern.compile(
            "\\b(?:import|export)\\s+(?:[^'\";]*?\\s+from\\s+)?['\"]([^'\"]+)['\"]");

    /** Matches dynamic import expressions. */
    private static final Pattern DYNAMIC_IMPORT_PATTERN = Pattern.compile(
            "\\bimport\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    /** Matches CommonJS require calls. */
    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
            "\\brequire\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");

    private static final List<String> LOOKUP_EXTENSIONS = List.of(
            ".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs", ".mts", ".cts");

    /** Compiled extension to the TypeScript sources producing it. */
    private static final Map<String, List<String>> SOURCE_EXTENSIONS = Map.of(
            ".js", List.of(".ts", ".tsx"),
            ".jsx", List.of(".tsx"),
            ".mjs", List.of(".mts"),
            ".cjs", List.of(".cts"));

    @Override
    public String language() {
        return "JavaScript/TypeScript";
    }

    @Override
    public Set<String> extensions() {
        return Set.copyOf(LOOKUP_EXTENSIONS);
    }

    @Override
    public List<String> extractImports(final String content) {
        // Keyed by offset so specifiers come out in source order.
        final TreeMap<Integer, String> found = new TreeMap<>();
        collect(STATIC_IMPORT_PATTERN, content, found);
        collect(DYNAMIC_IMPORT_PATTERN, content, found);
        collect(REQUIRE_PATTERN, content, found);
        return new ArrayList<>(found.values());
    }

    @Override
    public Optional<String> resolve(final String specifier,
            final String fromPath, final CandidateFiles candidates) {
        if (!isRelative(specifier)) {
            return Optional.empty();
        }

        final String base;
        try {
            final Path parent = Path.of(fromPath).getParent();
            if (parent == null) {
                return Optional.empty();
            }
            base = parent.resolve(specifier).normalize().toString();
        } catch (final InvalidPathException e) {
            return Optional.empty();
        }

        for (final String candidate : possibleFiles(base)) {
            if (candidates.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean isTestFile(final String path) {
        final String normalized = path.replace('\\', '/');
        final String name = normalized.substring(
                normalized.lastIndexOf('/') + 1);
        return name.contains(".test.")
                || name.contains(".spec.")
                || normalized.contains("/__tests__/");
    }

    private static void collect(final Pattern pattern, final String content,
            final Map<Integer, String> found) {
        final Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            found.putIfAbsent(matcher.start(1), matcher.group(1));
        }
    }

    private static boolean isRelative(final String specifier) {
        return specifier != null
                && (specifier.equals(".") || specifier.equals("..")
                || specifier.startsWith("./") || specifier.startsWith("../"));
    }

    /** Lists the files a relative specifier may denote, in priority order. */
    private static List<String> possibleFiles(final String base) {
        final List<String> files = new ArrayList<>();
        files.add(base);

        for (final Map.Entry<String, List<String>> entry
                : SOURCE_EXTENSIONS.entrySet()) {
            if (base.endsWith(entry.getKey())) {
                final String stem = base.substring(0,
                        base.length() - entry.getKey().length());
                for (final String extension : entry.getValue()) {
                    files.add(stem + extension);
                }
            }
        }

        for (final String extension : LOOKUP_EXTENSIONS) {
            files.add(base + extension);
        }

        final String index = Path.of(base).resolve("index").toString();
        for (final String extension : LOOKUP_EXTENSIONS) {
            files.add(index + extension);
        }
        return files;
    }

}
