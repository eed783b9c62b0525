package co.fanki.depgraph.graph.domain.golang;

import co.fanki.depgraph.graph.domain.CandidateFiles;
import co.fanki.depgraph.graph.domain.ImportResolver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Import resolver for Go sources.
 *
 * <p>A Go import names a package, that is a directory. The importing
 * file's module is found by walking up to the nearest {@code go.mod};
 * imports under the module path, or under a local {@code replace}
 * target, resolve to every non-test {@code .go} file of the package
 * directory. Standard library and third-party imports stay external.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GoImportResolver implements ImportResolver {

    /** One import: optional name ({@code _}, {@code .}, alias). */
    private static final Pattern IMPORT_SPEC = Pattern.compile(
            "^(?:[\\w.]+\\s+)?[\"`]([^\"`]+)[\"`]");

    private static final String GO_MOD = "go.mod";

    private static final String TEST_SUFFIX = "_test.go";

    @Override
    public String language() {
        return "Go";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".go");
    }

    @Override
    public List<String> extractImports(final String content) {
        final List<String> imports = new ArrayList<>();
        boolean inBlock = false;

        for (final String raw : content.split("\\R")) {
            final String line = stripComment(raw).trim();
            if (line.isEmpty()) {
                continue;
            }

            if (inBlock) {
                final int close = line.indexOf(')');
                addSpecs(close < 0 ? line : line.substring(0, close),
                        imports);
                inBlock = close < 0;
                continue;
            }

            if (isImport(line)) {
                final String rest = line.substring("import".length()).trim();
                if (rest.startsWith("(")) {
                    final String body = rest.substring(1);
                    final int close = body.indexOf(')');
                    addSpecs(close < 0 ? body : body.substring(0, close),
                            imports);
                    inBlock = close < 0;
                } else {
                    addSpecs(rest, imports);
                }
            } else if (isDeclaration(line)) {
                break;
            }
        }
        return imports;
    }

    @Override
    public Optional<String> resolve(final String specifier,
            final String fromPath, final CandidateFiles candidates) {
        return resolveAll(specifier, fromPath, candidates).stream()
                .findFirst();
    }

    @Override
    public List<String> resolveAll(final String specifier,
            final String fromPath, final CandidateFiles candidates) {
        if (specifier == null || specifier.isBlank()) {
            return List.of();
        }
        final Optional<GoModule> module = findModule(
                Path.of(fromPath).getParent(), candidates);
        if (module.isEmpty()) {
            return List.of();
        }
        return module.get().packageDirectory(specifier)
                .map(directory -> packageFiles(directory, candidates))
                .orElse(List.of());
    }

    @Override
    public boolean isTestFile(final String path) {
        return path.replace('\\', '/').endsWith(TEST_SUFFIX);
    }

    private static List<String> packageFiles(final Path directory,
            final CandidateFiles candidates) {
        final List<String> files = new ArrayList<>();
        for (final String file : candidates.inDirectory(
                directory.toString())) {
            if (file.endsWith(".go") && !file.endsWith(TEST_SUFFIX)) {
                files.add(file);
            }
        }
        return files;
    }

    private static Optional<GoModule> findModule(final Path start,
            final CandidateFiles candidates) {
        for (Path dir = start; dir != null; dir = dir.getParent()) {
            final Optional<String> descriptor = candidates.readText(
                    dir.resolve(GO_MOD).toString());
            if (descriptor.isPresent()) {
                return GoModule.parse(dir, descriptor.get());
            }
        }
        return Optional.empty();
    }

    private static void addSpecs(final String text,
            final List<String> imports) {
        for (final String part : text.split(";")) {
            final Matcher matcher = IMPORT_SPEC.matcher(part.trim());
            if (matcher.find()) {
                imports.add(matcher.group(1).trim());
            }
        }
    }

    private static String stripComment(final String line) {
        final int comment = line.indexOf("//");
        return comment < 0 ? line : line.substring(0, comment);
    }

    private static boolean isImport(final String line) {
        return line.startsWith("import")
                && (line.length() == "import".length()
                        || !Character.isJavaIdentifierPart(
                                line.charAt("import".length())));
    }

    private static boolean isDeclaration(final String line) {
        return line.startsWith("func ") || line.startsWith("type ")
                || line.startsWith("var ") || line.startsWith("const ");
    }

}
