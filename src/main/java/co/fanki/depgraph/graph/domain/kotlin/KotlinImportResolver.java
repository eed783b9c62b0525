package co.fanki.depgraph.graph.domain.kotlin;

import co.fanki.depgraph.graph.domain.CandidateFiles;
import co.fanki.depgraph.graph.domain.ConventionTestFileClassifier;
import co.fanki.depgraph.graph.domain.ImportResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Import resolver for Kotlin sources and scripts.
 *
 * <p>Handles {@code import a.b.C} with an optional {@code as} alias and
 * backtick quoted segments. Resolution follows the package directory
 * layout, which Kotlin recommends but does not enforce, so files placed
 * elsewhere are treated as external.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class KotlinImportResolver implements ImportResolver {

    /** Matches an import directive, capturing the imported name. */
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "^\\s*import\\s+([\\w.`*]+)(?:\\s+as\\s+[\\w`]+)?",
            Pattern.MULTILINE);

    private static final List<String> TARGET_EXTENSIONS = List.of(
            ".kt", ".kts", ".java");

    @Override
    public String language() {
        return "Kotlin";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".kt", ".kts");
    }

    @Override
    public List<String> extractImports(final String content) {
        final List<String> imports = new ArrayList<>();
        final Matcher matcher = IMPORT_PATTERN.matcher(content);
        while (matcher.find()) {
            final String name = matcher.group(1).replace("`", "");
            if (!name.endsWith("*")) {
                imports.add(name);
            }
        }
        return imports;
    }

    @Override
    public Optional<String> resolve(final String specifier,
            final String fromPath, final CandidateFiles candidates) {
        if (specifier == null || specifier.isBlank()) {
            return Optional.empty();
        }
        return candidates.findByQualifiedName(specifier, TARGET_EXTENSIONS)
                .filter(found -> !found.equals(fromPath));
    }

    @Override
    public boolean isTestFile(final String path) {
        final String normalized = path.replace('\\', '/');
        final String name = normalized.substring(
                normalized.lastIndexOf('/') + 1);
        return name.endsWith("Test.kt")
                || name.endsWith("Tests.kt")
                || normalized.contains("/src/test/")
                || ConventionTestFileClassifier.hasTestDirectory(normalized);
    }

}
