package co.fanki.depgraph.graph.domain.java;

import co.fanki.depgraph.graph.domain.CandidateFiles;
import co.fanki.depgraph.graph.domain.ConventionTestFileClassifier;
import co.fanki.depgraph.graph.domain.ImportResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Import resolver for Java sources.
 *
 * <p>Reads {@code import} statements up to the first type declaration and
 * maps each imported class to the file declaring it, matched by the
 * package directory layout. Wildcard imports are ignored since they name
 * a package, not a file.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JavaImportResolver implements ImportResolver {

    /** Java sources may import Kotlin classes in mixed modules. */
    private static final List<String> TARGET_EXTENSIONS = List.of(
            ".java", ".kt");

    @Override
    public String language() {
        return "Java";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".java");
    }

    @Override
    public List<String> extractImports(final String content) {
        final List<String> imports = new ArrayList<>();
        for (final String line : content.split("\\R")) {
            final String trimmed = line.trim();

            if (isTypeDeclaration(trimmed)) {
                break;
            }

            final String importedClass = parseImportLine(trimmed);
            if (importedClass != null) {
                imports.add(importedClass);
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
        // Importing a nested type of the same file is not a dependency.
        return candidates.findByQualifiedName(specifier, TARGET_EXTENSIONS)
                .filter(found -> !found.equals(fromPath));
    }

    @Override
    public boolean isTestFile(final String path) {
        final String normalized = path.replace('\\', '/');
        final String name = normalized.substring(
                normalized.lastIndexOf('/') + 1);
        return name.endsWith("Test.java")
                || name.endsWith("Tests.java")
                || normalized.contains("/src/test/")
                || ConventionTestFileClassifier.hasTestDirectory(normalized);
    }

    /**
     * Parses an import line to extract the fully-qualified class name.
     *
     * @param importLine the trimmed line
     * @return the class name, or null if not an import or a wildcard
     */
    String parseImportLine(final String importLine) {
        if (importLine == null || !importLine.startsWith("import ")) {
            return null;
        }

        String line = importLine.substring("import ".length()).trim();

        final boolean isStatic = line.startsWith("static ");
        if (isStatic) {
            line = line.substring("static ".length()).trim();
        }

        final int semicolon = line.indexOf(';');
        if (semicolon >= 0) {
            line = line.substring(0, semicolon).trim();
        }

        if (line.endsWith(".*")) {
            return null;
        }

        // Static imports name a member; the class is the part before it.
        if (isStatic) {
            final int lastDot = line.lastIndexOf('.');
            if (lastDot > 0) {
                line = line.substring(0, lastDot);
            }
        }

        return line.isBlank() ? null : line;
    }

    private static boolean isTypeDeclaration(final String line) {
        if (line.startsWith("//") || line.startsWith("*")
                || line.startsWith("/*") || line.startsWith("import ")) {
            return false;
        }
        return line.contains("class ")
                || line.contains("interface ")
                || line.contains("enum ")
                || line.contains("record ");
    }

}
