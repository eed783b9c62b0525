package co.fanki.depgraph.graph.domain.python;

import co.fanki.depgraph.graph.domain.CandidateFiles;
import co.fanki.depgraph.graph.domain.ConventionTestFileClassifier;
import co.fanki.depgraph.graph.domain.ImportResolver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Import resolver for Python modules.
 *
 * <p>Each imported module becomes one specifier. For
 * {@code from X import a, b} the specifiers are {@code X.a} and
 * {@code X.b}: when {@code a} is a submodule its file is the dependency,
 * otherwise resolution falls back to the module {@code X} itself.
 * Relative specifiers keep their leading dots and resolve against the
 * importing file's package; absolute ones match by path suffix.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonImportResolver implements ImportResolver {

    @Override
    public String language() {
        return "Python";
    }

    @Override
    public Set<String> extensions() {
        return Set.of(".py");
    }

    @Override
    public List<String> extractImports(final String content) {
        final List<String> imports = new ArrayList<>();
        for (final String statement : logicalLines(content)) {
            if (statement.startsWith("import ")) {
                parseImport(statement.substring("import ".length()), imports);
            } else if (statement.startsWith("from ")) {
                parseFromImport(statement.substring("from ".length()),
                        imports);
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

        int dots = 0;
        while (dots < specifier.length() && specifier.charAt(dots) == '.') {
            dots++;
        }
        final String module = specifier.substring(dots);

        if (dots == 0) {
            return resolveAbsolute(module, candidates);
        }
        return resolveRelative(dots, module, fromPath, candidates);
    }

    @Override
    public boolean isTestFile(final String path) {
        final String normalized = path.replace('\\', '/');
        final String name = normalized.substring(
                normalized.lastIndexOf('/') + 1);
        return (name.startsWith("test_") && name.endsWith(".py"))
                || name.endsWith("_test.py")
                || ConventionTestFileClassifier.hasTestDirectory(normalized);
    }

    private Optional<String> resolveAbsolute(final String module,
            final CandidateFiles candidates) {
        String current = module;
        while (!current.isEmpty()) {
            final String relative = current.replace('.', '/');
            final Optional<String> found = candidates.findBySuffix(
                    relative + ".py")
                    .or(() -> candidates.findBySuffix(
                            relative + "/__init__.py"));
            if (found.isPresent()) {
                return found;
            }
            current = parentModule(current);
        }
        return Optional.empty();
    }

    private Optional<String> resolveRelative(final int dots,
            final String module, final String fromPath,
            final CandidateFiles candidates) {
        Path directory = Path.of(fromPath).getParent();
        for (int i = 1; i < dots && directory != null; i++) {
            directory = directory.getParent();
        }
        if (directory == null) {
            return Optional.empty();
        }

        String current = module;
        while (true) {
            final Path target = current.isEmpty()
                    ? directory
                    : directory.resolve(current.replace('.', '/'));
            final String asModule = target + ".py";
            final String asPackage = target.resolve("__init__.py").toString();
            if (!current.isEmpty() && candidates.contains(asModule)) {
                return Optional.of(asModule);
            }
            if (candidates.contains(asPackage)) {
                return Optional.of(asPackage);
            }
            if (current.isEmpty()) {
                return Optional.empty();
            }
            current = parentModule(current);
        }
    }

    private static String parentModule(final String module) {
        final int dot = module.lastIndexOf('.');
        return dot < 0 ? "" : module.substring(0, dot);
    }

    /** Parses the body of {@code import a.b as c, d}. */
    private static void parseImport(final String body,
            final List<String> imports) {
        for (final String part : body.split(",")) {
            final String name = stripAlias(part);
            if (!name.isEmpty()) {
                imports.add(name);
            }
        }
    }

    /** Parses the body of {@code from X import a, b}. */
    private static void parseFromImport(final String body,
            final List<String> imports) {
        final int keyword = body.indexOf(" import ");
        if (keyword < 0) {
            return;
        }
        final String module = body.substring(0, keyword).trim();
        final String names = body.substring(keyword + " import ".length())
                .replace("(", "").replace(")", "").trim();
        if (module.isEmpty()) {
            return;
        }

        if (names.equals("*")) {
            imports.add(module);
            return;
        }

        final String prefix = module.endsWith(".") ? module : module + ".";
        for (final String part : names.split(",")) {
            final String name = stripAlias(part);
            if (!name.isEmpty()) {
                imports.add(prefix + name);
            }
        }
    }

    private static String stripAlias(final String part) {
        final String trimmed = part.trim();
        final int alias = trimmed.indexOf(" as ");
        return alias < 0 ? trimmed : trimmed.substring(0, alias).trim();
    }

    private static boolean isTopLevelImport(final String line) {
        return line.startsWith("import ") || line.startsWith("from ");
    }

    /**
     * Collects import statements, dropping comments and joining
     * parenthesized and backslash continued lines.
     *
     * <p>An import starting at column zero always opens a new statement,
     * so an unclosed parenthesis only loses the statement it belongs
     * to.</p>
     */
    private static List<String> logicalLines(final String content) {
        final List<String> statements = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        int depth = 0;
        for (final String raw : content.split("\\R")) {
            String line = raw;
            final int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            final String trimmed = line.trim();
            if (current.length() > 0 && isTopLevelImport(line)) {
                statements.add(current.toString().trim());
                current.setLength(0);
                depth = 0;
            }
            if (current.length() == 0 && !trimmed.startsWith("import ")
                    && !trimmed.startsWith("from ")) {
                continue;
            }
            boolean continued = false;
            if (line.stripTrailing().endsWith("\\")) {
                line = line.stripTrailing();
                line = line.substring(0, line.length() - 1);
                continued = true;
            }
            for (final char c : line.toCharArray()) {
                if (c == '(') {
                    depth++;
                } else if (c == ')' && depth > 0) {
                    depth--;
                }
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(line.trim());
            if (!continued && depth == 0) {
                statements.add(current.toString().trim());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            statements.add(current.toString().trim());
        }
        return statements;
    }

}
