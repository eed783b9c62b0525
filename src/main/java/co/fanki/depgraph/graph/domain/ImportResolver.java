package co.fanki.depgraph.graph.domain;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Language-specific import extraction and resolution.
 *
 * <p>Implementations are registered by file extension in an
 * {@link ImportResolverRegistry}. The {@link GraphBuilder} depends only
 * on this contract, never on a concrete language.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ImportResolver {

    /**
     * Returns the language name.
     *
     * @return the language (e.g., "Java", "Python")
     */
    String language();

    /**
     * Returns the file extensions handled by this resolver.
     *
     * @return lower-case extensions including the dot (e.g., ".java")
     */
    Set<String> extensions();

    /**
     * Extracts the raw import specifiers from a file.
     *
     * @param content the decoded file content
     * @return the specifiers in source order, possibly with duplicates
     */
    List<String> extractImports(String content);

    /**
     * Resolves one specifier to a file of the input set.
     *
     * @param specifier the raw specifier as extracted
     * @param fromPath the importing file
     * @param candidates the full input file set
     * @return the resolved file, empty for external or unknown imports
     */
    Optional<String> resolve(String specifier, String fromPath,
            CandidateFiles candidates);

    /**
     * Resolves one specifier to every file of the input set it names.
     *
     * <p>Languages whose imports name a package rather than a file
     * override this. The default returns the single file found by
     * {@link #resolve(String, String, CandidateFiles)}.</p>
     *
     * @param specifier the raw specifier as extracted
     * @param fromPath the importing file
     * @param candidates the full input file set
     * @return the resolved files, empty for external or unknown imports
     */
    default List<String> resolveAll(final String specifier,
            final String fromPath, final CandidateFiles candidates) {
        return resolve(specifier, fromPath, candidates)
                .map(List::of)
                .orElse(List.of());
    }

    /**
     * Checks if a path follows this language's test file conventions.
     *
     * @param path the file path
     * @return true if the file is a test
     */
    boolean isTestFile(String path);

}
