package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a set of files into a closed {@link DependencyGraph}.
 *
 * <p>Every input file becomes a node. Files without a registered resolver
 * and files whose content cannot be read or decoded as UTF-8 become nodes
 * without dependencies; the latter are reported as {@link BuildWarning}s.
 * A resolver that returns a path outside the input set fails the whole
 * build with a {@link GraphClosureException}.</p>
 *
 * <p>A builder holds no state between calls and may be shared.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphBuilder.class);

    private final ImportResolverRegistry registry;

    /**
     * Creates a builder.
     *
     * @param theRegistry the resolvers to use, by extension
     */
    public GraphBuilder(final ImportResolverRegistry theRegistry) {
        registry = Preconditions.requireNonNull(theRegistry,
                "Resolver registry is required");
    }

    /**
     * Builds the graph of the given files.
     *
     * @param paths the files, in any form; they are made absolute and
     *              normalized, duplicates are dropped
     * @param source where file content is read from
     * @return the graph with warnings and unsupported files
     * @throws GraphClosureException if a resolver breaks the closure
     */
    public BuildResult build(final Collection<String> paths,
            final ContentSource source) {
        Preconditions.requireNoNulls(paths, "Paths are required");
        Preconditions.requireNonNull(source, "Content source is required");

        final Set<String> files = new LinkedHashSet<>();
        for (final String path : paths) {
            files.add(normalize(path));
        }
        final CandidateFiles candidates = new CandidateFiles(files, source);

        LOG.debug("Building graph for {} files", files.size());

        final DependencyGraph.Builder builder = DependencyGraph.builder();
        final List<BuildWarning> warnings = new ArrayList<>();
        final List<String> unsupported = new ArrayList<>();

        for (final String file : files) {
            final Optional<ImportResolver> resolver = registry.forPath(file);
            if (resolver.isEmpty()) {
                LOG.debug("No resolver for {}", file);
                unsupported.add(file);
                builder.addNode(file);
                continue;
            }

            final String content;
            try {
                content = decode(source.read(file));
            } catch (final IOException e) {
                LOG.warn("Could not read {}, keeping it without dependencies:"
                        + " {}", file, e.getMessage());
                warnings.add(new BuildWarning(file, describe(e)));
                builder.addNode(file);
                continue;
            }

            builder.addNode(file, resolveImports(resolver.get(), file,
                    content, candidates));
        }

        final DependencyGraph graph = builder.build();

        LOG.info("Graph built: {} nodes, {} edges, {} unsupported, {} warnings",
                graph.nodeCount(), graph.edgeCount(), unsupported.size(),
                warnings.size());

        return new BuildResult(graph, warnings, unsupported);
    }

    private Set<String> resolveImports(final ImportResolver resolver,
            final String file, final String content,
            final CandidateFiles candidates) {
        final Set<String> dependencies = new LinkedHashSet<>();
        for (final String specifier : resolver.extractImports(content)) {
            dependencies.addAll(resolver.resolveAll(specifier, file,
                    candidates));
        }
        LOG.debug("{}: {} dependencies", file, dependencies.size());
        return dependencies;
    }

    /**
     * Normalizes a path to its absolute form.
     *
     * @param path the raw path
     * @return the absolute, normalized path
     * @throws IllegalArgumentException if the path is blank or malformed
     */
    public static String normalize(final String path) {
        Preconditions.requireNonBlank(path, "Path must not be blank");
        try {
            return Path.of(path).toAbsolutePath().normalize().toString();
        } catch (final InvalidPathException e) {
            throw new IllegalArgumentException("Invalid path: " + path, e);
        }
    }

    private static String decode(final byte[] bytes)
            throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static String describe(final IOException e) {
        if (e instanceof CharacterCodingException) {
            return "content is not valid UTF-8";
        }
        return e.getMessage() == null
                ? e.getClass().getSimpleName() : e.getMessage();
    }

}
