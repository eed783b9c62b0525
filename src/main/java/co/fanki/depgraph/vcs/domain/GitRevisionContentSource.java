package co.fanki.depgraph.vcs.domain;

import co.fanki.depgraph.graph.domain.ContentSource;
import co.fanki.depgraph.shared.Preconditions;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads file content as it was at a given revision.
 *
 * <p>Uses the repository it was created with and does not close it.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GitRevisionContentSource implements ContentSource {

    private final GitRepository repository;

    private final String revision;

    /**
     * Creates the source.
     *
     * @param theRepository the open repository
     * @param theRevision the revision to read from
     */
    public GitRevisionContentSource(final GitRepository theRepository,
            final String theRevision) {
        repository = Preconditions.requireNonNull(theRepository,
                "Repository is required");
        revision = Preconditions.requireNonBlank(theRevision,
                "Revision is required");
    }

    /**
     * {@inheritDoc}
     *
     * @throws FileNotFoundException if the path is outside of the work
     *         tree or not part of the revision
     */
    @Override
    public byte[] read(final String path) throws IOException {
        if (!Path.of(path).toAbsolutePath().normalize()
                .startsWith(repository.workTree())) {
            throw new FileNotFoundException(path + " is outside of "
                    + repository.workTree());
        }
        return repository.readFile(revision, path);
    }

    public String revision() {
        return revision;
    }

}
