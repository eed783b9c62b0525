package co.fanki.depgraph.vcs.domain;

import co.fanki.depgraph.graph.domain.ContentSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads file content from the working tree.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class FileSystemContentSource implements ContentSource {

    @Override
    public byte[] read(final String path) throws IOException {
        return Files.readAllBytes(Path.of(path));
    }

}
