package co.fanki.depgraph.graph.domain;

import java.io.IOException;

/**
 * Reads the bytes of a file, from the working tree or from a revision.
 *
 * <p>The engine never decides where content comes from; callers hand it
 * the source matching the files they selected.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface ContentSource {

    /**
     * Reads the content of a file.
     *
     * @param path the absolute, normalized file path
     * @return the file bytes
     * @throws IOException if the content is unavailable
     */
    byte[] read(String path) throws IOException;

}
