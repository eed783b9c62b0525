package co.fanki.depgraph.graph.domain;

/**
 * Decides whether a file is a test, from its path alone.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface TestFileClassifier {

    /**
     * Checks if a path denotes a test file.
     *
     * @param path the file path
     * @return true if the file is a test
     */
    boolean isTest(String path);

}
