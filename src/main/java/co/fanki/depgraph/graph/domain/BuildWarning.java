package co.fanki.depgraph.graph.domain;

/**
 * A file that was degraded to a standalone node during a build.
 *
 * @param path the affected file
 * @param reason why its dependencies could not be extracted
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BuildWarning(String path, String reason) {
}
