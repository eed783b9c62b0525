package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;
import co.fanki.depgraph.shared.ValueObject;

/**
 * A directed edge between two files, used as a lookup key for edge
 * metadata.
 *
 * @param from the dependent file
 * @param to the file it depends on
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileEdge(String from, String to) implements ValueObject {

    /** Validates both endpoints. */
    public FileEdge {
        Preconditions.requireNonBlank(from, "Edge source is required");
        Preconditions.requireNonBlank(to, "Edge target is required");
    }

}
