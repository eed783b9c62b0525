package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;
import co.fanki.depgraph.shared.ValueObject;

import java.util.List;

/**
 * One strongly connected component reported as a dependency cycle.
 *
 * <p>The path starts at the lexicographically smallest member and
 * follows depth-first discovery order inside the component. A single
 * path denotes a file that imports itself.</p>
 *
 * @param path the ordered member files
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Cycle(List<String> path) implements ValueObject {

    /** Validates and copies the path. */
    public Cycle {
        Preconditions.requireNoNulls(path, "Cycle path is required");
        Preconditions.require(!path.isEmpty(), "Cycle path must not be empty");
        path = List.copyOf(path);
    }

    /** Returns the first file of the cycle path. */
    public String start() {
        return path.get(0);
    }

    /** Returns the number of files in the cycle. */
    public int size() {
        return path.size();
    }

    /**
     * Checks if a file belongs to this cycle.
     *
     * @param file the file path
     * @return true if the file is a member
     */
    public boolean contains(final String file) {
        return path.contains(file);
    }

}
