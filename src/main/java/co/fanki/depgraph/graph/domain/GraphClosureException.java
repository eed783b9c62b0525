package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.DomainException;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Raised when a dependency list names a path that is not a node.
 *
 * <p>Indicates a resolver defect, never a user-input problem. The build
 * is aborted and no partial graph is returned.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphClosureException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final transient Map<String, Set<String>> danglingTargets;

    /**
     * Creates a new closure exception.
     *
     * @param theDanglingTargets source node to the targets that are not
     *                           nodes of the graph
     */
    public GraphClosureException(
            final Map<String, Set<String>> theDanglingTargets) {
        super("Dependency targets missing from graph: " + theDanglingTargets,
                "CLOSURE_VIOLATION");
        this.danglingTargets = Collections.unmodifiableMap(theDanglingTargets);
    }

    /**
     * Returns the offending edges grouped by source node.
     *
     * @return unmodifiable map of source to missing targets
     */
    public Map<String, Set<String>> danglingTargets() {
        return danglingTargets;
    }

}
