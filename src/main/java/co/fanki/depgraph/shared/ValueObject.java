package co.fanki.depgraph.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the domain model.
 *
 * <p>Value objects are immutable and compared by their attributes. In
 * this codebase they are records (edges, cycles, file statistics) that
 * validate their components in the compact constructor.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
