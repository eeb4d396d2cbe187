package org.metadump.graph;

import java.util.List;

import org.metadump.MetadumpException;

/**
 * Thrown when objects depend on each other in a cycle that shell promotion cannot break, for
 * example a cycle made only of functions or one that runs through two domains.
 */
public class UnbreakableCycleException extends MetadumpException {

    private final List<String> members;

    /**
     * @param members descriptions of every object in the cycle, in (schema, name, oid) order.
     */
    public UnbreakableCycleException(List<String> members) {
        super("Dependency cycle cannot be broken: " + String.join(", ", members));
        this.members = List.copyOf(members);
    }

    public List<String> getMembers() {
        return members;
    }
}
