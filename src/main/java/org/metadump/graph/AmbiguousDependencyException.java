package org.metadump.graph;

import java.util.List;

import org.metadump.MetadumpException;

/**
 * Thrown when a dependency name matches more than one object of the run.
 * <p>
 * This indicates inconsistent catalog data. The resolver never picks one of the candidates.
 */
public class AmbiguousDependencyException extends MetadumpException {

    private final String dependencyName;
    private final List<Long> candidateOids;

    /**
     * @param dependencyName the qualified name that could not be resolved uniquely.
     * @param candidateOids  the oids of all objects carrying that name, ascending.
     */
    public AmbiguousDependencyException(String dependencyName, List<Long> candidateOids) {
        super("Dependency '" + dependencyName + "' is ambiguous, candidate oids: " + candidateOids);
        this.dependencyName = dependencyName;
        this.candidateOids = List.copyOf(candidateOids);
    }

    public String getDependencyName() {
        return dependencyName;
    }

    public List<Long> getCandidateOids() {
        return candidateOids;
    }
}
