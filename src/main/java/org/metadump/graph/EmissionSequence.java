package org.metadump.graph;

import java.util.List;
import java.util.stream.Collectors;

import org.metadump.catalog.CatalogObjectRecord;
import org.metadump.output.Section;

/**
 * The order in which statements are emitted. Every full definition appears after all of its
 * dependencies, and every shell declaration before the full definition of the same object.
 *
 * @param steps the emission steps in order.
 */
public record EmissionSequence(List<EmissionStep> steps) {

    public EmissionSequence {
        steps = List.copyOf(steps);
    }

    /**
     * @return the records of all full definitions, in emission order.
     */
    public List<CatalogObjectRecord> records() {
        return steps.stream()
                .filter(step -> !step.isShell())
                .map(EmissionStep::record)
                .collect(Collectors.toList());
    }

    /**
     * @param section an output section.
     * @return the steps written to that section, in emission order.
     */
    public List<EmissionStep> forSection(Section section) {
        return steps.stream()
                .filter(step -> step.sections().contains(section))
                .collect(Collectors.toList());
    }

    public int size() {
        return steps.size();
    }

    public long shellCount() {
        return steps.stream().filter(EmissionStep::isShell).count();
    }
}
