package org.metadump.graph;

import java.util.Set;

import org.metadump.catalog.CatalogObjectRecord;
import org.metadump.catalog.ObjectKind;
import org.metadump.output.Section;

/**
 * One statement slot in an {@link EmissionSequence}: either the full definition of a record, or
 * the forward declaration that lets other objects reference it before it is fully defined.
 *
 * @param record the catalog object.
 * @param phase  which statement of the object this step produces.
 */
public record EmissionStep(CatalogObjectRecord record, Phase phase) {

    /**
     * The statement an object contributes at a given step. Declaration order matters: a shell
     * always precedes the full definition of the same object.
     */
    public enum Phase {
        /** Minimal forward declaration. */
        SHELL,
        /** Complete definition, including ownership, comment and privileges. */
        FULL
    }

    public static EmissionStep full(CatalogObjectRecord record) {
        return new EmissionStep(record, Phase.FULL);
    }

    public static EmissionStep shell(CatalogObjectRecord record) {
        return new EmissionStep(record, Phase.SHELL);
    }

    public boolean isShell() {
        return phase == Phase.SHELL;
    }

    /**
     * @return the kind tag recorded in the table of contents for this step.
     */
    public String tocKind() {
        return isShell() ? ObjectKind.SHELL_TOC_KIND : record.kind().tocKind();
    }

    /**
     * @return the sections this step is written to.
     */
    public Set<Section> sections() {
        return record.kind().sections();
    }

    @Override
    public String toString() {
        return phase + " " + record.describe();
    }
}
