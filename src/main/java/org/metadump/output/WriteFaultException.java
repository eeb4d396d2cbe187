package org.metadump.output;

import org.metadump.MetadumpException;

/**
 * Thrown when a section stream cannot be written. The section file is incomplete from then on and
 * must not be referenced by a persisted table of contents.
 */
public class WriteFaultException extends MetadumpException {

    private final Section section;

    public WriteFaultException(Section section, String message, Throwable cause) {
        super("Write to " + section.tag() + " section failed: " + message, cause);
        this.section = section;
    }

    public Section getSection() {
        return section;
    }
}
