package org.metadump.output;

import java.util.Locale;

/**
 * The independent output streams that together make up one metadata dump.
 * <p>
 * Each section is written by its own {@link ByteCountingWriter}, and every TOC offset is relative
 * to the start of the section it was recorded for.
 */
public enum Section {
    /** Cluster-wide objects: databases, resource management, roles, tablespaces. */
    GLOBAL,
    /** Schema objects that must exist before table data is loaded. */
    PREDATA,
    /** Schema objects that are created after table data is loaded. */
    POSTDATA;

    /**
     * Returns the lower-case tag used in configuration keys and in the persisted TOC.
     *
     * @return the section tag, e.g. {@code "predata"}.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a section tag, case-insensitively.
     *
     * @param tag the tag, e.g. {@code "global"}.
     * @return the matching section.
     * @throws IllegalArgumentException if no section has that tag.
     */
    public static Section fromTag(String tag) {
        for (Section section : values()) {
            if (section.tag().equalsIgnoreCase(tag)) {
                return section;
            }
        }
        throw new IllegalArgumentException("Unknown section: " + tag);
    }
}
