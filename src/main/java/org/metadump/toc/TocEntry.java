package org.metadump.toc;

import java.util.Objects;

import org.metadump.output.Section;

/**
 * Location of one object's statement text within a section stream.
 * <p>
 * Offsets are relative to the start of the section. A zero-length range records an object that
 * was considered but needed no statement; readers must accept it and extract empty text.
 *
 * @param section     the section stream.
 * @param schema      the object's schema; empty for global objects.
 * @param name        the object's name.
 * @param kind        the kind tag, e.g. {@code TYPE} or {@code SHELL TYPE}.
 * @param startOffset offset of the first byte.
 * @param endOffset   offset one past the last byte.
 */
public record TocEntry(Section section, String schema, String name, String kind, long startOffset, long endOffset) {

    public TocEntry {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        schema = Objects.requireNonNullElse(schema, "");
        if (startOffset < 0 || startOffset > endOffset) {
            throw new IllegalArgumentException("Invalid byte range [" + startOffset + ", " + endOffset
                    + ") for " + kind + " " + name);
        }
    }

    public long length() {
        return endOffset - startOffset;
    }

    public boolean isEmpty() {
        return startOffset == endOffset;
    }
}
