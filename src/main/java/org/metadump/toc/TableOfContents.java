package org.metadump.toc;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.metadump.output.Section;

/**
 * Index from (section, schema, name) to the byte ranges of emitted statements.
 * <p>
 * Shared by all section workers of a run. {@link #addEntry} is mutually exclusive, and each
 * section keeps its entries in the order they were added, which is its emission order. Lookups
 * are hash based and independent of insertion order.
 * <p>
 * One name may own several entries in a section, e.g. the shell declaration and the full
 * definition of a type, or several settings of one database. {@link #lookup} returns all of them.
 */
public class TableOfContents {

    private final Map<Section, List<TocEntry>> entriesBySection = new EnumMap<>(Section.class);
    private final Map<Key, List<TocEntry>> index = new HashMap<>();

    private record Key(Section section, String schema, String name) {
    }

    public TableOfContents() {
        for (Section section : Section.values()) {
            entriesBySection.put(section, new ArrayList<>());
        }
    }

    /**
     * Records the byte range of one emitted object.
     *
     * @return the recorded entry.
     * @throws IllegalArgumentException if the range is inverted or overlaps the previous entry of
     *                                  the same section.
     */
    public synchronized TocEntry addEntry(Section section, String schema, String name, String kind,
                                          long startOffset, long endOffset) {
        TocEntry entry = new TocEntry(section, schema, name, kind, startOffset, endOffset);
        List<TocEntry> sectionEntries = entriesBySection.get(section);
        if (!sectionEntries.isEmpty()) {
            TocEntry previous = sectionEntries.get(sectionEntries.size() - 1);
            if (startOffset < previous.endOffset()) {
                throw new IllegalArgumentException("Entry for " + kind + " " + name + " starts at " + startOffset
                        + ", before the end of the previous " + section.tag() + " entry at " + previous.endOffset());
            }
        }
        sectionEntries.add(entry);
        index.computeIfAbsent(new Key(section, entry.schema(), name), k -> new ArrayList<>(1)).add(entry);
        return entry;
    }

    /**
     * @return all entries of the object in emission order; empty if it was not emitted.
     */
    public synchronized List<TocEntry> lookup(Section section, String schema, String name) {
        List<TocEntry> found = index.get(new Key(section, schema == null ? "" : schema, name));
        return found == null ? List.of() : List.copyOf(found);
    }

    /**
     * @return the last entry of the object with the given kind tag.
     */
    public synchronized Optional<TocEntry> find(Section section, String schema, String name, String kind) {
        List<TocEntry> found = lookup(section, schema, name);
        for (int i = found.size() - 1; i >= 0; i--) {
            if (found.get(i).kind().equals(kind)) {
                return Optional.of(found.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * @return the entries of a section in emission order.
     */
    public synchronized List<TocEntry> entries(Section section) {
        return List.copyOf(entriesBySection.get(section));
    }

    /**
     * @return the end offset of the last entry in the section, or 0 if it has none.
     */
    public synchronized long endOffset(Section section) {
        List<TocEntry> sectionEntries = entriesBySection.get(section);
        return sectionEntries.isEmpty() ? 0 : sectionEntries.get(sectionEntries.size() - 1).endOffset();
    }

    public synchronized int size() {
        int size = 0;
        for (List<TocEntry> sectionEntries : entriesBySection.values()) {
            size += sectionEntries.size();
        }
        return size;
    }
}
