package org.metadump.toc;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import org.metadump.output.Section;

/**
 * Restore-side reader that pulls individual statements out of section files using only the
 * table of contents. Each extraction reads exactly the entry's byte range at its offset; nothing
 * before it in the file is read.
 */
public class SectionExtractor {

    private final TableOfContents toc;
    private final Map<Section, Path> sectionFiles;

    /**
     * @param toc          the table of contents of the dump.
     * @param sectionFiles the section files of the same dump.
     */
    public SectionExtractor(TableOfContents toc, Map<Section, Path> sectionFiles) {
        this.toc = toc;
        this.sectionFiles = new EnumMap<>(Section.class);
        this.sectionFiles.putAll(sectionFiles);
    }

    /**
     * Reads the statement text of one entry.
     *
     * @param entry an entry of this extractor's table.
     * @return the text; empty for zero-length entries.
     * @throws IOException if the section file is missing or shorter than the entry's range.
     */
    public String extract(TocEntry entry) throws IOException {
        if (entry.isEmpty()) {
            return "";
        }
        Path file = sectionFiles.get(entry.section());
        if (file == null) {
            throw new IOException("No file configured for the " + entry.section().tag() + " section");
        }
        if (entry.length() > Integer.MAX_VALUE) {
            throw new IOException("Entry too large to extract: " + entry.length() + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) entry.length());
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long position = entry.startOffset();
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    throw new IOException("Section file " + file + " ends at " + position
                            + ", entry " + entry.name() + " expects " + entry.endOffset());
                }
                position += read;
            }
        }
        return new String(buffer.array(), StandardCharsets.UTF_8);
    }

    /**
     * Reads all statements of one object, e.g. a shell declaration followed by the full definition.
     *
     * @return the texts in emission order; empty if the object is not in the table.
     */
    public List<String> extract(Section section, String schema, String name) throws IOException {
        List<String> texts = new ArrayList<>();
        for (TocEntry entry : toc.lookup(section, schema, name)) {
            texts.add(extract(entry));
        }
        return texts;
    }

    /**
     * Concatenates the statements of all entries of a section that match a filter, in emission
     * order. This is the building block for selective restore.
     */
    public String extractMatching(Section section, Predicate<TocEntry> filter) throws IOException {
        StringBuilder script = new StringBuilder();
        for (TocEntry entry : toc.entries(section)) {
            if (filter.test(entry)) {
                script.append(extract(entry));
            }
        }
        return script.toString();
    }
}
