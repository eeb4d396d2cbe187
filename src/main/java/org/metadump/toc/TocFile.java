package org.metadump.toc;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.metadump.output.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Persists a {@link TableOfContents} as JSON and reads it back.
 * <p>
 * The file lists, per section in {@link Section} order, every entry in emission order:
 * <pre>
 * {
 *   "formatVersion": 1,
 *   "sections": {
 *     "global": [ { "schema": "", "name": "admin", "kind": "ROLE", "startOffset": 0, "endOffset": 96 } ],
 *     "predata": [ ... ],
 *     "postdata": [ ... ]
 *   }
 * }
 * </pre>
 * The same table always serializes to the same bytes. Writing goes through a temporary file and
 * an atomic move, so a reader never sees a partially written TOC.
 */
public final class TocFile {

    public static final int FORMAT_VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(TocFile.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private TocFile() {
    }

    private static final class Document {
        int formatVersion;
        Map<String, List<Entry>> sections;
    }

    private static final class Entry {
        String schema;
        String name;
        String kind;
        long startOffset;
        long endOffset;
    }

    /**
     * Serializes the table to its JSON form.
     */
    public static String toJson(TableOfContents toc) {
        Document document = new Document();
        document.formatVersion = FORMAT_VERSION;
        document.sections = new LinkedHashMap<>();
        for (Section section : Section.values()) {
            List<Entry> entries = new ArrayList<>();
            for (TocEntry tocEntry : toc.entries(section)) {
                Entry entry = new Entry();
                entry.schema = tocEntry.schema();
                entry.name = tocEntry.name();
                entry.kind = tocEntry.kind();
                entry.startOffset = tocEntry.startOffset();
                entry.endOffset = tocEntry.endOffset();
                entries.add(entry);
            }
            document.sections.put(section.tag(), entries);
        }
        return GSON.toJson(document);
    }

    /**
     * Writes the table to a file atomically.
     *
     * @param toc  the table to persist.
     * @param file the destination, replaced if it exists.
     * @throws IOException if the file cannot be written.
     */
    public static void write(TableOfContents toc, Path file) throws IOException {
        Path target = file.toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tempFile = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
            writer.write(toJson(toc));
        }
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after move failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
        log.debug("Wrote table of contents with {} entries to {}", toc.size(), target);
    }

    /**
     * Reads a persisted table. Section data is not touched.
     *
     * @param file the TOC file.
     * @return the table, with entries in their original order.
     * @throws IOException if the file cannot be read or is malformed.
     */
    public static TableOfContents read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    static TableOfContents fromJson(Reader reader) throws IOException {
        Document document;
        try {
            document = GSON.fromJson(reader, Document.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed table of contents: " + e.getMessage(), e);
        }
        if (document == null || document.sections == null) {
            throw new IOException("Table of contents has no sections");
        }
        if (document.formatVersion != FORMAT_VERSION) {
            throw new IOException("Unsupported table of contents format version: " + document.formatVersion);
        }
        TableOfContents toc = new TableOfContents();
        try {
            for (Map.Entry<String, List<Entry>> sectionEntries : document.sections.entrySet()) {
                Section section = Section.fromTag(sectionEntries.getKey());
                if (sectionEntries.getValue() == null) {
                    continue;
                }
                for (Entry entry : sectionEntries.getValue()) {
                    toc.addEntry(section, entry.schema, entry.name, entry.kind, entry.startOffset, entry.endOffset);
                }
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IOException("Invalid table of contents entry: " + e.getMessage(), e);
        }
        return toc;
    }
}
