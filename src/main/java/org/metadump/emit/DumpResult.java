package org.metadump.emit;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.metadump.output.Section;

/**
 * Outcome of a successful dump run.
 *
 * @param objects      number of objects dumped.
 * @param steps        number of emission steps, shell declarations included.
 * @param tocEntries   number of TOC entries across all sections.
 * @param sectionBytes bytes written per section.
 * @param tocFile      where the table of contents was persisted.
 * @param elapsed      wall-clock duration of the run.
 */
public record DumpResult(int objects, int steps, int tocEntries, Map<Section, Long> sectionBytes,
                         Path tocFile, Duration elapsed) {

    public DumpResult {
        sectionBytes = Map.copyOf(sectionBytes);
    }
}
