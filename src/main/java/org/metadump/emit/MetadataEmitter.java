package org.metadump.emit;

import java.util.List;

import org.metadump.graph.EmissionStep;
import org.metadump.output.ByteCountingWriter;
import org.metadump.render.IStatementRenderer;
import org.metadump.render.RenderedStatement;
import org.metadump.toc.TableOfContents;
import org.metadump.toc.TocEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the steps of one section and records each in the table of contents.
 * <p>
 * Per step: render, note the writer offset, write the statement, write the annotation unless it
 * is empty, note the offset again, and add one TOC entry for the whole range. A step that renders
 * to nothing still gets a zero-length entry, so restore tooling can tell that the object was
 * considered.
 * <p>
 * Thread Safety: one emitter call writes one section on the calling thread. Several sections may
 * be emitted concurrently into the same {@link TableOfContents}.
 */
public class MetadataEmitter {

    private static final Logger log = LoggerFactory.getLogger(MetadataEmitter.class);

    private final IStatementRenderer renderer;
    private final TableOfContents toc;

    public MetadataEmitter(IStatementRenderer renderer, TableOfContents toc) {
        this.renderer = renderer;
        this.toc = toc;
    }

    /**
     * Emits steps in the given order.
     *
     * @param steps  the section's steps, in emission order.
     * @param writer the section's writer.
     * @return the number of entries recorded.
     * @throws org.metadump.output.WriteFaultException if the section cannot be written.
     */
    public int emit(List<EmissionStep> steps, ByteCountingWriter writer) {
        for (EmissionStep step : steps) {
            emit(step, writer);
        }
        writer.flush();
        log.debug("Emitted {} entries to {} section ({} bytes)", steps.size(), writer.section().tag(),
                writer.currentOffset());
        return steps.size();
    }

    /**
     * Emits a single step.
     *
     * @return the recorded entry.
     */
    public TocEntry emit(EmissionStep step, ByteCountingWriter writer) {
        RenderedStatement rendered = renderer.render(step);
        long start = writer.currentOffset();
        writer.append(rendered.statement());
        if (!rendered.annotation().isEmpty()) {
            writer.append(rendered.annotation());
        }
        long end = writer.currentOffset();
        if (start == end) {
            log.debug("No statement needed for {}", step);
        }
        return toc.addEntry(writer.section(), step.record().schema(), step.record().name(), step.tocKind(),
                start, end);
    }
}
