package org.metadump.emit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.metadump.catalog.CatalogObjectRecord;
import org.metadump.graph.DependencyGraph;
import org.metadump.graph.DependencyResolver;
import org.metadump.graph.EmissionSequence;
import org.metadump.graph.TopologicalSequencer;
import org.metadump.output.ByteCountingWriter;
import org.metadump.output.Section;
import org.metadump.render.IStatementRenderer;
import org.metadump.toc.TableOfContents;
import org.metadump.toc.TocFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one complete metadata dump.
 * <p>
 * Dependency resolution and sequencing happen once on the calling thread. Each section is then
 * emitted by its own worker into its own file, all of them recording into one shared
 * {@link TableOfContents}. Workers share nothing else that is mutable.
 * <p>
 * A run is all or nothing. If any section fails, the remaining sections are allowed to finish,
 * every section file of the run is deleted, no TOC is written, and the first failure is rethrown.
 * On success the TOC is persisted once, after all sections are closed.
 */
public class DumpRunner {

    private static final Logger log = LoggerFactory.getLogger(DumpRunner.class);

    private final DumpSettings settings;
    private final IStatementRenderer renderer;
    private final DependencyResolver resolver = new DependencyResolver();
    private final TopologicalSequencer sequencer = new TopologicalSequencer();

    public DumpRunner(DumpSettings settings, IStatementRenderer renderer) {
        this.settings = settings;
        this.renderer = renderer;
    }

    /**
     * Dumps the given records.
     *
     * @param records all catalog records of the run.
     * @return the run summary.
     * @throws org.metadump.graph.AmbiguousDependencyException if a dependency cannot be resolved uniquely.
     * @throws org.metadump.graph.UnbreakableCycleException    if the records cannot be ordered.
     * @throws org.metadump.output.WriteFaultException         if a section cannot be written.
     * @throws UncheckedIOException                            if the TOC cannot be persisted.
     */
    public DumpResult run(Collection<CatalogObjectRecord> records) {
        long startNanos = System.nanoTime();
        DependencyGraph graph = resolver.resolve(records);
        EmissionSequence sequence = sequencer.sequence(graph);
        log.info("Dumping {} objects in {} steps to {}", graph.size(), sequence.size(), settings.outputDirectory());

        TableOfContents toc = new TableOfContents();
        MetadataEmitter emitter = new MetadataEmitter(renderer, toc);
        Map<Section, Long> sectionBytes = emitSections(sequence, emitter);

        try {
            TocFile.write(toc, settings.tocFile());
        } catch (IOException e) {
            discardOutputs();
            throw new UncheckedIOException("Failed to persist table of contents to " + settings.tocFile(), e);
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        log.info("Dump complete: {} TOC entries, {} in {} ms", toc.size(), sectionBytes, elapsed.toMillis());
        return new DumpResult(graph.size(), sequence.size(), toc.size(), sectionBytes, settings.tocFile(), elapsed);
    }

    private Map<Section, Long> emitSections(EmissionSequence sequence, MetadataEmitter emitter) {
        AtomicInteger threadCounter = new AtomicInteger();
        int poolSize = Math.min(settings.workers(), Section.values().length);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, "section-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        Map<Section, Future<Long>> futures = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            futures.put(section, executor.submit(() -> emitSection(section, sequence, emitter)));
        }
        executor.shutdown();

        Map<Section, Long> sectionBytes = new EnumMap<>(Section.class);
        RuntimeException failure = null;
        for (Map.Entry<Section, Future<Long>> entry : futures.entrySet()) {
            try {
                sectionBytes.put(entry.getKey(), entry.getValue().get());
            } catch (ExecutionException e) {
                RuntimeException cause = asRuntime(e.getCause());
                log.error("Emission of {} section failed: {}", entry.getKey().tag(), cause.getMessage());
                if (failure == null) {
                    failure = cause;
                } else {
                    failure.addSuppressed(cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
                if (failure == null) {
                    failure = new IllegalStateException("Interrupted while emitting sections", e);
                }
                break;
            }
        }

        if (failure != null) {
            discardOutputs();
            throw failure;
        }
        return sectionBytes;
    }

    private long emitSection(Section section, EmissionSequence sequence, MetadataEmitter emitter) {
        try (ByteCountingWriter writer = ByteCountingWriter.open(section, settings.destination(section))) {
            emitter.emit(sequence.forSection(section), writer);
            return writer.currentOffset();
        }
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException(cause.getMessage(), cause);
    }

    /**
     * Deletes every file this run may have produced. A TOC must never point into a section that
     * did not complete.
     */
    private void discardOutputs() {
        for (Path destination : settings.destinations().values()) {
            deleteQuietly(destination);
        }
        deleteQuietly(settings.tocFile());
    }

    private static void deleteQuietly(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Discarded {}", file);
            }
        } catch (IOException e) {
            log.warn("Failed to discard output file {}: {}", file, e.getMessage());
        }
    }
}
