package org.metadump.output;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Append-only text stream for one output section that tracks how many bytes it has written.
 * <p>
 * Text is encoded as UTF-8 and the offset advances by the encoded byte length, not the character
 * count. Consecutive appends therefore cover adjacent byte ranges: whatever {@link #currentOffset()}
 * returns before an append is exactly where that append's first byte lands in the file.
 * <p>
 * The first I/O failure faults the writer. The failure surfaces as {@link WriteFaultException}
 * and every later write is rejected the same way, since the section file is no longer usable.
 * <p>
 * Thread Safety: Not thread-safe. Each section is written by a single worker.
 */
public class ByteCountingWriter implements Closeable {

    private final Section section;
    private final OutputStream delegate;
    private long offset;
    private IOException fault;
    private boolean closed;

    /**
     * Wraps an existing stream. The writer takes ownership and closes it.
     *
     * @param section the section being written, for error reporting.
     * @param out     the destination stream, positioned at the start of the section.
     */
    public ByteCountingWriter(Section section, OutputStream out) {
        this.section = Objects.requireNonNull(section, "section");
        this.delegate = Objects.requireNonNull(out, "out");
    }

    /**
     * Creates (or truncates) a section file and opens a buffered writer on it.
     *
     * @param section the section being written.
     * @param file    the destination file; parent directories are created.
     * @return the writer.
     * @throws WriteFaultException if the file cannot be opened.
     */
    public static ByteCountingWriter open(Section section, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            OutputStream out = new BufferedOutputStream(Files.newOutputStream(file,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE));
            return new ByteCountingWriter(section, out);
        } catch (IOException e) {
            throw new WriteFaultException(section, "cannot open " + file, e);
        }
    }

    /**
     * @return the number of bytes written so far, which is the offset of the next byte.
     */
    public long currentOffset() {
        return offset;
    }

    public Section section() {
        return section;
    }

    /**
     * Appends text.
     *
     * @param text the text to write; empty text is a no-op.
     * @throws WriteFaultException if the write fails or the writer already faulted.
     */
    public void append(String text) {
        ensureWritable();
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (bytes.length == 0) {
            return;
        }
        try {
            delegate.write(bytes);
        } catch (IOException e) {
            fault = e;
            throw new WriteFaultException(section, e.getMessage(), e);
        }
        offset += bytes.length;
    }

    /**
     * Appends formatted text, see {@link String#format(String, Object...)}.
     */
    public void printf(String format, Object... args) {
        append(String.format(format, args));
    }

    /**
     * Flushes buffered bytes to the destination.
     *
     * @throws WriteFaultException if flushing fails.
     */
    public void flush() {
        ensureWritable();
        try {
            delegate.flush();
        } catch (IOException e) {
            fault = e;
            throw new WriteFaultException(section, e.getMessage(), e);
        }
    }

    /**
     * @return {@code true} once a write has failed.
     */
    public boolean isFaulted() {
        return fault != null;
    }

    /**
     * Flushes and closes the destination. Closing twice is a no-op.
     *
     * @throws WriteFaultException if the final flush or close fails.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            delegate.close();
        } catch (IOException e) {
            if (fault == null) {
                fault = e;
            }
            throw new WriteFaultException(section, "close failed: " + e.getMessage(), e);
        }
    }

    private void ensureWritable() {
        if (fault != null) {
            throw new WriteFaultException(section, "stream already faulted", fault);
        }
        if (closed) {
            throw new IllegalStateException("Writer for " + section.tag() + " section is closed");
        }
    }
}
