package org.metadump;

/**
 * Base class of the faults that abort a dump run.
 * <p>
 * These are unchecked because none of them can be recovered from inside the run: the surrounding
 * orchestration decides whether to retry the whole run, and the partial output is discarded.
 */
public abstract class MetadumpException extends RuntimeException {

    protected MetadumpException(String message) {
        super(message);
    }

    protected MetadumpException(String message, Throwable cause) {
        super(message, cause);
    }
}
