package org.metadump.render;

import org.metadump.graph.EmissionStep;

/**
 * Turns one emission step into statement text.
 * <p>
 * Called once per step, in emission order, from the worker of the section being written.
 * Implementations must not depend on call order across sections, since sections are written
 * concurrently.
 */
@FunctionalInterface
public interface IStatementRenderer {

    /**
     * @param step the step to render.
     * @return the statement and its annotation; {@link RenderedStatement#EMPTY} if the object
     *         needs no statement.
     */
    RenderedStatement render(EmissionStep step);
}
