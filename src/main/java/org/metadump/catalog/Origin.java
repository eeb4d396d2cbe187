package org.metadump.catalog;

/**
 * How a catalog object came to exist.
 * <p>
 * Objects the server generates implicitly are recreated by the statement that creates their owner,
 * so they are never dumped and never act as dependency targets.
 */
public enum Origin {
    /** Created by a statement of its own. */
    EXPLICIT,
    /** The array type generated alongside a base or composite type. */
    ARRAY_COUNTERPART,
    /** The row type generated for a table, view or sequence. */
    TABLE_ROW_TYPE;

    /**
     * @return {@code true} if the object is generated by the server and must be skipped.
     */
    public boolean isImplicit() {
        return this != EXPLICIT;
    }
}
