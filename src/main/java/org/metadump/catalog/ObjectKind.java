package org.metadump.catalog;

import java.util.EnumSet;
import java.util.Set;

import org.metadump.output.Section;

/**
 * The catalog object kinds handled by the dump.
 * <p>
 * Each kind carries the static facts the rest of the pipeline needs: which output sections it is
 * written to, its priority class for sequencing, the tag recorded in the table of contents, and
 * whether it may be forward-declared as a shell to break a dependency cycle.
 * <p>
 * Priority classes encode the fixed cross-kind ordering of global objects (roles must exist before
 * grants reference them, resource queues before roles are assigned to them, and so on). All schema
 * objects share one class and are ordered by their dependency edges alone.
 */
public enum ObjectKind {
    SESSION_GUCS(0, "SESSION GUCS", Category.SETTINGS),
    DATABASE(1, "DATABASE", Category.GLOBAL),
    DATABASE_GUC(2, "DATABASE GUC", Category.GLOBAL),
    RESOURCE_QUEUE(3, "RESOURCE QUEUE", Category.GLOBAL),
    RESOURCE_GROUP(4, "RESOURCE GROUP", Category.GLOBAL),
    ROLE(5, "ROLE", Category.GLOBAL),
    ROLE_GRANT(6, "ROLE GRANT", Category.GLOBAL),
    TABLESPACE(7, "TABLESPACE", Category.GLOBAL),
    SHELL_TYPE(8, "SHELL TYPE", Category.TYPE),
    BASE_TYPE(8, "TYPE", Category.TYPE),
    COMPOSITE_TYPE(8, "TYPE", Category.TYPE),
    DOMAIN_TYPE(8, "DOMAIN", Category.TYPE),
    ENUM_TYPE(8, "TYPE", Category.TYPE),
    FUNCTION(8, "FUNCTION", Category.SCHEMA_OBJECT);

    /** TOC tag recorded for the forward declaration of a type. */
    public static final String SHELL_TOC_KIND = "SHELL TYPE";

    private enum Category { SETTINGS, GLOBAL, TYPE, SCHEMA_OBJECT }

    private final int priorityClass;
    private final String tocKind;
    private final Category category;

    ObjectKind(int priorityClass, String tocKind, Category category) {
        this.priorityClass = priorityClass;
        this.tocKind = tocKind;
        this.category = category;
    }

    /**
     * Returns the static priority class. Among objects whose dependencies are satisfied, lower
     * classes are always emitted first.
     *
     * @return the priority class, starting at 0.
     */
    public int priorityClass() {
        return priorityClass;
    }

    /**
     * Returns the kind tag written to the table of contents for a full definition.
     *
     * @return the TOC kind tag.
     */
    public String tocKind() {
        return tocKind;
    }

    /**
     * Returns the sections objects of this kind are written to. Session settings are repeated at
     * the top of every section so each file can be replayed on its own.
     *
     * @return an unmodifiable set of sections.
     */
    public Set<Section> sections() {
        return switch (category) {
            case SETTINGS -> EnumSet.allOf(Section.class);
            case GLOBAL -> EnumSet.of(Section.GLOBAL);
            case TYPE, SCHEMA_OBJECT -> EnumSet.of(Section.PREDATA);
        };
    }

    /**
     * @return {@code true} for base, composite, domain, enum and shell types.
     */
    public boolean isType() {
        return category == Category.TYPE;
    }

    /**
     * Returns whether a full definition of this kind can be preceded by a shell declaration.
     * Domains cannot fill a shell type, and a shell type has no further definition.
     *
     * @return {@code true} for base, composite and enum types.
     */
    public boolean isShellable() {
        return this == BASE_TYPE || this == COMPOSITE_TYPE || this == ENUM_TYPE;
    }

    /**
     * Returns whether other objects can name this kind in their dependencies. Session settings,
     * database settings and role grants are attached to an object and carry that object's name, so
     * they are never a dependency target.
     *
     * @return {@code false} for session settings, database settings and role grants.
     */
    public boolean isReferenceable() {
        return category != Category.SETTINGS && this != DATABASE_GUC && this != ROLE_GRANT;
    }

    /**
     * @return {@code true} if objects of this kind live in a schema.
     */
    public boolean isSchemaQualified() {
        return category == Category.TYPE || category == Category.SCHEMA_OBJECT;
    }
}
