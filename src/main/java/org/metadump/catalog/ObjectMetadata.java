package org.metadump.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Ownership, comment and privileges of a catalog object. Rendered as the trailing annotation of the
 * object's statement.
 *
 * @param owner      the owning role, or empty if ownership is not dumped.
 * @param comment    the object comment, unquoted; empty if none.
 * @param privileges the explicit grants on the object, in catalog order.
 */
public record ObjectMetadata(String owner, String comment, List<Privilege> privileges) {

    /** Metadata with nothing to annotate. */
    public static final ObjectMetadata NONE = new ObjectMetadata("", "", List.of());

    public ObjectMetadata {
        owner = Objects.requireNonNullElse(owner, "");
        comment = Objects.requireNonNullElse(comment, "");
        privileges = privileges == null ? List.of() : List.copyOf(privileges);
    }

    /**
     * @return {@code true} if no owner, comment or privilege is present.
     */
    public boolean isEmpty() {
        return owner.isEmpty() && comment.isEmpty() && privileges.isEmpty();
    }

    /**
     * A single grant.
     *
     * @param grantee         the receiving role, or {@code PUBLIC}.
     * @param privileges      the privilege list, e.g. {@code USAGE} or {@code ALL}.
     * @param withGrantOption whether the grantee may pass the privilege on.
     */
    public record Privilege(String grantee, String privileges, boolean withGrantOption) {
        public Privilege {
            grantee = Objects.requireNonNullElse(grantee, "");
            privileges = Objects.requireNonNullElse(privileges, "");
        }
    }
}
