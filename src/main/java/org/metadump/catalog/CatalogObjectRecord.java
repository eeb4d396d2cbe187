package org.metadump.catalog;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One catalog object as delivered by the catalog query layer. Immutable once created.
 *
 * @param oid         identifier assigned by the source catalog, unique within one run.
 * @param schema      the pre-escaped schema name; empty for global objects.
 * @param name        the pre-escaped object name.
 * @param kind        the object kind.
 * @param definition  the kind-specific definition.
 * @param metadata    ownership, comment and privileges; {@link ObjectMetadata#NONE} if absent.
 * @param origin      whether the object is explicit or server-generated.
 * @param dependsUpon qualified names of the objects this definition requires, in catalog order.
 */
public record CatalogObjectRecord(
        long oid,
        String schema,
        String name,
        ObjectKind kind,
        ObjectDefinition definition,
        ObjectMetadata metadata,
        Origin origin,
        List<String> dependsUpon
) {

    /**
     * Orders records by schema, then name, then oid. This is the tie-break used wherever several
     * records are equally eligible, which keeps dump output byte-identical across runs.
     */
    public static final Comparator<CatalogObjectRecord> BY_SCHEMA_NAME_OID =
            Comparator.comparing(CatalogObjectRecord::schema)
                    .thenComparing(CatalogObjectRecord::name)
                    .thenComparingLong(CatalogObjectRecord::oid);

    public CatalogObjectRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(definition, "definition");
        schema = Objects.requireNonNullElse(schema, "");
        metadata = Objects.requireNonNullElse(metadata, ObjectMetadata.NONE);
        origin = Objects.requireNonNullElse(origin, Origin.EXPLICIT);
        dependsUpon = dependsUpon == null ? List.of() : List.copyOf(dependsUpon);
    }

    /**
     * Creates an explicit record without metadata.
     */
    public static CatalogObjectRecord of(long oid, String schema, String name, ObjectKind kind,
                                         ObjectDefinition definition, String... dependsUpon) {
        return new CatalogObjectRecord(oid, schema, name, kind, definition, ObjectMetadata.NONE,
                Origin.EXPLICIT, List.of(dependsUpon));
    }

    /**
     * Returns the name other records use to reference this one in {@link #dependsUpon()}:
     * {@code name} for global objects, {@code schema.name} for schema objects and
     * {@code schema.name(arguments)} for functions.
     *
     * @return the qualified name.
     */
    public String qualifiedName() {
        String qualified = schema.isEmpty() ? name : schema + "." + name;
        if (definition instanceof ObjectDefinition.FunctionDefinition function) {
            return qualified + "(" + function.arguments() + ")";
        }
        return qualified;
    }

    /**
     * @return a short description for log and error messages, e.g. {@code BASE_TYPE public.t (oid 42)}.
     */
    public String describe() {
        return kind + " " + qualifiedName() + " (oid " + oid + ")";
    }
}
