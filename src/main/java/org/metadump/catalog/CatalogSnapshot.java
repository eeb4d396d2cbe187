package org.metadump.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Everything the catalog query layer hands over for one run: the object records and the version
 * of the cluster they were read from.
 *
 * @param sourceVersion the source cluster version.
 * @param records       all records of the run, in no particular order.
 */
public record CatalogSnapshot(SourceVersion sourceVersion, List<CatalogObjectRecord> records) {

    public CatalogSnapshot {
        Objects.requireNonNull(sourceVersion, "sourceVersion");
        records = records == null ? List.of() : List.copyOf(records);
    }
}
