package org.metadump.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.metadump.catalog.CatalogObjectRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the qualified-name dependency lists of catalog records into a {@link DependencyGraph}.
 * <p>
 * Resolution policy:
 * <ul>
 *   <li>Server-generated objects (array counterparts of types, implicit row types of tables) are
 *       removed from the candidate set first; they are neither nodes nor dependency targets.</li>
 *   <li>Records attached to another object (session settings, database settings, role grants)
 *       are nodes but never targets, since they share the name of the object they belong to.</li>
 *   <li>A name matching exactly one candidate becomes an edge.</li>
 *   <li>A name matching no candidate refers to a built-in or out-of-scope object and is dropped.</li>
 *   <li>A name matching several candidates fails with {@link AmbiguousDependencyException}.</li>
 *   <li>A reference from an object to itself is dropped; the definition that contains it is
 *       valid on its own.</li>
 * </ul>
 */
public final class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /**
     * Builds the dependency graph of one run.
     *
     * @param records all records of the run, in any order.
     * @return the graph over the explicit records.
     * @throws AmbiguousDependencyException if a dependency name matches more than one candidate.
     * @throws IllegalArgumentException     if two records share an oid.
     */
    public DependencyGraph resolve(Collection<CatalogObjectRecord> records) {
        List<CatalogObjectRecord> candidates = new ArrayList<>();
        Set<Long> seenOids = new HashSet<>();
        int implicit = 0;
        for (CatalogObjectRecord record : records) {
            if (!seenOids.add(record.oid())) {
                throw new IllegalArgumentException("Duplicate oid in catalog records: " + record.oid());
            }
            if (record.origin().isImplicit()) {
                implicit++;
                continue;
            }
            candidates.add(record);
        }

        Map<String, List<CatalogObjectRecord>> byQualifiedName = new HashMap<>();
        for (CatalogObjectRecord candidate : candidates) {
            if (!candidate.kind().isReferenceable()) {
                continue;
            }
            byQualifiedName.computeIfAbsent(candidate.qualifiedName(), k -> new ArrayList<>(1)).add(candidate);
        }

        Map<Long, Set<Long>> edges = new HashMap<>();
        int dropped = 0;
        for (CatalogObjectRecord record : candidates) {
            Set<Long> targets = new LinkedHashSet<>();
            for (String dependency : record.dependsUpon()) {
                List<CatalogObjectRecord> matches = byQualifiedName.get(dependency);
                if (matches == null) {
                    log.debug("Dropping unresolved dependency '{}' of {}", dependency, record.describe());
                    dropped++;
                    continue;
                }
                if (matches.size() > 1) {
                    TreeSet<Long> oids = new TreeSet<>();
                    matches.forEach(match -> oids.add(match.oid()));
                    throw new AmbiguousDependencyException(dependency, new ArrayList<>(oids));
                }
                long target = matches.get(0).oid();
                if (target == record.oid()) {
                    log.debug("Dropping self reference of {}", record.describe());
                    continue;
                }
                targets.add(target);
            }
            edges.put(record.oid(), targets);
        }

        DependencyGraph graph = new DependencyGraph(candidates, edges);
        log.debug("Resolved {} objects with {} dependency edges ({} implicit objects skipped, {} external references dropped)",
                graph.size(), graph.edgeCount(), implicit, dropped);
        return graph;
    }
}
