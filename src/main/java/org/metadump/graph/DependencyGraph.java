package org.metadump.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

import org.metadump.catalog.CatalogObjectRecord;

/**
 * Directed graph of the objects of one run. An edge from A to B means A's definition requires B
 * to exist first.
 * <p>
 * Nodes are held in (schema, name, oid) order and every adjacency set is sorted by oid, so any
 * traversal of the graph is independent of the order the records arrived in.
 */
public final class DependencyGraph {

    private final Map<Long, CatalogObjectRecord> nodes;
    private final Map<Long, NavigableSet<Long>> dependencies;
    private final Map<Long, NavigableSet<Long>> dependents;

    DependencyGraph(List<CatalogObjectRecord> records, Map<Long, ? extends Set<Long>> edges) {
        List<CatalogObjectRecord> sorted = new ArrayList<>(records);
        sorted.sort(CatalogObjectRecord.BY_SCHEMA_NAME_OID);
        this.nodes = new LinkedHashMap<>();
        this.dependencies = new LinkedHashMap<>();
        this.dependents = new LinkedHashMap<>();
        for (CatalogObjectRecord record : sorted) {
            nodes.put(record.oid(), record);
            dependencies.put(record.oid(), new TreeSet<>());
            dependents.put(record.oid(), new TreeSet<>());
        }
        edges.forEach((from, targets) -> {
            for (Long to : targets) {
                if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
                    throw new IllegalArgumentException("Edge " + from + " -> " + to + " leaves the node set");
                }
                dependencies.get(from).add(to);
                dependents.get(to).add(from);
            }
        });
    }

    /**
     * @return all nodes in (schema, name, oid) order.
     */
    public List<CatalogObjectRecord> nodes() {
        return List.copyOf(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(long oid) {
        return nodes.containsKey(oid);
    }

    /**
     * @param oid a node oid.
     * @return the node.
     * @throws IllegalArgumentException if the oid is not part of the graph.
     */
    public CatalogObjectRecord node(long oid) {
        CatalogObjectRecord record = nodes.get(oid);
        if (record == null) {
            throw new IllegalArgumentException("Unknown node oid: " + oid);
        }
        return record;
    }

    /**
     * @return oids of the nodes {@code oid} depends on, ascending.
     */
    public Set<Long> dependencyOids(long oid) {
        node(oid);
        return Collections.unmodifiableSet(dependencies.get(oid));
    }

    /**
     * @return oids of the nodes that depend on {@code oid}, ascending.
     */
    public Set<Long> dependentOids(long oid) {
        node(oid);
        return Collections.unmodifiableSet(dependents.get(oid));
    }

    /**
     * @return the records {@code record} depends on, in oid order.
     */
    public List<CatalogObjectRecord> dependenciesOf(CatalogObjectRecord record) {
        List<CatalogObjectRecord> result = new ArrayList<>();
        for (Long target : dependencyOids(record.oid())) {
            result.add(nodes.get(target));
        }
        return result;
    }

    public int edgeCount() {
        int count = 0;
        for (Set<Long> targets : dependencies.values()) {
            count += targets.size();
        }
        return count;
    }
}
