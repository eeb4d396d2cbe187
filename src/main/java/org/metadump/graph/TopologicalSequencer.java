package org.metadump.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

import org.metadump.catalog.CatalogObjectRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orders a {@link DependencyGraph} into a deterministic {@link EmissionSequence}.
 * <p>
 * Ordering is Kahn's algorithm over predecessor counts. Among the steps whose dependencies are all
 * emitted, the one with the lowest (priority class, schema, name, oid, phase) is taken next, so the
 * static priority classes of {@link org.metadump.catalog.ObjectKind} decide the order of global
 * objects and names decide the rest.
 * <p>
 * Cycles are found with strongly connected components. A component with more than one member is
 * broken by shell promotion:
 * <ul>
 *   <li>If every member is a type, one member stays the cycle anchor and all others are declared
 *       as shells first. The anchor is the one member that cannot be a shell (a domain) if there is
 *       one, otherwise the least member by (schema, name, oid).</li>
 *   <li>If the component also holds non-type objects, such as the I/O functions of a base type,
 *       every member that can be a shell is declared as one.</li>
 * </ul>
 * References inside the component to a shelled member then point at its shell step. If the
 * component is still cyclic after that, or nothing in it can be shelled, sequencing fails with
 * {@link UnbreakableCycleException}. No edge is ever dropped.
 */
public final class TopologicalSequencer {

    private static final Logger log = LoggerFactory.getLogger(TopologicalSequencer.class);

    private static final Comparator<EmissionStep> EMISSION_ORDER =
            Comparator.comparingInt((EmissionStep step) -> step.record().kind().priorityClass())
                    .thenComparing(EmissionStep::record, CatalogObjectRecord.BY_SCHEMA_NAME_OID)
                    .thenComparing(EmissionStep::phase);

    /**
     * Sequences the graph.
     *
     * @param graph the resolved dependency graph.
     * @return the emission sequence.
     * @throws UnbreakableCycleException if a cycle cannot be broken by shell declarations.
     */
    public EmissionSequence sequence(DependencyGraph graph) {
        List<CatalogObjectRecord> nodes = graph.nodes();
        int n = nodes.size();
        Map<Long, Integer> indexByOid = new HashMap<>();
        for (int i = 0; i < n; i++) {
            indexByOid.put(nodes.get(i).oid(), i);
        }
        int[][] adjacency = new int[n][];
        for (int i = 0; i < n; i++) {
            adjacency[i] = graph.dependencyOids(nodes.get(i).oid()).stream()
                    .mapToInt(indexByOid::get)
                    .toArray();
        }

        List<int[]> components = StronglyConnectedComponents.find(adjacency);
        components.sort(Comparator.comparingInt(component -> component[0]));
        int[] componentOf = new int[n];
        for (int c = 0; c < components.size(); c++) {
            for (int member : components.get(c)) {
                componentOf[member] = c;
            }
        }

        List<EmissionStep> steps = new ArrayList<>(n);
        for (CatalogObjectRecord node : nodes) {
            steps.add(EmissionStep.full(node));
        }
        int[] shellStep = new int[n];
        Arrays.fill(shellStep, -1);
        for (int[] component : components) {
            if (component.length < 2) {
                continue;
            }
            for (int member : chooseShelled(component, nodes)) {
                shellStep[member] = steps.size();
                steps.add(EmissionStep.shell(nodes.get(member)));
            }
            verifyBroken(component, adjacency, componentOf, shellStep, nodes);
        }

        List<Set<Integer>> stepDependencies = new ArrayList<>(steps.size());
        for (int s = 0; s < steps.size(); s++) {
            stepDependencies.add(new LinkedHashSet<>());
        }
        for (int u = 0; u < n; u++) {
            for (int v : adjacency[u]) {
                boolean redirect = componentOf[u] == componentOf[v] && shellStep[v] >= 0;
                stepDependencies.get(u).add(redirect ? shellStep[v] : v);
            }
            if (shellStep[u] >= 0) {
                stepDependencies.get(u).add(shellStep[u]);
            }
        }

        List<EmissionStep> ordered = order(steps, stepDependencies);
        EmissionSequence sequence = new EmissionSequence(ordered);
        log.debug("Sequenced {} objects into {} steps ({} shell declarations)",
                n, sequence.size(), sequence.shellCount());
        return sequence;
    }

    private static List<Integer> chooseShelled(int[] component, List<CatalogObjectRecord> nodes) {
        boolean allTypes = true;
        List<Integer> shellable = new ArrayList<>();
        List<Integer> fixed = new ArrayList<>();
        for (int member : component) {
            CatalogObjectRecord record = nodes.get(member);
            allTypes &= record.kind().isType();
            if (record.kind().isShellable()) {
                shellable.add(member);
            } else {
                fixed.add(member);
            }
        }

        if (allTypes) {
            if (fixed.size() > 1) {
                throw unbreakable(component, nodes);
            }
            int anchor = fixed.isEmpty() ? component[0] : fixed.get(0);
            shellable.remove(Integer.valueOf(anchor));
            log.debug("Breaking type cycle at anchor {} by declaring {} shell types",
                    nodes.get(anchor).describe(), shellable.size());
            return shellable;
        }
        if (shellable.isEmpty()) {
            throw unbreakable(component, nodes);
        }
        return shellable;
    }

    /**
     * Checks that the component's remaining internal edges, those not redirected to a shell step,
     * are acyclic.
     */
    private static void verifyBroken(int[] component, int[][] adjacency, int[] componentOf, int[] shellStep,
                                     List<CatalogObjectRecord> nodes) {
        Map<Integer, Integer> pending = new HashMap<>();
        Map<Integer, List<Integer>> dependents = new HashMap<>();
        for (int u : component) {
            pending.putIfAbsent(u, 0);
            for (int v : adjacency[u]) {
                if (componentOf[v] == componentOf[u] && shellStep[v] < 0) {
                    pending.merge(u, 1, Integer::sum);
                    dependents.computeIfAbsent(v, k -> new ArrayList<>()).add(u);
                }
            }
        }
        List<Integer> ready = new ArrayList<>();
        pending.forEach((member, count) -> {
            if (count == 0) {
                ready.add(member);
            }
        });
        int resolved = 0;
        while (!ready.isEmpty()) {
            int member = ready.remove(ready.size() - 1);
            resolved++;
            for (int dependent : dependents.getOrDefault(member, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (resolved != component.length) {
            throw unbreakable(component, nodes);
        }
    }

    private static List<EmissionStep> order(List<EmissionStep> steps, List<Set<Integer>> stepDependencies) {
        int total = steps.size();
        int[] remaining = new int[total];
        List<List<Integer>> dependents = new ArrayList<>(total);
        for (int s = 0; s < total; s++) {
            dependents.add(new ArrayList<>());
        }
        for (int s = 0; s < total; s++) {
            for (int dependency : stepDependencies.get(s)) {
                remaining[s]++;
                dependents.get(dependency).add(s);
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>(
                (a, b) -> EMISSION_ORDER.compare(steps.get(a), steps.get(b)));
        for (int s = 0; s < total; s++) {
            if (remaining[s] == 0) {
                ready.add(s);
            }
        }

        List<EmissionStep> ordered = new ArrayList<>(total);
        while (!ready.isEmpty()) {
            int current = ready.poll();
            ordered.add(steps.get(current));
            for (int dependent : dependents.get(current)) {
                if (--remaining[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (ordered.size() != total) {
            throw new IllegalStateException("Emission order incomplete: " + ordered.size() + " of " + total
                    + " steps placed after cycle breaking");
        }
        return ordered;
    }

    private static UnbreakableCycleException unbreakable(int[] component, List<CatalogObjectRecord> nodes) {
        List<String> members = new ArrayList<>(component.length);
        for (int member : component) {
            members.add(nodes.get(member).describe());
        }
        return new UnbreakableCycleException(members);
    }
}
