package org.metadump.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Tarjan's strongly connected components over an adjacency array.
 * <p>
 * Iterative, so dependency chains of any length do not exhaust the thread stack. Components are
 * returned in the order Tarjan completes them, each with its members sorted ascending.
 */
final class StronglyConnectedComponents {

    private StronglyConnectedComponents() {
    }

    /**
     * @param adjacency {@code adjacency[v]} lists the successors of node {@code v}.
     * @return every component of the graph, singletons included.
     */
    static List<int[]> find(int[][] adjacency) {
        int n = adjacency.length;
        int[] index = new int[n];
        int[] low = new int[n];
        int[] edgePosition = new int[n];
        boolean[] onStack = new boolean[n];
        int[] stack = new int[n];
        int[] callStack = new int[n];
        int stackSize = 0;
        int callDepth = 0;
        int counter = 0;
        Arrays.fill(index, -1);

        List<int[]> components = new ArrayList<>();
        for (int root = 0; root < n; root++) {
            if (index[root] >= 0) {
                continue;
            }
            index[root] = low[root] = counter++;
            stack[stackSize++] = root;
            onStack[root] = true;
            callStack[callDepth++] = root;

            while (callDepth > 0) {
                int v = callStack[callDepth - 1];
                if (edgePosition[v] < adjacency[v].length) {
                    int w = adjacency[v][edgePosition[v]++];
                    if (index[w] < 0) {
                        index[w] = low[w] = counter++;
                        stack[stackSize++] = w;
                        onStack[w] = true;
                        callStack[callDepth++] = w;
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }

                callDepth--;
                if (callDepth > 0) {
                    int parent = callStack[callDepth - 1];
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    List<Integer> members = new ArrayList<>();
                    int w;
                    do {
                        w = stack[--stackSize];
                        onStack[w] = false;
                        members.add(w);
                    } while (w != v);
                    int[] component = members.stream().mapToInt(Integer::intValue).sorted().toArray();
                    components.add(component);
                }
            }
        }
        return components;
    }
}
