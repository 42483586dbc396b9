package work.lcod.uber.basis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.uber.shared.UberException;

/**
 * Drops optional libraries and every library that is only reachable through optional ones.
 *
 * <p>A library flagged optional is always dropped. A required library is dropped once all of
 * its dependents are dropped; libraries without dependents (roots) are always kept. The
 * computation runs to a fixed point over an index-based view of the graph.
 */
public final class OptionalPruner {
    private OptionalPruner() {}

    /**
     * Returns the libraries to package, in the iteration order of {@code libs}. When nothing is
     * optional the input map itself is returned.
     */
    public static Map<String, LibraryNode> prune(Map<String, LibraryNode> libs) {
        Graph graph = Graph.of(libs);
        boolean[] dropped = new boolean[graph.size()];
        boolean anyOptional = false;
        for (int i = 0; i < graph.size(); i++) {
            if (graph.node(i).optional()) {
                dropped[i] = true;
                anyOptional = true;
            }
        }
        if (!anyOptional) {
            return libs;
        }

        boolean moved;
        do {
            moved = false;
            for (int i = 0; i < graph.size(); i++) {
                if (!dropped[i] && onlyDroppedDependents(graph, i, dropped)) {
                    dropped[i] = true;
                    moved = true;
                }
            }
        } while (moved);

        Map<String, LibraryNode> kept = new LinkedHashMap<>();
        for (int i = 0; i < graph.size(); i++) {
            if (!dropped[i]) {
                LibraryNode node = graph.node(i);
                kept.put(node.coordinate(), node);
            }
        }
        return kept;
    }

    private static boolean onlyDroppedDependents(Graph graph, int index, boolean[] dropped) {
        if (graph.node(index).isRoot() || graph.hasExternalDependent(index)) {
            return false;
        }
        for (int dependent : graph.dependents(index)) {
            if (!dropped[dependent]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Arena of library nodes; dependents are referenced by index. Dependents naming a coordinate
     * absent from the map are tracked separately and count as required consumers.
     */
    private static final class Graph {
        private final List<LibraryNode> nodes;
        private final int[][] dependents;
        private final boolean[] externalDependent;

        private Graph(List<LibraryNode> nodes, int[][] dependents, boolean[] externalDependent) {
            this.nodes = nodes;
            this.dependents = dependents;
            this.externalDependent = externalDependent;
        }

        static Graph of(Map<String, LibraryNode> libs) {
            List<LibraryNode> nodes = new ArrayList<>(libs.size());
            Map<String, Integer> ids = new HashMap<>();
            for (Map.Entry<String, LibraryNode> entry : libs.entrySet()) {
                LibraryNode node = entry.getValue();
                if (!entry.getKey().equals(node.coordinate())) {
                    throw new UberException(
                        UberException.INVALID_BASIS,
                        "Library keyed as " + entry.getKey() + " declares coordinate " + node.coordinate()
                    );
                }
                ids.put(node.coordinate(), nodes.size());
                nodes.add(node);
            }

            int[][] dependents = new int[nodes.size()][];
            boolean[] external = new boolean[nodes.size()];
            for (int i = 0; i < nodes.size(); i++) {
                LibraryNode node = nodes.get(i);
                List<Integer> known = new ArrayList<>();
                for (String dependent : node.dependents()) {
                    if (dependent.equals(node.coordinate())) {
                        throw new UberException(UberException.INVALID_BASIS, node.coordinate() + " lists itself as a dependent");
                    }
                    Integer id = ids.get(dependent);
                    if (id == null) {
                        external[i] = true;
                    } else {
                        known.add(id);
                    }
                }
                dependents[i] = known.stream().mapToInt(Integer::intValue).toArray();
            }
            Graph graph = new Graph(nodes, dependents, external);
            graph.requireAcyclic();
            return graph;
        }

        int size() {
            return nodes.size();
        }

        LibraryNode node(int index) {
            return nodes.get(index);
        }

        int[] dependents(int index) {
            return dependents[index];
        }

        boolean hasExternalDependent(int index) {
            return externalDependent[index];
        }

        // Kahn's algorithm over the "is depended on by" edges.
        private void requireAcyclic() {
            int[] incoming = new int[nodes.size()];
            for (int[] targets : dependents) {
                for (int target : targets) {
                    incoming[target]++;
                }
            }
            Deque<Integer> ready = new ArrayDeque<>();
            for (int i = 0; i < incoming.length; i++) {
                if (incoming[i] == 0) {
                    ready.add(i);
                }
            }
            int visited = 0;
            while (!ready.isEmpty()) {
                int current = ready.poll();
                visited++;
                for (int target : dependents[current]) {
                    if (--incoming[target] == 0) {
                        ready.add(target);
                    }
                }
            }
            if (visited != nodes.size()) {
                List<String> involved = new ArrayList<>();
                for (int i = 0; i < incoming.length; i++) {
                    if (incoming[i] > 0) {
                        involved.add(nodes.get(i).coordinate());
                    }
                }
                throw new UberException(UberException.INVALID_BASIS, "Dependency cycle between " + involved);
            }
        }
    }
}
