package co.fanki.depgraph.graph.domain;

import co.fanki.depgraph.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds dependency cycles as strongly connected components.
 *
 * <p>Runs Tarjan's algorithm in O(V+E) with an explicit stack, so deep
 * import chains do not overflow the call stack. Nodes and neighbors are
 * visited in path order, which makes the output identical for identical
 * input.</p>
 *
 * <p>A component is a cycle when it has at least two members, or when
 * its single member imports itself.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class CycleAnalyzer {

    private CycleAnalyzer() {
    }

    /**
     * Analyzes the graph for cycles.
     *
     * @param graph the graph to analyze
     * @return the cycles with per-edge and per-node membership flags
     */
    public static CycleAnalysis analyze(final DependencyGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final List<Set<String>> components = stronglyConnectedComponents(
                graph);

        final Map<String, Integer> componentOf = new HashMap<>();
        final List<Cycle> cycles = new ArrayList<>();
        final Set<Integer> cyclicComponents = new HashSet<>();

        for (int i = 0; i < components.size(); i++) {
            final Set<String> component = components.get(i);
            for (final String node : component) {
                componentOf.put(node, i);
            }
            if (isCyclic(graph, component)) {
                cyclicComponents.add(i);
                cycles.add(new Cycle(cyclePath(graph, component)));
            }
        }

        cycles.sort(Comparator.comparing(Cycle::start));

        final Map<FileEdge, Boolean> edgeFlags = new LinkedHashMap<>();
        for (final FileEdge edge : graph.edges()) {
            final int fromComponent = componentOf.get(edge.from());
            final boolean inCycle = fromComponent == componentOf.get(edge.to())
                    && cyclicComponents.contains(fromComponent);
            edgeFlags.put(edge, inCycle);
        }

        final Map<String, Boolean> nodeFlags = new LinkedHashMap<>();
        for (final String node : graph.sortedNodes()) {
            nodeFlags.put(node,
                    cyclicComponents.contains(componentOf.get(node)));
        }

        return new CycleAnalysis(cycles, edgeFlags, nodeFlags);
    }

    /**
     * Computes the strongly connected components of the graph.
     *
     * @param graph the graph
     * @return the components in the order Tarjan's algorithm emits them
     */
    static List<Set<String>> stronglyConnectedComponents(
            final DependencyGraph graph) {

        final Map<String, Integer> index = new HashMap<>();
        final Map<String, Integer> lowLink = new HashMap<>();
        final Deque<String> stack = new ArrayDeque<>();
        final Set<String> onStack = new HashSet<>();
        final List<Set<String>> components = new ArrayList<>();
        int counter = 0;

        for (final String root : graph.sortedNodes()) {
            if (index.containsKey(root)) {
                continue;
            }

            final Deque<Frame> work = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            work.push(new Frame(root, sortedTargets(graph, root)));

            while (!work.isEmpty()) {
                final Frame frame = work.peek();

                if (frame.targets.hasNext()) {
                    final String next = frame.targets.next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, sortedTargets(graph, next)));
                    } else if (onStack.contains(next)) {
                        lowLink.put(frame.node, Math.min(
                                lowLink.get(frame.node), index.get(next)));
                    }
                    continue;
                }

                work.pop();
                if (!work.isEmpty()) {
                    final String parent = work.peek().node;
                    lowLink.put(parent, Math.min(
                            lowLink.get(parent), lowLink.get(frame.node)));
                }

                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    final Set<String> component = new LinkedHashSet<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.node));
                    components.add(component);
                }
            }
        }

        return components;
    }

    private static boolean isCyclic(final DependencyGraph graph,
            final Set<String> component) {
        if (component.size() > 1) {
            return true;
        }
        final String only = component.iterator().next();
        return graph.dependencies(only).contains(only);
    }

    /**
     * Orders a component by depth-first discovery from its smallest
     * member, following only edges inside the component.
     */
    private static List<String> cyclePath(final DependencyGraph graph,
            final Set<String> component) {

        final String start = new TreeSet<>(component).first();
        final List<String> path = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        final Deque<Frame> work = new ArrayDeque<>();

        seen.add(start);
        path.add(start);
        work.push(new Frame(start, sortedTargets(graph, start)));

        while (!work.isEmpty()) {
            final Frame frame = work.peek();
            if (!frame.targets.hasNext()) {
                work.pop();
                continue;
            }
            final String next = frame.targets.next();
            if (component.contains(next) && seen.add(next)) {
                path.add(next);
                work.push(new Frame(next, sortedTargets(graph, next)));
            }
        }

        return path;
    }

    private static Iterator<String> sortedTargets(final DependencyGraph graph,
            final String node) {
        return new TreeSet<>(graph.dependencies(node)).iterator();
    }

    /** DFS frame: a node and the neighbors still to visit. */
    private static final class Frame {

        private final String node;
        private final Iterator<String> targets;

        private Frame(final String theNode, final Iterator<String> theTargets) {
            this.node = theNode;
            this.targets = theTargets;
        }
    }

}
