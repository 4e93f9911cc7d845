package io.calcport.engine.resolve;

import io.calcport.engine.diagnostic.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Orders calculations so every one follows the calculations it references.
 *
 * <p>Strongly connected components (Tarjan) find the cycles first; every
 * component with more than one member, or a single member referencing itself,
 * is excluded and reported. The remaining graph is sorted with Kahn's algorithm,
 * always taking the ready calculation that came first in the input.
 */
public final class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    public DependencyOrder order(List<CalculationDependencies> calculations) {
        Map<String, Integer> index = new HashMap<>();
        for (CalculationDependencies calc : calculations) {
            if (index.putIfAbsent(calc.sourceKey(), index.size()) != null) {
                throw new IllegalArgumentException("Duplicate calculation '" + calc.sourceKey() + "'");
            }
        }

        int n = calculations.size();
        List<List<Integer>> edges = new ArrayList<>(n);
        for (CalculationDependencies calc : calculations) {
            List<Integer> targets = new ArrayList<>();
            for (String ref : calc.references()) {
                Integer target = index.get(ref);
                if (target != null) {
                    targets.add(target);
                }
            }
            edges.add(targets);
        }

        boolean[] excluded = new boolean[n];
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (List<Integer> component : new Tarjan(edges).components()) {
            int first = component.get(0);
            boolean cycle = component.size() > 1 || edges.get(first).contains(first);
            if (!cycle) {
                continue;
            }
            List<String> members = component.stream()
                    .sorted()
                    .map(i -> calculations.get(i).sourceKey())
                    .toList();
            component.forEach(i -> excluded[i] = true);
            diagnostics.add(Diagnostic.circularDependency(members));
            log.debug("Circular dependency among {}", members);
        }

        // indegree counts dependencies still to be emitted
        int[] pending = new int[n];
        List<List<Integer>> dependents = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            dependents.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            if (excluded[i]) {
                continue;
            }
            for (int dep : new LinkedHashSet<>(edges.get(i))) {
                if (!excluded[dep]) {
                    pending[i]++;
                    dependents.get(dep).add(i);
                }
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>(Comparator.naturalOrder());
        for (int i = 0; i < n; i++) {
            if (!excluded[i] && pending[i] == 0) {
                ready.add(i);
            }
        }
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            int next = ready.poll();
            order.add(calculations.get(next).sourceKey());
            for (int dependent : dependents.get(next)) {
                if (--pending[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }

        Set<String> excludedKeys = new LinkedHashSet<>();
        for (int i = 0; i < n; i++) {
            if (excluded[i]) {
                excludedKeys.add(calculations.get(i).sourceKey());
            }
        }
        return new DependencyOrder(order, excludedKeys, diagnostics);
    }

    /**
     * Tarjan's strongly connected components, iterative so deep chains do not
     * overflow the stack. Components come out in reverse topological order.
     */
    private static final class Tarjan {
        private final List<List<Integer>> edges;
        private final int[] lowLink;
        private final int[] discovery;
        private final boolean[] onStack;
        private final Deque<Integer> stack = new ArrayDeque<>();
        private final List<List<Integer>> components = new ArrayList<>();
        private int time;

        Tarjan(List<List<Integer>> edges) {
            this.edges = edges;
            int n = edges.size();
            this.lowLink = new int[n];
            this.discovery = new int[n];
            this.onStack = new boolean[n];
            Arrays.fill(discovery, -1);
        }

        List<List<Integer>> components() {
            for (int v = 0; v < edges.size(); v++) {
                if (discovery[v] < 0) {
                    visit(v);
                }
            }
            return components;
        }

        private void visit(int root) {
            // frame: {vertex, next edge index}
            Deque<int[]> frames = new ArrayDeque<>();
            open(root);
            frames.push(new int[]{root, 0});
            while (!frames.isEmpty()) {
                int[] frame = frames.peek();
                int v = frame[0];
                List<Integer> out = edges.get(v);
                if (frame[1] < out.size()) {
                    int w = out.get(frame[1]++);
                    if (discovery[w] < 0) {
                        open(w);
                        frames.push(new int[]{w, 0});
                    } else if (onStack[w]) {
                        lowLink[v] = Math.min(lowLink[v], discovery[w]);
                    }
                    continue;
                }
                frames.pop();
                if (!frames.isEmpty()) {
                    int parent = frames.peek()[0];
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
                }
                if (lowLink[v] == discovery[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    components.add(component);
                }
            }
        }

        private void open(int v) {
            discovery[v] = time;
            lowLink[v] = time;
            time++;
            stack.push(v);
            onStack[v] = true;
        }
    }
}
