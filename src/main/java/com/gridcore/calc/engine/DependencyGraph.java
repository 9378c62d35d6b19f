package com.gridcore.calc.engine;

import com.gridcore.calc.model.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import lombok.extern.log4j.Log4j2;

/**
 * Cell-level dependency graph.
 *
 * <p>
 * {@code forward} maps a cell to the cells it reads, {@code reverse} maps a
 * cell to the cells that read it. Every mutation updates both maps together,
 * so {@code reverse} is always the exact transpose of {@code forward}. Edge
 * sets are sorted, which keeps every traversal deterministic.
 */
@Log4j2
public final class DependencyGraph {
    private final Map<CellAddress, Set<CellAddress>> forward = new HashMap<>();
    private final Map<CellAddress, Set<CellAddress>> reverse = new HashMap<>();

    /** Records that {@code from} reads {@code to}. */
    public void addDependency(CellAddress from, CellAddress to) {
        forward.computeIfAbsent(from, k -> new TreeSet<>()).add(to);
        reverse.computeIfAbsent(to, k -> new TreeSet<>()).add(from);
    }

    /** Drops every edge out of {@code cell}, pruning reverse entries left empty. */
    public void removeDependenciesFor(CellAddress cell) {
        Set<CellAddress> deps = forward.remove(cell);
        if (deps == null)
            return;
        for (CellAddress dep : deps) {
            Set<CellAddress> readers = reverse.get(dep);
            if (readers != null) {
                readers.remove(cell);
                if (readers.isEmpty())
                    reverse.remove(dep);
            }
        }
    }

    /** Replaces the out-edges of {@code cell} with {@code dependencies}. */
    public void setDependencies(CellAddress cell, Collection<CellAddress> dependencies) {
        removeDependenciesFor(cell);
        for (CellAddress dep : dependencies)
            addDependency(cell, dep);
        if (log.isDebugEnabled())
            log.debug("{} now reads {} cell(s)", cell, dependencies.size());
    }

    /** Cells that read {@code cell}. Never null. */
    public Set<CellAddress> getDependents(CellAddress cell) {
        return copyOf(reverse.get(cell));
    }

    /** Cells that {@code cell} reads. Never null. */
    public Set<CellAddress> getDependencies(CellAddress cell) {
        return copyOf(forward.get(cell));
    }

    private static Set<CellAddress> copyOf(Set<CellAddress> s) {
        return s == null ? Collections.emptySet() : Collections.unmodifiableSet(new TreeSet<>(s));
    }

    /**
     * Whether adding the edge "{@code from} reads {@code to}" would close a
     * cycle: true when {@code from == to} or {@code from} is already reachable
     * from {@code to} along forward edges.
     */
    public boolean wouldCreateCycle(CellAddress from, CellAddress to) {
        if (from.equals(to))
            return true;
        Set<CellAddress> visited = new HashSet<>();
        Deque<CellAddress> stack = new ArrayDeque<>();
        stack.push(to);
        while (!stack.isEmpty()) {
            CellAddress cur = stack.pop();
            if (cur.equals(from))
                return true;
            if (!visited.add(cur))
                continue;
            Set<CellAddress> next = forward.get(cur);
            if (next != null)
                for (CellAddress n : next)
                    if (!visited.contains(n))
                        stack.push(n);
        }
        return false;
    }

    /**
     * The changed cells plus everything that transitively reads them, ordered
     * so that each cell comes after all of its dependencies inside that set.
     * Cycles inside the set are cut at the edge that closes them.
     */
    public List<CellAddress> getAffectedCells(Set<CellAddress> changed) {
        Set<CellAddress> closure = new TreeSet<>(changed);
        Deque<CellAddress> queue = new ArrayDeque<>(closure);
        while (!queue.isEmpty()) {
            Set<CellAddress> readers = reverse.get(queue.poll());
            if (readers == null)
                continue;
            for (CellAddress r : readers)
                if (closure.add(r))
                    queue.add(r);
        }

        List<CellAddress> sorted = new ArrayList<>(closure.size());
        Set<CellAddress> done = new HashSet<>();
        Set<CellAddress> onPath = new HashSet<>();
        for (CellAddress root : closure) {
            if (done.contains(root))
                continue;
            // Iterative post-order DFS over in-closure dependencies.
            Deque<Iterator<CellAddress>> iters = new ArrayDeque<>();
            Deque<CellAddress> path = new ArrayDeque<>();
            path.push(root);
            onPath.add(root);
            iters.push(dependencyIterator(root));
            while (!path.isEmpty()) {
                Iterator<CellAddress> it = iters.peek();
                if (it.hasNext()) {
                    CellAddress dep = it.next();
                    if (!closure.contains(dep) || done.contains(dep) || onPath.contains(dep))
                        continue;
                    path.push(dep);
                    onPath.add(dep);
                    iters.push(dependencyIterator(dep));
                } else {
                    CellAddress finished = path.pop();
                    iters.pop();
                    onPath.remove(finished);
                    done.add(finished);
                    sorted.add(finished);
                }
            }
        }
        return sorted;
    }

    private Iterator<CellAddress> dependencyIterator(CellAddress cell) {
        Set<CellAddress> deps = forward.get(cell);
        return deps == null ? Collections.emptyIterator() : deps.iterator();
    }

    /**
     * Evaluation order over every cell that has a formula with at least one
     * reference, plus the cells they read.
     */
    public CalculationOrder calculationOrder() {
        CalculationOrder.Builder builder = CalculationOrder.builder();
        for (CellAddress cell : new TreeSet<>(forward.keySet())) {
            builder.addNode(cell);
            for (CellAddress dep : forward.get(cell))
                builder.addEdge(dep, cell);
        }
        CalculationOrder order = builder.build();
        if (order.hasCycles())
            log.debug("Calculation order has {} cell(s) on or behind a cycle", order.nodeCount() - order.acyclicCount());
        return order;
    }

    /** Cells that read at least one other cell. */
    public Set<CellAddress> cellsWithDependencies() {
        return Collections.unmodifiableSet(new TreeSet<>(forward.keySet()));
    }

    public int edgeCount() {
        int n = 0;
        for (Set<CellAddress> s : forward.values())
            n += s.size();
        return n;
    }

    public void clear() {
        forward.clear();
        reverse.clear();
    }

    /** Number of cells with outgoing edges. */
    public int size() {
        return forward.size();
    }

    public boolean isEmpty() {
        return forward.isEmpty();
    }
}
