package com.gridcore.calc.engine;

import com.gridcore.calc.model.CellAddress;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable evaluation order over a set of cells, CSR-encoded.
 *
 * <p>
 * Cells are indexed so that every acyclic cell comes after all of the cells it
 * reads. Cells that sit on (or behind) a cycle cannot be ordered; they are kept
 * rather than dropped and occupy the tail indices {@code [acyclicCount, nodeCount)}
 * in address order, where the runtime circularity guard resolves them.
 *
 * <p>
 * Data layout:
 * <ul>
 * <li>{@code order}: cells by index.</li>
 * <li>{@code childrenList}: flattened indices of each cell's dependents.</li>
 * <li>{@code childrenOffset}: dependents of cell {@code i} live in
 * {@code childrenList[childrenOffset[i] .. childrenOffset[i+1])}.</li>
 * </ul>
 */
public final class CalculationOrder {
    private final CellAddress[] order;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<CellAddress, Integer> addressToIndex;
    private final int acyclicCount;

    private CalculationOrder(CellAddress[] order, int[] childrenOffset, int[] childrenList, int[] parentCount,
            Map<CellAddress, Integer> addressToIndex, int acyclicCount) {
        this.order = order;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.addressToIndex = addressToIndex;
        this.acyclicCount = acyclicCount;
    }

    public int nodeCount() {
        return order.length;
    }

    public CellAddress cell(int index) {
        return order[index];
    }

    /** Index of {@code address}, or -1 when it is not part of this order. */
    public int indexOf(CellAddress address) {
        Integer idx = addressToIndex.get(address);
        return idx == null ? -1 : idx;
    }

    public int acyclicCount() {
        return acyclicCount;
    }

    public boolean hasCycles() {
        return acyclicCount < order.length;
    }

    public boolean isCyclic(int index) {
        return index >= acyclicCount;
    }

    public int childCount(int index) {
        return childrenOffset[index + 1] - childrenOffset[index];
    }

    public int child(int index, int i) {
        return childrenList[childrenOffset[index] + i];
    }

    public int parentCount(int index) {
        return parentCount[index];
    }

    /** All cells in evaluation order, cyclic tail included. */
    public List<CellAddress> cells() {
        return Collections.unmodifiableList(Arrays.asList(order));
    }

    public List<CellAddress> cyclicCells() {
        return cells().subList(acyclicCount, order.length);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects cells and "dependency before dependent" edges, then sorts them
     * with Kahn's algorithm.
     */
    public static final class Builder {
        private final List<CellAddress> nodes = new ArrayList<>();
        private final Map<CellAddress, Integer> addressToIdx = new LinkedHashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        /** Adds a cell; adding the same cell twice is a no-op. */
        public Builder addNode(CellAddress cell) {
            if (addressToIdx.containsKey(cell))
                return this;
            int idx = nodes.size();
            nodes.add(cell);
            addressToIdx.put(cell, idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        /** {@code dependent} reads {@code dependency}; both are added if missing. */
        public Builder addEdge(CellAddress dependency, CellAddress dependent) {
            addNode(dependency);
            addNode(dependent);
            forwardEdges.get(addressToIdx.get(dependency)).add(addressToIdx.get(dependent));
            return this;
        }

        public CalculationOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            int[] topoMap = new int[n], reverseMap = new int[n];
            boolean[] placed = new boolean[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                placed[curr] = true;
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            int acyclic = topoIdx;

            // Whatever Kahn could not place is on or downstream of a cycle.
            List<Integer> leftovers = new ArrayList<>();
            for (int i = 0; i < n; i++)
                if (!placed[i])
                    leftovers.add(i);
            leftovers.sort((a, b) -> nodes.get(a).compareTo(nodes.get(b)));
            for (int i : leftovers) {
                topoMap[i] = topoIdx;
                reverseMap[topoIdx] = i;
                topoIdx++;
            }

            CellAddress[] ordered = new CellAddress[n];
            Map<CellAddress, Integer> index = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                index.put(ordered[ti], ti);
            }

            int totalEdges = 0;
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                offsets[ti + 1] = offsets[ti] + children.size();
                totalEdges += children.size();
            }

            int[] flatChildren = new int[totalEdges];
            int[] parentCounts = new int[n];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            return new CalculationOrder(ordered, offsets, flatChildren, parentCounts, index, acyclic);
        }
    }
}
