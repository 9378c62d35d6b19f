package com.gridcore.calc.engine;

import com.gridcore.calc.model.CellAddress;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class DependencyGraphTest {

    private DependencyGraph graph;

    private static CellAddress at(String a1) {
        return CellAddress.fromA1(a1);
    }

    @Before
    public void setUp() {
        graph = new DependencyGraph();
    }

    @Test
    public void testForwardAndReverseStayInSync() {
        graph.setDependencies(at("C1"), List.of(at("A1"), at("B1")));
        graph.setDependencies(at("D1"), List.of(at("A1")));

        assertEquals(Set.of(at("A1"), at("B1")), graph.getDependencies(at("C1")));
        assertEquals(Set.of(at("C1"), at("D1")), graph.getDependents(at("A1")));
        assertEquals(3, graph.edgeCount());

        graph.setDependencies(at("C1"), List.of(at("B1")));
        assertEquals(Set.of(at("D1")), graph.getDependents(at("A1")));
        assertEquals(Set.of(at("C1")), graph.getDependents(at("B1")));

        graph.removeDependenciesFor(at("C1"));
        assertTrue(graph.getDependents(at("B1")).isEmpty());
        assertTrue(graph.getDependencies(at("C1")).isEmpty());
        assertEquals(1, graph.size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testReturnedSetsAreReadOnly() {
        graph.addDependency(at("B1"), at("A1"));
        graph.getDependents(at("A1")).add(at("Z1"));
    }

    @Test
    public void testWouldCreateCycle() {
        // C1 reads B1, B1 reads A1
        graph.addDependency(at("C1"), at("B1"));
        graph.addDependency(at("B1"), at("A1"));

        assertTrue(graph.wouldCreateCycle(at("A1"), at("C1")));
        assertTrue(graph.wouldCreateCycle(at("A1"), at("A1")));
        assertFalse(graph.wouldCreateCycle(at("D1"), at("C1")));
        assertFalse(graph.wouldCreateCycle(at("C1"), at("A1")));
    }

    @Test
    public void testAffectedCellsComeAfterTheirDependencies() {
        // B1 = A1, C1 = A1 + B1, D1 = C1, E1 unrelated
        graph.addDependency(at("B1"), at("A1"));
        graph.addDependency(at("C1"), at("A1"));
        graph.addDependency(at("C1"), at("B1"));
        graph.addDependency(at("D1"), at("C1"));
        graph.addDependency(at("E1"), at("Z9"));

        List<CellAddress> affected = graph.getAffectedCells(Set.of(at("A1")));
        assertEquals(List.of(at("A1"), at("B1"), at("C1"), at("D1")), affected);

        List<CellAddress> fromB = graph.getAffectedCells(Set.of(at("B1")));
        assertEquals(List.of(at("B1"), at("C1"), at("D1")), fromB);
    }

    @Test
    public void testAffectedCellsTerminateOnCycles() {
        graph.addDependency(at("A1"), at("B1"));
        graph.addDependency(at("B1"), at("A1"));
        graph.addDependency(at("C1"), at("B1"));

        List<CellAddress> affected = graph.getAffectedCells(Set.of(at("A1")));
        assertEquals(3, affected.size());
        assertTrue(affected.containsAll(List.of(at("A1"), at("B1"), at("C1"))));
        assertTrue(affected.indexOf(at("C1")) > affected.indexOf(at("B1")));
    }

    @Test
    public void testCalculationOrder() {
        graph.addDependency(at("B2"), at("A1"));
        graph.addDependency(at("C3"), at("B2"));
        CalculationOrder order = graph.calculationOrder();
        assertEquals(List.of(at("A1"), at("B2"), at("C3")), order.cells());
        assertEquals(Set.of(at("B2"), at("C3")), graph.cellsWithDependencies());

        graph.clear();
        assertTrue(graph.isEmpty());
        assertEquals(0, graph.calculationOrder().nodeCount());
    }
}
