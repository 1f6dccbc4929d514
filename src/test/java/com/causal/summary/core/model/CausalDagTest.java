package com.causal.summary.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CausalDag Tests")
class CausalDagTest {

    private static final Cluster A = Cluster.of("A");
    private static final Cluster B = Cluster.of("B");
    private static final Cluster C = Cluster.of("C");
    private static final Cluster D = Cluster.of("D");

    @Nested
    @DisplayName("Structure")
    class StructureTests {

        @Test
        @DisplayName("Adding an edge adds both endpoints")
        void edgeAddsEndpoints() {
            CausalDag dag = CausalDag.builder().addEdge("A", "B").build();

            assertEquals(2, dag.nodeCount());
            assertEquals(1, dag.edgeCount());
            assertTrue(dag.hasEdge(A, B));
            assertFalse(dag.hasEdge(B, A));
        }

        @Test
        @DisplayName("Duplicate edges collapse")
        void duplicateEdgesCollapse() {
            CausalDag dag = CausalDag.builder().addEdge("A", "B").addEdge("A", "B").build();

            assertEquals(1, dag.edgeCount());
        }

        @Test
        @DisplayName("Nodes are enumerated in insertion order")
        void enumerationOrder() {
            CausalDag dag = CausalDag.builder().addNode("C").addEdge("A", "B").build();

            assertEquals(List.of(C, A, B), List.copyOf(dag.nodes()));
        }

        @Test
        @DisplayName("Neighbour sets reflect edges")
        void neighbours() {
            CausalDag dag = SampleGraphs.diamond();

            assertEquals(Set.of(B, C), dag.successors(A));
            assertEquals(Set.of(B, C), dag.predecessors(D));
            assertTrue(dag.predecessors(A).isEmpty());
        }

        @Test
        @DisplayName("Querying an unknown node fails")
        void unknownNode() {
            CausalDag dag = SampleGraphs.chain("A", "B");

            assertThrows(IllegalArgumentException.class, () -> dag.successors(D));
        }

        @Test
        @DisplayName("Snapshot views cannot be modified")
        void immutableViews() {
            CausalDag dag = SampleGraphs.chain("A", "B");

            assertThrows(UnsupportedOperationException.class, () -> dag.nodes().add(C));
            assertThrows(UnsupportedOperationException.class, () -> dag.successors(A).add(C));
        }

        @Test
        @DisplayName("Builder edits do not leak into a built graph")
        void builderIsolation() {
            CausalDag.Builder builder = CausalDag.builder().addEdge("A", "B");
            CausalDag dag = builder.build();
            builder.addEdge("B", "C");

            assertEquals(2, dag.nodeCount());
            assertFalse(dag.containsNode(C));
        }

        @Test
        @DisplayName("removeNode drops incident edges")
        void removeNode() {
            CausalDag dag = SampleGraphs.chain("A", "B", "C").toBuilder().removeNode(B).build();

            assertEquals(Set.of(A, C), dag.nodes());
            assertEquals(0, dag.edgeCount());
        }

        @Test
        @DisplayName("Equality ignores enumeration order")
        void structuralEquality() {
            CausalDag first = CausalDag.builder().addEdge("A", "B").addNode("C").build();
            CausalDag second = CausalDag.builder().addNode("C").addNode("B").addEdge("A", "B").build();

            assertEquals(first, second);
            assertEquals(first.hashCode(), second.hashCode());
            assertEquals(first, first.toBuilder().build());
            assertNotEquals(first, SampleGraphs.isolated("A", "B", "C"));
        }

        @Test
        @DisplayName("atomicIdentifiers flattens cluster members")
        void atomicIdentifiers() {
            CausalDag dag = CausalDag.builder()
                    .addEdge(Cluster.of(List.of("A", "B")), Cluster.of("C"))
                    .build();

            assertEquals(Set.of("A", "B", "C"), dag.atomicIdentifiers());
        }
    }

    @Nested
    @DisplayName("Paths and ordering")
    class OrderingTests {

        @Test
        @DisplayName("hasPath follows directed edges only")
        void hasPath() {
            CausalDag dag = SampleGraphs.chain("A", "B", "C");

            assertTrue(dag.hasPath(A, C));
            assertFalse(dag.hasPath(C, A));
            assertFalse(dag.hasPath(A, A));
        }

        @Test
        @DisplayName("Topological order respects every edge")
        void topologicalOrder() {
            CausalDag dag = SampleGraphs.randomDag(12, 0.3, 7L);
            List<Cluster> order = dag.topologicalOrder();

            assertEquals(dag.nodeCount(), order.size());
            for (Edge edge : dag.edges()) {
                assertTrue(order.indexOf(edge.source()) < order.indexOf(edge.target()), edge.toString());
            }
        }

        @Test
        @DisplayName("Ready nodes are ordered by enumeration")
        void stableTopologicalOrder() {
            CausalDag dag = CausalDag.builder().addNode("B").addNode("A").addEdge("A", "C").build();

            assertEquals(List.of(B, A, C), dag.topologicalOrder());
        }

        @Test
        @DisplayName("Cycles are detected")
        void cycleDetection() {
            CausalDag cyclic = CausalDag.builder().addEdge("A", "B").addEdge("B", "C").addEdge("C", "A").build();

            assertFalse(cyclic.isAcyclic());
            assertThrows(InvalidGraphException.class, cyclic::topologicalOrder);
            assertTrue(SampleGraphs.diamond().isAcyclic());
        }

        @Test
        @DisplayName("A self-loop counts as a cycle")
        void selfLoop() {
            CausalDag dag = CausalDag.builder().addEdge(A, A).build();

            assertFalse(dag.isAcyclic());
            assertThrows(InvalidGraphException.class, dag::topologicalOrder);
        }

        @Test
        @DisplayName("A self-loop next to an acyclic component is still a cycle")
        void selfLoopBesideDag() {
            CausalDag dag = SampleGraphs.diamond().toBuilder().addEdge("E", "E").build();

            assertFalse(dag.isAcyclic());
        }

        @Test
        @DisplayName("Reachability walks from every source")
        void reachesFromSeveralSources() {
            CausalDag dag = CausalDag.builder().addEdge("A", "B").addEdge("C", "D").build();

            assertTrue(dag.reaches(List.of(A, C), D));
            assertTrue(dag.reaches(List.of(C), C));
            assertFalse(dag.reaches(List.of(B, D), A));
            assertFalse(dag.reaches(List.of(), A));
        }

        @Test
        @DisplayName("Edges are grouped by source in enumeration order")
        void edgeEnumeration() {
            CausalDag dag = CausalDag.builder()
                    .addNode("B")
                    .addEdge("A", "C")
                    .addEdge("B", "C")
                    .addEdge("A", "B")
                    .build();

            assertEquals(List.of(new Edge(B, C), new Edge(A, C), new Edge(A, B)), dag.edges());
        }
    }
}
