/*
 * This file is part of JMDD.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JMDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JMDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JMDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jmdd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class GraphExporterTest {
    private static Interface interfaceXy(BddManager manager) {
        return Interface.builder(manager)
                .input("x", ImmutableList.of(1, 2, 3, 4, 5))
                .input("y", ImmutableList.of('a', 'b'))
                .output(ImmutableList.of(-1, 0, 1), "out")
                .build();
    }

    /**
     * Yields 0 if x is 1 and y is 'a', and 1 otherwise.
     */
    private static DecisionDiagram testFirstBits(Interface anInterface) {
        Expression test = anInterface.var("x").bit(0).and(anInterface.var("y").bit(0));
        Variable output = anInterface.output();
        return anInterface.lift(test.ite(output.bit(1), output.bit(2)));
    }

    private static void checkPartition(Interface anInterface, LabeledGraph<Set<Object>> graph) {
        for (LabeledGraph.Node node : graph.nodes()) {
            if (node.isLeaf()) {
                assertThat(graph.outgoing(node.id()), is(empty()));
                continue;
            }
            Set<Object> union = new HashSet<>();
            int total = 0;
            for (LabeledGraph.Edge<Set<Object>> edge : graph.outgoing(node.id())) {
                assertThat(edge.label().isEmpty(), is(false));
                union.addAll(edge.label());
                total += edge.label().size();
            }
            assertThat(total, is(union.size()));
            assertThat(union, is(new HashSet<>(anInterface.var((String) node.label()).domain())));
        }
    }

    @Test
    public void testNodeCount() {
        DecisionDiagram diagram = testFirstBits(interfaceXy(BddManager.create()));
        LabeledGraph<Formula> graph = GraphExporter.symbolic(diagram);
        assertThat(graph.nodeCount(), is(4));
        assertThat(graph.edgeCount(), is(4));
        assertThat(graph.root().label(), is("x"));
        assertThat(graph.root().id(), is(0));
    }

    @Test
    public void testLeaves() {
        LabeledGraph<Formula> graph = testFirstBits(interfaceXy(BddManager.create())).toGraph();
        Set<Object> leafValues = new HashSet<>();
        for (LabeledGraph.Node node : graph.nodes()) {
            if (node.isLeaf()) {
                leafValues.add(node.label());
            }
        }
        assertThat(leafValues, is(ImmutableSet.of(0, 1)));
    }

    @Test
    public void testSymbolicGuards() {
        BddManager manager = BddManager.create();
        Interface anInterface = interfaceXy(manager);
        LabeledGraph<Formula> graph = testFirstBits(anInterface).toGraph();
        Variable x = anInterface.var("x");

        Map<Boolean, Formula> guards = new HashMap<>();
        for (LabeledGraph.Edge<Formula> edge : graph.outgoing(graph.root().id())) {
            guards.put(graph.node(edge.target()).isLeaf(), edge.label());
        }
        Formula toLeaf = x.bit(0).not().and(x.valid()).toFormula(manager);
        Formula toInner = x.bit(0).and(x.valid()).toFormula(manager);
        assertThat(guards.get(true), sameInstance(toLeaf));
        assertThat(guards.get(false), sameInstance(toInner));
        assertThat(guards.get(true).support(), containsInAnyOrder(x.bitNames().toArray()));
    }

    @Test
    public void testConcreteEdges() {
        Interface anInterface = interfaceXy(BddManager.create());
        LabeledGraph<Set<Object>> graph = testFirstBits(anInterface).toConcreteGraph();
        checkPartition(anInterface, graph);

        Map<Object, Set<Object>> rootEdges = new HashMap<>();
        for (LabeledGraph.Edge<Set<Object>> edge : graph.outgoing(graph.root().id())) {
            rootEdges.put(graph.node(edge.target()).label(), edge.label());
        }
        assertThat(rootEdges.get("y"), is(ImmutableSet.of(1)));
        assertThat(rootEdges.get(1), is(ImmutableSet.of(2, 3, 4, 5)));

        LabeledGraph.Node decideY = graph.successors(graph.root().id()).stream()
                .filter(node -> !node.isLeaf())
                .findAny()
                .get();
        Map<Object, Set<Object>> yEdges = new HashMap<>();
        for (LabeledGraph.Edge<Set<Object>> edge : graph.outgoing(decideY.id())) {
            yEdges.put(graph.node(edge.target()).label(), edge.label());
        }
        assertThat(yEdges.get(0), is(ImmutableSet.of('a')));
        assertThat(yEdges.get(1), is(ImmutableSet.of('b')));
    }

    @Test
    public void testWithoutRedundancyElimination() {
        DecisionDiagram diagram = testFirstBits(interfaceXy(BddManager.create()));
        ExportOptions options = ImmutableExportOptions.builder().eliminateRedundantNodes(false).build();
        LabeledGraph<Formula> graph = GraphExporter.symbolic(diagram, options);
        assertThat(graph.nodeCount(), is(5));
        assertThat(graph.edgeCount(), is(5));
        checkPartition(diagram.getInterface(), GraphExporter.concrete(diagram, options));
    }

    @Test
    public void testExplicitOrder() {
        BddManager manager = BddManager.create();
        Interface anInterface = interfaceXy(manager);
        DecisionDiagram diagram = testFirstBits(anInterface);
        ExportOptions options = ImmutableExportOptions.builder().addOrder("y").build();
        LabeledGraph<Set<Object>> graph = GraphExporter.concrete(diagram, options);

        assertThat(manager.order().get(0), is("y[0]"));
        assertThat(graph.root().label(), is("y"));
        assertThat(graph.nodeCount(), is(4));
        checkPartition(anInterface, graph);
    }

    @Test
    public void testConstantDiagram() {
        Interface anInterface = interfaceXy(BddManager.create());
        LabeledGraph<Set<Object>> graph = anInterface.constantly(-1).toConcreteGraph();
        assertThat(graph.nodeCount(), is(1));
        assertThat(graph.edgeCount(), is(0));
        assertThat(graph.root().isLeaf(), is(true));
        assertThat(graph.root().label(), is(-1));
    }

    @Test
    public void testOverriddenDiagram() {
        Interface anInterface = interfaceXy(BddManager.create());
        DecisionDiagram diagram = anInterface.constantly(-1)
                .override(anInterface.var("x").equalTo(3), 0)
                .override(anInterface.var("y").equalTo('b'), 1);
        LabeledGraph<Set<Object>> graph = diagram.toConcreteGraph();
        checkPartition(anInterface, graph);
        for (LabeledGraph.Node node : graph.nodes()) {
            if (node.isLeaf()) {
                assertThat(ImmutableSet.of(-1, 0, 1).contains(node.label()), is(true));
            }
        }
        assertThat(graph.nodeCount(), is(6));
        assertThat(graph.edgeCount(), is(6));
    }

    @Test
    public void testRawNodeIds() {
        DecisionDiagram diagram = testFirstBits(interfaceXy(BddManager.create()));
        LabeledGraph<Formula> graph = GraphExporter.symbolic(diagram,
                ImmutableExportOptions.builder().reindex(false).build());
        assertThat(graph.nodeCount(), is(4));
        for (LabeledGraph.Node node : graph.nodes()) {
            assertThat(node.id(), greaterThan(0));
        }
    }

    @Test
    public void testUnsatisfiableDiagram() {
        Variable x = Variable.of(ImmutableList.of(1, 2), "x");
        Interface anInterface = Interface.builder(BddManager.create())
                .input(x)
                .output(ImmutableList.of(0), "out")
                .constraint(x.equalTo(1).and(x.equalTo(2)))
                .build();
        DecisionDiagram diagram = anInterface.constantly(0);
        assertThat(diagram.formula().isFalse(), is(true));
        assertThrows(IllegalArgumentException.class, diagram::toGraph);
    }

    @Test
    public void testPartiallyDeterminedOutput() {
        Interface anInterface = Interface.builder(BddManager.create())
                .input("z", ImmutableList.of(7, 9, 8))
                .output(ImmutableList.of(-1, 0), "out")
                .build();
        Variable z = anInterface.var("z");
        DecisionDiagram diagram = anInterface.lift(z.equalTo(7).implies(anInterface.output().bit(0)));
        assertThat(diagram.evaluate(ImmutableMap.of("z", 7)), is(-1));
        assertThrows(NotFullyEvaluatedException.class, () -> diagram.evaluate(ImmutableMap.of("z", 9)));

        NotFullyEvaluatedException exception = assertThrows(NotFullyEvaluatedException.class,
                diagram::toConcreteGraph);
        assertThat(exception.remainingBits(), containsInAnyOrder("out[0]", "out[1]"));
        assertThrows(NotFullyEvaluatedException.class, diagram::toGraph);
        assertThrows(NotFullyEvaluatedException.class,
                () -> GraphExporter.concrete(diagram,
                        ImmutableExportOptions.builder().eliminateRedundantNodes(false).build()));
    }

    @Test
    public void testUnsatisfiableGuard() {
        BddManager manager = BddManager.create();
        Variable x = interfaceXy(manager).var("x");
        assertThrows(IllegalStateException.class, () -> GraphExporter.values(x, manager.falseFormula()));
        assertThat(GraphExporter.values(x, x.equalTo(4).toFormula(manager)), is(ImmutableSet.of(4)));
    }

    @Test
    public void testDot() {
        String dot = testFirstBits(interfaceXy(BddManager.create())).toGraph().toDot();
        assertThat(dot, containsString("digraph"));
        assertThat(dot, containsString("0 -> "));
        assertThat(dot, containsString("label=\"x\""));
    }
}
