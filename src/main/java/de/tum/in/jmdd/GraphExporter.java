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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Contracts the bit-level formula of a {@link DecisionDiagram} into a variable-level
 * {@link LabeledGraph}. Every run of nodes testing bits of the same variable becomes a single node
 * with one edge per distinct successor, labeled by the disjunction of all bit paths leading there.
 *
 * <p>Exporting fixes the variable order of the manager, see {@link Interface#order(List)}.</p>
 */
public final class GraphExporter {
    private static final Logger logger = Logger.getLogger(GraphExporter.class.getName());

    private GraphExporter() {}

    public static LabeledGraph<Formula> symbolic(DecisionDiagram diagram) {
        return symbolic(diagram, ExportOptions.defaults());
    }

    /**
     * Exports the diagram with edges labeled by formulas over the bits of their source variable.
     *
     * @throws IllegalArgumentException if the diagram's formula is constant.
     * @throws MalformedNodeNameException if a leaf does not decide an output bit.
     * @throws NotFullyEvaluatedException if a leaf does not determine a single output value, or if
     *     some admissible inputs reach the true terminal without passing the output.
     */
    public static LabeledGraph<Formula> symbolic(DecisionDiagram diagram, ExportOptions options) {
        diagram.order(options.order());
        Contraction contraction = new Contraction(diagram);
        contraction.contract();
        if (options.eliminateRedundantNodes()) {
            contraction.eliminateRedundantNodes();
        }
        LabeledGraph<Formula> graph = contraction.toGraph(options.reindex());
        logger.log(Level.FINER, "Exported diagram with {0} nodes and {1} edges",
                new Object[] {graph.nodeCount(), graph.edgeCount()});
        return graph;
    }

    public static LabeledGraph<Set<Object>> concrete(DecisionDiagram diagram) {
        return concrete(diagram, ExportOptions.defaults());
    }

    /**
     * Exports the diagram with edges labeled by the set of values of their source variable.
     *
     * @throws IllegalStateException if some edge admits no value.
     */
    public static LabeledGraph<Set<Object>> concrete(DecisionDiagram diagram, ExportOptions options) {
        LabeledGraph<Formula> graph = symbolic(diagram, options);
        Interface anInterface = diagram.getInterface();
        return graph.mapEdges(edge -> {
            String name = (String) graph.node(edge.source()).label();
            return values(anInterface.var(name), edge.label());
        });
    }

    /**
     * Returns the values of {@code variable} whose encoding satisfies {@code guard}.
     */
    static Set<Object> values(Variable variable, Formula guard) {
        if (guard.isFalse()) {
            throw new IllegalStateException("Guard over " + variable.name() + " is unsatisfiable");
        }
        Set<Object> values = new LinkedHashSet<>();
        for (Map<String, Boolean> model : guard.models(variable.bitNames())) {
            values.add(variable.decode(variable.unblast(model)));
        }
        return values;
    }

    private static final class Contraction {
        private final BddManager manager;
        private final Interface anInterface;
        private final int start;
        private final Map<String, Formula> validFormulas = new HashMap<>();

        private int root;
        /* Node id to variable name or output value, in discovery order. */
        private final Map<Integer, Object> labels = new LinkedHashMap<>();
        private final Set<Integer> leaves = new HashSet<>();
        private final Map<Integer, Map<Integer, Formula>> successors = new HashMap<>();

        Contraction(DecisionDiagram diagram) {
            this.manager = diagram.manager();
            this.anInterface = diagram.getInterface();
            this.start = manager.node(diagram.formula());
            if (manager.isLeaf(start)) {
                throw new IllegalArgumentException("Cannot export constant formula " + diagram.formula());
            }
        }

        void contract() {
            root = start;
            Deque<Integer> stack = new ArrayDeque<>();
            Set<Integer> visited = new HashSet<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                int node = stack.pop();
                if (!visited.add(node)) {
                    continue;
                }
                String bit = manager.variableName(node);
                BitName name = BitName.parse(bit);
                Variable variable = anInterface.find(name.signal());
                if (variable == null) {
                    throw new MalformedNodeNameException(bit, "no variable " + name.signal() + " in interface");
                }

                Map<Integer, Formula> children = transitions(variable, node);
                Map<Integer, Formula> edges = new LinkedHashMap<>();
                successors.put(node, edges);
                if (children.isEmpty()) {
                    labels.put(node, leafValue(node, bit, name));
                    leaves.add(node);
                    continue;
                }
                labels.put(node, variable.name());
                Formula valid = validFormula(variable);
                children.forEach((child, guard) -> edges.put(child, guard.and(valid)));

                List<Integer> targets = new ArrayList<>(children.keySet());
                Collections.reverse(targets);
                targets.forEach(stack::push);
            }
        }

        /**
         * Follows all paths from {@code blockStart} through the bits of {@code variable} and returns the
         * first node after the block of each path together with the disjunction of the paths.
         */
        private Map<Integer, Formula> transitions(Variable variable, int blockStart) {
            Map<Integer, Formula> destinations = new LinkedHashMap<>();
            Map<Integer, Formula> pending = new HashMap<>();
            PriorityQueue<Integer> queue = new PriorityQueue<>(Comparator.comparingInt(this::level));
            pending.put(blockStart, manager.trueFormula());
            queue.add(blockStart);

            // Nodes are processed top to bottom, so each node has collected all its paths when polled
            while (!queue.isEmpty()) {
                int node = queue.poll();
                Formula guard = pending.remove(node);
                Formula bit = manager.variable(manager.variableName(node));
                follow(variable, manager.high(node), guard.and(bit), pending, queue, destinations);
                follow(variable, manager.low(node), guard.and(bit.not()), pending, queue, destinations);
            }
            return destinations;
        }

        private void follow(Variable variable, int child, Formula guard, Map<Integer, Formula> pending,
                PriorityQueue<Integer> queue, Map<Integer, Formula> destinations) {
            if (child == NodeTable.TRUE_NODE && !variable.name().equals(anInterface.output().name())) {
                // Some values of this variable are accepted without any constraint on the output
                throw new NotFullyEvaluatedException("Output is not determined on a path through "
                        + variable.name(), new LinkedHashSet<>(anInterface.output().bitNames()));
            }
            if (manager.isLeaf(child)) {
                return;
            }
            String signal = BitName.parse(manager.variableName(child)).signal();
            if (!signal.equals(variable.name())) {
                destinations.merge(child, guard, Formula::or);
            } else if (pending.containsKey(child)) {
                pending.merge(child, guard, Formula::or);
            } else {
                pending.put(child, guard);
                queue.add(child);
            }
        }

        private int level(int node) {
            return manager.level(manager.variableName(node));
        }

        private Object leafValue(int node, String bit, BitName name) {
            Variable output = anInterface.output();
            if (!name.signal().equals(output.name())) {
                throw new MalformedNodeNameException(bit, "leaf does not decide output " + output.name());
            }
            if (name.index() >= output.size()) {
                throw new MalformedNodeNameException(bit, "output " + output.name() + " has only "
                        + output.size() + " bits");
            }
            if (!manager.isLiteral(node)) {
                throw new NotFullyEvaluatedException("Output is not determined at bit " + bit,
                        manager.support(node));
            }
            BitSet encoded = new BitSet(output.size());
            encoded.set(name.index());
            return output.decode(encoded);
        }

        private Formula validFormula(Variable variable) {
            return validFormulas.computeIfAbsent(variable.name(), name -> variable.valid().toFormula(manager));
        }

        /**
         * Bypasses inner nodes whose only edge admits every value and merges edges with equal source
         * and target, until neither applies.
         */
        void eliminateRedundantNodes() {
            while (true) {
                Map<Integer, Integer> bypass = new HashMap<>();
                for (Map.Entry<Integer, Object> entry : labels.entrySet()) {
                    int node = entry.getKey();
                    Map<Integer, Formula> edges = successors.get(node);
                    if (leaves.contains(node) || edges.size() != 1) {
                        continue;
                    }
                    Map.Entry<Integer, Formula> edge = edges.entrySet().iterator().next();
                    if (edge.getValue() == validFormula(anInterface.var((String) entry.getValue()))) {
                        bypass.put(node, edge.getKey());
                    }
                }
                if (bypass.isEmpty()) {
                    return;
                }

                root = resolve(root, bypass);
                labels.keySet().removeAll(bypass.keySet());
                successors.keySet().removeAll(bypass.keySet());
                for (Map.Entry<Integer, Map<Integer, Formula>> entry : successors.entrySet()) {
                    Map<Integer, Formula> merged = new LinkedHashMap<>();
                    entry.getValue().forEach((target, guard) ->
                            merged.merge(resolve(target, bypass), guard, Formula::or));
                    entry.setValue(merged);
                }
            }
        }

        private static int resolve(int node, Map<Integer, Integer> bypass) {
            int current = node;
            Integer next = bypass.get(current);
            while (next != null) {
                current = next;
                next = bypass.get(current);
            }
            return current;
        }

        LabeledGraph<Formula> toGraph(boolean reindex) {
            // Depth-first discovery order of the remaining nodes
            Map<Integer, Integer> ids = new LinkedHashMap<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                int node = stack.pop();
                if (ids.containsKey(node)) {
                    continue;
                }
                ids.put(node, reindex ? ids.size() : node);
                List<Integer> targets = new ArrayList<>(successors.get(node).keySet());
                Collections.reverse(targets);
                targets.forEach(stack::push);
            }

            LabeledGraph.Builder<Formula> builder = LabeledGraph.builder();
            ids.forEach((node, id) -> builder.addNode(id, labels.get(node), leaves.contains(node)));
            ids.forEach((node, id) -> successors.get(node).forEach((target, guard) ->
                    builder.addEdge(id, ids.get(target), guard)));
            return builder.build(ids.get(root));
        }
    }
}
