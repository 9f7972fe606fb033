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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A shared table of binary decision nodes over <i>named</i> boolean variables, together with the
 * current variable order. All {@link Formula formulas} created by a manager are canonical: two
 * formulas of the same manager are equal iff they represent the same boolean function, iff they are
 * the same object.
 *
 * <p>The variable order is global state of the manager. Calling {@link #reorder(Map)} rebuilds the
 * node table and relocates every formula still referenced by the program, so the change is visible to
 * every formula (and every {@link DecisionDiagram}) of this manager. Formulas keep their meaning, their
 * node ids do not.</p>
 *
 * <p>Note that managers are not thread safe. Callers who need parallelism should use one manager per
 * thread. Formulas of different managers must never be combined; doing so raises an
 * {@link IllegalArgumentException}.</p>
 */
public final class BddManager {
    private static final Logger logger = Logger.getLogger(BddManager.class.getName());

    private static final int UNASSIGNED = -1;
    private static final int LEAF_LEVEL = Integer.MAX_VALUE;

    private final ManagerConfiguration configuration;
    private final FormulaReferences references = new FormulaReferences();

    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> ids = new HashMap<>();
    /* Maps variable ids to their level and levels back to variable ids. */
    private int[] levelOf = new int[16];
    private int[] variableAt = new int[16];

    private NodeTable table;
    private OperationCache cache;
    private boolean autoReorder;
    private long reorderCount = 0;

    private BddManager(ManagerConfiguration configuration) {
        this.configuration = configuration;
        this.autoReorder = configuration.autoReorder();
        this.table = new NodeTable(configuration.initialSize(), configuration.growthFactor());
        this.cache = new OperationCache(configuration.initialSize(), configuration);
    }

    public static BddManager create() {
        return create(ImmutableManagerConfiguration.builder().build());
    }

    public static BddManager create(ManagerConfiguration configuration) {
        return new BddManager(configuration);
    }

    // Variables and constants

    public Formula trueFormula() {
        return make(NodeTable.TRUE_NODE);
    }

    public Formula falseFormula() {
        return make(NodeTable.FALSE_NODE);
    }

    public Formula constant(boolean value) {
        return value ? trueFormula() : falseFormula();
    }

    /**
     * Returns the formula of the bit {@code name}. Bits are declared on first use; a new bit is placed
     * below all existing ones.
     */
    public Formula variable(String name) {
        return make(variableNode(declare(name)));
    }

    public boolean isDeclared(String name) {
        return ids.containsKey(name);
    }

    /**
     * Returns all declared bits in declaration order.
     */
    public Set<String> variableNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    /**
     * Returns all declared bits ordered by their current level, top-most first.
     */
    public List<String> order() {
        List<String> order = new ArrayList<>(names.size());
        for (int level = 0; level < names.size(); level++) {
            order.add(names.get(variableAt[level]));
        }
        return order;
    }

    /**
     * Returns the level of every declared bit.
     */
    public Map<String, Integer> levels() {
        Map<String, Integer> levels = new LinkedHashMap<>();
        for (int level = 0; level < names.size(); level++) {
            levels.put(names.get(variableAt[level]), level);
        }
        return levels;
    }

    public int level(String name) {
        Integer id = ids.get(name);
        if (id == null) {
            throw new IllegalArgumentException("Unknown variable " + name);
        }
        return levelOf[id];
    }

    int declare(String name) {
        Integer existing = ids.get(name);
        if (existing != null) {
            return existing;
        }
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Variable names must not be empty");
        }
        int id = names.size();
        if (id == levelOf.length) {
            levelOf = Arrays.copyOf(levelOf, id * 2);
            variableAt = Arrays.copyOf(variableAt, id * 2);
        }
        names.add(name);
        ids.put(name, id);
        levelOf[id] = id;
        variableAt[id] = id;
        logger.log(Level.FINER, "Declared variable {0} at level {1}", new Object[] {name, id});
        return id;
    }

    // Ordering

    public boolean autoReorder() {
        return autoReorder;
    }

    public void setAutoReorder(boolean autoReorder) {
        this.autoReorder = autoReorder;
    }

    /**
     * Convenience variant of {@link #reorder(Map)}, placing the given bits on the top-most levels in
     * the given order.
     */
    public void reorder(List<String> order) {
        Map<String, Integer> levels = new HashMap<>();
        for (String name : order) {
            if (levels.put(name, levels.size()) != null) {
                throw new IllegalArgumentException("Variable " + name + " appears twice in order " + order);
            }
        }
        reorder(levels);
    }

    /**
     * Imposes a new variable order. The bits in {@code levels} are placed on top, sorted by their
     * given level; all other declared bits follow in their current relative order. Only the relative
     * order of the given levels matters, gaps are allowed.
     *
     * <p>All live formulas of this manager are rebuilt under the new order, which also discards every
     * node not reachable from a live formula.</p>
     *
     * @throws IllegalArgumentException if a bit is not declared or two bits share a level.
     */
    public void reorder(Map<String, Integer> levels) {
        int[] newOrder = new int[names.size()];
        BitSet placed = new BitSet(names.size());
        Map<Integer, String> byLevel = new HashMap<>();
        for (Map.Entry<String, Integer> entry : levels.entrySet()) {
            Integer id = ids.get(entry.getKey());
            if (id == null) {
                throw new IllegalArgumentException("Unknown variable " + entry.getKey());
            }
            String previous = byLevel.put(entry.getValue(), entry.getKey());
            if (previous != null) {
                throw new IllegalArgumentException(String.format(
                        "Variables %s and %s share level %d", previous, entry.getKey(), entry.getValue()));
            }
            placed.set(id);
        }

        int position = 0;
        List<Integer> explicitLevels = new ArrayList<>(byLevel.keySet());
        Collections.sort(explicitLevels);
        for (int level : explicitLevels) {
            newOrder[position] = ids.get(byLevel.get(level));
            position += 1;
        }
        for (int level = 0; level < names.size(); level++) {
            int id = variableAt[level];
            if (!placed.get(id)) {
                newOrder[position] = id;
                position += 1;
            }
        }
        assert position == names.size();

        if (Arrays.equals(newOrder, 0, newOrder.length, variableAt, 0, newOrder.length)) {
            return;
        }
        rebuild(newOrder);
    }

    private void rebuild(int[] newOrder) {
        List<Formula> live = references.live();
        NodeTable oldTable = table;
        int oldSize = oldTable.size();

        for (int level = 0; level < newOrder.length; level++) {
            variableAt[level] = newOrder[level];
            levelOf[newOrder[level]] = level;
        }
        table = new NodeTable(Math.max(configuration.initialSize(), oldSize), configuration.growthFactor());
        cache = new OperationCache(Math.max(configuration.initialSize(), oldSize), configuration);

        int[] memo = new int[oldTable.bound()];
        Map<Formula, Integer> relocated = new HashMap<>();
        for (Formula formula : live) {
            relocated.put(formula, transfer(oldTable, formula.node(), memo));
        }
        references.relocate(relocated);
        reorderCount += 1;

        logger.log(Level.FINE, "Reordered {0} variables, relocated {1} formulas, {2} -> {3} nodes",
                new Object[] {newOrder.length, live.size(), oldSize, table.size()});
    }

    private int transfer(NodeTable source, int node, int[] memo) {
        if (NodeTable.isLeaf(node)) {
            return node;
        }
        if (memo[node] != NodeTable.NOT_A_NODE) {
            return memo[node];
        }
        int low = transfer(source, source.low(node), memo);
        int high = transfer(source, source.high(node), memo);
        int result = ifThenElse(variableNode(source.variableOf(node)), high, low);
        memo[node] = result;
        return result;
    }

    // Node level access

    Formula make(int node) {
        assert table.isNodeValidOrLeaf(node);
        return references.make(this, node);
    }

    int node(Formula formula) {
        if (formula.manager() != this) {
            throw new IllegalArgumentException("Formula " + formula + " belongs to a different manager");
        }
        return formula.node();
    }

    boolean isLeaf(int node) {
        return NodeTable.isLeaf(node);
    }

    boolean isLiteral(int node) {
        return !isLeaf(node) && table.low(node) == NodeTable.FALSE_NODE && table.high(node) == NodeTable.TRUE_NODE;
    }

    int low(int node) {
        return table.low(node);
    }

    int high(int node) {
        return table.high(node);
    }

    String variableName(int node) {
        return names.get(table.variableOf(node));
    }

    private int variableNode(int id) {
        return table.make(id, NodeTable.FALSE_NODE, NodeTable.TRUE_NODE);
    }

    private int levelOfNode(int node) {
        return isLeaf(node) ? LEAF_LEVEL : levelOf[table.variableOf(node)];
    }

    // Operations

    int and(int node1, int node2) {
        return apply(OperationCache.OPERATION_AND, node1, node2);
    }

    int or(int node1, int node2) {
        return apply(OperationCache.OPERATION_OR, node1, node2);
    }

    int xor(int node1, int node2) {
        return apply(OperationCache.OPERATION_XOR, node1, node2);
    }

    private int apply(byte operation, int node1, int node2) {
        int terminal = applyTerminal(operation, node1, node2);
        if (terminal != NodeTable.NOT_A_NODE) {
            return terminal;
        }
        // All supported operations are commutative
        if (node2 < node1) {
            int swap = node1;
            node1 = node2;
            node2 = swap;
        }
        if (cache.lookupBinary(operation, node1, node2)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int level1 = levelOfNode(node1);
        int level2 = levelOfNode(node2);
        int topLevel = Math.min(level1, level2);
        int low = apply(operation,
                level1 == topLevel ? table.low(node1) : node1,
                level2 == topLevel ? table.low(node2) : node2);
        int high = apply(operation,
                level1 == topLevel ? table.high(node1) : node1,
                level2 == topLevel ? table.high(node2) : node2);
        int result = table.make(variableAt[topLevel], low, high);
        cache.putBinary(hash, operation, node1, node2, result);
        return result;
    }

    private int applyTerminal(byte operation, int node1, int node2) {
        switch (operation) {
            case OperationCache.OPERATION_AND:
                if (node1 == node2 || node2 == NodeTable.TRUE_NODE) {
                    return node1;
                }
                if (node1 == NodeTable.FALSE_NODE || node2 == NodeTable.FALSE_NODE) {
                    return NodeTable.FALSE_NODE;
                }
                if (node1 == NodeTable.TRUE_NODE) {
                    return node2;
                }
                return NodeTable.NOT_A_NODE;
            case OperationCache.OPERATION_OR:
                if (node1 == node2 || node2 == NodeTable.FALSE_NODE) {
                    return node1;
                }
                if (node1 == NodeTable.TRUE_NODE || node2 == NodeTable.TRUE_NODE) {
                    return NodeTable.TRUE_NODE;
                }
                if (node1 == NodeTable.FALSE_NODE) {
                    return node2;
                }
                return NodeTable.NOT_A_NODE;
            case OperationCache.OPERATION_XOR:
                if (node1 == node2) {
                    return NodeTable.FALSE_NODE;
                }
                if (node1 == NodeTable.FALSE_NODE) {
                    return node2;
                }
                if (node2 == NodeTable.FALSE_NODE) {
                    return node1;
                }
                if (node1 == NodeTable.TRUE_NODE) {
                    return not(node2);
                }
                if (node2 == NodeTable.TRUE_NODE) {
                    return not(node1);
                }
                return NodeTable.NOT_A_NODE;
            default:
                throw new AssertionError("Unknown operation " + operation);
        }
    }

    int not(int node) {
        if (node == NodeTable.TRUE_NODE) {
            return NodeTable.FALSE_NODE;
        }
        if (node == NodeTable.FALSE_NODE) {
            return NodeTable.TRUE_NODE;
        }
        if (cache.lookupNot(node)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();
        int low = not(table.low(node));
        int high = not(table.high(node));
        int result = table.make(table.variableOf(node), low, high);
        cache.putNot(hash, node, result);
        return result;
    }

    int ifThenElse(int ifNode, int thenNode, int elseNode) {
        if (ifNode == NodeTable.TRUE_NODE || thenNode == elseNode) {
            return thenNode;
        }
        if (ifNode == NodeTable.FALSE_NODE) {
            return elseNode;
        }
        if (thenNode == NodeTable.TRUE_NODE) {
            return elseNode == NodeTable.FALSE_NODE ? ifNode : or(ifNode, elseNode);
        }
        if (thenNode == NodeTable.FALSE_NODE) {
            return elseNode == NodeTable.TRUE_NODE ? not(ifNode) : and(not(ifNode), elseNode);
        }
        if (elseNode == NodeTable.FALSE_NODE) {
            return and(ifNode, thenNode);
        }
        if (elseNode == NodeTable.TRUE_NODE) {
            return or(not(ifNode), thenNode);
        }

        if (cache.lookupIfThenElse(ifNode, thenNode, elseNode)) {
            return cache.lookupResult();
        }
        int hash = cache.lookupHash();

        int ifLevel = levelOfNode(ifNode);
        int thenLevel = levelOfNode(thenNode);
        int elseLevel = levelOfNode(elseNode);
        int topLevel = Math.min(ifLevel, Math.min(thenLevel, elseLevel));

        int low = ifThenElse(
                ifLevel == topLevel ? table.low(ifNode) : ifNode,
                thenLevel == topLevel ? table.low(thenNode) : thenNode,
                elseLevel == topLevel ? table.low(elseNode) : elseNode);
        int high = ifThenElse(
                ifLevel == topLevel ? table.high(ifNode) : ifNode,
                thenLevel == topLevel ? table.high(thenNode) : thenNode,
                elseLevel == topLevel ? table.high(elseNode) : elseNode);
        int result = table.make(variableAt[topLevel], low, high);
        cache.putIfThenElse(hash, ifNode, thenNode, elseNode, result);
        return result;
    }

    /**
     * Replaces the given bits by constants. Bits which are not declared are ignored, as no node can
     * depend on them.
     */
    int restrict(int node, Map<String, Boolean> assignment) {
        if (isLeaf(node) || assignment.isEmpty()) {
            return node;
        }
        int[] values = new int[names.size()];
        Arrays.fill(values, UNASSIGNED);
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            Integer id = ids.get(entry.getKey());
            if (id != null) {
                values[id] = entry.getValue() ? 1 : 0;
            }
        }
        return restrict(node, values, new int[table.bound()]);
    }

    private int restrict(int node, int[] values, int[] memo) {
        if (isLeaf(node)) {
            return node;
        }
        if (memo[node] != NodeTable.NOT_A_NODE) {
            return memo[node];
        }
        int variable = table.variableOf(node);
        int result;
        if (values[variable] == UNASSIGNED) {
            int low = restrict(table.low(node), values, memo);
            int high = restrict(table.high(node), values, memo);
            result = table.make(variable, low, high);
        } else {
            result = restrict(values[variable] == 1 ? table.high(node) : table.low(node), values, memo);
        }
        memo[node] = result;
        return result;
    }

    boolean evaluate(int node, Map<String, Boolean> assignment) {
        int current = node;
        while (!isLeaf(current)) {
            String name = variableName(current);
            Boolean value = assignment.get(name);
            if (value == null) {
                throw new IllegalArgumentException("No value given for variable " + name);
            }
            current = value ? table.high(current) : table.low(current);
        }
        return current == NodeTable.TRUE_NODE;
    }

    /**
     * Returns the support of {@code node}, ordered by level.
     */
    Set<String> support(int node) {
        BitSet support = new BitSet(names.size());
        BitSet visited = new BitSet(table.bound());
        supportRecursive(node, support, visited);

        Set<String> result = new LinkedHashSet<>();
        for (int level = 0; level < names.size(); level++) {
            if (support.get(variableAt[level])) {
                result.add(names.get(variableAt[level]));
            }
        }
        return result;
    }

    private void supportRecursive(int node, BitSet support, BitSet visited) {
        if (isLeaf(node) || visited.get(node)) {
            return;
        }
        visited.set(node);
        support.set(table.variableOf(node));
        supportRecursive(table.low(node), support, visited);
        supportRecursive(table.high(node), support, visited);
    }

    /**
     * Counts the distinct nodes reachable from {@code node}, leaves included.
     */
    int dagSize(int node) {
        BitSet visited = new BitSet(table.bound());
        BitSet leaves = new BitSet(2);
        int inner = countRecursive(node, visited, leaves);
        return inner + leaves.cardinality();
    }

    private int countRecursive(int node, BitSet visited, BitSet leaves) {
        if (isLeaf(node)) {
            leaves.set(node == NodeTable.TRUE_NODE ? 0 : 1);
            return 0;
        }
        if (visited.get(node)) {
            return 0;
        }
        visited.set(node);
        return 1 + countRecursive(table.low(node), visited, leaves) + countRecursive(table.high(node), visited, leaves);
    }

    /**
     * Calls {@code action} once for every satisfying assignment over {@code careVariables}. The
     * passed map is reused between calls.
     *
     * @throws IllegalArgumentException if the support of {@code node} is not contained in the care set.
     */
    void forEachModel(int node, Collection<String> careVariables, Consumer<Map<String, Boolean>> action) {
        Set<String> support = support(node);
        if (!careVariables.containsAll(support)) {
            Set<String> missing = new LinkedHashSet<>(support);
            missing.removeAll(careVariables);
            throw new IllegalArgumentException("Care set misses support variables " + missing);
        }
        int[] careIds = new int[careVariables.size()];
        int position = 0;
        for (String name : new LinkedHashSet<>(careVariables)) {
            declare(name);
            careIds[position] = ids.get(name);
            position += 1;
        }
        int[] careByLevel = Arrays.stream(careIds, 0, position)
                .boxed()
                .sorted((a, b) -> Integer.compare(levelOf[a], levelOf[b]))
                .mapToInt(Integer::intValue)
                .toArray();

        Map<String, Boolean> model = new LinkedHashMap<>();
        for (int id : careByLevel) {
            model.put(names.get(id), Boolean.FALSE);
        }
        forEachModelRecursive(node, careByLevel, 0, model, action);
    }

    private void forEachModelRecursive(int node, int[] careByLevel, int position, Map<String, Boolean> model,
            Consumer<Map<String, Boolean>> action) {
        if (node == NodeTable.FALSE_NODE) {
            return;
        }
        if (position == careByLevel.length) {
            assert node == NodeTable.TRUE_NODE;
            action.accept(model);
            return;
        }
        int variable = careByLevel[position];
        String name = names.get(variable);
        boolean tested = !isLeaf(node) && table.variableOf(node) == variable;

        model.put(name, Boolean.FALSE);
        forEachModelRecursive(tested ? table.low(node) : node, careByLevel, position + 1, model, action);
        model.put(name, Boolean.TRUE);
        forEachModelRecursive(tested ? table.high(node) : node, careByLevel, position + 1, model, action);
        model.put(name, Boolean.FALSE);
    }

    // Statistics and formatting

    public int nodeCount() {
        return table.size();
    }

    public String statistics() {
        return String.format("%d variables, %d reorders, %d live formulas%n%s%n%s",
                names.size(), reorderCount, references.size(), table.statistics(), cache.statistics());
    }

    @Override
    public String toString() {
        return String.format("BddManager@%d(%d variables, %d nodes)", System.identityHashCode(this),
                names.size(), table.size());
    }
}
