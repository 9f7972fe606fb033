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
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import javax.annotation.Nullable;

/**
 * A boolean function represented by a node of a {@link BddManager}. Formulas are canonical within
 * their manager, hence {@link #equals(Object)} is object identity.
 *
 * <p>The underlying node may change when the manager is reordered, the represented function does
 * not.</p>
 */
public final class Formula {
    private final BddManager manager;
    private int node;

    Formula(BddManager manager, int node) {
        this.manager = manager;
        this.node = node;
    }

    int node() {
        return node;
    }

    void relocate(int node) {
        this.node = node;
    }

    public BddManager manager() {
        return manager;
    }

    public boolean isTrue() {
        return node == NodeTable.TRUE_NODE;
    }

    public boolean isFalse() {
        return node == NodeTable.FALSE_NODE;
    }

    public boolean isConstant() {
        return manager.isLeaf(node);
    }

    /**
     * Determines whether this formula is a single, non-negated bit.
     */
    public boolean isLiteral() {
        return manager.isLiteral(node);
    }

    /**
     * Returns the bit tested at the root of this formula or {@code null} for constants.
     */
    @Nullable
    public String variable() {
        return isConstant() ? null : manager.variableName(node);
    }

    public Formula and(Formula other) {
        return manager.make(manager.and(node, manager.node(other)));
    }

    public Formula or(Formula other) {
        return manager.make(manager.or(node, manager.node(other)));
    }

    public Formula xor(Formula other) {
        return manager.make(manager.xor(node, manager.node(other)));
    }

    public Formula not() {
        return manager.make(manager.not(node));
    }

    public Formula implies(Formula other) {
        return manager.make(manager.or(manager.not(node), manager.node(other)));
    }

    public Formula iff(Formula other) {
        return manager.make(manager.not(manager.xor(node, manager.node(other))));
    }

    public Formula ite(Formula thenFormula, Formula elseFormula) {
        return manager.make(manager.ifThenElse(node, manager.node(thenFormula), manager.node(elseFormula)));
    }

    /**
     * Replaces the given bits by constants, all other bits are left untouched.
     */
    public Formula restrict(Map<String, Boolean> assignment) {
        return manager.make(manager.restrict(node, assignment));
    }

    /**
     * Evaluates this formula.
     *
     * @throws IllegalArgumentException if a bit on the evaluation path has no value.
     */
    public boolean evaluate(Map<String, Boolean> assignment) {
        return manager.evaluate(node, assignment);
    }

    /**
     * Returns the bits this formula depends on, ordered by level.
     */
    public Set<String> support() {
        return manager.support(node);
    }

    /**
     * Number of distinct nodes of this formula, leaves included.
     */
    public int dagSize() {
        return manager.dagSize(node);
    }

    /**
     * Returns all satisfying assignments over {@code careVariables}, which has to contain the support.
     */
    public List<Map<String, Boolean>> models(Collection<String> careVariables) {
        List<Map<String, Boolean>> models = new ArrayList<>();
        manager.forEachModel(node, careVariables, model -> models.add(new LinkedHashMap<>(model)));
        return models;
    }

    @Override
    public String toString() {
        if (isTrue()) {
            return "true";
        }
        if (isFalse()) {
            return "false";
        }
        StringJoiner disjunction = new StringJoiner(" | ");
        List<String> path = new ArrayList<>();
        appendPaths(node, path, disjunction);
        return disjunction.toString();
    }

    private void appendPaths(int current, List<String> path, StringJoiner disjunction) {
        if (current == NodeTable.FALSE_NODE) {
            return;
        }
        if (current == NodeTable.TRUE_NODE) {
            disjunction.add(path.size() == 1 ? path.get(0) : "(" + String.join(" & ", path) + ")");
            return;
        }
        String name = manager.variableName(current);
        path.add("!" + name);
        appendPaths(manager.low(current), path, disjunction);
        path.set(path.size() - 1, name);
        appendPaths(manager.high(current), path, disjunction);
        path.remove(path.size() - 1);
    }
}
