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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * The signature of a {@link DecisionDiagram}: named input {@link Variable variables}, one output
 * variable and, optionally, an additional constraint restricting the admissible inputs. The
 * interface also tracks which inputs have already been fixed by {@link DecisionDiagram#let(Map)}.
 *
 * <p>All bits of the interface are declared in the manager when the interface is built, inputs in
 * declaration order first and the output last.</p>
 */
public final class Interface {
    private final BddManager manager;
    private final Map<String, Variable> inputs;
    private final Variable output;
    private final Set<String> applied;
    @Nullable
    private final Expression constraint;

    private Interface(BddManager manager, Map<String, Variable> inputs, Variable output, Set<String> applied,
            @Nullable Expression constraint) {
        this.manager = manager;
        this.inputs = inputs;
        this.output = output;
        this.applied = applied;
        this.constraint = constraint;
    }

    public static Builder builder(BddManager manager) {
        return new Builder(manager);
    }

    public BddManager manager() {
        return manager;
    }

    /**
     * All inputs in declaration order, including applied ones.
     */
    public Map<String, Variable> inputs() {
        return inputs;
    }

    public Variable output() {
        return output;
    }

    public Set<String> applied() {
        return applied;
    }

    /**
     * Inputs not yet fixed by partial evaluation, in declaration order.
     */
    public Set<String> pendingInputs() {
        Set<String> pending = new LinkedHashSet<>(inputs.keySet());
        pending.removeAll(applied);
        return pending;
    }

    public Optional<Expression> constraint() {
        return Optional.ofNullable(constraint);
    }

    @Nullable
    public Variable find(String name) {
        Variable variable = inputs.get(name);
        if (variable != null) {
            return variable;
        }
        return output.name().equals(name) ? output : null;
    }

    /**
     * Resolves {@code name} to an input or, failing that, the output.
     *
     * @throws IllegalArgumentException if neither has this name.
     */
    public Variable var(String name) {
        Variable variable = find(name);
        if (variable == null) {
            throw new IllegalArgumentException("Interface has no variable " + name);
        }
        return variable;
    }

    /**
     * The bits a diagram over this interface may depend on: those of all pending inputs and of the
     * output.
     */
    public List<String> bitNames() {
        List<String> bitNames = new ArrayList<>();
        for (String name : pendingInputs()) {
            bitNames.addAll(inputs.get(name).bitNames());
        }
        bitNames.addAll(output.bitNames());
        return bitNames;
    }

    /**
     * The admissible inputs: every pending input is one-hot and the constraint holds. The output bits
     * are mentioned as don't-cares, so the inputs of the result always contain all of
     * {@link #bitNames()}.
     */
    public Expression valid() {
        List<Expression> conjuncts = new ArrayList<>();
        for (String name : pendingInputs()) {
            conjuncts.add(inputs.get(name).valid());
        }
        if (constraint != null && Collections.disjoint(constraint.signals(), applied)) {
            conjuncts.add(constraint);
        }
        conjuncts.add(Expression.care(output.bitNames()));
        return Expression.and(conjuncts);
    }

    /**
     * The diagram which yields {@code value} on every admissible input.
     *
     * @throws InvalidAssignmentException if {@code value} is not in the output domain.
     */
    public DecisionDiagram constantly(@Nullable Object value) {
        int index = output.encode(value).nextSetBit(0);
        return lift(output.bit(index));
    }

    public DecisionDiagram lift(Expression expression) {
        return lift(expression, Collections.emptyList());
    }

    /**
     * Lifts a raw expression to a diagram over this interface, restricted to admissible inputs. If
     * {@code order} is non-empty, the variable order is fixed before the formula is built.
     *
     * @throws EncodingMismatchException if the expression mentions bits outside {@link #bitNames()}, or
     *     if the lifted formula is satisfiable but does not depend on any output bit.
     */
    public DecisionDiagram lift(Expression expression, List<String> order) {
        Expression guarded = expression.and(valid());
        Set<String> expected = new LinkedHashSet<>(bitNames());
        Set<String> mismatch = symmetricDifference(guarded.inputs(), expected);
        if (!mismatch.isEmpty()) {
            throw new EncodingMismatchException("Expression does not match interface bits", mismatch);
        }
        if (!order.isEmpty()) {
            order(order);
        }
        return new DecisionDiagram(this, guarded.toFormula(manager));
    }

    public DecisionDiagram lift(Formula formula) {
        return lift(formula, Collections.emptyList());
    }

    /**
     * Lifts a formula of this interface's manager, restricted to admissible inputs. If {@code order}
     * is non-empty, the variable order is fixed first.
     *
     * @throws EncodingMismatchException if the formula depends on bits outside {@link #bitNames()}, or
     *     if it is satisfiable but does not depend on any output bit.
     */
    public DecisionDiagram lift(Formula formula, List<String> order) {
        if (formula.manager() != manager) {
            throw new IllegalArgumentException("Formula belongs to a different manager");
        }
        Set<String> extra = new LinkedHashSet<>(formula.support());
        extra.removeAll(bitNames());
        if (!extra.isEmpty()) {
            throw new EncodingMismatchException("Formula depends on bits outside of the interface", extra);
        }
        if (!order.isEmpty()) {
            order(order);
        }
        // The diagram checks that the guarded formula still mentions the output
        return new DecisionDiagram(this, formula.and(valid().toFormula(manager)));
    }

    /**
     * Re-interprets the function of {@code diagram} under this interface.
     */
    public DecisionDiagram lift(DecisionDiagram diagram) {
        return lift(diagram.formula());
    }

    public DecisionDiagram lift(DecisionDiagram diagram, List<String> order) {
        return lift(diagram.formula(), order);
    }

    /**
     * Fixes the variable order of the manager: the bits of each variable form one contiguous block,
     * blocks are ordered as in {@code names} followed by all remaining variables in default order
     * (inputs as declared, output last). Automatic reordering is switched off afterwards.
     *
     * <p>This changes the order of the shared manager and thus affects all formulas of it.</p>
     *
     * @throws ValidationException if a name is unknown or appears twice.
     */
    public void order(List<String> names) {
        Set<String> blocks = new LinkedHashSet<>();
        for (String name : names) {
            if (find(name) == null) {
                throw new ValidationException("Cannot order unknown variable " + name);
            }
            if (!blocks.add(name)) {
                throw new ValidationException("Variable " + name + " appears twice in order " + names);
            }
        }
        blocks.addAll(inputs.keySet());
        blocks.add(output.name());

        Map<String, Integer> levels = new HashMap<>();
        for (String block : blocks) {
            for (String bit : var(block).bitNames()) {
                levels.put(bit, levels.size());
            }
        }
        manager.reorder(levels);
        manager.setAutoReorder(false);
    }

    Interface withApplied(Collection<String> names) {
        Set<String> extended = new LinkedHashSet<>(applied);
        extended.addAll(names);
        return new Interface(manager, inputs, output, Collections.unmodifiableSet(extended), constraint);
    }

    static Set<String> symmetricDifference(Set<String> first, Set<String> second) {
        Set<String> difference = new LinkedHashSet<>(first);
        difference.removeAll(second);
        for (String element : second) {
            if (!first.contains(element)) {
                difference.add(element);
            }
        }
        return difference;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Interface)) {
            return false;
        }
        Interface other = (Interface) o;
        return manager == other.manager
                && inputs.equals(other.inputs)
                && output.equals(other.output)
                && applied.equals(other.applied)
                && Objects.equals(constraint, other.constraint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputs, output, applied, constraint);
    }

    @Override
    public String toString() {
        return String.format("%s -> %s%s", inputs.values(), output,
                applied.isEmpty() ? "" : " (applied " + applied + ")");
    }

    public static final class Builder {
        private final BddManager manager;
        private final Map<String, Variable> inputs = new LinkedHashMap<>();
        @Nullable
        private Variable output;
        @Nullable
        private Expression constraint;

        private Builder(BddManager manager) {
            this.manager = manager;
        }

        public Builder input(String name, Collection<?> domain) {
            return input(Variable.of(domain, name));
        }

        public Builder input(Variable variable) {
            if (inputs.put(variable.name(), variable) != null) {
                throw new ValidationException("Duplicate input " + variable.name());
            }
            return this;
        }

        public Builder inputs(Map<String, ? extends Collection<?>> domains) {
            domains.forEach(this::input);
            return this;
        }

        /**
         * Sets the output to a variable over {@code domain} with a fresh name.
         */
        public Builder output(Collection<?> domain) {
            return output(Variable.of(domain));
        }

        public Builder output(Collection<?> domain, String name) {
            return output(Variable.of(domain, name));
        }

        public Builder output(Variable variable) {
            this.output = variable;
            return this;
        }

        /**
         * Restricts the admissible inputs further. The constraint may only mention bits of inputs.
         */
        public Builder constraint(Expression constraint) {
            this.constraint = constraint;
            return this;
        }

        /**
         * Validates the interface and declares its bits in the manager.
         *
         * @throws ValidationException if names collide, no output is given, or the constraint refers
         *     to anything but input bits.
         */
        public Interface build() {
            if (output == null) {
                throw new ValidationException("No output variable given");
            }
            if (inputs.containsKey(output.name())) {
                throw new ValidationException("Output " + output.name() + " collides with an input of the same name");
            }
            if (constraint != null) {
                checkConstraint(constraint);
            }

            for (Variable input : inputs.values()) {
                input.bitNames().forEach(manager::variable);
            }
            output.bitNames().forEach(manager::variable);

            return new Interface(manager, Collections.unmodifiableMap(new LinkedHashMap<>(inputs)), output,
                    Collections.emptySet(), constraint);
        }

        private void checkConstraint(Expression constraint) {
            for (String bit : constraint.inputs()) {
                BitName name = BitName.parse(bit);
                Variable input = inputs.get(name.signal());
                if (input == null) {
                    throw new ValidationException("Constraint refers to undeclared input " + name.signal());
                }
                if (name.index() >= input.size()) {
                    throw new ValidationException(String.format(
                            "Constraint refers to bit %s, but input %s has only %d bits", bit, input.name(),
                            input.size()));
                }
            }
        }
    }
}
