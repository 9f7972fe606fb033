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

import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A multi-valued function, represented by a {@link Formula} over the one-hot encoded bits of an
 * {@link Interface}. On every admissible input, the formula reduces to exactly one output bit.
 *
 * <p>Diagrams are immutable. The underlying formula belongs to the interface's {@link BddManager};
 * reordering that manager (e.g. through {@link #order(List)}) affects all its diagrams.</p>
 */
public final class DecisionDiagram {
    private final Interface anInterface;
    private final Formula formula;

    DecisionDiagram(Interface anInterface, Formula formula) {
        if (formula.manager() != anInterface.manager()) {
            throw new IllegalArgumentException("Formula and interface belong to different managers");
        }
        Set<String> extra = new LinkedHashSet<>(formula.support());
        extra.removeAll(anInterface.bitNames());
        if (!extra.isEmpty()) {
            throw new EncodingMismatchException("Formula depends on bits outside of the interface", extra);
        }
        if (!determinesOutput(anInterface, formula)) {
            throw new EncodingMismatchException("Formula does not depend on output "
                    + anInterface.output().name(), Interface.symmetricDifference(formula.support(),
                    new LinkedHashSet<>(anInterface.bitNames())));
        }
        this.anInterface = anInterface;
        this.formula = formula;
    }

    public Interface getInterface() {
        return anInterface;
    }

    public Formula formula() {
        return formula;
    }

    public BddManager manager() {
        return anInterface.manager();
    }

    /**
     * Number of nodes of the underlying formula.
     */
    public int size() {
        return formula.dagSize();
    }

    /**
     * Partially evaluates this diagram by fixing the given inputs.
     *
     * @throws InvalidAssignmentException if a name is not a pending input, a value is not in the
     *     respective domain, or the assignment contradicts admissibility.
     */
    public DecisionDiagram let(Map<String, ?> values) {
        Map<String, BitSet> encoded = new LinkedHashMap<>();
        values.forEach((name, value) -> encoded.put(name, pendingInput(name).encode(value)));
        return letEncoded(encoded);
    }

    /**
     * Variant of {@link #let(Map)} taking raw encodings. Each encoding has to satisfy the validity
     * predicate of its variable.
     */
    public DecisionDiagram letEncoded(Map<String, BitSet> values) {
        if (values.isEmpty()) {
            return this;
        }
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        values.forEach((name, encoded) -> {
            Variable variable = pendingInput(name);
            if (!variable.isValid(encoded)) {
                throw new InvalidAssignmentException(String.format("%s is not a valid encoding of %s",
                        encoded, name));
            }
            assignment.putAll(variable.blast(encoded));
        });
        Formula restricted = formula.restrict(assignment);
        if (restricted.isFalse()) {
            throw new InvalidAssignmentException("Assignment " + values + " is not admissible");
        }
        if (!determinesOutput(anInterface, restricted)) {
            throw new NotFullyEvaluatedException("Output is not determined by " + values,
                    new LinkedHashSet<>(anInterface.output().bitNames()));
        }
        return new DecisionDiagram(anInterface.withApplied(values.keySet()), restricted);
    }

    /* The false formula has no admissible input and is exempt. */
    private static boolean determinesOutput(Interface anInterface, Formula formula) {
        return formula.isFalse() || !Collections.disjoint(formula.support(), anInterface.output().bitNames());
    }

    private Variable pendingInput(String name) {
        Variable variable = anInterface.inputs().get(name);
        if (variable == null) {
            throw new InvalidAssignmentException("Unknown input " + name);
        }
        if (anInterface.applied().contains(name)) {
            throw new InvalidAssignmentException("Input " + name + " has already been applied");
        }
        return variable;
    }

    /**
     * Evaluates this diagram on the given values of all pending inputs.
     *
     * @throws NotFullyEvaluatedException if inputs are missing or the output is not determined.
     * @throws InvalidAssignmentException if the assignment is not admissible.
     * @throws MalformedNodeNameException if the remaining bit does not belong to the output.
     */
    @Nullable
    public Object evaluate(Map<String, ?> values) {
        Set<String> missing = anInterface.pendingInputs();
        missing.removeAll(values.keySet());
        if (!missing.isEmpty()) {
            Set<String> missingBits = new LinkedHashSet<>();
            missing.forEach(name -> missingBits.addAll(anInterface.var(name).bitNames()));
            throw new NotFullyEvaluatedException("Missing values for inputs " + missing, missingBits);
        }

        Formula result = let(values).formula;
        if (!result.isLiteral()) {
            throw new NotFullyEvaluatedException("Output is not determined by " + values, result.support());
        }
        String bit = Objects.requireNonNull(result.variable());
        BitName name = BitName.parse(bit);
        Variable output = anInterface.output();
        if (!name.signal().equals(output.name())) {
            throw new MalformedNodeNameException(bit, "expected a bit of output " + output.name());
        }
        if (name.index() >= output.size()) {
            throw new MalformedNodeNameException(bit, "output " + output.name() + " has only "
                    + output.size() + " bits");
        }
        BitSet encoded = new BitSet(output.size());
        encoded.set(name.index());
        return output.decode(encoded);
    }

    /**
     * Fixes the default variable order, see {@link Interface#order(List)}.
     */
    public DecisionDiagram order() {
        return order(Collections.emptyList());
    }

    /**
     * Fixes the variable order of the shared manager, see {@link Interface#order(List)}.
     */
    public DecisionDiagram order(List<String> names) {
        anInterface.order(names);
        return this;
    }

    /**
     * Returns the diagram which agrees with {@code value} where {@code test} holds and with this
     * diagram elsewhere.
     */
    public DecisionDiagram override(Expression test, DecisionDiagram value) {
        return override(test.toFormula(manager()), value);
    }

    public DecisionDiagram override(Expression test, @Nullable Object value) {
        return override(test.toFormula(manager()), anInterface.constantly(value));
    }

    public DecisionDiagram override(Formula test, @Nullable Object value) {
        return override(test, anInterface.constantly(value));
    }

    /**
     * Returns the diagram which agrees with {@code value} where {@code test} holds and with this
     * diagram elsewhere.
     *
     * @throws EncodingMismatchException if {@code value} has different interface bits.
     */
    public DecisionDiagram override(Formula test, DecisionDiagram value) {
        if (test.manager() != manager() || value.manager() != manager()) {
            throw new IllegalArgumentException("Cannot combine diagrams of different managers");
        }
        Set<String> mismatch = Interface.symmetricDifference(
                new LinkedHashSet<>(anInterface.bitNames()), new LinkedHashSet<>(value.anInterface.bitNames()));
        if (!mismatch.isEmpty()) {
            throw new EncodingMismatchException("Interfaces of overridden diagrams differ", mismatch);
        }
        Formula result = test.not().or(value.formula).and(test.or(formula));
        return new DecisionDiagram(anInterface, result);
    }

    public LabeledGraph<Formula> toGraph() {
        return GraphExporter.symbolic(this);
    }

    public LabeledGraph<Set<Object>> toConcreteGraph() {
        return GraphExporter.concrete(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecisionDiagram)) {
            return false;
        }
        DecisionDiagram other = (DecisionDiagram) o;
        return formula == other.formula && anInterface.equals(other.anInterface);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anInterface, formula);
    }

    @Override
    public String toString() {
        return String.format("DecisionDiagram(%s, %d nodes)", anInterface, size());
    }
}
