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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable propositional formula over named bits, independent of any {@link BddManager}. Unlike a
 * {@link Formula}, an expression remembers every bit it mentions syntactically, see {@link #inputs()}.
 * Use {@link #toFormula(BddManager)} to obtain the canonical representation.
 */
@SuppressWarnings("PMD.GodClass")
public abstract class Expression {
    public static final Expression TRUE = new Constant(true);
    public static final Expression FALSE = new Constant(false);

    Expression() {}

    public static Expression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * The bit with the given full name, e.g. {@code x[2]}.
     */
    public static Expression bit(String name) {
        BitName.parse(name);
        return new Atom(name);
    }

    public static Expression bit(String signal, int index) {
        return new Atom(BitName.format(signal, index));
    }

    /**
     * A tautology which nevertheless depends on the given bits, i.e. they are part of
     * {@link #inputs()}.
     */
    public static Expression care(Collection<String> bits) {
        bits.forEach(BitName::parse);
        return new Care(new LinkedHashSet<>(bits));
    }

    public static Expression and(Collection<? extends Expression> operands) {
        return nary(NaryType.AND, operands);
    }

    public static Expression or(Collection<? extends Expression> operands) {
        return nary(NaryType.OR, operands);
    }

    private static Expression nary(NaryType type, Collection<? extends Expression> operands) {
        // Only the neutral element may be dropped, absorbing constants keep the other inputs
        Expression neutral = type == NaryType.AND ? TRUE : FALSE;
        List<Expression> filtered = operands.stream()
                .filter(operand -> !operand.equals(neutral))
                .collect(Collectors.toList());
        if (filtered.isEmpty()) {
            return neutral;
        }
        if (filtered.size() == 1) {
            return filtered.get(0);
        }
        return new Nary(type, filtered);
    }

    public Expression and(Expression other) {
        return and(Arrays.asList(this, other));
    }

    public Expression or(Expression other) {
        return or(Arrays.asList(this, other));
    }

    public Expression not() {
        return new Not(this);
    }

    public Expression xor(Expression other) {
        return new Binary(BinaryType.XOR, this, other);
    }

    public Expression iff(Expression other) {
        return new Binary(BinaryType.IFF, this, other);
    }

    public Expression implies(Expression other) {
        return new Binary(BinaryType.IMPLIES, this, other);
    }

    public Expression ite(Expression thenExpression, Expression elseExpression) {
        return new IfThenElse(this, thenExpression, elseExpression);
    }

    /**
     * All bit names mentioned by this expression, in order of first occurrence.
     */
    public final Set<String> inputs() {
        Set<String> inputs = new LinkedHashSet<>();
        gatherInputs(inputs);
        return Collections.unmodifiableSet(inputs);
    }

    /**
     * The signal names of all mentioned bits, in order of first occurrence.
     */
    public final Set<String> signals() {
        Set<String> signals = new LinkedHashSet<>();
        for (String input : inputs()) {
            signals.add(BitName.parse(input).signal());
        }
        return Collections.unmodifiableSet(signals);
    }

    /**
     * Evaluates this expression.
     *
     * @throws IllegalArgumentException if a mentioned bit has no value.
     */
    public abstract boolean evaluate(Map<String, Boolean> assignment);

    /**
     * Builds the canonical representation of this expression in the given manager, declaring missing
     * bits on the way.
     */
    public final Formula toFormula(BddManager manager) {
        // Care bits have to be known to the manager even though no node depends on them
        inputs().forEach(manager::declare);
        return build(manager);
    }

    abstract Formula build(BddManager manager);

    abstract void gatherInputs(Set<String> inputs);

    /**
     * Renames the signals of all mentioned bits, keeping the bit indices.
     */
    public abstract Expression rename(UnaryOperator<String> signalRenaming);

    static String renameBit(String bit, UnaryOperator<String> signalRenaming) {
        BitName name = BitName.parse(bit);
        return BitName.format(signalRenaming.apply(name.signal()), name.index());
    }

    private static final class Constant extends Expression {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return value;
        }

        @Override
        Formula build(BddManager manager) {
            return manager.constant(value);
        }

        @Override
        void gatherInputs(Set<String> inputs) {
            // No inputs
        }

        @Override
        public Expression rename(UnaryOperator<String> signalRenaming) {
            return this;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Constant && value == ((Constant) o).value);
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    private static final class Atom extends Expression {
        private final String name;

        Atom(String name) {
            this.name = name;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            Boolean value = assignment.get(name);
            if (value == null) {
                throw new IllegalArgumentException("No value given for bit " + name);
            }
            return value;
        }

        @Override
        Formula build(BddManager manager) {
            return manager.variable(name);
        }

        @Override
        void gatherInputs(Set<String> inputs) {
            inputs.add(name);
        }

        @Override
        public Expression rename(UnaryOperator<String> signalRenaming) {
            return new Atom(renameBit(name, signalRenaming));
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Atom && name.equals(((Atom) o).name));
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static final class Care extends Expression {
        private final Set<String> bits;

        Care(Set<String> bits) {
            this.bits = bits;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return true;
        }

        @Override
        Formula build(BddManager manager) {
            return manager.trueFormula();
        }

        @Override
        void gatherInputs(Set<String> inputs) {
            inputs.addAll(bits);
        }

        @Override
        public Expression rename(UnaryOperator<String> signalRenaming) {
            Set<String> renamed = new LinkedHashSet<>();
            bits.forEach(bit -> renamed.add(renameBit(bit, signalRenaming)));
            return new Care(renamed);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Care && bits.equals(((Care) o).bits));
        }

        @Override
        public int hashCode() {
            return bits.hashCode() + 1;
        }

        @Override
        public String toString() {
            return "care" + bits;
        }
    }

    private static final class Not extends Expression {
        private final Expression child;

        Not(Expression child) {
            this.child = child;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            return !child.evaluate(assignment);
        }

        @Override
        Formula build(BddManager manager) {
            return child.build(manager).not();
        }

        @Override
        void gatherInputs(Set<String> inputs) {
            child.gatherInputs(inputs);
        }

        @Override
        public Expression rename(UnaryOperator<String> signalRenaming) {
            return new Not(child.rename(signalRenaming));
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Not && child.equals(((Not) o).child));
        }

        @Override
        public int hashCode() {
            return ~child.hashCode();
        }

        @Override
        public String toString() {
            return "!" + child;
        }
    }

    private enum NaryType {
        AND(" & "),
        OR(" | ");

        private final String symbol;

        NaryType(String symbol) {
            this.symbol = symbol;
        }
    }

    private static final class Nary extends Expression {
        private final NaryType type;
        private final List<Expression> operands;

        Nary(NaryType type, List<Expression> operands) {
            this.type = type;
            this.operands = operands;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            // Evaluate all operands so that missing values are always reported
            boolean result = type == NaryType.AND;
            for (Expression operand : operands) {
                boolean value = operand.evaluate(assignment);
                result = type == NaryType.AND ? result && value : result || value;
            }
            return result;
        }

        @Override
        Formula build(BddManager manager) {
            Formula result = manager.constant(type == NaryType.AND);
            for (Expression operand : operands) {
                Formula formula = operand.build(manager);
                result = type == NaryType.AND ? result.and(formula) : result.or(formula);
            }
            return result;
        }

        @Override
        void gatherInputs(Set<String> inputs) {
            operands.forEach(operand -> operand.gatherInputs(inputs));
        }

        @Override
        public Expression rename(UnaryOperator<String> signalRenaming) {
            List<Expression> renamed = new ArrayList<>(operands.size());
            operands.forEach(operand -> renamed.add(operand.rename(signalRenaming)));
            return new Nary(type, renamed);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Nary)) {
                return false;
            }
            Nary other = (Nary) o;
            return type == other.type && operands.equals(other.operands);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, operands);
        }

        @Override
        public String toString() {
            return operands.stream().map(Object::toString).collect(Collectors.joining(type.symbol, "(", ")"));
        }
    }

    private enum BinaryType {
        XOR(" ^ "),
        IFF(" <-> "),
        IMPLIES(" -> ");

        private final String symbol;

        BinaryType(String symbol) {
            this.symbol = symbol;
        }
    }

    private static final class Binary extends Expression {
        private final BinaryType type;
        private final Expression left;
        private final Expression right;

        Binary(BinaryType type, Expression left, Expression right) {
            this.type = type;
            this.left = left;
            this.right = right;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            boolean leftValue = left.evaluate(assignment);
            boolean rightValue = right.evaluate(assignment);
            switch (type) {
                case XOR:
                    return leftValue ^ rightValue;
                case IFF:
                    return leftValue == rightValue;
                case IMPLIES:
                    return !leftValue || rightValue;
                default:
                    throw new AssertionError();
            }
        }

        @Override
        Formula build(BddManager manager) {
            Formula leftFormula = left.build(manager);
            Formula rightFormula = right.build(manager);
            switch (type) {
                case XOR:
                    return leftFormula.xor(rightFormula);
                case IFF:
                    return leftFormula.iff(rightFormula);
                case IMPLIES:
                    return leftFormula.implies(rightFormula);
                default:
                    throw new AssertionError();
            }
        }

        @Override
        void gatherInputs(Set<String> inputs) {
            left.gatherInputs(inputs);
            right.gatherInputs(inputs);
        }

        @Override
        public Expression rename(UnaryOperator<String> signalRenaming) {
            return new Binary(type, left.rename(signalRenaming), right.rename(signalRenaming));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Binary)) {
                return false;
            }
            Binary other = (Binary) o;
            return type == other.type && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, left, right);
        }

        @Override
        public String toString() {
            return "(" + left + type.symbol + right + ")";
        }
    }

    private static final class IfThenElse extends Expression {
        private final Expression condition;
        private final Expression thenExpression;
        private final Expression elseExpression;

        IfThenElse(Expression condition, Expression thenExpression, Expression elseExpression) {
            this.condition = condition;
            this.thenExpression = thenExpression;
            this.elseExpression = elseExpression;
        }

        @Override
        public boolean evaluate(Map<String, Boolean> assignment) {
            boolean thenValue = thenExpression.evaluate(assignment);
            boolean elseValue = elseExpression.evaluate(assignment);
            return condition.evaluate(assignment) ? thenValue : elseValue;
        }

        @Override
        Formula build(BddManager manager) {
            return condition.build(manager).ite(thenExpression.build(manager), elseExpression.build(manager));
        }

        @Override
        void gatherInputs(Set<String> inputs) {
            condition.gatherInputs(inputs);
            thenExpression.gatherInputs(inputs);
            elseExpression.gatherInputs(inputs);
        }

        @Override
        public Expression rename(UnaryOperator<String> signalRenaming) {
            return new IfThenElse(condition.rename(signalRenaming), thenExpression.rename(signalRenaming),
                    elseExpression.rename(signalRenaming));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof IfThenElse)) {
                return false;
            }
            IfThenElse other = (IfThenElse) o;
            return condition.equals(other.condition) && thenExpression.equals(other.thenExpression)
                    && elseExpression.equals(other.elseExpression);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition, thenExpression, elseExpression);
        }

        @Override
        public String toString() {
            return "(" + condition + " ? " + thenExpression + " : " + elseExpression + ")";
        }
    }
}
