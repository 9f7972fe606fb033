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
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.function.BinaryOperator;

/**
 * A fixed-width vector of {@link Expression expressions}, bit {@code 0} first.
 */
public final class BitVector {
    private final List<Expression> bits;

    private BitVector(List<Expression> bits) {
        this.bits = Collections.unmodifiableList(bits);
    }

    /**
     * The vector {@code name[0], ..., name[width - 1]} of fresh bits.
     */
    public static BitVector atom(String name, int width) {
        checkWidth(width);
        List<Expression> bits = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            bits.add(Expression.bit(name, i));
        }
        return new BitVector(bits);
    }

    public static BitVector constant(BitSet value, int width) {
        checkWidth(width);
        if (value.length() > width) {
            throw new IllegalArgumentException("Value " + value + " does not fit into " + width + " bits");
        }
        List<Expression> bits = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            bits.add(Expression.constant(value.get(i)));
        }
        return new BitVector(bits);
    }

    public static BitVector constant(long value, int width) {
        return constant(BitSet.valueOf(new long[] {value}), width);
    }

    public static BitVector of(List<Expression> bits) {
        checkWidth(bits.size());
        return new BitVector(new ArrayList<>(bits));
    }

    private static void checkWidth(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Width must be positive, got " + width);
        }
    }

    public int width() {
        return bits.size();
    }

    public Expression bit(int index) {
        return bits.get(index);
    }

    public List<Expression> bits() {
        return bits;
    }

    public BitVector and(BitVector other) {
        return zip(other, Expression::and);
    }

    public BitVector or(BitVector other) {
        return zip(other, Expression::or);
    }

    public BitVector xor(BitVector other) {
        return zip(other, Expression::xor);
    }

    public BitVector not() {
        List<Expression> negated = new ArrayList<>(width());
        bits.forEach(bit -> negated.add(bit.not()));
        return new BitVector(negated);
    }

    /**
     * Bitwise choice between {@code thenVector} and {@code elseVector}.
     */
    public static BitVector ite(Expression condition, BitVector thenVector, BitVector elseVector) {
        checkSameWidth(thenVector, elseVector);
        List<Expression> bits = new ArrayList<>(thenVector.width());
        for (int i = 0; i < thenVector.width(); i++) {
            bits.add(condition.ite(thenVector.bit(i), elseVector.bit(i)));
        }
        return new BitVector(bits);
    }

    public Expression eq(BitVector other) {
        checkSameWidth(this, other);
        List<Expression> equalities = new ArrayList<>(width());
        for (int i = 0; i < width(); i++) {
            equalities.add(bit(i).iff(other.bit(i)));
        }
        return Expression.and(equalities);
    }

    /**
     * Compares against a constant. Bits of the constant are folded in, so the result only mentions the
     * bits of this vector.
     */
    public Expression eq(BitSet value) {
        if (value.length() > width()) {
            return Expression.FALSE.and(Expression.care(inputs()));
        }
        List<Expression> literals = new ArrayList<>(width());
        for (int i = 0; i < width(); i++) {
            literals.add(value.get(i) ? bit(i) : bit(i).not());
        }
        return Expression.and(literals);
    }

    public Expression eq(long value) {
        return eq(BitSet.valueOf(new long[] {value}));
    }

    public Expression neq(BitVector other) {
        return eq(other).not();
    }

    public Expression neq(BitSet value) {
        return eq(value).not();
    }

    public Expression neq(long value) {
        return eq(value).not();
    }

    /**
     * True iff exactly one bit is set, i.e. the vector is a one-hot encoding.
     */
    public Expression exactlyOne() {
        List<Expression> choices = new ArrayList<>(width());
        for (int i = 0; i < width(); i++) {
            List<Expression> choice = new ArrayList<>(width());
            for (int j = 0; j < width(); j++) {
                choice.add(i == j ? bit(j) : bit(j).not());
            }
            choices.add(Expression.and(choice));
        }
        return Expression.or(choices);
    }

    public Expression isZero() {
        List<Expression> negated = new ArrayList<>(width());
        bits.forEach(bit -> negated.add(bit.not()));
        return Expression.and(negated);
    }

    private List<String> inputs() {
        List<String> inputs = new ArrayList<>();
        bits.forEach(bit -> inputs.addAll(bit.inputs()));
        return inputs;
    }

    private BitVector zip(BitVector other, BinaryOperator<Expression> operator) {
        checkSameWidth(this, other);
        List<Expression> result = new ArrayList<>(width());
        for (int i = 0; i < width(); i++) {
            result.add(operator.apply(bit(i), other.bit(i)));
        }
        return new BitVector(result);
    }

    private static void checkSameWidth(BitVector first, BitVector second) {
        if (first.width() != second.width()) {
            throw new IllegalArgumentException(
                    String.format("Width mismatch: %d vs. %d", first.width(), second.width()));
        }
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof BitVector && bits.equals(((BitVector) o).bits));
    }

    @Override
    public int hashCode() {
        return bits.hashCode();
    }

    @Override
    public String toString() {
        return bits.toString();
    }
}
