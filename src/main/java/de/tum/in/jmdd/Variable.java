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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

/**
 * A multi-valued variable over a finite domain, encoded one-hot: value number {@code i} of the domain
 * is represented by the bit vector where exactly bit {@code name[i]} is set.
 *
 * <p>Variables are immutable values. Domain values are compared with {@link Object#equals(Object)};
 * if a value occurs several times, the first occurrence determines its encoding.</p>
 */
public final class Variable {
    /* Names of the form _v<number> are reserved for variables created without a name. */
    private static final String FRESH_PREFIX = "_v";
    private static final AtomicInteger freshNames = new AtomicInteger();

    private final String name;
    private final List<Object> domain;
    private final Expression valid;

    private Variable(String name, List<Object> domain, Expression valid) {
        this.name = name;
        this.domain = domain;
        this.valid = valid;
    }

    /**
     * Creates a variable over {@code domain} with a fresh, globally unique name.
     */
    public static Variable of(Collection<?> domain) {
        return create(domain, FRESH_PREFIX + freshNames.getAndIncrement());
    }

    /**
     * Creates a variable over {@code domain} named {@code name}.
     *
     * @throws ValidationException if the name is malformed or reserved for fresh names.
     */
    public static Variable of(Collection<?> domain, String name) {
        checkName(name);
        return create(domain, name);
    }

    private static Variable create(Collection<?> domain, String name) {
        List<Object> values = checkDomain(domain);
        return new Variable(name, values, BitVector.atom(name, values.size()).exactlyOne());
    }

    /**
     * Renames an existing variable. Returns {@code variable} itself if {@code name} is {@code null} or
     * equals its current name.
     */
    public static Variable of(Variable variable, @Nullable String name) {
        return name == null ? variable : variable.withName(name);
    }

    /**
     * Creates a variable from an explicit validity predicate. The predicate has to mention bits of
     * exactly one signal, which becomes the name of the variable.
     *
     * @throws ValidationException if the predicate spans zero or several signals or mentions a bit
     *     outside the domain.
     */
    public static Variable fromPredicate(Expression valid, Collection<?> domain) {
        Set<String> signals = valid.signals();
        if (signals.size() != 1) {
            throw new ValidationException("Validity predicate must be defined over exactly one signal, got "
                    + signals);
        }
        String name = signals.iterator().next();
        checkName(name);
        List<Object> values = checkDomain(domain);
        for (String bit : valid.inputs()) {
            int index = BitName.parse(bit).index();
            if (index >= values.size()) {
                throw new ValidationException(String.format(
                        "Validity predicate mentions bit %s, but domain has only %d values", bit, values.size()));
            }
        }
        List<String> bits = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            bits.add(BitName.format(name, i));
        }
        // Bits not mentioned by the predicate are still part of the encoding
        return new Variable(name, values, valid.and(Expression.care(bits)));
    }

    private static void checkName(String name) {
        if (name.isEmpty() || name.indexOf('[') >= 0 || name.indexOf(']') >= 0) {
            throw new ValidationException("Invalid variable name '" + name + "'");
        }
        if (isFreshName(name)) {
            throw new ValidationException("Variable name '" + name + "' is reserved for generated names");
        }
    }

    private static boolean isFreshName(String name) {
        if (!name.startsWith(FRESH_PREFIX) || name.length() == FRESH_PREFIX.length()) {
            return false;
        }
        for (int i = FRESH_PREFIX.length(); i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static List<Object> checkDomain(Collection<?> domain) {
        if (domain.isEmpty()) {
            throw new ValidationException("Domain must not be empty");
        }
        return Collections.unmodifiableList(new ArrayList<>(domain));
    }

    public String name() {
        return name;
    }

    /**
     * Number of domain values, which also is the number of bits of the encoding.
     */
    public int size() {
        return domain.size();
    }

    public List<Object> domain() {
        return domain;
    }

    /**
     * The predicate over the bits of this variable which holds exactly on admissible encodings.
     */
    public Expression valid() {
        return valid;
    }

    public BitVector vector() {
        return BitVector.atom(name, size());
    }

    public Expression bit(int index) {
        checkIndex(index);
        return Expression.bit(name, index);
    }

    public String bitName(int index) {
        checkIndex(index);
        return BitName.format(name, index);
    }

    public List<String> bitNames() {
        List<String> bitNames = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            bitNames.add(BitName.format(name, i));
        }
        return bitNames;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size()) {
            throw new IndexOutOfBoundsException(String.format("Bit %d of variable %s with %d bits",
                    index, name, size()));
        }
    }

    /**
     * Returns the index of {@code value} in the domain or -1.
     */
    public int indexOf(@Nullable Object value) {
        for (int i = 0; i < domain.size(); i++) {
            if (Objects.equals(domain.get(i), value)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the one-hot encoding of {@code value}.
     *
     * @throws InvalidAssignmentException if the value is not part of the domain.
     */
    public BitSet encode(@Nullable Object value) {
        int index = indexOf(value);
        if (index < 0) {
            throw new InvalidAssignmentException(String.format("Value %s is not in the domain %s of %s",
                    value, domain, name));
        }
        BitSet encoded = new BitSet(size());
        encoded.set(index);
        return encoded;
    }

    /**
     * Inverse of {@link #encode(Object)}.
     *
     * @throws InvalidAssignmentException if {@code encoded} is not a one-hot encoding of this variable.
     */
    @Nullable
    public Object decode(BitSet encoded) {
        if (encoded.cardinality() != 1 || encoded.length() > size()) {
            throw new InvalidAssignmentException(String.format("%s is not a one-hot encoding of %s with %d bits",
                    encoded, name, size()));
        }
        return domain.get(encoded.nextSetBit(0));
    }

    public boolean isValid(BitSet encoded) {
        return encoded.length() <= size() && valid.evaluate(blast(encoded));
    }

    /**
     * Assigns each bit of this variable its value in {@code encoded}.
     */
    public Map<String, Boolean> blast(BitSet encoded) {
        Map<String, Boolean> assignment = new LinkedHashMap<>();
        for (int i = 0; i < size(); i++) {
            assignment.put(BitName.format(name, i), encoded.get(i));
        }
        return assignment;
    }

    /**
     * Inverse of {@link #blast(BitSet)}, other bits in {@code assignment} are ignored.
     *
     * @throws IllegalArgumentException if a bit of this variable is not assigned.
     */
    public BitSet unblast(Map<String, Boolean> assignment) {
        BitSet encoded = new BitSet(size());
        for (int i = 0; i < size(); i++) {
            Boolean value = assignment.get(BitName.format(name, i));
            if (value == null) {
                throw new IllegalArgumentException("No value for bit " + BitName.format(name, i));
            }
            encoded.set(i, value);
        }
        return encoded;
    }

    /**
     * The predicate "this variable has value {@code value}".
     */
    public Expression equalTo(@Nullable Object value) {
        return vector().eq(encode(value));
    }

    /**
     * Returns a structurally identical variable over the signal {@code name}, or this variable if the
     * name does not change.
     */
    public Variable withName(String name) {
        if (this.name.equals(name)) {
            return this;
        }
        checkName(name);
        String oldName = this.name;
        return new Variable(name, domain, valid.rename(signal -> signal.equals(oldName) ? name : signal));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable)) {
            return false;
        }
        Variable other = (Variable) o;
        return name.equals(other.name) && domain.equals(other.domain) && valid.equals(other.valid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, domain, valid);
    }

    @Override
    public String toString() {
        return name + domain;
    }
}
