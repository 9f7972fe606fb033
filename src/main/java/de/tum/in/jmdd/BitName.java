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

import java.util.Objects;

/**
 * The name {@code signal[index]} of a single bit of a multi-bit signal.
 */
public final class BitName {
    private final String signal;
    private final int index;

    private BitName(String signal, int index) {
        this.signal = signal;
        this.index = index;
    }

    public static BitName of(String signal, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative bit index " + index);
        }
        return new BitName(signal, index);
    }

    public static String format(String signal, int index) {
        return signal + '[' + index + ']';
    }

    /**
     * Parses a bit name.
     *
     * @throws MalformedNodeNameException if {@code name} is not of the form {@code signal[index]}.
     */
    public static BitName parse(String name) {
        int open = name.lastIndexOf('[');
        if (open <= 0 || !name.endsWith("]") || open == name.length() - 2) {
            throw new MalformedNodeNameException(name, "expected signal[index]");
        }
        String digits = name.substring(open + 1, name.length() - 1);
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                throw new MalformedNodeNameException(name, "index is not a number");
            }
        }
        try {
            return new BitName(name.substring(0, open), Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            throw new MalformedNodeNameException(name, "index out of range", e);
        }
    }

    public String signal() {
        return signal;
    }

    public int index() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BitName)) {
            return false;
        }
        BitName other = (BitName) o;
        return index == other.index && signal.equals(other.signal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signal, index);
    }

    @Override
    public String toString() {
        return format(signal, index);
    }
}
