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

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when the bits a formula depends on do not match the bits an {@link Interface} declares.
 */
public class EncodingMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final Set<String> mismatchedBits;

    public EncodingMismatchException(String message, Set<String> mismatchedBits) {
        super(message + ": " + new TreeSet<>(mismatchedBits));
        this.mismatchedBits = Collections.unmodifiableSet(new TreeSet<>(mismatchedBits));
    }

    /**
     * The bits present on exactly one side of the comparison, sorted by name.
     */
    public Set<String> mismatchedBits() {
        return mismatchedBits;
    }
}
