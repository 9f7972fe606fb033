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
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Thrown when a diagram is evaluated but the inputs do not determine a single output value.
 */
public class NotFullyEvaluatedException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final Set<String> remainingBits;

    public NotFullyEvaluatedException(String message, Set<String> remainingBits) {
        super(message + ", remaining bits " + remainingBits);
        this.remainingBits = Collections.unmodifiableSet(new LinkedHashSet<>(remainingBits));
    }

    public Set<String> remainingBits() {
        return remainingBits;
    }
}
