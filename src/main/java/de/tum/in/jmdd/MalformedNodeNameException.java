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

/**
 * Thrown when the name of a decision bit does not have the form {@code signal[index]} or does not
 * fit the variable it is resolved to.
 */
public class MalformedNodeNameException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final String nodeName;

    public MalformedNodeNameException(String nodeName, String reason) {
        super(String.format("Malformed bit name %s: %s", nodeName, reason));
        this.nodeName = nodeName;
    }

    public MalformedNodeNameException(String nodeName, String reason, Throwable cause) {
        this(nodeName, reason);
        initCause(cause);
    }

    public String nodeName() {
        return nodeName;
    }
}
