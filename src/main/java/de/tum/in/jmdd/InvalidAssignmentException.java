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
 * Thrown when a value is not part of a domain, an encoding is not admissible or a (partial) input
 * assignment contradicts the diagram it is applied to.
 */
public class InvalidAssignmentException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public InvalidAssignmentException(String message) {
        super(message);
    }
}
