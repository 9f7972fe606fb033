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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class ManagerConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final int DEFAULT_CACHE_BINARY_DIVIDER = 8;
    public static final int DEFAULT_CACHE_TERNARY_DIVIDER = 16;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    @Value.Default
    public int cacheBinaryDivider() {
        return DEFAULT_CACHE_BINARY_DIVIDER;
    }

    @Value.Default
    public int cacheTernaryDivider() {
        return DEFAULT_CACHE_TERNARY_DIVIDER;
    }

    /**
     * Initial value of {@link BddManager#autoReorder()}. Fixing an explicit order through
     * {@link DecisionDiagram#order()} switches it off.
     */
    @Value.Default
    public boolean autoReorder() {
        return true;
    }

    @Value.Check
    protected void check() {
        if (initialSize() <= 0) {
            throw new IllegalArgumentException("Initial size must be positive, got " + initialSize());
        }
        if (growthFactor() <= 1.0d) {
            throw new IllegalArgumentException("Growth factor must exceed 1, got " + growthFactor());
        }
        if (cacheBinaryDivider() <= 0 || cacheTernaryDivider() <= 0) {
            throw new IllegalArgumentException("Cache dividers must be positive");
        }
    }
}
