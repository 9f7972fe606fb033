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

final class HashUtil {
    // Cheap multiplicative mixing, called for every node lookup and cache access
    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int key) {
        return key * PRIME;
    }

    static int hash(int firstKey, int secondKey) {
        return (firstKey * PRIME + secondKey) * PRIME;
    }

    static int hash(int firstKey, int secondKey, int thirdKey) {
        return ((firstKey * PRIME + secondKey) * PRIME + thirdKey) * PRIME;
    }
}
