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

import java.util.List;
import org.immutables.value.Value;

/**
 * Options of {@link GraphExporter}.
 */
@Value.Immutable
public abstract class ExportOptions {
    public static ExportOptions defaults() {
        return ImmutableExportOptions.builder().build();
    }

    /**
     * Variable blocks to put on top of the order before exporting; remaining variables follow in
     * default order.
     */
    public abstract List<String> order();

    /**
     * Whether node ids are replaced by sequential numbers in depth-first order. Otherwise, ids are the
     * node ids of the underlying formula, which change when the manager is reordered.
     */
    @Value.Default
    public boolean reindex() {
        return true;
    }

    /**
     * Whether decision nodes which cannot influence the result are removed.
     */
    @Value.Default
    public boolean eliminateRedundantNodes() {
        return true;
    }
}
