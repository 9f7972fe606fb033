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

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps exactly one {@link Formula} per node alive and remembers all of them weakly, so that a
 * reorder can relocate every formula still in use.
 */
final class FormulaReferences {
    private static final Logger logger = Logger.getLogger(FormulaReferences.class.getName());

    private final Map<Integer, FormulaReference> references = new HashMap<>();
    private final ReferenceQueue<Formula> queue = new ReferenceQueue<>();

    // This is not thread safe!
    Formula make(BddManager manager, int node) {
        FormulaReference canonicalReference = references.get(node);
        if (canonicalReference != null) {
            Formula canonical = canonicalReference.get();
            if (canonical != null) {
                assert canonical.node() == node;
                return canonical;
            }
        }
        processReferenceQueue();

        Formula formula = new Formula(manager, node);
        references.put(node, new FormulaReference(formula, queue));
        return formula;
    }

    List<Formula> live() {
        processReferenceQueue();
        List<Formula> live = new ArrayList<>(references.size());
        for (FormulaReference reference : references.values()) {
            Formula formula = reference.get();
            if (formula != null) {
                live.add(formula);
            }
        }
        return live;
    }

    /**
     * Moves the given formulas to their new nodes. Any formula not mentioned is forgotten.
     */
    void relocate(Map<Formula, Integer> relocation) {
        references.clear();
        for (Map.Entry<Formula, Integer> entry : relocation.entrySet()) {
            Formula formula = entry.getKey();
            int node = entry.getValue();
            formula.relocate(node);
            FormulaReference previous = references.put(node, new FormulaReference(formula, queue));
            assert previous == null : "Distinct formulas relocated to the same node " + node;
        }
    }

    int size() {
        return references.size();
    }

    private void processReferenceQueue() {
        Reference<? extends Formula> reference = queue.poll();
        if (reference == null) {
            return;
        }

        int count = 0;
        do {
            FormulaReference formulaReference = (FormulaReference) reference;
            // The slot might already hold a newer formula for the same node
            if (references.get(formulaReference.node) == formulaReference) {
                references.remove(formulaReference.node);
                count += 1;
            }
            reference = queue.poll();
        } while (reference != null);

        logger.log(Level.FINEST, "Cleared {0} references", count);
    }

    private static final class FormulaReference extends WeakReference<Formula> {
        private final int node;

        private FormulaReference(Formula formula, ReferenceQueue<? super Formula> queue) {
            super(formula, queue);
            this.node = formula.node();
        }
    }
}
