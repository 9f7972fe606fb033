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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.in;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks formulas against the truth tables of random expressions, before and after reordering.
 */
public class BddManagerTest {
    private static final int expressionCount = 200;
    private static final int treeDepth = 7;
    private static final int variableCount = 6;

    private static final List<String> bits = IntStream.range(0, variableCount)
            .mapToObj(i -> BitName.format("v", i))
            .collect(Collectors.toList());

    public static Stream<Expression> expressions() {
        Random random = new Random(0L);
        return Stream.generate(() -> randomTree(random, treeDepth)).limit(expressionCount);
    }

    private static Expression randomTree(Random random, int depth) {
        if (depth == 0 || random.nextInt(5) == 0) {
            int leaf = random.nextInt(variableCount + 2);
            if (leaf == variableCount) {
                return Expression.TRUE;
            }
            if (leaf == variableCount + 1) {
                return Expression.FALSE;
            }
            return Expression.bit(bits.get(leaf));
        }
        switch (random.nextInt(6)) {
            case 0:
                return randomTree(random, depth - 1).not();
            case 1:
                return randomTree(random, depth - 1).and(randomTree(random, depth - 1));
            case 2:
                return randomTree(random, depth - 1).or(randomTree(random, depth - 1));
            case 3:
                return randomTree(random, depth - 1).xor(randomTree(random, depth - 1));
            case 4:
                return randomTree(random, depth - 1).iff(randomTree(random, depth - 1));
            default:
                return randomTree(random, depth - 1)
                        .ite(randomTree(random, depth - 1), randomTree(random, depth - 1));
        }
    }

    private static List<Map<String, Boolean>> assignments() {
        List<Map<String, Boolean>> assignments = new ArrayList<>();
        for (int valuation = 0; valuation < 1 << variableCount; valuation++) {
            Map<String, Boolean> assignment = new HashMap<>();
            for (int i = 0; i < variableCount; i++) {
                assignment.put(bits.get(i), (valuation & (1 << i)) != 0);
            }
            assignments.add(assignment);
        }
        return assignments;
    }

    private static BddManager manager() {
        BddManager manager = BddManager.create(ImmutableManagerConfiguration.builder().initialSize(16).build());
        bits.forEach(manager::variable);
        return manager;
    }

    private static void checkTruthTable(Expression expression, Formula formula) {
        int models = 0;
        for (Map<String, Boolean> assignment : assignments()) {
            boolean value = expression.evaluate(assignment);
            assertThat(formula.evaluate(assignment), is(value));
            if (value) {
                models += 1;
            }
        }
        assertThat(formula.models(bits).size(), is(models));
        assertThat(formula.support(), everyItem(is(in(expression.inputs()))));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("expressions")
    public void testFormulaMatchesExpression(Expression expression) {
        BddManager manager = manager();
        Formula formula = expression.toFormula(manager);
        checkTruthTable(expression, formula);
        assertThat(expression.toFormula(manager), sameInstance(formula));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("expressions")
    public void testReorderKeepsFunction(Expression expression) {
        BddManager manager = manager();
        Formula formula = expression.toFormula(manager);
        Formula negation = formula.not();

        List<String> reversed = new ArrayList<>(bits);
        Collections.reverse(reversed);
        manager.reorder(reversed);
        assertThat(manager.order(), is(reversed));

        checkTruthTable(expression, formula);
        checkTruthTable(expression.not(), negation);
        assertThat(expression.toFormula(manager), sameInstance(formula));
        assertThat(formula.not(), sameInstance(negation));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("expressions")
    public void testRestrict(Expression expression) {
        BddManager manager = manager();
        Formula formula = expression.toFormula(manager);
        Map<String, Boolean> partial = ImmutableMap.of(bits.get(0), true, bits.get(3), false);
        Formula restricted = formula.restrict(partial);

        assertThat(restricted.support().contains(bits.get(0)), is(false));
        assertThat(restricted.support().contains(bits.get(3)), is(false));
        for (Map<String, Boolean> assignment : assignments()) {
            if (assignment.get(bits.get(0)) && !assignment.get(bits.get(3))) {
                assertThat(restricted.evaluate(assignment), is(formula.evaluate(assignment)));
            }
        }
    }

    @Test
    public void testConstants() {
        BddManager manager = manager();
        assertThat(manager.trueFormula().isTrue(), is(true));
        assertThat(manager.falseFormula().isFalse(), is(true));
        assertThat(manager.trueFormula().not(), sameInstance(manager.falseFormula()));
        assertThat(manager.constant(true).support(), is(empty()));
        assertThat(manager.trueFormula().dagSize(), is(1));
    }

    @Test
    public void testLiteral() {
        BddManager manager = manager();
        Formula bit = manager.variable(bits.get(2));
        assertThat(bit.isLiteral(), is(true));
        assertThat(bit.not().isLiteral(), is(false));
        assertThat(bit.variable(), is(bits.get(2)));
        assertThat(bit.dagSize(), is(3));
        assertThat(bit.support(), contains(bits.get(2)));
    }

    @Test
    public void testDeclarationOrder() {
        BddManager manager = BddManager.create();
        manager.variable("b[0]");
        manager.variable("a[0]");
        manager.variable("b[0]");
        assertThat(manager.order(), is(ImmutableList.of("b[0]", "a[0]")));
        assertThat(manager.level("a[0]"), is(1));
        assertThat(manager.isDeclared("c[0]"), is(false));
    }

    @Test
    public void testPartialReorder() {
        BddManager manager = manager();
        Formula formula = manager.variable(bits.get(0)).and(manager.variable(bits.get(5)));
        manager.reorder(ImmutableMap.of(bits.get(5), 10, bits.get(4), 20));
        assertThat(manager.order(), is(ImmutableList.of(bits.get(5), bits.get(4), bits.get(0), bits.get(1),
                bits.get(2), bits.get(3))));
        assertThat(formula.variable(), is(bits.get(5)));
        assertThat(formula.support(), contains(bits.get(5), bits.get(0)));
    }

    @Test
    public void testReorderRejectsInvalidLevels() {
        BddManager manager = manager();
        assertThrows(IllegalArgumentException.class, () -> manager.reorder(ImmutableList.of("w[0]")));
        assertThrows(IllegalArgumentException.class,
                () -> manager.reorder(ImmutableList.of(bits.get(0), bits.get(0))));
        assertThrows(IllegalArgumentException.class,
                () -> manager.reorder(ImmutableMap.of(bits.get(0), 1, bits.get(1), 1)));
    }

    @Test
    public void testDifferentManagers() {
        Formula first = manager().variable(bits.get(0));
        Formula second = manager().variable(bits.get(0));
        assertThrows(IllegalArgumentException.class, () -> first.and(second));
    }

    @Test
    public void testModelsOverCareSet() {
        BddManager manager = manager();
        Formula formula = manager.variable(bits.get(1)).or(manager.variable(bits.get(2)));
        assertThat(formula.models(ImmutableList.of(bits.get(1), bits.get(2))).size(), is(3));
        assertThat(formula.models(ImmutableList.of(bits.get(1), bits.get(2), bits.get(3))).size(), is(6));
        assertThrows(IllegalArgumentException.class, () -> formula.models(ImmutableList.of(bits.get(1))));
    }

    @Test
    public void testConfigurationIsChecked() {
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableManagerConfiguration.builder().growthFactor(1.0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ImmutableManagerConfiguration.builder().initialSize(0).build());
    }

    @Test
    public void testAutoReorderFlag() {
        BddManager manager = BddManager.create(ImmutableManagerConfiguration.builder().autoReorder(false).build());
        assertThat(manager.autoReorder(), is(false));
        manager.setAutoReorder(true);
        assertThat(manager.autoReorder(), is(true));
    }
}
