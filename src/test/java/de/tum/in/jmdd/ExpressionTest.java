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
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class ExpressionTest {
    @Test
    public void testInputsKeepAbsorbedOperands() {
        Expression a = Expression.bit("a", 0);
        Expression b = Expression.bit("b", 1);
        assertThat(a.and(Expression.FALSE).and(b).inputs(), contains("a[0]", "b[1]"));
        assertThat(Expression.FALSE.and(b).inputs(), contains("b[1]"));
        assertThat(Expression.TRUE.and(a), is(a));
        assertThat(Expression.FALSE.or(a), is(a));
        assertThat(a.ite(b, Expression.TRUE).signals(), contains("a", "b"));
    }

    @Test
    public void testCare() {
        BddManager manager = BddManager.create();
        Expression care = Expression.bit("a", 0).and(Expression.care(ImmutableList.of("c[0]", "c[1]")));
        assertThat(care.inputs(), contains("a[0]", "c[0]", "c[1]"));
        assertThat(care.evaluate(ImmutableMap.of("a[0]", true)), is(true));

        Formula formula = care.toFormula(manager);
        assertThat(formula, sameInstance(manager.variable("a[0]")));
        assertThat(manager.isDeclared("c[1]"), is(true));
    }

    @Test
    public void testEvaluate() {
        Expression a = Expression.bit("a[0]");
        Expression b = Expression.bit("b[0]");
        Expression expression = a.implies(b).iff(a.not().or(b)).and(a.xor(b).not().iff(a.iff(b)));
        for (boolean first : new boolean[] {false, true}) {
            for (boolean second : new boolean[] {false, true}) {
                assertThat(expression.evaluate(ImmutableMap.of("a[0]", first, "b[0]", second)), is(true));
            }
        }
        assertThrows(IllegalArgumentException.class, () -> expression.evaluate(ImmutableMap.of("a[0]", true)));
    }

    @Test
    public void testRename() {
        Expression expression = Expression.bit("a", 0).and(Expression.bit("b", 2).not());
        Expression renamed = expression.rename(signal -> signal.equals("a") ? "x" : signal);
        assertThat(renamed.inputs(), contains("x[0]", "b[2]"));
        assertThat(renamed, is(Expression.bit("x", 0).and(Expression.bit("b", 2).not())));
    }

    @Test
    public void testBitName() {
        BitName name = BitName.parse("a[b][12]");
        assertThat(name.signal(), is("a[b]"));
        assertThat(name.index(), is(12));
        assertThat(name.toString(), is("a[b][12]"));

        for (String malformed : ImmutableList.of("a", "a[]", "a[x]", "[1]", "a[1", "a[99999999999]")) {
            MalformedNodeNameException exception =
                    assertThrows(MalformedNodeNameException.class, () -> BitName.parse(malformed));
            assertThat(exception.nodeName(), is(malformed));
        }
    }

    @Test
    public void testExactlyOne() {
        BitVector vector = BitVector.atom("v", 3);
        Expression exactlyOne = vector.exactlyOne();
        Expression isZero = vector.isZero();
        for (int value = 0; value < 8; value++) {
            Map<String, Boolean> assignment = new HashMap<>();
            for (int i = 0; i < 3; i++) {
                assignment.put(BitName.format("v", i), (value & (1 << i)) != 0);
            }
            assertThat(exactlyOne.evaluate(assignment), is(Integer.bitCount(value) == 1));
            assertThat(isZero.evaluate(assignment), is(value == 0));
            assertThat(vector.eq(value).evaluate(assignment), is(true));
            assertThat(vector.neq((value + 1) % 8).evaluate(assignment), is(true));
        }
    }

    @Test
    public void testVectorOperations() {
        BitVector x = BitVector.atom("x", 2);
        BitVector y = BitVector.atom("y", 2);
        BddManager manager = BddManager.create();

        Formula sameAsXor = x.xor(y).isZero().toFormula(manager);
        assertThat(x.eq(y).toFormula(manager), sameInstance(sameAsXor));
        assertThat(x.and(y).or(x.not()).width(), is(2));
        assertThat(BitVector.ite(Expression.TRUE, x, y).bit(1).inputs(), contains("x[1]", "y[1]"));
        assertThat(x.eq(BitVector.constant(2, 2)).toFormula(manager), sameInstance(x.eq(2).toFormula(manager)));
        assertThat(x.eq(4).inputs(), is(ImmutableSet.of("x[0]", "x[1]")));
        assertThat(x.eq(4).toFormula(manager).isFalse(), is(true));
        assertThrows(IllegalArgumentException.class, () -> x.eq(BitVector.atom("z", 3)));
        assertThrows(IllegalArgumentException.class, () -> BitVector.constant(4, 2));
    }
}
