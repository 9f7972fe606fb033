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
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class VariableTest {
    private static BitSet mask(long value) {
        return BitSet.valueOf(new long[] {value});
    }

    @Test
    public void testEncodeDecode() {
        Variable variable = Variable.of(ImmutableList.of("x", "y", "z"), "myvar");
        assertThat(variable.name(), is("myvar"));
        assertThat(variable.size(), is(3));

        assertThat(variable.encode("x"), is(mask(0b001)));
        assertThat(variable.encode("y"), is(mask(0b010)));
        assertThat(variable.encode("z"), is(mask(0b100)));

        assertThat(variable.decode(mask(0b100)), is("z"));
        assertThat(variable.decode(mask(0b010)), is("y"));
        assertThat(variable.decode(mask(0b001)), is("x"));
    }

    @Test
    public void testNullAndDuplicateValues() {
        List<Object> domain = Arrays.<Object>asList(1, null, 1);
        Variable variable = Variable.of(domain, "v");
        assertThat(variable.encode(null), is(mask(0b010)));
        assertThat(variable.encode(1), is(mask(0b001)));
        assertThat(variable.decode(mask(0b010)), is(nullValue()));
        assertThat(variable.decode(mask(0b100)), is(1));
    }

    @Test
    public void testValidIsOneHot() {
        Variable variable = Variable.of(ImmutableList.of('a', 'b', 'c', 'd'), "v");
        for (long value = 0; value < 1 << variable.size(); value++) {
            assertThat(variable.isValid(mask(value)), is(Long.bitCount(value) == 1));
        }
        assertThat(variable.isValid(mask(0b10000)), is(false));
    }

    @Test
    public void testValidMentionsAllBits() {
        Variable variable = Variable.of(ImmutableList.of(1, 2, 3), "v");
        assertThat(variable.valid().inputs(), is(ImmutableSet.of("v[0]", "v[1]", "v[2]")));
        assertThat(variable.bitNames(), contains("v[0]", "v[1]", "v[2]"));
        assertThat(variable.bitName(1), is("v[1]"));
    }

    @Test
    public void testInvalidEncodings() {
        Variable variable = Variable.of(ImmutableList.of(1, 2, 3), "v");
        assertThrows(InvalidAssignmentException.class, () -> variable.encode(4));
        assertThrows(InvalidAssignmentException.class, () -> variable.decode(mask(0)));
        assertThrows(InvalidAssignmentException.class, () -> variable.decode(mask(0b011)));
        assertThrows(InvalidAssignmentException.class, () -> variable.decode(mask(0b1000)));
    }

    @Test
    public void testInvalidDefinitions() {
        assertThrows(ValidationException.class, () -> Variable.of(ImmutableList.of(), "v"));
        assertThrows(ValidationException.class, () -> Variable.of(ImmutableList.of(1), ""));
        assertThrows(ValidationException.class, () -> Variable.of(ImmutableList.of(1), "v[0]"));
    }

    @Test
    public void testRenaming() {
        Variable variable = Variable.of(ImmutableList.of("x", "y", "z"), "myvar");
        assertThat(variable.withName("myvar"), sameInstance(variable));
        assertThat(Variable.of(variable, null), sameInstance(variable));
        assertThat(Variable.of(variable, "myvar"), sameInstance(variable));

        Variable renamed = variable.withName("bar");
        assertThat(variable.name(), is("myvar"));
        assertThat(renamed.name(), is("bar"));
        assertThat(renamed.domain(), is(variable.domain()));
        assertThat(renamed.valid().inputs(), is(ImmutableSet.of("bar[0]", "bar[1]", "bar[2]")));
        assertThat(renamed.encode("y"), is(variable.encode("y")));
        assertThat(renamed, is(not(variable)));
        assertThat(renamed.withName("myvar"), is(variable));
    }

    @Test
    public void testFreshNames() {
        Variable first = Variable.of(ImmutableList.of(1));
        Variable second = Variable.of(ImmutableList.of(1));
        assertThat(first.name(), is(not(second.name())));
        assertThat(first.withName(first.name()), sameInstance(first));
    }

    @Test
    public void testFreshNamesAreReserved() {
        Variable fresh = Variable.of(ImmutableList.of(1, 2));
        assertThrows(ValidationException.class, () -> Variable.of(ImmutableList.of(1), fresh.name()));
        assertThrows(ValidationException.class, () -> Variable.of(ImmutableList.of(1), "_v0"));
        assertThrows(ValidationException.class, () -> Variable.of(ImmutableList.of(1)).withName("_v12"));
        assertThrows(ValidationException.class,
                () -> Variable.fromPredicate(Expression.bit("_v3", 0), ImmutableList.of(1)));

        assertThat(Variable.of(ImmutableList.of(1), "_v").name(), is("_v"));
        assertThat(Variable.of(ImmutableList.of(1), "_value").name(), is("_value"));
        assertThat(fresh.withName("w").name(), is("w"));
    }

    @Test
    public void testFromPredicate() {
        Expression atLeastOne = Expression.bit("p", 0).or(Expression.bit("p", 1));
        Variable variable = Variable.fromPredicate(atLeastOne, ImmutableList.of("l", "r", "n"));
        assertThat(variable.name(), is("p"));
        assertThat(variable.isValid(mask(0b011)), is(true));
        assertThat(variable.isValid(mask(0b100)), is(false));
        assertThat(variable.valid().inputs(), is(ImmutableSet.of("p[0]", "p[1]", "p[2]")));
    }

    @Test
    public void testFromPredicateRejectsSeveralSignals() {
        Expression predicate = Expression.bit("p", 0).and(Expression.bit("q", 0));
        assertThrows(ValidationException.class, () -> Variable.fromPredicate(predicate, ImmutableList.of(1)));
        assertThrows(ValidationException.class, () -> Variable.fromPredicate(Expression.TRUE, ImmutableList.of(1)));
        assertThrows(ValidationException.class,
                () -> Variable.fromPredicate(Expression.bit("p", 3), ImmutableList.of(1, 2)));
    }

    @Test
    public void testEqualTo() {
        Variable variable = Variable.of(ImmutableList.of(1, 2, 3), "v");
        Expression isTwo = variable.equalTo(2);
        assertThat(isTwo.evaluate(variable.blast(variable.encode(2))), is(true));
        assertThat(isTwo.evaluate(variable.blast(variable.encode(3))), is(false));
        assertThat(variable.unblast(variable.blast(mask(0b101))), is(mask(0b101)));
    }
}
