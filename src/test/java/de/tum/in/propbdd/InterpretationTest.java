/*
 * This file is part of PropBDD.
 * Copyright (c) 2024 The PropBDD contributors.
 *
 * PropBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * PropBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PropBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.propbdd;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class InterpretationTest {
    @Test
    public void testAssignAndGet() {
        Interpretation interpretation = new Interpretation();
        interpretation.assign("p", true);
        interpretation.assign("q", false);
        assertThat(interpretation.get("p"), is(true));
        assertThat(interpretation.get("q"), is(false));
        assertThat(interpretation.get("r"), is(nullValue()));
        assertThat(interpretation.isDefinedFor("q"), is(true));
        assertThat(interpretation.isDefinedFor("r"), is(false));
        assertThrows(UnassignedVariableException.class, () -> interpretation.valueOf("r"));
    }

    @Test
    public void testCopyIsIndependent() {
        Interpretation original = Interpretation.of(Map.of("p", true));
        Interpretation copy = original.copy();
        copy.assign("p", false);
        copy.assign("q", true);
        assertThat(original.get("p"), is(true));
        assertThat(original.isDefinedFor("q"), is(false));
    }

    @Test
    public void testExtendDoesNotMutate() {
        Interpretation original = Interpretation.of(Map.of("p", true));
        Interpretation extended = original.extend("q", false);
        assertThat(extended.get("q"), is(false));
        assertThat(extended.get("p"), is(true));
        assertThat(original.isDefinedFor("q"), is(false));
    }

    @Test
    public void testCompleteness() {
        Interpretation interpretation = Interpretation.of(Map.of("p", true, "q", false));
        assertThat(interpretation.isComplete(List.of("p", "q")), is(true));
        assertThat(interpretation.isComplete(List.of("p", "q", "r")), is(false));
    }

    @Test
    public void testEquality() {
        Interpretation first = Interpretation.of(Map.of("p", true, "q", false));
        Interpretation second = new Interpretation();
        second.assign("q", false);
        second.assign("p", true);
        assertThat(first, is(second));
        assertThat(first.hashCode(), is(second.hashCode()));
        assertThat(first, is(not(first.extend("r", true))));
    }

    @Test
    public void testToString() {
        Interpretation interpretation = Interpretation.of(Map.of("q", false, "p", true));
        assertThat(interpretation.toString(), is("I(p=true, q=false)"));
    }
}
