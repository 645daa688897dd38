package io.github.goodees.fluentmatch;

/*-
 * #%L
 * fluent-match
 * %%
 * Copyright (C) 2017 - 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.fluentmatch.Matching.Branch;
import io.github.goodees.fluentmatch.Matching.TypeBranch;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static io.github.goodees.fluentmatch.predicates.MatchPredicates.inRange;
import static io.github.goodees.fluentmatch.predicates.MatchPredicates.isOneOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MatchingTest {

    static abstract class Shape {
    }

    static class Circle extends Shape {
        final double radius;

        Circle(double radius) {
            this.radius = radius;
        }
    }

    static class Square extends Shape {
        final double side;

        Square(double side) {
            this.side = side;
        }
    }

    @Test
    public void match_returns_first_matching_branch() {
        String result = Matching.match(5,
                Branch.equalTo(3, () -> "Three"),
                Branch.equalTo(5, () -> "Five"),
                Branch.when(x -> x > 0, () -> "Positive"));
        assertEquals("Five", result);
    }

    @Test
    public void match_with_predicates() {
        String result = Matching.match(42,
                Branch.when(x -> x == 1, () -> "One"),
                Branch.when(x -> x == 2, () -> "Two"),
                Branch.when(x -> true, () -> "Other"));
        assertEquals("Other", result);
    }

    @Test
    public void match_without_matching_branch_fails() {
        try {
            Matching.match(7, Branch.equalTo(1, () -> "One").labeled("One"));
            fail("Match without any matching branch should fail");
        } catch (MatchException e) {
            assertEquals(MatchException.Fault.UNMATCHED, e.getFault());
            assertEquals(7, e.getSubject());
        }
    }

    @Test
    public void null_produced_by_matching_branch_is_a_result() {
        String result = Matching.match(1, Branch.equalTo(1, () -> (String) null));
        assertNull(result);
    }

    @Test
    public void match_type_selects_by_runtime_class() {
        Shape shape = new Square(2);
        String result = Matching.matchType(shape,
                TypeBranch.of(Circle.class, c -> "Circle of " + c.radius),
                TypeBranch.of(Square.class, s -> "Square of " + s.side));
        assertEquals("Square of 2.0", result);
    }

    @Test
    public void match_type_supertype_branch_matches_subclass() {
        Object value = new Circle(1);
        String result = Matching.matchType(value,
                TypeBranch.of(Shape.class, s -> "Shape"),
                TypeBranch.of(Circle.class, c -> "Circle"));
        assertEquals("Shape", result);
    }

    @Test
    public void match_type_never_matches_null() {
        try {
            Matching.matchType(null, TypeBranch.of(Object.class, o -> "Object"));
            fail("Null should not match any type");
        } catch (MatchException e) {
            assertEquals(MatchException.Fault.UNMATCHED, e.getFault());
        }
    }

    @Test
    public void match_null_distinguishes_absent_value() {
        String nothing = null;
        assertEquals("Is null", Matching.matchNull(nothing, () -> "Is null", s -> "Value: " + s));
        assertEquals("Value: x", Matching.matchNull("x", () -> "Is null", s -> "Value: " + s));
    }

    @Test
    public void match_null_does_not_suppress_body_failure() {
        IllegalStateException failure = new IllegalStateException("broken");
        try {
            Matching.matchNull("x", () -> "Is null", s -> {
                throw failure;
            });
            fail("Failure of body should propagate");
        } catch (MatchException e) {
            assertEquals(MatchException.Fault.UNHANDLED_CLAUSE_ERROR, e.getFault());
            assertSame(failure, e.getCause());
        }
    }

    @Test
    public void regex_clause_receives_positioned_matcher() {
        FluentMatch<String, String> matcher = FluentMatch.of("order-1234-b", String.class);
        Matching.onRegex(matcher, "[a-z]+-(\\d+)", found -> found.group(1));
        assertEquals("1234", matcher.result());
        assertEquals("Regex: [a-z]+-(\\d+)", matcher.log().get(0).label());
    }

    @Test
    public void regex_clause_skips_non_matching_and_null_subject() {
        FluentMatch<String, String> matcher = FluentMatch.of("no digits", String.class);
        Matching.onRegex(matcher, "\\d+", found -> found.group(), "Digits");
        assertFalse(matcher.hasMatched());

        FluentMatch<String, String> nullMatcher = FluentMatch.of(null, String.class);
        Matching.onRegex(nullMatcher, ".*", found -> "anything");
        assertFalse(nullMatcher.hasMatched());
        assertTrue(nullMatcher.log().isEmpty());
    }

    @Test
    public void match_each_streams_all_results_in_item_order() {
        List<String> results = Matching.<Integer, String>matchEach(Arrays.asList(1, 2, 3, 4), m -> {
            m.on(isOneOf(2, 4), () -> "Even")
                    .on(inRange(1, 3), () -> "Low")
                    .otherwise(() -> "Other");
        }).collect(Collectors.toList());
        assertEquals(Arrays.asList("Low", "Even", "Low", "Low", "Even"), results);
    }

    @Test
    public void match_each_applies_default_to_unmatched_items() {
        List<String> results = Matching.<Integer, String>matchEach(Arrays.asList(5, 2), m -> {
            m.on(isOneOf(2, 4), () -> "Even").otherwise(() -> "Other");
        }).collect(Collectors.toList());
        assertEquals(Arrays.asList("Other", "Even"), results);
    }

    @Test
    public void match_each_is_lazy() {
        AtomicInteger configured = new AtomicInteger();
        Stream<String> results = Matching.<Integer, String>matchEach(Arrays.asList(1, 2, 3), m -> {
            configured.incrementAndGet();
            m.on(x -> x > 2, () -> "Big");
        });
        assertEquals(0, configured.get());
        assertEquals(Collections.singletonList("Big"), results.collect(Collectors.toList()));
        assertEquals(3, configured.get());
    }
}
