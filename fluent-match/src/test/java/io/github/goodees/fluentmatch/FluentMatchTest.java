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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.goodees.fluentmatch.predicates.MatchPredicates.contains;
import static io.github.goodees.fluentmatch.predicates.MatchPredicates.endsWith;
import static io.github.goodees.fluentmatch.predicates.MatchPredicates.inRange;
import static io.github.goodees.fluentmatch.predicates.MatchPredicates.startsWith;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class FluentMatchTest {

    @Rule
    public TestName testName = new TestName();

    @Test
    public void range_clause_wins_over_default() {
        String result = FluentMatch.of(42, String.class)
                .onEquals(1, () -> "One")
                .on(inRange(10, 100), () -> "Big range")
                .otherwise(() -> "Other");
        assertEquals("Big range", result);
    }

    @Test
    public void value_clause_matches_equal_subject() {
        String result = FluentMatch.of(5, String.class)
                .onEquals(3, () -> "Three")
                .onEquals(5, () -> "Five")
                .otherwise(() -> "Other");
        assertEquals("Five", result);
    }

    @Test
    public void first_true_predicate_wins() {
        FluentMatch<String, String> matcher = FluentMatch.of("foobar", String.class)
                .on(contains("foo"), () -> "Contains foo")
                .on(startsWith("bar"), () -> "Starts with bar")
                .on(endsWith("ar"), () -> "Ends with ar");
        assertEquals("Contains foo", matcher.otherwise(() -> "No match"));
        assertEquals(1, matcher.log().size());
    }

    @Test
    public void clauses_after_match_are_not_evaluated() {
        AtomicBoolean evaluated = new AtomicBoolean();
        FluentMatch<Integer, String> matcher = FluentMatch.of(7, String.class)
                .on(x -> x > 5, () -> "first")
                .on(x -> {
                    evaluated.set(true);
                    return true;
                }, () -> "second")
                .onEquals(7, () -> "third");
        assertFalse(evaluated.get());
        assertEquals("first", matcher.result());
        assertEquals(1, matcher.log().size());
        assertEquals(1, matcher.allResults().size());
    }

    @Test
    public void collecting_matcher_records_every_satisfied_clause() {
        FluentMatch<Integer, String> matcher = FluentMatch.<Integer, String>of(12, MatchConfiguration.collectAllMatches())
                .on(x -> x % 2 == 0, () -> "even")
                .on(x -> x > 100, () -> "huge")
                .on(x -> x % 3 == 0, () -> "divisible by three");
        assertEquals(Arrays.asList("even", "divisible by three"), matcher.allResults());
        assertEquals("divisible by three", matcher.result());
        assertEquals(2, matcher.log().size());
        assertEquals(0, matcher.log().get(0).index());
        assertEquals(1, matcher.log().get(1).index());
    }

    @Test
    public void default_is_not_executed_after_match() {
        AtomicBoolean executed = new AtomicBoolean();
        FluentMatch<Integer, String> matcher = FluentMatch.of(1, String.class).onEquals(1, () -> "One");
        String result = matcher.otherwise(() -> {
            executed.set(true);
            return "Other";
        });
        assertEquals("One", result);
        assertFalse(executed.get());
        assertEquals(1, matcher.log().size());
        assertEquals(MatchLogEntry.Outcome.MATCHED, matcher.log().get(0).outcome());
    }

    @Test
    public void default_is_executed_when_nothing_matched() {
        FluentMatch<Integer, String> matcher = FluentMatch.of(2, String.class).onEquals(1, () -> "One");
        assertEquals("Other", matcher.otherwise(() -> "Other"));
        assertFalse(matcher.hasMatched());
        assertEquals(Collections.singletonList("Other"), matcher.allResults());
        MatchLogEntry entry = matcher.log().get(0);
        assertEquals(MatchLogEntry.Outcome.DEFAULTED, entry.outcome());
        assertEquals("Default", entry.label());
        assertEquals(Optional.of("Other"), entry.result());
    }

    @Test
    public void collecting_matcher_skips_default_when_anything_matched() {
        FluentMatch<Integer, String> matcher = FluentMatch.of(4, MatchConfiguration.collectAllMatches());
        matcher.on(x -> x > 1, () -> "big").on(x -> x > 10, () -> "huge");
        assertEquals("big", matcher.otherwise(() -> "Other"));
        assertEquals(Collections.singletonList("big"), matcher.allResults());
    }

    @Test
    public void result_is_null_without_match_and_default() {
        FluentMatch<Integer, String> matcher = FluentMatch.of(3, String.class)
                .onEquals(1, () -> "One")
                .on(x -> x > 10, () -> "Big");
        assertNull(matcher.result());
        assertFalse(matcher.resultIfPresent().isPresent());
        assertFalse(matcher.hasMatched());
        assertThat(matcher.log(), empty());
        assertThat(matcher.allResults(), empty());
    }

    @Test
    public void null_subject_is_matched_like_any_other_value() {
        FluentMatch<String, String> matcher = FluentMatch.<String, String>of(null)
                .on(s -> s != null && s.isEmpty(), () -> "empty")
                .onEquals(null, () -> "nothing");
        assertEquals("nothing", matcher.result());
        assertFalse(matcher.log().get(0).subject().isPresent());
    }

    @Test
    public void type_clause_receives_narrowed_subject() {
        Object subject = "hello";
        FluentMatch<Object, Integer> matcher = FluentMatch.of(subject, Integer.class)
                .onType(Integer.class, i -> i * 2)
                .onType(String.class, String::length);
        assertEquals(Integer.valueOf(5), matcher.result());
        assertEquals("String", matcher.log().get(0).label());
    }

    @Test
    public void type_clause_matches_subclasses_but_not_null() {
        assertEquals("number", FluentMatch.of((Object) 3L, String.class)
                .onType(Number.class, n -> "number")
                .otherwise(() -> "other"));
        assertEquals("other", FluentMatch.<Object, String>of(null)
                .onType(Object.class, o -> "object")
                .otherwise(() -> "other"));
    }

    @Test
    public void side_effect_clause_counts_as_match_without_result() {
        List<Integer> seen = new ArrayList<>();
        FluentMatch<Integer, String> matcher = FluentMatch.of(9, String.class)
                .perform(x -> x > 5, () -> seen.add(9))
                .on(x -> true, () -> "ignored");
        matcher.otherwisePerform(() -> seen.add(-1));
        assertEquals(Collections.singletonList(9), seen);
        assertTrue(matcher.hasMatched());
        assertNull(matcher.result());
        assertThat(matcher.allResults(), empty());
        assertEquals(1, matcher.log().size());
        assertFalse(matcher.log().get(0).result().isPresent());
    }

    @Test
    public void side_effect_clauses_by_value_and_type() {
        AtomicInteger counter = new AtomicInteger();
        FluentMatch<Object, Void> matcher = FluentMatch.of((Object) "text", MatchConfiguration.collectAllMatches());
        matcher.performOnEquals("text", counter::incrementAndGet)
                .performOnType(String.class, s -> counter.addAndGet(s.length()))
                .performOnType(Integer.class, i -> counter.addAndGet(100));
        assertEquals(5, counter.get());
        assertEquals(Arrays.asList("Case", "String"), labels(matcher));
    }

    @Test
    public void default_side_effect_runs_when_nothing_matched() {
        List<String> seen = new ArrayList<>();
        FluentMatch<String, String> matcher = FluentMatch.of("x", String.class).onEquals("y", () -> "y");
        matcher.otherwisePerform(() -> seen.add("fallback"), "Fallback");
        assertEquals(Collections.singletonList("fallback"), seen);
        assertEquals(MatchLogEntry.Outcome.DEFAULTED, matcher.log().get(0).outcome());
        assertEquals("Fallback", matcher.log().get(0).label());
        assertNull(matcher.result());
    }

    @Test
    public void log_entries_carry_label_subject_result_and_timestamp() {
        Instant now = Instant.parse("2018-03-01T10:15:30Z");
        MatchConfiguration configuration = new MatchConfiguration(false, null)
                .withClock(Clock.fixed(now, ZoneOffset.UTC));
        FluentMatch<Integer, String> matcher = FluentMatch.of(42, configuration);
        matcher.on(x -> x > 10, () -> "Big", "BigMatch")
                .on(x -> x > 20, () -> "Bigger");

        MatchLogEntry first = matcher.log().get(0);
        assertEquals(0, first.index());
        assertEquals(now, first.timestamp());
        assertEquals("BigMatch", first.label());
        assertEquals(Optional.of(42), first.subject());
        assertEquals(Optional.of("Big"), first.result());
        assertFalse(first.error().isPresent());
        assertEquals("Case", matcher.log().get(1).label());
    }

    @Test
    public void log_indices_follow_positions() {
        FluentMatch<String, String> matcher = FluentMatch.of(testName.getMethodName(), MatchConfiguration.collectAllMatches());
        matcher.on(s -> s.startsWith("log"), () -> "a")
                .on(s -> false, () -> "never")
                .on(s -> {
                    throw new IllegalStateException("predicate failure");
                }, () -> "b")
                .on(s -> s.endsWith("positions"), () -> "c");
        matcher.otherwise(() -> "d");
        assertEquals(Arrays.asList("a", "c"), matcher.allResults());
        for (int i = 0; i < matcher.log().size(); i++) {
            assertEquals(i, matcher.log().get(i).index());
        }
        assertEquals(3, matcher.log().size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void log_cannot_be_modified() {
        FluentMatch.of(1, String.class).onEquals(1, () -> "One").log().clear();
    }

    @Test(expected = NullPointerException.class)
    public void configuration_is_required() {
        new FluentMatch<>(1, (MatchConfiguration) null);
    }

    private static List<String> labels(FluentMatch<?, ?> matcher) {
        List<String> labels = new ArrayList<>();
        for (MatchLogEntry entry : matcher.log()) {
            labels.add(entry.label());
        }
        return labels;
    }
}
