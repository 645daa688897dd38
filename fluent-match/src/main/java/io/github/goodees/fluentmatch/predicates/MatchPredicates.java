package io.github.goodees.fluentmatch.predicates;

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

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Predicate factories for use as clause conditions, meant to be statically imported:
 * <pre>{@code
 * FluentMatch.of(temperature, String.class)
 *         .on(lessThan(0), () -> "freezing")
 *         .on(inRange(0, 25), () -> "mild")
 *         .otherwise(() -> "hot");
 * }</pre>
 * Predicates over strings and comparables never match null.
 */
public final class MatchPredicates {

    private MatchPredicates() {
    }

    /**
     * Subject between bounds, both inclusive.
     * @param min lower bound
     * @param max upper bound
     * @param <C> comparable type
     * @return predicate
     */
    public static <C extends Comparable<? super C>> Predicate<C> inRange(C min, C max) {
        Objects.requireNonNull(min, "Lower bound must be defined");
        Objects.requireNonNull(max, "Upper bound must be defined");
        return x -> x != null && x.compareTo(min) >= 0 && x.compareTo(max) <= 0;
    }

    /**
     * Subject strictly greater than the value. Described as {@code ">value"}.
     * @param value compared value
     * @param <C> comparable type
     * @return predicate
     */
    public static <C extends Comparable<? super C>> DescribedPredicate<C> greaterThan(C value) {
        Objects.requireNonNull(value, "Compared value must be defined");
        return DescribedPredicate.of(">" + value, (C x) -> x != null && x.compareTo(value) > 0);
    }

    public static <C extends Comparable<? super C>> DescribedPredicate<C> lessThan(C value) {
        Objects.requireNonNull(value, "Compared value must be defined");
        return DescribedPredicate.of("<" + value, (C x) -> x != null && x.compareTo(value) < 0);
    }

    public static <T> DescribedPredicate<T> equalTo(T value) {
        return DescribedPredicate.of("==" + value, (T x) -> Objects.equals(x, value));
    }

    public static DescribedPredicate<Boolean> isTrue() {
        return DescribedPredicate.of("True", Boolean.TRUE::equals);
    }

    public static DescribedPredicate<Boolean> isFalse() {
        return DescribedPredicate.of("False", Boolean.FALSE::equals);
    }

    public static <T> Predicate<T> isNull() {
        return Objects::isNull;
    }

    public static <T> Predicate<T> isNotNull() {
        return Objects::nonNull;
    }

    public static Predicate<String> contains(String substring) {
        Objects.requireNonNull(substring, "Substring must be defined");
        return s -> s != null && s.contains(substring);
    }

    public static Predicate<String> startsWith(String prefix) {
        Objects.requireNonNull(prefix, "Prefix must be defined");
        return s -> s != null && s.startsWith(prefix);
    }

    public static Predicate<String> endsWith(String suffix) {
        Objects.requireNonNull(suffix, "Suffix must be defined");
        return s -> s != null && s.endsWith(suffix);
    }

    /**
     * Subject contains a match of the regular expression.
     * @param regex the expression
     * @return predicate
     * @see java.util.regex.Matcher#find()
     */
    public static Predicate<String> matchesRegex(String regex) {
        return matchesRegex(Pattern.compile(regex));
    }

    public static Predicate<String> matchesRegex(Pattern pattern) {
        Objects.requireNonNull(pattern, "Pattern must be defined");
        return s -> s != null && pattern.matcher(s).find();
    }

    @SafeVarargs
    public static <T> Predicate<T> isOneOf(T... values) {
        return isOneOf(Arrays.asList(values));
    }

    /**
     * Subject is equal to one of the values. The values are copied, later changes to the collection are not
     * reflected.
     * @param values accepted values, may contain null
     * @param <T> type of subject
     * @return predicate
     */
    public static <T> Predicate<T> isOneOf(Collection<? extends T> values) {
        Set<T> accepted = new HashSet<>(values);
        return accepted::contains;
    }

    @SafeVarargs
    public static <E extends Enum<E>> Predicate<E> isAnyOf(E first, E... rest) {
        Set<E> accepted = EnumSet.of(first, rest);
        return x -> x != null && accepted.contains(x);
    }
}
