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

import io.github.goodees.fluentmatch.predicates.MatchPredicates;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Single expression matching and other shortcuts built on top of {@link FluentMatch}.
 */
public final class Matching {
    static final String NULL_LABEL = "Null";
    static final String NOT_NULL_LABEL = "NotNull";
    static final String REGEX_LABEL_PREFIX = "Regex: ";

    private Matching() {
    }

    /**
     * Evaluate branches against the subject and return the result of the first that matches.
     * <pre>{@code
     * String name = Matching.match(n,
     *         Branch.equalTo(1, () -> "One"),
     *         Branch.when(x -> x > 10, () -> "Many"));
     * }</pre>
     * Failing branches are suppressed as in a default {@link FluentMatch}.
     * @param subject value to match
     * @param branches value or predicate branches
     * @param <T> type of subject
     * @param <R> type of result
     * @return result of first matching branch, which may be null if the branch produced null
     * @throws MatchException with fault {@link MatchException.Fault#UNMATCHED} if no branch matched
     */
    @SafeVarargs
    public static <T, R> R match(T subject, Branch<T, R>... branches) {
        FluentMatch<T, R> matcher = new FluentMatch<>(subject);
        for (Branch<T, R> branch : branches) {
            matcher.on(branch.condition, branch.body, branch.label);
        }
        return resultOrUnmatched(matcher);
    }

    /**
     * Match on the runtime type of the subject, union style. Type tests use {@link Class#isInstance(Object)}, so a
     * branch for a supertype matches its subclasses as well and null never matches.
     * @param subject value to match
     * @param branches type branches
     * @param <S> type of subject
     * @param <R> type of result
     * @return result of first matching branch
     * @throws MatchException with fault {@link MatchException.Fault#UNMATCHED} if no branch matched
     */
    @SafeVarargs
    public static <S, R> R matchType(S subject, TypeBranch<?, ? extends R>... branches) {
        FluentMatch<S, R> matcher = new FluentMatch<>(subject);
        for (TypeBranch<?, ? extends R> branch : branches) {
            declare(matcher, branch);
        }
        return resultOrUnmatched(matcher);
    }

    /**
     * Distinguish null from a present value. Exceptions of the bodies are not suppressed, they are rethrown as
     * {@link MatchException} with fault {@link MatchException.Fault#UNHANDLED_CLAUSE_ERROR}.
     * @param subject value to match
     * @param whenNull result when subject is null
     * @param whenNotNull result computed from present subject
     * @param <T> type of subject
     * @param <R> type of result
     * @return the result of the matching body
     */
    public static <T, R> R matchNull(T subject, FluentMatch.Body<? extends R> whenNull,
            FluentMatch.TypedBody<? super T, ? extends R> whenNotNull) {
        Objects.requireNonNull(whenNotNull, "Body must be defined");
        FluentMatch<T, R> matcher = new FluentMatch<>(subject,
                MatchConfiguration.breakOnFirstMatch().withUnhandledErrorPolicy(UnhandledErrorPolicy.RETHROW));
        return matcher
                .on(MatchPredicates.isNull(), whenNull, NULL_LABEL)
                .on(MatchPredicates.isNotNull(), () -> whenNotNull.apply(subject), NOT_NULL_LABEL)
                .result();
    }

    public static <R> FluentMatch<String, R> onRegex(FluentMatch<String, R> matcher, String regex,
            FluentMatch.TypedBody<? super Matcher, ? extends R> body) {
        return onRegex(matcher, regex, body, null);
    }

    /**
     * Add a clause matching when the expression is found in the subject. The body receives the regex matcher
     * positioned at the first match.
     * @param matcher matcher to add the clause to
     * @param regex the regular expression
     * @param body result producing function
     * @param label label of the log entry, {@code "Regex: <regex>"} when null
     * @param <R> type of result
     * @return the matcher
     */
    public static <R> FluentMatch<String, R> onRegex(FluentMatch<String, R> matcher, String regex,
            FluentMatch.TypedBody<? super Matcher, ? extends R> body, String label) {
        Objects.requireNonNull(matcher, "Matcher must be defined");
        Objects.requireNonNull(body, "Body must be defined");
        Pattern pattern = Pattern.compile(regex);
        return matcher.on(MatchPredicates.matchesRegex(pattern), () -> {
            Matcher found = pattern.matcher(matcher.subject());
            found.find();
            return body.apply(found);
        }, label != null ? label : REGEX_LABEL_PREFIX + regex);
    }

    /**
     * Match every item with a fresh matcher that {@linkplain MatchConfiguration#collectAllMatches() collects all
     * matches}, and stream all of their results. The stream is lazy, items are matched as it is consumed.
     * @param items subjects to match
     * @param configurer function declaring clauses for a single item
     * @param <T> type of subject
     * @param <R> type of result
     * @return results of all items in item order, and then in order of clauses
     */
    public static <T, R> Stream<R> matchEach(Iterable<? extends T> items, Consumer<? super FluentMatch<T, R>> configurer) {
        Objects.requireNonNull(items, "Items must be defined");
        Objects.requireNonNull(configurer, "Configuring function must be defined");
        return StreamSupport.stream(items.spliterator(), false)
                .flatMap(item -> {
                    FluentMatch<T, R> matcher = new FluentMatch<>(item, MatchConfiguration.collectAllMatches());
                    configurer.accept(matcher);
                    return matcher.allResults().stream();
                });
    }

    private static <R> R resultOrUnmatched(FluentMatch<?, R> matcher) {
        if (!matcher.hasMatched()) {
            throw MatchException.unmatched(matcher.subject());
        }
        return matcher.result();
    }

    private static <S, C, R> void declare(FluentMatch<S, R> matcher, TypeBranch<C, ? extends R> branch) {
        matcher.onType(branch.type, branch.body, branch.label, null);
    }

    /**
     * A value or predicate branch of {@link #match(Object, Branch[])}.
     * @param <T> type of subject
     * @param <R> type of result
     */
    public static final class Branch<T, R> {
        private final Predicate<? super T> condition;
        private final FluentMatch.Body<? extends R> body;
        private final String label;

        private Branch(Predicate<? super T> condition, FluentMatch.Body<? extends R> body,
                String label) {
            this.condition = Objects.requireNonNull(condition, "Condition must be defined");
            this.body = Objects.requireNonNull(body, "Body must be defined");
            this.label = label;
        }

        public static <T, R> Branch<T, R> when(Predicate<? super T> condition, FluentMatch.Body<? extends R> body) {
            return new Branch<>(condition, body, null);
        }

        public static <T, R> Branch<T, R> equalTo(T value, FluentMatch.Body<? extends R> body) {
            return new Branch<>(MatchPredicates.equalTo(value), body, null);
        }

        public Branch<T, R> labeled(String label) {
            return new Branch<>(condition, body, label);
        }
    }

    /**
     * A type branch of {@link #matchType(Object, TypeBranch[])}.
     * @param <C> the type to match
     * @param <R> type of result
     */
    public static final class TypeBranch<C, R> {
        private final Class<C> type;
        private final FluentMatch.TypedBody<? super C, ? extends R> body;
        private final String label;

        private TypeBranch(Class<C> type, FluentMatch.TypedBody<? super C, ? extends R> body, String label) {
            this.type = Objects.requireNonNull(type, "Case class cannot be null");
            this.body = Objects.requireNonNull(body, "Body must be defined");
            this.label = label;
        }

        public static <C, R> TypeBranch<C, R> of(Class<C> type, FluentMatch.TypedBody<? super C, ? extends R> body) {
            return new TypeBranch<>(type, body, null);
        }

        public TypeBranch<C, R> labeled(String label) {
            return new TypeBranch<>(type, body, label);
        }
    }
}
