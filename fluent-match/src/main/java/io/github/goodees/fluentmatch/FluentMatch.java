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

import io.github.goodees.fluentmatch.async.AsyncMatch;
import io.github.goodees.fluentmatch.predicates.DescribedPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * Fluent pattern matching over a single subject. Clauses are evaluated immediately as they are declared, in
 * declaration order, and the matcher records a {@linkplain #log() log entry} for every clause that matched or failed.
 *
 * <pre>{@code
 * String size = FluentMatch.of(42, String.class)
 *         .onEquals(1, () -> "One")
 *         .on(inRange(10, 100), () -> "Big range")
 *         .otherwise(() -> "Other");
 * }</pre>
 *
 * <h2>Short circuit</h2>
 * <p>When {@linkplain MatchConfiguration#isBreakOnMatch() breaking on match} (the default), the first satisfied clause
 * produces the result and every clause declared afterwards is skipped without evaluating its predicate. Otherwise
 * every satisfied clause appends its value to {@link #allResults()}.</p>
 *
 * <h2>Clause failures</h2>
 * <p>An exception thrown by a predicate or a body is offered to the clause error handler, then to the
 * {@linkplain MatchConfiguration#globalErrorHandler() global handler}. If neither returns true, the
 * {@link UnhandledErrorPolicy} decides whether it is suppressed or rethrown as {@link MatchException}. Either way a
 * {@link MatchLogEntry.Outcome#FAILED} entry is logged and the failed clause does not count as a match.</p>
 *
 * <h2>Asynchronous clauses</h2>
 * <p>The {@code ...Async} variants accept bodies returning a {@link CompletionStage}. They complete with this matcher
 * once the clause is settled, and the caller needs to compose on that stage before declaring the next clause.
 * {@link #async()} does this composition.</p>
 *
 * <p>The matcher is not thread safe and is meant to be driven by a single call chain.</p>
 *
 * @param <T> type of the subject
 * @param <R> type of the result
 */
public class FluentMatch<T, R> {
    private static final Logger logger = LoggerFactory.getLogger(FluentMatch.class);

    static final String CASE_LABEL = "Case";
    static final String CASE_ASYNC_LABEL = "CaseAsync";
    static final String DEFAULT_LABEL = "Default";
    static final String DEFAULT_ASYNC_LABEL = "DefaultAsync";

    private final T subject;
    private final MatchConfiguration configuration;
    private final List<R> allResults = new ArrayList<>();
    private final List<MatchLogEntry> log = new ArrayList<>();
    private boolean matched;
    private R result;

    public FluentMatch(T subject, MatchConfiguration configuration) {
        this.subject = subject;
        this.configuration = Objects.requireNonNull(configuration, "Match configuration must be specified");
    }

    public FluentMatch(T subject, boolean breakOnMatch, ClauseErrorHandler globalErrorHandler) {
        this(subject, new MatchConfiguration(breakOnMatch, globalErrorHandler));
    }

    public FluentMatch(T subject) {
        this(subject, MatchConfiguration.breakOnFirstMatch());
    }

    public static <T, R> FluentMatch<T, R> of(T subject) {
        return new FluentMatch<>(subject);
    }

    /**
     * Start matching with explicit result type, so that the chain does not need type witnesses.
     * @param subject value to match
     * @param resultType class of the result
     * @param <T> type of subject
     * @param <R> type of result
     * @return new matcher breaking on first match
     */
    public static <T, R> FluentMatch<T, R> of(T subject, Class<R> resultType) {
        return new FluentMatch<>(subject);
    }

    public static <T, R> FluentMatch<T, R> of(T subject, MatchConfiguration configuration) {
        return new FluentMatch<>(subject, configuration);
    }

    // synchronous clauses

    /**
     * When subject satisfies the predicate, produce the result with the body.
     * @param predicate test of the subject
     * @param body result producing function
     * @return this matcher
     */
    public FluentMatch<T, R> on(Predicate<? super T> predicate, Body<? extends R> body) {
        return on(predicate, body, null, null);
    }

    public FluentMatch<T, R> on(Predicate<? super T> predicate, Body<? extends R> body, String label) {
        return on(predicate, body, label, null);
    }

    /**
     * When subject satisfies the predicate, produce the result with the body.
     * @param predicate test of the subject
     * @param body result producing function
     * @param label label of the log entry, description of a {@link DescribedPredicate} or {@code "Case"} when null
     * @param errorHandler handler consulted first when predicate or body throws, may be null
     * @return this matcher
     */
    public FluentMatch<T, R> on(Predicate<? super T> predicate, Body<? extends R> body, String label,
            ClauseErrorHandler errorHandler) {
        return evaluate(predicate, body, true, labelOr(label, describe(predicate, CASE_LABEL)), errorHandler);
    }

    public FluentMatch<T, R> perform(Predicate<? super T> predicate, Action action) {
        return perform(predicate, action, null, null);
    }

    public FluentMatch<T, R> perform(Predicate<? super T> predicate, Action action, String label) {
        return perform(predicate, action, label, null);
    }

    /**
     * When subject satisfies the predicate, execute a side effect. The clause counts as a match, but doesn't change
     * the result.
     * @param predicate test of the subject
     * @param action side effect to execute
     * @param label label of the log entry, description of a {@link DescribedPredicate} or {@code "Case"} when null
     * @param errorHandler handler consulted first when predicate or action throws, may be null
     * @return this matcher
     */
    public FluentMatch<T, R> perform(Predicate<? super T> predicate, Action action, String label,
            ClauseErrorHandler errorHandler) {
        Objects.requireNonNull(action, "Action must be defined");
        return evaluate(predicate, () -> {
            action.run();
            return null;
        }, false, labelOr(label, describe(predicate, CASE_LABEL)), errorHandler);
    }

    public FluentMatch<T, R> onEquals(T value, Body<? extends R> body) {
        return onEquals(value, body, null, null);
    }

    public FluentMatch<T, R> onEquals(T value, Body<? extends R> body, String label) {
        return onEquals(value, body, label, null);
    }

    /**
     * When subject {@linkplain Objects#equals(Object, Object) equals} the value, produce the result with the body.
     * @param value value to compare with, may be null
     * @param body result producing function
     * @param label label of the log entry, {@code "Case"} when null
     * @param errorHandler handler consulted first when the body throws, may be null
     * @return this matcher
     */
    public FluentMatch<T, R> onEquals(T value, Body<? extends R> body, String label, ClauseErrorHandler errorHandler) {
        return on(equalTo(value), body, label, errorHandler);
    }

    public FluentMatch<T, R> performOnEquals(T value, Action action) {
        return performOnEquals(value, action, null, null);
    }

    public FluentMatch<T, R> performOnEquals(T value, Action action, String label) {
        return performOnEquals(value, action, label, null);
    }

    public FluentMatch<T, R> performOnEquals(T value, Action action, String label, ClauseErrorHandler errorHandler) {
        return perform(equalTo(value), action, label, errorHandler);
    }

    public <C> FluentMatch<T, R> onType(Class<C> type, TypedBody<? super C, ? extends R> body) {
        return onType(type, body, null, null);
    }

    public <C> FluentMatch<T, R> onType(Class<C> type, TypedBody<? super C, ? extends R> body, String label) {
        return onType(type, body, label, null);
    }

    /**
     * When subject is an instance of the class, produce the result with the body receiving the cast subject.
     * Null subject never matches.
     * @param type class of the subject
     * @param body result producing function
     * @param label label of the log entry, simple name of the class when null
     * @param errorHandler handler consulted first when the body throws, may be null
     * @param <C> the type to match
     * @return this matcher
     */
    public <C> FluentMatch<T, R> onType(Class<C> type, TypedBody<? super C, ? extends R> body, String label,
            ClauseErrorHandler errorHandler) {
        Objects.requireNonNull(type, "Case class cannot be null");
        Objects.requireNonNull(body, "Body must be defined");
        return evaluate(type::isInstance, () -> body.apply(type.cast(subject)), true,
                labelOr(label, type.getSimpleName()), errorHandler);
    }

    public <C> FluentMatch<T, R> performOnType(Class<C> type, TypedAction<? super C> action) {
        return performOnType(type, action, null, null);
    }

    public <C> FluentMatch<T, R> performOnType(Class<C> type, TypedAction<? super C> action, String label,
            ClauseErrorHandler errorHandler) {
        Objects.requireNonNull(type, "Case class cannot be null");
        Objects.requireNonNull(action, "Action must be defined");
        return evaluate(type::isInstance, () -> {
            action.accept(type.cast(subject));
            return null;
        }, false, labelOr(label, type.getSimpleName()), errorHandler);
    }

    // defaults

    public R otherwise(Body<? extends R> body) {
        return otherwise(body, null);
    }

    /**
     * Produce the result with the body if no clause matched so far. The body is not guarded by clause error handling,
     * unchecked exceptions propagate to the caller and checked ones are wrapped in {@link MatchException}.
     * @param body result producing function
     * @param label label of the log entry, {@code "Default"} when null
     * @return result of the default, or result of the matched clause
     */
    public R otherwise(Body<? extends R> body, String label) {
        Objects.requireNonNull(body, "Default body must be defined");
        if (matched) {
            return result;
        }
        String defaultLabel = labelOr(label, DEFAULT_LABEL);
        R value;
        try {
            value = body.get();
        } catch (Exception e) {
            throw asDefaultFailure(defaultLabel, e);
        }
        recordDefault(defaultLabel, value, true);
        return value;
    }

    public void otherwisePerform(Action action) {
        otherwisePerform(action, null);
    }

    public void otherwisePerform(Action action, String label) {
        Objects.requireNonNull(action, "Default action must be defined");
        if (matched) {
            return;
        }
        String defaultLabel = labelOr(label, DEFAULT_LABEL);
        try {
            action.run();
        } catch (Exception e) {
            throw asDefaultFailure(defaultLabel, e);
        }
        recordDefault(defaultLabel, null, false);
    }

    // asynchronous clauses

    public CompletionStage<FluentMatch<T, R>> onAsync(Predicate<? super T> predicate, AsyncBody<? extends R> body) {
        return onAsync(predicate, body, null, null);
    }

    public CompletionStage<FluentMatch<T, R>> onAsync(Predicate<? super T> predicate, AsyncBody<? extends R> body,
            String label) {
        return onAsync(predicate, body, label, null);
    }

    /**
     * Asynchronous counterpart of {@link #on(Predicate, Body, String, ClauseErrorHandler)}. Exceptional completion of
     * the body's stage is handled the same way as an exception thrown by a synchronous body.
     * @param predicate test of the subject
     * @param body function returning the stage of the result
     * @param label label of the log entry, description of a {@link DescribedPredicate} or {@code "CaseAsync"} when
     *              null
     * @param errorHandler handler consulted first when the clause fails, may be null
     * @return stage completing with this matcher when the clause is settled
     */
    public CompletionStage<FluentMatch<T, R>> onAsync(Predicate<? super T> predicate, AsyncBody<? extends R> body,
            String label, ClauseErrorHandler errorHandler) {
        return evaluateAsync(predicate, body, true, labelOr(label, describe(predicate, CASE_ASYNC_LABEL)),
                errorHandler);
    }

    public CompletionStage<FluentMatch<T, R>> performAsync(Predicate<? super T> predicate, AsyncAction action) {
        return performAsync(predicate, action, null, null);
    }

    public CompletionStage<FluentMatch<T, R>> performAsync(Predicate<? super T> predicate, AsyncAction action,
            String label, ClauseErrorHandler errorHandler) {
        Objects.requireNonNull(action, "Action must be defined");
        return evaluateAsync(predicate, () -> action.run().thenApply(ignored -> null), false,
                labelOr(label, describe(predicate, CASE_ASYNC_LABEL)), errorHandler);
    }

    public CompletionStage<FluentMatch<T, R>> onEqualsAsync(T value, AsyncBody<? extends R> body) {
        return onEqualsAsync(value, body, null, null);
    }

    public CompletionStage<FluentMatch<T, R>> onEqualsAsync(T value, AsyncBody<? extends R> body, String label,
            ClauseErrorHandler errorHandler) {
        return onAsync(equalTo(value), body, label, errorHandler);
    }

    public CompletionStage<FluentMatch<T, R>> performOnEqualsAsync(T value, AsyncAction action) {
        return performOnEqualsAsync(value, action, null, null);
    }

    public CompletionStage<FluentMatch<T, R>> performOnEqualsAsync(T value, AsyncAction action, String label,
            ClauseErrorHandler errorHandler) {
        return performAsync(equalTo(value), action, label, errorHandler);
    }

    public <C> CompletionStage<FluentMatch<T, R>> onTypeAsync(Class<C> type,
            AsyncTypedBody<? super C, ? extends R> body) {
        return onTypeAsync(type, body, null, null);
    }

    public <C> CompletionStage<FluentMatch<T, R>> onTypeAsync(Class<C> type,
            AsyncTypedBody<? super C, ? extends R> body, String label, ClauseErrorHandler errorHandler) {
        Objects.requireNonNull(type, "Case class cannot be null");
        Objects.requireNonNull(body, "Body must be defined");
        return evaluateAsync(type::isInstance, () -> body.apply(type.cast(subject)), true,
                labelOr(label, type.getSimpleName()), errorHandler);
    }

    public CompletionStage<R> otherwiseAsync(AsyncBody<? extends R> body) {
        return otherwiseAsync(body, null);
    }

    /**
     * Asynchronous counterpart of {@link #otherwise(Body, String)}.
     * @param body function returning the stage of the default result
     * @param label label of the log entry, {@code "DefaultAsync"} when null
     * @return stage of the default result, or of the matched result when a clause matched
     */
    public CompletionStage<R> otherwiseAsync(AsyncBody<? extends R> body, String label) {
        return defaultAsync(body, true, labelOr(label, DEFAULT_ASYNC_LABEL));
    }

    public CompletionStage<Void> otherwisePerformAsync(AsyncAction action) {
        return otherwisePerformAsync(action, null);
    }

    public CompletionStage<Void> otherwisePerformAsync(AsyncAction action, String label) {
        Objects.requireNonNull(action, "Default action must be defined");
        if (matched) {
            return CompletableFuture.completedFuture(null);
        }
        return defaultAsync(() -> action.run().thenApply(ignored -> null), false,
                labelOr(label, DEFAULT_ASYNC_LABEL)).thenApply(ignored -> null);
    }

    /**
     * Continue declaring clauses as a single asynchronous chain.
     * @return chain starting with this matcher
     */
    public AsyncMatch<T, R> async() {
        return AsyncMatch.from(this);
    }

    // state

    public T subject() {
        return subject;
    }

    /**
     * Result of the last result producing clause that matched, or of the default.
     * @return the result, null when nothing produced a result
     */
    public R result() {
        return result;
    }

    public Optional<R> resultIfPresent() {
        return Optional.ofNullable(result);
    }

    /**
     * Whether any clause matched. Unlike inspecting {@link #result()} this tells apart a clause that produced null
     * from no clause matching. Execution of the default does not count as a match.
     * @return true if a clause matched
     */
    public boolean hasMatched() {
        return matched;
    }

    /**
     * Results of all matched result producing clauses, and the default, in the order they were produced.
     * @return unmodifiable view of the results
     */
    public List<R> allResults() {
        return Collections.unmodifiableList(allResults);
    }

    /**
     * Log of all matched and failed clauses and the executed default.
     * @return unmodifiable view of the log
     */
    public List<MatchLogEntry> log() {
        return Collections.unmodifiableList(log);
    }

    public MatchConfiguration configuration() {
        return configuration;
    }

    // evaluation

    private boolean isShortCircuited() {
        return matched && configuration.isBreakOnMatch();
    }

    private FluentMatch<T, R> evaluate(Predicate<? super T> predicate, Body<? extends R> body, boolean producesResult,
            String label, ClauseErrorHandler errorHandler) {
        Objects.requireNonNull(predicate, "Predicate must be defined");
        Objects.requireNonNull(body, "Body must be defined");
        if (isShortCircuited()) {
            return this;
        }
        R value;
        try {
            if (!predicate.test(subject)) {
                return this;
            }
            value = body.get();
        } catch (Exception e) {
            handleClauseError(label, e, errorHandler);
            return this;
        }
        recordMatch(label, value, producesResult);
        return this;
    }

    private CompletionStage<FluentMatch<T, R>> evaluateAsync(Predicate<? super T> predicate,
            AsyncBody<? extends R> body, boolean producesResult, String label, ClauseErrorHandler errorHandler) {
        Objects.requireNonNull(predicate, "Predicate must be defined");
        Objects.requireNonNull(body, "Body must be defined");
        if (isShortCircuited()) {
            return CompletableFuture.completedFuture(this);
        }
        CompletableFuture<FluentMatch<T, R>> settled = new CompletableFuture<>();
        CompletionStage<? extends R> pending;
        try {
            if (!predicate.test(subject)) {
                return CompletableFuture.completedFuture(this);
            }
            pending = Objects.requireNonNull(body.get(), "Asynchronous body returned null instead of a stage");
        } catch (Exception e) {
            settleFailure(label, e, errorHandler, settled);
            return settled;
        }
        pending.whenComplete((value, failure) -> {
            if (failure == null) {
                recordMatch(label, value, producesResult);
                settled.complete(this);
            } else {
                Throwable cause = unwrapCompletionException(failure);
                if (cause instanceof Exception) {
                    settleFailure(label, (Exception) cause, errorHandler, settled);
                } else {
                    settled.completeExceptionally(cause);
                }
            }
        });
        return settled;
    }

    private void settleFailure(String label, Exception error, ClauseErrorHandler errorHandler,
            CompletableFuture<FluentMatch<T, R>> settled) {
        try {
            handleClauseError(label, error, errorHandler);
            settled.complete(this);
        } catch (Throwable t) {
            settled.completeExceptionally(t);
        }
    }

    private CompletionStage<R> defaultAsync(AsyncBody<? extends R> body, boolean producesResult, String label) {
        Objects.requireNonNull(body, "Default body must be defined");
        if (matched) {
            return CompletableFuture.completedFuture(result);
        }
        CompletionStage<? extends R> pending;
        try {
            pending = Objects.requireNonNull(body.get(), "Asynchronous default returned null instead of a stage");
        } catch (Exception e) {
            return throwing(asDefaultFailure(label, e));
        }
        CompletableFuture<R> settled = new CompletableFuture<>();
        pending.whenComplete((value, failure) -> {
            if (failure == null) {
                recordDefault(label, value, producesResult);
                settled.complete(value);
            } else {
                Throwable cause = unwrapCompletionException(failure);
                settled.completeExceptionally(cause instanceof Exception
                        ? asDefaultFailure(label, (Exception) cause) : cause);
            }
        });
        return settled;
    }

    private void handleClauseError(String label, Exception error, ClauseErrorHandler errorHandler) {
        appendLog(label, MatchLogEntry.Outcome.FAILED, null, error);
        boolean handled = errorHandler != null && errorHandler.handle(error, subject);
        if (!handled) {
            Optional<ClauseErrorHandler> globalHandler = configuration.globalErrorHandler();
            handled = globalHandler.isPresent() && globalHandler.get().handle(error, subject);
        }
        if (handled) {
            logger.info("Clause {} failed on {}, the error was handled", label, subject);
        } else if (configuration.unhandledErrorPolicy() == UnhandledErrorPolicy.RETHROW) {
            throw MatchException.unhandledClauseError(label, subject, error);
        } else {
            logger.warn("Clause {} failed on {}, suppressing unhandled error", label, subject, error);
        }
    }

    private void recordMatch(String label, R value, boolean producesResult) {
        matched = true;
        if (producesResult) {
            result = value;
            allResults.add(value);
        }
        appendLog(label, MatchLogEntry.Outcome.MATCHED, producesResult ? value : null, null);
        logger.debug("Clause {} matched {}", label, subject);
    }

    private void recordDefault(String label, R value, boolean producesResult) {
        if (producesResult) {
            result = value;
            allResults.add(value);
        }
        appendLog(label, MatchLogEntry.Outcome.DEFAULTED, producesResult ? value : null, null);
        logger.debug("No clause matched {}, applied {}", subject, label);
    }

    private void appendLog(String label, MatchLogEntry.Outcome outcome, R value, Exception error) {
        log.add(ImmutableMatchLogEntry.builder()
                .index(log.size())
                .timestamp(configuration.clock().instant())
                .label(label)
                .outcome(outcome)
                .subject(Optional.<Object>ofNullable(subject))
                .result(Optional.<Object>ofNullable(value))
                .error(Optional.ofNullable(error))
                .build());
    }

    private RuntimeException asDefaultFailure(String label, Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return MatchException.defaultFailed(label, subject, e);
    }

    private static <V> Predicate<V> equalTo(V value) {
        return candidate -> Objects.equals(candidate, value);
    }

    private static String labelOr(String label, String fallback) {
        return label != null ? label : fallback;
    }

    private static String describe(Predicate<?> predicate, String fallback) {
        return predicate instanceof DescribedPredicate ? ((DescribedPredicate<?>) predicate).description() : fallback;
    }

    private static <U> CompletionStage<U> throwing(Throwable t) {
        CompletableFuture<U> result = new CompletableFuture<>();
        result.completeExceptionally(t);
        return result;
    }

    static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    /**
     * Result producing body of a clause.
     * @param <R> type of result
     */
    @FunctionalInterface
    public interface Body<R> {
        R get() throws Exception;
    }

    /**
     * Side effecting body of a clause.
     */
    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }

    @FunctionalInterface
    public interface TypedBody<C, R> {
        R apply(C subject) throws Exception;
    }

    @FunctionalInterface
    public interface TypedAction<C> {
        void accept(C subject) throws Exception;
    }

    @FunctionalInterface
    public interface AsyncBody<R> {
        CompletionStage<? extends R> get() throws Exception;
    }

    @FunctionalInterface
    public interface AsyncAction {
        CompletionStage<?> run() throws Exception;
    }

    @FunctionalInterface
    public interface AsyncTypedBody<C, R> {
        CompletionStage<? extends R> apply(C subject) throws Exception;
    }
}
