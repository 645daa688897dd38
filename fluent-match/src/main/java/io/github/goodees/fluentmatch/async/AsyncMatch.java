package io.github.goodees.fluentmatch.async;

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

import io.github.goodees.fluentmatch.ClauseErrorHandler;
import io.github.goodees.fluentmatch.FluentMatch;
import io.github.goodees.fluentmatch.MatchConfiguration;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Asynchronous chain of clauses over a single {@link FluentMatch}. Every clause is composed on the completion of the
 * previous one, therefore synchronous and asynchronous clauses can be mixed freely and are still evaluated one at a
 * time in declaration order.
 *
 * <pre>{@code
 * CompletionStage<Boolean> startsWithH = AsyncMatch.of("Hello", Boolean.class)
 *         .onAsync(s -> s.startsWith("H"), () -> CompletableFuture.supplyAsync(() -> true), "StartsWith H")
 *         .otherwiseAsync(() -> CompletableFuture.completedFuture(false));
 * }</pre>
 *
 * <p>The chain adds no timeouts and does not cancel running bodies. When a stage fails, because a handler rethrew or
 * {@linkplain io.github.goodees.fluentmatch.UnhandledErrorPolicy#RETHROW rethrow policy} is in place, the remaining
 * clauses are skipped and the terminal stage completes exceptionally.</p>
 *
 * @param <T> type of the subject
 * @param <R> type of the result
 */
public class AsyncMatch<T, R> {
    private final CompletionStage<FluentMatch<T, R>> stage;

    private AsyncMatch(CompletionStage<FluentMatch<T, R>> stage) {
        this.stage = stage;
    }

    /**
     * Continue with an existing matcher.
     * @param matcher the matcher
     * @param <T> type of subject
     * @param <R> type of result
     * @return new chain
     */
    public static <T, R> AsyncMatch<T, R> from(FluentMatch<T, R> matcher) {
        Objects.requireNonNull(matcher, "Matcher must be defined");
        return new AsyncMatch<>(CompletableFuture.completedFuture(matcher));
    }

    /**
     * Continue after a stage producing a matcher, e. g. the result of {@link FluentMatch#onAsync(Predicate, FluentMatch.AsyncBody)}.
     * @param stage stage of the matcher
     * @param <T> type of subject
     * @param <R> type of result
     * @return new chain
     */
    public static <T, R> AsyncMatch<T, R> after(CompletionStage<FluentMatch<T, R>> stage) {
        return new AsyncMatch<>(Objects.requireNonNull(stage, "Stage must be defined"));
    }

    public static <T, R> AsyncMatch<T, R> of(T subject) {
        return from(new FluentMatch<>(subject));
    }

    public static <T, R> AsyncMatch<T, R> of(T subject, Class<R> resultType) {
        return from(FluentMatch.of(subject, resultType));
    }

    public static <T, R> AsyncMatch<T, R> of(T subject, MatchConfiguration configuration) {
        return from(new FluentMatch<>(subject, configuration));
    }

    /**
     * Create a matcher and let an asynchronous function declare its clauses.
     * @param subject value to match
     * @param configuration configuration of the matcher
     * @param configurer function declaring the clauses and returning the stage of configured matcher
     * @param <T> type of subject
     * @param <R> type of result
     * @return stage of the configured matcher
     */
    public static <T, R> CompletionStage<FluentMatch<T, R>> configure(T subject, MatchConfiguration configuration,
            Function<FluentMatch<T, R>, ? extends CompletionStage<FluentMatch<T, R>>> configurer) {
        Objects.requireNonNull(configurer, "Configuring function must be defined");
        return configurer.apply(new FluentMatch<>(subject, configuration));
    }

    public AsyncMatch<T, R> on(Predicate<? super T> predicate, FluentMatch.Body<? extends R> body) {
        return on(predicate, body, null, null);
    }

    public AsyncMatch<T, R> on(Predicate<? super T> predicate, FluentMatch.Body<? extends R> body, String label) {
        return on(predicate, body, label, null);
    }

    public AsyncMatch<T, R> on(Predicate<? super T> predicate, FluentMatch.Body<? extends R> body, String label,
            ClauseErrorHandler errorHandler) {
        return next(stage.thenApply(m -> m.on(predicate, body, label, errorHandler)));
    }

    public AsyncMatch<T, R> perform(Predicate<? super T> predicate, FluentMatch.Action action) {
        return perform(predicate, action, null, null);
    }

    public AsyncMatch<T, R> perform(Predicate<? super T> predicate, FluentMatch.Action action, String label,
            ClauseErrorHandler errorHandler) {
        return next(stage.thenApply(m -> m.perform(predicate, action, label, errorHandler)));
    }

    public AsyncMatch<T, R> onEquals(T value, FluentMatch.Body<? extends R> body) {
        return onEquals(value, body, null, null);
    }

    public AsyncMatch<T, R> onEquals(T value, FluentMatch.Body<? extends R> body, String label,
            ClauseErrorHandler errorHandler) {
        return next(stage.thenApply(m -> m.onEquals(value, body, label, errorHandler)));
    }

    public AsyncMatch<T, R> performOnEquals(T value, FluentMatch.Action action) {
        return performOnEquals(value, action, null, null);
    }

    public AsyncMatch<T, R> performOnEquals(T value, FluentMatch.Action action, String label,
            ClauseErrorHandler errorHandler) {
        return next(stage.thenApply(m -> m.performOnEquals(value, action, label, errorHandler)));
    }

    public <C> AsyncMatch<T, R> onType(Class<C> type, FluentMatch.TypedBody<? super C, ? extends R> body) {
        return onType(type, body, null, null);
    }

    public <C> AsyncMatch<T, R> onType(Class<C> type, FluentMatch.TypedBody<? super C, ? extends R> body,
            String label, ClauseErrorHandler errorHandler) {
        return next(stage.thenApply(m -> m.onType(type, body, label, errorHandler)));
    }

    public <C> AsyncMatch<T, R> performOnType(Class<C> type, FluentMatch.TypedAction<? super C> action) {
        return performOnType(type, action, null, null);
    }

    public <C> AsyncMatch<T, R> performOnType(Class<C> type, FluentMatch.TypedAction<? super C> action, String label,
            ClauseErrorHandler errorHandler) {
        return next(stage.thenApply(m -> m.performOnType(type, action, label, errorHandler)));
    }

    public AsyncMatch<T, R> onAsync(Predicate<? super T> predicate, FluentMatch.AsyncBody<? extends R> body) {
        return onAsync(predicate, body, null, null);
    }

    public AsyncMatch<T, R> onAsync(Predicate<? super T> predicate, FluentMatch.AsyncBody<? extends R> body,
            String label) {
        return onAsync(predicate, body, label, null);
    }

    public AsyncMatch<T, R> onAsync(Predicate<? super T> predicate, FluentMatch.AsyncBody<? extends R> body,
            String label, ClauseErrorHandler errorHandler) {
        return next(stage.thenCompose(m -> m.onAsync(predicate, body, label, errorHandler)));
    }

    public AsyncMatch<T, R> performAsync(Predicate<? super T> predicate, FluentMatch.AsyncAction action) {
        return performAsync(predicate, action, null, null);
    }

    public AsyncMatch<T, R> performAsync(Predicate<? super T> predicate, FluentMatch.AsyncAction action,
            String label, ClauseErrorHandler errorHandler) {
        return next(stage.thenCompose(m -> m.performAsync(predicate, action, label, errorHandler)));
    }

    public AsyncMatch<T, R> onEqualsAsync(T value, FluentMatch.AsyncBody<? extends R> body) {
        return onEqualsAsync(value, body, null, null);
    }

    public AsyncMatch<T, R> onEqualsAsync(T value, FluentMatch.AsyncBody<? extends R> body, String label,
            ClauseErrorHandler errorHandler) {
        return next(stage.thenCompose(m -> m.onEqualsAsync(value, body, label, errorHandler)));
    }

    public AsyncMatch<T, R> performOnEqualsAsync(T value, FluentMatch.AsyncAction action) {
        return performOnEqualsAsync(value, action, null, null);
    }

    public AsyncMatch<T, R> performOnEqualsAsync(T value, FluentMatch.AsyncAction action, String label,
            ClauseErrorHandler errorHandler) {
        return next(stage.thenCompose(m -> m.performOnEqualsAsync(value, action, label, errorHandler)));
    }

    public <C> AsyncMatch<T, R> onTypeAsync(Class<C> type, FluentMatch.AsyncTypedBody<? super C, ? extends R> body) {
        return onTypeAsync(type, body, null, null);
    }

    public <C> AsyncMatch<T, R> onTypeAsync(Class<C> type, FluentMatch.AsyncTypedBody<? super C, ? extends R> body,
            String label, ClauseErrorHandler errorHandler) {
        return next(stage.thenCompose(m -> m.onTypeAsync(type, body, label, errorHandler)));
    }

    public CompletionStage<R> otherwise(FluentMatch.Body<? extends R> body) {
        return otherwise(body, null);
    }

    public CompletionStage<R> otherwise(FluentMatch.Body<? extends R> body, String label) {
        return stage.thenApply(m -> m.otherwise(body, label));
    }

    public CompletionStage<R> otherwiseAsync(FluentMatch.AsyncBody<? extends R> body) {
        return otherwiseAsync(body, null);
    }

    /**
     * Terminate the chain with an asynchronous default.
     * @param body function returning the stage of the default result
     * @param label label of the log entry, {@code "DefaultAsync"} when null
     * @return stage of the result
     * @see FluentMatch#otherwiseAsync(FluentMatch.AsyncBody, String)
     */
    public CompletionStage<R> otherwiseAsync(FluentMatch.AsyncBody<? extends R> body, String label) {
        return stage.thenCompose(m -> m.otherwiseAsync(body, label));
    }

    public CompletionStage<Void> otherwisePerform(FluentMatch.Action action) {
        return otherwisePerform(action, null);
    }

    public CompletionStage<Void> otherwisePerform(FluentMatch.Action action, String label) {
        return stage.thenAccept(m -> m.otherwisePerform(action, label));
    }

    public CompletionStage<Void> otherwisePerformAsync(FluentMatch.AsyncAction action) {
        return otherwisePerformAsync(action, null);
    }

    public CompletionStage<Void> otherwisePerformAsync(FluentMatch.AsyncAction action, String label) {
        return stage.thenCompose(m -> m.otherwisePerformAsync(action, label));
    }

    /**
     * Terminate the chain without a default.
     * @return stage of the result, completing with null when nothing matched
     */
    public CompletionStage<R> result() {
        return stage.thenApply(FluentMatch::result);
    }

    public CompletionStage<FluentMatch<T, R>> toCompletionStage() {
        return stage;
    }

    private AsyncMatch<T, R> next(CompletionStage<FluentMatch<T, R>> nextStage) {
        return new AsyncMatch<>(nextStage);
    }
}
