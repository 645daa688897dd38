/**
 * Fluent pattern matching. Provides a matcher object that evaluates clauses against a single subject as they are
 * declared, keeps a diagnostic log of what matched or failed, and isolates failures of individual clauses.
 *
 * <h2>Clauses</h2>
 * <p>A clause is a condition and a body. {@link io.github.goodees.fluentmatch.FluentMatch} offers conditions based on
 * a predicate ({@code on}), equality to a value ({@code onEquals}) and runtime type ({@code onType}). Result producing
 * bodies set the result of the match, side effecting bodies ({@code perform...}) only count as a match. A default
 * ({@code otherwise}) is executed only when no clause matched.
 * <p>Matching is a linear scan. There is no exhaustiveness checking and no compilation of the clauses, the cost of a
 * match is the cost of the clauses evaluated before the matching one.
 *
 * <h2>Short circuit and collecting matches</h2>
 * <p>By default the first satisfied clause wins and every later clause is a no-op. A matcher created with
 * {@link io.github.goodees.fluentmatch.MatchConfiguration#collectAllMatches()} evaluates all clauses and collects
 * every result, which is what {@link io.github.goodees.fluentmatch.Matching#matchEach(java.lang.Iterable, java.util.function.Consumer)}
 * uses for matching collections.
 *
 * <h2>Failures</h2>
 * <p>A clause that throws never aborts the chain on its own. The exception is offered to the handler of the clause,
 * then to the global handler of the matcher. Unhandled exceptions are suppressed unless the matcher is configured with
 * {@link io.github.goodees.fluentmatch.UnhandledErrorPolicy#RETHROW}. Callers that keep the default should inspect
 * {@link io.github.goodees.fluentmatch.FluentMatch#log()} for
 * {@linkplain io.github.goodees.fluentmatch.MatchLogEntry.Outcome#FAILED failed} entries.
 *
 * <h2>Asynchronous clauses</h2>
 * <p>Asynchronous clauses return {@link java.util.concurrent.CompletionStage}. The matcher itself never runs two
 * clauses at once, it is up to the caller to compose on each stage before declaring the next clause, or to use
 * {@link io.github.goodees.fluentmatch.async.AsyncMatch} which does that.
 */
package io.github.goodees.fluentmatch;
