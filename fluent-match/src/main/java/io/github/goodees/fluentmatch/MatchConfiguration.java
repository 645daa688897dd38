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

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Construction-time policy of a {@link FluentMatch}. Instances are immutable, the {@code with...} methods return
 * modified copies.
 */
public class MatchConfiguration {
    private static final MatchConfiguration BREAK_ON_FIRST_MATCH = new MatchConfiguration(true, null);
    private static final MatchConfiguration COLLECT_ALL_MATCHES = new MatchConfiguration(false, null);

    private final boolean breakOnMatch;
    private final ClauseErrorHandler globalErrorHandler;
    private final UnhandledErrorPolicy unhandledErrorPolicy;
    private final Clock clock;

    /**
     * Create match configuration.
     * @param breakOnMatch if true, clauses declared after the first match are not evaluated
     * @param globalErrorHandler handler consulted for clause failures the clause itself did not handle, may be null
     * @param unhandledErrorPolicy what to do with failures no handler accepted
     * @param clock clock used to timestamp match log entries
     */
    public MatchConfiguration(boolean breakOnMatch, ClauseErrorHandler globalErrorHandler,
                              UnhandledErrorPolicy unhandledErrorPolicy, Clock clock) {
        this.breakOnMatch = breakOnMatch;
        this.globalErrorHandler = globalErrorHandler;
        this.unhandledErrorPolicy = Objects.requireNonNull(unhandledErrorPolicy, "Unhandled error policy must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    /**
     * Create match configuration that suppresses unhandled clause errors and timestamps log in UTC.
     * @param breakOnMatch if true, clauses declared after the first match are not evaluated
     * @param globalErrorHandler handler consulted for clause failures the clause itself did not handle, may be null
     */
    public MatchConfiguration(boolean breakOnMatch, ClauseErrorHandler globalErrorHandler) {
        this(breakOnMatch, globalErrorHandler, UnhandledErrorPolicy.SUPPRESS, Clock.systemUTC());
    }

    /**
     * Configuration where only the first satisfied clause produces a result. This is the default.
     * @return a configuration
     */
    public static MatchConfiguration breakOnFirstMatch() {
        return BREAK_ON_FIRST_MATCH;
    }

    /**
     * Configuration where every satisfied clause contributes to {@link FluentMatch#allResults()}.
     * @return a configuration
     */
    public static MatchConfiguration collectAllMatches() {
        return COLLECT_ALL_MATCHES;
    }

    public boolean isBreakOnMatch() {
        return breakOnMatch;
    }

    public Optional<ClauseErrorHandler> globalErrorHandler() {
        return Optional.ofNullable(globalErrorHandler);
    }

    public UnhandledErrorPolicy unhandledErrorPolicy() {
        return unhandledErrorPolicy;
    }

    public Clock clock() {
        return clock;
    }

    public MatchConfiguration withGlobalErrorHandler(ClauseErrorHandler handler) {
        return new MatchConfiguration(breakOnMatch, handler, unhandledErrorPolicy, clock);
    }

    public MatchConfiguration withUnhandledErrorPolicy(UnhandledErrorPolicy policy) {
        return new MatchConfiguration(breakOnMatch, globalErrorHandler, policy, clock);
    }

    public MatchConfiguration withClock(Clock clock) {
        return new MatchConfiguration(breakOnMatch, globalErrorHandler, unhandledErrorPolicy, clock);
    }

    @Override
    public String toString() {
        return "MatchConfiguration{" + "breakOnMatch=" + breakOnMatch + ", globalErrorHandler=" + globalErrorHandler
                + ", unhandledErrorPolicy=" + unhandledErrorPolicy + '}';
    }
}
