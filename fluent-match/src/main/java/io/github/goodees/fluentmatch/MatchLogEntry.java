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

import java.time.Instant;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Record of a single clause evaluation. Entries are only created for clauses that matched or failed, and for an
 * executed default; a clause whose predicate did not hold leaves no trace.
 */
@Value.Immutable
public interface MatchLogEntry {

    enum Outcome {
        MATCHED, DEFAULTED, FAILED
    }

    /**
     * Position of this entry in the match log.
     * @return zero-based index
     */
    int index();

    Instant timestamp();

    /**
     * Explicit clause label, simple class name for type clauses, or a generic tag.
     * @return the label
     */
    String label();

    Outcome outcome();

    /**
     * The subject the clause was evaluated against. Empty when the subject was null.
     * @return the subject
     */
    Optional<Object> subject();

    /**
     * Value produced by the clause. Empty for side effecting clauses, failures, and clauses that produced null.
     * @return the result
     */
    Optional<Object> result();

    Optional<Exception> error();

    default boolean isFailure() {
        return outcome() == Outcome.FAILED;
    }

    @Value.Check
    default void check() {
        if (index() < 0) {
            throw new IllegalStateException("Log entry index cannot be negative: " + index());
        }
        if (result().isPresent() && error().isPresent()) {
            throw new IllegalStateException("Log entry " + label() + " cannot carry both result and error");
        }
        if (isFailure() != error().isPresent()) {
            throw new IllegalStateException("Log entry " + label() + " must carry an error exactly when it failed");
        }
    }
}
