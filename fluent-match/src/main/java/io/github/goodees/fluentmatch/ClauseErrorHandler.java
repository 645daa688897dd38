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

/**
 * Handler offered an exception thrown by the predicate or body of a clause.
 * @see FluentMatch for the order in which handlers are consulted
 */
@FunctionalInterface
public interface ClauseErrorHandler {
    /**
     * Inspect a clause failure.
     * @param error exception thrown by the clause
     * @param subject the subject the clause was evaluated against, may be null
     * @return true if the error is handled and should not be offered to further handlers
     */
    boolean handle(Exception error, Object subject);
}
