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
 * What happens to a clause failure that neither the clause handler nor the global handler accepted.
 */
public enum UnhandledErrorPolicy {
    /**
     * Record the failure in the match log and continue with the next clause.
     */
    SUPPRESS,
    /**
     * Record the failure in the match log and throw {@link MatchException} with fault
     * {@link MatchException.Fault#UNHANDLED_CLAUSE_ERROR}.
     */
    RETHROW
}
