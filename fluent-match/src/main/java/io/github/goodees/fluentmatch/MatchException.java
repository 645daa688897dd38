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

public class MatchException extends RuntimeException {
    private final Fault fault;
    private final Object subject;

    public enum Fault {
        UNMATCHED, UNHANDLED_CLAUSE_ERROR, DEFAULT_FAILED
    }

    protected MatchException(Fault type, Object subject, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
        this.subject = subject;
    }

    public Fault getFault() {
        return fault;
    }

    /**
     * The subject that was being matched when the exception occurred.
     * @return the subject, may be null
     */
    public Object getSubject() {
        return subject;
    }

    public static MatchException unmatched(Object subject) {
        return new MatchException(Fault.UNMATCHED, subject, "No match found for " + describe(subject), null);
    }

    public static MatchException unhandledClauseError(String label, Object subject, Exception cause) {
        return new MatchException(Fault.UNHANDLED_CLAUSE_ERROR, subject, "Clause " + label + " failed on "
                + describe(subject) + ". " + cause.getMessage(), cause);
    }

    public static MatchException defaultFailed(String label, Object subject, Exception cause) {
        return new MatchException(Fault.DEFAULT_FAILED, subject, label + " failed on " + describe(subject)
                + ". " + cause.getMessage(), cause);
    }

    private static String describe(Object subject) {
        return subject == null ? "null" : subject + " (of " + subject.getClass().getName() + ")";
    }
}
