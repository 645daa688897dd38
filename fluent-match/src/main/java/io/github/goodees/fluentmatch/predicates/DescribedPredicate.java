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

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Predicate carrying a short description. A clause declared with such predicate and without explicit label uses the
 * description as the label of its log entry, e. g. {@code ">5"} for {@code greaterThan(5)}.
 *
 * @param <T> type of the tested value
 */
public interface DescribedPredicate<T> extends Predicate<T> {

    String description();

    /**
     * Attach description to a predicate.
     * @param description the description
     * @param test the predicate
     * @param <T> type of the tested value
     * @return predicate with the description
     */
    static <T> DescribedPredicate<T> of(String description, Predicate<? super T> test) {
        Objects.requireNonNull(description, "Description must be defined");
        Objects.requireNonNull(test, "Predicate must be defined");
        return new DescribedPredicate<T>() {
            @Override
            public boolean test(T t) {
                return test.test(t);
            }

            @Override
            public String description() {
                return description;
            }

            @Override
            public String toString() {
                return description;
            }
        };
    }
}
