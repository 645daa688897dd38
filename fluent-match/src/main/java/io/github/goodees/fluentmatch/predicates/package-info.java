/**
 * Stateless predicate factories for clause conditions.
 */
package io.github.goodees.fluentmatch.predicates;
