package org.hypertrace.core.dashboard.query.service.variable;

import org.hypertrace.core.dashboard.query.service.variable.VariablePlaceholders.Substitution;

/**
 * Rewrites equality matchers that received a multi-value substitution into the backend's one-of
 * form. Equality against a joined set of values does not test membership, so every backend supplies
 * the rewrite for its own query language.
 */
@FunctionalInterface
public interface MultiValueMatcherRewriter {

  String rewrite(Substitution substitution);
}
