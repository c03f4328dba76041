package org.hypertrace.core.dashboard.query.service.variable;

import io.reactivex.rxjava3.core.Single;
import java.util.List;
import org.hypertrace.core.dashboard.query.api.VariableDefinition;

/** Runs a query variable's substituted definition query and returns its candidate values. */
@FunctionalInterface
public interface VariableQueryExecutor {

  Single<List<String>> execute(String substitutedQuery, VariableDefinition definition);
}
