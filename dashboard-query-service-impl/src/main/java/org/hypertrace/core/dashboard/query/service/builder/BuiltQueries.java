package org.hypertrace.core.dashboard.query.service.builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.dashboard.query.api.Formula;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.Query;

/** Output of one build: backend-ready queries, formulas and what each refId was built from. */
@Value
@Builder
public class BuiltQueries {
  @Singular List<Query> queries;
  @Singular List<Formula> formulas;

  /** Every assigned refId, queries and formulas alike, in assignment order. */
  @Singular("ref") Map<String, PanelInfo> refMap;

  public boolean isEmpty() {
    return queries.isEmpty();
  }

  public Set<String> getHiddenRefIds() {
    return queries.stream()
        .filter(Query::isDisabled)
        .map(Query::getRefId)
        .collect(Collectors.toUnmodifiableSet());
  }

  /** The reference map restricted to data queries. */
  public Map<String, PanelInfo> getQueryRefMap() {
    Set<String> formulaRefIds =
        formulas.stream().map(Formula::getRefId).collect(Collectors.toUnmodifiableSet());
    return refMap.entrySet().stream()
        .filter(entry -> !formulaRefIds.contains(entry.getKey()))
        .collect(
            Collectors.toMap(
                Map.Entry::getKey,
                Map.Entry::getValue,
                (first, second) -> first,
                LinkedHashMap::new));
  }
}
