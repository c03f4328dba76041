package org.hypertrace.core.dashboard.query.service.normalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.TimeSeriesResult.Label;

/** Labels every normalized time series starts with, identifying where it came from. */
public final class SeriesLabels {
  public static final String PANEL_ID = "panel_id";
  public static final String PANEL_TITLE = "panel_title";
  public static final String REF_ID = "ref_id";
  public static final String ORIGINAL_EXPR = "original_expr";
  public static final String SERIES_NAME = "series_name";

  public static final Set<String> BOOKKEEPING =
      Set.of(PANEL_ID, PANEL_TITLE, REF_ID, ORIGINAL_EXPR, SERIES_NAME);

  private SeriesLabels() {}

  public static List<Label> bookkeeping(String refId, PanelInfo panelInfo) {
    List<Label> labels = new ArrayList<>();
    labels.add(Label.of(PANEL_ID, panelInfo.getPanelId()));
    labels.add(Label.of(PANEL_TITLE, panelInfo.getPanelTitle()));
    labels.add(Label.of(REF_ID, refId));
    labels.add(Label.of(ORIGINAL_EXPR, panelInfo.getOriginalExpression()));
    return labels;
  }

  /** Appends a label unless the key is already taken, keeping keys unique within one series. */
  public static void append(List<Label> labels, String key, String value) {
    if (labels.stream().noneMatch(label -> label.getKey().equals(key))) {
      labels.add(Label.of(key, value));
    }
  }
}
