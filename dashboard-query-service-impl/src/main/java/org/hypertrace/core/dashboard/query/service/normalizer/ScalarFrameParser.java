package org.hypertrace.core.dashboard.query.service.normalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.NormalizedResult;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.ScalarResult;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Collapses the first frame to a single row made of the first cell of every field. */
public class ScalarFrameParser extends AbstractFrameParser {
  private static final Logger LOG = LoggerFactory.getLogger(ScalarFrameParser.class);

  @Override
  protected Logger getLogger() {
    return LOG;
  }

  @Override
  public Set<String> getPanelTypes() {
    return Set.of("stat", "gauge", "bargauge", "singlestat");
  }

  @Override
  public NormalizedResult parse(
      String refId, PanelInfo panelInfo, List<Frame> frames, ResolutionContext context) {
    Frame frame = firstFrame(refId, panelInfo, frames);
    int fieldCount = usableFieldCount(refId, panelInfo, frame, context);
    List<ScalarResult.Entry> entries = new ArrayList<>(fieldCount);
    for (int column = 0; column < fieldCount; column++) {
      List<?> values = frame.getColumns().get(column);
      entries.add(
          ScalarResult.Entry.of(
              frame.getFields().get(column).getName(),
              values.isEmpty() ? "" : FrameValues.formatScalar(values.get(0))));
    }
    return new ScalarResult(refId, panelInfo, List.copyOf(entries));
  }

  @Override
  public NormalizedResult emptyResult(String refId, PanelInfo panelInfo) {
    return new ScalarResult(refId, panelInfo, List.of());
  }
}
