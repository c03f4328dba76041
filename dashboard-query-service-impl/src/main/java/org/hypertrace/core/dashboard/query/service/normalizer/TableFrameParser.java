package org.hypertrace.core.dashboard.query.service.normalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.hypertrace.core.dashboard.query.api.Field;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.NormalizedResult;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.api.TableResult;
import org.hypertrace.core.dashboard.query.api.TableResult.Column;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps the first frame's fields one to one onto table columns, keeping row order. */
public class TableFrameParser extends AbstractFrameParser {
  private static final Logger LOG = LoggerFactory.getLogger(TableFrameParser.class);

  @Override
  protected Logger getLogger() {
    return LOG;
  }

  @Override
  public Set<String> getPanelTypes() {
    return Set.of("table", "table-old");
  }

  @Override
  public NormalizedResult parse(
      String refId, PanelInfo panelInfo, List<Frame> frames, ResolutionContext context) {
    Frame frame = firstFrame(refId, panelInfo, frames);
    int fieldCount = usableFieldCount(refId, panelInfo, frame, context);
    int rowCount = usableRowCount(refId, panelInfo, frame, fieldCount, context);

    List<Column> columns = new ArrayList<>(fieldCount);
    for (Field field : frame.getFields().subList(0, fieldCount)) {
      columns.add(Column.of(field.getName(), field.getType()));
    }
    List<List<String>> rows = new ArrayList<>(rowCount);
    for (int row = 0; row < rowCount; row++) {
      List<String> cells = new ArrayList<>(fieldCount);
      for (int column = 0; column < fieldCount; column++) {
        cells.add(FrameValues.stringify(cell(frame, column, row)));
      }
      rows.add(List.copyOf(cells));
    }
    return new TableResult(refId, panelInfo, List.copyOf(columns), List.copyOf(rows));
  }

  @Override
  public NormalizedResult emptyResult(String refId, PanelInfo panelInfo) {
    return new TableResult(refId, panelInfo, List.of(), List.of());
  }
}
