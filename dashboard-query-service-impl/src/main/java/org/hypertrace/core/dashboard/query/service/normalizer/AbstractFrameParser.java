package org.hypertrace.core.dashboard.query.service.normalizer;

import java.util.List;
import org.hypertrace.core.dashboard.query.api.Diagnostic;
import org.hypertrace.core.dashboard.query.api.DiagnosticType;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.slf4j.Logger;

public abstract class AbstractFrameParser implements FrameParser {

  protected abstract Logger getLogger();

  /**
   * Number of leading fields backed by a data column. A frame declaring more fields than it has
   * columns, or the reverse, is truncated to the shorter of the two.
   */
  protected int usableFieldCount(
      String refId, PanelInfo panelInfo, Frame frame, ResolutionContext context) {
    int fieldCount = frame.getFields().size();
    int columnCount = frame.getColumns().size();
    if (fieldCount != columnCount) {
      reportShapeMismatch(
          refId,
          panelInfo,
          String.format(
              "frame declares %d fields but carries %d data columns, truncating to %d",
              fieldCount, columnCount, Math.min(fieldCount, columnCount)),
          context);
    }
    return Math.min(fieldCount, columnCount);
  }

  /** Length of the shortest of the first {@code fieldCount} columns. */
  protected int usableRowCount(
      String refId, PanelInfo panelInfo, Frame frame, int fieldCount, ResolutionContext context) {
    List<List<?>> columns = frame.getColumns().subList(0, fieldCount);
    int shortest = columns.stream().mapToInt(List::size).min().orElse(0);
    int longest = columns.stream().mapToInt(List::size).max().orElse(0);
    if (shortest != longest) {
      reportShapeMismatch(
          refId,
          panelInfo,
          String.format(
              "data columns have between %d and %d rows, truncating to %d",
              shortest, longest, shortest),
          context);
    }
    return shortest;
  }

  protected Frame firstFrame(String refId, PanelInfo panelInfo, List<Frame> frames) {
    if (frames.size() > 1) {
      getLogger()
          .warn(
              "Panel {} of type {} returned {} frames for refId {}, using only the first",
              panelInfo.getPanelId(),
              panelInfo.getPanelType(),
              frames.size(),
              refId);
    }
    return frames.get(0);
  }

  protected void reportShapeMismatch(
      String refId, PanelInfo panelInfo, String message, ResolutionContext context) {
    getLogger()
        .warn(
            "Unexpected frame shape for refId {} of panel {}: {}",
            refId,
            panelInfo.getPanelId(),
            message);
    context.addDiagnostic(
        Diagnostic.forRefId(DiagnosticType.SHAPE_MISMATCH, refId, panelInfo, message));
  }

  protected static Object cell(Frame frame, int column, int row) {
    return frame.getColumns().get(column).get(row);
  }
}
