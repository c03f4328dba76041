package org.hypertrace.core.dashboard.query.service.normalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.hypertrace.core.dashboard.query.api.Field;
import org.hypertrace.core.dashboard.query.api.FieldType;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.LogListResult;
import org.hypertrace.core.dashboard.query.api.LogListResult.LogEntry;
import org.hypertrace.core.dashboard.query.api.NormalizedResult;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Every row of every frame becomes one log entry. The timestamp comes from the first time field,
 * the message and level from the conventionally named fields, and everything else, including the
 * entries of a label map field, goes into the attributes.
 */
public class LogListFrameParser extends AbstractFrameParser {
  private static final Logger LOG = LoggerFactory.getLogger(LogListFrameParser.class);

  private static final Set<String> MESSAGE_FIELDS = Set.of("line", "message", "msg", "body", "log");
  private static final Set<String> LEVEL_FIELDS =
      Set.of("level", "severity", "detected_level", "loglevel");
  private static final String LABELS_FIELD = "labels";

  @Override
  protected Logger getLogger() {
    return LOG;
  }

  @Override
  public Set<String> getPanelTypes() {
    return Set.of("logs");
  }

  @Override
  public NormalizedResult parse(
      String refId, PanelInfo panelInfo, List<Frame> frames, ResolutionContext context) {
    List<LogEntry> entries = new ArrayList<>();
    for (Frame frame : frames) {
      int fieldCount = usableFieldCount(refId, panelInfo, frame, context);
      int rowCount = usableRowCount(refId, panelInfo, frame, fieldCount, context);
      List<Field> fields = frame.getFields().subList(0, fieldCount);
      int timeIndex = firstTimeField(fields);
      for (int row = 0; row < rowCount; row++) {
        entries.add(toEntry(frame, fields, timeIndex, row));
      }
    }
    return new LogListResult(refId, panelInfo, List.copyOf(entries));
  }

  @Override
  public NormalizedResult emptyResult(String refId, PanelInfo panelInfo) {
    return new LogListResult(refId, panelInfo, List.of());
  }

  private static LogEntry toEntry(Frame frame, List<Field> fields, int timeIndex, int row) {
    LogEntry.LogEntryBuilder entry = LogEntry.builder();
    boolean messageSet = false;
    boolean levelSet = false;
    for (int column = 0; column < fields.size(); column++) {
      String name = fields.get(column).getName();
      String key = name.toLowerCase(Locale.ROOT);
      Object value = cell(frame, column, row);
      if (column == timeIndex) {
        entry.timestamp(formatTimestamp(value));
      } else if (!messageSet && MESSAGE_FIELDS.contains(key)) {
        entry.message(FrameValues.stringify(value));
        messageSet = true;
      } else if (!levelSet && LEVEL_FIELDS.contains(key)) {
        entry.level(FrameValues.stringify(value));
        levelSet = true;
      } else if (LABELS_FIELD.equals(key) && value instanceof Map) {
        for (Map.Entry<?, ?> label : ((Map<?, ?>) value).entrySet()) {
          String labelKey = String.valueOf(label.getKey());
          String labelValue = FrameValues.stringify(label.getValue());
          if (!levelSet && LEVEL_FIELDS.contains(labelKey.toLowerCase(Locale.ROOT))) {
            entry.level(labelValue);
            levelSet = true;
          }
          entry.attribute(labelKey, labelValue);
        }
      } else {
        entry.attribute(name, FrameValues.stringify(value));
      }
    }
    return entry.build();
  }

  private static int firstTimeField(List<Field> fields) {
    for (int index = 0; index < fields.size(); index++) {
      if (fields.get(index).getType() == FieldType.TIME) {
        return index;
      }
    }
    return -1;
  }

  private static String formatTimestamp(Object value) {
    Optional<Long> epochMillis = FrameValues.toEpochMillis(value);
    return epochMillis.map(millis -> Instant.ofEpochMilli(millis).toString()).orElse("");
  }
}
