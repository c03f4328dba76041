package org.hypertrace.core.dashboard.query.service.variable;

import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.hypertrace.core.dashboard.query.api.TimeRange;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;

/** Variables derived purely from the run's time window, bucket size and dashboard. */
public final class BuiltinVariables {
  public static final String INTERVAL = "__interval";
  public static final String INTERVAL_MS = "__interval_ms";
  public static final String RATE_INTERVAL = "__rate_interval";
  public static final String RANGE = "__range";
  public static final String RANGE_S = "__range_s";
  public static final String RANGE_MS = "__range_ms";
  public static final String FROM = "__from";
  public static final String TO = "__to";
  public static final String DASHBOARD = "__dashboard";

  public static final Set<String> NAMES =
      ImmutableSet.of(
          INTERVAL, INTERVAL_MS, RATE_INTERVAL, RANGE, RANGE_S, RANGE_MS, FROM, TO, DASHBOARD);

  private BuiltinVariables() {}

  public static Map<String, VariableValue> of(ResolutionContext context) {
    TimeRange timeRange = context.getTimeRange();
    long bucketSeconds = context.getBucketSeconds();
    long rangeSeconds = timeRange.getDurationSeconds();
    Map<String, VariableValue> builtins = new LinkedHashMap<>();
    put(builtins, INTERVAL, formatSeconds(bucketSeconds));
    put(builtins, INTERVAL_MS, String.valueOf(bucketSeconds * 1000));
    put(builtins, RATE_INTERVAL, formatSeconds(2 * bucketSeconds));
    put(builtins, RANGE, rangeSeconds + "s");
    put(builtins, RANGE_S, String.valueOf(rangeSeconds));
    put(builtins, RANGE_MS, String.valueOf(timeRange.getDuration().toMillis()));
    put(builtins, FROM, String.valueOf(timeRange.getFrom().toEpochMilli()));
    put(builtins, TO, String.valueOf(timeRange.getTo().toEpochMilli()));
    put(builtins, DASHBOARD, context.getDashboardId());
    return builtins;
  }

  /** Formats seconds in the largest whole unit, e.g. {@code 2m} or {@code 3h}. */
  public static String formatSeconds(long seconds) {
    if (seconds > 0 && seconds % 86400 == 0) {
      return seconds / 86400 + "d";
    }
    if (seconds > 0 && seconds % 3600 == 0) {
      return seconds / 3600 + "h";
    }
    if (seconds > 0 && seconds % 60 == 0) {
      return seconds / 60 + "m";
    }
    return seconds + "s";
  }

  private static void put(Map<String, VariableValue> builtins, String name, String value) {
    builtins.put(name, VariableValue.single(name, value));
  }
}
