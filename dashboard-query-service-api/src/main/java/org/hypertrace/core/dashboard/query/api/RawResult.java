package org.hypertrace.core.dashboard.query.api;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The backend's answer for one refId. A result without a frame collection ({@link #isMissing()}) is
 * a different state from a result whose frame collection is present but empty.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RawResult {
  @Nullable List<Frame> frames;
  @Nullable String error;
  @Nullable Integer status;

  public static RawResult of(List<Frame> frames) {
    return new RawResult(List.copyOf(frames), null, null);
  }

  public static RawResult of(List<Frame> frames, @Nullable Integer status) {
    return new RawResult(List.copyOf(frames), null, status);
  }

  public static RawResult missing(@Nullable String error, @Nullable Integer status) {
    return new RawResult(null, error, status);
  }

  public static RawResult withError(
      @Nullable List<Frame> frames, String error, @Nullable Integer status) {
    return new RawResult(frames == null ? null : List.copyOf(frames), error, status);
  }

  public Optional<List<Frame>> getFramesOptional() {
    return Optional.ofNullable(frames);
  }

  public Optional<String> getErrorOptional() {
    return Optional.ofNullable(error).filter(message -> !message.isBlank());
  }

  public boolean isMissing() {
    return frames == null;
  }

  public boolean isEmpty() {
    return frames != null && frames.isEmpty();
  }
}
