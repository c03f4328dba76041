package org.hypertrace.core.dashboard.query.service.normalizer;

import java.util.List;
import java.util.Set;
import org.hypertrace.core.dashboard.query.api.Frame;
import org.hypertrace.core.dashboard.query.api.NormalizedResult;
import org.hypertrace.core.dashboard.query.api.PanelInfo;
import org.hypertrace.core.dashboard.query.service.ResolutionContext;

/** Turns the frames returned for one refId into the result shape of a family of panel types. */
public interface FrameParser {

  /** Panel types, lower case, whose results this parser produces. */
  Set<String> getPanelTypes();

  /**
   * @param frames non-empty frame collection of one refId
   * @param context receives shape warnings found while parsing
   */
  NormalizedResult parse(
      String refId, PanelInfo panelInfo, List<Frame> frames, ResolutionContext context);

  NormalizedResult emptyResult(String refId, PanelInfo panelInfo);
}
