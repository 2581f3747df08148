package com.scholary.followalong.alignment;

import com.scholary.followalong.alignment.AlignmentResult.Position;
import org.springframework.stereotype.Component;

/**
 * Estimates where a sentence sits on its page.
 *
 * <p>Sentences are spread evenly down the printable area inside one-inch margins, first sentence at
 * the top. This is a layout guess, not a measurement.
 */
@Component
public class PositionEstimator {

  static final double MARGIN = 72;
  static final double LINE_HEIGHT = 14;

  public Position estimate(int index, int total, double pageWidth, double pageHeight) {
    double usableHeight = pageHeight - 2 * MARGIN;
    double fraction = total <= 0 ? 0 : (double) index / total;
    double y = Math.round(pageHeight - (MARGIN + fraction * usableHeight));
    return new Position(MARGIN, y, pageWidth - 2 * MARGIN, LINE_HEIGHT);
  }
}
