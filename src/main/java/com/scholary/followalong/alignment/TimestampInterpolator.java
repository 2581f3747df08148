package com.scholary.followalong.alignment;

import com.scholary.followalong.alignment.AlignmentResult.AlignedSentence;
import com.scholary.followalong.alignment.AlignmentResult.AudioSpan;
import com.scholary.followalong.config.AlignmentProperties;
import com.scholary.followalong.transcript.BookTranscript;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Fills gaps between matched sentences on a page.
 *
 * <p>A run of unplaced sentences with a placed sentence on both sides shares the time between the
 * end of the earlier one and the start of the later one in equal parts. Runs at the start or end of
 * a page stay unplaced.
 */
@Component
public class TimestampInterpolator {

  private final double confidence;

  public TimestampInterpolator(AlignmentProperties properties) {
    this.confidence = properties.interpolatedConfidence();
  }

  public List<AlignedSentence> interpolate(List<AlignedSentence> page, BookTranscript transcript) {
    List<AlignedSentence> result = new ArrayList<>(page);
    int i = 0;
    while (i < result.size()) {
      if (result.get(i).audio() != null) {
        i++;
        continue;
      }
      int runStart = i;
      while (i < result.size() && result.get(i).audio() == null) {
        i++;
      }
      int runEnd = i;
      if (runStart == 0 || runEnd == result.size()) {
        continue;
      }

      double from = result.get(runStart - 1).audio().globalEnd();
      double to = Math.max(from, result.get(runEnd).audio().globalStart());
      int gap = runEnd - runStart;
      double step = (to - from) / gap;
      for (int k = 0; k < gap; k++) {
        double start = from + k * step;
        double end = from + (k + 1) * step;
        AudioSpan span = new AudioSpan(transcript.chapterAt(start), start, end, true);
        result.set(runStart + k, result.get(runStart + k).withAudio(span, confidence));
      }
    }
    return result;
  }
}
