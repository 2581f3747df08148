package com.scholary.followalong.transcript;

import com.scholary.followalong.engine.TimedFragment;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Joins engine fragments into sentences.
 *
 * <p>Fragments accumulate until one ends with terminal punctuation, optionally followed by a
 * closing quote or parenthesis. Whatever remains at the end of the stream becomes the last
 * sentence.
 */
@Component
public class SentenceSegmenter {

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?][\"'”’)]?$");

  public List<Sentence> segment(List<TimedFragment> fragments) {
    List<Sentence> sentences = new ArrayList<>();
    StringBuilder text = new StringBuilder();
    long startMs = 0;
    long endMs = 0;

    for (TimedFragment fragment : fragments) {
      String piece = fragment.text() == null ? "" : fragment.text().trim();
      if (piece.isEmpty()) {
        continue;
      }
      if (text.length() == 0) {
        startMs = fragment.startMs();
      } else {
        text.append(' ');
      }
      text.append(piece);
      endMs = Math.max(endMs, fragment.endMs());

      if (isSentenceEnd(piece)) {
        sentences.add(toSentence(text, startMs, endMs));
        text.setLength(0);
        endMs = 0;
      }
    }
    if (text.length() > 0) {
      sentences.add(toSentence(text, startMs, endMs));
    }
    return sentences;
  }

  public static boolean isSentenceEnd(String text) {
    return SENTENCE_END.matcher(text.trim()).find();
  }

  private static Sentence toSentence(StringBuilder text, long startMs, long endMs) {
    double start = Math.max(0, startMs) / 1000.0;
    double end = Math.max(start, endMs / 1000.0);
    return new Sentence(text.toString(), start, end);
  }
}
