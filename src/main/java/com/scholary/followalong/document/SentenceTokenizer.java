package com.scholary.followalong.document;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Splits page text into sentences with the JDK sentence {@link BreakIterator}. */
@Component
public class SentenceTokenizer {

  /** Collapse line breaks and runs of whitespace into single spaces. */
  public String normalizeWhitespace(String text) {
    return text.replace("\r\n", " ").replace('\n', ' ').replaceAll("\\s+", " ").trim();
  }

  public List<String> tokenize(String text) {
    String normalized = normalizeWhitespace(text);
    List<String> sentences = new ArrayList<>();
    if (normalized.isEmpty()) {
      return sentences;
    }
    BreakIterator iterator = BreakIterator.getSentenceInstance(Locale.ENGLISH);
    iterator.setText(normalized);
    int start = iterator.first();
    for (int end = iterator.next(); end != BreakIterator.DONE; start = end, end = iterator.next()) {
      String sentence = normalized.substring(start, end).trim();
      if (!sentence.isEmpty()) {
        sentences.add(sentence);
      }
    }
    return sentences;
  }
}
