package com.scholary.followalong.alignment;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Makes document and transcript text comparable: lowercase, no punctuation, single spaces. */
@Component
public class TextNormalizer {

  private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
  private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");

  public String normalize(String text) {
    if (text == null) {
      return "";
    }
    String t = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    t = PUNCTUATION.matcher(t).replaceAll("");
    return MULTI_SPACE.matcher(t).replaceAll(" ").trim();
  }

  /** The first {@code words} words of already normalized text, joined by single spaces. */
  public String leadingWords(String normalized, int words) {
    if (normalized.isEmpty()) {
      return "";
    }
    String[] parts = normalized.split(" ");
    int count = Math.min(words, parts.length);
    return String.join(" ", Arrays.copyOf(parts, count));
  }
}
