package com.scholary.followalong.alignment;

import com.scholary.followalong.transcript.BookTranscript;
import com.scholary.followalong.transcript.TimedSentence;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup of transcript sentences by their first three normalized words.
 *
 * <p>Sentences of synthetic chapters are left out: their placeholder text can never match a
 * document.
 */
final class TranscriptIndex {

  static final int KEY_WORDS = 3;

  private final List<TimedSentence> sentences;
  private final String[] normalized;
  private final Map<String, List<Integer>> byKey = new HashMap<>();

  private TranscriptIndex(List<TimedSentence> sentences) {
    this.sentences = sentences;
    this.normalized = new String[sentences.size()];
  }

  static TranscriptIndex build(BookTranscript transcript, TextNormalizer normalizer) {
    TranscriptIndex index = new TranscriptIndex(transcript.sentences());
    for (int i = 0; i < index.sentences.size(); i++) {
      TimedSentence sentence = index.sentences.get(i);
      if (transcript.isSyntheticChapter(sentence.chapterIndex())) {
        continue;
      }
      String text = normalizer.normalize(sentence.text());
      index.normalized[i] = text;
      String key = normalizer.leadingWords(text, KEY_WORDS);
      if (!key.isEmpty()) {
        index.byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
      }
    }
    return index;
  }

  List<Integer> candidates(String key) {
    return byKey.getOrDefault(key, List.of());
  }

  String normalizedText(int i) {
    return normalized[i];
  }

  TimedSentence sentence(int i) {
    return sentences.get(i);
  }

  int size() {
    return sentences.size();
  }

  int keyCount() {
    return byKey.size();
  }
}
