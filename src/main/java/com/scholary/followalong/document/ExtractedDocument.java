package com.scholary.followalong.document;

import java.util.List;

/**
 * Result of text extraction.
 *
 * @param hasText false for image-only documents, which carry no pages
 */
public record ExtractedDocument(int pageCount, boolean hasText, List<DocumentPage> pages) {

  public ExtractedDocument {
    pages = List.copyOf(pages);
  }

  public List<DocumentSentence> sentences() {
    return pages.stream().flatMap(page -> page.sentences().stream()).toList();
  }

  public int sentenceCount() {
    return pages.stream().mapToInt(page -> page.sentences().size()).sum();
  }
}
