package com.scholary.followalong.document;

import java.util.List;

/** One page of an extracted document, with its size in PDF points. */
public record DocumentPage(
    int pageNumber, double width, double height, List<DocumentSentence> sentences) {

  public static final double LETTER_WIDTH = 612;
  public static final double LETTER_HEIGHT = 792;

  public DocumentPage {
    sentences = List.copyOf(sentences);
  }
}
