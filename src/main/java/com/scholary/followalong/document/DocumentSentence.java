package com.scholary.followalong.document;

/**
 * A sentence extracted from one page of a document.
 *
 * @param pageNumber one-based page number
 * @param indexInPage zero-based position on the page
 */
public record DocumentSentence(int pageNumber, int indexInPage, String text) {

  /** Stable identifier, e.g. {@code p3s1} for the first sentence on page 3. */
  public String id() {
    return "p" + pageNumber + "s" + (indexInPage + 1);
  }
}
