package com.scholary.followalong.document;

/** Thrown when a document holds no extractable text, typically a scan. */
public class UnsupportedDocumentException extends RuntimeException {

  public UnsupportedDocumentException(String message) {
    super(message);
  }
}
