package com.scholary.followalong.common;

/**
 * Thrown when a book, document or job referenced by a caller does not exist.
 *
 * <p>Mapped to HTTP 404 by the API layer.
 */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }
}
