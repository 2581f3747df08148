package com.scholary.followalong.library;

/**
 * One audio track of a book, as registered by the library scanner.
 *
 * @param orderIndex zero-based position within the book
 * @param durationSeconds known duration, or 0 when the scanner could not read it
 */
public record Chapter(long bookId, int orderIndex, String filePath, double durationSeconds) {}
