package com.scholary.followalong.library;

/**
 * An uploaded document attached to a book.
 *
 * @param pageCount number of pages, null until the document has been extracted once
 * @param scanned true once extraction found no usable text
 */
public record Document(long id, long bookId, String filePath, Integer pageCount, boolean scanned) {}
