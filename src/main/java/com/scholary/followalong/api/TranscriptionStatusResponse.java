package com.scholary.followalong.api;

/**
 * Transcription state of a book.
 *
 * @param job the latest transcription job, null if none was ever started
 */
public record TranscriptionStatusResponse(
    JobResponse job, int chapterCount, int transcribedCount, boolean hasTranscription) {}
