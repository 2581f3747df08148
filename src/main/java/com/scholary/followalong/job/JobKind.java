package com.scholary.followalong.job;

/** What a job produces. The subject id is a book id or a document id accordingly. */
public enum JobKind {
  /** Transcribe every chapter of a book into the transcript cache. */
  TRANSCRIPTION,
  /** Extract a document, transcribe its book and align the two. */
  ALIGNMENT
}
