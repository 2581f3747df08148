package com.scholary.followalong.api;

import com.scholary.followalong.transcript.TimedSentence;
import java.util.List;

/** Cached transcript of a book on the global timeline. */
public record TranscriptDataResponse(long bookId, List<TimedSentence> sentences) {}
