package com.scholary.followalong.engine;

/**
 * A piece of recognized text as emitted by the engine.
 *
 * @param text the recognized text, untrimmed
 * @param startMs start offset in milliseconds, chapter-relative
 * @param endMs end offset in milliseconds, chapter-relative
 */
public record TimedFragment(String text, long startMs, long endMs) {}
