package com.scholary.dubber.synthesis;

/**
 * One synthesized chunk of a segment's text.
 *
 * @param text the text that was spoken
 * @param durationSeconds measured duration of the chunk's audio
 */
public record SpeechChunk(String text, double durationSeconds) {}
