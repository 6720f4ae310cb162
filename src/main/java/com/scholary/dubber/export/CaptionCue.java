package com.scholary.dubber.export;

/**
 * One subtitle entry.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param text text to display
 */
public record CaptionCue(double start, double end, String text) {}
