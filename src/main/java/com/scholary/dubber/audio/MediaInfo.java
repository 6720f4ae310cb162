package com.scholary.dubber.audio;

/**
 * Result of probing a media file.
 *
 * @param durationSeconds container duration
 * @param hasAudio whether at least one audio stream is present
 * @param hasVideo whether at least one video stream is present
 * @param sampleRate sample rate of the first audio stream, 0 when there is none
 * @param channels channel count of the first audio stream, 0 when there is none
 * @param codec codec of the first audio stream, null when there is none
 * @param formatName container format reported by the prober
 */
public record MediaInfo(
    double durationSeconds,
    boolean hasAudio,
    boolean hasVideo,
    int sampleRate,
    int channels,
    String codec,
    String formatName) {}
