package com.scholary.dubber.voice;

/**
 * Pitch estimate for one diarized speaker.
 *
 * @param speakerId diarization label
 * @param estimatedPitchHz mean fundamental frequency, 0.0 when it could not be estimated
 */
public record SpeakerProfile(String speakerId, double estimatedPitchHz) {}
