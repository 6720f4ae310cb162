package com.scholary.dubber.voice;

/**
 * A stock synthetic voice.
 *
 * @param voiceName provider voice identifier
 * @param pitchHz nominal fundamental frequency of the voice
 * @param gender perceived gender, informational only
 */
public record VoiceCatalogEntry(String voiceName, double pitchHz, Gender gender) {}
