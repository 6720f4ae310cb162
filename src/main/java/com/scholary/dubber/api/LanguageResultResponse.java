package com.scholary.dubber.api;

import java.util.List;

/**
 * Outcome of one target language as reported to API clients.
 *
 * <p>File names refer to the job's output directory; {@code publishedKeys} lists the object store
 * keys when publishing is enabled. On failure only {@code failedStage} and {@code error} are set.
 */
public record LanguageResultResponse(
    String language,
    boolean success,
    String finalAudio,
    String voiceOnly,
    String captions,
    String bundle,
    String translatedText,
    boolean mixedWithBackground,
    int failedSegments,
    List<String> publishedKeys,
    String failedStage,
    String error) {}
