package com.scholary.dubber.pipeline;

import com.scholary.dubber.PipelineStage;

/**
 * Progress notification emitted by the pipeline.
 *
 * @param language target language, or null for stages shared by all languages
 * @param stage the stage that just completed
 * @param percent progress of the language (or of the shared part) in {@code [0, 100]}
 * @param message short human-readable description
 */
public record ProgressEvent(String language, PipelineStage stage, int percent, String message) {}
