package com.scholary.dubber.pipeline;

import com.scholary.dubber.PipelineStage;

/**
 * Why a target language could not be completed.
 *
 * @param stage stage that failed
 * @param message user-facing description, free of paths and credentials
 */
public record PipelineFailure(PipelineStage stage, String message) {}
