package com.scholary.dubber;

/** Stages of a dubbing run, used for progress reporting and failure attribution. */
public enum PipelineStage {
  PROBE,
  EXTRACTION,
  TRANSCRIPTION,
  SEGMENTATION,
  VOICE_ASSIGNMENT,
  TRANSLATION,
  SYNTHESIS,
  DURATION_MATCHING,
  RECONSTRUCTION,
  MIXING,
  EXPORT,
  PUBLISH
}
