package com.scholary.dubber.config;

import com.scholary.dubber.mixing.MixSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the dubbing pipeline.
 *
 * <p>Maps to the "dubbing.*" keys in application.yml. Components that only need a single value
 * read it through {@code @Value}; binding the whole tree here validates it at startup.
 */
@ConfigurationProperties(prefix = "dubbing")
@Validated
public record DubbingProperties(
    @NotBlank String tempDir,
    @NotBlank String outputDir,
    @Valid @NotNull Concurrency concurrency,
    @Valid @NotNull Segmentation segmentation,
    @Valid @NotNull DurationMatching duration,
    @Valid @NotNull Chunking chunking,
    @Valid @NotNull Speakers speakers,
    @Valid @NotNull MixSettings mixing) {

  /** Worker pool sizes. Jobs and languages use separate pools so a job never waits on itself. */
  public record Concurrency(
      @Positive int maxConcurrentJobs,
      @Positive int maxConcurrentLanguages,
      @Positive int queueCapacity) {}

  public record Segmentation(
      @Positive double silenceGapThreshold, @Positive double minSpeechDuration) {}

  public record DurationMatching(
      @Positive double tolerance, @DecimalMin("1.0") double maxSpeedFactor) {}

  public record Chunking(@Positive int maxChunkLength) {}

  public record Speakers(@Positive double minSampleDuration) {}
}
