package com.scholary.dubber.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg and ffprobe invocations.
 *
 * <p>Every intermediate file is written in the canonical layout ({@code sampleRate} Hz, {@code
 * channels} channels, 16-bit PCM WAV), so concatenation and mixing never see mixed formats.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int sampleRate,
    @Positive int channels,
    @Positive int probeTimeoutSeconds,
    @Positive int extractTimeoutSeconds,
    @Positive int processTimeoutSeconds,
    @NotBlank String exportFormat,
    @NotBlank String exportBitrate) {}
