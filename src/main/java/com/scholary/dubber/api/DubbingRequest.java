package com.scholary.dubber.api;

import com.scholary.dubber.translation.LanguageNames;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * Request to dub a recording stored in the object store.
 *
 * <p>{@code backgroundKey} is optional; without it every language is exported voice-only. Language
 * codes must match {@link LanguageNames#CODE_PATTERN}.
 */
public record DubbingRequest(
    @NotBlank String bucket,
    @NotBlank String voiceKey,
    String backgroundKey,
    @NotBlank @Pattern(regexp = LanguageNames.CODE_PATTERN) String sourceLanguage,
    @NotEmpty List<@NotBlank @Pattern(regexp = LanguageNames.CODE_PATTERN) String>
        targetLanguages) {}
