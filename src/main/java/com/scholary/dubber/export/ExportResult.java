package com.scholary.dubber.export;

import java.nio.file.Path;
import java.util.List;

/**
 * Files written for one dubbed language.
 *
 * @param finalAudio the final mix in the delivery format
 * @param voiceOnly the dubbed voice without background, same format
 * @param captions SRT captions
 * @param transcript transcript JSON
 * @param bundle zip archive holding all of the above
 */
public record ExportResult(
    Path finalAudio, Path voiceOnly, Path captions, Path transcript, Path bundle) {

  public List<Path> files() {
    return List.of(finalAudio, voiceOnly, captions, transcript, bundle);
  }
}
