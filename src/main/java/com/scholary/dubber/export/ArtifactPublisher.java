package com.scholary.dubber.export;

import com.scholary.dubber.PipelineStage;
import com.scholary.dubber.objectstore.ObjectStoreClient;
import com.scholary.dubber.objectstore.ObjectStoreException;
import com.scholary.dubber.objectstore.ObjectStoreProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Uploads exported files to the object store under {@code <prefix>/<jobId>/<language>/<file>}.
 */
@Component
public class ArtifactPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactPublisher.class);

  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties properties;

  public ArtifactPublisher(ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
  }

  public boolean isEnabled() {
    return properties.publishEnabled();
  }

  /**
   * Upload every file of an export.
   *
   * @return the object keys written, in {@link ExportResult#files()} order
   * @throws ExportException if a file cannot be read or uploaded
   */
  public List<String> publish(String jobId, String language, ExportResult export) {
    List<String> keys = new ArrayList<>();
    for (Path file : export.files()) {
      String key = keyFor(jobId, language, file.getFileName().toString());
      try (InputStream data = Files.newInputStream(file)) {
        objectStoreClient.putObject(
            properties.bucket(), key, data, Files.size(file), contentType(file));
      } catch (IOException | ObjectStoreException e) {
        throw new ExportException(PipelineStage.PUBLISH, "Deliverables could not be published", e);
      }
      keys.add(key);
    }
    LOGGER.info("Published {} files for job {} language {}", keys.size(), jobId, language);
    return keys;
  }

  String keyFor(String jobId, String language, String fileName) {
    String prefix = properties.publishPrefix();
    String base = prefix == null || prefix.isBlank() ? "" : prefix.replaceAll("/+$", "") + "/";
    return base + jobId + "/" + language + "/" + fileName;
  }

  static String contentType(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".wav")) {
      return "audio/wav";
    } else if (name.endsWith(".m4a")) {
      return "audio/mp4";
    } else if (name.endsWith(".mp3")) {
      return "audio/mpeg";
    } else if (name.endsWith(".srt")) {
      return "application/x-subrip";
    } else if (name.endsWith(".json")) {
      return "application/json";
    } else if (name.endsWith(".zip")) {
      return "application/zip";
    }
    return "application/octet-stream";
  }
}
