package com.scholary.dubber.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scratch directory owned by one job or one language run, deleted with its contents on close.
 *
 * <p>Use with try-with-resources so the directory is removed on every exit path.
 */
public final class WorkingDirectory implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(WorkingDirectory.class);

  private final Path path;

  private WorkingDirectory(Path path) {
    this.path = path;
  }

  /**
   * Create a fresh directory under {@code parent}.
   *
   * @param prefix name prefix; a random suffix keeps concurrent runs apart
   */
  public static WorkingDirectory create(Path parent, String prefix) throws IOException {
    Files.createDirectories(parent);
    return new WorkingDirectory(Files.createTempDirectory(parent, prefix + "-"));
  }

  public Path path() {
    return path;
  }

  public Path resolve(String name) {
    return path.resolve(name);
  }

  @Override
  public void close() {
    if (!Files.exists(path)) {
      return;
    }
    List<Path> entries;
    try (Stream<Path> walk = Files.walk(path)) {
      entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    } catch (IOException e) {
      LOGGER.warn("Failed to list working directory {}: {}", path, e.getMessage());
      return;
    }
    for (Path entry : entries) {
      try {
        Files.deleteIfExists(entry);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete {}: {}", entry, e.getMessage());
      }
    }
  }
}
