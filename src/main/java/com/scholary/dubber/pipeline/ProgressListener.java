package com.scholary.dubber.pipeline;

/**
 * Receives pipeline progress.
 *
 * <p>Languages run concurrently, so implementations are called from several threads and must be
 * thread-safe.
 */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = event -> {};

  void onProgress(ProgressEvent event);
}
