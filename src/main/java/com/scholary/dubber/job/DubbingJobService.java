package com.scholary.dubber.job;

import com.scholary.dubber.api.DubbingRequest;
import com.scholary.dubber.api.JobStatusResponse.Status;
import com.scholary.dubber.api.LanguageResultResponse;
import com.scholary.dubber.config.AsyncConfig;
import com.scholary.dubber.export.ArtifactPublisher;
import com.scholary.dubber.export.ExportException;
import com.scholary.dubber.logging.StructuredLogger;
import com.scholary.dubber.objectstore.ObjectStoreClient;
import com.scholary.dubber.objectstore.ObjectStoreException;
import com.scholary.dubber.pipeline.DubbingPipeline;
import com.scholary.dubber.pipeline.PipelineException;
import com.scholary.dubber.pipeline.PipelineResult;
import com.scholary.dubber.pipeline.ProgressEvent;
import com.scholary.dubber.pipeline.WorkingDirectory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs dubbing jobs submitted through the API.
 *
 * <p>A job downloads its inputs from the object store into a scratch directory, runs the dubbing
 * pipeline, and optionally publishes each language's deliverables back to the store. The job
 * completes when at least one language succeeded; it fails when a shared stage failed or every
 * language did.
 */
@Service
public class DubbingJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingJobService.class);

  private final ObjectStoreClient objectStoreClient;
  private final DubbingPipeline pipeline;
  private final ArtifactPublisher publisher;
  private final JobRepository jobRepository;
  private final Executor jobExecutor;
  private final Path tempRoot;

  public DubbingJobService(
      ObjectStoreClient objectStoreClient,
      DubbingPipeline pipeline,
      ArtifactPublisher publisher,
      JobRepository jobRepository,
      @Qualifier(AsyncConfig.JOB_EXECUTOR) Executor jobExecutor,
      @Value("${dubbing.tempDir}") String tempDir) {
    this.objectStoreClient = objectStoreClient;
    this.pipeline = pipeline;
    this.publisher = publisher;
    this.jobRepository = jobRepository;
    this.jobExecutor = jobExecutor;
    this.tempRoot = Paths.get(tempDir);
  }

  /**
   * Create a job and queue it.
   *
   * @throws RejectedExecutionException if the job queue is full; the job is not kept
   */
  public DubbingJob submit(DubbingRequest request) {
    DubbingJob job = new DubbingJob(UUID.randomUUID().toString(), request);
    jobRepository.save(job);
    try {
      jobExecutor.execute(() -> process(job));
    } catch (RejectedExecutionException e) {
      jobRepository.delete(job.getJobId());
      throw e;
    }
    LOGGER.info(
        "Queued dubbing job {}: bucket={}, voiceKey={}, targets={}",
        job.getJobId(),
        request.bucket(),
        request.voiceKey(),
        request.targetLanguages());
    return job;
  }

  public Optional<DubbingJob> find(String jobId) {
    return jobRepository.findById(jobId);
  }

  /** Run a job to completion on the calling thread. Never throws. */
  void process(DubbingJob job) {
    String jobId = job.getJobId();
    DubbingRequest request = job.getRequest();
    StructuredLogger.setJobContext(jobId);
    job.setStatus(Status.PROCESSING);
    LOGGER.info("Starting dubbing job {}", jobId);

    try (WorkingDirectory inputs = WorkingDirectory.create(tempRoot, "inputs-" + jobId)) {
      Path voice = download(request.bucket(), request.voiceKey(), inputs, "voice");
      Path background =
          request.backgroundKey() == null || request.backgroundKey().isBlank()
              ? null
              : download(request.bucket(), request.backgroundKey(), inputs, "background");

      Map<String, PipelineResult> results =
          pipeline.runPipeline(
              jobId,
              voice,
              background,
              request.sourceLanguage(),
              request.targetLanguages(),
              event -> onProgress(job, event));

      boolean anySucceeded = false;
      for (PipelineResult result : results.values()) {
        job.putResult(toResponse(jobId, result));
        anySucceeded |= result.isSuccess();
      }

      if (anySucceeded) {
        job.complete();
        LOGGER.info("Dubbing job {} completed", jobId);
      } else {
        job.fail("All target languages failed");
        LOGGER.warn("Dubbing job {} failed: no language succeeded", jobId);
      }

    } catch (PipelineException e) {
      LOGGER.error("Dubbing job {} failed at {}", jobId, e.getStage(), e);
      job.fail(e.getStage() + ": " + e.getMessage());
    } catch (ObjectStoreException e) {
      LOGGER.error("Inputs of job {} could not be downloaded", jobId, e);
      job.fail("Input could not be downloaded from the object store");
    } catch (IOException e) {
      LOGGER.error("Scratch space for job {} could not be created", jobId, e);
      job.fail("Working directory could not be created");
    } catch (RuntimeException e) {
      LOGGER.error("Dubbing job {} failed unexpectedly", jobId, e);
      job.fail("Unexpected processing error");
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private Path download(String bucket, String key, WorkingDirectory inputs, String role)
      throws IOException {
    Path target = inputs.resolve(role + extensionOf(key));
    try (InputStream stream = objectStoreClient.getObjectStream(bucket, key)) {
      long bytes = Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
      LOGGER.info("Downloaded {} input: key={}, size={} KB", role, key, bytes / 1024);
    }
    return target;
  }

  private static String extensionOf(String key) {
    int slash = key.lastIndexOf('/');
    int dot = key.lastIndexOf('.');
    return dot > slash && dot < key.length() - 1 ? key.substring(dot) : "";
  }

  private static void onProgress(DubbingJob job, ProgressEvent event) {
    if (event.language() == null) {
      job.updateSharedProgress(event.percent());
    } else {
      job.updateLanguageProgress(event.language(), event.percent());
    }
  }

  private LanguageResultResponse toResponse(String jobId, PipelineResult result) {
    if (!result.isSuccess()) {
      return new LanguageResultResponse(
          result.languageCode(),
          false,
          null,
          null,
          null,
          null,
          null,
          false,
          result.failedSegments(),
          List.of(),
          result.failure().stage().name(),
          result.failure().message());
    }

    List<String> keys = List.of();
    String error = null;
    String failedStage = null;
    if (publisher.isEnabled()) {
      try {
        keys = publisher.publish(jobId, result.languageCode(), result.export());
      } catch (ExportException e) {
        LOGGER.error("Publishing failed for language {}", result.languageCode(), e);
        failedStage = e.getStage().name();
        error = e.getMessage();
      }
    }

    return new LanguageResultResponse(
        result.languageCode(),
        true,
        fileName(result.finalAudioPath()),
        fileName(result.voiceOnlyPath()),
        fileName(result.captionsPath()),
        fileName(result.bundlePath()),
        result.translatedText(),
        result.mixedWithBackground(),
        result.failedSegments(),
        keys,
        failedStage,
        error);
  }

  private static String fileName(Path path) {
    return path == null ? null : path.getFileName().toString();
  }
}
