package com.scholary.dubber.api;

import com.scholary.dubber.job.DubbingJob;
import com.scholary.dubber.job.DubbingJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for multilingual dubbing.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a dubbing job from object store keys (returns job ID immediately)
 *   <li>Job status polling, with per-language progress and results
 * </ul>
 */
@RestController
@RequestMapping("/api/dubbing")
@Tag(name = "Dubbing", description = "Multilingual audio dubbing API")
public class DubbingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingController.class);

  private final DubbingJobService jobService;

  public DubbingController(DubbingJobService jobService) {
    this.jobService = jobService;
  }

  /** Start an asynchronous dubbing job. */
  @PostMapping
  @Operation(
      summary = "Start dubbing",
      description =
          "Dub a recording stored in the object store into one or more target languages. "
              + "Returns a job ID for status polling.")
  public ResponseEntity<DubbingJobResponse> dub(@Valid @RequestBody DubbingRequest request) {
    LOGGER.info(
        "Dubbing request: bucket={}, voiceKey={}, source={}, targets={}",
        request.bucket(),
        request.voiceKey(),
        request.sourceLanguage(),
        request.targetLanguages());
    try {
      DubbingJob job = jobService.submit(request);
      return ResponseEntity.accepted().body(new DubbingJobResponse(job.getJobId()));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Dubbing request rejected, job queue is full");
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }
  }

  /**
   * Get job status.
   *
   * <p>Results are included per language as soon as the job has finished.
   */
  @GetMapping("/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of a dubbing job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String jobId) {
    return jobService
        .find(jobId)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getProgress(),
                        job.getLanguageProgress(),
                        job.getResults(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}
