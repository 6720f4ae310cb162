package com.scholary.dubber.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.dubber.api.DubbingRequest;
import com.scholary.dubber.api.JobStatusResponse.Status;
import com.scholary.dubber.api.LanguageResultResponse;
import java.util.List;
import org.junit.jupiter.api.Test;

class DubbingJobTest {

  private static DubbingJob job(String... languages) {
    return new DubbingJob(
        "job-1", new DubbingRequest("audio", "in/voice.wav", null, "es", List.of(languages)));
  }

  private static LanguageResultResponse result(String language) {
    return new LanguageResultResponse(
        language, true, null, null, null, null, "x", false, 0, List.of(), null, null);
  }

  @Test
  void newJob_shouldBePendingWithNoProgress() {
    DubbingJob job = job("en");

    assertThat(job.getStatus()).isEqualTo(Status.PENDING);
    assertThat(job.getProgress()).isZero();
    assertThat(job.getLanguageProgress()).isEmpty();
    assertThat(job.getResults()).isEmpty();
  }

  @Test
  void updateLanguageProgress_shouldAverageOverAllTargetLanguages() {
    DubbingJob job = job("en", "fr");
    job.updateSharedProgress(DubbingJob.SHARED_STAGES_PERCENT);

    job.updateLanguageProgress("en", 100);

    // 20 + 80 * (100 + 0) / 2 / 100
    assertThat(job.getProgress()).isEqualTo(60);
    assertThat(job.getLanguageProgress()).containsEntry("en", 100).doesNotContainKey("fr");

    job.updateLanguageProgress("fr", 50);

    assertThat(job.getProgress()).isEqualTo(80);
  }

  @Test
  void progress_shouldNeverMoveBackwards() {
    DubbingJob job = job("en");
    job.updateLanguageProgress("en", 70);
    int before = job.getProgress();

    job.updateLanguageProgress("en", 40);
    job.updateSharedProgress(5);

    assertThat(job.getProgress()).isEqualTo(before);
    assertThat(job.getLanguageProgress()).containsEntry("en", 70);
  }

  @Test
  void updateSharedProgress_shouldBeCappedAtSharedShare() {
    DubbingJob job = job("en");

    job.updateSharedProgress(100);

    assertThat(job.getProgress()).isEqualTo(DubbingJob.SHARED_STAGES_PERCENT);
  }

  @Test
  void complete_shouldReportFullProgress() {
    DubbingJob job = job("en");

    job.complete();

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getProgress()).isEqualTo(100);
  }

  @Test
  void fail_shouldKeepErrorMessage() {
    DubbingJob job = job("en");

    job.fail("TRANSCRIPTION: Transcription failed with status 401");

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).isEqualTo("TRANSCRIPTION: Transcription failed with status 401");
  }

  @Test
  void getResults_shouldFollowRequestOrder() {
    DubbingJob job = job("zh", "en", "fr");
    job.putResult(result("fr"));
    job.putResult(result("zh"));
    job.putResult(result("en"));

    assertThat(job.getResults().keySet()).containsExactly("zh", "en", "fr");
  }
}
