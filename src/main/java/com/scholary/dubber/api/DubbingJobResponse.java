package com.scholary.dubber.api;

/** Response for an accepted dubbing request; the job id is used to poll for status. */
public record DubbingJobResponse(String jobId) {}
