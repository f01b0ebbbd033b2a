package com.scholary.subtitle.api;

/** Response for an accepted job: the id to poll /api/jobs/{id} with. */
public record AsyncJobResponse(String jobId) {}
