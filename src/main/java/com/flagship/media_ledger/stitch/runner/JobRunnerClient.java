package com.flagship.media_ledger.stitch.runner;

/**
 * External service that executes stitch jobs.
 */
public interface JobRunnerClient {

    /**
     * @return the runner's execution id
     * @throws JobRunnerException if the runner did not accept the job
     */
    String submit(StitchJobSpec spec);

    /**
     * @throws JobRunnerException if the status could not be read; callers treat this as unknown
     */
    RunnerStatus getStatus(String executionId);
}
