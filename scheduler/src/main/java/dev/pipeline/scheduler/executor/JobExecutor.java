package dev.pipeline.scheduler.executor;

import dev.pipeline.scheduler.exceptions.ConcurrencyLimitReachedException;

/** Runs job commands somewhere outside the scheduler and reports on them. */
public interface JobExecutor {

  /**
   * Starts {@code command} and returns a handle identifying the job.
   *
   * @throws ConcurrencyLimitReachedException if no execution slot is free
   */
  String startJob(String command, LaunchParameters parameters);

  JobStatus getJobStatus(String jobHandle);

  /**
   * Asks the executor to stop a job. The resulting terminal status is reported by later calls to
   * {@link #getJobStatus}.
   *
   * @return false if the job is unknown or already finished
   */
  boolean cancelJob(String jobHandle);
}
