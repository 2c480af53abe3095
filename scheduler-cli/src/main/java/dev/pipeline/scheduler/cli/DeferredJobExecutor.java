package dev.pipeline.scheduler.cli;

import dev.pipeline.scheduler.exceptions.ConcurrencyLimitReachedException;
import dev.pipeline.scheduler.executor.JobExecutor;
import dev.pipeline.scheduler.executor.JobStatus;
import dev.pipeline.scheduler.executor.LaunchParameters;

/**
 * Executor used by one-shot CLI commands. It never starts a job, so runs created from the command
 * line stay pending until a {@code serve} process launches them with its own executor.
 */
class DeferredJobExecutor implements JobExecutor {

  @Override
  public String startJob(String command, LaunchParameters parameters) {
    throw new ConcurrencyLimitReachedException(0);
  }

  @Override
  public JobStatus getJobStatus(String jobHandle) {
    throw new IllegalStateException("Job status is only known to the serving scheduler");
  }

  @Override
  public boolean cancelJob(String jobHandle) {
    return false;
  }
}
