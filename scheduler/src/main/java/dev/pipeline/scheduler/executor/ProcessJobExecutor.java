package dev.pipeline.scheduler.executor;

import dev.pipeline.scheduler.exceptions.ConcurrencyLimitReachedException;
import dev.pipeline.scheduler.json.JSONUtil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each job as a local operating-system process. The command is split on whitespace; {@code
 * --target} and {@code --vars} are appended from the launch parameters. Output and errors of a job
 * go to {@code <logDir>/<handle>.log}.
 *
 * <p>Only running jobs hold a process. Once a job exits its final status is kept in a bounded,
 * oldest-first evicted table; the handle of an evicted job reads as unknown.
 */
public class ProcessJobExecutor implements JobExecutor {

  static final int DEFAULT_FINISHED_JOBS_KEPT = 1024;

  private static final Logger logger = LoggerFactory.getLogger(ProcessJobExecutor.class);

  private final Path logDir;
  private final int maxConcurrentJobs;
  private final Clock clock;
  private final Map<String, Job> jobs = new ConcurrentHashMap<>();
  private final Map<String, JobStatus> finished;
  private final AtomicInteger live = new AtomicInteger();

  private static class Job {
    final Process process;
    final Instant startedAt;
    final AtomicBoolean retired = new AtomicBoolean();
    volatile Instant finishedAt;
    volatile boolean cancelled;

    Job(Process process, Instant startedAt) {
      this.process = process;
      this.startedAt = startedAt;
    }
  }

  ProcessJobExecutor(Path logDir, int maxConcurrentJobs, Clock clock, int finishedJobsKept) {
    if (maxConcurrentJobs < 1) {
      throw new IllegalArgumentException("maxConcurrentJobs must be at least 1");
    }
    this.logDir = logDir;
    this.maxConcurrentJobs = maxConcurrentJobs;
    this.clock = clock;
    this.finished =
        Collections.synchronizedMap(
            new LinkedHashMap<String, JobStatus>() {
              @Override
              protected boolean removeEldestEntry(Map.Entry<String, JobStatus> eldest) {
                return size() > finishedJobsKept;
              }
            });
  }

  public ProcessJobExecutor(Path logDir, int maxConcurrentJobs, Clock clock) {
    this(logDir, maxConcurrentJobs, clock, DEFAULT_FINISHED_JOBS_KEPT);
  }

  public ProcessJobExecutor(Path logDir, int maxConcurrentJobs) {
    this(logDir, maxConcurrentJobs, Clock.systemUTC());
  }

  @Override
  public synchronized String startJob(String command, LaunchParameters parameters) {
    if (live.get() >= maxConcurrentJobs) {
      throw new ConcurrencyLimitReachedException(maxConcurrentJobs);
    }

    var handle = UUID.randomUUID().toString();
    var args = commandLine(command, parameters);
    try {
      Files.createDirectories(logDir);
      var logFile = logDir.resolve(handle + ".log").toFile();
      var process =
          new ProcessBuilder(args)
              .redirectErrorStream(true)
              .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile))
              .start();
      var job = new Job(process, clock.instant());
      jobs.put(handle, job);
      live.incrementAndGet();
      process
          .onExit()
          .thenRun(
              () -> {
                job.finishedAt = clock.instant();
                retire(handle, job);
              });
      logger.info("Started job {} (pid {}): {}", handle, process.pid(), args);
      return handle;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to start job: " + command, e);
    }
  }

  static List<String> commandLine(String command, LaunchParameters parameters) {
    List<String> args = new ArrayList<>(List.of(command.trim().split("\\s+")));
    if (parameters.targetName() != null && !parameters.targetName().isEmpty()) {
      args.add("--target");
      args.add(parameters.targetName());
    }
    if (!parameters.variables().isEmpty()) {
      args.add("--vars");
      args.add(JSONUtil.toJson(parameters.variables()));
    }
    return args;
  }

  @Override
  public JobStatus getJobStatus(String jobHandle) {
    var job = jobs.get(jobHandle);
    if (job == null) {
      var done = finished.get(jobHandle);
      if (done != null) {
        return done;
      }
      return JobStatus.failed(null, clock.instant(), "Unknown job handle " + jobHandle);
    }
    if (job.process.isAlive()) {
      return JobStatus.running(job.startedAt);
    }
    return retire(jobHandle, job);
  }

  /** Number of jobs whose process has not been seen to exit */
  int liveJobs() {
    return live.get();
  }

  /** Number of jobs still holding a process */
  int trackedJobs() {
    return jobs.size();
  }

  // Called from the exit callback and from status polls; only the first call releases the slot.
  private JobStatus retire(String jobHandle, Job job) {
    var status = exitStatus(jobHandle, job);
    if (job.retired.compareAndSet(false, true)) {
      finished.put(jobHandle, status);
      jobs.remove(jobHandle, job);
      live.decrementAndGet();
      logger.debug("Job {} finished: {}", jobHandle, status.status());
      return status;
    }
    var kept = finished.get(jobHandle);
    return kept != null ? kept : status;
  }

  private JobStatus exitStatus(String jobHandle, Job job) {
    var finishedAt = job.finishedAt == null ? clock.instant() : job.finishedAt;
    if (job.cancelled) {
      return JobStatus.cancelled(job.startedAt, finishedAt);
    }
    int exitCode = job.process.exitValue();
    if (exitCode == 0) {
      return JobStatus.succeeded(job.startedAt, finishedAt);
    }
    return JobStatus.failed(
        job.startedAt,
        finishedAt,
        "Process exited with code %d, see %s"
            .formatted(exitCode, logDir.resolve(jobHandle + ".log")));
  }

  @Override
  public boolean cancelJob(String jobHandle) {
    var job = jobs.get(jobHandle);
    if (job == null || !job.process.isAlive()) {
      return false;
    }
    job.cancelled = true;
    job.process.destroy();
    logger.info("Cancelled job {}", jobHandle);
    return true;
  }
}
