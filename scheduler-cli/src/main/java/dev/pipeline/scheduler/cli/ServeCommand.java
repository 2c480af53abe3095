package dev.pipeline.scheduler.cli;

import dev.pipeline.scheduler.PipelineScheduler;
import dev.pipeline.scheduler.executor.ProcessJobExecutor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(
    name = "serve",
    description = "Run the scheduler loop until interrupted",
    mixinStandardHelpOptions = true)
public class ServeCommand implements Callable<Integer> {

  private static final Logger logger = LoggerFactory.getLogger(ServeCommand.class);

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-l", "--log-dir"},
      description = "Directory for job output files",
      defaultValue = "logs")
  Path logDir;

  @Option(
      names = {"-j", "--max-jobs"},
      description = "Maximum number of jobs running at once",
      defaultValue = "4")
  int maxJobs;

  @Option(
      names = {"-i", "--poll-interval"},
      description = "Seconds between scheduler ticks",
      defaultValue = "30")
  int pollIntervalSeconds;

  @Option(
      names = {"--no-migrate"},
      description = "Do not create or upgrade the scheduler tables on start")
  boolean noMigrate;

  @Override
  public Integer call() throws Exception {
    var config =
        dbOptions
            .config()
            .withAppName("pipesched")
            .withMigrate(!noMigrate)
            .withSchedulerEnabled(true)
            .withPollInterval(Duration.ofSeconds(pollIntervalSeconds));

    var stopped = new CountDownLatch(1);
    var scheduler = new PipelineScheduler(config, new ProcessJobExecutor(logDir, maxJobs));
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  logger.info("Shutting down scheduler");
                  scheduler.close();
                  stopped.countDown();
                }));
    scheduler.launch();
    stopped.await();
    return 0;
  }
}
