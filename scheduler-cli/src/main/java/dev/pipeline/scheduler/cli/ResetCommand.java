package dev.pipeline.scheduler.cli;

import dev.pipeline.scheduler.database.SystemDatabase;
import dev.pipeline.scheduler.migrations.MigrationManager;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(name = "reset", description = "Drop the scheduler schema and everything in it")
public class ResetCommand implements Callable<Integer> {

  @Option(
      names = {"-y", "--yes"},
      description = "Skip confirmation prompt")
  boolean skipConfirmation;

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    var config = dbOptions.config();

    if (!skipConfirmation) {
      String prompt =
          "This command drops schema %s, deleting every schedule, run and log entry. Are you sure you want to proceed? "
              .formatted(config.schema());
      if (!SchedulerCommand.confirm(prompt)) {
        out.println("Scheduler reset cancelled");
        return 0;
      }
    }

    try (var ds = SystemDatabase.createDataSource(config)) {
      MigrationManager.dropSchema(ds, config.schema());
    }
    out.format("Schema %s has been dropped%n", config.schema());
    return 0;
  }
}
