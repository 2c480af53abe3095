package dev.pipeline.scheduler.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(name = "overview", description = "Show schedule counts, run counts and upcoming runs")
public class OverviewCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    try (var scheduler = ScheduleCommand.open(dbOptions)) {
      spec.commandLine().getOut().println(SchedulerCommand.prettyPrint(scheduler.overview()));
    }
    return 0;
  }
}
