package dev.pipeline.scheduler.cli;

import dev.pipeline.scheduler.PipelineScheduler;

import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "schedule",
    aliases = {"sched"},
    description = "Manage schedules",
    subcommands = {
      ListSchedulesCommand.class,
      PauseScheduleCommand.class,
      ResumeScheduleCommand.class,
      RunScheduleCommand.class,
    })
public class ScheduleCommand implements Runnable {

  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      description = "Display this help message")
  boolean help;

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  static PipelineScheduler open(DatabaseOptions dbOptions) {
    return new PipelineScheduler(dbOptions.config(), new DeferredJobExecutor());
  }
}

@Command(name = "list", description = "List all schedules")
class ListSchedulesCommand implements Callable<Integer> {

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
      List<?> schedules = scheduler.listSchedules();
      spec.commandLine().getOut().println(SchedulerCommand.prettyPrint(schedules));
    }
    return 0;
  }
}

@Command(name = "pause", description = "Pause a schedule")
class PauseScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "The id of the schedule to pause")
  long scheduleId;

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
      var schedule = scheduler.pauseSchedule(scheduleId);
      spec.commandLine()
          .getOut()
          .format("Schedule %d (%s) paused%n", schedule.id(), schedule.name());
    }
    return 0;
  }
}

@Command(name = "resume", description = "Resume a paused schedule")
class ResumeScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "The id of the schedule to resume")
  long scheduleId;

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
      var schedule = scheduler.resumeSchedule(scheduleId);
      spec.commandLine()
          .getOut()
          .format(
              "Schedule %d (%s) resumed, next run at %s%n",
              schedule.id(), schedule.name(), schedule.nextRunTime());
    }
    return 0;
  }
}

@Command(
    name = "run",
    description = "Trigger a run now; it starts on the next tick of the serving scheduler")
class RunScheduleCommand implements Callable<Integer> {

  @Parameters(index = "0", description = "The id of the schedule to run")
  long scheduleId;

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
      var run = scheduler.runNow(scheduleId);
      spec.commandLine().getOut().println(SchedulerCommand.prettyPrint(run));
    }
    return 0;
  }
}
