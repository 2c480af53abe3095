package dev.pipeline.scheduler.cli;

import dev.pipeline.scheduler.PipelineScheduler;
import dev.pipeline.scheduler.json.JSONUtil;
import dev.pipeline.scheduler.json.JSONUtil.JsonRuntimeException;

import java.util.Objects;
import java.util.Scanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

@Command(
    name = "pipesched",
    description = "Command-line interface for the pipeline scheduler",
    mixinStandardHelpOptions = true,
    subcommands = {
      MigrateCommand.class,
      ServeCommand.class,
      ScheduleCommand.class,
      OverviewCommand.class,
      ResetCommand.class
    },
    versionProvider = SchedulerCommand.class)
public class SchedulerCommand implements Runnable, IVersionProvider {

  @Override
  public void run() {
    CommandLine cmd = new CommandLine(this);
    cmd.usage(System.out);
  }

  @Override
  public String[] getVersion() throws Exception {
    var pkg = PipelineScheduler.class.getPackage();
    var version = pkg == null ? null : pkg.getImplementationVersion();
    var ver = version == null ? null : "v%s".formatted(version);
    return new String[] {
      "${COMMAND-FULL-NAME} " + Objects.requireNonNullElse(ver, "<unknown version>")
    };
  }

  public static String prettyPrint(Object object) {
    var writer = JSONUtil.mapper().writerWithDefaultPrettyPrinter();
    try {
      return writer.writeValueAsString(Objects.requireNonNull(object));
    } catch (JsonProcessingException e) {
      throw new JsonRuntimeException(e);
    }
  }

  public static boolean confirm(String prompt) {
    try (var scanner = new Scanner(System.in)) {
      System.out.print(prompt);
      if (!scanner.hasNextLine()) {
        return false;
      }
      String input = scanner.nextLine();
      return input.equalsIgnoreCase("y") || input.equalsIgnoreCase("yes");
    }
  }
}
