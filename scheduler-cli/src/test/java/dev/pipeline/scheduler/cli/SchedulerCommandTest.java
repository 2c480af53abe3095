package dev.pipeline.scheduler.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import dev.pipeline.scheduler.Constants;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

public class SchedulerCommandTest {

  @Test
  public void helpListsSubcommands() {
    var cmd = new CommandLine(new SchedulerCommand());
    var sw = new StringWriter();
    cmd.setOut(new PrintWriter(sw));

    var exitCode = cmd.execute("--help");
    assertEquals(0, exitCode);

    var usage = sw.toString();
    assertTrue(usage.contains("pipesched"), usage);
    for (var sub : new String[] {"migrate", "serve", "schedule", "overview", "reset"}) {
      assertTrue(usage.contains(sub), "missing " + sub + " in " + usage);
    }
  }

  @Test
  public void versionFallsBackWhenNotPackaged() {
    var cmd = new CommandLine(new SchedulerCommand());
    var sw = new StringWriter();
    cmd.setOut(new PrintWriter(sw));

    assertEquals(0, cmd.execute("--version"));
    assertTrue(sw.toString().startsWith("pipesched "), sw.toString());
  }

  @Test
  public void scheduleAliasShowsSubcommands() {
    var cmd = new CommandLine(new SchedulerCommand());
    var sw = new StringWriter();
    cmd.setOut(new PrintWriter(sw));

    assertEquals(0, cmd.execute("sched", "--help"));
    var usage = sw.toString();
    assertTrue(usage.contains("pause"), usage);
    assertTrue(usage.contains("resume"), usage);
    assertTrue(usage.contains("list"), usage);
  }

  @Test
  public void unknownOptionIsUsageError() {
    var cmd = new CommandLine(new SchedulerCommand());
    cmd.setErr(new PrintWriter(new StringWriter()));
    assertEquals(2, cmd.execute("serve", "--no-such-option"));
  }

  @Test
  public void missingDatabaseUrlFails() {
    assumeTrue(System.getenv(Constants.SYSTEM_JDBC_URL_ENV_VAR) == null);

    var cmd = new CommandLine(new SchedulerCommand());
    var err = new StringWriter();
    cmd.setErr(new PrintWriter(err));

    assertNotEquals(0, cmd.execute("migrate"));
    assertNotEquals(0, cmd.execute("reset", "-y"));
    assertTrue(err.toString().contains(Constants.SYSTEM_JDBC_URL_ENV_VAR), err.toString());
  }
}
