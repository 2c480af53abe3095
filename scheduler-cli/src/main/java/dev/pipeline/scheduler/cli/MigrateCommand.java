package dev.pipeline.scheduler.cli;

import dev.pipeline.scheduler.migrations.MigrationManager;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "migrate",
    description = "Create the scheduler database, schema and tables",
    mixinStandardHelpOptions = true)
public class MigrateCommand implements Callable<Integer> {

  @Mixin DatabaseOptions dbOptions;

  @Spec CommandSpec spec;

  @Override
  public Integer call() throws Exception {
    var out = spec.commandLine().getOut();
    var config = dbOptions.config();
    out.format("Starting scheduler migrations%n");
    out.format("  Database: %s%n", config.databaseUrl());
    out.format("  Database User: %s%n", config.dbUser());
    out.format("  Schema: %s%n", config.schema());

    MigrationManager.runMigrations(config);
    out.format("Migrations complete%n");
    return 0;
  }
}
