package dev.pipeline.scheduler.executor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a job needs to know about the environment it runs in.
 *
 * @param targetName warehouse target of the environment, or null for the project default
 * @param connectionProfile name of the connection profile the job uses, or null for the default
 * @param variables variables passed to the command
 */
public record LaunchParameters(
    String targetName, String connectionProfile, Map<String, Object> variables) {

  public LaunchParameters {
    variables =
        variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
  }

  /** Reads the parameters from an environment snapshot taken when the run was created */
  @SuppressWarnings("unchecked")
  public static LaunchParameters fromSnapshot(Map<String, Object> snapshot) {
    if (snapshot == null || snapshot.isEmpty()) {
      return new LaunchParameters(null, null, Map.of());
    }
    var target = snapshot.get("target_name");
    var profile = snapshot.get("connection_profile");
    var vars = snapshot.get("variables");
    return new LaunchParameters(
        target == null ? null : target.toString(),
        profile == null ? null : profile.toString(),
        vars instanceof Map ? (Map<String, Object>) vars : Map.of());
  }
}
