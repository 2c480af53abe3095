package dev.pipeline.scheduler.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named execution context: the warehouse target a job runs against, the variables passed to it
 * and the retention policy applied to schedules that carry none of their own.
 */
public record Environment(
    Long id,
    String name,
    String description,
    String targetName,
    String connectionProfile,
    Map<String, Object> variables,
    RetentionPolicy defaultRetentionPolicy,
    Instant createdAt,
    Instant updatedAt) {

  public Environment {
    Objects.requireNonNull(name, "Environment name must not be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Environment name must not be empty");
    }
    variables =
        variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
  }

  public Environment(String name) {
    this(null, name, null, null, null, Map.of(), null, null, null);
  }

  public Environment withId(Long id) {
    return new Environment(
        id,
        name,
        description,
        targetName,
        connectionProfile,
        variables,
        defaultRetentionPolicy,
        createdAt,
        updatedAt);
  }

  public Environment withName(String name) {
    return new Environment(
        id,
        name,
        description,
        targetName,
        connectionProfile,
        variables,
        defaultRetentionPolicy,
        createdAt,
        updatedAt);
  }

  public Environment withDescription(String description) {
    return new Environment(
        id,
        name,
        description,
        targetName,
        connectionProfile,
        variables,
        defaultRetentionPolicy,
        createdAt,
        updatedAt);
  }

  public Environment withTargetName(String targetName) {
    return new Environment(
        id,
        name,
        description,
        targetName,
        connectionProfile,
        variables,
        defaultRetentionPolicy,
        createdAt,
        updatedAt);
  }

  public Environment withConnectionProfile(String connectionProfile) {
    return new Environment(
        id,
        name,
        description,
        targetName,
        connectionProfile,
        variables,
        defaultRetentionPolicy,
        createdAt,
        updatedAt);
  }

  public Environment withVariables(Map<String, Object> variables) {
    return new Environment(
        id,
        name,
        description,
        targetName,
        connectionProfile,
        variables,
        defaultRetentionPolicy,
        createdAt,
        updatedAt);
  }

  public Environment withDefaultRetentionPolicy(RetentionPolicy policy) {
    return new Environment(
        id,
        name,
        description,
        targetName,
        connectionProfile,
        variables,
        policy,
        createdAt,
        updatedAt);
  }

  public Environment withTimestamps(Instant createdAt, Instant updatedAt) {
    return new Environment(
        id,
        name,
        description,
        targetName,
        connectionProfile,
        variables,
        defaultRetentionPolicy,
        createdAt,
        updatedAt);
  }

  /** The copy of this environment frozen onto a scheduled run when it is created. */
  public Map<String, Object> snapshot() {
    var snapshot = new LinkedHashMap<String, Object>();
    snapshot.put("id", id);
    snapshot.put("name", name);
    snapshot.put("target_name", targetName);
    snapshot.put("connection_profile", connectionProfile);
    snapshot.put("variables", variables);
    return snapshot;
  }
}
