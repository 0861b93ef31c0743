/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.openmas.agents;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.openmas.JsonBaseModel;
import org.openmas.exceptions.ConfigurationException;

/**
 * Validated configuration of an agent. Immutable once built.
 *
 * <p>Instances come either from {@link #builder()} or from a generic key/value map produced by a
 * configuration loader, via {@link #fromMap(Map)}. Map keys use snake_case: {@code name}, {@code
 * communicator_type}, {@code communicator_options}, {@code service_urls}, {@code log_level},
 * {@code extension_paths} and {@code shutdown_timeout_seconds}.
 */
@AutoValue
public abstract class AgentConfig extends JsonBaseModel {

  public static final String DEFAULT_COMMUNICATOR_TYPE = "http";
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

  @JsonProperty("name")
  public abstract String name();

  /** Registry type id of the communicator, e.g. {@code http} or {@code mock}. */
  @JsonProperty("communicator_type")
  public abstract String communicatorType();

  /** Communicator specific options. Values are plain JSON-compatible objects. */
  @JsonProperty("communicator_options")
  public abstract ImmutableMap<String, Object> communicatorOptions();

  /** Service name to address (URL, command line) of the services this agent talks to. */
  @JsonProperty("service_urls")
  public abstract ImmutableMap<String, String> serviceUrls();

  @JsonProperty("log_level")
  public abstract LogLevel logLevel();

  /** Directories or JARs scanned for communicator plugins. */
  @JsonIgnore
  public abstract ImmutableList<Path> extensionPaths();

  /** Upper bound for the shutdown hook and for stopping the communicator. */
  @JsonIgnore
  public abstract Duration shutdownTimeout();

  @JsonProperty("extension_paths")
  List<String> extensionPathStrings() {
    return extensionPaths().stream().map(Path::toString).collect(toImmutableList());
  }

  @JsonProperty("shutdown_timeout_seconds")
  double shutdownTimeoutSeconds() {
    return shutdownTimeout().toMillis() / 1000.0;
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_AgentConfig.Builder()
        .setCommunicatorType(DEFAULT_COMMUNICATOR_TYPE)
        .setCommunicatorOptions(ImmutableMap.of())
        .setServiceUrls(ImmutableMap.of())
        .setLogLevel(LogLevel.INFO)
        .setExtensionPaths(ImmutableList.of())
        .setShutdownTimeout(DEFAULT_SHUTDOWN_TIMEOUT);
  }

  /**
   * Binds and validates a configuration map, typically the output of a YAML or environment
   * loader.
   *
   * @throws ConfigurationException if the map is malformed or fails validation.
   */
  public static AgentConfig fromMap(Map<String, ?> values) {
    try {
      return getMapper().convertValue(values, AgentConfig.class);
    } catch (IllegalArgumentException e) {
      for (Throwable cause = e; cause != null; cause = cause.getCause()) {
        if (cause instanceof ConfigurationException) {
          throw (ConfigurationException) cause;
        }
      }
      throw new ConfigurationException(
          "Configuration validation failed: " + e.getMessage(), e);
    }
  }

  @JsonCreator
  static AgentConfig create(
      @JsonProperty("name") @Nullable String name,
      @JsonProperty("communicator_type") @Nullable String communicatorType,
      @JsonProperty("communicator_options") @Nullable Map<String, Object> communicatorOptions,
      @JsonProperty("service_urls") @Nullable Map<String, String> serviceUrls,
      @JsonProperty("log_level") @Nullable LogLevel logLevel,
      @JsonProperty("extension_paths") @Nullable List<String> extensionPaths,
      @JsonProperty("shutdown_timeout_seconds") @Nullable Double shutdownTimeoutSeconds) {
    Builder builder = builder();
    if (name == null) {
      throw new ConfigurationException("Configuration validation failed: 'name' is required");
    }
    builder.setName(name);
    if (communicatorType != null) {
      builder.setCommunicatorType(communicatorType);
    }
    if (communicatorOptions != null) {
      builder.setCommunicatorOptions(withoutNullValues(communicatorOptions));
    }
    if (serviceUrls != null) {
      builder.setServiceUrls(withoutNullValues(serviceUrls));
    }
    if (logLevel != null) {
      builder.setLogLevel(logLevel);
    }
    if (extensionPaths != null) {
      List<Path> paths = new ArrayList<>();
      for (String path : extensionPaths) {
        paths.add(Path.of(path));
      }
      builder.setExtensionPaths(paths);
    }
    if (shutdownTimeoutSeconds != null) {
      if (shutdownTimeoutSeconds.isNaN() || shutdownTimeoutSeconds < 0) {
        throw new ConfigurationException(
            "Configuration validation failed: 'shutdown_timeout_seconds' must be non-negative");
      }
      builder.setShutdownTimeout(Duration.ofMillis(Math.round(shutdownTimeoutSeconds * 1000)));
    }
    return builder.build();
  }

  private static <V> Map<String, V> withoutNullValues(Map<String, V> values) {
    Map<String, V> copy = new LinkedHashMap<>();
    values.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            copy.put(key, value);
          }
        });
    return copy;
  }

  /** Builder for {@link AgentConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {

    @CanIgnoreReturnValue
    public abstract Builder setName(String name);

    @CanIgnoreReturnValue
    public abstract Builder setCommunicatorType(String communicatorType);

    @CanIgnoreReturnValue
    public abstract Builder setCommunicatorOptions(Map<String, ?> communicatorOptions);

    @CanIgnoreReturnValue
    public abstract Builder setServiceUrls(Map<String, String> serviceUrls);

    @CanIgnoreReturnValue
    public abstract Builder setLogLevel(LogLevel logLevel);

    @CanIgnoreReturnValue
    public abstract Builder setExtensionPaths(Iterable<Path> extensionPaths);

    @CanIgnoreReturnValue
    public abstract Builder setShutdownTimeout(Duration shutdownTimeout);

    abstract AgentConfig autoBuild();

    /**
     * Builds and validates the configuration.
     *
     * @throws ConfigurationException if a required value is blank or out of range.
     */
    public AgentConfig build() {
      AgentConfig config;
      try {
        config = autoBuild();
      } catch (IllegalStateException e) {
        throw new ConfigurationException("Configuration validation failed: " + e.getMessage(), e);
      }
      if (config.name().isBlank()) {
        throw new ConfigurationException("Configuration validation failed: 'name' is blank");
      }
      if (config.communicatorType().isBlank()) {
        throw new ConfigurationException(
            "Configuration validation failed: 'communicator_type' is blank");
      }
      if (config.shutdownTimeout().isNegative()) {
        throw new ConfigurationException(
            "Configuration validation failed: 'shutdown_timeout_seconds' must be non-negative");
      }
      return config;
    }
  }
}
