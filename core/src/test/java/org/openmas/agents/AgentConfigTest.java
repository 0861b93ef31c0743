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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.openmas.exceptions.ConfigurationException;

@RunWith(JUnit4.class)
public final class AgentConfigTest {

  @Test
  public void builder_appliesDefaults() {
    AgentConfig config = AgentConfig.builder().setName("agent").build();

    assertThat(config.communicatorType()).isEqualTo("http");
    assertThat(config.communicatorOptions()).isEmpty();
    assertThat(config.serviceUrls()).isEmpty();
    assertThat(config.logLevel()).isEqualTo(LogLevel.INFO);
    assertThat(config.extensionPaths()).isEmpty();
    assertThat(config.shutdownTimeout()).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  public void builder_blankName_fails() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class, () -> AgentConfig.builder().setName("  ").build());

    assertThat(e).hasMessageThat().startsWith("Configuration validation failed");
  }

  @Test
  public void builder_missingName_fails() {
    assertThrows(ConfigurationException.class, () -> AgentConfig.builder().build());
  }

  @Test
  public void builder_negativeShutdownTimeout_fails() {
    assertThrows(
        ConfigurationException.class,
        () ->
            AgentConfig.builder()
                .setName("agent")
                .setShutdownTimeout(Duration.ofSeconds(-1))
                .build());
  }

  @Test
  public void fromMap_bindsSnakeCaseKeys() {
    Map<String, Object> values = new HashMap<>();
    values.put("name", "planner");
    values.put("communicator_type", "mock");
    values.put("communicator_options", ImmutableMap.of("port", 8081, "host", "127.0.0.1"));
    values.put("service_urls", ImmutableMap.of("worker", "http://localhost:8082"));
    values.put("log_level", "debug");
    values.put("extension_paths", ImmutableList.of("plugins"));
    values.put("shutdown_timeout_seconds", 2.5);
    values.put("unrelated_key", "ignored");

    AgentConfig config = AgentConfig.fromMap(values);

    assertThat(config.name()).isEqualTo("planner");
    assertThat(config.communicatorType()).isEqualTo("mock");
    assertThat(config.communicatorOptions()).containsExactly("port", 8081, "host", "127.0.0.1");
    assertThat(config.serviceUrls()).containsExactly("worker", "http://localhost:8082");
    assertThat(config.logLevel()).isEqualTo(LogLevel.DEBUG);
    assertThat(config.extensionPaths()).containsExactly(Path.of("plugins"));
    assertThat(config.shutdownTimeout()).isEqualTo(Duration.ofMillis(2500));
  }

  @Test
  public void fromMap_dropsNullOptionValues() {
    Map<String, Object> options = new HashMap<>();
    options.put("port", null);
    options.put("host", "localhost");

    AgentConfig config =
        AgentConfig.fromMap(ImmutableMap.of("name", "a", "communicator_options", options));

    assertThat(config.communicatorOptions()).containsExactly("host", "localhost");
  }

  @Test
  public void fromMap_missingName_failsValidation() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () -> AgentConfig.fromMap(ImmutableMap.of("communicator_type", "http")));

    assertThat(e).hasMessageThat().contains("'name' is required");
  }

  @Test
  public void fromMap_unknownLogLevel_failsWithConfigurationException() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () -> AgentConfig.fromMap(ImmutableMap.of("name", "a", "log_level", "LOUD")));

    assertThat(e).hasMessageThat().contains("LOUD");
  }

  @Test
  public void fromMap_malformedValue_failsWithConfigurationException() {
    ConfigurationException e =
        assertThrows(
            ConfigurationException.class,
            () -> AgentConfig.fromMap(ImmutableMap.of("name", "a", "service_urls", "nope")));

    assertThat(e).hasMessageThat().startsWith("Configuration validation failed");
  }

  @Test
  public void logLevel_acceptsAnyCaseAndWarningAlias() {
    assertThat(LogLevel.fromString("warning")).isEqualTo(LogLevel.WARN);
    assertThat(LogLevel.fromString("Error")).isEqualTo(LogLevel.ERROR);
    assertThat(LogLevel.fromString(" trace ")).isEqualTo(LogLevel.TRACE);
  }

  @Test
  public void toJson_usesSnakeCaseKeys() {
    AgentConfig config =
        AgentConfig.builder()
            .setName("agent")
            .setServiceUrls(ImmutableMap.of("peer", "http://peer"))
            .build();

    String json = config.toJson();

    assertThat(json).contains("\"communicator_type\":\"http\"");
    assertThat(json).contains("\"service_urls\":{\"peer\":\"http://peer\"}");
    assertThat(json).contains("\"shutdown_timeout_seconds\":10.0");
    assertThat(json).contains("\"log_level\":\"INFO\"");
  }

  @Test
  public void toBuilder_overridesName() {
    AgentConfig config = AgentConfig.builder().setName("agent").build();

    AgentConfig renamed = config.toBuilder().setName("other").build();

    assertThat(renamed.name()).isEqualTo("other");
    assertThat(renamed.communicatorType()).isEqualTo(config.communicatorType());
  }
}
