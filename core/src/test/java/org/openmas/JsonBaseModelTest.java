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

package org.openmas;

import static com.google.common.truth.Truth.assertThat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.openmas.agents.AgentConfig;
import org.openmas.agents.LogLevel;

/** Tests for JSON serialization/deserialization of classes inheriting from JsonBaseModel. */
@RunWith(JUnit4.class)
public class JsonBaseModelTest {

  private static final class Reply extends JsonBaseModel {
    @JsonProperty("status")
    final String status = "ok";

    @JsonProperty("error_message")
    final Optional<String> errorMessage = Optional.empty();

    @JsonProperty("trace_id")
    final Optional<String> traceId = Optional.of("abc");
  }

  @Test
  public void toJson_omitsAbsentOptionalsAndUnwrapsPresentOnes() {
    String json = new Reply().toJson();

    assertThat(json).contains("\"status\":\"ok\"");
    assertThat(json).contains("\"trace_id\":\"abc\"");
    assertThat(json).doesNotContain("error_message");
  }

  @Test
  public void agentConfigDeserialization_handlesSnakeCaseAndIgnoresUnknownKeys() throws Exception {
    String json =
        "{"
            + "\"name\":\"planner\","
            + "\"communicator_type\":\"mock\","
            + "\"service_urls\":{\"search\":\"http://localhost:8001\"},"
            + "\"log_level\":\"debug\","
            + "\"log_level_colors\":true,"
            + "\"communicator_options\":null"
            + "}";

    AgentConfig config = JsonBaseModel.getMapper().readValue(json, AgentConfig.class);

    assertThat(config.name()).isEqualTo("planner");
    assertThat(config.communicatorType()).isEqualTo("mock");
    assertThat(config.serviceUrls()).containsExactly("search", "http://localhost:8001");
    assertThat(config.logLevel()).isEqualTo(LogLevel.DEBUG);
    assertThat(config.communicatorOptions()).isEmpty();
  }

  @Test
  public void toMap_convertsModelToGenericMap() {
    AgentConfig config =
        AgentConfig.builder()
            .setName("planner")
            .setServiceUrls(ImmutableMap.of("search", "http://localhost:8001"))
            .build();

    Map<String, Object> map = JsonBaseModel.toMap(config);

    assertThat(map).containsEntry("name", "planner");
    assertThat(map).containsEntry("communicator_type", "http");
    assertThat(map)
        .containsEntry("service_urls", ImmutableMap.of("search", "http://localhost:8001"));
    assertThat(map).containsEntry("log_level", "INFO");
  }
}
