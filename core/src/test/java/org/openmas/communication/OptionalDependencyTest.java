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

package org.openmas.communication;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.openmas.exceptions.DependencyException;

@RunWith(JUnit4.class)
public final class OptionalDependencyTest {

  @Test
  public void isPresent_reflectsClasspath() {
    assertThat(OptionalDependency.isPresent(CommunicatorRegistry.MCP_CLIENT_CLASS)).isTrue();
    assertThat(OptionalDependency.isPresent("org.example.nothing.Here")).isFalse();
  }

  @Test
  public void require_presentClass_passes() {
    OptionalDependency.require(
        CommunicatorRegistry.MCP_CLIENT_CLASS, CommunicatorRegistry.MCP_COORDINATES, "MCP");
  }

  @Test
  public void require_missingClass_namesDependencyAndHowToAddIt() {
    DependencyException e =
        assertThrows(
            DependencyException.class,
            () ->
                OptionalDependency.require(
                    "org.example.nothing.Here", "org.example:nothing:2.0", "Communicator 'zmq'"));

    assertThat(e.dependency()).isEqualTo("org.example:nothing:2.0");
    assertThat(e.installHint())
        .isEqualTo("Add org.example:nothing:2.0 to your project's dependencies.");
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "Communicator 'zmq' requires org.example:nothing:2.0, which is not on the classpath."
                + " Add org.example:nothing:2.0 to your project's dependencies.");
  }
}
