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

/** Lifecycle state of a {@link BaseAgent}. */
public enum LifecycleState {
  CREATED,
  STARTING,
  RUNNING,
  STOPPING,
  STOPPED,
  /** {@code start()} failed. The agent cannot be restarted. */
  FAILED;

  /** Whether {@code start()} may be called from this state. */
  boolean canStart() {
    return this == CREATED || this == STOPPED;
  }

  /** Whether the communicator may be replaced in this state. */
  boolean isIdle() {
    return this == CREATED || this == STOPPED || this == FAILED;
  }
}
