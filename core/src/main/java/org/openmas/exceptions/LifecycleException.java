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

package org.openmas.exceptions;

/**
 * A lifecycle precondition was violated, or a failure while starting an agent was wrapped for
 * propagation to the caller of {@code start()}.
 */
public class LifecycleException extends OpenMasException {

  /** The lifecycle phase an error is attributed to. */
  public enum Phase {
    START,
    COMMUNICATOR_START,
    SETUP,
    RUN,
    STOP,
    RECONFIGURE
  }

  private final Phase phase;

  public LifecycleException(Phase phase, String message) {
    super(message);
    this.phase = phase;
  }

  public LifecycleException(Phase phase, String message, Throwable cause) {
    super(message, cause);
    this.phase = phase;
  }

  public Phase phase() {
    return phase;
  }
}
