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
 * A registered communicator factory failed for a reason other than a missing optional
 * dependency.
 */
public class CommunicatorCreationException extends OpenMasException {

  private final String communicatorType;

  public CommunicatorCreationException(String communicatorType, Throwable cause) {
    super(
        "Failed to create communicator of type '" + communicatorType + "': " + cause.getMessage(),
        cause);
    this.communicatorType = communicatorType;
  }

  public String communicatorType() {
    return communicatorType;
  }
}
