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

import java.time.Duration;

/** A request did not receive a response within its timeout. */
public class RequestTimeoutException extends CommunicationException {

  private final Duration timeout;

  public RequestTimeoutException(String target, String method, Duration timeout) {
    super(
        String.format(
            "Request '%s' to service '%s' timed out after %d ms",
            method, target, timeout.toMillis()),
        target);
    this.timeout = timeout;
  }

  public Duration timeout() {
    return timeout;
  }
}
