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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** A transport-level failure raised by a communicator. Passes through the agent unchanged. */
public class CommunicationException extends OpenMasException {

  private final @Nullable String target;
  private final ImmutableMap<String, Object> details;

  public CommunicationException(String message) {
    this(message, null, null, null);
  }

  public CommunicationException(String message, @Nullable String target) {
    this(message, target, null, null);
  }

  public CommunicationException(String message, @Nullable String target, Throwable cause) {
    this(message, target, null, cause);
  }

  public CommunicationException(
      String message,
      @Nullable String target,
      @Nullable Map<String, Object> details,
      @Nullable Throwable cause) {
    super(message, cause);
    this.target = target;
    ImmutableMap.Builder<String, Object> copy = ImmutableMap.builder();
    if (details != null) {
      details.forEach(
          (key, value) -> {
            if (key != null && value != null) {
              copy.put(key, value);
            }
          });
    }
    this.details = copy.buildKeepingLast();
  }

  /** The target service name, if the failure concerns one. */
  public Optional<String> target() {
    return Optional.ofNullable(target);
  }

  /** Structured details of the failure, such as a JSON-RPC error object, without null values. */
  public ImmutableMap<String, Object> details() {
    return details;
  }
}
