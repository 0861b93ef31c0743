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

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import java.time.Duration;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Transport used by an agent to exchange requests and notifications with other services.
 *
 * <p>This is the whole contract the agent lifecycle relies on; wire-level details stay inside the
 * implementations. Implementations must allow concurrent {@code sendRequest} and {@code
 * sendNotification} calls from several tasks of the same agent.
 */
public interface Communicator {

  /** Name of the agent that owns this communicator. */
  String agentName();

  /**
   * Acquires whatever the transport needs to send and receive. Treated as atomic by the agent: it
   * either completes or fails.
   */
  Completable start();

  /** Releases everything acquired by {@link #start()}. Safe after a partially failed start. */
  Completable stop();

  /**
   * Sends a request and waits for its response.
   *
   * <p>Fails with {@link org.openmas.exceptions.RequestTimeoutException} once {@code timeout}
   * elapses and with {@link org.openmas.exceptions.ServiceNotFoundException} when the target is
   * unknown or unreachable. A timed-out request never blocks later requests.
   *
   * @param targetService the name of the target service.
   * @param method the remote method.
   * @param params the request payload.
   * @param timeout the response timeout, or {@code null} for the communicator's default.
   */
  Single<Map<String, Object>> sendRequest(
      String targetService, String method, Map<String, Object> params, @Nullable Duration timeout);

  /** Sends a request using the communicator's default timeout. */
  default Single<Map<String, Object>> sendRequest(
      String targetService, String method, Map<String, Object> params) {
    return sendRequest(targetService, method, params, null);
  }

  /**
   * Sends a notification. Completion only means the notification was handed to the transport,
   * not that it was delivered.
   */
  Completable sendNotification(String targetService, String method, Map<String, Object> params);

  /**
   * Installs the handler for inbound calls of {@code method}. A second registration for the same
   * method replaces the first one and logs a warning.
   */
  void registerHandler(String method, RequestHandler handler);
}
