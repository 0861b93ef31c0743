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

import com.google.common.collect.ImmutableSortedSet;
import io.reactivex.rxjava3.core.Single;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.openmas.exceptions.MethodNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Method name to handler mapping of one communicator. At most one handler per method. */
public final class HandlerTable {

  private static final Logger logger = LoggerFactory.getLogger(HandlerTable.class);

  private final String agentName;
  private final Map<String, RequestHandler> handlers = new ConcurrentHashMap<>();

  public HandlerTable(String agentName) {
    this.agentName = agentName;
  }

  /**
   * Installs {@code handler} for {@code method}, replacing and warning about any previous one.
   *
   * @throws IllegalArgumentException if the method name is null or empty.
   */
  public void register(String method, RequestHandler handler) {
    if (method == null || method.isEmpty()) {
      throw new IllegalArgumentException("Method name cannot be null or empty");
    }
    RequestHandler previous = handlers.put(method, handler);
    if (previous != null && previous != handler) {
      logger
          .atWarn()
          .addKeyValue("agent_name", agentName)
          .addKeyValue("event", "handler_replaced")
          .log("Handler for method '{}' was already registered and has been replaced", method);
    }
  }

  public Optional<RequestHandler> get(String method) {
    return Optional.ofNullable(handlers.get(method));
  }

  public boolean contains(String method) {
    return handlers.containsKey(method);
  }

  public boolean isEmpty() {
    return handlers.isEmpty();
  }

  public ImmutableSortedSet<String> methods() {
    return ImmutableSortedSet.copyOf(handlers.keySet());
  }

  /**
   * Invokes the handler of {@code method}. Fails with {@link MethodNotFoundException} when none is
   * registered.
   */
  public Single<Map<String, Object>> dispatch(String method, Map<String, Object> params) {
    RequestHandler handler = handlers.get(method);
    if (handler == null) {
      return Single.error(
          new MethodNotFoundException(
              "Method '" + method + "' not found on agent '" + agentName + "'", agentName));
    }
    return Single.defer(() -> handler.handle(params));
  }
}
