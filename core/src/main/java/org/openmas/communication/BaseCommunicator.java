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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.openmas.exceptions.ServiceNotFoundException;

/** Base class for communicators: owns the agent name, the service URLs and the handlers. */
public abstract class BaseCommunicator implements Communicator {

  protected final String agentName;
  protected final ImmutableMap<String, String> serviceUrls;
  protected final HandlerTable handlers;

  protected BaseCommunicator(String agentName, Map<String, String> serviceUrls) {
    this.agentName = agentName;
    this.serviceUrls = ImmutableMap.copyOf(serviceUrls);
    this.handlers = new HandlerTable(agentName);
  }

  @Override
  public String agentName() {
    return agentName;
  }

  public ImmutableMap<String, String> serviceUrls() {
    return serviceUrls;
  }

  /** The handlers registered so far. */
  public HandlerTable handlers() {
    return handlers;
  }

  @Override
  public void registerHandler(String method, RequestHandler handler) {
    handlers.register(method, handler);
    onHandlerRegistered(method);
  }

  /** Called after a handler is installed. Transports that serve lazily override this. */
  protected void onHandlerRegistered(String method) {}

  /**
   * Returns the address configured for {@code targetService}.
   *
   * @throws ServiceNotFoundException if the service has no configured address.
   */
  protected String serviceUrl(String targetService) {
    String url = serviceUrls.get(targetService);
    if (url == null) {
      throw new ServiceNotFoundException(
          "Service '" + targetService + "' not found in service URLs", targetService);
    }
    return url;
  }
}
