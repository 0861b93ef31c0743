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

/**
 * Service provider interface for communicator plugins.
 *
 * <p>Plugins are discovered with {@link java.util.ServiceLoader}: a JAR lists its
 * implementations in {@code META-INF/services/org.openmas.communication.CommunicatorPlugin}.
 * Implementations need a public no-argument constructor.
 */
public interface CommunicatorPlugin {

  /** Registers the communicator types this plugin provides. */
  void register(CommunicatorRegistry registry);
}
