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

import org.openmas.agents.AgentConfig;

/**
 * Creates a communicator for an agent. Factories load any optional library they need only when
 * invoked, and report a missing one with {@link org.openmas.exceptions.DependencyException}.
 */
@FunctionalInterface
public interface CommunicatorFactory {

  Communicator create(AgentConfig config);
}
