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

import org.openmas.testing.MockCommunicator;

/** Registers the {@code fake} type again, producing communicators with a marked agent name. */
public final class OverridingPlugin implements CommunicatorPlugin {

  @Override
  public void register(CommunicatorRegistry registry) {
    registry.register(
        FakeCommunicatorPlugin.TYPE_ID,
        config -> new MockCommunicator(config.name() + "-override"));
  }
}
