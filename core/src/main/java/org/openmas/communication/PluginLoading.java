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

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** ServiceLoader helper that skips providers which fail to load. */
final class PluginLoading {

  private static final Logger logger = LoggerFactory.getLogger(PluginLoading.class);

  private PluginLoading() {}

  static ImmutableList<CommunicatorPlugin> load(ClassLoader classLoader, String origin) {
    ImmutableList.Builder<CommunicatorPlugin> plugins = ImmutableList.builder();
    Iterator<CommunicatorPlugin> iterator =
        ServiceLoader.load(CommunicatorPlugin.class, classLoader).iterator();
    while (true) {
      try {
        if (!iterator.hasNext()) {
          break;
        }
      } catch (ServiceConfigurationError e) {
        logger.warn("Failed to read communicator plugin declarations from {}", origin, e);
        break;
      }
      try {
        plugins.add(iterator.next());
      } catch (ServiceConfigurationError e) {
        logger.warn("Skipping communicator plugin from {} that failed to load", origin, e);
      }
    }
    return plugins.build();
  }
}
