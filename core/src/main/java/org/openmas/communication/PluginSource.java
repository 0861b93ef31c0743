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

/**
 * Supplies the plugins installed with the application, as opposed to those found in extension
 * paths.
 */
@FunctionalInterface
public interface PluginSource {

  ImmutableList<CommunicatorPlugin> plugins();

  /** Plugins declared through {@code META-INF/services} on the context class loader. */
  static PluginSource installed() {
    return () -> {
      ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
      if (classLoader == null) {
        classLoader = PluginSource.class.getClassLoader();
      }
      return PluginLoading.load(classLoader, "classpath");
    };
  }

  static PluginSource none() {
    return ImmutableList::of;
  }

  static PluginSource of(CommunicatorPlugin... plugins) {
    ImmutableList<CommunicatorPlugin> list = ImmutableList.copyOf(plugins);
    return () -> list;
  }
}
