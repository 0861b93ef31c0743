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

import org.openmas.exceptions.DependencyException;

/** Checks for optional libraries before a communicator factory touches any of their classes. */
public final class OptionalDependency {

  private OptionalDependency() {}

  /** Whether {@code className} can be loaded, without initializing it. */
  public static boolean isPresent(String className) {
    try {
      Class.forName(className, false, OptionalDependency.class.getClassLoader());
      return true;
    } catch (ClassNotFoundException | LinkageError e) {
      return false;
    }
  }

  /**
   * Fails with {@link DependencyException} when {@code className} is not on the classpath.
   *
   * @param className a class that exists only when the dependency is present.
   * @param coordinates the Maven coordinates of the dependency.
   * @param feature what needs it, used in the message.
   */
  public static void require(String className, String coordinates, String feature) {
    if (!isPresent(className)) {
      throw new DependencyException(
          feature + " requires " + coordinates + ", which is not on the classpath.",
          coordinates,
          "Add " + coordinates + " to your project's dependencies.");
    }
  }
}
