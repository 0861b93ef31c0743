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

/**
 * A communicator type is known but its implementation needs an optional library that is not on the
 * classpath.
 *
 * <p>Unlike {@link ConfigurationException}, the remedy is to add a dependency rather than to fix
 * the configuration, so the exception carries the missing artifact and an install hint.
 */
public class DependencyException extends OpenMasException {

  private final String dependency;
  private final String installHint;

  public DependencyException(String message, String dependency, String installHint) {
    super(message + " " + installHint);
    this.dependency = dependency;
    this.installHint = installHint;
  }

  public DependencyException(
      String message, String dependency, String installHint, Throwable cause) {
    super(message + " " + installHint, cause);
    this.dependency = dependency;
    this.installHint = installHint;
  }

  /** The missing library, usually as Maven coordinates. */
  public String dependency() {
    return dependency;
  }

  /** What to add to the build to make the communicator available. */
  public String installHint() {
    return installHint;
  }
}
