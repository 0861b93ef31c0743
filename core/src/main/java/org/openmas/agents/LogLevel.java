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

package org.openmas.agents;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.openmas.exceptions.ConfigurationException;
import org.slf4j.event.Level;

/** Log verbosity requested for an agent. Maps onto SLF4J levels. */
public enum LogLevel {
  TRACE(Level.TRACE),
  DEBUG(Level.DEBUG),
  INFO(Level.INFO),
  WARN(Level.WARN),
  ERROR(Level.ERROR);

  private final Level slf4jLevel;

  LogLevel(Level slf4jLevel) {
    this.slf4jLevel = slf4jLevel;
  }

  public Level toSlf4jLevel() {
    return slf4jLevel;
  }

  @JsonValue
  public String jsonValue() {
    return name();
  }

  /**
   * Parses a level name in any case. {@code WARNING} is accepted as an alias of {@link #WARN}.
   *
   * @throws ConfigurationException if the name is not a known level.
   */
  @JsonCreator
  public static LogLevel fromString(String value) {
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("WARNING")) {
      return WARN;
    }
    for (LogLevel level : values()) {
      if (level.name().equals(normalized)) {
        return level;
      }
    }
    throw new ConfigurationException(
        "Unknown log level '"
            + value
            + "'. Expected one of: "
            + Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", ")));
  }
}
