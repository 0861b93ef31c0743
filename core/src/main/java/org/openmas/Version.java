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

package org.openmas;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The library version. */
public final class Version {

  private static final Logger logger = LoggerFactory.getLogger(Version.class);

  private static final String RESOURCE = "openmas/version.properties";
  private static final String UNKNOWN = "unknown";

  /** Read from a resource filtered at build time; {@code "unknown"} if it is missing. */
  public static final String OPENMAS_VERSION = load();

  private static String load() {
    try (InputStream input = Version.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (input == null) {
        logger.warn("{} not found on the classpath", RESOURCE);
        return UNKNOWN;
      }
      Properties properties = new Properties();
      properties.load(input);
      String version = properties.getProperty("version", UNKNOWN).trim();
      // Unfiltered when running from sources that were not processed by Maven.
      return version.isEmpty() || version.startsWith("${") ? UNKNOWN : version;
    } catch (IOException e) {
      logger.warn("Failed to read {}", RESOURCE, e);
      return UNKNOWN;
    }
  }

  private Version() {}
}
