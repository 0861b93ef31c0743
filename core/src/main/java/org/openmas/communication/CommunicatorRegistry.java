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

import static java.util.Comparator.comparing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.openmas.agents.AgentConfig;
import org.openmas.communication.http.HttpCommunicator;
import org.openmas.communication.mcp.McpCommunicator;
import org.openmas.exceptions.CommunicatorCreationException;
import org.openmas.exceptions.ConfigurationException;
import org.openmas.exceptions.DependencyException;
import org.openmas.testing.MockCommunicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps communicator type ids to the factories that create them.
 *
 * <p>A registry is an explicit object handed to each agent; there is no process-wide instance.
 * Factories run only on {@link #resolve}, so a communicator type whose optional library is absent
 * costs nothing until it is actually used.
 *
 * <p>Registering a type id that already exists replaces the previous factory. Plugin discovery
 * relies on this: installed plugins are applied before extension paths, and extension paths in the
 * order given, so the last registration of a type id wins.
 */
public final class CommunicatorRegistry {

  private static final Logger logger = LoggerFactory.getLogger(CommunicatorRegistry.class);

  public static final String HTTP = "http";
  public static final String MOCK = "mock";
  public static final String MCP_SSE = "mcp-sse";
  public static final String MCP_STDIO = "mcp-stdio";

  static final String MCP_CLIENT_CLASS = "io.modelcontextprotocol.client.McpClient";
  static final String MCP_COORDINATES = "io.modelcontextprotocol.sdk:mcp:0.10.0";

  private final Map<String, CommunicatorFactory> factories = new ConcurrentHashMap<>();
  private final Set<Path> appliedLocations = ConcurrentHashMap.newKeySet();
  // Keyed by origin and plugin class name.
  private final Set<String> appliedPlugins = ConcurrentHashMap.newKeySet();
  private final List<URLClassLoader> pluginClassLoaders = new CopyOnWriteArrayList<>();

  private CommunicatorRegistry() {}

  /** A registry without any entries. */
  public static CommunicatorRegistry empty() {
    return new CommunicatorRegistry();
  }

  /** A registry holding the built-in types: {@code http}, {@code mock} and the MCP clients. */
  public static CommunicatorRegistry withBuiltIns() {
    CommunicatorRegistry registry = new CommunicatorRegistry();
    registry.registerBuiltIns();
    return registry;
  }

  private void registerBuiltIns() {
    register(HTTP, HttpCommunicator::new);
    register(MOCK, MockCommunicator::fromConfig);
    register(
        MCP_SSE,
        config -> {
          OptionalDependency.require(MCP_CLIENT_CLASS, MCP_COORDINATES, "Communicator 'mcp-sse'");
          return McpCommunicator.sse(config);
        });
    register(
        MCP_STDIO,
        config -> {
          OptionalDependency.require(
              MCP_CLIENT_CLASS, MCP_COORDINATES, "Communicator 'mcp-stdio'");
          return McpCommunicator.stdio(config);
        });
  }

  /**
   * Registers {@code factory} under {@code typeId}, replacing any previous registration.
   *
   * @throws IllegalArgumentException if the type id is null or empty.
   */
  public void register(String typeId, CommunicatorFactory factory) {
    if (typeId == null || typeId.isEmpty()) {
      throw new IllegalArgumentException("Type id cannot be null or empty");
    }
    if (factory == null) {
      throw new IllegalArgumentException("Factory cannot be null");
    }
    if (factories.put(typeId, factory) != null) {
      logger.info("Communicator type '{}' was already registered. Overwriting.", typeId);
    } else {
      logger.debug("Registered communicator type '{}'", typeId);
    }
  }

  public boolean contains(String typeId) {
    return factories.containsKey(typeId);
  }

  /** The known type ids, sorted. */
  public ImmutableSortedSet<String> typeIds() {
    return ImmutableSortedSet.copyOf(factories.keySet());
  }

  /** Creates the communicator configured by {@link AgentConfig#communicatorType()}. */
  public Communicator resolve(AgentConfig config) {
    return resolve(config.communicatorType(), config);
  }

  /**
   * Creates a communicator of type {@code typeId} for the agent configured by {@code config}.
   *
   * @throws ConfigurationException if the type id is unknown. The message lists the known ids.
   * @throws DependencyException if the factory needs an optional library that is missing.
   * @throws CommunicatorCreationException if the factory fails for any other reason.
   */
  public Communicator resolve(String typeId, AgentConfig config) {
    CommunicatorFactory factory = factories.get(typeId);
    if (factory == null) {
      ImmutableSortedSet<String> known = typeIds();
      throw new ConfigurationException(
          String.format(
              "Communicator type '%s' not found. Available types: %s. Check your configuration"
                  + " or add the plugin that provides it to the extension paths.",
              typeId, known.isEmpty() ? "none" : String.join(", ", known)));
    }
    Communicator communicator;
    try {
      communicator = factory.create(config);
    } catch (DependencyException | ConfigurationException e) {
      throw e;
    } catch (NoClassDefFoundError e) {
      throw new DependencyException(
          "Communicator type '" + typeId + "' needs missing class " + e.getMessage(),
          String.valueOf(e.getMessage()),
          "Add the library that provides it to your project's dependencies.",
          e);
    } catch (RuntimeException e) {
      throw new CommunicatorCreationException(typeId, e);
    }
    if (communicator == null) {
      throw new CommunicatorCreationException(
          typeId, new IllegalStateException("Factory returned no communicator"));
    }
    logger.debug("Resolved communicator type '{}' for agent '{}'", typeId, config.name());
    return communicator;
  }

  /** Applies the installed plugins, then the plugins found in {@code extensionPaths}. */
  public void discoverPlugins(List<Path> extensionPaths) {
    discoverPlugins(extensionPaths, PluginSource.installed());
  }

  /**
   * Applies the plugins supplied by {@code installed}, then the plugins found in {@code
   * extensionPaths}, in that order.
   *
   * <p>Each extension path may be a JAR, a directory containing JARs, or a classes directory with
   * a {@code META-INF/services} entry. Discovery is idempotent per origin: a location already
   * scanned, or a plugin class already applied from the same origin, is skipped. A plugin class
   * found in a new location is applied again, so its registrations win over earlier ones. Missing
   * paths and plugins that fail are logged and skipped.
   */
  public void discoverPlugins(List<Path> extensionPaths, PluginSource installed) {
    ImmutableList<CommunicatorPlugin> installedPlugins;
    try {
      installedPlugins = installed.plugins();
    } catch (RuntimeException e) {
      logger.warn("Failed to enumerate installed communicator plugins", e);
      installedPlugins = ImmutableList.of();
    }
    for (CommunicatorPlugin plugin : installedPlugins) {
      apply(plugin, "installed packages");
    }
    for (Path extensionPath : extensionPaths) {
      for (Path location : locations(extensionPath)) {
        if (!appliedLocations.add(location)) {
          logger.debug("Extension location {} already scanned", location);
          continue;
        }
        URLClassLoader classLoader = newClassLoader(location);
        if (classLoader == null) {
          continue;
        }
        pluginClassLoaders.add(classLoader);
        for (CommunicatorPlugin plugin : PluginLoading.load(classLoader, location.toString())) {
          apply(plugin, location.toString());
        }
      }
    }
  }

  /** Removes every entry and forgets past discoveries. Intended for tests. */
  public void clear() {
    factories.clear();
    appliedLocations.clear();
    appliedPlugins.clear();
    for (URLClassLoader classLoader : pluginClassLoaders) {
      try {
        classLoader.close();
      } catch (IOException e) {
        logger.warn("Failed to close plugin class loader", e);
      }
    }
    pluginClassLoaders.clear();
  }

  private void apply(CommunicatorPlugin plugin, String origin) {
    String pluginClass = plugin.getClass().getName();
    if (!appliedPlugins.add(origin + "!" + pluginClass)) {
      logger.debug("Communicator plugin {} from {} already applied", pluginClass, origin);
      return;
    }
    try {
      plugin.register(this);
      logger.info("Loaded communicator plugin {} from {}", pluginClass, origin);
    } catch (RuntimeException | LinkageError e) {
      logger.warn("Communicator plugin {} from {} failed to register", pluginClass, origin, e);
    }
  }

  /** Expands one extension path into the locations that each get a class loader. */
  private static List<Path> locations(Path extensionPath) {
    Path path = extensionPath.toAbsolutePath().normalize();
    if (!Files.exists(path)) {
      logger.warn("Extension path {} does not exist, skipping", path);
      return ImmutableList.of();
    }
    if (!Files.isDirectory(path)) {
      if (isJar(path)) {
        return ImmutableList.of(path);
      }
      logger.warn("Extension path {} is neither a directory nor a JAR, skipping", path);
      return ImmutableList.of();
    }
    List<Path> locations = new ArrayList<>();
    if (Files.isDirectory(path.resolve("META-INF").resolve("services"))) {
      locations.add(path);
    }
    try (Stream<Path> children = Files.list(path)) {
      locations.addAll(
          children
              .filter(child -> Files.isRegularFile(child) && isJar(child))
              .sorted(comparing(Path::toString))
              .collect(Collectors.toList()));
    } catch (IOException e) {
      logger.warn("Failed to list extension directory {}", path, e);
    }
    if (locations.isEmpty()) {
      logger.debug("No communicator plugins found in {}", path);
    }
    return locations;
  }

  private static boolean isJar(Path path) {
    return path.getFileName().toString().endsWith(".jar");
  }

  private static @Nullable URLClassLoader newClassLoader(Path location) {
    try {
      URL url = location.toUri().toURL();
      return new URLClassLoader(
          new URL[] {url}, CommunicatorRegistry.class.getClassLoader());
    } catch (MalformedURLException e) {
      logger.warn("Invalid extension location {}", location, e);
      return null;
    }
  }
}
