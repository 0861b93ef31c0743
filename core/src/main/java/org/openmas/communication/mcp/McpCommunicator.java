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

package org.openmas.communication.mcp;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.modelcontextprotocol.client.McpAsyncClient;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.spec.McpSchema.CallToolRequest;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.Content;
import io.modelcontextprotocol.spec.McpSchema.ImageContent;
import io.modelcontextprotocol.spec.McpSchema.ListToolsResult;
import io.modelcontextprotocol.spec.McpSchema.TextContent;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.openmas.Telemetry;
import org.openmas.agents.AgentConfig;
import org.openmas.communication.BaseCommunicator;
import org.openmas.exceptions.CommunicationException;
import org.openmas.exceptions.ConfigurationException;
import org.openmas.exceptions.RequestTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-side communicator for Model Context Protocol servers.
 *
 * <p>Each entry of {@code service_urls} names an MCP server: the base URL of an SSE server, or
 * the command line that launches a stdio server. Methods map onto MCP operations:
 *
 * <ul>
 *   <li>{@code tool/list} lists the server's tools as {@code {"tools": [{"name", "description"}]}}
 *   <li>{@code tool/call/<name>}, or any other method name, calls that tool with the request
 *       params and returns {@code {"content": [...], "is_error": boolean}}
 * </ul>
 *
 * <p>Options: {@code sse_endpoint} (default {@code sse}), {@code headers}, {@code env} for stdio
 * servers, {@code timeout_seconds} (default 30) and {@code initialization_timeout_seconds} (default
 * 10). This communicator does not serve inbound calls.
 */
public class McpCommunicator extends BaseCommunicator {

  private static final Logger logger = LoggerFactory.getLogger(McpCommunicator.class);

  public static final String LIST_TOOLS = "tool/list";
  public static final String CALL_TOOL_PREFIX = "tool/call/";

  /** How target services are reached. */
  public enum Transport {
    SSE("mcp-sse"),
    STDIO("mcp-stdio");

    private final String typeId;

    Transport(String typeId) {
      this.typeId = typeId;
    }

    public String typeId() {
      return typeId;
    }
  }

  private final Transport transport;
  private final ImmutableMap<String, Object> options;
  private final Duration defaultTimeout;
  private final McpSessionManager sessionManager;

  public McpCommunicator(AgentConfig config, Transport transport) {
    this(config, transport, new DefaultMcpTransportBuilder());
  }

  public McpCommunicator(
      AgentConfig config, Transport transport, McpTransportBuilder transportBuilder) {
    super(config.name(), config.serviceUrls());
    this.transport = transport;
    this.options = config.communicatorOptions();
    this.defaultTimeout = durationOption(options, "timeout_seconds", Duration.ofSeconds(30));
    this.sessionManager =
        new McpSessionManager(
            transportBuilder,
            durationOption(options, "initialization_timeout_seconds", Duration.ofSeconds(10)),
            defaultTimeout);
  }

  /** Creates a communicator reaching its servers over SSE. */
  public static McpCommunicator sse(AgentConfig config) {
    return new McpCommunicator(config, Transport.SSE);
  }

  /** Creates a communicator launching its servers as subprocesses speaking stdio. */
  public static McpCommunicator stdio(AgentConfig config) {
    return new McpCommunicator(config, Transport.STDIO);
  }

  public Transport transport() {
    return transport;
  }

  @Override
  public Completable start() {
    return Completable.fromAction(
        () ->
            logger.debug(
                "MCP communicator ({}) for agent '{}' started", transport.typeId(), agentName));
  }

  @Override
  public Completable stop() {
    return sessionManager.closeAll();
  }

  @Override
  protected void onHandlerRegistered(String method) {
    logger.debug(
        "Handler for '{}' recorded on agent '{}'; MCP client communicators do not serve calls",
        method,
        agentName);
  }

  @Override
  public Single<Map<String, Object>> sendRequest(
      String targetService,
      String method,
      Map<String, Object> params,
      @Nullable Duration timeout) {
    Duration effectiveTimeout = timeout == null ? defaultTimeout : timeout;
    return Single.defer(
            () -> {
              Object connectionParams = connectionParams(targetService);
              Telemetry.traceRequest(transport.typeId(), targetService, method);
              return sessionManager
                  .session(targetService, connectionParams)
                  .flatMap(client -> invoke(client, method, params));
            })
        .timeout(effectiveTimeout.toNanos(), TimeUnit.NANOSECONDS, Schedulers.computation())
        .onErrorResumeNext(
            error -> Single.error(mapError(error, targetService, method, effectiveTimeout)));
  }

  @Override
  public Completable sendNotification(
      String targetService, String method, Map<String, Object> params) {
    return Completable.fromAction(
        () -> {
          connectionParams(targetService);
          sendRequest(targetService, method, params)
              .subscribe(
                  result -> {},
                  error ->
                      logger.warn(
                          "Notification '{}' to MCP service '{}' failed",
                          method,
                          targetService,
                          error));
        });
  }

  private Single<Map<String, Object>> invoke(
      McpAsyncClient client, String method, Map<String, Object> params) {
    if (method.equals(LIST_TOOLS)) {
      return Single.fromCompletionStage(client.listTools().toFuture())
          .map(McpCommunicator::toolsToMap);
    }
    String toolName =
        method.startsWith(CALL_TOOL_PREFIX) ? method.substring(CALL_TOOL_PREFIX.length()) : method;
    return Single.fromCompletionStage(
            client.callTool(new CallToolRequest(toolName, new HashMap<>(params))).toFuture())
        .map(McpCommunicator::callResultToMap);
  }

  @VisibleForTesting
  Object connectionParams(String targetService) {
    String address = serviceUrl(targetService);
    if (transport == Transport.SSE) {
      return SseServerParameters.builder()
          .url(address)
          .sseEndpoint(String.valueOf(options.getOrDefault("sse_endpoint", "sse")))
          .headers(stringMapOption(options, "headers"))
          .build();
    }
    List<String> commandLine = splitCommandLine(address);
    if (commandLine.isEmpty()) {
      throw new ConfigurationException(
          "Empty command line for MCP stdio service '" + targetService + "'");
    }
    return ServerParameters.builder(commandLine.get(0))
        .args(commandLine.subList(1, commandLine.size()))
        .env(stringMapOption(options, "env"))
        .build();
  }

  @VisibleForTesting
  static ImmutableList<String> splitCommandLine(String commandLine) {
    return ImmutableList.copyOf(
        Splitter.on(' ').trimResults().omitEmptyStrings().split(commandLine));
  }

  static Map<String, Object> toolsToMap(ListToolsResult result) {
    List<Map<String, Object>> tools = new ArrayList<>();
    if (result.tools() != null) {
      for (Tool tool : result.tools()) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", tool.name());
        entry.put("description", tool.description());
        tools.add(entry);
      }
    }
    Map<String, Object> map = new HashMap<>();
    map.put("tools", tools);
    return map;
  }

  static Map<String, Object> callResultToMap(CallToolResult result) {
    List<Map<String, Object>> content = new ArrayList<>();
    if (result.content() != null) {
      for (Content item : result.content()) {
        Map<String, Object> entry = new LinkedHashMap<>();
        if (item instanceof TextContent textContent) {
          entry.put("type", "text");
          entry.put("text", textContent.text());
        } else if (item instanceof ImageContent imageContent) {
          entry.put("type", "image");
          entry.put("data", imageContent.data());
          entry.put("mime_type", imageContent.mimeType());
        } else {
          entry.put("type", "other");
          entry.put("value", String.valueOf(item));
        }
        content.add(entry);
      }
    }
    Map<String, Object> map = new HashMap<>();
    map.put("content", content);
    map.put("is_error", Boolean.TRUE.equals(result.isError()));
    return map;
  }

  private static Throwable mapError(
      Throwable error, String targetService, String method, Duration timeout) {
    if (error instanceof TimeoutException) {
      return new RequestTimeoutException(targetService, method, timeout);
    }
    if (error instanceof CommunicationException || error instanceof ConfigurationException) {
      return error;
    }
    return new CommunicationException(
        "MCP call '" + method + "' to service '" + targetService + "' failed: "
            + error.getMessage(),
        targetService,
        error);
  }

  private static Duration durationOption(
      Map<String, Object> options, String key, Duration fallback) {
    Object value = options.get(key);
    if (value == null) {
      return fallback;
    }
    try {
      double seconds =
          value instanceof Number
              ? ((Number) value).doubleValue()
              : Double.parseDouble(value.toString());
      return Duration.ofMillis(Math.round(seconds * 1000));
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid MCP option '" + key + "': " + value, e);
    }
  }

  private static ImmutableMap<String, String> stringMapOption(
      Map<String, Object> options, String key) {
    Object value = options.get(key);
    if (value == null) {
      return ImmutableMap.of();
    }
    if (!(value instanceof Map)) {
      throw new ConfigurationException("MCP option '" + key + "' must be a map");
    }
    ImmutableMap.Builder<String, String> map = ImmutableMap.builder();
    ((Map<?, ?>) value)
        .forEach(
            (k, v) -> {
              if (k != null && v != null) {
                map.put(k.toString(), v.toString());
              }
            });
    return map.buildKeepingLast();
  }

  /** Exposed for tests: the number of open sessions. */
  @VisibleForTesting
  int openSessions() {
    return sessionManager.size();
  }

  @Override
  public String toString() {
    return "McpCommunicator{agent=" + agentName + ", transport=" + transport.typeId() + "}";
  }
}
