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

package org.openmas.communication.http;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jspecify.annotations.Nullable;
import org.openmas.Telemetry;
import org.openmas.agents.AgentConfig;
import org.openmas.communication.BaseCommunicator;
import org.openmas.exceptions.CommunicationException;
import org.openmas.exceptions.ConfigurationException;
import org.openmas.exceptions.RequestTimeoutException;
import org.openmas.exceptions.ServiceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Communicator speaking JSON-RPC 2.0 over HTTP POST.
 *
 * <p>Outbound calls go through OkHttp to the URL configured for the target in {@code
 * service_urls}. Inbound calls are served by an embedded Spring MVC server, see {@link
 * JsonRpcController}, once at least one handler is registered and the communicator is started. The
 * listening port is the {@code port} option, else the port of this agent's own entry in {@code
 * service_urls}, else {@value #DEFAULT_PORT}.
 *
 * <p>Options: {@code port}, {@code host} (default {@value #DEFAULT_HOST}) and {@code
 * timeout_seconds} (default request timeout, 30 seconds).
 */
public class HttpCommunicator extends BaseCommunicator {

  private static final Logger logger = LoggerFactory.getLogger(HttpCommunicator.class);

  public static final int DEFAULT_PORT = 8000;
  public static final String DEFAULT_HOST = "0.0.0.0";
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private static final String TYPE_ID = "http";
  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final String host;
  private final int port;
  private final Duration defaultTimeout;

  private final Object serverLock = new Object();
  private @Nullable JsonRpcServer server;
  private volatile boolean started;

  public HttpCommunicator(AgentConfig config) {
    this(config.name(), config.serviceUrls(), config.communicatorOptions());
  }

  public HttpCommunicator(
      String agentName, Map<String, String> serviceUrls, Map<String, Object> options) {
    super(agentName, serviceUrls);
    this.host = stringOption(options, "host", DEFAULT_HOST);
    this.port = resolvePort(agentName, serviceUrls, options);
    this.defaultTimeout = timeoutOption(options);
    // Request timeouts are enforced per call, so OkHttp must not cut reads short on its own.
    this.client =
        new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(Duration.ZERO)
            .writeTimeout(Duration.ZERO)
            .build();
  }

  /** The configured listening port. Zero means an ephemeral port, see {@link #boundPort()}. */
  public int port() {
    return port;
  }

  public Duration defaultTimeout() {
    return defaultTimeout;
  }

  /** The port the inbound server is bound to, or -1 when it is not running. */
  public int boundPort() {
    synchronized (serverLock) {
      return server == null ? -1 : server.port();
    }
  }

  @Override
  public Completable start() {
    return Completable.fromAction(
        () -> {
          started = true;
          if (!handlers.isEmpty()) {
            startServer();
          }
          logger.debug("HTTP communicator for agent '{}' started", agentName);
        });
  }

  @Override
  public Completable stop() {
    return Completable.fromAction(
        () -> {
          started = false;
          stopServer();
          client.dispatcher().cancelAll();
          client.connectionPool().evictAll();
          logger.debug("HTTP communicator for agent '{}' stopped", agentName);
        });
  }

  @Override
  protected void onHandlerRegistered(String method) {
    if (started) {
      startServer();
    }
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
              Request request =
                  newRequest(
                      targetService,
                      JsonRpcCodec.encodeRequest(UUID.randomUUID().toString(), method, params));
              Telemetry.traceRequest(TYPE_ID, targetService, method);
              return execute(request, targetService, method, effectiveTimeout)
                  .map(body -> JsonRpcCodec.decodeResponse(body, targetService, method));
            })
        .timeout(effectiveTimeout.toNanos(), TimeUnit.NANOSECONDS, Schedulers.computation())
        .onErrorResumeNext(
            error ->
                Single.error(
                    error instanceof TimeoutException
                        ? new RequestTimeoutException(targetService, method, effectiveTimeout)
                        : error));
  }

  @Override
  public Completable sendNotification(
      String targetService, String method, Map<String, Object> params) {
    return Completable.fromAction(
        () -> {
          Request request =
              newRequest(targetService, JsonRpcCodec.encodeNotification(method, params));
          client
              .newCall(request)
              .enqueue(
                  new Callback() {
                    @Override
                    public void onFailure(Call call, IOException e) {
                      logger.warn(
                          "Notification '{}' to service '{}' failed", method, targetService, e);
                    }

                    @Override
                    public void onResponse(Call call, Response response) {
                      try (response) {
                        if (!response.isSuccessful()) {
                          logger.warn(
                              "Notification '{}' to service '{}' failed with HTTP {}",
                              method,
                              targetService,
                              response.code());
                        }
                      }
                    }
                  });
        });
  }

  private Request newRequest(String targetService, String json) {
    String url = serviceUrl(targetService);
    try {
      return new Request.Builder().url(url).post(RequestBody.create(json, JSON)).build();
    } catch (IllegalArgumentException e) {
      throw new CommunicationException(
          "Invalid URL '" + url + "' for service '" + targetService + "'", targetService, e);
    }
  }

  private Single<String> execute(
      Request request, String targetService, String method, Duration timeout) {
    return Single.create(
        emitter -> {
          Call call = client.newCall(request);
          emitter.setCancellable(call::cancel);
          call.enqueue(
              new Callback() {
                @Override
                public void onFailure(Call call, IOException e) {
                  emitter.tryOnError(mapFailure(e, targetService, method, timeout));
                }

                @Override
                public void onResponse(Call call, Response response) {
                  try (response) {
                    ResponseBody body = response.body();
                    String text = body == null ? "" : body.string();
                    if (!response.isSuccessful()) {
                      emitter.tryOnError(
                          new CommunicationException(
                              "Service '"
                                  + targetService
                                  + "' answered '"
                                  + method
                                  + "' with HTTP "
                                  + response.code(),
                              targetService,
                              Map.of("status_code", response.code(), "body", text),
                              null));
                      return;
                    }
                    emitter.onSuccess(text);
                  } catch (IOException e) {
                    emitter.tryOnError(mapFailure(e, targetService, method, timeout));
                  }
                }
              });
        });
  }

  private static RuntimeException mapFailure(
      IOException e, String targetService, String method, Duration timeout) {
    if (e instanceof ConnectException || e instanceof UnknownHostException) {
      ServiceNotFoundException notFound =
          new ServiceNotFoundException(
              "Service '" + targetService + "' is unreachable: " + e.getMessage(), targetService);
      notFound.initCause(e);
      return notFound;
    }
    if (e instanceof InterruptedIOException) {
      return new RequestTimeoutException(targetService, method, timeout);
    }
    return new CommunicationException(
        "Request '" + method + "' to service '" + targetService + "' failed: " + e.getMessage(),
        targetService,
        e);
  }

  private void startServer() {
    synchronized (serverLock) {
      if (server != null) {
        return;
      }
      JsonRpcServer jsonRpcServer;
      try {
        jsonRpcServer = JsonRpcServer.start(host, port, new JsonRpcController(agentName, handlers));
      } catch (UnknownHostException | RuntimeException e) {
        throw new CommunicationException(
            "Failed to start HTTP server for agent '" + agentName + "' on " + host + ":" + port,
            null,
            e);
      }
      server = jsonRpcServer;
      logger
          .atInfo()
          .addKeyValue("agent_name", agentName)
          .addKeyValue("event", "http_server_started")
          .log("Serving JSON-RPC on {}:{}", host, jsonRpcServer.port());
    }
  }

  private void stopServer() {
    synchronized (serverLock) {
      if (server != null) {
        server.close();
        server = null;
      }
    }
  }

  private static String stringOption(Map<String, Object> options, String key, String fallback) {
    Object value = options.get(key);
    return value == null ? fallback : value.toString();
  }

  private static Duration timeoutOption(Map<String, Object> options) {
    Object value = options.get("timeout_seconds");
    if (value == null) {
      return DEFAULT_TIMEOUT;
    }
    double seconds;
    try {
      seconds =
          value instanceof Number
              ? ((Number) value).doubleValue()
              : Double.parseDouble(value.toString());
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid HTTP option 'timeout_seconds': " + value, e);
    }
    if (!(seconds > 0)) {
      throw new ConfigurationException("HTTP option 'timeout_seconds' must be positive: " + value);
    }
    return Duration.ofMillis(Math.round(seconds * 1000));
  }

  private static int resolvePort(
      String agentName, Map<String, String> serviceUrls, Map<String, Object> options) {
    Object value = options.get("port");
    if (value != null) {
      try {
        int port =
            value instanceof Number
                ? ((Number) value).intValue()
                : Integer.parseInt(value.toString().trim());
        if (port < 0 || port > 65535) {
          throw new ConfigurationException("HTTP option 'port' is out of range: " + value);
        }
        return port;
      } catch (NumberFormatException e) {
        throw new ConfigurationException("Invalid HTTP option 'port': " + value, e);
      }
    }
    String ownUrl = serviceUrls.get(agentName);
    if (ownUrl != null) {
      try {
        int port = new URI(ownUrl).getPort();
        if (port != -1) {
          return port;
        }
      } catch (URISyntaxException e) {
        logger.warn("Ignoring malformed service URL '{}' of agent '{}'", ownUrl, agentName);
      }
    }
    return DEFAULT_PORT;
  }
}
