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

import io.modelcontextprotocol.client.McpAsyncClient;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema.ClientCapabilities;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one initialized MCP client session per target service. Sessions open on first use; a
 * session whose initialization fails is discarded so the next call retries.
 */
public class McpSessionManager {

  private static final Logger logger = LoggerFactory.getLogger(McpSessionManager.class);

  private final McpTransportBuilder transportBuilder;
  private final Duration initializationTimeout;
  private final Duration requestTimeout;
  private final Map<String, Session> sessions = new ConcurrentHashMap<>();

  public McpSessionManager(
      McpTransportBuilder transportBuilder,
      Duration initializationTimeout,
      Duration requestTimeout) {
    this.transportBuilder = transportBuilder;
    this.initializationTimeout = initializationTimeout;
    this.requestTimeout = requestTimeout;
  }

  /** Returns the initialized session for {@code target}, opening it if needed. */
  public Single<McpAsyncClient> session(String target, Object connectionParams) {
    return Single.defer(
        () -> {
          Session session =
              sessions.computeIfAbsent(target, unused -> open(target, connectionParams));
          return session.ready.doOnError(
              error -> {
                if (sessions.remove(target, session)) {
                  session.client.close();
                }
              });
        });
  }

  /** Number of open (or opening) sessions. */
  public int size() {
    return sessions.size();
  }

  /** Closes every session. Failures are logged; this never fails. */
  public Completable closeAll() {
    return Completable.defer(
        () -> {
          List<Completable> closes = new ArrayList<>();
          for (String target : List.copyOf(sessions.keySet())) {
            Session session = sessions.remove(target);
            if (session != null) {
              closes.add(close(target, session));
            }
          }
          return Completable.merge(closes);
        });
  }

  private Session open(String target, Object connectionParams) {
    McpClientTransport transport = transportBuilder.build(connectionParams);
    McpAsyncClient client =
        McpClient.async(transport)
            .initializationTimeout(initializationTimeout)
            .requestTimeout(requestTimeout)
            .capabilities(ClientCapabilities.builder().build())
            .build();
    Single<McpAsyncClient> ready =
        Single.defer(() -> Single.fromCompletionStage(client.initialize().toFuture()))
            .doOnSuccess(
                result -> logger.debug("Initialized MCP session to '{}': {}", target, result))
            .map(unused -> client)
            .cache();
    return new Session(client, ready);
  }

  private static Completable close(String target, Session session) {
    return Completable.defer(
            () -> Completable.fromCompletionStage(session.client.closeGracefully().toFuture()))
        .timeout(5, TimeUnit.SECONDS)
        .doOnError(
            error -> {
              logger.warn("Failed to close MCP session to '{}' gracefully", target, error);
              session.client.close();
            })
        .onErrorComplete();
  }

  private static final class Session {
    final McpAsyncClient client;
    final Single<McpAsyncClient> ready;

    Session(McpAsyncClient client, Single<McpAsyncClient> ready) {
      this.client = client;
      this.ready = ready;
    }
  }
}
