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

package org.openmas.runner;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.subjects.CompletableSubject;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.openmas.agents.BaseAgent;
import org.openmas.agents.TaskHandle;
import org.openmas.exceptions.LifecycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns an agent for the duration of one run: starts it, waits until its main task ends or a
 * shutdown is requested, then stops it.
 *
 * <p>The {@link Completable} returned by {@link #run()} completes after the agent has stopped. If
 * the agent's {@code run()} hook failed, it fails with that error, still after teardown.
 */
public final class AgentRunner {

  private static final Logger logger = LoggerFactory.getLogger(AgentRunner.class);

  private final BaseAgent agent;
  private final CompletableSubject shutdownRequested = CompletableSubject.create();
  private final CompletableSubject terminated = CompletableSubject.create();
  private volatile boolean running;
  private @Nullable Thread shutdownHook;

  public AgentRunner(BaseAgent agent) {
    this.agent = agent;
  }

  public BaseAgent agent() {
    return agent;
  }

  /** Starts the agent and stops it once its main task ends or {@link #requestShutdown()}. */
  public Completable run() {
    return agent
        .start()
        .doOnSubscribe(unused -> running = true)
        .andThen(
            Completable.defer(
                () -> {
                  TaskHandle mainTask =
                      agent
                          .mainTask()
                          .orElseThrow(
                              () ->
                                  new LifecycleException(
                                      LifecycleException.Phase.RUN,
                                      "Agent '" + agent.name() + "' has no main task"));
                  return Completable.ambArray(mainTask.awaitTermination(), shutdownRequested)
                      .andThen(agent.stop())
                      .andThen(
                          Completable.defer(
                              () ->
                                  mainTask
                                      .failure()
                                      .map(error -> Completable.error(error))
                                      .orElse(Completable.complete())));
                }))
        .doFinally(
            () -> {
              removeShutdownHook();
              terminated.onComplete();
            });
  }

  /** Asks a running {@link #run()} to stop the agent. Safe to call more than once. */
  public void requestShutdown() {
    if (!shutdownRequested.hasComplete()) {
      logger.info("Shutdown requested for agent '{}'", agent.name());
      shutdownRequested.onComplete();
    }
  }

  /**
   * Installs a JVM shutdown hook that stops the agent, waiting at most {@code timeout}. The hook
   * is removed when {@link #run()} terminates.
   */
  @CanIgnoreReturnValue
  public synchronized AgentRunner installShutdownHook(Duration timeout) {
    if (shutdownHook != null) {
      return this;
    }
    Thread hook =
        new Thread(
            () -> {
              requestShutdown();
              Completable teardown = running ? terminated.onErrorComplete() : agent.stop();
              if (!teardown.blockingAwait(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn(
                    "Agent '{}' did not stop within {} ms of JVM shutdown",
                    agent.name(),
                    timeout.toMillis());
              }
            },
            "openmas-shutdown-" + agent.name());
    Runtime.getRuntime().addShutdownHook(hook);
    shutdownHook = hook;
    return this;
  }

  private synchronized void removeShutdownHook() {
    if (shutdownHook == null) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException e) {
      logger.debug("JVM is already shutting down; keeping the shutdown hook", e);
    }
    shutdownHook = null;
  }
}
