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

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.openmas.Telemetry;
import org.openmas.communication.Communicator;
import org.openmas.communication.CommunicatorRegistry;
import org.openmas.exceptions.ConfigurationException;
import org.openmas.exceptions.LifecycleException;
import org.openmas.exceptions.LifecycleException.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Base class for all agents. Drives the lifecycle {@code setup -> run -> shutdown} around a
 * {@link Communicator}.
 *
 * <p>{@link #start()} starts the communicator, runs {@link #setup()}, then schedules {@link
 * #run()} as the main task and completes without waiting for it. {@link #stop()} cancels the
 * background tasks and the main task, then always runs {@link #shutdown()} and stops the
 * communicator, whatever failed before.
 *
 * <p>A failure of {@code run()} does not stop the agent. The owner observes it through {@link
 * #mainTask()} and is responsible for calling {@link #stop()}; {@link
 * org.openmas.runner.AgentRunner} does both.
 */
public abstract class BaseAgent {

  private static final Logger logger = LoggerFactory.getLogger(BaseAgent.class);

  private final AgentConfig config;
  private final String name;
  private final Scheduler scheduler;
  private final BackgroundTaskManager backgroundTasks;

  private final Object stateLock = new Object();
  private LifecycleState state = LifecycleState.CREATED;
  private Communicator communicator;
  private @Nullable TaskHandle mainTask;

  /**
   * Creates an agent whose communicator is resolved from {@code registry} using {@link
   * AgentConfig#communicatorType()}.
   *
   * <p>If the type is unknown and the configuration lists extension paths, plugins are
   * discovered from those paths and resolution is retried once.
   *
   * @throws ConfigurationException if the communicator type is unknown.
   * @throws org.openmas.exceptions.DependencyException if the communicator needs a missing
   *     optional library.
   */
  protected BaseAgent(AgentConfig config, CommunicatorRegistry registry) {
    this(config, registry, null, Schedulers.io());
  }

  /**
   * @param name overrides {@link AgentConfig#name()} when not null.
   * @param scheduler runs the main task and the background tasks.
   */
  protected BaseAgent(
      AgentConfig config,
      CommunicatorRegistry registry,
      @Nullable String name,
      Scheduler scheduler) {
    this.config = withName(config, name);
    this.name = this.config.name();
    this.scheduler = scheduler;
    this.backgroundTasks = new BackgroundTaskManager(this.name, scheduler);
    this.communicator = resolveCommunicator(this.config, registry);
    logInitialized();
  }

  /** Creates an agent around an explicit communicator, bypassing any registry. */
  protected BaseAgent(AgentConfig config, Communicator communicator) {
    this(config, communicator, Schedulers.io());
  }

  protected BaseAgent(AgentConfig config, Communicator communicator, Scheduler scheduler) {
    this.config = config;
    this.name = config.name();
    this.scheduler = scheduler;
    this.backgroundTasks = new BackgroundTaskManager(name, scheduler);
    this.communicator = communicator;
    logInitialized();
  }

  /** One-time initialization, typically registering handlers. Runs before {@link #run()}. */
  protected abstract Completable setup();

  /**
   * Steady-state behaviour. May run until cancelled or complete on its own; completing is a
   * normal termination and is not restarted.
   */
  protected abstract Completable run();

  /** Releases resources. Must tolerate a {@link #run()} that failed or never got far. */
  protected abstract Completable shutdown();

  public String name() {
    return name;
  }

  public AgentConfig config() {
    return config;
  }

  public Communicator communicator() {
    synchronized (stateLock) {
      return communicator;
    }
  }

  public LifecycleState state() {
    synchronized (stateLock) {
      return state;
    }
  }

  /** The task running {@link #run()}, once the agent has started. */
  public Optional<TaskHandle> mainTask() {
    synchronized (stateLock) {
      return Optional.ofNullable(mainTask);
    }
  }

  /** The background tasks currently owned by this agent. */
  public BackgroundTaskManager backgroundTasks() {
    return backgroundTasks;
  }

  /**
   * Replaces the communicator. Only allowed while the agent is not running.
   *
   * @throws LifecycleException if the agent is starting, running or stopping.
   */
  public void setCommunicator(Communicator communicator) {
    synchronized (stateLock) {
      if (!state.isIdle()) {
        throw new LifecycleException(
            Phase.RECONFIGURE,
            "Cannot replace the communicator of agent '" + name + "' while it is " + state);
      }
      this.communicator = communicator;
    }
  }

  /**
   * Schedules {@code work} as a background task of this agent. It is cancelled when the agent
   * stops.
   *
   * @throws LifecycleException unless the agent is starting or running.
   */
  public TaskHandle spawn(String taskName, Completable work) {
    synchronized (stateLock) {
      if (state != LifecycleState.STARTING && state != LifecycleState.RUNNING) {
        throw new LifecycleException(
            Phase.RUN,
            "Cannot spawn task '" + taskName + "' on agent '" + name + "' while it is " + state);
      }
      return backgroundTasks.spawn(taskName, work);
    }
  }

  /**
   * Starts the agent. Completes once {@link #run()} is scheduled.
   *
   * <p>Fails with {@link LifecycleException} if the agent is not {@code CREATED} or {@code
   * STOPPED}, if the communicator fails to start, or if {@link #setup()} fails. In the last case
   * the communicator is stopped before the error is delivered. Any failure leaves the agent
   * {@code FAILED}.
   */
  public Completable start() {
    return Completable.defer(
        () -> {
          Communicator activeCommunicator;
          synchronized (stateLock) {
            if (!state.canStart()) {
              return Completable.error(
                  new LifecycleException(
                      Phase.START,
                      "Agent '" + name + "' cannot be started: it is " + state));
            }
            state = LifecycleState.STARTING;
            activeCommunicator = communicator;
          }
          logEvent(Level.INFO, "agent_starting", null, "Starting agent '{}'", name);
          Span span = Telemetry.startLifecycleSpan("agent_start", name);
          try (Scope scope = span.makeCurrent()) {
            Completable startCommunicator =
                Completable.defer(activeCommunicator::start)
                    .onErrorResumeNext(
                        error ->
                            fail(Phase.COMMUNICATOR_START, "Communicator failed to start", error));
            Completable runSetup =
                Completable.defer(this::setup)
                    .onErrorResumeNext(
                        error ->
                            backgroundTasks
                                .cancelAll()
                                .andThen(stopCommunicatorQuietly(activeCommunicator))
                                .andThen(fail(Phase.SETUP, "Setup failed", error)));
            return startCommunicator
                .andThen(runSetup)
                .andThen(Completable.fromAction(this::enterRunning))
                .doOnComplete(span::end)
                .doOnError(error -> Telemetry.endWithError(span, error))
                .doOnDispose(
                    () -> {
                      span.end();
                      abandonStart(activeCommunicator);
                    });
          }
        });
  }

  /**
   * Stops the agent. A no-op unless the agent is {@code RUNNING}.
   *
   * <p>Cancels the background tasks and the main task and waits for them to exit, then runs {@link
   * #shutdown()} and stops the communicator. Each of those waits is bounded by {@link
   * AgentConfig#shutdownTimeout()}. Timeouts and failures are logged and never delivered, so the
   * agent always reaches {@code STOPPED}.
   *
   * <p>Fails with {@link LifecycleException} only if the agent is still starting.
   */
  public Completable stop() {
    return Completable.defer(
        () -> {
          Communicator activeCommunicator;
          TaskHandle activeMainTask;
          synchronized (stateLock) {
            if (state == LifecycleState.STARTING) {
              return Completable.error(
                  new LifecycleException(
                      Phase.STOP, "Agent '" + name + "' cannot be stopped while starting"));
            }
            if (state != LifecycleState.RUNNING) {
              return Completable.complete();
            }
            state = LifecycleState.STOPPING;
            activeCommunicator = communicator;
            activeMainTask = mainTask;
          }
          logEvent(Level.INFO, "agent_stopping", null, "Stopping agent '{}'", name);
          Span span = Telemetry.startLifecycleSpan("agent_stop", name);
          try (Scope scope = span.makeCurrent()) {
            return awaitCancellation(backgroundTasks.cancelAll(), "background tasks")
                .andThen(awaitCancellation(cancelMainTask(activeMainTask), "run task"))
                .andThen(runShutdownQuietly())
                .andThen(stopCommunicatorQuietly(activeCommunicator))
                .andThen(
                    Completable.fromAction(
                        () -> {
                          transition(LifecycleState.STOPPED);
                          logEvent(Level.INFO, "agent_stopped", null, "Agent '{}' stopped", name);
                        }))
                .doFinally(span::end);
          }
        });
  }

  private void enterRunning() {
    TaskHandle task = new TaskHandle("run", this::onMainTaskFinished);
    synchronized (stateLock) {
      state = LifecycleState.RUNNING;
      mainTask = task;
    }
    logEvent(Level.INFO, "agent_started", null, "Agent '{}' started", name);
    task.subscribe(Completable.defer(this::run), scheduler);
  }

  private void onMainTaskFinished(TaskHandle task) {
    switch (task.status()) {
      case COMPLETED:
        logEvent(Level.INFO, "run_completed", null, "Agent '{}' run completed", name);
        break;
      case CANCELLED:
        logEvent(Level.DEBUG, "run_cancelled", null, "Agent '{}' run cancelled", name);
        break;
      case FAILED:
        logEvent(
            Level.ERROR,
            "run_failed",
            task.failure().orElse(null),
            "Agent '{}' run failed",
            name);
        break;
      default:
        break;
    }
  }

  private Completable fail(Phase phase, String message, Throwable cause) {
    return Completable.defer(
        () -> {
          transition(LifecycleState.FAILED);
          logEvent(
              Level.ERROR, "start_failed", cause, "Agent '{}' failed to start ({})", name, phase);
          return Completable.error(
              new LifecycleException(
                  phase, message + " for agent '" + name + "': " + cause.getMessage(), cause));
        });
  }

  /** The subscriber of {@link #start()} went away before the agent was running. */
  private void abandonStart(Communicator activeCommunicator) {
    synchronized (stateLock) {
      if (state != LifecycleState.STARTING) {
        return;
      }
      state = LifecycleState.FAILED;
    }
    logEvent(Level.WARN, "start_failed", null, "Start of agent '{}' was cancelled", name);
    backgroundTasks
        .cancelAll()
        .andThen(stopCommunicatorQuietly(activeCommunicator))
        .subscribe();
  }

  private static Completable cancelMainTask(@Nullable TaskHandle task) {
    if (task == null) {
      return Completable.complete();
    }
    return Completable.defer(
        () -> {
          task.cancel();
          return task.awaitTermination();
        });
  }

  /** Waits for cancelled work to exit, giving up after the shutdown timeout. */
  private Completable awaitCancellation(Completable termination, String what) {
    return bounded(termination)
        .onErrorResumeNext(
            error -> {
              logEvent(
                  Level.WARN,
                  "task_cancel_timeout",
                  error,
                  "Cancelled {} of agent '{}' did not exit{}",
                  what,
                  name,
                  describeTimeout(error));
              return Completable.complete();
            });
  }

  private Completable runShutdownQuietly() {
    return bounded(Completable.defer(this::shutdown))
        .onErrorResumeNext(
            error -> {
              logEvent(
                  Level.ERROR,
                  "shutdown_failed",
                  error,
                  "Shutdown of agent '{}' failed{}",
                  name,
                  describeTimeout(error));
              return Completable.complete();
            });
  }

  private Completable stopCommunicatorQuietly(Communicator activeCommunicator) {
    return bounded(Completable.defer(activeCommunicator::stop))
        .onErrorResumeNext(
            error -> {
              logEvent(
                  Level.ERROR,
                  "communicator_stop_failed",
                  error,
                  "Stopping the communicator of agent '{}' failed{}",
                  name,
                  describeTimeout(error));
              return Completable.complete();
            });
  }

  /** Applies the shutdown timeout. A zero timeout means no bound. */
  private Completable bounded(Completable completable) {
    Duration timeout = config.shutdownTimeout();
    if (timeout.isZero()) {
      return completable;
    }
    return completable.timeout(timeout.toNanos(), TimeUnit.NANOSECONDS, Schedulers.computation());
  }

  private String describeTimeout(Throwable error) {
    return error instanceof TimeoutException
        ? " (timed out after " + config.shutdownTimeout().toMillis() + " ms)"
        : "";
  }

  private void transition(LifecycleState next) {
    synchronized (stateLock) {
      state = next;
    }
  }

  private void logInitialized() {
    logger
        .atDebug()
        .addKeyValue("agent_name", name)
        .addKeyValue("event", "agent_initialized")
        .addKeyValue("communicator_type", config.communicatorType())
        .addKeyValue("log_level", config.logLevel())
        .log("Initialized agent '{}'", name);
  }

  private void logEvent(
      Level level, String event, @Nullable Throwable error, String message, Object... args) {
    LoggingEventBuilder builder =
        logger.atLevel(level).addKeyValue("agent_name", name).addKeyValue("event", event);
    if (error != null) {
      builder = builder.addKeyValue("error", error.toString()).setCause(error);
    }
    builder.log(message, args);
  }

  private static AgentConfig withName(AgentConfig config, @Nullable String name) {
    return name == null ? config : config.toBuilder().setName(name).build();
  }

  private static Communicator resolveCommunicator(
      AgentConfig config, CommunicatorRegistry registry) {
    String type = config.communicatorType();
    if (!registry.contains(type) && !config.extensionPaths().isEmpty()) {
      logger.info(
          "Communicator type '{}' is not registered; discovering plugins in {}",
          type,
          config.extensionPaths());
      registry.discoverPlugins(config.extensionPaths());
    }
    return registry.resolve(config);
  }
}
