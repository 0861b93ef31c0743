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

import com.google.common.collect.ImmutableSet;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the background tasks owned by one agent so that teardown can cancel all of them.
 *
 * <p>A task is tracked from the moment it is spawned until it reaches a terminal status, whatever
 * that status is. After {@link #cancelAll()} completes no task is tracked.
 */
public final class BackgroundTaskManager {

  private static final Logger logger = LoggerFactory.getLogger(BackgroundTaskManager.class);

  private final String ownerName;
  private final Scheduler scheduler;
  private final Set<TaskHandle> tasks = ConcurrentHashMap.newKeySet();

  public BackgroundTaskManager(String ownerName, Scheduler scheduler) {
    this.ownerName = ownerName;
    this.scheduler = scheduler;
  }

  /**
   * Schedules {@code work} on this manager's scheduler and tracks it until it terminates.
   *
   * @param name a descriptive name used in logs.
   * @param work the unit of work; it starts on subscription.
   * @return the handle of the scheduled task.
   */
  public TaskHandle spawn(String name, Completable work) {
    TaskHandle handle = new TaskHandle(name, this::onFinished);
    // Tracked before subscribing, so that work finishing synchronously is still removed.
    tasks.add(handle);
    handle.subscribe(work, scheduler);
    return handle;
  }

  /**
   * Cancels every tracked task and waits for each to exit. A task blocked in synchronous work is
   * interrupted and only counts as terminated once that work returns, so this never completes
   * while cancelled work is still executing. Task failures are logged, never propagated.
   */
  public Completable cancelAll() {
    return Completable.defer(
        () -> {
          if (tasks.isEmpty()) {
            return Completable.complete();
          }
          List<Completable> terminations = new ArrayList<>();
          for (TaskHandle task : ImmutableSet.copyOf(tasks)) {
            task.cancel();
            terminations.add(task.awaitTermination());
          }
          logger
              .atDebug()
              .addKeyValue("agent_name", ownerName)
              .addKeyValue("event", "background_tasks_cancelled")
              .log("Cancelled {} background tasks", terminations.size());
          return Completable.merge(terminations).andThen(cancelAll());
        });
  }

  /** Number of tracked tasks. */
  public int size() {
    return tasks.size();
  }

  public boolean isEmpty() {
    return tasks.isEmpty();
  }

  /** Snapshot of the tracked tasks. */
  public ImmutableSet<TaskHandle> tasks() {
    return ImmutableSet.copyOf(tasks);
  }

  private void onFinished(TaskHandle task) {
    tasks.remove(task);
    task.failure()
        .ifPresent(
            error ->
                logger
                    .atWarn()
                    .addKeyValue("agent_name", ownerName)
                    .addKeyValue("event", "background_task_failed")
                    .addKeyValue("error", error.toString())
                    .setCause(error)
                    .log("Background task '{}' failed", task.name()));
  }
}
