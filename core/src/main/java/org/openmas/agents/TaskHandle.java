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

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.CompletableObserver;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subjects.CompletableSubject;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle to a unit of work scheduled by an agent: either its main {@code run()} task or a
 * background task created through {@link BaseAgent#spawn(String, Completable)}.
 *
 * <p>A handle reaches exactly one terminal status, and only once the work has returned. While the
 * work is still executing its synchronous part, {@link #cancel()} interrupts the executing thread
 * and the handle stays {@link Status#RUNNING} until that part exits. Once the synchronous part has
 * returned, cancelling disposes the pending asynchronous part. Work that reacts to cancellation
 * by failing with {@link CancellationException} or {@link InterruptedException} is reported as
 * cancelled rather than failed.
 */
public final class TaskHandle {

  private static final Logger logger = LoggerFactory.getLogger(TaskHandle.class);

  /** Status of a task. Every status other than {@link #RUNNING} is terminal. */
  public enum Status {
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
  }

  private final String name;
  private final Consumer<TaskHandle> onFinish;
  private final AtomicReference<Status> status = new AtomicReference<>(Status.RUNNING);
  private final CompletableSubject completion = CompletableSubject.create();
  private final Object lock = new Object();
  private volatile @Nullable Throwable failure;

  // Guarded by lock.
  private boolean cancelRequested;
  private boolean started;
  private boolean runnerInterrupted;
  private @Nullable Thread runner;
  private @Nullable Disposable scheduled;
  private @Nullable Disposable upstream;

  TaskHandle(String name, Consumer<TaskHandle> onFinish) {
    this.name = name;
    this.onFinish = onFinish;
  }

  /** Schedules {@code work} on {@code scheduler}. Called once, after the handle is tracked. */
  void subscribe(Completable work, Scheduler scheduler) {
    synchronized (lock) {
      if (cancelRequested) {
        return;
      }
    }
    Disposable task = scheduler.scheduleDirect(() -> execute(work));
    synchronized (lock) {
      if (!started) {
        scheduled = task;
      }
    }
  }

  private void execute(Completable work) {
    boolean cancelledBeforeStart;
    synchronized (lock) {
      started = true;
      cancelledBeforeStart = cancelRequested;
      if (!cancelledBeforeStart) {
        runner = Thread.currentThread();
      }
    }
    if (cancelledBeforeStart) {
      finish(Status.CANCELLED, null);
      return;
    }
    try {
      work.subscribe(new TaskObserver());
    } catch (RuntimeException e) {
      finish(Status.FAILED, e);
    } finally {
      Disposable pending = null;
      boolean cancelNow;
      synchronized (lock) {
        runner = null;
        if (runnerInterrupted) {
          // The flag must not leak into the scheduler's pool.
          Thread.interrupted();
          runnerInterrupted = false;
        }
        cancelNow = cancelRequested && !isDone();
        if (cancelNow) {
          pending = upstream;
        }
      }
      if (pending != null) {
        pending.dispose();
      }
      if (cancelNow) {
        finish(Status.CANCELLED, null);
      }
    }
  }

  public String name() {
    return name;
  }

  public Status status() {
    return status.get();
  }

  public boolean isDone() {
    return status.get() != Status.RUNNING;
  }

  public boolean isCancelled() {
    return status.get() == Status.CANCELLED;
  }

  /** The error the task failed with, if its status is {@link Status#FAILED}. */
  public Optional<Throwable> failure() {
    return Optional.ofNullable(failure);
  }

  /**
   * Requests cancellation. Has no effect on a task that already reached a terminal status or whose
   * cancellation was already requested. The handle becomes {@link Status#CANCELLED} once the work
   * has returned; observe {@link #awaitTermination()} to wait for that.
   *
   * @return whether this call requested the cancellation.
   */
  public boolean cancel() {
    Disposable toDispose = null;
    boolean finishNow = false;
    synchronized (lock) {
      if (isDone() || cancelRequested) {
        return false;
      }
      cancelRequested = true;
      if (!started) {
        toDispose = scheduled;
        finishNow = true;
      } else if (runner != null) {
        if (runner != Thread.currentThread()) {
          runner.interrupt();
          runnerInterrupted = true;
        }
      } else {
        toDispose = upstream;
        finishNow = true;
      }
    }
    if (toDispose != null) {
      toDispose.dispose();
    }
    if (finishNow) {
      finish(Status.CANCELLED, null);
    }
    return true;
  }

  /** Whether {@link #cancel()} was called before the task terminated on its own. */
  public boolean isCancellationRequested() {
    synchronized (lock) {
      return cancelRequested;
    }
  }

  /**
   * Completes when the task completes or is cancelled, and fails with the task's error when it
   * fails.
   */
  public Completable completion() {
    return completion.hide();
  }

  /** Completes when the task reaches any terminal status. Never fails. */
  public Completable awaitTermination() {
    return completion.onErrorComplete();
  }

  private boolean finish(Status terminal, @Nullable Throwable error) {
    if (!status.compareAndSet(Status.RUNNING, terminal)) {
      return false;
    }
    failure = error;
    onFinish.accept(this);
    if (error != null) {
      completion.onError(error);
    } else {
      completion.onComplete();
    }
    return true;
  }

  static boolean isCancellation(Throwable error) {
    return error instanceof CancellationException || error instanceof InterruptedException;
  }

  @Override
  public String toString() {
    return "TaskHandle{name=" + name + ", status=" + status.get() + "}";
  }

  /**
   * Clears an interrupt raised by {@link #cancel()} on the executing thread before terminal
   * callbacks run, so that whatever observes the handle does not run interrupted.
   */
  private void clearCancellationInterrupt() {
    synchronized (lock) {
      if (runnerInterrupted && runner == Thread.currentThread()) {
        Thread.interrupted();
        runnerInterrupted = false;
      }
    }
  }

  private final class TaskObserver implements CompletableObserver {

    @Override
    public void onSubscribe(Disposable d) {
      synchronized (lock) {
        upstream = d;
      }
    }

    @Override
    public void onComplete() {
      clearCancellationInterrupt();
      finish(isCancellationRequested() ? Status.CANCELLED : Status.COMPLETED, null);
    }

    @Override
    public void onError(Throwable error) {
      clearCancellationInterrupt();
      if (isCancellation(error)) {
        finish(Status.CANCELLED, null);
      } else if (isCancellationRequested()) {
        logger
            .atWarn()
            .addKeyValue("task_name", name)
            .addKeyValue("event", "task_failed_after_cancel")
            .addKeyValue("error", error.toString())
            .setCause(error)
            .log("Task '{}' failed while being cancelled", name);
        finish(Status.CANCELLED, null);
      } else {
        finish(Status.FAILED, error);
      }
    }
  }
}
