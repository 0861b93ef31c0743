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

import static com.google.common.truth.Truth.assertThat;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.reactivex.rxjava3.subjects.CompletableSubject;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BackgroundTaskManagerTest {

  private final BackgroundTaskManager manager =
      new BackgroundTaskManager("owner", Schedulers.trampoline());

  @Test
  public void spawn_tracksTaskUntilItCompletes() {
    CompletableSubject work = CompletableSubject.create();

    TaskHandle task = manager.spawn("work", work);

    assertThat(manager.tasks()).containsExactly(task);
    work.onComplete();
    assertThat(manager.isEmpty()).isTrue();
    assertThat(task.status()).isEqualTo(TaskHandle.Status.COMPLETED);
  }

  @Test
  public void spawn_synchronouslyCompletingWork_isNotLeftTracked() {
    TaskHandle task = manager.spawn("instant", Completable.complete());

    assertThat(task.status()).isEqualTo(TaskHandle.Status.COMPLETED);
    assertThat(manager.size()).isEqualTo(0);
  }

  @Test
  public void spawn_failingWork_isRemovedAndReportsFailure() {
    IllegalStateException failure = new IllegalStateException("boom");

    TaskHandle task = manager.spawn("failing", Completable.error(failure));

    assertThat(manager.isEmpty()).isTrue();
    assertThat(task.status()).isEqualTo(TaskHandle.Status.FAILED);
    assertThat(task.failure()).hasValue(failure);
  }

  @Test
  public void spawn_workFailingWithCancellation_isReportedAsCancelled() {
    TaskHandle task =
        manager.spawn("cancelled", Completable.error(new CancellationException("cancelled")));

    assertThat(task.status()).isEqualTo(TaskHandle.Status.CANCELLED);
    assertThat(task.failure()).isEmpty();
  }

  @Test
  public void cancelAll_cancelsEveryTaskAndEmptiesSet() {
    List<TaskHandle> tasks = new ArrayList<>();
    AtomicBoolean disposed = new AtomicBoolean();
    tasks.add(manager.spawn("a", Completable.never()));
    tasks.add(manager.spawn("b", Completable.never().doOnDispose(() -> disposed.set(true))));
    tasks.add(manager.spawn("c", CompletableSubject.create()));

    manager.cancelAll().blockingAwait();

    assertThat(manager.isEmpty()).isTrue();
    assertThat(disposed.get()).isTrue();
    for (TaskHandle task : tasks) {
      assertThat(task.isCancelled()).isTrue();
    }
  }

  @Test
  public void cancelAll_withFinishedAndFailedTasks_completes() {
    TaskHandle done = manager.spawn("done", Completable.complete());
    TaskHandle failed = manager.spawn("failed", Completable.error(new IllegalStateException()));
    TaskHandle pending = manager.spawn("pending", Completable.never());

    manager.cancelAll().test().assertComplete();

    assertThat(done.status()).isEqualTo(TaskHandle.Status.COMPLETED);
    assertThat(failed.status()).isEqualTo(TaskHandle.Status.FAILED);
    assertThat(pending.status()).isEqualTo(TaskHandle.Status.CANCELLED);
    assertThat(manager.isEmpty()).isTrue();
  }

  @Test
  public void cancelAll_onEmptyManager_completes() {
    manager.cancelAll().test().assertComplete();
  }

  @Test
  public void cancelAll_interruptsBlockingWorkOnIoScheduler() throws InterruptedException {
    BackgroundTaskManager ioManager = new BackgroundTaskManager("owner", Schedulers.io());
    CompletableSubject started = CompletableSubject.create();
    TaskHandle task =
        ioManager.spawn(
            "sleeper",
            Completable.fromAction(
                () -> {
                  started.onComplete();
                  try {
                    Thread.sleep(60_000);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                }));
    assertThat(started.blockingAwait(5, TimeUnit.SECONDS)).isTrue();

    assertThat(ioManager.cancelAll().blockingAwait(5, TimeUnit.SECONDS)).isTrue();

    assertThat(task.isCancelled()).isTrue();
    assertThat(ioManager.isEmpty()).isTrue();
  }
}
