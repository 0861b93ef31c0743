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
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TaskHandleTest {

  private final List<TaskHandle> finished = new ArrayList<>();

  @Test
  public void cancel_beforeSubscribe_disposesWorkOnSubscribe() {
    TaskHandle task = new TaskHandle("early", finished::add);
    CompletableSubject work = CompletableSubject.create();

    assertThat(task.cancel()).isTrue();
    task.subscribe(work, Schedulers.trampoline());

    assertThat(work.hasObservers()).isFalse();
    assertThat(task.isCancelled()).isTrue();
    assertThat(finished).containsExactly(task);
  }

  @Test
  public void cancel_afterCompletion_hasNoEffect() {
    TaskHandle task = new TaskHandle("done", finished::add);
    task.subscribe(Completable.complete(), Schedulers.trampoline());

    assertThat(task.cancel()).isFalse();
    assertThat(task.status()).isEqualTo(TaskHandle.Status.COMPLETED);
    assertThat(finished).hasSize(1);
  }

  @Test
  public void completion_failsWithTaskError_awaitTerminationDoesNot() {
    IllegalStateException failure = new IllegalStateException("boom");
    TaskHandle task = new TaskHandle("failing", finished::add);
    task.subscribe(Completable.error(failure), Schedulers.trampoline());

    task.completion().test().assertError(failure);
    task.awaitTermination().test().assertComplete();
    assertThat(task.isDone()).isTrue();
  }

  @Test
  public void interruptedWork_isReportedAsCancelled() {
    TaskHandle task = new TaskHandle("interrupted", finished::add);

    task.subscribe(Completable.error(new InterruptedException()), Schedulers.trampoline());

    assertThat(task.status()).isEqualTo(TaskHandle.Status.CANCELLED);
    task.completion().test().assertComplete();
  }

  @Test
  public void runningTask_isNotDone() {
    TaskHandle task = new TaskHandle("pending", finished::add);

    task.subscribe(Completable.never(), Schedulers.trampoline());

    assertThat(task.isDone()).isFalse();
    assertThat(task.status()).isEqualTo(TaskHandle.Status.RUNNING);
    task.awaitTermination().test().assertNotComplete();
    assertThat(finished).isEmpty();
  }

  @Test
  public void cancel_whileWorkBlocks_staysRunningUntilWorkExits() throws InterruptedException {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    TaskHandle task = new TaskHandle("blocking", finished::add);
    task.subscribe(
        Completable.fromAction(
            () -> {
              started.countDown();
              try {
                Thread.sleep(60_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
                release.await(5, TimeUnit.SECONDS);
                throw e;
              }
            }),
        Schedulers.io());
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(task.cancel()).isTrue();
    assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();

    assertThat(task.status()).isEqualTo(TaskHandle.Status.RUNNING);
    assertThat(task.isCancellationRequested()).isTrue();
    assertThat(task.cancel()).isFalse();
    release.countDown();
    assertThat(task.awaitTermination().blockingAwait(5, TimeUnit.SECONDS)).isTrue();
    assertThat(task.status()).isEqualTo(TaskHandle.Status.CANCELLED);
    assertThat(finished).containsExactly(task);
  }

  @Test
  public void cancel_afterSynchronousPartReturned_disposesPendingWork() {
    AtomicBoolean disposed = new AtomicBoolean();
    TaskHandle task = new TaskHandle("pending", finished::add);
    task.subscribe(
        Completable.never().doOnDispose(() -> disposed.set(true)), Schedulers.trampoline());

    assertThat(task.cancel()).isTrue();

    assertThat(disposed.get()).isTrue();
    assertThat(task.status()).isEqualTo(TaskHandle.Status.CANCELLED);
    task.completion().test().assertComplete();
  }

  @Test
  public void workFailingAfterCancellation_isReportedAsCancelled() {
    TaskHandle task = new TaskHandle("cleanup-fails", finished::add);
    task.subscribe(
        Completable.fromAction(() -> task.cancel()).andThen(Completable.error(new IOException())),
        Schedulers.trampoline());

    assertThat(task.status()).isEqualTo(TaskHandle.Status.CANCELLED);
    assertThat(task.failure()).isEmpty();
    assertThat(finished).containsExactly(task);
  }
}
