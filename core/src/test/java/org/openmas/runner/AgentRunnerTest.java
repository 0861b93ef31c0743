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

import static com.google.common.truth.Truth.assertThat;
import static org.openmas.testing.TestUtils.mockConfig;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.openmas.agents.LifecycleState;
import org.openmas.exceptions.LifecycleException;
import org.openmas.testing.MockCommunicator;
import org.openmas.testing.TestAgent;

@RunWith(JUnit4.class)
public final class AgentRunnerTest {

  private final MockCommunicator communicator = new MockCommunicator("runner-agent");

  @Test
  public void run_mainTaskCompletes_stopsAgent() {
    TestAgent agent = agentWithRun(Completable.complete());

    new AgentRunner(agent).run().blockingAwait(5, TimeUnit.SECONDS);

    assertThat(agent.state()).isEqualTo(LifecycleState.STOPPED);
    assertThat(agent.shutdownCount()).isEqualTo(1);
    assertThat(communicator.stopCount()).isEqualTo(1);
  }

  @Test
  public void requestShutdown_stopsLongRunningAgent() throws InterruptedException {
    TestAgent agent = agentWithRun(Completable.never());
    AgentRunner runner = new AgentRunner(agent);

    TestObserver<Void> observer = runner.run().test();
    assertThat(agent.state()).isEqualTo(LifecycleState.RUNNING);
    runner.requestShutdown();
    runner.requestShutdown();

    assertThat(observer.await(5, TimeUnit.SECONDS)).isTrue();
    observer.assertComplete();
    assertThat(agent.state()).isEqualTo(LifecycleState.STOPPED);
    assertThat(agent.mainTask().get().isCancelled()).isTrue();
  }

  @Test
  public void run_mainTaskFails_surfacesErrorAfterTeardown() throws InterruptedException {
    TestAgent agent = agentWithRun(Completable.error(new IllegalStateException("run broke")));

    TestObserver<Void> observer = new AgentRunner(agent).run().test();

    assertThat(observer.await(5, TimeUnit.SECONDS)).isTrue();
    observer.assertError(
        e -> e instanceof IllegalStateException && e.getMessage().equals("run broke"));
    assertThat(agent.state()).isEqualTo(LifecycleState.STOPPED);
    assertThat(agent.shutdownCount()).isEqualTo(1);
  }

  @Test
  public void run_startFails_surfacesLifecycleError() throws InterruptedException {
    communicator.failOnStart(new IllegalStateException("no socket"));
    TestAgent agent = agentWithRun(Completable.never());

    TestObserver<Void> observer = new AgentRunner(agent).run().test();

    assertThat(observer.await(5, TimeUnit.SECONDS)).isTrue();
    observer.assertError(
        e ->
            e instanceof LifecycleException
                && ((LifecycleException) e).phase()
                    == LifecycleException.Phase.COMMUNICATOR_START);
    assertThat(agent.state()).isEqualTo(LifecycleState.FAILED);
    assertThat(agent.runCount()).isEqualTo(0);
  }

  @Test
  public void installShutdownHook_isIdempotentAndReleasedAfterRun() {
    TestAgent agent = agentWithRun(Completable.complete());
    AgentRunner runner = new AgentRunner(agent);

    assertThat(runner.installShutdownHook(Duration.ofSeconds(1))).isSameInstanceAs(runner);
    assertThat(runner.installShutdownHook(Duration.ofSeconds(1))).isSameInstanceAs(runner);
    runner.run().blockingAwait(5, TimeUnit.SECONDS);

    assertThat(agent.state()).isEqualTo(LifecycleState.STOPPED);
  }

  private TestAgent agentWithRun(Completable run) {
    return new TestAgent(
        mockConfig("runner-agent"),
        communicator,
        Schedulers.io(),
        agent -> Completable.complete(),
        agent -> run,
        agent -> Completable.complete());
  }
}
