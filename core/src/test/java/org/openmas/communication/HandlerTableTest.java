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

package org.openmas.communication;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import io.reactivex.rxjava3.core.Single;
import java.util.Map;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.openmas.exceptions.MethodNotFoundException;

@RunWith(JUnit4.class)
public final class HandlerTableTest {

  private final HandlerTable table = new HandlerTable("agent");

  @Test
  public void dispatch_invokesRegisteredHandler() {
    table.register("echo", params -> Single.just(params));

    Map<String, Object> result = table.dispatch("echo", ImmutableMap.of("x", 1)).blockingGet();

    assertThat(result).containsExactly("x", 1);
  }

  @Test
  public void register_twice_replacesPreviousHandler() {
    table.register("m", params -> Single.just(ImmutableMap.of("v", "first")));
    table.register("m", params -> Single.just(ImmutableMap.of("v", "second")));

    assertThat(table.dispatch("m", Map.of()).blockingGet()).containsExactly("v", "second");
    assertThat(table.methods()).containsExactly("m");
  }

  @Test
  public void dispatch_unknownMethod_failsWithMethodNotFound() {
    table.dispatch("missing", Map.of()).test().assertError(MethodNotFoundException.class);
  }

  @Test
  public void dispatch_handlerThrowing_becomesError() {
    table.register(
        "explode",
        params -> {
          throw new IllegalStateException("boom");
        });

    table.dispatch("explode", Map.of()).test().assertError(IllegalStateException.class);
  }

  @Test
  public void register_emptyMethod_fails() {
    assertThrows(
        IllegalArgumentException.class,
        () -> table.register("", params -> Single.just(Map.of())));
  }
}
