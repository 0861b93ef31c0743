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

package org.openmas;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for tracing agent lifecycle transitions and outbound requests with
 * OpenTelemetry. When the host application does not install an SDK the global no-op tracer is
 * used and every call here is free.
 */
public final class Telemetry {

  private static final Logger log = LoggerFactory.getLogger(Telemetry.class);
  private static final String INSTRUMENTATION_NAME = "org.openmas";

  private Telemetry() {}

  /** Returns the tracer used by the framework. */
  public static Tracer getTracer() {
    return GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME, Version.OPENMAS_VERSION);
  }

  /**
   * Starts a span for a lifecycle phase of an agent, e.g. {@code agent_start [worker]}.
   *
   * @param phase the lifecycle phase, used as the span name prefix.
   * @param agentName the name of the agent.
   * @return the started span; the caller must end it.
   */
  public static Span startLifecycleSpan(String phase, String agentName) {
    return getTracer()
        .spanBuilder(phase + " [" + agentName + "]")
        .setAttribute("openmas.agent.name", agentName)
        .startSpan();
  }

  /**
   * Records outbound request attributes on the current span, if there is one.
   *
   * @param communicatorType the registry type id of the communicator.
   * @param target the target service name.
   * @param method the remote method.
   */
  public static void traceRequest(String communicatorType, String target, String method) {
    Span span = Span.current();
    if (span == null || !span.getSpanContext().isValid()) {
      log.trace("traceRequest: No valid span in current context.");
      return;
    }
    span.setAttribute("openmas.communicator.type", communicatorType);
    span.setAttribute("openmas.request.target", target);
    span.setAttribute("openmas.request.method", method);
  }

  /** Marks {@code span} as failed with {@code error} and ends it. */
  public static void endWithError(Span span, Throwable error) {
    span.recordException(error);
    span.setStatus(StatusCode.ERROR, String.valueOf(error.getMessage()));
    span.end();
  }
}
