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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** Parameters for connecting to an MCP server over Server-Sent Events. */
@AutoValue
public abstract class SseServerParameters {

  /** Base URL of the server. */
  public abstract String url();

  /** Endpoint of the SSE stream, relative to {@link #url()}. */
  public abstract String sseEndpoint();

  /** Headers added to every HTTP request. */
  public abstract ImmutableMap<String, String> headers();

  public static Builder builder() {
    return new AutoValue_SseServerParameters.Builder()
        .sseEndpoint("sse")
        .headers(ImmutableMap.of());
  }

  /** Builder for {@link SseServerParameters}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder url(String url);

    public abstract Builder sseEndpoint(String sseEndpoint);

    public abstract Builder headers(Map<String, String> headers);

    public abstract SseServerParameters build();
  }
}
