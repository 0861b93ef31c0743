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

import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;

/**
 * Opens an HTTP SSE transport for {@link SseServerParameters} and launches a subprocess speaking
 * stdio for the SDK's {@link ServerParameters}.
 */
public class DefaultMcpTransportBuilder implements McpTransportBuilder {

  @Override
  public McpClientTransport build(Object connectionParams) {
    if (connectionParams instanceof SseServerParameters sse) {
      return sseTransport(sse);
    }
    if (connectionParams instanceof ServerParameters command) {
      return new StdioClientTransport(command);
    }
    throw new IllegalArgumentException(
        "Unsupported MCP connection parameters: "
            + (connectionParams == null ? "null" : connectionParams.getClass().getName()));
  }

  private static McpClientTransport sseTransport(SseServerParameters params) {
    HttpClientSseClientTransport.Builder builder =
        HttpClientSseClientTransport.builder(params.url()).sseEndpoint(params.sseEndpoint());
    if (!params.headers().isEmpty()) {
      builder.customizeRequest(request -> params.headers().forEach(request::header));
    }
    return builder.build();
  }
}
