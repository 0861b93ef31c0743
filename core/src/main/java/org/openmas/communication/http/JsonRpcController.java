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

package org.openmas.communication.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.jspecify.annotations.Nullable;
import org.openmas.JsonBaseModel;
import org.openmas.communication.HandlerTable;
import org.openmas.exceptions.MethodNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Answers JSON-RPC 2.0 calls posted to any path by dispatching them to an agent's handlers.
 *
 * <p>Requests are answered with HTTP 200 and a JSON-RPC response, including protocol and handler
 * errors. Notifications are acknowledged with HTTP 204 before their handler runs.
 */
@RestController
public class JsonRpcController {

  private static final Logger logger = LoggerFactory.getLogger(JsonRpcController.class);

  private final String agentName;
  private final HandlerTable handlers;

  public JsonRpcController(String agentName, HandlerTable handlers) {
    this.agentName = agentName;
    this.handlers = handlers;
  }

  @PostMapping(path = "/**")
  public CompletionStage<ResponseEntity<String>> handle(
      @RequestBody(required = false) @Nullable String body) {
    JsonNode message;
    try {
      if (body == null || body.isBlank()) {
        return answer(JsonRpcCodec.encodeError(null, JsonRpcCodec.PARSE_ERROR, "Parse error"));
      }
      message = JsonRpcCodec.parse(body);
    } catch (JsonProcessingException e) {
      return answer(JsonRpcCodec.encodeError(null, JsonRpcCodec.PARSE_ERROR, "Parse error"));
    }
    JsonNode id = message.get("id");
    JsonNode methodNode = message.get("method");
    if (!message.isObject() || methodNode == null || !methodNode.isTextual()) {
      return answer(JsonRpcCodec.encodeError(id, JsonRpcCodec.INVALID_REQUEST, "Invalid request"));
    }
    String method = methodNode.asText();
    JsonNode paramsNode = message.get("params");
    if (paramsNode != null && !paramsNode.isNull() && !paramsNode.isObject()) {
      return answer(
          JsonRpcCodec.encodeError(id, JsonRpcCodec.INVALID_PARAMS, "Params must be an object"));
    }
    Map<String, Object> params =
        paramsNode == null || paramsNode.isNull()
            ? Map.of()
            : JsonBaseModel.getMapper().convertValue(paramsNode, JsonBaseModel.MAP_TYPE);

    if (id == null) {
      handlers
          .dispatch(method, params)
          .subscribe(
              result -> {},
              error ->
                  logger.warn(
                      "Handler for notification '{}' on agent '{}' failed",
                      method,
                      agentName,
                      error));
      return CompletableFuture.completedFuture(ResponseEntity.noContent().build());
    }
    return handlers
        .dispatch(method, params)
        .map(result -> JsonRpcCodec.encodeResult(id, result))
        .onErrorReturn(error -> encodeFailure(id, method, error))
        .map(JsonRpcController::ok)
        .toCompletionStage();
  }

  private String encodeFailure(JsonNode id, String method, Throwable error) {
    if (error instanceof MethodNotFoundException) {
      return JsonRpcCodec.encodeError(id, JsonRpcCodec.METHOD_NOT_FOUND, error.getMessage());
    }
    logger.warn("Handler for method '{}' on agent '{}' failed", method, agentName, error);
    return JsonRpcCodec.encodeError(
        id, JsonRpcCodec.INTERNAL_ERROR, String.valueOf(error.getMessage()));
  }

  private static CompletionStage<ResponseEntity<String>> answer(String json) {
    return CompletableFuture.completedFuture(ok(json));
  }

  private static ResponseEntity<String> ok(String json) {
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(json);
  }
}
