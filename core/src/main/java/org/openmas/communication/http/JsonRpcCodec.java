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
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.openmas.JsonBaseModel;
import org.openmas.exceptions.CommunicationException;
import org.openmas.exceptions.MethodNotFoundException;

/** Encodes and decodes JSON-RPC 2.0 messages exchanged by {@link HttpCommunicator}. */
public final class JsonRpcCodec {

  public static final String VERSION = "2.0";

  public static final int PARSE_ERROR = -32700;
  public static final int INVALID_REQUEST = -32600;
  public static final int METHOD_NOT_FOUND = -32601;
  public static final int INVALID_PARAMS = -32602;
  public static final int INTERNAL_ERROR = -32603;

  private JsonRpcCodec() {}

  /** Encodes a request. {@code id} correlates the response. */
  public static String encodeRequest(String id, String method, Map<String, Object> params) {
    ObjectNode message = envelope(method, params);
    message.put("id", id);
    return write(message);
  }

  /** Encodes a notification, which carries no id and gets no response. */
  public static String encodeNotification(String method, Map<String, Object> params) {
    return write(envelope(method, params));
  }

  /**
   * Decodes the response to a request.
   *
   * <p>An object result is returned as is, any other result is wrapped as {@code {"result":
   * value}}.
   *
   * @throws MethodNotFoundException if the remote side reports {@value #METHOD_NOT_FOUND}.
   * @throws CommunicationException for any other error object or a malformed response.
   */
  public static Map<String, Object> decodeResponse(String body, String target, String method) {
    Map<String, Object> response;
    try {
      response = JsonBaseModel.getMapper().readValue(body, JsonBaseModel.MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new CommunicationException(
          "Invalid JSON-RPC response from service '" + target + "'", target, e);
    }
    if (response == null) {
      throw new CommunicationException(
          "Empty JSON-RPC response from service '" + target + "'", target);
    }
    Object error = response.get("error");
    if (error instanceof Map) {
      @SuppressWarnings("unchecked")
      Map<String, Object> errorObject = (Map<String, Object>) error;
      Object code = errorObject.get("code");
      String message = String.valueOf(errorObject.getOrDefault("message", "Unknown error"));
      if (code instanceof Number && ((Number) code).intValue() == METHOD_NOT_FOUND) {
        throw new MethodNotFoundException(
            "Method '" + method + "' not found on service '" + target + "': " + message, target);
      }
      throw new CommunicationException(
          "Error from service '" + target + "' calling '" + method + "': " + message,
          target,
          errorObject,
          null);
    }
    if (!response.containsKey("result")) {
      throw new CommunicationException(
          "JSON-RPC response from service '" + target + "' has neither result nor error",
          target);
    }
    return asResultMap(response.get("result"));
  }

  /** Returns {@code result} when it is an object, else {@code {"result": result}}. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asResultMap(@Nullable Object result) {
    if (result instanceof Map) {
      return (Map<String, Object>) result;
    }
    Map<String, Object> wrapped = new HashMap<>();
    wrapped.put("result", result);
    return wrapped;
  }

  /** Parses an inbound message. */
  static JsonNode parse(String body) throws JsonProcessingException {
    return JsonBaseModel.getMapper().readTree(body);
  }

  static String encodeResult(@Nullable JsonNode id, Map<String, Object> result) {
    ObjectNode message = JsonBaseModel.getMapper().createObjectNode();
    message.put("jsonrpc", VERSION);
    message.set("id", id);
    message.set("result", JsonBaseModel.getMapper().valueToTree(result));
    return write(message);
  }

  static String encodeError(@Nullable JsonNode id, int code, String errorMessage) {
    ObjectNode message = JsonBaseModel.getMapper().createObjectNode();
    message.put("jsonrpc", VERSION);
    message.set("id", id);
    ObjectNode error = message.putObject("error");
    error.put("code", code);
    error.put("message", errorMessage);
    return write(message);
  }

  private static ObjectNode envelope(String method, Map<String, Object> params) {
    ObjectNode message = JsonBaseModel.getMapper().createObjectNode();
    message.put("jsonrpc", VERSION);
    message.put("method", method);
    message.set("params", JsonBaseModel.getMapper().valueToTree(params));
    return message;
  }

  private static String write(JsonNode message) {
    try {
      return JsonBaseModel.getMapper().writeValueAsString(message);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode JSON-RPC message", e);
    }
  }
}
