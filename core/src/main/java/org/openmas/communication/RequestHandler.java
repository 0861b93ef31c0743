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

import io.reactivex.rxjava3.core.Single;
import java.util.Map;

/** Handles one inbound request or notification method. */
@FunctionalInterface
public interface RequestHandler {

  /**
   * Handles a call.
   *
   * @param params the structured payload of the call.
   * @return the structured result. For notifications the result is discarded.
   */
  Single<Map<String, Object>> handle(Map<String, Object> params);
}
