/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.retryclient;

import java.io.IOException;

/**
 * Thrown when a replayable request body could not be opened for an attempt.
 * The call is aborted; it is never retried.
 */
public class BodyReplayException extends IOException {
  public BodyReplayException(String message, IOException cause) {
    super(message, cause);
  }
}
