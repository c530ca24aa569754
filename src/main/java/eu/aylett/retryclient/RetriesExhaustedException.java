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

import org.jspecify.annotations.Nullable;

import java.io.IOException;

/**
 * Thrown when every permitted attempt ended in a retryable outcome.
 * <p>
 * This is deliberately not the last response: a caller seeing this exception
 * knows the client gave up, rather than mistaking a {@code 503} for an answer.
 * If the last attempt failed without a response, that failure is the cause.
 * </p>
 */
public class RetriesExhaustedException extends IOException {
  /**
   * The number of attempts made, including the first.
   */
  public final int attempts;
  /**
   * The status code of the last response, or {@code null} if the last attempt
   * got no response at all.
   */
  public final @Nullable Integer lastStatusCode;

  /**
   * @param attempts
   *          the number of attempts made
   * @param lastStatusCode
   *          the status of the last response, if there was one
   * @param cause
   *          the failure of the last attempt, if it had no response
   */
  public RetriesExhaustedException(int attempts, @Nullable Integer lastStatusCode, @Nullable Throwable cause) {
    super("Retries exhausted after " + attempts + " attempts"
        + (lastStatusCode != null ? " (last status " + lastStatusCode + ")" : ""), cause);
    this.attempts = attempts;
    this.lastStatusCode = lastStatusCode;
  }
}
