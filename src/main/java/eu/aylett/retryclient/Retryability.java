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

import com.google.common.base.CharMatcher;
import com.google.common.primitives.Longs;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Decides which outcomes are worth another attempt, and how long the server
 * asked us to wait.
 */
public final class Retryability {
  public static final int TOO_MANY_REQUESTS = 429;
  public static final String RETRY_AFTER = "Retry-After";

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private Retryability() {
  }

  /**
   * {@code 429} and every {@code 5xx} are transient; anything else is the
   * server's final answer.
   */
  @Contract(pure = true)
  public static boolean isRetryableStatus(int statusCode) {
    return statusCode == TOO_MANY_REQUESTS || (statusCode >= 500 && statusCode <= 599);
  }

  /**
   * Transport failures are transient, except for the ones this library raises
   * itself to end a call.
   */
  @Contract(pure = true)
  public static boolean isRetryableFailure(IOException failure) {
    return !(failure instanceof BodyReplayException) && !(failure instanceof RetriesExhaustedException);
  }

  /**
   * The delay requested by the response's {@code Retry-After} header.
   */
  public static Optional<Duration> retryAfter(Response response) {
    return response.header(RETRY_AFTER).flatMap(Retryability::parseRetryAfter);
  }

  /**
   * Parse a {@code Retry-After} value. Only a positive whole number of seconds is
   * understood; HTTP dates, fractions, signs and zero all count as absent.
   */
  public static Optional<Duration> parseRetryAfter(@Nullable String value) {
    if (value == null) {
      return Optional.empty();
    }
    var trimmed = value.trim();
    if (trimmed.isEmpty() || !DIGITS.matchesAllOf(trimmed)) {
      return Optional.empty();
    }
    var seconds = Longs.tryParse(trimmed);
    if (seconds == null || seconds <= 0) {
      return Optional.empty();
    }
    return Optional.of(Duration.ofSeconds(seconds));
  }
}
