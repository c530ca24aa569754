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

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Properties;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Settings for a {@link RetryClient}.
 * <p>
 * Zero means "use the default" for every field, never "don't wait": the
 * defaults are 3 retries, a 200ms initial backoff, a 2s backoff cap and no rate
 * limit. Negative values are rejected.
 * </p>
 *
 * @param maxRequestsPerSecond
 *          the sustained request rate ceiling, or 0 for no limit
 * @param maxRetries
 *          the number of attempts allowed after the first
 * @param initialBackoff
 *          the wait before the first retry
 * @param maxBackoff
 *          the longest exponential wait between retries
 * @param transport
 *          the transport that performs the exchange, or {@code null} for a
 *          {@link JdkHttpTransport} with a 15 second timeout
 */
public record RetryClientConfig(int maxRequestsPerSecond, int maxRetries, Duration initialBackoff,
    Duration maxBackoff, @Nullable Transport transport) {
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(200);
  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(2);

  public static final String MAX_RPS = "max_rps";
  public static final String MAX_RETRIES = "max_retries";
  public static final String INITIAL_BACKOFF_MS = "initial_backoff_ms";
  public static final String MAX_BACKOFF_MS = "max_backoff_ms";

  public RetryClientConfig {
    checkArgument(maxRequestsPerSecond >= 0, "maxRequestsPerSecond must not be negative: %s", maxRequestsPerSecond);
    checkArgument(maxRetries >= 0, "maxRetries must not be negative: %s", maxRetries);
    checkArgument(!initialBackoff.isNegative(), "initialBackoff must not be negative: %s", initialBackoff);
    checkArgument(!maxBackoff.isNegative(), "maxBackoff must not be negative: %s", maxBackoff);
    if (maxRetries == 0) {
      maxRetries = DEFAULT_MAX_RETRIES;
    }
    if (initialBackoff.isZero()) {
      initialBackoff = DEFAULT_INITIAL_BACKOFF;
    }
    if (maxBackoff.isZero()) {
      maxBackoff = DEFAULT_MAX_BACKOFF;
    }
  }

  /**
   * No rate limit, default retry settings, default transport.
   */
  public static RetryClientConfig defaults() {
    return new RetryClientConfig(0, 0, Duration.ZERO, Duration.ZERO, null);
  }

  /**
   * Settings with the backoffs given in milliseconds.
   */
  public static RetryClientConfig ofMillis(int maxRequestsPerSecond, int maxRetries, long initialBackoffMillis,
      long maxBackoffMillis) {
    return new RetryClientConfig(maxRequestsPerSecond, maxRetries, Duration.ofMillis(initialBackoffMillis),
        Duration.ofMillis(maxBackoffMillis), null);
  }

  /**
   * Read settings from {@code max_rps}, {@code max_retries},
   * {@code initial_backoff_ms} and {@code max_backoff_ms}. Missing keys take the
   * defaults.
   *
   * @throws IllegalArgumentException
   *           if a value isn't a whole number, or is negative
   */
  public static RetryClientConfig fromProperties(Properties properties) {
    return ofMillis(intProperty(properties, MAX_RPS), intProperty(properties, MAX_RETRIES),
        longProperty(properties, INITIAL_BACKOFF_MS), longProperty(properties, MAX_BACKOFF_MS));
  }

  public RetryClientConfig withMaxRequestsPerSecond(int rate) {
    return new RetryClientConfig(rate, maxRetries, initialBackoff, maxBackoff, transport);
  }

  public RetryClientConfig withMaxRetries(int retries) {
    return new RetryClientConfig(maxRequestsPerSecond, retries, initialBackoff, maxBackoff, transport);
  }

  public RetryClientConfig withBackoff(Duration initial, Duration max) {
    return new RetryClientConfig(maxRequestsPerSecond, maxRetries, initial, max, transport);
  }

  public RetryClientConfig withTransport(@Nullable Transport base) {
    return new RetryClientConfig(maxRequestsPerSecond, maxRetries, initialBackoff, maxBackoff, base);
  }

  private static int intProperty(Properties properties, String key) {
    var value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return 0;
    }
    var parsed = Ints.tryParse(value.trim());
    checkArgument(parsed != null, "%s is not a whole number: %s", key, value);
    return parsed;
  }

  private static long longProperty(Properties properties, String key) {
    var value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return 0;
    }
    var parsed = Longs.tryParse(value.trim());
    checkArgument(parsed != null, "%s is not a whole number: %s", key, value);
    return parsed;
  }
}
