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

import com.google.common.io.Closeables;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Retries transient failures of the next transport with capped exponential
 * backoff.
 * <p>
 * A call makes at most {@code maxRetries + 1} attempts. Transport failures and
 * responses with status {@code 429} or {@code 5xx} are retried; any other
 * response is returned as soon as it arrives. Between attempts the client waits
 * for the number of seconds in the response's {@code Retry-After} header if it
 * has one, and otherwise for the current backoff, which starts at
 * {@code initialBackoff} and doubles after each use up to {@code maxBackoff}.
 * </p>
 * <p>
 * Requests with a {@link RequestBody.SingleUse} body are dispatched exactly
 * once: their payload can't be sent again.
 * </p>
 */
public final class RetryingTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(RetryingTransport.class);

  private final Transport next;
  private final int maxRetries;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final Sleeper sleeper;

  /**
   * A retrying transport that waits using each request's cancellation signal.
   */
  public RetryingTransport(Transport next, int maxRetries, Duration initialBackoff, Duration maxBackoff) {
    this(next, maxRetries, initialBackoff, maxBackoff, (delay, signal) -> signal.pause(delay));
  }

  /**
   * A fully configurable retrying transport.
   *
   * @param next
   *          the transport each attempt is dispatched to
   * @param maxRetries
   *          the number of attempts allowed after the first
   * @param initialBackoff
   *          the wait before the first retry
   * @param maxBackoff
   *          the longest exponential wait
   * @param sleeper
   *          waits between attempts (mainly for testing)
   */
  public RetryingTransport(Transport next, int maxRetries, Duration initialBackoff, Duration maxBackoff,
      Sleeper sleeper) {
    checkArgument(maxRetries >= 0, "maxRetries must not be negative: %s", maxRetries);
    checkArgument(!initialBackoff.isNegative(), "initialBackoff must not be negative: %s", initialBackoff);
    checkArgument(!maxBackoff.isNegative(), "maxBackoff must not be negative: %s", maxBackoff);
    this.next = requireNonNull(next, "next");
    this.maxRetries = maxRetries;
    this.initialBackoff = initialBackoff;
    this.maxBackoff = maxBackoff;
    this.sleeper = requireNonNull(sleeper, "sleeper");
  }

  @Override
  public Response dispatch(Request request) throws IOException, InterruptedException {
    if (!request.body().isReplayable()) {
      log.debug("{} {} has a single-use body, sending without retries", request.method(), request.uri());
      return next.dispatch(request);
    }

    var attempt = 0;
    var backoff = initialBackoff;
    while (true) {
      attempt++;
      var attemptRequest = prepare(request, attempt);

      Response response = null;
      IOException failure = null;
      try {
        response = next.dispatch(attemptRequest);
      } catch (IOException e) {
        if (!Retryability.isRetryableFailure(e)) {
          throw e;
        }
        failure = e;
      } finally {
        if (attemptRequest.body() instanceof RequestBody.SingleUse opened) {
          Closeables.closeQuietly(opened.stream());
        }
      }

      if (response != null && !Retryability.isRetryableStatus(response.statusCode())) {
        return response;
      }

      var lastStatus = response != null ? response.statusCode() : null;
      if (attempt > maxRetries) {
        if (response != null) {
          discard(response);
        }
        log.debug("Giving up on {} {} after {} attempts", request.method(), request.uri(), attempt);
        throw new RetriesExhaustedException(attempt, lastStatus, failure);
      }

      Optional<Duration> retryAfter = Optional.empty();
      if (response != null) {
        retryAfter = Retryability.retryAfter(response);
        discard(response);
      }

      Duration delay;
      if (retryAfter.isPresent()) {
        delay = retryAfter.get();
      } else {
        delay = backoff;
        backoff = nextBackoff(backoff);
      }

      if (log.isDebugEnabled()) {
        log.debug("Attempt {} of {} {} failed ({}), retrying in {}", attempt, request.method(), request.uri(),
            describe(lastStatus, failure), delay);
      }
      sleeper.sleep(delay, request.cancellation());
    }
  }

  /**
   * The request to send for the given attempt, with a freshly opened body.
   */
  private static Request prepare(Request request, int attempt) throws BodyReplayException {
    if (request.body() instanceof RequestBody.Replayable replayable) {
      try {
        return request.withBody(RequestBody.ofStream(replayable.source().open()));
      } catch (IOException e) {
        throw new BodyReplayException("Could not open request body for attempt " + attempt, e);
      }
    }
    return request;
  }

  private Duration nextBackoff(Duration current) {
    var doubled = current.multipliedBy(2);
    return doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
  }

  private static void discard(Response response) {
    try {
      response.close();
    } catch (IOException e) {
      // The connection won't be reused, but the retry decision stands.
      log.debug("Failed to drain discarded response body", e);
    }
  }

  private static String describe(@Nullable Integer status, @Nullable IOException failure) {
    if (status != null) {
      return "status " + status;
    }
    return failure != null ? failure.toString() : "no response";
  }

  /**
   * Waits out the delay between two attempts.
   */
  @FunctionalInterface
  public interface Sleeper {
    /**
     * @throws java.util.concurrent.CancellationException
     *           if the signal fires during the wait
     * @throws InterruptedException
     *           if the calling thread is interrupted during the wait
     */
    void sleep(Duration delay, CancellationSignal signal) throws InterruptedException;
  }
}
