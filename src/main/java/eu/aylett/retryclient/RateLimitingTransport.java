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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Suppliers;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Admits at most {@code maxRequestsPerSecond} dispatches per second to the next
 * transport.
 * <p>
 * Admission uses a token bucket holding up to {@code maxRequestsPerSecond}
 * tokens. A background thread adds one token every
 * {@code 1s / maxRequestsPerSecond}; tokens that would overflow the bucket are
 * dropped, so an idle limiter never builds up more than one second's worth of
 * burst. The bucket and its thread are created on first use.
 * </p>
 * <p>
 * A rate of zero or less disables limiting: requests pass straight through and
 * no thread is ever started.
 * </p>
 */
public final class RateLimitingTransport implements Transport, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RateLimitingTransport.class);

  private final Transport next;
  private final int maxRequestsPerSecond;
  private final Supplier<ScheduledExecutorService> executorFactory;
  private final Supplier<TokenBucket> bucket;
  private volatile @Nullable ScheduledExecutorService refiller;
  private volatile @Nullable TokenBucket started;
  private volatile boolean closed;

  /**
   * @param next
   *          the transport admitted requests are passed to
   * @param maxRequestsPerSecond
   *          the sustained rate ceiling; zero or less for no limit
   */
  public RateLimitingTransport(Transport next, int maxRequestsPerSecond) {
    this(next, maxRequestsPerSecond, RateLimitingTransport::newRefillExecutor);
  }

  /**
   * @param executorFactory
   *          creates the executor that refills the bucket; called at most once
   *          (mainly for testing)
   */
  @VisibleForTesting
  RateLimitingTransport(Transport next, int maxRequestsPerSecond,
      Supplier<ScheduledExecutorService> executorFactory) {
    this.next = requireNonNull(next, "next");
    this.maxRequestsPerSecond = maxRequestsPerSecond;
    this.executorFactory = requireNonNull(executorFactory, "executorFactory");
    this.bucket = Suppliers.memoize(this::start);
  }

  public int maxRequestsPerSecond() {
    return maxRequestsPerSecond;
  }

  public boolean isEnabled() {
    return maxRequestsPerSecond > 0;
  }

  @Override
  public Response dispatch(Request request) throws IOException, InterruptedException {
    acquire(request.cancellation());
    return next.dispatch(request);
  }

  /**
   * Block until the limiter admits one call.
   *
   * @throws java.util.concurrent.CancellationException
   *           if the signal fires first
   * @throws InterruptedException
   *           if the calling thread is interrupted while waiting
   * @throws IllegalStateException
   *           if the limiter has been closed
   */
  public void acquire(CancellationSignal signal) throws InterruptedException {
    if (!isEnabled()) {
      return;
    }
    checkState(!closed, "Rate limiter is closed");
    bucket.get().take(signal);
  }

  /**
   * Stop the refill thread. Callers still waiting for a token fail with
   * {@link IllegalStateException}, as does every later call.
   */
  @Override
  public void close() {
    closed = true;
    var tokens = started;
    if (tokens != null) {
      tokens.close();
    }
    var executor = refiller;
    if (executor != null) {
      executor.shutdownNow();
      log.debug("Stopped rate limiter at {} requests per second", maxRequestsPerSecond);
    }
  }

  private TokenBucket start() {
    var tokens = new TokenBucket(maxRequestsPerSecond);
    var periodNanos = Math.max(1L, TimeUnit.SECONDS.toNanos(1) / maxRequestsPerSecond);
    var executor = executorFactory.get();
    executor.scheduleAtFixedRate(tokens::deposit, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
    refiller = executor;
    started = tokens;
    // close() may have run before refiller and started were published.
    if (closed) {
      tokens.close();
      executor.shutdownNow();
    }
    log.debug("Started rate limiter at {} requests per second", maxRequestsPerSecond);
    return tokens;
  }

  private static ScheduledExecutorService newRefillExecutor() {
    var threadFactory = new ThreadFactoryBuilder().setDaemon(true).setNameFormat("retryclient-token-refill-%d")
        .build();
    return Executors.newSingleThreadScheduledExecutor(threadFactory);
  }
}
