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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

import static java.util.Objects.requireNonNull;

/**
 * An HTTP client that rate limits and retries.
 * <p>
 * Every call runs through {@link RetryingTransport}, then
 * {@link RateLimitingTransport}, then the configured base transport, so each
 * individual attempt (retries included) has to be admitted by the rate
 * limiter. Safe for concurrent use; share one instance per remote service.
 * </p>
 */
public final class RetryClient implements Transport, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RetryClient.class);

  private final RetryClientConfig config;
  private final RateLimitingTransport rateLimiter;
  private final RetryingTransport retrying;

  private RetryClient(RetryClientConfig config, RateLimitingTransport rateLimiter, RetryingTransport retrying) {
    this.config = config;
    this.rateLimiter = rateLimiter;
    this.retrying = retrying;
  }

  /**
   * A client with no rate limit and the default retry settings.
   */
  public static RetryClient create() {
    return create(RetryClientConfig.defaults());
  }

  public static RetryClient create(RetryClientConfig config) {
    requireNonNull(config, "config");
    var base = config.transport() != null ? config.transport() : new JdkHttpTransport();
    var rateLimiter = new RateLimitingTransport(base, config.maxRequestsPerSecond());
    var retrying = new RetryingTransport(rateLimiter, config.maxRetries(), config.initialBackoff(),
        config.maxBackoff());
    log.debug("Created retry client: {}", config);
    return new RetryClient(config, rateLimiter, retrying);
  }

  public RetryClientConfig config() {
    return config;
  }

  /**
   * Send the request, retrying transient failures.
   *
   * @throws RetriesExhaustedException
   *           if every attempt had a retryable outcome
   * @throws BodyReplayException
   *           if the request body couldn't be produced for an attempt
   * @throws IOException
   *           if a non-retryable transport failure occurred
   * @throws java.util.concurrent.CancellationException
   *           if the request's cancellation signal fired
   */
  public Response send(Request request) throws IOException, InterruptedException {
    return retrying.dispatch(request);
  }

  @Override
  public Response dispatch(Request request) throws IOException, InterruptedException {
    return send(request);
  }

  public Response get(URI uri) throws IOException, InterruptedException {
    return send(Request.get(uri));
  }

  /**
   * POST a replayable copy of the given bytes.
   */
  public Response post(URI uri, String contentType, byte[] body) throws IOException, InterruptedException {
    return send(Request.post(uri, RequestBody.of(body)).withHeader("Content-Type", contentType));
  }

  /**
   * Stop the rate limiter's refill thread. Calls made afterwards fail if a rate
   * limit is configured.
   */
  @Override
  public void close() {
    rateLimiter.close();
  }
}
