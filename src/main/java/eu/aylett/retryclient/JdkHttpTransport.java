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

import com.google.common.collect.ImmutableListMultimap;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The base transport: performs the exchange with {@link HttpClient}.
 * <p>
 * Each exchange is bounded by the request's own timeout, or by this
 * transport's default. Firing the request's cancellation signal aborts the
 * exchange in flight.
 * </p>
 */
public final class JdkHttpTransport implements Transport {
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

  private final HttpClient client;
  private final Duration timeout;

  /**
   * A transport over a new {@link HttpClient} with a 15 second timeout.
   */
  public JdkHttpTransport() {
    this(HttpClient.newHttpClient(), DEFAULT_TIMEOUT);
  }

  public JdkHttpTransport(HttpClient client, Duration timeout) {
    checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive: %s", timeout);
    this.client = requireNonNull(client, "client");
    this.timeout = timeout;
  }

  @Override
  public Response dispatch(Request request) throws IOException, InterruptedException {
    var signal = request.cancellation();
    signal.throwIfCancelled();
    var future = client.sendAsync(toHttpRequest(request), HttpResponse.BodyHandlers.ofInputStream());
    try (var registration = signal.onCancel(() -> future.cancel(true))) {
      var response = future.get();
      return new Response(response.statusCode(), headers(response.headers()), response.body());
    } catch (CancellationException e) {
      signal.throwIfCancelled();
      throw e;
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    } catch (ExecutionException e) {
      var cause = e.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      if (cause instanceof UncheckedIOException unchecked) {
        throw unchecked.getCause();
      }
      throw new IOException("HTTP exchange failed: " + request.method() + " " + request.uri(), cause);
    }
  }

  private HttpRequest toHttpRequest(Request request) {
    var builder = HttpRequest.newBuilder(request.uri())
        .timeout(request.timeout() != null ? request.timeout() : timeout)
        .method(request.method(), publisher(request.body()));
    request.headers().forEach(builder::header);
    return builder.build();
  }

  private static HttpRequest.BodyPublisher publisher(RequestBody body) {
    if (body instanceof RequestBody.SingleUse singleUse) {
      var stream = singleUse.stream();
      return HttpRequest.BodyPublishers.ofInputStream(() -> stream);
    }
    if (body instanceof RequestBody.Replayable replayable) {
      var source = replayable.source();
      return HttpRequest.BodyPublishers.ofInputStream(() -> open(source));
    }
    return HttpRequest.BodyPublishers.noBody();
  }

  private static InputStream open(RequestBody.BodySource source) {
    try {
      return source.open();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private static ImmutableListMultimap<String, String> headers(HttpHeaders headers) {
    var builder = ImmutableListMultimap.<String, String>builder();
    headers.map().forEach(builder::putAll);
    return builder.build();
  }
}
