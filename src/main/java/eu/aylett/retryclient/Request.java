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
import com.google.common.collect.Multimap;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * An HTTP request as it travels through the {@link Transport} chain.
 *
 * @param method
 *          the HTTP method, e.g. {@code GET}
 * @param uri
 *          the absolute target URI
 * @param headers
 *          request headers, in the order they will be sent
 * @param body
 *          the payload, which also decides whether the request may be retried
 * @param cancellation
 *          the signal that aborts this call
 * @param timeout
 *          an overall timeout for a single exchange, or {@code null} for the
 *          transport's default
 */
public record Request(String method, URI uri, ImmutableListMultimap<String, String> headers, RequestBody body,
    CancellationSignal cancellation, @Nullable Duration timeout) {

  public Request {
    requireNonNull(method, "method");
    requireNonNull(uri, "uri");
    requireNonNull(headers, "headers");
    requireNonNull(body, "body");
    requireNonNull(cancellation, "cancellation");
    checkArgument(!method.isBlank(), "method must not be blank");
    checkArgument(timeout == null || (!timeout.isNegative() && !timeout.isZero()), "timeout must be positive: %s",
        timeout);
  }

  /**
   * A request with no headers, the given body, and no cancellation signal.
   */
  public static Request of(String method, URI uri, RequestBody body) {
    return new Request(method, uri, ImmutableListMultimap.of(), body, CancellationSignal.none(), null);
  }

  public static Request get(URI uri) {
    return of("GET", uri, RequestBody.none());
  }

  public static Request post(URI uri, RequestBody body) {
    return of("POST", uri, body);
  }

  /**
   * A copy of this request with an extra header value appended.
   */
  public Request withHeader(String name, String value) {
    var builder = ImmutableListMultimap.<String, String>builder().putAll(headers).put(name, value);
    return new Request(method, uri, builder.build(), body, cancellation, timeout);
  }

  public Request withHeaders(Multimap<String, String> newHeaders) {
    return new Request(method, uri, ImmutableListMultimap.copyOf(newHeaders), body, cancellation, timeout);
  }

  public Request withBody(RequestBody newBody) {
    return new Request(method, uri, headers, newBody, cancellation, timeout);
  }

  public Request withCancellation(CancellationSignal signal) {
    return new Request(method, uri, headers, body, signal, timeout);
  }

  public Request withTimeout(@Nullable Duration newTimeout) {
    return new Request(method, uri, headers, body, cancellation, newTimeout);
  }
}
