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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimap;
import com.google.common.io.ByteStreams;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * An HTTP response with a streaming body.
 * <p>
 * The caller owns the response and must {@link #close()} it. Closing drains
 * whatever is left of the body first, which lets the underlying connection be
 * reused.
 * </p>
 */
public final class Response implements Closeable {
  private final int statusCode;
  private final ImmutableListMultimap<String, String> headers;
  private final InputStream body;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * @param statusCode
   *          the HTTP status code
   * @param headers
   *          response headers; names are matched case-insensitively
   * @param body
   *          the response body, which this response takes ownership of
   */
  public Response(int statusCode, Multimap<String, String> headers, InputStream body) {
    this.statusCode = statusCode;
    var normalized = ImmutableListMultimap.<String, String>builder();
    headers.forEach((name, value) -> normalized.put(Ascii.toLowerCase(name), value));
    this.headers = normalized.build();
    this.body = requireNonNull(body, "body");
  }

  public int statusCode() {
    return statusCode;
  }

  /**
   * All headers, with lower-cased names.
   */
  public ImmutableListMultimap<String, String> headers() {
    return headers;
  }

  /**
   * The first value of the named header, if present.
   */
  public Optional<String> header(String name) {
    return headers.get(Ascii.toLowerCase(name)).stream().findFirst();
  }

  public InputStream body() {
    return body;
  }

  /**
   * Read the remaining body and close the response.
   */
  public byte[] bodyAsBytes() throws IOException {
    try {
      return body.readAllBytes();
    } finally {
      close();
    }
  }

  /**
   * Read the remaining body as UTF-8 text and close the response.
   */
  public String bodyAsString() throws IOException {
    return new String(bodyAsBytes(), StandardCharsets.UTF_8);
  }

  /**
   * Drain and close the body. Later calls do nothing.
   */
  @Override
  public void close() throws IOException {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try (body) {
      ByteStreams.exhaust(body);
    }
  }

  @Override
  public String toString() {
    return "Response(" + statusCode + ")";
  }
}
