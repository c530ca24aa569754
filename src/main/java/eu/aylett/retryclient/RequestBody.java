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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * The payload of a {@link Request}.
 * <p>
 * Only a body that can be produced again may be sent more than once, so the
 * variant decides whether a call is eligible for retries at all:
 * </p>
 * <ul>
 * <li>{@link NoBody}: nothing to send, always retryable;</li>
 * <li>{@link SingleUse}: a stream that can be read exactly once, never
 * retried;</li>
 * <li>{@link Replayable}: a source that opens a fresh stream for each
 * attempt.</li>
 * </ul>
 */
public sealed interface RequestBody permits RequestBody.NoBody, RequestBody.SingleUse, RequestBody.Replayable {

  /**
   * Whether a request carrying this body may be dispatched more than once.
   */
  default boolean isReplayable() {
    return !(this instanceof SingleUse);
  }

  static RequestBody none() {
    return NoBody.INSTANCE;
  }

  /**
   * A replayable body over a copy of the given bytes.
   */
  static RequestBody of(byte[] bytes) {
    var copy = bytes.clone();
    return new Replayable(() -> new ByteArrayInputStream(copy));
  }

  /**
   * A replayable body over the UTF-8 encoding of the given text.
   */
  static RequestBody of(String text) {
    var bytes = text.getBytes(StandardCharsets.UTF_8);
    return new Replayable(() -> new ByteArrayInputStream(bytes));
  }

  /**
   * A body that can only be sent once. Requests carrying it are never retried.
   */
  static RequestBody ofStream(InputStream stream) {
    return new SingleUse(stream);
  }

  static RequestBody replayable(BodySource source) {
    return new Replayable(source);
  }

  /**
   * The request has no body.
   */
  enum NoBody implements RequestBody {
    INSTANCE
  }

  /**
   * A body that is consumed by the first dispatch.
   */
  record SingleUse(InputStream stream) implements RequestBody {
    public SingleUse {
      requireNonNull(stream, "stream");
    }
  }

  /**
   * A body that can be opened again for every attempt.
   */
  record Replayable(BodySource source) implements RequestBody {
    public Replayable {
      requireNonNull(source, "source");
    }
  }

  /**
   * Produces a fresh, unread stream holding the whole body.
   */
  @FunctionalInterface
  interface BodySource {
    InputStream open() throws IOException;
  }
}
