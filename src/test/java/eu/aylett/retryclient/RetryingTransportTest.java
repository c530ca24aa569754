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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetryingTransportTest {
  private static final URI TARGET = URI.create("http://localhost/resource");

  private final Transport next = mock(Transport.class);
  private final List<Duration> waits = new ArrayList<>();
  private final RetryingTransport.Sleeper recordingSleeper = (delay, signal) -> waits.add(delay);

  private RetryingTransport retrying(int maxRetries) {
    return new RetryingTransport(next, maxRetries, Duration.ofMillis(200), Duration.ofSeconds(2), recordingSleeper);
  }

  @ParameterizedTest
  @ValueSource(ints = {200, 204, 301, 400, 404})
  void terminalStatusReturnsOnFirstAttempt(int status) throws Exception {
    var response = StubResponses.status(status);
    when(next.dispatch(any())).thenReturn(response);

    assertThat(retrying(3).dispatch(Request.get(TARGET)), sameInstance(response));

    verify(next, times(1)).dispatch(any());
    assertThat(waits, empty());
  }

  @Test
  void retriesTransientStatusUntilSuccess() throws Exception {
    var first = StubResponses.status(503);
    var second = StubResponses.status(429);
    var ok = StubResponses.status(200);
    when(next.dispatch(any())).thenReturn(first, second, ok);

    assertThat(retrying(3).dispatch(Request.get(TARGET)), sameInstance(ok));

    verify(next, times(3)).dispatch(any());
    assertThat(waits, contains(Duration.ofMillis(200), Duration.ofMillis(400)));
  }

  @Test
  void discardedResponsesAreDrainedAndClosed() throws Exception {
    var body = new StubResponses.TrackingInputStream("try again later");
    var transient503 = new Response(503, ImmutableListMultimap.of(), body);
    when(next.dispatch(any())).thenReturn(transient503, StubResponses.status(200));

    retrying(3).dispatch(Request.get(TARGET));

    assertThat(body.drained(), equalTo(true));
    assertThat(body.closed, equalTo(true));
  }

  @Test
  void backoffDoublesUpToTheCap() throws Exception {
    when(next.dispatch(any())).thenAnswer(invocation -> StubResponses.status(503));

    assertThrows(RetriesExhaustedException.class, () -> retrying(7).dispatch(Request.get(TARGET)));

    assertThat(waits, contains(Duration.ofMillis(200), Duration.ofMillis(400), Duration.ofMillis(800),
        Duration.ofMillis(1600), Duration.ofMillis(2000), Duration.ofMillis(2000), Duration.ofMillis(2000)));
  }

  @Test
  void retryAfterIsHonouredWithoutAdvancingBackoff() throws Exception {
    when(next.dispatch(any())).thenReturn(StubResponses.status(503), StubResponses.retryAfter(503, "5"),
        StubResponses.status(500), StubResponses.status(200));

    retrying(3).dispatch(Request.get(TARGET));

    assertThat(waits, contains(Duration.ofMillis(200), Duration.ofSeconds(5), Duration.ofMillis(400)));
  }

  @Test
  void unparseableRetryAfterFallsBackToBackoff() throws Exception {
    when(next.dispatch(any())).thenReturn(StubResponses.retryAfter(429, "Wed, 21 Oct 2015 07:28:00 GMT"),
        StubResponses.status(200));

    retrying(3).dispatch(Request.get(TARGET));

    assertThat(waits, contains(Duration.ofMillis(200)));
  }

  @Test
  void alwaysUnavailableExhaustsAfterFourAttempts() throws Exception {
    var bodies = new CopyOnWriteArrayList<StubResponses.TrackingInputStream>();
    when(next.dispatch(any())).thenAnswer(invocation -> {
      var body = new StubResponses.TrackingInputStream("unavailable");
      bodies.add(body);
      return new Response(503, ImmutableListMultimap.of(), body);
    });

    var thrown = assertThrows(RetriesExhaustedException.class, () -> retrying(3).dispatch(Request.get(TARGET)));

    verify(next, times(4)).dispatch(any());
    assertThat(thrown.attempts, equalTo(4));
    assertThat(thrown.lastStatusCode, equalTo(503));
    assertThat(bodies.stream().allMatch(body -> body.closed), equalTo(true));
  }

  @Test
  void zeroRetriesMeansOneAttempt() throws Exception {
    when(next.dispatch(any())).thenAnswer(invocation -> StubResponses.status(502));

    var thrown = assertThrows(RetriesExhaustedException.class, () -> retrying(0).dispatch(Request.get(TARGET)));

    verify(next, times(1)).dispatch(any());
    assertThat(thrown.attempts, equalTo(1));
    assertThat(waits, empty());
  }

  @Test
  void transportFailuresAreRetried() throws Exception {
    var ok = StubResponses.status(200);
    when(next.dispatch(any())).thenThrow(new ConnectException("refused")).thenThrow(new IOException("reset"))
        .thenReturn(ok);

    assertThat(retrying(3).dispatch(Request.get(TARGET)), sameInstance(ok));
    assertThat(waits, contains(Duration.ofMillis(200), Duration.ofMillis(400)));
  }

  @Test
  void persistentTransportFailureReportsExhaustion() throws Exception {
    var failure = new ConnectException("refused");
    when(next.dispatch(any())).thenThrow(failure);

    var thrown = assertThrows(RetriesExhaustedException.class, () -> retrying(3).dispatch(Request.get(TARGET)));

    verify(next, times(4)).dispatch(any());
    assertThat(thrown.lastStatusCode, nullValue());
    assertThat(thrown.getCause(), sameInstance(failure));
  }

  @Test
  void singleUseBodyIsSentOnce() throws Exception {
    var unavailable = StubResponses.status(503);
    when(next.dispatch(any())).thenReturn(unavailable, StubResponses.status(200));
    var request = Request.post(TARGET,
        RequestBody.ofStream(new ByteArrayInputStream("once".getBytes(StandardCharsets.UTF_8))));

    assertThat(retrying(3).dispatch(request), sameInstance(unavailable));

    verify(next, times(1)).dispatch(request);
    assertThat(waits, empty());
  }

  @Test
  void singleUseBodyFailureIsSurfacedVerbatim() throws Exception {
    var failure = new ConnectException("refused");
    when(next.dispatch(any())).thenThrow(failure);
    var request = Request.post(TARGET, RequestBody.ofStream(new ByteArrayInputStream(new byte[0])));

    var thrown = assertThrows(ConnectException.class, () -> retrying(3).dispatch(request));

    assertThat(thrown, sameInstance(failure));
    verify(next, times(1)).dispatch(any());
  }

  @Test
  void replayableBodyIsReopenedForEveryAttempt() throws Exception {
    var opened = new AtomicInteger();
    var sent = new ArrayList<String>();
    var request = Request.post(TARGET, RequestBody.replayable(() -> {
      opened.incrementAndGet();
      return new ByteArrayInputStream("payload".getBytes(StandardCharsets.UTF_8));
    }));
    when(next.dispatch(any())).thenAnswer(invocation -> {
      Request attempt = invocation.getArgument(0);
      var body = (RequestBody.SingleUse) attempt.body();
      sent.add(new String(body.stream().readAllBytes(), StandardCharsets.UTF_8));
      return StubResponses.status(sent.size() < 3 ? 500 : 201);
    });

    var response = retrying(3).dispatch(request);

    assertThat(response.statusCode(), equalTo(201));
    assertThat(opened.get(), equalTo(3));
    assertThat(sent, contains("payload", "payload", "payload"));
  }

  @Test
  void bodyReplayFailureAbortsTheCall() throws Exception {
    var opened = new AtomicInteger();
    var request = Request.post(TARGET, RequestBody.replayable(() -> {
      if (opened.incrementAndGet() > 1) {
        throw new IOException("source gone");
      }
      return new ByteArrayInputStream(new byte[]{1, 2, 3});
    }));
    when(next.dispatch(any())).thenAnswer(invocation -> StubResponses.status(503));

    var thrown = assertThrows(BodyReplayException.class, () -> retrying(3).dispatch(request));

    assertThat(thrown.getCause().getMessage(), equalTo("source gone"));
    verify(next, times(1)).dispatch(any());
  }

  @Test
  void bodyReplayFailureFromDownstreamIsNotRetried() throws Exception {
    when(next.dispatch(any())).thenThrow(new BodyReplayException("nested", new IOException()));

    assertThrows(BodyReplayException.class, () -> retrying(3).dispatch(Request.get(TARGET)));

    verify(next, times(1)).dispatch(any());
  }

  @Test
  void cancelDuringBackoffEndsTheCallPromptly() throws Exception {
    var signal = CancellationSignal.create();
    var scheduler = Executors.newSingleThreadScheduledExecutor();
    var attempts = new AtomicInteger();
    when(next.dispatch(any())).thenAnswer(invocation -> {
      if (attempts.incrementAndGet() == 2) {
        scheduler.schedule(signal::cancel, 100, TimeUnit.MILLISECONDS);
      }
      return StubResponses.status(503);
    });
    var transport = new RetryingTransport(next, 5, Duration.ofSeconds(1), Duration.ofSeconds(30));
    try {
      var start = System.nanoTime();
      assertThrows(CancellationException.class,
          () -> transport.dispatch(Request.get(TARGET).withCancellation(signal)));

      assertThat(System.nanoTime() - start, lessThan(TimeUnit.SECONDS.toNanos(5)));
      assertThat(attempts.get(), equalTo(2));
    } finally {
      scheduler.shutdownNow();
    }
  }

  @Test
  void interruptionDuringBackoffPropagates() throws Exception {
    when(next.dispatch(any())).thenAnswer(invocation -> StubResponses.status(503));
    RetryingTransport.Sleeper interrupted = (delay, signal) -> {
      throw new InterruptedException("stop");
    };
    var transport = new RetryingTransport(next, 3, Duration.ofMillis(200), Duration.ofSeconds(2), interrupted);

    var thrown = assertThrows(InterruptedException.class, () -> transport.dispatch(Request.get(TARGET)));

    assertThat(thrown.getMessage(), equalTo("stop"));
    verify(next, times(1)).dispatch(any());
  }

  @Test
  void rejectsNegativeSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new RetryingTransport(next, -1, Duration.ofMillis(200), Duration.ofSeconds(2)));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryingTransport(next, 3, Duration.ofMillis(-1), Duration.ofSeconds(2)));
    assertThrows(IllegalArgumentException.class,
        () -> new RetryingTransport(next, 3, Duration.ofMillis(200), Duration.ofSeconds(-2)));
  }
}
