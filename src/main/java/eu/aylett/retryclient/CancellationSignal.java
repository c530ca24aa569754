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

import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A one-shot signal that aborts a single logical call.
 * <p>
 * Every blocking point in the pipeline (waiting for a rate limiter token,
 * waiting between attempts, waiting for the network) watches the signal of the
 * request it is serving, and gives up with a {@link CancellationException} once
 * it fires. Firing a signal only affects the calls carrying it.
 * </p>
 */
public final class CancellationSignal {
  private static final CancellationSignal NONE = new CancellationSignal(false);

  private final boolean cancellable;
  private final CompletableFuture<@Nullable Void> fired = new CompletableFuture<>();
  private final Set<Registration> callbacks = ConcurrentHashMap.newKeySet();

  private CancellationSignal(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * A fresh signal that has not fired.
   */
  public static CancellationSignal create() {
    return new CancellationSignal(true);
  }

  /**
   * A shared signal that never fires; {@link #cancel()} is not supported.
   */
  public static CancellationSignal none() {
    return NONE;
  }

  /**
   * Fire the signal. Registered callbacks run on the calling thread. Firing more
   * than once has no further effect.
   *
   * @throws UnsupportedOperationException
   *           on the {@link #none()} signal
   */
  public void cancel() {
    if (!cancellable) {
      throw new UnsupportedOperationException("This signal can never be cancelled");
    }
    if (fired.complete(null)) {
      for (var registration : callbacks) {
        registration.fire();
      }
    }
  }

  @Contract(pure = true)
  public boolean isCancelled() {
    return fired.isDone();
  }

  /**
   * @throws CancellationException
   *           if the signal has fired
   */
  public void throwIfCancelled() {
    if (isCancelled()) {
      throw cancelled();
    }
  }

  /**
   * Wait for the given duration, or until the signal fires.
   *
   * @throws CancellationException
   *           if the signal fired before or during the wait
   * @throws InterruptedException
   *           if the calling thread was interrupted
   */
  public void pause(Duration duration) throws InterruptedException {
    throwIfCancelled();
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      fired.get(TimeUnit.NANOSECONDS.convert(duration), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      // Waited the full duration.
      return;
    } catch (ExecutionException e) {
      // Never completed exceptionally.
      throw new AssertionError(e);
    }
    throw cancelled();
  }

  /**
   * Run the callback when the signal fires, or straight away if it already has.
   * The callback runs at most once.
   *
   * @return a registration that removes the callback when closed
   */
  public Registration onCancel(Runnable callback) {
    var registration = new Registration(this, callback);
    if (!cancellable) {
      return registration;
    }
    callbacks.add(registration);
    if (isCancelled()) {
      registration.fire();
    }
    return registration;
  }

  private static CancellationException cancelled() {
    return new CancellationException("Request cancelled");
  }

  /**
   * A callback registered with {@link #onCancel(Runnable)}.
   */
  public static final class Registration implements AutoCloseable {
    private final CancellationSignal signal;
    private final Runnable callback;

    private Registration(CancellationSignal signal, Runnable callback) {
      this.signal = signal;
      this.callback = callback;
    }

    private void fire() {
      // Whoever removes the registration first gets to run it.
      if (signal.callbacks.remove(this)) {
        callback.run();
      }
    }

    @Override
    public void close() {
      signal.callbacks.remove(this);
    }
  }
}
