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

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * A bounded pool of admission tokens. Starts empty; {@link #deposit()} adds one
 * token unless the pool is already full, and {@link #take(CancellationSignal)}
 * blocks until it can remove one. Once {@link #close() closed}, every taker
 * fails, including those already waiting.
 */
final class TokenBucket {
  private final int capacity;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition available = lock.newCondition();
  private int tokens;
  private boolean closed;

  TokenBucket(int capacity) {
    checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
  }

  /**
   * Add a token.
   *
   * @return false if the bucket was full and the token was dropped
   */
  boolean deposit() {
    lock.lock();
    try {
      if (tokens >= capacity) {
        return false;
      }
      tokens++;
      available.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Remove a token, waiting for one if necessary.
   *
   * @throws java.util.concurrent.CancellationException
   *           if the signal fires while no token is available
   * @throws InterruptedException
   *           if the calling thread is interrupted while waiting
   * @throws IllegalStateException
   *           if the bucket is closed before a token could be taken
   */
  void take(CancellationSignal signal) throws InterruptedException {
    signal.throwIfCancelled();
    try (var registration = signal.onCancel(this::wakeAll)) {
      lock.lockInterruptibly();
      try {
        // A waiter only gives up while the bucket is empty, so no deposit
        // signal is lost to a cancelled thread.
        checkState(!closed, "Rate limiter is closed");
        while (tokens == 0) {
          signal.throwIfCancelled();
          available.await();
          checkState(!closed, "Rate limiter is closed");
        }
        tokens--;
      } finally {
        lock.unlock();
      }
    }
  }

  /**
   * Fail every current and future {@link #take(CancellationSignal)}.
   */
  void close() {
    lock.lock();
    try {
      closed = true;
      available.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  int capacity() {
    return capacity;
  }

  @VisibleForTesting
  int available() {
    lock.lock();
    try {
      return tokens;
    } finally {
      lock.unlock();
    }
  }

  private void wakeAll() {
    lock.lock();
    try {
      available.signalAll();
    } finally {
      lock.unlock();
    }
  }
}
