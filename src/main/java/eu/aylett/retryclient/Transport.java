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

import java.io.IOException;

/**
 * One stage of the request pipeline.
 * <p>
 * Implementations either perform the network exchange themselves or decorate
 * another transport. A returned {@link Response} is owned by the caller, who
 * must close it.
 * </p>
 */
@FunctionalInterface
public interface Transport {
  /**
   * Send the request and return the response.
   *
   * @throws IOException
   *           if no response could be obtained
   * @throws InterruptedException
   *           if the calling thread was interrupted while waiting
   * @throws java.util.concurrent.CancellationException
   *           if the request's cancellation signal fired
   */
  Response dispatch(Request request) throws IOException, InterruptedException;
}
