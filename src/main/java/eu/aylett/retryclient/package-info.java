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

/**
 * An HTTP client that throttles its outgoing request rate and retries transient
 * failures.
 * <p>
 * Requests flow through a fixed chain of {@link eu.aylett.retryclient.Transport}
 * stages: {@link eu.aylett.retryclient.RetryingTransport} owns the attempt loop,
 * {@link eu.aylett.retryclient.RateLimitingTransport} admits each attempt
 * against a token bucket, and a base transport (by default
 * {@link eu.aylett.retryclient.JdkHttpTransport}) performs the exchange.
 * </p>
 * <p>
 * Use one {@link eu.aylett.retryclient.RetryClient} per remote service you
 * call, and share it between threads: the rate limit only means something if
 * every caller goes through the same bucket.
 * </p>
 * <p>
 * Only requests whose body can be produced again are retried. Pass a
 * {@link eu.aylett.retryclient.RequestBody.Replayable} body (or none) if you
 * want retries for requests carrying a payload.
 * </p>
 */
@NullMarked
package eu.aylett.retryclient;

import org.jspecify.annotations.NullMarked;
