/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.cloudfn.client;

import io.grpc.ManagedChannel;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * A pool of gRPC channels shared by every service stub of a {@link CloudFunctionsClient}.
 * <p>
 * Callers never hold a channel: they hand the pool a function that builds a stub on the
 * channel it lends and issues the call. The channel goes back to the pool once the stage
 * returned by the call completes.
 * </p>
 *
 * @see ManagedChannelPool
 */
public interface ChannelPool extends AutoCloseable {

  /**
   * Runs an asynchronous call on a pooled channel; the channel is released when the returned
   * stage completes, normally or not. The calling thread never waits for a channel: when all
   * of them are lent, the call is issued later, on the thread releasing one.
   * <pre>{@code
   * CompletionStage<Operation> operation = channelPool.executeAsync(channel ->
   *   Futures.toCompletionStage(OperationsGrpc.newFutureStub(channel).getOperation(request))
   * );
   * }</pre>
   *
   * @param operation the call to issue
   * @param <T>       the result type
   * @return a stage completing with the result of the call
   * @throws NullPointerException if operation is null
   */
  <T> CompletionStage<T> executeAsync(Function<ManagedChannel, CompletionStage<T>> operation);

  /**
   * Shuts every channel down. Calls issued after closing fail with {@link IllegalStateException}.
   */
  @Override
  void close();

  /**
   * @return the number of channels currently owned by the pool, idle or lent
   */
  int size();

  /**
   * @return the number of idle channels
   */
  int availableChannels();
}
