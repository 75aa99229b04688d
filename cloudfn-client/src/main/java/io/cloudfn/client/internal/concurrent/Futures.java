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
package io.cloudfn.client.internal.concurrent;

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.ListenableFuture;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import static com.google.common.util.concurrent.Futures.addCallback;
import static io.cloudfn.client.internal.concurrent.ExecutorProvider.defaultExecutor;
import static java.util.Objects.requireNonNull;

/**
 * Bridges the Guava futures returned by gRPC future stubs to Java {@link CompletionStage}s.
 */
public final class Futures {
  private Futures() {
  }

  /**
   * Adapts a Guava {@link ListenableFuture} to a Java {@link CompletionStage}.
   * <ul>
   *   <li>On success, the stage completes with the value.</li>
   *   <li>On failure, the stage completes exceptionally with the original throwable, or is
   *       cancelled if that throwable is a {@link CancellationException}.</li>
   *   <li>Cancelling the returned stage cancels the source future.</li>
   * </ul>
   * Callbacks run on {@link ExecutorProvider#defaultExecutor()}.
   *
   * @param listenableFuture the source future
   * @param <T>              the result type
   * @return a stage mirroring the source future
   * @throws NullPointerException if listenableFuture is null
   */
  public static <T> CompletionStage<T> toCompletionStage(ListenableFuture<T> listenableFuture) {
    requireNonNull(listenableFuture);

    CompletableFuture<T> completableFuture = new CompletableFuture<>();
    addCallback(listenableFuture, completingCallback(completableFuture), defaultExecutor());

    completableFuture.whenComplete((value, throwable) -> {
      if (completableFuture.isCancelled()) listenableFuture.cancel(true);
    });

    return completableFuture;
  }

  /**
   * Strips the {@link CompletionException} and {@link ExecutionException} wrappers added by
   * stage composition, returning the failure that actually happened.
   *
   * @param throwable the failure observed by a stage callback
   * @return the innermost wrapped cause, or {@code throwable} itself
   */
  public static Throwable unwrap(Throwable throwable) {
    var current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static <T> FutureCallback<T> completingCallback(CompletableFuture<T> completableFuture) {
    return new FutureCallback<>() {
      @Override
      public void onSuccess(T result) {
        completableFuture.complete(result);
      }

      @Override
      public void onFailure(Throwable throwable) {
        if (throwable instanceof CancellationException) {
          completableFuture.cancel(false);
        } else {
          completableFuture.completeExceptionally(throwable);
        }
      }
    };
  }
}
