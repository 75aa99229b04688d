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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Provides the shared {@link Executor} on which gRPC responses are handed back to the client.
 * <p>
 * Operation listeners run on these threads, so they should stay short. A failure escaping a
 * callback is logged rather than lost with the worker thread.
 * </p>
 */
public final class ExecutorProvider {
  private static final Logger logger = LoggerFactory.getLogger(ExecutorProvider.class);

  static final String THREAD_NAME_PREFIX = "CloudFunctions-Client-";
  static final int MIN_PARALLELISM = 2;

  private static final Executor EXECUTOR = newCallbackPool(parallelism(Runtime.getRuntime().availableProcessors()));

  private ExecutorProvider() {
  }

  /**
   * @return the default shared executor
   */
  public static Executor defaultExecutor() {
    return EXECUTOR;
  }

  static int parallelism(int availableProcessors) {
    return Math.max(MIN_PARALLELISM, availableProcessors);
  }

  static ForkJoinPool newCallbackPool(int parallelism) {
    ForkJoinPool.ForkJoinWorkerThreadFactory threads = pool -> {
      var worker = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
      worker.setName(THREAD_NAME_PREFIX + worker.getPoolIndex());
      worker.setDaemon(true);
      return worker;
    };
    Thread.UncaughtExceptionHandler onFailure = (thread, error) ->
      logger.error("Uncaught failure in callback thread {}", thread.getName(), error);

    return new ForkJoinPool(parallelism, threads, onFailure, true);
  }
}
