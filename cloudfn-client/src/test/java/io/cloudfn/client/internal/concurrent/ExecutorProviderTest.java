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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

class ExecutorProviderTest {

  @Test
  @DisplayName("parallelism should never go below two")
  void parallelism_should_never_go_below_two() {
    assertThat(ExecutorProvider.parallelism(1)).isEqualTo(2);
    assertThat(ExecutorProvider.parallelism(8)).isEqualTo(8);
  }

  @Test
  @DisplayName("callbacks should run on named daemon threads")
  void callbacks_should_run_on_named_daemon_threads() throws Exception {
    // Given
    var thread = new CompletableFuture<Thread>();

    // When
    ExecutorProvider.defaultExecutor().execute(() -> thread.complete(Thread.currentThread()));

    // Then
    var callbackThread = thread.get(1, SECONDS);
    assertThat(callbackThread.getName()).startsWith("CloudFunctions-Client-");
    assertThat(callbackThread.isDaemon()).isTrue();
  }

  @Test
  @DisplayName("callback pool should keep an uncaught failure handler")
  void callback_pool_should_keep_uncaught_failure_handler() {
    // When
    var pool = ExecutorProvider.newCallbackPool(2);

    // Then
    assertThat(pool.getUncaughtExceptionHandler()).isNotNull();
    assertThat(pool.getParallelism()).isEqualTo(2);
    assertThat(pool.getAsyncMode()).isTrue();
    pool.shutdown();
  }
}
