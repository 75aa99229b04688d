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

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

/**
 * Holds the scheduler used to delay operation polls.
 * <p>
 * A single daemon thread is enough: a scheduled task only issues a non-blocking status fetch,
 * the response is processed on the gRPC callback executor. Cancelled tasks are removed
 * immediately and delayed tasks are dropped on shutdown, so a handle polling at shutdown ends
 * with an error event instead of hanging.
 */
public final class Schedulers {
  static final String POLLER_THREAD_NAME = "cloudfn-operation-poller";

  private Schedulers() {
  }

  /**
   * Returns the scheduler shared by every operation handle. Callers must not shut it down.
   *
   * @return the shared scheduled executor service
   */
  public static ScheduledExecutorService shared() {
    return PollerHolder.POLLER;
  }

  static ScheduledThreadPoolExecutor newPollerScheduler() {
    var scheduler = new ScheduledThreadPoolExecutor(1, daemonThread(POLLER_THREAD_NAME));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  private static ThreadFactory daemonThread(String name) {
    return task -> {
      var thread = new Thread(task, name);
      thread.setDaemon(true);
      return thread;
    };
  }

  // created on first use, handles built only for get/cancel/delete never start the thread
  private static final class PollerHolder {
    private static final ScheduledThreadPoolExecutor POLLER = newPollerScheduler();

    static {
      Runtime.getRuntime().addShutdownHook(new Thread(POLLER::shutdown, POLLER_THREAD_NAME + "-shutdown"));
    }
  }
}
