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
package io.cloudfn.client.testutils;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Scheduler whose delayed tasks only run when the test says so.
 */
public class ManualScheduler {

  private final ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
  private final Queue<Runnable> tasks = new ArrayDeque<>();
  private final List<Long> delaysMillis = new CopyOnWriteArrayList<>();

  public ManualScheduler() {
    when(executor.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
      Runnable task = invocation.getArgument(0);
      Long delay = invocation.getArgument(1);
      TimeUnit unit = invocation.getArgument(2);
      synchronized (tasks) {
        tasks.add(task);
      }
      delaysMillis.add(unit.toMillis(delay));
      return mock(ScheduledFuture.class);
    });
  }

  public ScheduledExecutorService executor() {
    return executor;
  }

  public int pendingTasks() {
    synchronized (tasks) {
      return tasks.size();
    }
  }

  public List<Long> delaysMillis() {
    return delaysMillis;
  }

  /** Runs the oldest scheduled task, as if its delay had elapsed. */
  public void runNext() {
    Runnable task;
    synchronized (tasks) {
      task = tasks.poll();
    }
    if (task == null) throw new IllegalStateException("No scheduled task");
    task.run();
  }
}
