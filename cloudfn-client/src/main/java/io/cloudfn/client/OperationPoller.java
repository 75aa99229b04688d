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

import com.google.longrunning.Operation;
import com.google.rpc.Status;
import io.cloudfn.client.exception.CloudFunctionsException;
import io.cloudfn.client.exception.OperationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static io.cloudfn.client.internal.concurrent.Futures.unwrap;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Polls an operation while it has {@code complete} listeners.
 * <p>
 * The poller is the {@link SubscriptionChangeListener} of its emitter. When the number of
 * complete listeners becomes positive and no poll cycle is in flight, it fetches the operation
 * immediately, then every {@link #POLL_INTERVAL} until the operation is done or failed.
 * </p>
 * <p>
 * A cycle is never cancelled from outside. It checks for listeners when it starts and again
 * when the response arrives; without listeners the cycle ends and the response is dropped.
 * A response is fully processed before the next fetch is scheduled, so at most one cycle is in
 * flight per operation.
 * </p>
 * <p>
 * Outcome of a response:
 * <ul>
 *   <li>the fetch failed: error event with that failure;</li>
 *   <li>the {@code error} field is set: error event with the decorated status, or with an
 *       {@link OperationFailedException} when the decoration throws or returns nothing;</li>
 *   <li>{@code done} is {@code false}: next fetch in {@link #POLL_INTERVAL};</li>
 *   <li>{@code done} is {@code true}: complete event with the transformed operation.</li>
 * </ul>
 * There is no retry: the first failure is terminal.
 *
 * @param <T> the type carried by the complete event
 */
final class OperationPoller<T> implements SubscriptionChangeListener {
  private static final Logger logger = LoggerFactory.getLogger(OperationPoller.class);

  static final Duration POLL_INTERVAL = Duration.ofMillis(500);

  private final String name;
  private final OperationsService operationsService;
  private final OperationEventEmitter<T> events;
  private final Function<Operation, T> transform;
  private final AtomicReference<Operation> lastKnown;
  private final ScheduledExecutorService scheduler;

  private final Object lock = new Object();
  private boolean cycleInFlight;
  private boolean terminal;

  OperationPoller(String name,
                  OperationsService operationsService,
                  OperationEventEmitter<T> events,
                  Function<Operation, T> transform,
                  AtomicReference<Operation> lastKnown,
                  ScheduledExecutorService scheduler) {
    this.name = requireNonNull(name, "name must not be null");
    this.operationsService = requireNonNull(operationsService, "operationsService must not be null");
    this.events = requireNonNull(events, "events must not be null");
    this.transform = requireNonNull(transform, "transform must not be null");
    this.lastKnown = requireNonNull(lastKnown, "lastKnown must not be null");
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
  }

  @Override
  public void onSubscriptionChange(int completeListeners) {
    if (completeListeners == 0) {
      logger.debug("Last complete listener of operation {} removed", name);
      return;
    }

    synchronized (lock) {
      if (terminal || cycleInFlight) return;
      cycleInFlight = true;
    }
    logger.debug("Start polling operation {}", name);
    poll();
  }

  OperationHandle.State state() {
    synchronized (lock) {
      if (terminal) return OperationHandle.State.TERMINAL;
      return cycleInFlight && events.completeListenerCount() > 0
        ? OperationHandle.State.POLLING
        : OperationHandle.State.IDLE;
    }
  }

  private void poll() {
    if (!keepPolling()) return;

    logger.trace("Polling operation {}", name);
    CompletionStage<Operation> response;
    try {
      response = operationsService.getOperation(name);
    } catch (RuntimeException e) {
      response = CompletableFuture.failedFuture(e);
    }
    response.whenComplete(this::onResponse);
  }

  private void onResponse(Operation operation, Throwable fetchError) {
    if (operation != null) lastKnown.set(operation);

    Throwable failure = null;
    if (fetchError != null) {
      failure = unwrap(fetchError);
    } else if (operation == null) {
      failure = new CloudFunctionsException("No state returned for operation " + name);
    } else if (operation.hasError()) {
      failure = decorate(operation.getError());
    }

    if (failure == null && !operation.getDone()) {
      if (keepPolling()) scheduleNextPoll();
      return;
    }

    if (!enterTerminalState()) return;

    if (failure != null) {
      logger.debug("Operation {} failed", name, failure);
      events.emitError(failure);
      return;
    }

    T result;
    try {
      result = transform.apply(operation);
    } catch (Throwable e) {
      events.emitError(new CloudFunctionsException("Unable to decode the result of operation " + name, e));
      return;
    }
    logger.debug("Operation {} completed", name);
    events.emitComplete(result);
  }

  private Throwable decorate(Status error) {
    RuntimeException decorated;
    try {
      decorated = operationsService.decorateStatus(error);
    } catch (RuntimeException e) {
      logger.warn("Unable to decorate the error of operation {}, reporting the raw status", name, e);
      var fallback = OperationFailedException.fromStatus(error);
      fallback.addSuppressed(e);
      return fallback;
    }
    if (decorated == null) {
      logger.warn("Error decoration of operation {} returned nothing, reporting the raw status", name);
      return OperationFailedException.fromStatus(error);
    }
    return decorated;
  }

  private void scheduleNextPoll() {
    try {
      scheduler.schedule(this::poll, POLL_INTERVAL.toMillis(), MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.error("Unable to schedule the next poll of operation {}", name, e);
      if (enterTerminalState()) {
        events.emitError(new CloudFunctionsException("Polling of operation " + name + " was interrupted", e));
      }
    }
  }

  private boolean keepPolling() {
    synchronized (lock) {
      if (terminal) {
        cycleInFlight = false;
        return false;
      }
      if (events.completeListenerCount() == 0) {
        cycleInFlight = false;
        logger.debug("No complete listener left on operation {}, polling stopped", name);
        return false;
      }
      return true;
    }
  }

  private boolean enterTerminalState() {
    synchronized (lock) {
      if (terminal) return false;
      if (events.completeListenerCount() == 0) {
        cycleInFlight = false;
        logger.debug("No complete listener left on operation {}, dropping its final state", name);
        return false;
      }
      terminal = true;
      cycleInFlight = false;
      return true;
    }
  }
}
