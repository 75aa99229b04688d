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
import com.google.protobuf.Empty;
import io.cloudfn.client.internal.concurrent.Schedulers;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Client-side handle on a long-running operation started by a Cloud Functions call.
 * <p>
 * A handle is inert until someone waits for the operation: registering a {@code complete}
 * listener, or calling {@link #asPromise()}, starts polling the operation; removing the last
 * {@code complete} listener lets polling stop. Any number of listeners share a single poll
 * loop.
 * <pre>{@code
 * var operation = client.operation("operations/abc123", OperationTransforms.unpackResponse(StringValue.class));
 *
 * operation.onError(error -> logger.error("Deployment failed", error));
 * operation.onComplete(result -> logger.info("Deployed {}", result.getValue()));
 *
 * // or
 * var result = operation.asPromise().toCompletableFuture().join();
 * }</pre>
 * <p>
 * When the server reports the operation as done, the {@code complete} event carries the
 * operation transformed by the function given at creation. When the fetch fails, or the
 * operation carries an error, the {@code error} event carries that failure. Either event fires
 * at most once and is not replayed to listeners registered afterwards.
 * </p>
 * <p>
 * {@link #get()}, {@link #cancel()} and {@link #delete()} are one-shot calls and do not affect
 * polling.
 * </p>
 *
 * @param <T> the type carried by the complete event
 * @see CloudFunctionsClient#operation(String)
 * @see OperationTransforms
 */
public final class OperationHandle<T> {

  /**
   * Polling state of a handle.
   */
  public enum State {
    /** No complete listener, no poll in progress. */
    IDLE,
    /** At least one complete listener, the operation is being polled. */
    POLLING,
    /** A complete or error event fired; the operation is never polled again. */
    TERMINAL
  }

  private final String name;
  private final OperationsService operationsService;
  private final AtomicReference<Operation> lastKnown;
  private final OperationEventEmitter<T> events;
  private final OperationPoller<T> poller;

  OperationHandle(String name,
                  OperationsService operationsService,
                  Function<Operation, T> transform,
                  Operation initialState,
                  ScheduledExecutorService scheduler) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("A name must be specified for an operation");

    this.name = name;
    this.operationsService = requireNonNull(operationsService, "operationsService must not be null");
    this.lastKnown = new AtomicReference<>(initialState);
    this.events = new OperationEventEmitter<>(name);
    this.poller = new OperationPoller<>(name, operationsService, events, transform, lastKnown, scheduler);
    this.events.onSubscriptionChange(poller);
  }

  /**
   * Creates a handle whose complete event carries the final operation as returned by the
   * server.
   *
   * @param operationsService the service used to fetch, cancel and delete the operation
   * @param name              the operation name
   * @return a new idle handle
   * @throws IllegalArgumentException if name is null or blank
   * @throws NullPointerException     if operationsService is null
   */
  public static OperationHandle<Operation> create(OperationsService operationsService, String name) {
    return create(operationsService, name, OperationTransforms.identity());
  }

  /**
   * Creates a handle whose complete event carries the final operation passed through
   * {@code transform}.
   * <p>
   * A transform that throws turns the completion into an error event.
   *
   * @param operationsService the service used to fetch, cancel and delete the operation
   * @param name              the operation name
   * @param transform         decodes the done operation into the completion value
   * @param <T>               the type of the completion value
   * @return a new idle handle
   * @throws IllegalArgumentException if name is null or blank
   * @throws NullPointerException     if operationsService or transform is null
   */
  public static <T> OperationHandle<T> create(OperationsService operationsService,
                                              String name,
                                              Function<Operation, T> transform) {
    return new OperationHandle<>(name, operationsService, transform, null, Schedulers.shared());
  }

  /**
   * @return the operation name
   */
  public String name() {
    return name;
  }

  /**
   * Returns the operation as last received from the server, by polling or by {@link #get()}.
   *
   * @return the last known operation, empty if it was never fetched
   */
  public Optional<Operation> metadata() {
    return Optional.ofNullable(lastKnown.get());
  }

  /**
   * @return the polling state of this handle
   */
  public State state() {
    return poller.state();
  }

  /**
   * Fetches the operation once.
   *
   * @return a stage completing with the operation, or with the failure of the call
   */
  public CompletionStage<Operation> get() {
    return operationsService.getOperation(name)
                            .thenApply(operation -> {
                              lastKnown.set(operation);
                              return operation;
                            });
  }

  /**
   * Asks the server to cancel the operation.
   * <p>
   * If the server honours the request, the operation ends with a {@code CANCELLED} error that
   * polling reports through the error event.
   *
   * @return a stage completing once the request was accepted, or with the failure of the call
   */
  public CompletionStage<Empty> cancel() {
    return operationsService.cancelOperation(name);
  }

  /**
   * Deletes the operation on the server.
   *
   * @return a stage completing once the request was accepted, or with the failure of the call
   */
  public CompletionStage<Empty> delete() {
    return operationsService.deleteOperation(name);
  }

  /**
   * Registers a listener for the completion of the operation. Starts polling if this is the
   * first complete listener.
   *
   * @param listener called once with the completion value
   * @return the registration, to unsubscribe
   * @throws NullPointerException if listener is null
   */
  public Subscription onComplete(Consumer<? super T> listener) {
    return events.onComplete(listener);
  }

  /**
   * Registers a listener for the failure of the operation. Error listeners alone do not start
   * polling.
   *
   * @param listener called once with the failure
   * @return the registration, to unsubscribe
   * @throws NullPointerException if listener is null
   */
  public Subscription onError(Consumer<? super Throwable> listener) {
    return events.onError(listener);
  }

  /**
   * Returns a stage completing with the outcome of the operation.
   * <p>
   * This registers an error listener and a complete listener, exactly as a caller would, so it
   * starts polling. Both listeners are removed once the stage completes. Cancelling the stage,
   * through {@code toCompletableFuture().cancel(...)}, removes them too, which stops polling
   * when no other complete listener is left.
   * <p>
   * Called after the operation reached its terminal state, the returned stage never completes.
   *
   * @return a stage completing with the completion value, or exceptionally with the failure
   */
  public CompletionStage<T> asPromise() {
    var promise = new CompletableFuture<T>();
    var errorSubscription = events.onError(promise::completeExceptionally);
    var completeSubscription = events.onComplete(promise::complete);

    promise.whenComplete((result, error) -> {
      completeSubscription.unsubscribe();
      errorSubscription.unsubscribe();
    });
    return promise;
  }

  @Override
  public String toString() {
    return "OperationHandle{name='" + name + "', state=" + state() + '}';
  }
}
