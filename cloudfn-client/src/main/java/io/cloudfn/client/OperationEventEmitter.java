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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * The two terminal notification channels of an operation: {@code complete} and {@code error}.
 * <p>
 * At most one of them ever fires, once. Listeners registered after that are kept but never
 * called: nothing is replayed. Listeners are invoked outside the emitter lock, on the thread
 * emitting the event; a listener that throws is logged and the remaining ones are still
 * notified.
 * </p>
 * <p>
 * The number of {@code complete} listeners is published to a {@link SubscriptionChangeListener}
 * registered with {@link #onSubscriptionChange(SubscriptionChangeListener)}; this is how the
 * owning {@link OperationHandle} starts polling.
 * </p>
 *
 * @param <T> the type carried by the complete event
 */
final class OperationEventEmitter<T> {
  private static final Logger logger = LoggerFactory.getLogger(OperationEventEmitter.class);

  private final String operationName;
  private final Object lock = new Object();
  private final List<Registration<Consumer<? super T>>> completeListeners = new ArrayList<>();
  private final List<Registration<Consumer<? super Throwable>>> errorListeners = new ArrayList<>();
  private volatile SubscriptionChangeListener subscriptionChangeListener = count -> {};
  private boolean terminated;

  OperationEventEmitter(String operationName) {
    this.operationName = requireNonNull(operationName, "operationName must not be null");
  }

  void onSubscriptionChange(SubscriptionChangeListener listener) {
    this.subscriptionChangeListener = requireNonNull(listener, "listener must not be null");
  }

  Subscription onComplete(Consumer<? super T> listener) {
    requireNonNull(listener, "listener must not be null");

    var registration = new Registration<Consumer<? super T>>(listener);
    int count;
    synchronized (lock) {
      completeListeners.add(registration);
      count = completeListeners.size();
    }
    subscriptionChangeListener.onSubscriptionChange(count);

    return new RegistrationSubscription(registration, () -> {
      int remaining;
      synchronized (lock) {
        completeListeners.remove(registration);
        remaining = completeListeners.size();
      }
      subscriptionChangeListener.onSubscriptionChange(remaining);
    });
  }

  Subscription onError(Consumer<? super Throwable> listener) {
    requireNonNull(listener, "listener must not be null");

    var registration = new Registration<Consumer<? super Throwable>>(listener);
    synchronized (lock) {
      errorListeners.add(registration);
    }
    return new RegistrationSubscription(registration, () -> {
      synchronized (lock) {
        errorListeners.remove(registration);
      }
    });
  }

  int completeListenerCount() {
    synchronized (lock) {
      return completeListeners.size();
    }
  }

  /**
   * Fires the complete event, unless a terminal event already fired.
   *
   * @return whether the event was emitted
   */
  boolean emitComplete(T value) {
    List<Registration<Consumer<? super T>>> snapshot;
    synchronized (lock) {
      if (terminated) return false;
      terminated = true;
      snapshot = List.copyOf(completeListeners);
    }

    snapshot.forEach(registration -> deliver(registration, value, "complete"));
    return true;
  }

  /**
   * Fires the error event, unless a terminal event already fired.
   *
   * @return whether the event was emitted
   */
  boolean emitError(Throwable error) {
    List<Registration<Consumer<? super Throwable>>> snapshot;
    synchronized (lock) {
      if (terminated) return false;
      terminated = true;
      snapshot = List.copyOf(errorListeners);
    }

    if (snapshot.isEmpty()) {
      logger.warn("Operation {} failed and no error listener is registered", operationName, error);
    }
    snapshot.forEach(registration -> deliver(registration, error, "error"));
    return true;
  }

  private <V> void deliver(Registration<Consumer<? super V>> registration, V value, String event) {
    try {
      registration.listener.accept(value);
    } catch (RuntimeException e) {
      logger.warn("A {} listener of operation {} threw an exception", event, operationName, e);
    }
  }

  // compared by identity, the same consumer may be registered twice
  private static final class Registration<L> {
    private final L listener;

    private Registration(L listener) {
      this.listener = listener;
    }
  }

  private static final class RegistrationSubscription implements Subscription {
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final Registration<?> registration;
    private final Runnable removal;

    private RegistrationSubscription(Registration<?> registration, Runnable removal) {
      this.registration = registration;
      this.removal = removal;
    }

    @Override
    public void unsubscribe() {
      if (active.compareAndSet(true, false)) removal.run();
    }

    @Override
    public boolean isActive() {
      return active.get();
    }

    @Override
    public String toString() {
      return "Subscription{listener=" + registration.listener + ", active=" + active.get() + '}';
    }
  }
}
