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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class OperationEventEmitterTest {

  private OperationEventEmitter<String> emitter;
  private final List<Integer> subscriptionChanges = new CopyOnWriteArrayList<>();
  private final List<String> completions = new CopyOnWriteArrayList<>();
  private final List<Throwable> errors = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    emitter = new OperationEventEmitter<>("operations/test");
    emitter.onSubscriptionChange(subscriptionChanges::add);
    subscriptionChanges.clear();
    completions.clear();
    errors.clear();
  }

  @Test
  @DisplayName("should publish the complete listener count on every registration change")
  void should_publish_complete_listener_count_on_every_change() {
    // When
    var first = emitter.onComplete(completions::add);
    var second = emitter.onComplete(completions::add);
    first.unsubscribe();
    second.unsubscribe();

    // Then
    assertThat(subscriptionChanges).containsExactly(1, 2, 1, 0);
    assertThat(emitter.completeListenerCount()).isZero();
  }

  @Test
  @DisplayName("error listeners should not count as complete listeners")
  void error_listeners_should_not_count_as_complete_listeners() {
    // When
    var subscription = emitter.onError(errors::add);
    subscription.unsubscribe();

    // Then
    assertThat(subscriptionChanges).isEmpty();
    assertThat(emitter.completeListenerCount()).isZero();
  }

  @Test
  @DisplayName("registering the same consumer twice should create two independent subscriptions")
  void same_consumer_registered_twice_should_create_two_subscriptions() {
    // Given
    Consumer<String> listener = completions::add;
    var first = emitter.onComplete(listener);
    emitter.onComplete(listener);

    // When
    first.unsubscribe();
    first.close();
    emitter.emitComplete("done");

    // Then
    assertThat(subscriptionChanges).containsExactly(1, 2, 1);
    assertThat(completions).containsExactly("done");
  }

  @Test
  @DisplayName("should emit a single terminal event")
  void should_emit_single_terminal_event() {
    // Given
    emitter.onComplete(completions::add);
    emitter.onError(errors::add);

    // When
    var completeEmitted = emitter.emitComplete("first");
    var errorEmitted = emitter.emitError(new IllegalStateException("late"));
    var secondCompleteEmitted = emitter.emitComplete("second");

    // Then
    assertThat(completeEmitted).isTrue();
    assertThat(errorEmitted).isFalse();
    assertThat(secondCompleteEmitted).isFalse();
    assertThat(completions).containsExactly("first");
    assertThat(errors).isEmpty();
  }

  @Test
  @DisplayName("should not replay the terminal event to late listeners")
  void should_not_replay_terminal_event_to_late_listeners() {
    // Given
    emitter.emitError(new IllegalStateException("boom"));

    // When
    emitter.onError(errors::add);
    emitter.onComplete(completions::add);

    // Then
    assertThat(errors).isEmpty();
    assertThat(completions).isEmpty();
  }

  @Test
  @DisplayName("should not notify unsubscribed listeners")
  void should_not_notify_unsubscribed_listeners() {
    // Given
    emitter.onError(errors::add).unsubscribe();
    var kept = new CopyOnWriteArrayList<Throwable>();
    emitter.onError(kept::add);
    var failure = new IllegalStateException("boom");

    // When
    emitter.emitError(failure);

    // Then
    assertThat(errors).isEmpty();
    assertThat(kept).containsExactly(failure);
  }

  @Test
  @DisplayName("should emit an error even when nobody listens to it")
  void should_emit_error_when_nobody_listens() {
    // When
    var emitted = emitter.emitError(new IllegalStateException("unobserved"));

    // Then
    assertThat(emitted).isTrue();
    assertThat(emitter.emitComplete("after")).isFalse();
  }

  @Test
  @DisplayName("a throwing error listener should not prevent the others from being notified")
  void throwing_error_listener_should_not_prevent_others() {
    // Given
    emitter.onError(error -> {
      throw new IllegalStateException("listener failure");
    });
    emitter.onError(errors::add);

    // When
    emitter.emitError(new IllegalArgumentException("boom"));

    // Then
    assertThat(errors).singleElement().isInstanceOf(IllegalArgumentException.class);
  }
}
