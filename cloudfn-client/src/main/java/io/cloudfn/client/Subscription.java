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

/**
 * A listener registration on an {@link OperationHandle}.
 * <p>
 * Unsubscribing a {@code complete} listener may stop polling if it was the last one.
 * Unsubscribing twice has no further effect.
 * </p>
 */
public interface Subscription extends AutoCloseable {

  /**
   * Removes the listener. Idempotent.
   */
  void unsubscribe();

  /**
   * @return {@code true} until {@link #unsubscribe()} is called
   */
  boolean isActive();

  /**
   * Same as {@link #unsubscribe()}, for try-with-resources.
   */
  @Override
  default void close() {
    unsubscribe();
  }
}
