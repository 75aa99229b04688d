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
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import io.cloudfn.client.exception.CloudFunctionsException;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Completion transforms for {@link OperationHandle}s.
 * <p>
 * A transform turns the done operation into the value carried by the complete event. Calls
 * that create or update a function expect the function itself, calls that delete it only
 * care about the operation.
 */
public final class OperationTransforms {

  private OperationTransforms() {
  }

  /**
   * @return a transform yielding the operation itself
   */
  public static Function<Operation, Operation> identity() {
    return Function.identity();
  }

  /**
   * Returns a transform that unpacks the {@code response} field of the operation.
   *
   * @param type the expected message type of the response
   * @param <M>  the message type
   * @return a transform yielding the unpacked response
   * @throws NullPointerException if type is null
   */
  public static <M extends Message> Function<Operation, M> unpackResponse(Class<M> type) {
    requireNonNull(type, "type must not be null");

    return operation -> {
      if (!operation.hasResponse()) {
        throw new CloudFunctionsException("Operation " + operation.getName() + " has no response");
      }
      try {
        return operation.getResponse().unpack(type);
      } catch (InvalidProtocolBufferException e) {
        throw new CloudFunctionsException(
          "Response of operation " + operation.getName() + " is not a " + type.getSimpleName(), e);
      }
    };
  }
}
