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
import com.google.rpc.Status;
import io.cloudfn.client.exception.OperationFailedException;
import io.cloudfn.client.internal.grpc.GrpcOperationsService;

import java.util.concurrent.CompletionStage;

/**
 * The remote side an {@link OperationHandle} talks to.
 * <p>
 * Each method issues exactly one call keyed by the operation name and reports the raw
 * response, or the failure, through the returned stage. Implementations perform no retry and
 * keep no per-operation state, so one instance is shared by every handle of a client.
 * </p>
 *
 * @see GrpcOperationsService
 */
public interface OperationsService {

  /**
   * Fetches the current state of an operation.
   *
   * @param name the operation name
   * @return a stage completing with the operation as known by the server
   */
  CompletionStage<Operation> getOperation(String name);

  /**
   * Requests the cancellation of an operation. The server handles it on a best-effort basis.
   *
   * @param name the operation name
   * @return a stage completing once the server accepted the request
   */
  CompletionStage<Empty> cancelOperation(String name);

  /**
   * Deletes an operation. Its result is no longer retrievable afterwards.
   *
   * @param name the operation name
   * @return a stage completing once the server accepted the request
   */
  CompletionStage<Empty> deleteOperation(String name);

  /**
   * Converts the {@code error} field of a failed operation into an exception.
   *
   * @param status the failure payload
   * @return the error surfaced to operation listeners
   */
  default RuntimeException decorateStatus(Status status) {
    return OperationFailedException.fromStatus(status);
  }
}
