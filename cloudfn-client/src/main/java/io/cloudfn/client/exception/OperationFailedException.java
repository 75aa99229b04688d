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
package io.cloudfn.client.exception;

import com.google.rpc.Status;
import io.grpc.protobuf.StatusProto;

import static java.util.Objects.requireNonNull;

/**
 * Raised when a long-running operation completed on the server side with an error.
 * <p>
 * The remote call that fetched the operation succeeded, but the operation itself carries a
 * populated {@code error} field. The raw {@link Status} is kept so callers can inspect the
 * error details, and the equivalent {@link io.grpc.StatusRuntimeException} is attached as
 * the cause.
 * </p>
 *
 * @see #fromStatus(Status)
 */
public class OperationFailedException extends CloudFunctionsException {
  private final transient Status status;
  private final io.grpc.Status.Code code;

  private OperationFailedException(Status status) {
    super(messageOf(status), StatusProto.toStatusRuntimeException(status));
    this.status = status;
    this.code = io.grpc.Status.fromCodeValue(status.getCode()).getCode();
  }

  /**
   * Converts a logical failure payload into an exception.
   *
   * @param status the {@code error} field of an operation
   * @return the decorated error
   * @throws NullPointerException if status is null
   */
  public static OperationFailedException fromStatus(Status status) {
    requireNonNull(status, "status must not be null");
    return new OperationFailedException(status);
  }

  /**
   * @return the gRPC code of the failure
   */
  public io.grpc.Status.Code code() {
    return code;
  }

  /**
   * @return the failure payload as returned by the server
   */
  public Status status() {
    return status;
  }

  private static String messageOf(Status status) {
    var code = io.grpc.Status.fromCodeValue(status.getCode()).getCode();
    return status.getMessage().isBlank() ? code.name() : code.name() + ": " + status.getMessage();
  }
}
