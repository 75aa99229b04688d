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

/**
 * Base exception for all Cloud Functions client operations.
 * <p>
 * This unchecked exception is raised when talking to the Cloud Functions or long-running
 * operations services fails, or when the client cannot make sense of what those services
 * returned. It may wrap a lower-level gRPC or decoding error.
 * </p>
 */
public class CloudFunctionsException extends RuntimeException {

  /**
   * Creates a new exception with the specified error message.
   *
   * @param message the detail message
   */
  public CloudFunctionsException(String message) {
    super(message);
  }

  /**
   * Creates a new exception with the specified error message and cause.
   *
   * @param message the detail message
   * @param cause   the underlying cause; may be {@code null}
   */
  public CloudFunctionsException(String message, Throwable cause) {
    super(message, cause);
  }
}
