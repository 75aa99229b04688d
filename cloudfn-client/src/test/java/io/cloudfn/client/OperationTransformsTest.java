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
import com.google.protobuf.Any;
import com.google.protobuf.Int64Value;
import com.google.protobuf.StringValue;
import io.cloudfn.client.exception.CloudFunctionsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static io.cloudfn.client.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationTransformsTest {

  @Test
  @DisplayName("identity should return the operation itself")
  void identity_should_return_operation_itself() {
    // Given
    var operation = done(OPERATION_NAME, "X");

    // When
    var result = OperationTransforms.identity().apply(operation);

    // Then
    assertThat(result).isSameAs(operation);
  }

  @Test
  @DisplayName("unpack response should decode the packed message")
  void unpack_response_should_decode_packed_message() {
    // When
    var result = OperationTransforms.unpackResponse(StringValue.class).apply(done(OPERATION_NAME, "hello"));

    // Then
    assertThat(result.getValue()).isEqualTo("hello");
  }

  @Test
  @DisplayName("unpack response should fail when the response has another type")
  void unpack_response_should_fail_when_response_has_another_type() {
    // Given
    var operation = Operation.newBuilder()
                             .setName(OPERATION_NAME)
                             .setDone(true)
                             .setResponse(Any.pack(Int64Value.of(42)))
                             .build();
    var transform = OperationTransforms.unpackResponse(StringValue.class);

    // When / Then
    assertThatThrownBy(() -> transform.apply(operation))
      .isInstanceOf(CloudFunctionsException.class)
      .hasMessageContaining("is not a StringValue");
  }

  @Test
  @DisplayName("unpack response should fail when the operation has no response")
  void unpack_response_should_fail_when_operation_has_no_response() {
    // Given
    var transform = OperationTransforms.unpackResponse(StringValue.class);

    // When / Then
    assertThatThrownBy(() -> transform.apply(pending(OPERATION_NAME)))
      .isInstanceOf(CloudFunctionsException.class)
      .hasMessage("Operation " + OPERATION_NAME + " has no response");
  }
}
