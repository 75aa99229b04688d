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
package io.cloudfn.client.internal.grpc.mappers;

import com.google.longrunning.CancelOperationRequest;
import com.google.longrunning.DeleteOperationRequest;
import com.google.longrunning.GetOperationRequest;

public final class OperationMapper {

  private OperationMapper() {
  }

  public static GetOperationRequest toGetOperationRequest(String name) {
    return GetOperationRequest.newBuilder()
                              .setName(name)
                              .build();
  }

  public static CancelOperationRequest toCancelOperationRequest(String name) {
    return CancelOperationRequest.newBuilder()
                                 .setName(name)
                                 .build();
  }

  public static DeleteOperationRequest toDeleteOperationRequest(String name) {
    return DeleteOperationRequest.newBuilder()
                                 .setName(name)
                                 .build();
  }
}
