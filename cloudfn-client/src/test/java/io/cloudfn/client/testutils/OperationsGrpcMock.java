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
package io.cloudfn.client.testutils;

import com.google.longrunning.CancelOperationRequest;
import com.google.longrunning.DeleteOperationRequest;
import com.google.longrunning.GetOperationRequest;
import com.google.longrunning.Operation;
import com.google.longrunning.OperationsGrpc;
import com.google.protobuf.Empty;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Operations service answering GetOperation with scripted states, one per call; the last
 * state of a script is repeated once the script is exhausted.
 */
public class OperationsGrpcMock extends OperationsGrpc.OperationsImplBase {

  public final List<GetOperationRequest> submittedGetRequests = new CopyOnWriteArrayList<>();
  public final List<CancelOperationRequest> submittedCancelRequests = new CopyOnWriteArrayList<>();
  public final List<DeleteOperationRequest> submittedDeleteRequests = new CopyOnWriteArrayList<>();

  private final Map<String, ConcurrentLinkedDeque<Operation>> scripts = new ConcurrentHashMap<>();

  public void script(String name, Operation... states) {
    scripts.put(name, new ConcurrentLinkedDeque<>(List.of(states)));
  }

  public void reset() {
    scripts.clear();
    submittedGetRequests.clear();
    submittedCancelRequests.clear();
    submittedDeleteRequests.clear();
  }

  @Override
  public void getOperation(GetOperationRequest request, StreamObserver<Operation> responseObserver) {
    submittedGetRequests.add(request);

    var script = scripts.get(request.getName());
    if (script == null || script.isEmpty()) {
      responseObserver.onError(Status.NOT_FOUND.withDescription("Operation not found").asRuntimeException());
      return;
    }

    var state = script.size() > 1 ? script.poll() : script.peek();
    responseObserver.onNext(state);
    responseObserver.onCompleted();
  }

  @Override
  public void cancelOperation(CancelOperationRequest request, StreamObserver<Empty> responseObserver) {
    submittedCancelRequests.add(request);
    respondIfKnown(request.getName(), responseObserver);
  }

  @Override
  public void deleteOperation(DeleteOperationRequest request, StreamObserver<Empty> responseObserver) {
    submittedDeleteRequests.add(request);
    respondIfKnown(request.getName(), responseObserver);
  }

  private void respondIfKnown(String name, StreamObserver<Empty> responseObserver) {
    if (!scripts.containsKey(name)) {
      responseObserver.onError(Status.NOT_FOUND.withDescription("Operation not found").asRuntimeException());
      return;
    }
    responseObserver.onNext(Empty.getDefaultInstance());
    responseObserver.onCompleted();
  }
}
