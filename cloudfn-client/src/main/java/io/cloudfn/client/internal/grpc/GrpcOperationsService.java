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
package io.cloudfn.client.internal.grpc;

import com.google.longrunning.Operation;
import com.google.longrunning.OperationsGrpc;
import com.google.protobuf.Empty;
import io.cloudfn.client.ChannelPool;
import io.cloudfn.client.OperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionStage;

import static io.cloudfn.client.internal.concurrent.Futures.toCompletionStage;
import static io.cloudfn.client.internal.grpc.mappers.OperationMapper.toCancelOperationRequest;
import static io.cloudfn.client.internal.grpc.mappers.OperationMapper.toDeleteOperationRequest;
import static io.cloudfn.client.internal.grpc.mappers.OperationMapper.toGetOperationRequest;
import static java.util.Objects.requireNonNull;

/**
 * {@link OperationsService} backed by the {@code google.longrunning.Operations} gRPC service.
 * <p>
 * Every call borrows a channel from the {@link ChannelPool} for the duration of the call and
 * uses a future stub, so no thread blocks while the server answers. Failures are the
 * {@link io.grpc.StatusRuntimeException}s raised by gRPC, untouched.
 * </p>
 */
public final class GrpcOperationsService implements OperationsService {
  private static final Logger logger = LoggerFactory.getLogger(GrpcOperationsService.class);

  private final ChannelPool channelPool;

  public GrpcOperationsService(ChannelPool channelPool) {
    this.channelPool = requireNonNull(channelPool, "channelPool must not be null");
  }

  @Override
  public CompletionStage<Operation> getOperation(String name) {
    logger.trace("GetOperation {}", name);
    return channelPool.executeAsync(channel ->
      toCompletionStage(OperationsGrpc.newFutureStub(channel).getOperation(toGetOperationRequest(name)))
    );
  }

  @Override
  public CompletionStage<Empty> cancelOperation(String name) {
    logger.debug("CancelOperation {}", name);
    return channelPool.executeAsync(channel ->
      toCompletionStage(OperationsGrpc.newFutureStub(channel).cancelOperation(toCancelOperationRequest(name)))
    );
  }

  @Override
  public CompletionStage<Empty> deleteOperation(String name) {
    logger.debug("DeleteOperation {}", name);
    return channelPool.executeAsync(channel ->
      toCompletionStage(OperationsGrpc.newFutureStub(channel).deleteOperation(toDeleteOperationRequest(name)))
    );
  }
}
