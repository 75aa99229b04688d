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
import io.cloudfn.client.exception.CloudFunctionsException;
import io.cloudfn.client.internal.concurrent.Schedulers;
import io.cloudfn.client.internal.grpc.GrpcOperationsService;
import io.grpc.ManagedChannel;
import io.grpc.netty.shaded.io.grpc.netty.GrpcSslContexts;
import io.grpc.netty.shaded.io.grpc.netty.NettyChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.File;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;

/**
 * Entry point of the Cloud Functions client.
 * <p>
 * The client owns the gRPC channels to the service and hands out {@link OperationHandle}s for
 * the long-running operations started by function deployments, updates and deletions.
 * <p>
 * The client implements {@link AutoCloseable}; closing it closes the channels, after which the
 * handles it created can no longer reach the server.
 * <pre>{@code
 * try (var client = new CloudFunctionsClient(CloudFunctionsConfig.fromEnvironment())) {
 *   var operation = client.operation(operationName);
 *   var done = operation.asPromise().toCompletableFuture().join();
 * }
 * }</pre>
 *
 * @see OperationHandle
 * @see CloudFunctionsConfig
 */
public class CloudFunctionsClient implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(CloudFunctionsClient.class);

  private final ChannelPool channelPool;
  private final OperationsService operationsService;

  /**
   * Creates a client connected according to {@code config}. Channels are opened lazily, on the
   * first call.
   *
   * @param config the connection settings
   * @throws NullPointerException if config is null
   */
  public CloudFunctionsClient(CloudFunctionsConfig config) {
    requireNonNull(config, "config must not be null");

    logger.info("Creating Cloud Functions client for {}", config.endpoint());
    this.channelPool = ManagedChannelPool.create(config.channelPoolSize(), () -> createChannel(config));
    this.operationsService = new GrpcOperationsService(channelPool);
  }

  CloudFunctionsClient(ChannelPool channelPool) {
    this.channelPool = requireNonNull(channelPool, "channelPool must not be null");
    this.operationsService = new GrpcOperationsService(channelPool);
  }

  /**
   * Returns a handle on a known operation; its complete event carries the final operation.
   *
   * @param name the operation name
   * @return an idle handle
   * @throws IllegalArgumentException if name is null or blank
   */
  public OperationHandle<Operation> operation(String name) {
    return operation(name, OperationTransforms.identity());
  }

  /**
   * Returns a handle on a known operation; its complete event carries the final operation
   * passed through {@code transform}.
   *
   * @param name      the operation name
   * @param transform decodes the done operation
   * @param <T>       the type of the completion value
   * @return an idle handle
   * @throws IllegalArgumentException if name is null or blank
   * @throws NullPointerException     if transform is null
   */
  public <T> OperationHandle<T> operation(String name, Function<Operation, T> transform) {
    return new OperationHandle<>(name, operationsService, transform, null, Schedulers.shared());
  }

  /**
   * Returns a handle on the operation just returned by a call that started it. The response
   * becomes the handle's initial {@link OperationHandle#metadata()}.
   *
   * @param response  the operation returned by the starting call
   * @param transform decodes the done operation
   * @param <T>       the type of the completion value
   * @return an idle handle
   * @throws NullPointerException     if response or transform is null
   * @throws IllegalArgumentException if the response carries no name
   */
  public <T> OperationHandle<T> operation(Operation response, Function<Operation, T> transform) {
    requireNonNull(response, "response must not be null");

    return new OperationHandle<>(response.getName(), operationsService, transform, response, Schedulers.shared());
  }

  /**
   * @return the service used by the handles of this client
   */
  public OperationsService operationsService() {
    return operationsService;
  }

  @Override
  public void close() {
    logger.info("Closing Cloud Functions client");
    channelPool.close();
  }

  private static ManagedChannel createChannel(CloudFunctionsConfig config) {
    var builder = NettyChannelBuilder.forTarget(config.endpoint())
                                     .idleTimeout(5, MINUTES)
                                     .keepAliveTime(30, SECONDS)
                                     .keepAliveTimeout(10, SECONDS);

    if (!config.sslValidation()) {
      builder.usePlaintext();
    } else if (config.caCertPem() != null && !config.caCertPem().isBlank()) {
      try {
        builder.sslContext(GrpcSslContexts.forClient().trustManager(new File(config.caCertPem())).build());
      } catch (SSLException e) {
        throw new CloudFunctionsException("Unable to load CA certificate " + config.caCertPem(), e);
      }
    } else {
      builder.useTransportSecurity();
    }

    return builder.build();
  }
}
