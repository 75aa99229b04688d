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

import io.grpc.ManagedChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

import static io.cloudfn.client.internal.concurrent.Futures.unwrap;
import static java.util.Objects.requireNonNull;

/**
 * {@link ChannelPool} creating channels lazily from a factory, up to a maximum size.
 * <p>
 * Calls never block the calling thread, which is often the single poll scheduler thread:
 * when every channel is lent, calls wait in FIFO order and are issued as soon as a channel is
 * released. Channels found in {@code TRANSIENT_FAILURE} or {@code SHUTDOWN} state, on
 * acquisition or on release, are shut down and dropped.
 * </p>
 * <p>
 * Operation polls are unary and short-lived, so a handful of channels serve many concurrent
 * {@link OperationHandle}s.
 * </p>
 */
public final class ManagedChannelPool implements ChannelPool {
  private static final Logger logger = LoggerFactory.getLogger(ManagedChannelPool.class);
  private static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

  private final Supplier<ManagedChannel> channelFactory;
  private final Semaphore permits;
  private final Queue<ManagedChannel> idleChannels = new ConcurrentLinkedQueue<>();
  private final Set<ManagedChannel> ownedChannels = ConcurrentHashMap.newKeySet();
  private final Queue<QueuedCall<?>> queuedCalls = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ManagedChannelPool(int maxSize, Supplier<ManagedChannel> channelFactory) {
    this.channelFactory = requireNonNull(channelFactory, "channelFactory must not be null");
    this.permits = new Semaphore(maxSize);
  }

  /**
   * Creates a pool owning at most {@code maxSize} channels.
   *
   * @param maxSize        the maximum number of channels, at least 1
   * @param channelFactory creates a new channel
   * @return a pool with no channel yet
   * @throws IllegalArgumentException if maxSize is less than 1
   * @throws NullPointerException     if channelFactory is null
   */
  public static ManagedChannelPool create(int maxSize, Supplier<ManagedChannel> channelFactory) {
    if (maxSize < 1) throw new IllegalArgumentException("maxSize must be at least 1, got: " + maxSize);

    return new ManagedChannelPool(maxSize, channelFactory);
  }

  @Override
  public <T> CompletionStage<T> executeAsync(Function<ManagedChannel, CompletionStage<T>> operation) {
    requireNonNull(operation, "operation must not be null");
    if (closed.get()) return CompletableFuture.failedFuture(poolClosed());

    if (queuedCalls.isEmpty() && permits.tryAcquire()) return callWithPermit(operation);

    var queued = new QueuedCall<>(operation);
    queuedCalls.offer(queued);
    logger.debug("All channels are in use, call queued ({} waiting)", queuedCalls.size());
    drainQueuedCalls();
    if (closed.get() && queuedCalls.remove(queued)) queued.result.completeExceptionally(poolClosed());
    return queued.result;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;

    logger.info("Closing channel pool ({} channels)", ownedChannels.size());
    QueuedCall<?> queued;
    while ((queued = queuedCalls.poll()) != null) {
      queued.result.completeExceptionally(poolClosed());
    }
    ownedChannels.forEach(this::shutdownChannel);
    idleChannels.clear();
    ownedChannels.clear();
  }

  @Override
  public int size() {
    return ownedChannels.size();
  }

  @Override
  public int availableChannels() {
    return idleChannels.size();
  }

  int queuedCalls() {
    return queuedCalls.size();
  }

  private <T> CompletionStage<T> callWithPermit(Function<ManagedChannel, CompletionStage<T>> operation) {
    ManagedChannel channel;
    try {
      channel = takeChannel();
    } catch (RuntimeException e) {
      permits.release();
      drainQueuedCalls();
      return CompletableFuture.failedFuture(e);
    }

    try {
      return operation.apply(channel).whenComplete((result, error) -> release(channel));
    } catch (RuntimeException e) {
      release(channel);
      return CompletableFuture.failedFuture(e);
    }
  }

  private void drainQueuedCalls() {
    while (!queuedCalls.isEmpty() && permits.tryAcquire()) {
      var queued = queuedCalls.poll();
      if (queued == null) {
        permits.release();
        return;
      }
      queued.issue();
    }
  }

  private ManagedChannel takeChannel() {
    if (closed.get()) throw poolClosed();

    ManagedChannel candidate;
    while ((candidate = idleChannels.poll()) != null) {
      if (isHealthy(candidate)) return candidate;

      logger.debug("Dropping channel in state {}", candidate.getState(false));
      ownedChannels.remove(candidate);
      shutdownChannel(candidate);
    }
    var channel = channelFactory.get();
    ownedChannels.add(channel);
    logger.debug("Created channel, pool size is now {}", ownedChannels.size());
    return channel;
  }

  private void release(ManagedChannel channel) {
    try {
      if (closed.get() || !isHealthy(channel)) {
        ownedChannels.remove(channel);
        shutdownChannel(channel);
      } else {
        idleChannels.offer(channel);
      }
    } finally {
      permits.release();
    }
    drainQueuedCalls();
  }

  private static boolean isHealthy(ManagedChannel channel) {
    return switch (channel.getState(false)) {
      case READY, IDLE, CONNECTING -> true;
      case TRANSIENT_FAILURE, SHUTDOWN -> false;
    };
  }

  private static IllegalStateException poolClosed() {
    return new IllegalStateException("Channel pool has been closed");
  }

  private void shutdownChannel(ManagedChannel channel) {
    try {
      channel.shutdown();
      if (!channel.awaitTermination(GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("Channel did not terminate within {}, forcing shutdown", GRACEFUL_SHUTDOWN_TIMEOUT);
        channel.shutdownNow();
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while shutting down channel");
      channel.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private final class QueuedCall<T> {
    private final Function<ManagedChannel, CompletionStage<T>> operation;
    private final CompletableFuture<T> result = new CompletableFuture<>();

    private QueuedCall(Function<ManagedChannel, CompletionStage<T>> operation) {
      this.operation = operation;
    }

    private void issue() {
      callWithPermit(operation).whenComplete((value, error) -> {
        if (error != null) {
          result.completeExceptionally(unwrap(error));
        } else {
          result.complete(value);
        }
      });
    }
  }
}
