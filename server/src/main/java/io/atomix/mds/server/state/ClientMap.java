/*
 * Copyright 2015 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.atomix.mds.server.state;

import io.atomix.catalyst.buffer.BufferInput;
import io.atomix.catalyst.buffer.BufferOutput;
import io.atomix.catalyst.util.Assert;
import io.atomix.mds.client.ClientId;
import io.atomix.mds.client.ClientInstance;
import io.atomix.mds.client.RequestId;
import io.atomix.mds.error.SnapshotFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Client ledger of a metadata server.
 * <p>
 * The client map remembers which clients hold a mount or open handles on the server, the network identity of
 * those clients while requests are processed on their behalf, and which client requests have already been
 * completed so that retried requests are not executed twice.
 * <p>
 * The mounted clients and their identities are persistent. Every mount and unmount advances the
 * {@link #getVersion() version}, and the owning server is expected to journal the ledger through the
 * {@link CommitPipeline commit pipeline}:
 * <pre>
 *   {@code
 *   long version = clientMap.getVersion();
 *   clientMap.beginCommit(version);
 *   clientMap.encode(buffer);
 *   // once the journal reports the write durable
 *   clientMap.confirmCommit(version);
 *   clientMap.takeCommitWaiters(version).forEach(Runnable::run);
 *   }
 * </pre>
 * Open handles and completed requests are runtime state only and are not encoded.
 * <p>
 * The client map is not thread safe. All calls must be serialized by the owner, typically by running them on a
 * single thread context.
 */
public class ClientMap {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClientMap.class);
  private final CommitPipeline pipeline = new CommitPipeline();
  private final ClientRegistry registry = new ClientRegistry();
  private final CompletedRequests requests = new CompletedRequests();

  /**
   * Returns the commit pipeline.
   *
   * @return The commit pipeline.
   */
  public CommitPipeline pipeline() {
    return pipeline;
  }

  /**
   * Returns the client registry.
   *
   * @return The client registry.
   */
  public ClientRegistry registry() {
    return registry;
  }

  /**
   * Returns the completed request ledger.
   *
   * @return The completed request ledger.
   */
  public CompletedRequests requests() {
    return requests;
  }

  public long getVersion() {
    return pipeline.current();
  }

  public long getProjected() {
    return pipeline.projected();
  }

  public long getCommitting() {
    return pipeline.committing();
  }

  public long getCommitted() {
    return pipeline.committed();
  }

  /**
   * Reserves the next projected version.
   *
   * @return The reserved version.
   */
  public long projectVersion() {
    return pipeline.advanceProjected();
  }

  /**
   * Discards unsubmitted version reservations.
   */
  public void resetProjected() {
    pipeline.resetProjected();
  }

  /**
   * Records that the given version is being written to the journal.
   *
   * @param version The version being written.
   */
  public void beginCommit(long version) {
    pipeline.beginCommit(version);
  }

  /**
   * Records that the given version is durable.
   *
   * @param version The durable version.
   */
  public void confirmCommit(long version) {
    pipeline.confirmCommit(version);
  }

  /**
   * Registers a waiter on the version currently being committed.
   *
   * @param waiter The waiter.
   */
  public void addCommitWaiter(Runnable waiter) {
    pipeline.addWaiter(waiter);
  }

  /**
   * Removes and returns the waiters of a committed version.
   *
   * @param version The committed version.
   * @return The version's waiters in registration order.
   */
  public List<Runnable> takeCommitWaiters(long version) {
    return pipeline.takeWaiters(version);
  }

  /**
   * Registers a client mount and advances the version.
   *
   * @param instance The mounting client instance.
   * @throws IllegalStateException if the client is registered with a different instance
   */
  public void addMount(ClientInstance instance) {
    registry.addMount(instance);
    pipeline.advanceCurrent();
  }

  /**
   * Unregisters a client mount and advances the version.
   *
   * @param client The unmounting client.
   * @throws IllegalStateException if the client is not mounted
   */
  public void removeMount(ClientId client) {
    registry.removeMount(client);
    pipeline.advanceCurrent();
  }

  /**
   * Registers an open handle.
   * <p>
   * Open handles are too frequent to journal individually and do not advance the version. They are rebuilt from
   * the rest of the server's metadata on recovery.
   *
   * @param client The client opening the handle.
   * @param instance The client instance.
   * @throws IllegalStateException if the client is registered with a different instance
   */
  public void addOpen(ClientId client, ClientInstance instance) {
    registry.addOpen(client, instance);
  }

  /**
   * Releases an open handle without advancing the version.
   *
   * @param client The client closing the handle.
   * @throws IllegalStateException if the client holds no references
   */
  public void removeOpen(ClientId client) {
    registry.removeOpen(client);
  }

  /**
   * Returns the instance of a referenced client.
   *
   * @param client The client.
   * @return The client instance.
   * @throws IllegalStateException if the client holds no references
   */
  public ClientInstance getInstance(ClientId client) {
    return registry.getInstance(client);
  }

  /**
   * Returns a read-only view of the mounted clients.
   *
   * @return The mounted clients.
   */
  public Set<ClientId> getMountSet() {
    return registry.getMountSet();
  }

  /**
   * Returns whether the client map tracks no client identities, mounts or references.
   *
   * @return Whether the client map can be discarded.
   */
  public boolean isEmpty() {
    return registry.isEmpty();
  }

  /**
   * Records a completed request.
   *
   * @param request The completed request.
   */
  public void addCompletedRequest(RequestId request) {
    requests.record(request);
  }

  /**
   * Returns whether a request has already been completed.
   *
   * @param request The request.
   * @return Whether the request was completed and not yet trimmed.
   */
  public boolean haveCompletedRequest(RequestId request) {
    return requests.contains(request);
  }

  /**
   * Trims the completed requests of a client below the given floor.
   *
   * @param client The client.
   * @param floor The lowest sequence number to retain, or {@link CompletedRequests#TRIM_ALL}.
   * @return The released trim waiters in ascending request order.
   */
  public List<Runnable> trimCompletedRequests(ClientId client, long floor) {
    return requests.trim(client, floor);
  }

  /**
   * Registers a waiter released when the given request is trimmed.
   *
   * @param request The request.
   * @param waiter The waiter.
   */
  public void addTrimWaiter(RequestId request, Runnable waiter) {
    requests.addTrimWaiter(request, waiter);
  }

  /**
   * Encodes the persistent client map state.
   *
   * @param buffer The buffer to which to write the state.
   */
  public void encode(BufferOutput<?> buffer) {
    Assert.notNull(buffer, "buffer");
    ClientMapCodec.encode(pipeline.current(), registry, buffer);
  }

  /**
   * Decodes the persistent client map state.
   * <p>
   * On success the registry is replaced and all versions are reset to the decoded version. On failure the client
   * map is left unchanged.
   *
   * @param buffer The buffer from which to read the state.
   * @throws SnapshotFormatException if the buffer does not hold a complete client map
   */
  public void decode(BufferInput<?> buffer) {
    Assert.notNull(buffer, "buffer");
    ClientMapCodec.Snapshot snapshot = ClientMapCodec.decode(buffer);
    pipeline.reset(snapshot.version);
    registry.restore(snapshot.instances, snapshot.mounts, snapshot.references);
    LOGGER.debug("Restored {} client(s) at version {}", snapshot.references.size(), snapshot.version);
  }

  @Override
  public String toString() {
    return String.format("%s[version=%d, clients=%d, mounts=%d]", getClass().getSimpleName(), pipeline.current(), registry.clients().size(), registry.getMountSet().size());
  }

}
