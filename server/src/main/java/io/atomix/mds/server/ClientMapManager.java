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
package io.atomix.mds.server;

import io.atomix.catalyst.buffer.Buffer;
import io.atomix.catalyst.buffer.HeapBuffer;
import io.atomix.catalyst.concurrent.SingleThreadContext;
import io.atomix.catalyst.concurrent.ThreadContext;
import io.atomix.catalyst.serializer.Serializer;
import io.atomix.catalyst.util.Assert;
import io.atomix.mds.client.ClientId;
import io.atomix.mds.client.RequestId;
import io.atomix.mds.server.state.ClientMap;
import io.atomix.mds.server.state.CommitPipeline;
import io.atomix.mds.server.storage.ClientMapJournal;
import io.atomix.mds.server.storage.Storage;
import io.atomix.mds.util.ProtocolSerialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Runs a {@link ClientMap} on a single thread context and journals its snapshots.
 * <p>
 * All access to the client map is serialized through the manager's {@link ThreadContext}. Operations submitted
 * with {@link #submit(Function)} run on the context, {@link #commit()} writes the current client map version to
 * the {@link ClientMapJournal journal}, and commit and trim waiters are run on the context once the version or
 * request they wait on is released.
 * <pre>
 *   {@code
 *   ClientMapManager manager = ClientMapManager.builder()
 *     .withName("mds0")
 *     .withStorage(Storage.builder().withDirectory("logs").build())
 *     .build();
 *   manager.open().join();
 *   manager.submit(clientMap -> {
 *     clientMap.addMount(instance);
 *     return null;
 *   }).thenCompose(v -> manager.commit()).join();
 *   }
 * </pre>
 */
public class ClientMapManager implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClientMapManager.class);

  /**
   * Returns a new client map manager builder.
   *
   * @return A new client map manager builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  private final String name;
  private final ClientMap clientMap = new ClientMap();
  private final ClientMapJournal journal;
  private final ThreadContext context;
  private final boolean ownsContext;
  private final NavigableSet<Long> appending = new TreeSet<>();

  protected ClientMapManager(String name, ClientMapJournal journal, ThreadContext context, boolean ownsContext) {
    this.name = Assert.notNull(name, "name");
    this.journal = Assert.notNull(journal, "journal");
    this.context = Assert.notNull(context, "context");
    this.ownsContext = ownsContext;
  }

  /**
   * Returns the manager name.
   *
   * @return The manager name.
   */
  public String name() {
    return name;
  }

  /**
   * Returns the managed client map.
   * <p>
   * The client map may only be accessed from the manager's {@link #context() thread context}.
   *
   * @return The managed client map.
   */
  public ClientMap clientMap() {
    return clientMap;
  }

  /**
   * Returns the manager's thread context.
   *
   * @return The manager's thread context.
   */
  public ThreadContext context() {
    return context;
  }

  /**
   * Restores the client map from the latest durable snapshot in the journal.
   *
   * @return A future completed once the client map has been restored. The future fails with a
   *         {@link io.atomix.mds.error.SnapshotFormatException} if the snapshot cannot be read.
   */
  public CompletableFuture<ClientMapManager> open() {
    CompletableFuture<ClientMapManager> future = new CompletableFuture<>();
    context.executor().execute(() -> {
      try {
        Buffer snapshot = journal.load();
        if (snapshot != null) {
          clientMap.decode(snapshot);
          LOGGER.info("{} - Recovered client map at version {}", name, clientMap.getVersion());
        } else {
          LOGGER.debug("{} - No client map snapshot found", name);
        }
        future.complete(this);
      } catch (RuntimeException e) {
        LOGGER.warn("{} - Failed to recover client map", name, e);
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  /**
   * Runs an operation against the client map on the manager's thread context.
   *
   * @param operation The operation to run.
   * @param <T> The operation result type.
   * @return A future completed with the operation's result.
   */
  public <T> CompletableFuture<T> submit(Function<ClientMap, T> operation) {
    Assert.notNull(operation, "operation");
    CompletableFuture<T> future = new CompletableFuture<>();
    context.executor().execute(() -> {
      try {
        future.complete(operation.apply(clientMap));
      } catch (RuntimeException e) {
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  /**
   * Writes the current client map version to the journal.
   * <p>
   * If the current version is already committed the returned future completes immediately. If a write covering
   * the current version is already in flight, the future completes once that write lands.
   *
   * @return A future completed with the committed version once the write is durable.
   */
  public CompletableFuture<Long> commit() {
    CompletableFuture<Long> future = new CompletableFuture<>();
    context.executor().execute(() -> commit(future));
    return future;
  }

  /**
   * Commits the current version.
   */
  private void commit(CompletableFuture<Long> future) {
    CommitPipeline pipeline = clientMap.pipeline();
    long version = pipeline.current();
    if (version <= pipeline.committed()) {
      future.complete(pipeline.committed());
      return;
    }

    if (!appending.isEmpty() && appending.last() >= version) {
      pipeline.addWaiter(() -> future.complete(pipeline.committed()));
      return;
    }

    Buffer snapshot = HeapBuffer.allocate();
    try {
      pipeline.beginCommit(version);
      clientMap.encode(snapshot);
      snapshot.flip();
    } catch (RuntimeException e) {
      snapshot.close();
      future.completeExceptionally(e);
      return;
    }

    CompletableFuture<Long> append;
    appending.add(version);
    try {
      append = journal.append(version, snapshot);
    } catch (RuntimeException e) {
      appending.remove(version);
      snapshot.close();
      LOGGER.warn("{} - Failed to append version {}", name, version, e);
      future.completeExceptionally(e);
      return;
    }

    append.whenCompleteAsync((result, error) -> {
      appending.remove(version);
      snapshot.close();
      if (error == null) {
        pipeline.confirmCommit(version);
        List<Runnable> waiters = pipeline.takeWaitersThrough(version);
        LOGGER.debug("{} - Committed version {}, releasing {} waiter(s)", name, version, waiters.size());
        runWaiters(waiters);
        future.complete(version);
      } else {
        LOGGER.warn("{} - Failed to commit version {}", name, version, error);
        future.completeExceptionally(error);
      }
    }, context.executor());
  }

  /**
   * Waits for the version currently being committed to become durable.
   *
   * @return A future completed with the committed version. If no commit is in flight the future is completed
   *         immediately with the last committed version.
   */
  public CompletableFuture<Long> awaitCommit() {
    CompletableFuture<Long> future = new CompletableFuture<>();
    context.executor().execute(() -> {
      CommitPipeline pipeline = clientMap.pipeline();
      if (pipeline.committing() <= pipeline.committed()) {
        future.complete(pipeline.committed());
      } else {
        pipeline.addWaiter(() -> future.complete(pipeline.committed()));
      }
    });
    return future;
  }

  /**
   * Trims the completed requests of a client and runs released trim waiters.
   *
   * @param client The client whose requests to trim.
   * @param floor The lowest request sequence number to retain.
   * @return A future completed with the number of released trim waiters.
   */
  public CompletableFuture<Integer> trimCompleted(ClientId client, long floor) {
    return submit(clientMap -> {
      List<Runnable> waiters = clientMap.trimCompletedRequests(client, floor);
      runWaiters(waiters);
      return waiters.size();
    });
  }

  /**
   * Runs released waiters in order. A failing waiter does not prevent later waiters from running.
   */
  private void runWaiters(List<Runnable> waiters) {
    for (Runnable waiter : waiters) {
      try {
        waiter.run();
      } catch (RuntimeException e) {
        LOGGER.warn("{} - Waiter failed", name, e);
      }
    }
  }

  /**
   * Waits for the given request to be trimmed from the completed request ledger.
   *
   * @param request The request to wait for.
   * @return A future completed once the request has been trimmed.
   */
  public CompletableFuture<Void> awaitTrim(RequestId request) {
    Assert.notNull(request, "request");
    CompletableFuture<Void> future = new CompletableFuture<>();
    context.executor().execute(() -> clientMap.addTrimWaiter(request, () -> future.complete(null)));
    return future;
  }

  @Override
  public void close() {
    journal.close();
    if (ownsContext) {
      context.close();
    }
  }

  @Override
  public String toString() {
    return String.format("%s[name=%s]", getClass().getSimpleName(), name);
  }

  /**
   * Client map manager builder.
   */
  public static class Builder implements io.atomix.catalyst.util.Builder<ClientMapManager> {
    private static final String DEFAULT_NAME = "clientmap";
    private String name = DEFAULT_NAME;
    private ClientMapJournal journal;
    private Storage storage;
    private ThreadContext context;
    private Serializer serializer;

    private Builder() {
    }

    /**
     * Sets the manager name, returning the builder for method chaining.
     * <p>
     * The name identifies the client map store when the manager is built with a {@link Storage}.
     *
     * @param name The manager name.
     * @return The builder.
     */
    public Builder withName(String name) {
      this.name = Assert.notNull(name, "name");
      return this;
    }

    /**
     * Sets the journal, returning the builder for method chaining.
     *
     * @param journal The client map journal.
     * @return The builder.
     */
    public Builder withJournal(ClientMapJournal journal) {
      this.journal = Assert.notNull(journal, "journal");
      return this;
    }

    /**
     * Sets the storage from which to open a client map store, returning the builder for method chaining.
     *
     * @param storage The storage configuration.
     * @return The builder.
     */
    public Builder withStorage(Storage storage) {
      this.storage = Assert.notNull(storage, "storage");
      return this;
    }

    /**
     * Sets the thread context on which to run the client map, returning the builder for method chaining.
     * <p>
     * A context provided by the caller is not closed when the manager is closed.
     *
     * @param context The thread context.
     * @return The builder.
     */
    public Builder withThreadContext(ThreadContext context) {
      this.context = Assert.notNull(context, "context");
      return this;
    }

    /**
     * Sets the serializer for the manager's own thread context, returning the builder for method chaining.
     *
     * @param serializer The serializer.
     * @return The builder.
     */
    public Builder withSerializer(Serializer serializer) {
      this.serializer = Assert.notNull(serializer, "serializer");
      return this;
    }

    @Override
    public ClientMapManager build() {
      ClientMapJournal journal = this.journal;
      if (journal == null) {
        Assert.state(storage != null, "either a journal or a storage must be configured");
        journal = storage.openClientMapStore(name);
      }

      if (context != null) {
        return new ClientMapManager(name, journal, context, false);
      }

      Serializer serializer = this.serializer != null ? this.serializer : new Serializer().resolve(new ProtocolSerialization());
      return new ClientMapManager(name, journal, new SingleThreadContext("mds-" + name + "-%d", serializer), true);
    }
  }

}
