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
package io.atomix.mds.server.storage;

import io.atomix.catalyst.buffer.Buffer;

import java.util.concurrent.CompletableFuture;

/**
 * Durable destination for encoded client map snapshots.
 * <p>
 * The journal accepts a snapshot tagged with the client map version it encodes and completes the returned future
 * once the snapshot is durable. Futures must be completed in the order in which snapshots were appended.
 */
public interface ClientMapJournal extends AutoCloseable {

  /**
   * Appends an encoded client map snapshot.
   *
   * @param version The client map version encoded in the snapshot.
   * @param snapshot The encoded snapshot, positioned at its first byte.
   * @return A future completed with the version once the snapshot is durable.
   */
  CompletableFuture<Long> append(long version, Buffer snapshot);

  /**
   * Loads the latest durable snapshot.
   *
   * @return The latest durable snapshot or {@code null} if no snapshot has been written.
   */
  Buffer load();

  @Override
  void close();

}
