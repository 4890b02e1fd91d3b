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
import io.atomix.catalyst.buffer.FileBuffer;
import io.atomix.catalyst.buffer.HeapBuffer;
import io.atomix.catalyst.util.Assert;
import io.atomix.mds.error.JournalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.CompletableFuture;

/**
 * Persists the latest client map snapshot.
 * <p>
 * The store keeps a single snapshot according to the configured {@link Storage#level() storage level}. Each
 * appended snapshot replaces the previous one once it is written, and is durable when the returned future
 * completes. The stored layout is {@code [present:int8][version:int64][length:int32][snapshot]}.
 */
public class ClientMapStore implements ClientMapJournal {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClientMapStore.class);
  private static final int HEADER_BYTES = Byte.BYTES + Long.BYTES + Integer.BYTES;
  private static final String EXTENSION = "clientmap";
  private final Storage storage;
  private final Buffer buffer;

  /**
   * Returns the file name used by the store with the given name.
   */
  static String fileName(String name) {
    return String.format("%s.%s", name, EXTENSION);
  }

  public ClientMapStore(String name, Storage storage) {
    Assert.notNull(name, "name");
    this.storage = Assert.notNull(storage, "storage");
    if (storage.level() == StorageLevel.MEMORY) {
      buffer = HeapBuffer.allocate(HEADER_BYTES);
    } else {
      storage.directory().mkdirs();
      File file = new File(storage.directory(), fileName(name));
      buffer = FileBuffer.allocate(file, HEADER_BYTES);
    }
  }

  /**
   * Returns the version of the stored snapshot.
   *
   * @return The stored snapshot version or {@code 0} if no snapshot has been stored.
   */
  public synchronized long version() {
    if (buffer.readByte(0) == 1) {
      return buffer.readLong(Byte.BYTES);
    }
    return 0;
  }

  @Override
  public synchronized CompletableFuture<Long> append(long version, Buffer snapshot) {
    Assert.notNull(snapshot, "snapshot");
    CompletableFuture<Long> future = new CompletableFuture<>();
    long stored = version();
    if (version < stored) {
      future.completeExceptionally(new JournalException("cannot store version %d behind stored version %d", version, stored));
      return future;
    }

    try {
      byte[] bytes = new byte[(int) snapshot.remaining()];
      snapshot.read(bytes);
      LOGGER.trace("Store client map version {} ({} bytes)", version, bytes.length);
      buffer.position(0)
        .writeByte(1)
        .writeLong(version)
        .writeInt(bytes.length)
        .write(bytes);
      buffer.flush();
      future.complete(version);
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to store client map version {}", version, e);
      future.completeExceptionally(new JournalException(e, "failed to store version %d", version));
    }
    return future;
  }

  @Override
  public synchronized Buffer load() {
    if (buffer.readByte(0) != 1) {
      return null;
    }

    long version = buffer.readLong(Byte.BYTES);
    int length = buffer.readInt(Byte.BYTES + Long.BYTES);
    if (length < 0) {
      throw new JournalException("corrupt client map store: invalid snapshot length %d", length);
    }

    byte[] bytes = new byte[length];
    buffer.position(HEADER_BYTES).read(bytes);
    LOGGER.debug("Loaded client map version {} ({} bytes)", version, length);
    return HeapBuffer.wrap(bytes);
  }

  @Override
  public synchronized void close() {
    buffer.close();
  }

  @Override
  public String toString() {
    if (buffer instanceof FileBuffer) {
      return String.format("%s[%s]", getClass().getSimpleName(), ((FileBuffer) buffer).file());
    } else {
      return getClass().getSimpleName();
    }
  }

}
