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

import io.atomix.catalyst.util.Assert;
import io.atomix.mds.error.JournalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;

/**
 * Client ledger storage configuration.
 * <p>
 * The storage object determines where and how client map snapshots are persisted. Snapshots written with the
 * {@link StorageLevel#DISK DISK} level are stored in the configured {@link #directory() directory} and survive a
 * server restart. Snapshots written with the {@link StorageLevel#MEMORY MEMORY} level are lost once the store is
 * closed and are intended for testing.
 * <pre>
 *   {@code
 *   Storage storage = Storage.builder()
 *     .withDirectory(new File("logs"))
 *     .withStorageLevel(StorageLevel.DISK)
 *     .build();
 *   }
 * </pre>
 */
public class Storage {
  private static final Logger LOGGER = LoggerFactory.getLogger(Storage.class);

  /**
   * Returns a new storage builder.
   *
   * @return A new storage builder.
   */
  public static Builder builder() {
    return new Builder();
  }

  private static final String DEFAULT_DIRECTORY = System.getProperty("user.dir");

  private StorageLevel storageLevel = StorageLevel.DISK;
  private File directory = new File(DEFAULT_DIRECTORY);

  public Storage() {
  }

  public Storage(StorageLevel storageLevel) {
    this.storageLevel = Assert.notNull(storageLevel, "storageLevel");
  }

  public Storage(String directory) {
    this(new File(Assert.notNull(directory, "directory")));
  }

  public Storage(File directory) {
    this(directory, StorageLevel.DISK);
  }

  public Storage(File directory, StorageLevel storageLevel) {
    this.directory = Assert.notNull(directory, "directory");
    this.storageLevel = Assert.notNull(storageLevel, "storageLevel");
  }

  /**
   * Returns the storage directory.
   *
   * @return The storage directory.
   */
  public File directory() {
    return directory;
  }

  /**
   * Returns the storage level.
   *
   * @return The storage level.
   */
  public StorageLevel level() {
    return storageLevel;
  }

  /**
   * Opens a client map store, recovering the last snapshot from disk if it exists.
   *
   * @param name The store name.
   * @return The client map store.
   */
  public ClientMapStore openClientMapStore(String name) {
    return new ClientMapStore(name, this);
  }

  /**
   * Deletes a client map store from disk.
   * <p>
   * The store must be closed before it is deleted. Deleting a store that does not exist has no effect.
   *
   * @param name The store name.
   * @throws JournalException if the store file cannot be deleted
   */
  public void deleteClientMapStore(String name) {
    File file = new File(directory, ClientMapStore.fileName(Assert.notNull(name, "name")));
    try {
      if (Files.deleteIfExists(file.toPath())) {
        LOGGER.debug("Deleted client map store {}", file);
      }
    } catch (IOException e) {
      throw new JournalException(e, "failed to delete %s", file);
    }
  }

  @Override
  public String toString() {
    return String.format("%s[directory=%s, level=%s]", getClass().getSimpleName(), directory, storageLevel);
  }

  /**
   * Builds a {@link Storage} configuration.
   */
  public static class Builder implements io.atomix.catalyst.util.Builder<Storage> {
    private final Storage storage = new Storage();

    private Builder() {
    }

    /**
     * Sets the storage level, returning the builder for method chaining.
     *
     * @param storageLevel The storage level.
     * @return The storage builder.
     */
    public Builder withStorageLevel(StorageLevel storageLevel) {
      storage.storageLevel = Assert.notNull(storageLevel, "storageLevel");
      return this;
    }

    /**
     * Sets the storage directory, returning the builder for method chaining.
     *
     * @param directory The storage directory.
     * @return The storage builder.
     */
    public Builder withDirectory(String directory) {
      return withDirectory(new File(Assert.notNull(directory, "directory")));
    }

    /**
     * Sets the storage directory, returning the builder for method chaining.
     *
     * @param directory The storage directory.
     * @return The storage builder.
     */
    public Builder withDirectory(File directory) {
      storage.directory = Assert.notNull(directory, "directory");
      return this;
    }

    @Override
    public Storage build() {
      return storage;
    }
  }

}
