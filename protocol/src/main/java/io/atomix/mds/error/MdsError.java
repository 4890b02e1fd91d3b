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
package io.atomix.mds.error;

/**
 * Base type for metadata server ledger errors.
 * <p>
 * Errors are identified by a stable byte ID so they can be reported across server instances without
 * serializing the exception itself.
 */
public interface MdsError {

  /**
   * Returns the error for the given identifier.
   *
   * @param id The error identifier.
   * @return The error for the given identifier.
   * @throws IllegalArgumentException If the given identifier is not a valid error identifier.
   */
  static MdsError forId(int id) {
    switch (id) {
      case 1:
        return Type.SNAPSHOT_FORMAT_ERROR;
      case 2:
        return Type.JOURNAL_ERROR;
      default:
        throw new IllegalArgumentException("invalid error identifier: " + id);
    }
  }

  /**
   * Returns the unique error identifier.
   *
   * @return The unique error identifier.
   */
  byte id();

  /**
   * Creates a new exception for the error.
   *
   * @return The error exception.
   */
  MdsException createException();

  /**
   * Ledger error types.
   */
  enum Type implements MdsError {

    /**
     * An encoded snapshot could not be read.
     */
    SNAPSHOT_FORMAT_ERROR(1) {
      @Override
      public MdsException createException() {
        return new SnapshotFormatException("malformed snapshot");
      }
    },

    /**
     * A snapshot could not be written to or read from the journal.
     */
    JOURNAL_ERROR(2) {
      @Override
      public MdsException createException() {
        return new JournalException("journal failure");
      }
    };

    private final byte id;

    Type(int id) {
      this.id = (byte) id;
    }

    @Override
    public byte id() {
      return id;
    }
  }

}
