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

import io.atomix.catalyst.util.Assert;

/**
 * Base ledger exception.
 * <p>
 * Ledger exceptions report failures to read a client map snapshot or to move it through the journal. Each
 * exception carries an {@link MdsError.Type} whose {@link MdsError#id() id} can be reported to another server in
 * place of the exception itself. Broken ledger invariants are not reported through this hierarchy; they fail
 * with {@link IllegalStateException}.
 */
public abstract class MdsException extends RuntimeException {
  private final MdsError.Type type;

  protected MdsException(MdsError.Type type, String message, Object... args) {
    super(String.format(message, args));
    this.type = Assert.notNull(type, "type");
  }

  protected MdsException(MdsError.Type type, Throwable cause, String message, Object... args) {
    super(String.format(message, args), cause);
    this.type = Assert.notNull(type, "type");
  }

  /**
   * Returns the exception type.
   *
   * @return The exception type.
   */
  public MdsError.Type getType() {
    return type;
  }

  /**
   * Returns whether the failure left the stored snapshot unreadable.
   * <p>
   * A snapshot format error means the stored snapshot cannot be decoded. Journal errors leave the last durable
   * snapshot in place.
   *
   * @return Whether the stored snapshot is unreadable.
   */
  public boolean isSnapshotUnreadable() {
    return type == MdsError.Type.SNAPSHOT_FORMAT_ERROR;
  }

  @Override
  public String toString() {
    return String.format("%s[%s]: %s", getClass().getSimpleName(), type, getMessage());
  }

}
