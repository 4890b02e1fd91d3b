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
 * Thrown when an encoded client ledger snapshot is truncated or malformed.
 * <p>
 * Callers should treat the snapshot as unreadable and fall back to recovering from the journal.
 */
public class SnapshotFormatException extends MdsException {
  private static final MdsError.Type TYPE = MdsError.Type.SNAPSHOT_FORMAT_ERROR;

  public SnapshotFormatException(String message, Object... args) {
    super(TYPE, message, args);
  }

  public SnapshotFormatException(Throwable cause, String message, Object... args) {
    super(TYPE, cause, message, args);
  }

}
