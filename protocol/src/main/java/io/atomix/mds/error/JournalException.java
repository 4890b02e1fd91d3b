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
 * Thrown when a snapshot cannot be made durable or loaded from the journal.
 */
public class JournalException extends MdsException {
  private static final MdsError.Type TYPE = MdsError.Type.JOURNAL_ERROR;

  public JournalException(String message, Object... args) {
    super(TYPE, message, args);
  }

  public JournalException(Throwable cause, String message, Object... args) {
    super(TYPE, cause, message, args);
  }

}
