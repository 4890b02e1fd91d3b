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
package io.atomix.mds.client;

import io.atomix.catalyst.buffer.BufferInput;
import io.atomix.catalyst.buffer.BufferOutput;
import io.atomix.catalyst.serializer.CatalystSerializable;
import io.atomix.catalyst.serializer.Serializer;
import io.atomix.catalyst.util.Assert;

/**
 * Stable client identifier.
 * <p>
 * Client identifiers are assigned by the session layer and remain stable across reconnects. Identifiers are
 * ordered by their numeric value.
 */
public final class ClientId implements Comparable<ClientId>, CatalystSerializable {

  /**
   * Returns the client identifier for the given number.
   *
   * @param id The client number.
   * @return The client identifier.
   * @throws IllegalArgumentException if {@code id} is negative
   */
  public static ClientId of(long id) {
    return new ClientId(id);
  }

  private long id;

  public ClientId() {
  }

  private ClientId(long id) {
    this.id = Assert.arg(id, id >= 0, "client id cannot be negative");
  }

  /**
   * Returns the client number.
   *
   * @return The client number.
   */
  public long id() {
    return id;
  }

  @Override
  public int compareTo(ClientId other) {
    return Long.compare(id, other.id);
  }

  @Override
  public void writeObject(BufferOutput<?> buffer, Serializer serializer) {
    buffer.writeLong(id);
  }

  @Override
  public void readObject(BufferInput<?> buffer, Serializer serializer) {
    id = buffer.readLong();
  }

  @Override
  public int hashCode() {
    return Long.hashCode(id);
  }

  @Override
  public boolean equals(Object object) {
    return object instanceof ClientId && ((ClientId) object).id == id;
  }

  @Override
  public String toString() {
    return String.format("client.%d", id);
  }

}
