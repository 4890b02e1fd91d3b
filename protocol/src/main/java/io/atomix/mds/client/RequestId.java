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
 * Identifies a single client request.
 * <p>
 * Requests are numbered per client. Sequence numbers start at {@code 1}; {@code 0} is reserved and never
 * identifies a request.
 */
public final class RequestId implements Comparable<RequestId>, CatalystSerializable {
  private ClientId client;
  private long sequence;

  public RequestId() {
  }

  public RequestId(ClientId client, long sequence) {
    this.client = Assert.notNull(client, "client");
    this.sequence = Assert.arg(sequence, sequence > 0, "request sequence must be positive");
  }

  /**
   * Returns the client that issued the request.
   *
   * @return The client that issued the request.
   */
  public ClientId client() {
    return client;
  }

  /**
   * Returns the request sequence number.
   *
   * @return The request sequence number.
   */
  public long sequence() {
    return sequence;
  }

  @Override
  public int compareTo(RequestId other) {
    int result = client.compareTo(other.client);
    return result != 0 ? result : Long.compare(sequence, other.sequence);
  }

  @Override
  public void writeObject(BufferOutput<?> buffer, Serializer serializer) {
    buffer.writeLong(client.id()).writeLong(sequence);
  }

  @Override
  public void readObject(BufferInput<?> buffer, Serializer serializer) {
    client = ClientId.of(buffer.readLong());
    sequence = buffer.readLong();
  }

  @Override
  public int hashCode() {
    return 31 * client.hashCode() + Long.hashCode(sequence);
  }

  @Override
  public boolean equals(Object object) {
    return object instanceof RequestId
      && ((RequestId) object).client.equals(client)
      && ((RequestId) object).sequence == sequence;
  }

  @Override
  public String toString() {
    return String.format("%s:%d", client, sequence);
  }

}
