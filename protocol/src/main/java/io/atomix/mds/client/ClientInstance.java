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
import io.atomix.catalyst.transport.Address;
import io.atomix.catalyst.util.Assert;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Network identity of a client session.
 * <p>
 * An instance pairs the stable {@link ClientId} with the address the client is currently reachable at and the
 * epoch of the session it connected with. A client that reconnects from a new address or with a new session
 * epoch presents a different instance under the same client ID.
 */
public final class ClientInstance implements CatalystSerializable {
  private ClientId client;
  private Address address;
  private long epoch;

  public ClientInstance() {
  }

  /**
   * Creates a client instance.
   * <p>
   * The address is kept unresolved, so two instances are equal when they name the same host and port regardless
   * of what the host name resolves to.
   *
   * @param client The client ID.
   * @param address The client address.
   * @param epoch The session epoch.
   */
  public ClientInstance(ClientId client, Address address, long epoch) {
    this.client = Assert.notNull(client, "client");
    this.address = unresolved(Assert.notNull(address, "address").host(), address.port());
    this.epoch = Assert.arg(epoch, epoch >= 0, "epoch cannot be negative");
  }

  /**
   * Returns an address for the given host and port without performing a name lookup.
   *
   * @param host The host name.
   * @param port The port.
   * @return The unresolved address.
   */
  public static Address unresolved(String host, int port) {
    return new Address(InetSocketAddress.createUnresolved(host, port));
  }

  /**
   * Returns the client ID.
   *
   * @return The client ID.
   */
  public ClientId id() {
    return client;
  }

  /**
   * Returns the client address.
   *
   * @return The client address.
   */
  public Address address() {
    return address;
  }

  /**
   * Returns the session epoch.
   *
   * @return The session epoch.
   */
  public long epoch() {
    return epoch;
  }

  @Override
  public void writeObject(BufferOutput<?> buffer, Serializer serializer) {
    buffer.writeLong(client.id())
      .writeString(address.host())
      .writeInt(address.port())
      .writeLong(epoch);
  }

  @Override
  public void readObject(BufferInput<?> buffer, Serializer serializer) {
    client = ClientId.of(buffer.readLong());
    String host = buffer.readString();
    address = unresolved(host, buffer.readInt());
    epoch = buffer.readLong();
  }

  @Override
  public int hashCode() {
    return Objects.hash(client, address, epoch);
  }

  @Override
  public boolean equals(Object object) {
    if (object instanceof ClientInstance) {
      ClientInstance instance = (ClientInstance) object;
      return instance.client.equals(client) && instance.address.equals(address) && instance.epoch == epoch;
    }
    return false;
  }

  @Override
  public String toString() {
    return String.format("%s[client=%s, address=%s, epoch=%d]", getClass().getSimpleName(), client, address, epoch);
  }

}
