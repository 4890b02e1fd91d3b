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
package io.atomix.mds.server.state;

import io.atomix.catalyst.util.Assert;
import io.atomix.mds.client.ClientId;
import io.atomix.mds.client.ClientInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reference counted registry of client instances.
 * <p>
 * The registry remembers the network identity of every client that holds a mount or an open handle on this
 * server. Each mount and each open handle counts as one reference. The identity of a client is recorded with its
 * first reference and dropped together with its last one, so an identity is known exactly while the client's
 * reference count is positive.
 * <p>
 * Mounted clients are tracked separately. A mount implies a reference, but a client may hold references without
 * a recorded mount, for instance when it reconnects with open handles.
 */
public class ClientRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClientRegistry.class);
  final NavigableMap<ClientId, ClientInstance> instances = new TreeMap<>();
  final NavigableSet<ClientId> mounts = new TreeSet<>();
  final NavigableMap<ClientId, Integer> references = new TreeMap<>();

  /**
   * Adds a reference to the given client instance.
   */
  private void reference(ClientId client, ClientInstance instance) {
    ClientInstance existing = instances.get(client);
    if (existing != null) {
      Assert.state(existing.equals(instance), "%s presented %s but is registered as %s", client, instance, existing);
      Assert.state(references.containsKey(client), "%s has an instance but no references", client);
    } else {
      instances.put(client, instance);
    }
    references.merge(client, 1, Integer::sum);
  }

  /**
   * Releases a reference to the given client.
   */
  private void release(ClientId client) {
    Integer count = references.get(client);
    Assert.state(count != null && count > 0, "%s holds no references", client);
    if (count == 1) {
      references.remove(client);
      instances.remove(client);
      LOGGER.trace("Released last reference to {}", client);
    } else {
      references.put(client, count - 1);
    }
  }

  /**
   * Registers a client mount.
   *
   * @param instance The mounting client instance.
   * @throws IllegalStateException if the client is registered with a different instance
   */
  public void addMount(ClientInstance instance) {
    Assert.notNull(instance, "instance");
    reference(instance.id(), instance);
    mounts.add(instance.id());
    LOGGER.debug("Mounted {}", instance);
  }

  /**
   * Unregisters a client mount.
   *
   * @param client The unmounting client.
   * @throws IllegalStateException if the client is not mounted
   */
  public void removeMount(ClientId client) {
    Assert.notNull(client, "client");
    Assert.state(mounts.contains(client), "%s is not mounted", client);
    release(client);
    mounts.remove(client);
    LOGGER.debug("Unmounted {}", client);
  }

  /**
   * Registers an open handle held by the given client.
   *
   * @param client The client opening the handle.
   * @param instance The client instance.
   * @throws IllegalStateException if the client is registered with a different instance
   */
  public void addOpen(ClientId client, ClientInstance instance) {
    Assert.notNull(client, "client");
    Assert.notNull(instance, "instance");
    Assert.arg(client.equals(instance.id()), "%s does not belong to %s", instance, client);
    reference(client, instance);
    LOGGER.trace("Opened handle for {}", client);
  }

  /**
   * Releases an open handle held by the given client.
   *
   * @param client The client closing the handle.
   * @throws IllegalStateException if the client holds no references
   */
  public void removeOpen(ClientId client) {
    Assert.notNull(client, "client");
    release(client);
    LOGGER.trace("Closed handle for {}", client);
  }

  /**
   * Returns the instance of a referenced client.
   *
   * @param client The client.
   * @return The client instance.
   * @throws IllegalStateException if the client holds no references
   */
  public ClientInstance getInstance(ClientId client) {
    ClientInstance instance = instances.get(Assert.notNull(client, "client"));
    Assert.state(instance != null, "%s is not registered", client);
    return instance;
  }

  /**
   * Returns a read-only view of the mounted clients.
   *
   * @return The mounted clients in ascending order.
   */
  public Set<ClientId> getMountSet() {
    return Collections.unmodifiableSet(mounts);
  }

  /**
   * Returns a read-only view of the referenced clients.
   *
   * @return The referenced clients in ascending order.
   */
  public Set<ClientId> clients() {
    return Collections.unmodifiableSet(references.keySet());
  }

  /**
   * Returns the number of references held by the given client.
   *
   * @param client The client.
   * @return The client's reference count or {@code 0} if the client is unknown.
   */
  public int referenceCount(ClientId client) {
    return references.getOrDefault(client, 0);
  }

  /**
   * Returns whether the given client holds any references.
   *
   * @param client The client.
   * @return Whether the client holds any references.
   */
  public boolean contains(ClientId client) {
    return references.containsKey(client);
  }

  /**
   * Returns whether the given client is mounted.
   *
   * @param client The client.
   * @return Whether the client is mounted.
   */
  public boolean isMounted(ClientId client) {
    return mounts.contains(client);
  }

  /**
   * Returns whether the registry tracks no clients.
   *
   * @return Whether the registry is empty.
   */
  public boolean isEmpty() {
    return instances.isEmpty() && mounts.isEmpty() && references.isEmpty();
  }

  /**
   * Replaces the registry contents.
   */
  void restore(Map<ClientId, ClientInstance> instances, Set<ClientId> mounts, Map<ClientId, Integer> references) {
    this.instances.clear();
    this.instances.putAll(instances);
    this.mounts.clear();
    this.mounts.addAll(mounts);
    this.references.clear();
    this.references.putAll(references);
  }

  @Override
  public String toString() {
    return String.format("%s[clients=%d, mounts=%d]", getClass().getSimpleName(), references.size(), mounts.size());
  }

}
