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

import io.atomix.catalyst.buffer.BufferInput;
import io.atomix.catalyst.buffer.BufferOutput;
import io.atomix.mds.client.ClientId;
import io.atomix.mds.client.ClientInstance;
import io.atomix.mds.error.SnapshotFormatException;

import java.nio.BufferUnderflowException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Binary encoding of the persistent client ledger state.
 * <p>
 * The snapshot layout is:
 * <pre>
 *   [version:int64]
 *   [instances:  count:int32, count x (client:int64, hostLength:int32, host:utf8, port:int32, epoch:int64)]
 *   [mounts:     count:int32, count x client:int64]
 *   [references: count:int32, count x (client:int64, count:int32)]
 * </pre>
 * Entries are written in ascending client order so equal ledgers always produce identical bytes.
 */
final class ClientMapCodec {
  private static final int INSTANCE_BYTES = Long.BYTES + Integer.BYTES + Integer.BYTES + Long.BYTES;
  private static final int MOUNT_BYTES = Long.BYTES;
  private static final int REFERENCE_BYTES = Long.BYTES + Integer.BYTES;

  private ClientMapCodec() {
  }

  /**
   * Writes the persistent ledger state to the given buffer.
   */
  static void encode(long version, ClientRegistry registry, BufferOutput<?> buffer) {
    buffer.writeLong(version);

    buffer.writeInt(registry.instances.size());
    for (Map.Entry<ClientId, ClientInstance> entry : registry.instances.entrySet()) {
      ClientInstance instance = entry.getValue();
      byte[] host = instance.address().host().getBytes(StandardCharsets.UTF_8);
      buffer.writeLong(entry.getKey().id())
        .writeInt(host.length)
        .write(host)
        .writeInt(instance.address().port())
        .writeLong(instance.epoch());
    }

    buffer.writeInt(registry.mounts.size());
    for (ClientId client : registry.mounts) {
      buffer.writeLong(client.id());
    }

    buffer.writeInt(registry.references.size());
    for (Map.Entry<ClientId, Integer> entry : registry.references.entrySet()) {
      buffer.writeLong(entry.getKey().id()).writeInt(entry.getValue());
    }
  }

  /**
   * Reads the persistent ledger state from the given buffer.
   *
   * @throws SnapshotFormatException if the buffer is truncated or does not hold a valid ledger
   */
  static Snapshot decode(BufferInput<?> buffer) {
    try {
      Snapshot snapshot = new Snapshot(readLong(buffer, "version"));
      if (snapshot.version < 0) {
        throw new SnapshotFormatException("invalid snapshot version %d", snapshot.version);
      }

      int instances = readCount(buffer, "instances", INSTANCE_BYTES);
      for (int i = 0; i < instances; i++) {
        ClientId client = readClient(buffer, "instance client");
        int length = readInt(buffer, "host length");
        if (length < 0) {
          throw new SnapshotFormatException("invalid host length %d for %s", length, client);
        }
        require(buffer, length, "host");
        byte[] host = new byte[length];
        buffer.read(host);
        int port = readInt(buffer, "port");
        long epoch = readLong(buffer, "epoch");
        ClientInstance instance;
        try {
          instance = new ClientInstance(client, ClientInstance.unresolved(new String(host, StandardCharsets.UTF_8), port), epoch);
        } catch (IllegalArgumentException e) {
          throw new SnapshotFormatException(e, "invalid instance for %s", client);
        }
        if (snapshot.instances.put(client, instance) != null) {
          throw new SnapshotFormatException("duplicate instance for %s", client);
        }
      }

      int mounts = readCount(buffer, "mounts", MOUNT_BYTES);
      for (int i = 0; i < mounts; i++) {
        ClientId client = readClient(buffer, "mount");
        if (!snapshot.mounts.add(client)) {
          throw new SnapshotFormatException("duplicate mount for %s", client);
        }
      }

      int references = readCount(buffer, "references", REFERENCE_BYTES);
      for (int i = 0; i < references; i++) {
        ClientId client = readClient(buffer, "reference client");
        int count = readInt(buffer, "reference count");
        if (count <= 0) {
          throw new SnapshotFormatException("invalid reference count %d for %s", count, client);
        }
        if (snapshot.references.put(client, count) != null) {
          throw new SnapshotFormatException("duplicate reference count for %s", client);
        }
      }

      validate(snapshot);
      return snapshot;
    } catch (BufferUnderflowException | IndexOutOfBoundsException e) {
      throw new SnapshotFormatException(e, "truncated snapshot");
    }
  }

  /**
   * Checks that the decoded state satisfies the registry invariants.
   */
  private static void validate(Snapshot snapshot) {
    if (!snapshot.instances.keySet().equals(snapshot.references.keySet())) {
      throw new SnapshotFormatException("instances %s do not match references %s", snapshot.instances.keySet(), snapshot.references.keySet());
    }
    for (ClientId client : snapshot.mounts) {
      if (!snapshot.references.containsKey(client)) {
        throw new SnapshotFormatException("mounted %s holds no references", client);
      }
    }
  }

  private static void require(BufferInput<?> buffer, long bytes, String field) {
    if (buffer.remaining() < bytes) {
      throw new SnapshotFormatException("truncated snapshot: %d bytes required for %s, %d remaining", bytes, field, buffer.remaining());
    }
  }

  private static long readLong(BufferInput<?> buffer, String field) {
    require(buffer, Long.BYTES, field);
    return buffer.readLong();
  }

  private static int readInt(BufferInput<?> buffer, String field) {
    require(buffer, Integer.BYTES, field);
    return buffer.readInt();
  }

  private static int readCount(BufferInput<?> buffer, String field, int entryBytes) {
    int count = readInt(buffer, field);
    if (count < 0) {
      throw new SnapshotFormatException("invalid %s count %d", field, count);
    }
    require(buffer, (long) count * entryBytes, field);
    return count;
  }

  private static ClientId readClient(BufferInput<?> buffer, String field) {
    long id = readLong(buffer, field);
    if (id < 0) {
      throw new SnapshotFormatException("invalid client id %d in %s", id, field);
    }
    return ClientId.of(id);
  }

  /**
   * Decoded ledger state.
   */
  static final class Snapshot {
    final long version;
    final NavigableMap<ClientId, ClientInstance> instances = new TreeMap<>();
    final NavigableSet<ClientId> mounts = new TreeSet<>();
    final NavigableMap<ClientId, Integer> references = new TreeMap<>();

    private Snapshot(long version) {
      this.version = version;
    }
  }

}
