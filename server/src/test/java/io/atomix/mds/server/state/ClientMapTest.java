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

import io.atomix.catalyst.buffer.Buffer;
import io.atomix.catalyst.buffer.HeapBuffer;
import io.atomix.catalyst.transport.Address;
import io.atomix.mds.client.ClientId;
import io.atomix.mds.client.ClientInstance;
import io.atomix.mds.client.RequestId;
import io.atomix.mds.error.SnapshotFormatException;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.testng.Assert.*;

/**
 * Client map test.
 */
@Test
public class ClientMapTest {
  private static final ClientId CLIENT = ClientId.of(42);
  private static final ClientInstance INSTANCE = new ClientInstance(CLIENT, new Address("localhost", 6800), 1);

  /**
   * Encodes the client map and returns the encoded bytes.
   */
  private static byte[] encode(ClientMap clientMap) {
    Buffer buffer = HeapBuffer.allocate();
    clientMap.encode(buffer);
    buffer.flip();
    byte[] bytes = new byte[(int) buffer.remaining()];
    buffer.read(bytes);
    buffer.close();
    return bytes;
  }

  /**
   * Creates a client map holding two clients.
   */
  private static ClientMap createClientMap() {
    ClientMap clientMap = new ClientMap();
    clientMap.addMount(INSTANCE);
    clientMap.addOpen(CLIENT, INSTANCE);
    ClientInstance other = new ClientInstance(ClientId.of(7), new Address("localhost", 6801), 3);
    clientMap.addOpen(other.id(), other);
    return clientMap;
  }

  /**
   * Tests the mount and open handle life cycle of a single client.
   */
  public void testClientLifeCycle() throws Throwable {
    ClientMap clientMap = new ClientMap();
    assertTrue(clientMap.isEmpty());

    clientMap.addMount(INSTANCE);
    assertEquals(clientMap.getVersion(), 1);
    assertEquals(clientMap.getMountSet(), Collections.singleton(CLIENT));
    assertEquals(clientMap.registry().referenceCount(CLIENT), 1);

    clientMap.addOpen(CLIENT, INSTANCE);
    assertEquals(clientMap.registry().referenceCount(CLIENT), 2);
    assertEquals(clientMap.getVersion(), 1);

    clientMap.removeMount(CLIENT);
    assertEquals(clientMap.registry().referenceCount(CLIENT), 1);
    assertTrue(clientMap.getMountSet().isEmpty());
    assertEquals(clientMap.getVersion(), 2);
    assertEquals(clientMap.getInstance(CLIENT), INSTANCE);

    clientMap.removeOpen(CLIENT);
    assertEquals(clientMap.registry().referenceCount(CLIENT), 0);
    assertFalse(clientMap.registry().contains(CLIENT));
    assertEquals(clientMap.getVersion(), 2);
    assertTrue(clientMap.isEmpty());
  }

  /**
   * Tests driving a commit through the client map.
   */
  public void testCommit() throws Throwable {
    ClientMap clientMap = new ClientMap();
    List<String> fired = new ArrayList<>();
    clientMap.addMount(INSTANCE);
    assertEquals(clientMap.getProjected(), 1);
    assertEquals(clientMap.projectVersion(), 2);
    clientMap.resetProjected();
    assertEquals(clientMap.getProjected(), 1);

    clientMap.beginCommit(clientMap.getVersion());
    clientMap.addCommitWaiter(() -> fired.add("w1"));
    assertEquals(clientMap.getCommitting(), 1);
    assertEquals(clientMap.getCommitted(), 0);

    clientMap.confirmCommit(1);
    clientMap.takeCommitWaiters(1).forEach(Runnable::run);
    assertEquals(clientMap.getCommitted(), 1);
    assertEquals(fired, Arrays.asList("w1"));
  }

  /**
   * Tests completed requests through the client map.
   */
  public void testCompletedRequests() throws Throwable {
    ClientMap clientMap = new ClientMap();
    List<String> fired = new ArrayList<>();
    clientMap.addCompletedRequest(new RequestId(CLIENT, 1));
    clientMap.addCompletedRequest(new RequestId(CLIENT, 2));
    clientMap.addTrimWaiter(new RequestId(CLIENT, 1), () -> fired.add("w1"));
    assertTrue(clientMap.haveCompletedRequest(new RequestId(CLIENT, 1)));

    clientMap.trimCompletedRequests(CLIENT, 2).forEach(Runnable::run);
    assertFalse(clientMap.haveCompletedRequest(new RequestId(CLIENT, 1)));
    assertTrue(clientMap.haveCompletedRequest(new RequestId(CLIENT, 2)));
    assertEquals(fired, Arrays.asList("w1"));
    assertEquals(clientMap.getVersion(), 0);
  }

  /**
   * Tests that a decoded client map re-encodes to identical bytes.
   */
  public void testEncodeDecode() throws Throwable {
    ClientMap clientMap = createClientMap();
    byte[] bytes = encode(clientMap);

    ClientMap restored = new ClientMap();
    restored.decode(HeapBuffer.wrap(bytes));
    assertEquals(encode(restored), bytes);

    assertEquals(restored.getVersion(), 1);
    assertEquals(restored.getProjected(), 1);
    assertEquals(restored.getCommitting(), 1);
    assertEquals(restored.getCommitted(), 1);
    assertEquals(restored.getMountSet(), Collections.singleton(CLIENT));
    assertEquals(restored.getInstance(CLIENT), INSTANCE);
    assertEquals(restored.registry().referenceCount(CLIENT), 2);
    assertEquals(restored.registry().referenceCount(ClientId.of(7)), 1);
    assertFalse(restored.registry().isMounted(ClientId.of(7)));
  }

  /**
   * Tests that a client whose host name cannot be resolved survives a snapshot round trip.
   */
  public void testUnresolvableHost() throws Throwable {
    ClientInstance instance = new ClientInstance(ClientId.of(9), ClientInstance.unresolved("mds-client.invalid", 6800), 4);
    ClientMap clientMap = new ClientMap();
    clientMap.addMount(instance);
    byte[] bytes = encode(clientMap);

    ClientMap restored = new ClientMap();
    restored.decode(HeapBuffer.wrap(bytes));
    assertEquals(restored.getInstance(ClientId.of(9)), instance);
    assertEquals(restored.getInstance(ClientId.of(9)).address().host(), "mds-client.invalid");
    restored.addOpen(ClientId.of(9), instance);
    assertEquals(restored.registry().referenceCount(ClientId.of(9)), 2);
    assertEquals(encode(restored), bytes);
  }

  /**
   * Tests that completed requests are not encoded.
   */
  public void testCompletedRequestsNotEncoded() throws Throwable {
    ClientMap clientMap = createClientMap();
    byte[] before = encode(clientMap);
    clientMap.addCompletedRequest(new RequestId(CLIENT, 5));
    assertEquals(encode(clientMap), before);

    ClientMap restored = new ClientMap();
    restored.decode(HeapBuffer.wrap(before));
    assertFalse(restored.haveCompletedRequest(new RequestId(CLIENT, 5)));
  }

  /**
   * Tests that equal client maps built in different orders encode identically.
   */
  public void testCanonicalEncoding() throws Throwable {
    ClientInstance first = new ClientInstance(ClientId.of(1), new Address("localhost", 5001), 0);
    ClientInstance second = new ClientInstance(ClientId.of(2), new Address("localhost", 5002), 0);

    ClientMap a = new ClientMap();
    a.addMount(first);
    a.addMount(second);
    ClientMap b = new ClientMap();
    b.addMount(second);
    b.addMount(first);
    assertEquals(encode(a), encode(b));
  }

  /**
   * Tests that truncated snapshots are rejected.
   */
  public void testTruncatedSnapshot() throws Throwable {
    byte[] bytes = encode(createClientMap());
    for (int length : new int[]{4, 8, 11, 20, bytes.length / 2, bytes.length - 1}) {
      ClientMap clientMap = new ClientMap();
      try {
        clientMap.decode(HeapBuffer.wrap(Arrays.copyOf(bytes, length)));
        fail("decoded snapshot truncated to " + length + " bytes");
      } catch (SnapshotFormatException e) {
        assertTrue(clientMap.isEmpty());
        assertEquals(clientMap.getVersion(), 0);
      }
    }
  }

  /**
   * Tests that a failed decode leaves the client map unchanged.
   */
  public void testFailedDecodeKeepsState() throws Throwable {
    ClientMap clientMap = createClientMap();
    byte[] before = encode(clientMap);
    try {
      clientMap.decode(HeapBuffer.wrap(Arrays.copyOf(before, before.length - 4)));
      fail();
    } catch (SnapshotFormatException e) {
      assertEquals(encode(clientMap), before);
      assertEquals(clientMap.registry().referenceCount(CLIENT), 2);
    }
  }

  /**
   * Tests that a snapshot whose mounts are not referenced is rejected.
   */
  @Test(expectedExceptions = SnapshotFormatException.class)
  public void testUnreferencedMount() throws Throwable {
    Buffer buffer = HeapBuffer.allocate()
      .writeLong(1)
      .writeInt(0)
      .writeInt(1)
      .writeLong(42)
      .writeInt(0)
      .flip();
    new ClientMap().decode(buffer);
  }

  /**
   * Tests that a snapshot with a non-positive reference count is rejected.
   */
  @Test(expectedExceptions = SnapshotFormatException.class)
  public void testInvalidReferenceCount() throws Throwable {
    Buffer buffer = HeapBuffer.allocate()
      .writeLong(1)
      .writeInt(0)
      .writeInt(0)
      .writeInt(1)
      .writeLong(42)
      .writeInt(0)
      .flip();
    new ClientMap().decode(buffer);
  }

  /**
   * Tests that a snapshot with a negative count is rejected.
   */
  @Test(expectedExceptions = SnapshotFormatException.class)
  public void testNegativeCount() throws Throwable {
    Buffer buffer = HeapBuffer.allocate()
      .writeLong(1)
      .writeInt(-1)
      .flip();
    new ClientMap().decode(buffer);
  }

  /**
   * Tests that an empty client map round trips.
   */
  public void testEmptySnapshot() throws Throwable {
    byte[] bytes = encode(new ClientMap());
    assertEquals(bytes.length, Long.BYTES + 3 * Integer.BYTES);
    ClientMap clientMap = new ClientMap();
    clientMap.decode(HeapBuffer.wrap(bytes));
    assertTrue(clientMap.isEmpty());
  }

}
