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
import io.atomix.mds.client.RequestId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Per-client record of completed requests.
 * <p>
 * Requests are recorded once they have been processed so that a request retried by a client after a timeout or a
 * server failure can be recognized as a duplicate rather than executed again. Clients periodically acknowledge
 * that they will no longer retry requests below some sequence number, at which point the ledger is
 * {@link #trim(ClientId, long) trimmed}. Trimming is irreversible.
 * <p>
 * Components that depend on a request still being detectable as a duplicate can register a trim waiter for it.
 * The waiter is handed back by the trim that removes the request. The ledger never runs waiters itself.
 */
public class CompletedRequests {
  private static final Logger LOGGER = LoggerFactory.getLogger(CompletedRequests.class);

  /**
   * Floor value that trims every request.
   */
  public static final long TRIM_ALL = 0;

  private final Map<ClientId, NavigableSet<Long>> completed = new HashMap<>();
  private final Map<ClientId, NavigableMap<Long, Runnable>> trimWaiters = new HashMap<>();

  /**
   * Records a completed request.
   * <p>
   * Recording a request that is already recorded has no effect.
   *
   * @param request The completed request.
   */
  public void record(RequestId request) {
    Assert.notNull(request, "request");
    if (completed.computeIfAbsent(request.client(), c -> new TreeSet<>()).add(request.sequence())) {
      LOGGER.trace("Recorded completed request {}", request);
    }
  }

  /**
   * Returns whether the given request has been completed and not yet trimmed.
   *
   * @param request The request to check.
   * @return Whether the request is recorded as completed.
   */
  public boolean contains(RequestId request) {
    Assert.notNull(request, "request");
    NavigableSet<Long> sequences = completed.get(request.client());
    return sequences != null && sequences.contains(request.sequence());
  }

  /**
   * Trims the completed requests of a client.
   * <p>
   * All requests with a sequence number strictly below {@code floor} are removed. A floor of {@link #TRIM_ALL}
   * removes every request of the client. Trim waiters registered below the floor are removed and returned in
   * ascending sequence order; a floor of {@link #TRIM_ALL} releases every waiter of the client.
   *
   * @param client The client whose requests to trim.
   * @param floor The lowest sequence number to retain, or {@link #TRIM_ALL}.
   * @return The released trim waiters. Never {@code null}.
   */
  public List<Runnable> trim(ClientId client, long floor) {
    Assert.notNull(client, "client");
    Assert.arg(floor >= 0, "floor cannot be negative");

    NavigableSet<Long> sequences = completed.get(client);
    if (sequences != null) {
      if (floor == TRIM_ALL) {
        sequences.clear();
      } else {
        sequences.headSet(floor, false).clear();
      }
      if (sequences.isEmpty()) {
        completed.remove(client);
      }
    }

    NavigableMap<Long, Runnable> waiters = trimWaiters.get(client);
    if (waiters == null) {
      return Collections.emptyList();
    }

    List<Runnable> released = new ArrayList<>();
    Map.Entry<Long, Runnable> entry = waiters.firstEntry();
    while (entry != null && (floor == TRIM_ALL || entry.getKey() < floor)) {
      released.add(waiters.pollFirstEntry().getValue());
      entry = waiters.firstEntry();
    }
    if (waiters.isEmpty()) {
      trimWaiters.remove(client);
    }

    LOGGER.trace("Trimmed {} below {}, released {} waiter(s)", client, floor, released.size());
    return released;
  }

  /**
   * Registers a waiter to be released once the given request is trimmed.
   * <p>
   * Registering a second waiter for the same request replaces the first.
   *
   * @param request The request to wait for.
   * @param waiter The waiter.
   */
  public void addTrimWaiter(RequestId request, Runnable waiter) {
    Assert.notNull(request, "request");
    Assert.notNull(waiter, "waiter");
    trimWaiters.computeIfAbsent(request.client(), c -> new TreeMap<>()).put(request.sequence(), waiter);
  }

  /**
   * Removes all requests of a client.
   *
   * @param client The client to remove.
   * @return The client's trim waiters in ascending sequence order. Never {@code null}.
   */
  public List<Runnable> remove(ClientId client) {
    return trim(client, TRIM_ALL);
  }

  /**
   * Returns the number of completed requests recorded for a client.
   *
   * @param client The client.
   * @return The number of completed requests.
   */
  public int completedCount(ClientId client) {
    NavigableSet<Long> sequences = completed.get(client);
    return sequences != null ? sequences.size() : 0;
  }

  /**
   * Returns the number of trim waiters registered for a client.
   *
   * @param client The client.
   * @return The number of trim waiters.
   */
  public int trimWaiterCount(ClientId client) {
    NavigableMap<Long, Runnable> waiters = trimWaiters.get(client);
    return waiters != null ? waiters.size() : 0;
  }

  /**
   * Returns whether no requests or waiters are recorded.
   *
   * @return Whether the ledger is empty.
   */
  public boolean isEmpty() {
    return completed.isEmpty() && trimWaiters.isEmpty();
  }

}
