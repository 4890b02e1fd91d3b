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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tracks the progress of client ledger versions towards the journal.
 * <p>
 * The pipeline maintains four monotonically non-decreasing versions. The {@link #current() current} version is
 * the version reflected by the ledger's persistent state. The {@link #projected() projected} version is the highest
 * version reserved for a change that has not been submitted yet. The {@link #committing() committing} version is the
 * version currently being written to the journal, and the {@link #committed() committed} version is the highest
 * version known to be durable. At all times {@code committed <= committing <= projected} and
 * {@code current <= projected}.
 * <p>
 * Several projected versions may be reserved before a single journal write, and the next batch may be prepared
 * while a write is in flight.
 * <p>
 * Commit waiters are registered against the committing version and handed back to the caller once that version is
 * committed. The pipeline never runs waiters itself.
 */
public class CommitPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(CommitPipeline.class);
  private long current;
  private long projected;
  private long committing;
  private long committed;
  private final Map<Long, List<Runnable>> commitWaiters = new TreeMap<>();

  /**
   * Returns the current version.
   *
   * @return The current version.
   */
  public long current() {
    return current;
  }

  /**
   * Returns the projected version.
   *
   * @return The projected version.
   */
  public long projected() {
    return projected;
  }

  /**
   * Returns the version being written to the journal.
   *
   * @return The committing version.
   */
  public long committing() {
    return committing;
  }

  /**
   * Returns the highest durable version.
   *
   * @return The committed version.
   */
  public long committed() {
    return committed;
  }

  /**
   * Advances the current version by one.
   * <p>
   * If the projected version falls behind the current version it is moved forward with it.
   *
   * @return The updated current version.
   */
  long advanceCurrent() {
    current++;
    if (projected < current) {
      projected = current;
    }
    return current;
  }

  /**
   * Reserves the next projected version.
   *
   * @return The reserved version.
   */
  public long advanceProjected() {
    return ++projected;
  }

  /**
   * Discards speculative reservations by resetting the projected version to the current version.
   * <p>
   * Callers must not have registered waiters against a discarded version.
   */
  public void resetProjected() {
    projected = Math.max(current, committing);
  }

  /**
   * Records that the given version is being written to the journal.
   *
   * @param version The version being written.
   * @throws IllegalStateException if {@code version} is greater than the projected version or less than the
   *         version already being written
   */
  public void beginCommit(long version) {
    Assert.state(version <= projected, "cannot commit version %d beyond projected version %d", version, projected);
    Assert.state(version >= committing, "cannot commit version %d behind committing version %d", version, committing);
    LOGGER.debug("Committing version {}", version);
    committing = version;
  }

  /**
   * Records that the given version is durable.
   *
   * @param version The durable version.
   * @throws IllegalStateException if {@code version} is greater than the committing version
   */
  public void confirmCommit(long version) {
    Assert.state(version <= committing, "cannot confirm version %d beyond committing version %d", version, committing);
    LOGGER.debug("Committed version {}", version);
    if (version > committed) {
      committed = version;
    }
  }

  /**
   * Registers a callback to be handed back once the committing version is committed.
   * <p>
   * The waiter is bound to the value of {@link #committing()} at the time of the call. Registering a waiter
   * before any commit has begun binds it to version {@code 0}, which is never committed.
   *
   * @param waiter The waiter to register.
   */
  public void addWaiter(Runnable waiter) {
    Assert.notNull(waiter, "waiter");
    commitWaiters.computeIfAbsent(committing, v -> new ArrayList<>()).add(waiter);
  }

  /**
   * Removes and returns all waiters registered for exactly the given version.
   *
   * @param version The committed version.
   * @return The waiters for the version in registration order. Never {@code null}.
   */
  public List<Runnable> takeWaiters(long version) {
    List<Runnable> waiters = commitWaiters.remove(version);
    return waiters != null ? waiters : Collections.emptyList();
  }

  /**
   * Removes and returns all waiters registered for committed versions up to and including the given version.
   * <p>
   * Waiters bound to version {@code 0} are never returned.
   *
   * @param version The committed version.
   * @return The waiters in ascending version order, and in registration order within each version.
   */
  public List<Runnable> takeWaitersThrough(long version) {
    List<Runnable> waiters = new ArrayList<>();
    Iterator<Map.Entry<Long, List<Runnable>>> iterator = commitWaiters.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<Long, List<Runnable>> entry = iterator.next();
      if (entry.getKey() > version) {
        break;
      }
      if (entry.getKey() > 0) {
        waiters.addAll(entry.getValue());
        iterator.remove();
      }
    }
    return waiters;
  }

  /**
   * Returns the number of waiters that have not been taken.
   *
   * @return The number of pending waiters.
   */
  public int pendingWaiters() {
    int count = 0;
    for (List<Runnable> waiters : commitWaiters.values()) {
      count += waiters.size();
    }
    return count;
  }

  /**
   * Resets all versions to the given version.
   *
   * @param version The version to reset to.
   * @throws IllegalStateException if waiters are pending
   */
  void reset(long version) {
    Assert.state(commitWaiters.isEmpty(), "cannot reset versions with pending commit waiters");
    current = projected = committing = committed = version;
  }

  @Override
  public String toString() {
    return String.format("%s[current=%d, projected=%d, committing=%d, committed=%d]", getClass().getSimpleName(), current, projected, committing, committed);
  }

}
