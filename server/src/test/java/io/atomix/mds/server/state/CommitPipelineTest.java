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

import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.testng.Assert.*;

/**
 * Commit pipeline test.
 */
@Test
public class CommitPipelineTest {

  /**
   * Tests that versions start at zero.
   */
  public void testInitialVersions() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    assertEquals(pipeline.current(), 0);
    assertEquals(pipeline.projected(), 0);
    assertEquals(pipeline.committing(), 0);
    assertEquals(pipeline.committed(), 0);
    assertEquals(pipeline.pendingWaiters(), 0);
  }

  /**
   * Tests that advancing the current version lifts the projected version.
   */
  public void testAdvanceCurrent() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    assertEquals(pipeline.advanceCurrent(), 1);
    assertEquals(pipeline.projected(), 1);
    assertEquals(pipeline.advanceProjected(), 2);
    assertEquals(pipeline.advanceProjected(), 3);
    assertEquals(pipeline.advanceCurrent(), 2);
    assertEquals(pipeline.projected(), 3);
    pipeline.resetProjected();
    assertEquals(pipeline.projected(), 2);
  }

  /**
   * Tests that resetting the projected version never drops below the committing version.
   */
  public void testResetProjectedKeepsCommitting() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    pipeline.advanceCurrent();
    pipeline.advanceProjected();
    pipeline.advanceProjected();
    pipeline.beginCommit(3);
    pipeline.resetProjected();
    assertEquals(pipeline.projected(), 3);
    assertEquals(pipeline.current(), 1);
  }

  /**
   * Tests that waiters are bound to the committing version and handed back in registration order.
   */
  public void testWaiters() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    List<String> fired = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      pipeline.advanceCurrent();
    }

    pipeline.beginCommit(5);
    pipeline.addWaiter(() -> fired.add("w1"));
    pipeline.addWaiter(() -> fired.add("w2"));
    pipeline.beginCommit(6);
    pipeline.addWaiter(() -> fired.add("w3"));
    assertEquals(pipeline.pendingWaiters(), 3);

    pipeline.confirmCommit(5);
    assertEquals(pipeline.committed(), 5);
    pipeline.takeWaiters(5).forEach(Runnable::run);
    assertEquals(fired, Arrays.asList("w1", "w2"));
    assertTrue(pipeline.takeWaiters(5).isEmpty());
    assertEquals(pipeline.pendingWaiters(), 1);

    pipeline.confirmCommit(6);
    pipeline.takeWaiters(6).forEach(Runnable::run);
    assertEquals(fired, Arrays.asList("w1", "w2", "w3"));
    assertEquals(pipeline.pendingWaiters(), 0);
  }

  /**
   * Tests taking the waiters of every version up to a committed version.
   */
  public void testTakeWaitersThrough() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    List<String> fired = new ArrayList<>();
    pipeline.addWaiter(() -> fired.add("w0"));
    pipeline.advanceCurrent();
    pipeline.advanceCurrent();
    pipeline.advanceCurrent();
    pipeline.beginCommit(1);
    pipeline.addWaiter(() -> fired.add("w1"));
    pipeline.beginCommit(2);
    pipeline.addWaiter(() -> fired.add("w2"));
    pipeline.beginCommit(3);
    pipeline.addWaiter(() -> fired.add("w3"));

    pipeline.confirmCommit(2);
    pipeline.takeWaitersThrough(2).forEach(Runnable::run);
    assertEquals(fired, Arrays.asList("w1", "w2"));
    assertEquals(pipeline.pendingWaiters(), 2);
    assertEquals(pipeline.takeWaiters(0).size(), 1);
  }

  /**
   * Tests that confirming an older version does not move the committed version backwards.
   */
  public void testConfirmIsMonotonic() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    pipeline.advanceCurrent();
    pipeline.advanceCurrent();
    pipeline.beginCommit(2);
    pipeline.confirmCommit(2);
    pipeline.confirmCommit(1);
    assertEquals(pipeline.committed(), 2);
  }

  /**
   * Tests that a commit beyond the projected version fails.
   */
  @Test(expectedExceptions = IllegalStateException.class)
  public void testCommitBeyondProjected() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    pipeline.advanceCurrent();
    pipeline.beginCommit(2);
  }

  /**
   * Tests that a commit behind the committing version fails.
   */
  @Test(expectedExceptions = IllegalStateException.class)
  public void testCommitBehindCommitting() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    pipeline.advanceCurrent();
    pipeline.advanceCurrent();
    pipeline.beginCommit(2);
    pipeline.beginCommit(1);
  }

  /**
   * Tests that confirming a version that is not being committed fails.
   */
  @Test(expectedExceptions = IllegalStateException.class)
  public void testConfirmBeyondCommitting() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    pipeline.advanceCurrent();
    pipeline.confirmCommit(1);
  }

  /**
   * Tests that versions cannot be reset while waiters are pending.
   */
  @Test(expectedExceptions = IllegalStateException.class)
  public void testResetWithWaiters() throws Throwable {
    CommitPipeline pipeline = new CommitPipeline();
    pipeline.addWaiter(() -> {});
    pipeline.reset(4);
  }

}
