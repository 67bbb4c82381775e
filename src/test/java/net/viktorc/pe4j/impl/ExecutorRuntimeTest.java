/*
 * Copyright 2017 Viktor Csomor
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.viktorc.pe4j.impl;

import java.net.URI;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.viktorc.pe4j.api.ExecutorBadStateException;
import net.viktorc.pe4j.api.ExecutorState;
import net.viktorc.pe4j.api.FailedStartupException;
import net.viktorc.pe4j.api.StagingProvider;
import net.viktorc.pe4j.api.TaskExecutor;
import net.viktorc.pe4j.impl.TestUtils.FailingProvider;
import net.viktorc.pe4j.impl.TestUtils.FaultyShutdownExecutor;
import net.viktorc.pe4j.impl.TestUtils.RefusingExecutor;
import org.junit.Assert;
import org.junit.Test;

/**
 * A unit test class for {@link ExecutorRuntime} and the retry handling it delegates to {@link RetryHandler}.
 *
 * @author Viktor Csomor
 */
public class ExecutorRuntimeTest extends TestCase {

  private static final String RUN_DIR = "runinfo/000";

  private static ThreadPoolTaskExecutor newExecutor(String label) {
    return new ThreadPoolTaskExecutor(new SimpleExecutorConfig(label, false), 2);
  }

  @Test
  public void testAddedExecutorsAreStartedAndWired() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    runtime.setMonitoringHub("127.0.0.1", 55055);
    ThreadPoolTaskExecutor executor = newExecutor("threads");
    runtime.addExecutors(executor);
    Assert.assertEquals(ExecutorState.STARTED, executor.getState());
    Assert.assertEquals(RUN_DIR, executor.getRunDir().orElse(null));
    Assert.assertEquals("127.0.0.1", executor.getHubAddress().orElse(null));
    Assert.assertEquals(55055, (int) executor.getHubPort().orElse(0));
    Assert.assertTrue(executor.isMonitoringEnabled());
    Assert.assertSame(executor, runtime.getExecutor("threads").orElse(null));
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testMonitoringHubUpdatesStartedExecutors() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    ThreadPoolTaskExecutor executor = newExecutor("threads");
    runtime.addExecutors(executor);
    Assert.assertFalse(executor.isMonitoringEnabled());
    runtime.setMonitoringHub("hub.local", 6000);
    Assert.assertEquals("hub.local", executor.getHubAddress().orElse(null));
    Assert.assertEquals(6000, (int) executor.getHubPort().orElse(0));
    runtime.setMonitoringHub(null, null);
    Assert.assertFalse(executor.isMonitoringEnabled());
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testThrowsExceptionIfLabelTaken() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    runtime.addExecutors(newExecutor("threads"));
    ThreadPoolTaskExecutor duplicate = newExecutor("threads");
    try {
      exceptionRule.expect(IllegalArgumentException.class);
      runtime.addExecutors(duplicate);
    } finally {
      Assert.assertEquals(ExecutorState.CREATED, duplicate.getState());
      Assert.assertEquals(1, runtime.getExecutors().size());
      runtime.shutdown();
    }
  }

  @Test
  public void testDuplicateLabelsInBatchRejectedBeforeStart() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    ThreadPoolTaskExecutor first = newExecutor("twin");
    ThreadPoolTaskExecutor second = newExecutor("twin");
    try {
      runtime.addExecutors(first, second);
      Assert.fail();
    } catch (IllegalArgumentException e) {
      Assert.assertEquals(ExecutorState.CREATED, first.getState());
      Assert.assertEquals(ExecutorState.CREATED, second.getState());
      Assert.assertTrue(runtime.getExecutors().isEmpty());
    }
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testThrowsExceptionIfExecutorAlreadyStarted() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    ThreadPoolTaskExecutor started = newExecutor("pre");
    started.start();
    try {
      runtime.addExecutors(started);
      Assert.fail();
    } catch (IllegalArgumentException e) {
      Assert.assertFalse(runtime.getExecutor("pre").isPresent());
      Assert.assertNull(started.getRunDir().orElse(null));
    }
    Assert.assertTrue(runtime.shutdown());
    Assert.assertEquals(ExecutorState.STARTED, started.getState());
    Assert.assertTrue(started.shutdown());
  }

  @Test
  public void testThrowsExceptionIfExecutorShutDown() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    ThreadPoolTaskExecutor stopped = newExecutor("stopped");
    stopped.shutdown();
    try {
      exceptionRule.expect(IllegalArgumentException.class);
      runtime.addExecutors(stopped);
    } finally {
      Assert.assertTrue(runtime.getExecutors().isEmpty());
    }
  }

  @Test
  public void testFailedStartUnregistersExecutor() {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    ThreadPoolTaskExecutor healthy = newExecutor("healthy");
    BlockProviderExecutor broken = new BlockProviderExecutor(new SimpleExecutorConfig("broken", true), new FailingProvider(1));
    ThreadPoolTaskExecutor skipped = newExecutor("skipped");
    try {
      runtime.addExecutors(healthy, broken, skipped);
      Assert.fail();
    } catch (FailedStartupException e) {
      Assert.assertEquals(ExecutorState.STARTED, healthy.getState());
      Assert.assertEquals(ExecutorState.SHUT_DOWN, broken.getState());
      Assert.assertEquals(ExecutorState.CREATED, skipped.getState());
      Assert.assertEquals(Collections.singletonList(healthy), runtime.getExecutors());
    }
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testStagingFallsBackToDefaults() throws FailedStartupException {
    StagingProvider http = new StagingProvider() {

      @Override
      public boolean canStageIn(URI file) {
        return "http".equals(file.getScheme());
      }

      @Override
      public boolean canStageOut(URI file) {
        return false;
      }
    };
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    ThreadPoolTaskExecutor plain = newExecutor("plain");
    ThreadPoolTaskExecutor staging = new ThreadPoolTaskExecutor(new SimpleExecutorConfig("staging", false, null,
        Collections.singletonList(http)), 1);
    runtime.addExecutors(plain, staging);
    List<StagingProvider> defaults = runtime.getStagingProviders("plain");
    Assert.assertEquals(1, defaults.size());
    Assert.assertTrue(defaults.get(0) instanceof NoOpFileStaging);
    Assert.assertTrue(defaults.get(0).canStageIn(URI.create("file:///data/input.csv")));
    Assert.assertEquals(Collections.singletonList(http), runtime.getStagingProviders("staging"));
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testThrowsExceptionIfExecutorUnknown() {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    exceptionRule.expect(IllegalArgumentException.class);
    runtime.getStagingProviders("missing");
  }

  @Test
  public void testShutdownIsBestEffort() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    FaultyShutdownExecutor faulty = new FaultyShutdownExecutor(new SimpleExecutorConfig("faulty", false));
    ThreadPoolTaskExecutor healthy = newExecutor("healthy");
    runtime.addExecutors(faulty, healthy);
    Assert.assertFalse(runtime.shutdown());
    Assert.assertEquals(1, faulty.getNumOfTeardowns());
    Assert.assertEquals(ExecutorState.SHUT_DOWN, healthy.getState());
    Assert.assertTrue(runtime.getExecutors().isEmpty());
  }

  @Test
  public void testShutdownSkipsExecutorsAlreadyShutDown() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    FaultyShutdownExecutor faulty = new FaultyShutdownExecutor(new SimpleExecutorConfig("faulty", false));
    runtime.addExecutors(faulty);
    Assert.assertFalse(faulty.shutdown());
    Assert.assertTrue(runtime.shutdown());
    Assert.assertEquals(1, faulty.getNumOfTeardowns());
  }

  @Test
  public void testSecondShutdownReturnsFalse() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    runtime.addExecutors(newExecutor("threads"));
    Assert.assertTrue(runtime.shutdown());
    Assert.assertFalse(runtime.shutdown());
  }

  @Test
  public void testThrowsExceptionIfAddedAfterShutdown() throws FailedStartupException {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    runtime.shutdown();
    exceptionRule.expect(IllegalStateException.class);
    runtime.addExecutors(newExecutor("late"));
  }

  @Test
  public void testRetriedTaskSucceeds() throws Exception {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    runtime.addExecutors(newExecutor("threads"));
    AtomicInteger attempts = new AtomicInteger(0);
    CompletableFuture<Integer> future = runtime.submit("threads", () -> {
      if (attempts.incrementAndGet() < 3) {
        throw new IllegalStateException("Attempt " + attempts.get() + " failed");
      }
      return attempts.get();
    }, 2);
    Assert.assertEquals(3, (int) future.get(TestUtils.TIMEOUT, TimeUnit.MILLISECONDS));
    Assert.assertEquals(3, attempts.get());
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testRetriesExhausted() throws Exception {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    runtime.addExecutors(newExecutor("threads"));
    AtomicInteger attempts = new AtomicInteger(0);
    CompletableFuture<Integer> future = runtime.submit("threads", () -> {
      attempts.incrementAndGet();
      throw new IllegalStateException("Always fails");
    }, 1);
    try {
      future.get(TestUtils.TIMEOUT, TimeUnit.MILLISECONDS);
      Assert.fail();
    } catch (ExecutionException e) {
      Assert.assertTrue(e.getCause() instanceof IllegalStateException);
    }
    Assert.assertEquals(2, attempts.get());
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testNoRetries() throws Exception {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    runtime.addExecutors(newExecutor("threads"));
    AtomicInteger attempts = new AtomicInteger(0);
    CompletableFuture<Integer> future = runtime.submit("threads", () -> {
      attempts.incrementAndGet();
      throw new IllegalStateException("Fails once");
    }, 0);
    try {
      future.get(TestUtils.TIMEOUT, TimeUnit.MILLISECONDS);
      Assert.fail();
    } catch (ExecutionException e) {
      Assert.assertEquals("Fails once", e.getCause().getMessage());
    }
    Assert.assertEquals(1, attempts.get());
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testManyRetriesOfImmediatelyFailingTask() throws Exception {
    int retries = 50000;
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    RefusingExecutor executor = new RefusingExecutor(new SimpleExecutorConfig("refusing", false));
    runtime.addExecutors(executor);
    CompletableFuture<Integer> future = runtime.submit("refusing", () -> 1, retries);
    try {
      future.get(TestUtils.TIMEOUT, TimeUnit.MILLISECONDS);
      Assert.fail();
    } catch (ExecutionException e) {
      Assert.assertEquals("Refused", e.getCause().getMessage());
    }
    Assert.assertEquals(retries + 1, executor.getNumOfSubmissions());
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testNoRetriesOnExecutorInBadState() throws Exception {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    BlockProviderExecutor executor = new BlockProviderExecutor(new SimpleExecutorConfig("bad", true, null, null, 1, 1000L),
        new FailingProvider(0));
    runtime.addExecutors(executor);
    Assert.assertEquals(0, (int) executor.scaleOut(1).get(TestUtils.TIMEOUT, TimeUnit.MILLISECONDS));
    Assert.assertTrue(executor.isBadStateSet());
    CompletableFuture<Integer> future = runtime.submit("bad", () -> 1, 100000);
    try {
      future.get(TestUtils.TIMEOUT, TimeUnit.MILLISECONDS);
      Assert.fail();
    } catch (ExecutionException e) {
      Assert.assertTrue(e.getCause() instanceof ExecutorBadStateException);
    }
    Assert.assertEquals(0, executor.getOutstanding());
    Assert.assertTrue(runtime.shutdown());
  }

  @Test
  public void testRetriesAcrossBlockProviderExecutor() throws Exception {
    ExecutorRuntime runtime = new ExecutorRuntime(RUN_DIR);
    TaskExecutor executor = TaskExecutors.newLocalBlockExecutor("blocks", 1, 2, 2);
    runtime.addExecutors(Arrays.asList(executor));
    AtomicInteger attempts = new AtomicInteger(0);
    CompletableFuture<String> future = runtime.submit("blocks", () -> {
      if (attempts.incrementAndGet() == 1) {
        throw new IllegalStateException("First attempt fails");
      }
      return "done";
    }, 3);
    Assert.assertEquals("done", future.get(TestUtils.TIMEOUT, TimeUnit.MILLISECONDS));
    Assert.assertEquals(2, attempts.get());
    Assert.assertTrue(runtime.shutdown());
  }

}
