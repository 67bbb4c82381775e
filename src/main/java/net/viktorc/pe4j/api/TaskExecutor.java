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
package net.viktorc.pe4j.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * The uniform interface every task execution backend implements, whether it runs tasks in a local thread pool, on remote workers, or on
 * batch scheduled allocations. It allows the surrounding runtime to submit tasks, to grow and shrink the executor's capacity in whole
 * blocks, and to observe the executor's state without any backend specific code.
 * <p>
 * The life cycle of an executor is <code>CREATED</code>, then <code>STARTED</code> after {@link #start()}, then <code>SHUT_DOWN</code>
 * after {@link #shutdown()}. Tasks can be submitted and capacity can be scaled concurrently while the executor is started.
 *
 * @author Viktor Csomor
 */
public interface TaskExecutor {

  /**
   * Returns the label of the executor. It is immutable and unique among the executors of a runtime.
   *
   * @return The label of the executor.
   */
  String getLabel();

  /**
   * Returns the provider the executor acquires blocks from. Executors that do not scale may not have one.
   *
   * @return The provider of the executor's blocks.
   */
  Optional<ExecutionProvider> getProvider();

  /**
   * Returns whether the blocks of the executor are under the elastic control of the runtime. If {@link #isScalingEnabled()} returns
   * <code>false</code>, this method returns <code>false</code> as well.
   *
   * @return Whether the executor is managed.
   */
  boolean isManaged();

  /**
   * Returns whether the executor is backed by an elastic provider and supports {@link #scaleOut(int)} and {@link #scaleIn(int)}.
   *
   * @return Whether scaling is enabled.
   */
  boolean isScalingEnabled();

  /**
   * Returns the current life cycle state of the executor.
   *
   * @return The state of the executor.
   */
  ExecutorState getState();

  /**
   * Returns a consistent snapshot of the states of the executor's blocks keyed by their executor-side IDs.
   *
   * @return The states of the blocks of the executor.
   */
  Map<String, BlockState> getStatus();

  /**
   * Returns the number of blocks the executor currently holds or is in the process of acquiring, i.e. the blocks not in a terminal state.
   *
   * @return The number of live blocks.
   */
  int getBlockCount();

  /**
   * Returns the number of tasks submitted but not yet completed. It is never negative.
   *
   * @return The number of outstanding tasks.
   */
  int getOutstanding();

  /**
   * Returns the directory used for backend-local artifacts.
   *
   * @return The working directory.
   */
  Optional<String> getWorkingDir();

  /**
   * Returns the ordered list of staging providers exposed by the executor. If it is empty, the runtime falls back on its default staging
   * providers.
   *
   * @return The staging providers of the executor.
   */
  Optional<List<StagingProvider>> getStorageAccess();

  /**
   * Returns the path to the bookkeeping directory of the run.
   *
   * @return The run directory.
   */
  Optional<String> getRunDir();

  /**
   * Sets the path to the bookkeeping directory of the run.
   *
   * @param runDir The run directory.
   */
  void setRunDir(String runDir);

  /**
   * Returns the address of the monitoring hub.
   *
   * @return The hub address or an empty optional if monitoring is disabled.
   */
  Optional<String> getHubAddress();

  /**
   * Sets the address of the monitoring hub. It may be called at any time, including after {@link #start()}.
   *
   * @param hubAddress The hub address or <code>null</code> to disable monitoring.
   */
  void setHubAddress(String hubAddress);

  /**
   * Returns the port of the monitoring hub.
   *
   * @return The hub port or an empty optional if monitoring is disabled.
   */
  Optional<Integer> getHubPort();

  /**
   * Sets the port of the monitoring hub. It may be called at any time, including after {@link #start()}.
   *
   * @param hubPort The hub port or <code>null</code> to disable monitoring.
   */
  void setHubPort(Integer hubPort);

  /**
   * Performs all spin-up operations of the backend. It is called exactly once, before any submission.
   *
   * @throws FailedStartupException If the executor cannot be started. The executor is unusable afterwards.
   * @throws IllegalStateException If the executor has already been started or shut down.
   */
  void start() throws FailedStartupException;

  /**
   * Schedules the task for asynchronous execution and returns a handle to it without blocking. It may be called concurrently. If the task
   * cannot be executed, either an exception is thrown or the returned future fails; tasks are never silently dropped.
   *
   * @param task The task to execute.
   * @param <T> The return type of the task.
   * @return A future representing the pending completion of the task.
   * @throws IllegalArgumentException If the task is null.
   * @throws java.util.concurrent.RejectedExecutionException If the executor is not started.
   */
  <T> SubmissionFuture<T> submit(Callable<T> task);

  /**
   * Requests the specified number of additional blocks from the provider. It returns immediately; the acquisition happens in the
   * background and its progress is reflected by {@link #getStatus()}.
   *
   * @param blocks The number of blocks to add.
   * @return A future holding the number of blocks actually acquired.
   * @throws IllegalArgumentException If the number of blocks is negative.
   * @throws ScalingNotSupportedException If scaling is not enabled.
   * @throws IllegalStateException If the executor is not started.
   */
  Future<Integer> scaleOut(int blocks);

  /**
   * Requests the release of the specified number of blocks. It returns immediately; the release happens in the background. The request is
   * clamped to the number of blocks the executor holds.
   *
   * @param blocks The number of blocks to release.
   * @return A future holding the number of blocks actually released.
   * @throws IllegalArgumentException If the number of blocks is negative.
   * @throws ScalingNotSupportedException If scaling is not enabled.
   * @throws IllegalStateException If the executor is not started.
   */
  Future<Integer> scaleIn(int blocks);

  /**
   * Releases all resources of the executor including its remaining blocks, background threads, and connections. It never throws so that
   * the runtime can shut down all its executors on a best-effort basis. Calling it again has no effect.
   *
   * @return Whether this call performed the teardown and the teardown succeeded. It is <code>false</code> if the executor had already
   * been shut down.
   */
  boolean shutdown();

}
