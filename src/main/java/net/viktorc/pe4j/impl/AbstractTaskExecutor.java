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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import net.viktorc.pe4j.api.ExecutionProvider;
import net.viktorc.pe4j.api.ExecutorConfig;
import net.viktorc.pe4j.api.ExecutorState;
import net.viktorc.pe4j.api.FailedStartupException;
import net.viktorc.pe4j.api.ScalingNotSupportedException;
import net.viktorc.pe4j.api.StagingProvider;
import net.viktorc.pe4j.api.SubmissionFuture;
import net.viktorc.pe4j.api.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An abstract implementation of the {@link TaskExecutor} interface that holds the fields every executor has and enforces the life cycle
 * and the argument checks of the contract. It keeps track of the number of outstanding tasks by counting the completion futures it hands
 * to sub-classes. Sub-classes only have to provide the backend specific parts of starting, submitting, scaling, and shutting down.
 *
 * @author Viktor Csomor
 */
public abstract class AbstractTaskExecutor implements TaskExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AbstractTaskExecutor.class);

  protected final ExecutorConfig config;
  protected final Object stateLock;

  private final String label;
  private final ExecutionProvider provider;
  private final boolean managed;
  private final boolean scalingEnabled;
  private final String workingDir;
  private final List<StagingProvider> storageAccess;
  private final AtomicInteger outstanding;

  private volatile ExecutorState state;
  private volatile String runDir;
  private volatile String hubAddress;
  private volatile Integer hubPort;

  /**
   * Constructs an executor according to the specified configuration.
   *
   * @param config The static configuration of the executor.
   * @param provider The provider of the executor's blocks. It may only be null if scaling is not enabled.
   * @param scalingEnabled Whether the executor supports scaling.
   * @throws IllegalArgumentException If the configuration is null, or the label is null or blank, or scaling is enabled but the provider
   * is null, or scaling is not enabled but the configuration marks the executor managed.
   */
  protected AbstractTaskExecutor(ExecutorConfig config, ExecutionProvider provider, boolean scalingEnabled) {
    if (config == null) {
      throw new IllegalArgumentException("The executor configuration cannot be null");
    }
    if (config.getLabel() == null || config.getLabel().trim().isEmpty()) {
      throw new IllegalArgumentException("The executor label cannot be null or empty");
    }
    if (scalingEnabled && provider == null) {
      throw new IllegalArgumentException("A scaling executor requires an execution provider");
    }
    if (!scalingEnabled && config.isManaged()) {
      throw new IllegalArgumentException("An executor that cannot scale cannot be managed");
    }
    this.config = config;
    this.provider = provider;
    this.scalingEnabled = scalingEnabled;
    label = config.getLabel();
    managed = config.isManaged();
    workingDir = config.getWorkingDir().orElse(null);
    storageAccess = config.getStorageAccess()
        .map(list -> Collections.unmodifiableList(new ArrayList<>(list)))
        .orElse(null);
    outstanding = new AtomicInteger(0);
    stateLock = new Object();
    state = ExecutorState.CREATED;
  }

  /**
   * Executes the task and completes the future with its outcome unless the future is already done, e.g. because it has been cancelled.
   *
   * @param task The task to execute.
   * @param completion The future to complete.
   * @param <T> The return type of the task.
   */
  protected static <T> void executeAndComplete(Callable<T> task, CompletableFuture<T> completion) {
    if (completion.isDone()) {
      return;
    }
    try {
      completion.complete(task.call());
    } catch (Exception e) {
      completion.completeExceptionally(e);
    } catch (Error e) {
      completion.completeExceptionally(e);
      throw e;
    }
  }

  /**
   * Performs the backend specific spin-up operations. It is called exactly once, while holding the state lock.
   *
   * @throws FailedStartupException If the backend cannot be started.
   */
  protected abstract void doStart() throws FailedStartupException;

  /**
   * Schedules the task for execution. The implementation has to ensure that the completion future is eventually completed one way or
   * another.
   *
   * @param task The task to execute.
   * @param completion The future to complete with the outcome of the task.
   * @param <T> The return type of the task.
   * @return The future the backend natively returned for the task or <code>null</code> if it did not return one.
   * @throws RejectedExecutionException If the task cannot be scheduled.
   */
  protected abstract <T> Future<?> doSubmit(Callable<T> task, CompletableFuture<T> completion);

  /**
   * Acquires the specified number of blocks in the background. It is only called on started, managed executors with scaling enabled and
   * a positive number of blocks.
   *
   * @param blocks The number of blocks to acquire.
   * @return A future holding the number of blocks actually acquired.
   */
  protected Future<Integer> doScaleOut(int blocks) {
    throw new ScalingNotSupportedException(label);
  }

  /**
   * Releases the specified number of blocks in the background. It is only called on started, managed executors with scaling enabled and a
   * positive number of blocks.
   *
   * @param blocks The number of blocks to release.
   * @return A future holding the number of blocks actually released.
   */
  protected Future<Integer> doScaleIn(int blocks) {
    throw new ScalingNotSupportedException(label);
  }

  /**
   * Releases all resources of the backend. It is called at most once, either from {@link #shutdown()} or after a failed start.
   *
   * @return Whether all resources have been released successfully.
   */
  protected abstract boolean doShutdown();

  /**
   * Checks a scaling request against the contract.
   *
   * @param blocks The number of blocks requested.
   * @return Whether the request should be passed on to the backend.
   */
  private boolean checkScalingRequest(int blocks) {
    if (blocks < 0) {
      throw new IllegalArgumentException("The number of blocks cannot be negative");
    }
    if (!scalingEnabled) {
      throw new ScalingNotSupportedException(label);
    }
    if (state != ExecutorState.STARTED) {
      throw new IllegalStateException(String.format("Executor %s is not running", label));
    }
    if (!managed) {
      LOGGER.debug("Ignoring scaling request of executor {} as it is not managed", label);
      return false;
    }
    return blocks > 0;
  }

  @Override
  public String getLabel() {
    return label;
  }

  @Override
  public Optional<ExecutionProvider> getProvider() {
    return Optional.ofNullable(provider);
  }

  @Override
  public boolean isManaged() {
    return managed;
  }

  @Override
  public boolean isScalingEnabled() {
    return scalingEnabled;
  }

  @Override
  public ExecutorState getState() {
    return state;
  }

  @Override
  public int getOutstanding() {
    return outstanding.get();
  }

  @Override
  public Optional<String> getWorkingDir() {
    return Optional.ofNullable(workingDir);
  }

  @Override
  public Optional<List<StagingProvider>> getStorageAccess() {
    return Optional.ofNullable(storageAccess);
  }

  @Override
  public Optional<String> getRunDir() {
    return Optional.ofNullable(runDir);
  }

  @Override
  public void setRunDir(String runDir) {
    this.runDir = runDir;
  }

  @Override
  public Optional<String> getHubAddress() {
    return Optional.ofNullable(hubAddress);
  }

  @Override
  public void setHubAddress(String hubAddress) {
    this.hubAddress = hubAddress;
  }

  @Override
  public Optional<Integer> getHubPort() {
    return Optional.ofNullable(hubPort);
  }

  @Override
  public void setHubPort(Integer hubPort) {
    this.hubPort = hubPort;
  }

  /**
   * Returns whether both the address and the port of the monitoring hub are set.
   *
   * @return Whether monitoring is enabled for the executor.
   */
  public boolean isMonitoringEnabled() {
    return hubAddress != null && hubPort != null;
  }

  @Override
  public final void start() throws FailedStartupException {
    synchronized (stateLock) {
      if (state != ExecutorState.CREATED) {
        throw new IllegalStateException(String.format("Executor %s cannot be started in state %s", label, state));
      }
      LOGGER.debug("Starting executor {}...", label);
      try {
        doStart();
      } catch (FailedStartupException | RuntimeException e) {
        LOGGER.debug("Startup of executor {} failed", label);
        state = ExecutorState.SHUT_DOWN;
        try {
          doShutdown();
        } catch (RuntimeException e2) {
          e.addSuppressed(e2);
        }
        if (e instanceof FailedStartupException) {
          throw (FailedStartupException) e;
        }
        throw new FailedStartupException(e);
      }
      state = ExecutorState.STARTED;
      LOGGER.debug("Executor {} started", label);
    }
  }

  @Override
  public final <T> SubmissionFuture<T> submit(Callable<T> task) {
    if (task == null) {
      throw new IllegalArgumentException("The task cannot be null");
    }
    if (state != ExecutorState.STARTED) {
      throw new RejectedExecutionException(String.format("Executor %s is not running", label));
    }
    CompletableFuture<T> completion = new CompletableFuture<>();
    outstanding.incrementAndGet();
    completion.whenComplete((result, exception) -> outstanding.decrementAndGet());
    try {
      Future<?> nativeFuture = doSubmit(task, completion);
      LOGGER.trace("Task {} submitted to executor {}", task, label);
      return new SubmissionFuture<>(completion, nativeFuture);
    } catch (RuntimeException e) {
      completion.completeExceptionally(e);
      throw e;
    }
  }

  @Override
  public final Future<Integer> scaleOut(int blocks) {
    if (!checkScalingRequest(blocks)) {
      return CompletableFuture.completedFuture(0);
    }
    LOGGER.debug("Scaling out executor {} by {} block(s)", label, blocks);
    return doScaleOut(blocks);
  }

  @Override
  public final Future<Integer> scaleIn(int blocks) {
    if (!checkScalingRequest(blocks)) {
      return CompletableFuture.completedFuture(0);
    }
    LOGGER.debug("Scaling in executor {} by {} block(s)", label, blocks);
    return doScaleIn(blocks);
  }

  @Override
  public final boolean shutdown() {
    synchronized (stateLock) {
      if (state == ExecutorState.SHUT_DOWN) {
        LOGGER.debug("Executor {} has already been shut down", label);
        return false;
      }
      state = ExecutorState.SHUT_DOWN;
    }
    LOGGER.debug("Shutting down executor {}...", label);
    boolean success;
    try {
      success = doShutdown();
    } catch (RuntimeException e) {
      LOGGER.warn(String.format("Error while shutting down executor %s", label), e);
      success = false;
    }
    LOGGER.debug("Executor {} shut down{}", label, success ? "" : " with errors");
    return success;
  }

  @Override
  public String toString() {
    return String.format("%s@%s", label, Integer.toHexString(hashCode()));
  }

}
