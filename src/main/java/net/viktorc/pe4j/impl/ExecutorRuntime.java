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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import net.viktorc.pe4j.api.ExecutorState;
import net.viktorc.pe4j.api.FailedStartupException;
import net.viktorc.pe4j.api.StagingProvider;
import net.viktorc.pe4j.api.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The owner of a set of executors within one run. It makes sure that the labels of its executors are unique, wires the executors to the
 * run directory and the monitoring hub, starts them, substitutes the default staging providers for executors that do not have their own,
 * retries failed tasks, and shuts all executors down on a best-effort basis at the end of the run.
 *
 * @author Viktor Csomor
 */
public class ExecutorRuntime {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorRuntime.class);

  private final String runDir;
  private final List<StagingProvider> defaultStaging;
  private final ExecutorRegistry registry;
  private final RetryHandler retryHandler;
  private final Object lock;

  private String hubAddress;
  private Integer hubPort;
  private boolean shutdown;

  /**
   * Constructs a runtime according to the specified parameters.
   *
   * @param runDir The bookkeeping directory of the run.
   * @param defaultStaging The staging providers to use for executors that do not expose their own.
   * @throws IllegalArgumentException If the run directory or the default staging providers are null.
   */
  public ExecutorRuntime(String runDir, List<StagingProvider> defaultStaging) {
    if (runDir == null) {
      throw new IllegalArgumentException("The run directory cannot be null");
    }
    if (defaultStaging == null) {
      throw new IllegalArgumentException("The default staging providers cannot be null");
    }
    this.runDir = runDir;
    this.defaultStaging = Collections.unmodifiableList(defaultStaging);
    registry = new ExecutorRegistry();
    retryHandler = new RetryHandler();
    lock = new Object();
  }

  /**
   * Constructs a runtime using the providers returned by {@link DefaultStaging#getProviders()} as the default staging providers.
   *
   * @param runDir The bookkeeping directory of the run.
   */
  public ExecutorRuntime(String runDir) {
    this(runDir, DefaultStaging.getProviders());
  }

  public String getRunDir() {
    return runDir;
  }

  /**
   * Sets the monitoring hub endpoint and passes it on to all executors of the runtime, including the ones already started.
   *
   * @param hubAddress The address of the hub or <code>null</code> to disable monitoring.
   * @param hubPort The port of the hub or <code>null</code> to disable monitoring.
   */
  public void setMonitoringHub(String hubAddress, Integer hubPort) {
    synchronized (lock) {
      this.hubAddress = hubAddress;
      this.hubPort = hubPort;
      for (TaskExecutor executor : registry.getExecutors()) {
        executor.setHubAddress(hubAddress);
        executor.setHubPort(hubPort);
      }
    }
    LOGGER.debug("Monitoring hub set to {}:{}", hubAddress, hubPort);
  }

  /**
   * Registers and starts the specified executors. The labels are checked before any of the executors is started. If an executor fails to
   * start, the executors after it are neither registered nor started.
   *
   * @param executors The executors to add.
   * @throws FailedStartupException If one of the executors fails to start.
   * @throws IllegalArgumentException If an executor is null, or its label is already taken, or two executors have the same label, or an
   * executor is not in the <code>CREATED</code> state.
   * @throws IllegalStateException If the runtime has been shut down.
   */
  public void addExecutors(Collection<? extends TaskExecutor> executors) throws FailedStartupException {
    synchronized (lock) {
      if (shutdown) {
        throw new IllegalStateException("The runtime has already been shut down");
      }
      Set<String> labels = new HashSet<>();
      for (TaskExecutor executor : executors) {
        if (executor == null) {
          throw new IllegalArgumentException("The executor cannot be null");
        }
        if (!labels.add(executor.getLabel()) || registry.contains(executor.getLabel())) {
          throw new IllegalArgumentException(String.format("The executor label %s is not unique", executor.getLabel()));
        }
        if (executor.getState() != ExecutorState.CREATED) {
          throw new IllegalArgumentException(String.format("Executor %s has already been started", executor.getLabel()));
        }
      }
      for (TaskExecutor executor : executors) {
        registry.register(executor);
        executor.setRunDir(runDir);
        executor.setHubAddress(hubAddress);
        executor.setHubPort(hubPort);
        try {
          executor.start();
        } catch (FailedStartupException | RuntimeException e) {
          LOGGER.error(String.format("Executor %s failed to start", executor.getLabel()), e);
          registry.unregister(executor.getLabel());
          throw e;
        }
        LOGGER.debug("Executor {} added to the runtime", executor.getLabel());
      }
    }
  }

  /**
   * Registers and starts the specified executors. See {@link #addExecutors(Collection)}.
   *
   * @param executors The executors to add.
   * @throws FailedStartupException If one of the executors fails to start.
   */
  public void addExecutors(TaskExecutor... executors) throws FailedStartupException {
    addExecutors(Arrays.asList(executors));
  }

  /**
   * Returns the executor with the specified label.
   *
   * @param label The label of the executor.
   * @return The executor or an empty optional if the runtime has no executor with the label.
   */
  public Optional<TaskExecutor> getExecutor(String label) {
    return registry.get(label);
  }

  /**
   * Returns the executors of the runtime in the order they were added.
   *
   * @return A list of the executors.
   */
  public List<TaskExecutor> getExecutors() {
    return registry.getExecutors();
  }

  /**
   * Returns the staging providers to consult for tasks run on the executor with the specified label: the executor's own providers if it
   * exposes any, the runtime's default providers otherwise.
   *
   * @param label The label of the executor.
   * @return The ordered list of staging providers.
   * @throws IllegalArgumentException If the runtime has no executor with the label.
   */
  public List<StagingProvider> getStagingProviders(String label) {
    return requireExecutor(label).getStorageAccess().orElse(defaultStaging);
  }

  /**
   * Submits the task to the executor with the specified label, resubmitting it at most <code>retries</code> times if it fails.
   *
   * @param label The label of the executor.
   * @param task The task to execute.
   * @param retries The number of retries.
   * @param <T> The return type of the task.
   * @return A future representing the outcome of the task across all attempts.
   * @throws IllegalArgumentException If the runtime has no executor with the label.
   */
  public <T> CompletableFuture<T> submit(String label, Callable<T> task, int retries) {
    return retryHandler.submit(requireExecutor(label), task, retries);
  }

  /**
   * Shuts down all executors of the runtime, continuing with the rest if one of them fails, and clears the registry.
   *
   * @return Whether all executors were shut down successfully. It is <code>false</code> if the runtime had already been shut down.
   */
  public boolean shutdown() {
    List<TaskExecutor> executors;
    synchronized (lock) {
      if (shutdown) {
        return false;
      }
      shutdown = true;
      executors = registry.getExecutors();
    }
    boolean success = true;
    for (TaskExecutor executor : executors) {
      if (executor.getState() == ExecutorState.SHUT_DOWN) {
        continue;
      }
      try {
        if (!executor.shutdown()) {
          LOGGER.warn("Executor {} failed to shut down cleanly", executor.getLabel());
          success = false;
        }
      } catch (RuntimeException e) {
        LOGGER.warn(String.format("Error while shutting down executor %s", executor.getLabel()), e);
        success = false;
      }
    }
    registry.clear();
    LOGGER.debug("Runtime shut down{}", success ? "" : " with errors");
    return success;
  }

  private TaskExecutor requireExecutor(String label) {
    return registry.get(label)
        .orElseThrow(() -> new IllegalArgumentException(String.format("No executor labelled %s", label)));
  }

}
