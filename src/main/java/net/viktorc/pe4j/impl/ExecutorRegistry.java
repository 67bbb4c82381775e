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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.viktorc.pe4j.api.TaskExecutor;

/**
 * A registry of the executors of one runtime instance ensuring that their labels are unique. It lives as long as its runtime and is
 * cleared when the runtime shuts down.
 *
 * @author Viktor Csomor
 */
public class ExecutorRegistry {

  private final Map<String, TaskExecutor> executors;

  /**
   * Constructs an empty registry.
   */
  public ExecutorRegistry() {
    executors = new LinkedHashMap<>();
  }

  /**
   * Registers the executor under its label.
   *
   * @param executor The executor to register.
   * @throws IllegalArgumentException If the executor is null, its label is null or blank, or another executor is already registered under
   * the same label.
   */
  public synchronized void register(TaskExecutor executor) {
    if (executor == null) {
      throw new IllegalArgumentException("The executor cannot be null");
    }
    String label = executor.getLabel();
    if (label == null || label.trim().isEmpty()) {
      throw new IllegalArgumentException("The executor label cannot be null or empty");
    }
    if (executors.containsKey(label)) {
      throw new IllegalArgumentException(String.format("An executor labelled %s is already registered", label));
    }
    executors.put(label, executor);
  }

  /**
   * Removes the executor registered under the specified label.
   *
   * @param label The label of the executor.
   * @return Whether there was an executor registered under the label.
   */
  public synchronized boolean unregister(String label) {
    return executors.remove(label) != null;
  }

  /**
   * Returns whether an executor is registered under the specified label.
   *
   * @param label The label to check.
   * @return Whether the label is taken.
   */
  public synchronized boolean contains(String label) {
    return executors.containsKey(label);
  }

  /**
   * Returns the executor registered under the specified label.
   *
   * @param label The label of the executor.
   * @return The executor or an empty optional if there is none registered under the label.
   */
  public synchronized Optional<TaskExecutor> get(String label) {
    return Optional.ofNullable(executors.get(label));
  }

  /**
   * Returns the registered executors in the order of their registration.
   *
   * @return A list of the registered executors.
   */
  public synchronized List<TaskExecutor> getExecutors() {
    return new ArrayList<>(executors.values());
  }

  /**
   * Removes all executors from the registry.
   */
  public synchronized void clear() {
    executors.clear();
  }

}
