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
import net.viktorc.pe4j.api.ExecutorConfig;
import net.viktorc.pe4j.api.StagingProvider;

/**
 * A simple, immutable implementation of the {@link ExecutorConfig} interface.
 *
 * @author Viktor Csomor
 */
public class SimpleExecutorConfig implements ExecutorConfig {

  private final String label;
  private final boolean managed;
  private final String workingDir;
  private final List<StagingProvider> storageAccess;
  private final int maxConsecutiveBlockFailures;
  private final long threadKeepAliveTime;

  /**
   * Constructs a <code>SimpleExecutorConfig</code> instance according to the specified parameters.
   *
   * @param label The label of the executor.
   * @param managed Whether the executor's blocks are under the elastic control of the runtime.
   * @param workingDir The working directory of the executor. If it is null, it will be ignored.
   * @param storageAccess The staging providers of the executor. If it is null, the runtime's defaults apply.
   * @param maxConsecutiveBlockFailures The number of consecutive block failures without active blocks the executor tolerates.
   * @param threadKeepAliveTime The number of milliseconds after which idle excess threads are terminated.
   * @throws IllegalArgumentException If the label is null or blank, the storage access list contains null, the maximum number of
   * consecutive block failures is less than 1, or the keep-alive time is not positive.
   */
  public SimpleExecutorConfig(String label, boolean managed, String workingDir, List<StagingProvider> storageAccess,
      int maxConsecutiveBlockFailures, long threadKeepAliveTime) {
    if (label == null || label.trim().isEmpty()) {
      throw new IllegalArgumentException("The label cannot be null or empty");
    }
    if (storageAccess != null && storageAccess.contains(null)) {
      throw new IllegalArgumentException("The storage access list cannot contain null");
    }
    if (maxConsecutiveBlockFailures < 1) {
      throw new IllegalArgumentException("The maximum number of consecutive block failures must be at least 1");
    }
    if (threadKeepAliveTime <= 0) {
      throw new IllegalArgumentException("The thread keep-alive time must be greater than 0");
    }
    this.label = label;
    this.managed = managed;
    this.workingDir = workingDir;
    this.storageAccess = storageAccess == null ? null : Collections.unmodifiableList(new ArrayList<>(storageAccess));
    this.maxConsecutiveBlockFailures = maxConsecutiveBlockFailures;
    this.threadKeepAliveTime = threadKeepAliveTime;
  }

  /**
   * Constructs a <code>SimpleExecutorConfig</code> instance according to the specified parameters using the default number of tolerated
   * block failures and the default thread keep-alive time.
   *
   * @param label The label of the executor.
   * @param managed Whether the executor's blocks are under the elastic control of the runtime.
   * @param workingDir The working directory of the executor. If it is null, it will be ignored.
   * @param storageAccess The staging providers of the executor. If it is null, the runtime's defaults apply.
   */
  public SimpleExecutorConfig(String label, boolean managed, String workingDir, List<StagingProvider> storageAccess) {
    this(label, managed, workingDir, storageAccess, 3, 60L * 1000L);
  }

  /**
   * Constructs a <code>SimpleExecutorConfig</code> instance with no working directory and no staging providers.
   *
   * @param label The label of the executor.
   * @param managed Whether the executor's blocks are under the elastic control of the runtime.
   */
  public SimpleExecutorConfig(String label, boolean managed) {
    this(label, managed, null, null);
  }

  @Override
  public String getLabel() {
    return label;
  }

  @Override
  public boolean isManaged() {
    return managed;
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
  public int getMaxConsecutiveBlockFailures() {
    return maxConsecutiveBlockFailures;
  }

  @Override
  public long getThreadKeepAliveTime() {
    return threadKeepAliveTime;
  }

}
