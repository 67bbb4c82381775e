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
import java.util.Optional;

/**
 * An interface for the static configuration of a {@link TaskExecutor}. Everything but the label has a default.
 *
 * @author Viktor Csomor
 */
public interface ExecutorConfig {

  /**
   * Returns the label of the executor. It has to be non-empty and unique among the executors of a runtime.
   *
   * @return The label of the executor.
   */
  String getLabel();

  /**
   * Returns whether the blocks of the executor are under the elastic control of the runtime. Executors that cannot scale must not be
   * managed.
   *
   * @return Whether the executor is managed.
   */
  default boolean isManaged() {
    return true;
  }

  /**
   * Returns the directory for backend-local artifacts.
   *
   * @return The working directory of the executor.
   */
  default Optional<String> getWorkingDir() {
    return Optional.empty();
  }

  /**
   * Returns the staging providers the executor exposes. If it is empty, the runtime substitutes its default staging providers.
   *
   * @return The ordered list of staging providers of the executor.
   */
  default Optional<List<StagingProvider>> getStorageAccess() {
    return Optional.empty();
  }

  /**
   * Returns the number of consecutive block provisioning failures, without any active blocks left, after which the executor gives up and
   * fails all its outstanding tasks.
   *
   * @return The maximum number of consecutive block failures tolerated.
   */
  default int getMaxConsecutiveBlockFailures() {
    return 3;
  }

  /**
   * Returns the number of milliseconds of idleness after which excess threads of the executor's internal thread pools are terminated.
   *
   * @return The keep-alive time of idle threads in milliseconds.
   */
  default long getThreadKeepAliveTime() {
    return 60L * 1000L;
  }

}
