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

import net.viktorc.pe4j.api.ExecutionProvider;
import net.viktorc.pe4j.api.TaskExecutor;

/**
 * A class for convenience and factory methods for creating instances of implementations of the {@link TaskExecutor} interface.
 *
 * @author Viktor Csomor
 */
public class TaskExecutors {

  /**
   * Not initializable; only static methods...
   */
  private TaskExecutors() {
  }

  /**
   * Returns an unmanaged executor backed by a local pool of a fixed number of threads. It does not support scaling.
   *
   * @param label The label of the executor.
   * @param numOfThreads The number of threads in the pool.
   * @return A fixed-capacity executor.
   */
  public static TaskExecutor newThreadPoolExecutor(String label, int numOfThreads) {
    return new ThreadPoolTaskExecutor(new SimpleExecutorConfig(label, false), numOfThreads);
  }

  /**
   * Returns a managed executor acquiring its blocks from the specified provider.
   *
   * @param label The label of the executor.
   * @param provider The provider of the executor's blocks.
   * @return An elastic executor.
   */
  public static TaskExecutor newBlockProviderExecutor(String label, ExecutionProvider provider) {
    return new BlockProviderExecutor(new SimpleExecutorConfig(label, true), provider);
  }

  /**
   * Returns a managed executor whose blocks live in the local JVM. It is a convenience method for calling
   * {@link #newBlockProviderExecutor(String, ExecutionProvider)} with a {@link LocalProvider} with no minimum.
   *
   * @param label The label of the executor.
   * @param initBlocks The number of blocks to acquire on startup.
   * @param maxBlocks The maximum number of blocks.
   * @param workersPerBlock The number of workers per block.
   * @return An elastic executor running its tasks in the local JVM.
   */
  public static TaskExecutor newLocalBlockExecutor(String label, int initBlocks, int maxBlocks, int workersPerBlock) {
    return newBlockProviderExecutor(label, new LocalProvider(initBlocks, 0, maxBlocks, workersPerBlock));
  }

}
