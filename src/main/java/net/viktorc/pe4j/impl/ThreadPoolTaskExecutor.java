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

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import net.viktorc.pe4j.api.BlockState;
import net.viktorc.pe4j.api.ExecutorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed-capacity executor running tasks in a local thread pool. It does not have a provider, it does not hold blocks, and it does not
 * support scaling. On shutdown, it waits for the submitted tasks to complete.
 *
 * @author Viktor Csomor
 */
public class ThreadPoolTaskExecutor extends AbstractTaskExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ThreadPoolTaskExecutor.class);

  private final int maxThreads;

  private ThreadPoolExecutor threadPool;

  /**
   * Constructs an executor according to the specified parameters.
   *
   * @param config The configuration of the executor. It must not mark the executor managed.
   * @param maxThreads The number of threads in the pool.
   * @throws IllegalArgumentException If the configuration is invalid or marks the executor managed, or the number of threads is less than
   * 1.
   */
  public ThreadPoolTaskExecutor(ExecutorConfig config, int maxThreads) {
    super(config, null, false);
    if (maxThreads < 1) {
      throw new IllegalArgumentException("The number of threads must be at least 1");
    }
    this.maxThreads = maxThreads;
  }

  /**
   * Returns the number of threads of the executor's pool.
   *
   * @return The size of the thread pool.
   */
  public int getMaxThreads() {
    return maxThreads;
  }

  @Override
  protected void doStart() {
    threadPool = new ThreadPoolExecutor(maxThreads, maxThreads, config.getThreadKeepAliveTime(), TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(), new CustomizedThreadFactory(getLabel()));
    LOGGER.debug("Thread pool of {} thread(s) created for executor {}", maxThreads, getLabel());
  }

  @Override
  protected <T> Future<?> doSubmit(Callable<T> task, CompletableFuture<T> completion) {
    return threadPool.submit(() -> executeAndComplete(task, completion));
  }

  @Override
  protected boolean doShutdown() {
    if (threadPool == null) {
      return true;
    }
    threadPool.shutdown();
    try {
      threadPool.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
      return true;
    } catch (InterruptedException e) {
      LOGGER.warn(e.getMessage(), e);
      threadPool.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public Map<String, BlockState> getStatus() {
    return Collections.emptyMap();
  }

  @Override
  public int getBlockCount() {
    return 0;
  }

}
