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

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An implementation the {@link ThreadFactory} interface that provides more descriptive thread names and logs the exceptions thrown in the
 * threads it creates that are not caught otherwise.
 *
 * @author Viktor Csomor
 */
class CustomizedThreadFactory implements ThreadFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(CustomizedThreadFactory.class);

  private final String poolName;
  private final ThreadFactory defaultFactory;

  /**
   * Constructs an instance according to the specified parameters.
   *
   * @param poolName The name of the thread pool. It will be prepended to the name of the created threads.
   */
  CustomizedThreadFactory(String poolName) {
    this.poolName = poolName;
    defaultFactory = Executors.defaultThreadFactory();
  }

  @Override
  public Thread newThread(Runnable r) {
    Thread thread = defaultFactory.newThread(r);
    thread.setName(thread.getName().replaceFirst("pool-[0-9]+", poolName));
    thread.setUncaughtExceptionHandler((t, e) -> LOGGER.error(e.getMessage(), e));
    return thread;
  }

}
