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

import net.viktorc.pe4j.api.TaskExecutor;
import org.junit.Assert;
import org.junit.Test;

/**
 * A unit test class for {@link TaskExecutors}.
 *
 * @author Viktor Csomor
 */
public class TaskExecutorsTest extends TestCase {

  @Test
  public void testNewThreadPoolExecutor() {
    TaskExecutor executor = TaskExecutors.newThreadPoolExecutor("threads", 2);
    Assert.assertTrue(executor instanceof ThreadPoolTaskExecutor);
    Assert.assertEquals("threads", executor.getLabel());
    Assert.assertFalse(executor.isManaged());
    Assert.assertFalse(executor.isScalingEnabled());
    Assert.assertFalse(executor.getProvider().isPresent());
  }

  @Test
  public void testNewLocalBlockExecutor() {
    TaskExecutor executor = TaskExecutors.newLocalBlockExecutor("blocks", 1, 3, 2);
    Assert.assertTrue(executor instanceof BlockProviderExecutor);
    Assert.assertTrue(executor.isManaged());
    Assert.assertTrue(executor.isScalingEnabled());
    Assert.assertEquals(3, executor.getProvider().map(p -> p.getMaxBlocks()).orElse(0).intValue());
    Assert.assertEquals(2, executor.getProvider().map(p -> p.getWorkersPerBlock()).orElse(0).intValue());
  }

}
