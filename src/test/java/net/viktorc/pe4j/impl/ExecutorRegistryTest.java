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
import net.viktorc.pe4j.api.TaskExecutor;
import org.junit.Assert;
import org.junit.Test;

/**
 * A unit test class for {@link ExecutorRegistry}.
 *
 * @author Viktor Csomor
 */
public class ExecutorRegistryTest extends TestCase {

  @Test
  public void testRegisteredExecutorsRetrievableByLabel() {
    ExecutorRegistry registry = new ExecutorRegistry();
    TaskExecutor first = TaskExecutors.newThreadPoolExecutor("first", 1);
    TaskExecutor second = TaskExecutors.newThreadPoolExecutor("second", 1);
    registry.register(first);
    registry.register(second);
    Assert.assertTrue(registry.contains("first"));
    Assert.assertSame(second, registry.get("second").orElse(null));
    Assert.assertFalse(registry.get("third").isPresent());
    Assert.assertEquals(Arrays.asList(first, second), registry.getExecutors());
  }

  @Test
  public void testThrowsExceptionIfLabelRegistered() {
    ExecutorRegistry registry = new ExecutorRegistry();
    registry.register(TaskExecutors.newThreadPoolExecutor("dup", 1));
    exceptionRule.expect(IllegalArgumentException.class);
    registry.register(TaskExecutors.newThreadPoolExecutor("dup", 2));
  }

  @Test
  public void testThrowsExceptionIfExecutorNull() {
    ExecutorRegistry registry = new ExecutorRegistry();
    exceptionRule.expect(IllegalArgumentException.class);
    registry.register(null);
  }

  @Test
  public void testLabelReusableAfterUnregistering() {
    ExecutorRegistry registry = new ExecutorRegistry();
    registry.register(TaskExecutors.newThreadPoolExecutor("reused", 1));
    Assert.assertTrue(registry.unregister("reused"));
    Assert.assertFalse(registry.unregister("reused"));
    TaskExecutor replacement = TaskExecutors.newThreadPoolExecutor("reused", 1);
    registry.register(replacement);
    Assert.assertSame(replacement, registry.get("reused").orElse(null));
  }

  @Test
  public void testClear() {
    ExecutorRegistry registry = new ExecutorRegistry();
    registry.register(TaskExecutors.newThreadPoolExecutor("a", 1));
    registry.register(TaskExecutors.newThreadPoolExecutor("b", 1));
    registry.clear();
    Assert.assertTrue(registry.getExecutors().isEmpty());
    Assert.assertFalse(registry.contains("a"));
  }

  @Test
  public void testExecutorListIsCopy() {
    ExecutorRegistry registry = new ExecutorRegistry();
    registry.register(TaskExecutors.newThreadPoolExecutor("a", 1));
    registry.getExecutors().clear();
    Assert.assertTrue(registry.contains("a"));
  }

}
