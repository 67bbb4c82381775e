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

import java.net.URI;
import net.viktorc.pe4j.api.StagingProvider;
import org.junit.Assert;
import org.junit.Test;

/**
 * A unit test class for {@link NoOpFileStaging} and {@link DefaultStaging}.
 *
 * @author Viktor Csomor
 */
public class NoOpFileStagingTest extends TestCase {

  @Test
  public void testLocalFilesAccepted() {
    StagingProvider staging = new NoOpFileStaging();
    Assert.assertTrue(staging.canStageIn(URI.create("file:///data/in.txt")));
    Assert.assertTrue(staging.canStageOut(URI.create("FILE:///data/out.txt")));
    Assert.assertTrue(staging.canStageIn(URI.create("relative/path.txt")));
  }

  @Test
  public void testRemoteFilesRejected() {
    StagingProvider staging = new NoOpFileStaging();
    Assert.assertFalse(staging.canStageIn(URI.create("https://example.org/in.txt")));
    Assert.assertFalse(staging.canStageOut(URI.create("globus://endpoint/out.txt")));
  }

  @Test
  public void testDefaultProviders() {
    Assert.assertEquals(1, DefaultStaging.getProviders().size());
    Assert.assertTrue(DefaultStaging.getProviders().get(0) instanceof NoOpFileStaging);
  }

}
