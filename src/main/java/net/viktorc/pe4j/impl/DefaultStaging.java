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
import java.util.List;
import net.viktorc.pe4j.api.StagingProvider;

/**
 * The staging providers used for executors that do not expose their own.
 *
 * @author Viktor Csomor
 */
public class DefaultStaging {

  private static final List<StagingProvider> PROVIDERS = Collections.singletonList(new NoOpFileStaging());

  /**
   * Not initializable; only static methods...
   */
  private DefaultStaging() {
  }

  /**
   * Returns the default staging providers in the order they should be consulted.
   *
   * @return An unmodifiable list of the default staging providers.
   */
  public static List<StagingProvider> getProviders() {
    return PROVIDERS;
  }

}
