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

/**
 * A staging provider for local files that are accessible where the tasks execute, hence do not need to be moved.
 *
 * @author Viktor Csomor
 */
public class NoOpFileStaging implements StagingProvider {

  private static final String FILE_SCHEME = "file";

  private static boolean isLocalFile(URI file) {
    return file.getScheme() == null || FILE_SCHEME.equalsIgnoreCase(file.getScheme());
  }

  @Override
  public boolean canStageIn(URI file) {
    return isLocalFile(file);
  }

  @Override
  public boolean canStageOut(URI file) {
    return isLocalFile(file);
  }

  @Override
  public String toString() {
    return "noOpFileStaging";
  }

}
