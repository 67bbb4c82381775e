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

import java.net.URI;

/**
 * An interface for file staging collaborators. Executors may expose an ordered list of them through
 * {@link TaskExecutor#getStorageAccess()}; the staging subsystem consults them in order and uses the first one that can handle a file.
 *
 * @author Viktor Csomor
 */
public interface StagingProvider {

  /**
   * Returns whether the provider can move the specified file to where the task executes.
   *
   * @param file The location of the input file.
   * @return Whether the file can be staged in by this provider.
   */
  boolean canStageIn(URI file);

  /**
   * Returns whether the provider can move the specified file from where the task executes to its final location.
   *
   * @param file The location of the output file.
   * @return Whether the file can be staged out by this provider.
   */
  boolean canStageOut(URI file);

}
