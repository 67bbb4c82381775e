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

/**
 * An exception thrown when a scaling operation is requested from an executor whose {@link TaskExecutor#isScalingEnabled()} method
 * returns <code>false</code>. No capacity change is attempted when it is thrown.
 *
 * @author Viktor Csomor
 */
public class ScalingNotSupportedException extends UnsupportedOperationException {

  /**
   * Creates a <code>ScalingNotSupportedException</code> for the executor with the specified label.
   *
   * @param label The label of the executor that does not support scaling.
   */
  public ScalingNotSupportedException(String label) {
    super(String.format("Executor %s does not support scaling", label));
  }

}
