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
 * An exception used to fail the outstanding and any subsequently submitted tasks of an executor that has lost the ability to acquire
 * capacity.
 *
 * @author Viktor Csomor
 */
public class ExecutorBadStateException extends RuntimeException {

  /**
   * Creates an <code>ExecutorBadStateException</code> with the provided error message and cause.
   *
   * @param message The error message describing the bad state.
   * @param e The exception that put the executor into the bad state.
   */
  public ExecutorBadStateException(String message, Throwable e) {
    super(message, e);
  }

}
