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
 * The life cycle states of a {@link TaskExecutor}. Tasks may only be submitted and capacity may only be scaled in the
 * <code>STARTED</code> state. <code>SHUT_DOWN</code> is terminal.
 *
 * @author Viktor Csomor
 */
public enum ExecutorState {
  CREATED,
  STARTED,
  SHUT_DOWN
}
