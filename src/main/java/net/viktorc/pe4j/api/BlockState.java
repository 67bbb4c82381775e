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
 * The states a block of compute capacity goes through from the moment it is requested until it is given back to its provider.
 *
 * @author Viktor Csomor
 */
public enum BlockState {

  /**
   * The block has been requested but the request has not been passed on to the provider yet.
   */
  PENDING(false),
  /**
   * The provider is in the process of acquiring the block.
   */
  PROVISIONING(false),
  /**
   * The block is up and its workers are accepting tasks.
   */
  ACTIVE(false),
  /**
   * The block is being retired; its workers finish the tasks they hold but take no new ones.
   */
  DRAINING(false),
  /**
   * The block has been given back to the provider.
   */
  RELEASED(true),
  /**
   * The block could not be provisioned or released, or the provider reported it as lost.
   */
  FAILED(true);

  private final boolean terminal;

  BlockState(boolean terminal) {
    this.terminal = terminal;
  }

  /**
   * Returns whether no further transitions are possible out of this state. Blocks in terminal states do not count towards an executor's
   * capacity.
   *
   * @return Whether the state is terminal.
   */
  public boolean isTerminal() {
    return terminal;
  }

}
