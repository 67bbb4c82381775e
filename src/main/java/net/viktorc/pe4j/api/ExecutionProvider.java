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
 * An interface for collaborators capable of acquiring and releasing blocks of compute capacity on physical or virtual infrastructure. An
 * executor holds a shared reference to its provider; the provider outlives the executor and is never closed by it. Calls issued by a
 * single executor may be serialized or queued at the provider's discretion but must not corrupt the provider's state.
 *
 * @author Viktor Csomor
 */
public interface ExecutionProvider {

  /**
   * Returns a human readable name of the provider.
   *
   * @return The label of the provider.
   */
  String getLabel();

  /**
   * Requests a single block of capacity. It may block for the time it takes the infrastructure to accept the request but not for the
   * lifetime of the block.
   *
   * @param request The description of the block to acquire.
   * @return The provider-side job ID of the block.
   * @throws ProvisioningException If the block cannot be acquired.
   */
  String submitBlock(BlockRequest request) throws ProvisioningException;

  /**
   * Releases the block with the specified job ID.
   *
   * @param jobId The provider-side job ID of the block.
   * @return Whether the block was live and has been released.
   * @throws ProvisioningException If the infrastructure fails to release the block.
   */
  boolean cancelBlock(String jobId) throws ProvisioningException;

  /**
   * Returns the state of the block with the specified job ID as seen by the provider.
   *
   * @param jobId The provider-side job ID of the block.
   * @return The state of the block.
   * @throws IllegalArgumentException If the provider does not know of a block with the specified ID.
   */
  BlockState getBlockState(String jobId);

  /**
   * Returns the number of blocks an executor should acquire on startup.
   *
   * @return The initial number of blocks.
   */
  default int getInitBlocks() {
    return 0;
  }

  /**
   * Returns the number of blocks a strategy should never scale below.
   *
   * @return The minimum number of blocks.
   */
  default int getMinBlocks() {
    return 0;
  }

  /**
   * Returns the number of blocks a strategy should never scale above.
   *
   * @return The maximum number of blocks.
   */
  default int getMaxBlocks() {
    return Integer.MAX_VALUE;
  }

  /**
   * Returns the number of workers, i.e. concurrently executable tasks, a single block provides.
   *
   * @return The number of workers per block.
   */
  default int getWorkersPerBlock() {
    return 1;
  }

}
