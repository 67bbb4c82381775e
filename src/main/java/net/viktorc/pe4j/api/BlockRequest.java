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

import java.util.Optional;

/**
 * An immutable description of a block passed to an {@link ExecutionProvider} when requesting capacity. Besides identifying the block, it
 * carries everything the workers launched on it need to know about the run they belong to, including the monitoring endpoint if the
 * executor has been wired to one.
 *
 * @author Viktor Csomor
 */
public class BlockRequest {

  private final String executorLabel;
  private final String blockId;
  private final int workersPerBlock;
  private final String runDir;
  private final String workingDir;
  private final String hubAddress;
  private final Integer hubPort;

  /**
   * Constructs an instance according to the specified parameters.
   *
   * @param executorLabel The label of the requesting executor.
   * @param blockId The executor-side ID of the block.
   * @param workersPerBlock The number of workers to launch on the block.
   * @param runDir The run directory or <code>null</code> if none has been set.
   * @param workingDir The working directory of the executor or <code>null</code>.
   * @param hubAddress The address of the monitoring hub or <code>null</code>.
   * @param hubPort The port of the monitoring hub or <code>null</code>.
   * @throws IllegalArgumentException If the label or the block ID is null, or the number of workers is less than 1.
   */
  public BlockRequest(String executorLabel, String blockId, int workersPerBlock, String runDir, String workingDir, String hubAddress,
      Integer hubPort) {
    if (executorLabel == null || blockId == null) {
      throw new IllegalArgumentException("The executor label and the block ID cannot be null");
    }
    if (workersPerBlock < 1) {
      throw new IllegalArgumentException("The number of workers per block must be at least 1");
    }
    this.executorLabel = executorLabel;
    this.blockId = blockId;
    this.workersPerBlock = workersPerBlock;
    this.runDir = runDir;
    this.workingDir = workingDir;
    this.hubAddress = hubAddress;
    this.hubPort = hubPort;
  }

  public String getExecutorLabel() {
    return executorLabel;
  }

  public String getBlockId() {
    return blockId;
  }

  public int getWorkersPerBlock() {
    return workersPerBlock;
  }

  public Optional<String> getRunDir() {
    return Optional.ofNullable(runDir);
  }

  public Optional<String> getWorkingDir() {
    return Optional.ofNullable(workingDir);
  }

  public Optional<String> getHubAddress() {
    return Optional.ofNullable(hubAddress);
  }

  public Optional<Integer> getHubPort() {
    return Optional.ofNullable(hubPort);
  }

  @Override
  public String toString() {
    return String.format("%s/block-%s", executorLabel, blockId);
  }

}
