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

import java.util.LinkedHashMap;
import java.util.Map;
import net.viktorc.pe4j.api.BlockRequest;
import net.viktorc.pe4j.api.BlockState;
import net.viktorc.pe4j.api.ExecutionProvider;
import net.viktorc.pe4j.api.ProvisioningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link ExecutionProvider} whose blocks live in the local JVM. Blocks are acquired instantly and identified by sequential job IDs. The
 * number of live blocks is capped at the maximum number of blocks; requests beyond it fail.
 *
 * @author Viktor Csomor
 */
public class LocalProvider implements ExecutionProvider {

  private static final String LABEL = "local";
  private static final Logger LOGGER = LoggerFactory.getLogger(LocalProvider.class);

  private final int initBlocks;
  private final int minBlocks;
  private final int maxBlocks;
  private final int workersPerBlock;
  private final Map<String, BlockState> jobs;

  private int jobIdCounter;

  /**
   * Constructs a provider according to the specified parameters.
   *
   * @param initBlocks The number of blocks executors should acquire on startup.
   * @param minBlocks The minimum number of blocks.
   * @param maxBlocks The maximum number of live blocks.
   * @param workersPerBlock The number of workers per block.
   * @throws IllegalArgumentException If the minimum number of blocks is less than 0, or the maximum number of blocks is less than 1 or the
   * minimum, or the initial number of blocks is not between the minimum and the maximum, or the number of workers per block is less than 1.
   */
  public LocalProvider(int initBlocks, int minBlocks, int maxBlocks, int workersPerBlock) {
    if (minBlocks < 0) {
      throw new IllegalArgumentException("The minimum number of blocks cannot be negative");
    }
    if (maxBlocks < 1 || maxBlocks < minBlocks) {
      throw new IllegalArgumentException("The maximum number of blocks has to be at least 1 and at least as great as the minimum");
    }
    if (initBlocks < minBlocks || initBlocks > maxBlocks) {
      throw new IllegalArgumentException("The initial number of blocks has to be between the minimum and the maximum");
    }
    if (workersPerBlock < 1) {
      throw new IllegalArgumentException("The number of workers per block must be at least 1");
    }
    this.initBlocks = initBlocks;
    this.minBlocks = minBlocks;
    this.maxBlocks = maxBlocks;
    this.workersPerBlock = workersPerBlock;
    jobs = new LinkedHashMap<>();
  }

  /**
   * Constructs a provider with no initial blocks and no minimum.
   *
   * @param maxBlocks The maximum number of live blocks.
   * @param workersPerBlock The number of workers per block.
   */
  public LocalProvider(int maxBlocks, int workersPerBlock) {
    this(0, 0, maxBlocks, workersPerBlock);
  }

  /**
   * Returns the number of blocks acquired but not yet released.
   *
   * @return The number of live blocks.
   */
  public synchronized int getLiveBlockCount() {
    return (int) jobs.values().stream()
        .filter(s -> !s.isTerminal())
        .count();
  }

  @Override
  public String getLabel() {
    return LABEL;
  }

  @Override
  public synchronized String submitBlock(BlockRequest request) throws ProvisioningException {
    if (getLiveBlockCount() >= maxBlocks) {
      throw new ProvisioningException(String.format("Provider %s cannot hold more than %d block(s)", LABEL, maxBlocks));
    }
    String jobId = LABEL + "-" + jobIdCounter++;
    jobs.put(jobId, BlockState.ACTIVE);
    LOGGER.debug("Block {} acquired as job {}", request, jobId);
    return jobId;
  }

  @Override
  public synchronized boolean cancelBlock(String jobId) throws ProvisioningException {
    BlockState state = jobs.get(jobId);
    if (state == null) {
      throw new ProvisioningException(String.format("Unknown job %s", jobId));
    }
    if (state.isTerminal()) {
      return false;
    }
    jobs.put(jobId, BlockState.RELEASED);
    LOGGER.debug("Job {} released", jobId);
    return true;
  }

  @Override
  public synchronized BlockState getBlockState(String jobId) {
    BlockState state = jobs.get(jobId);
    if (state == null) {
      throw new IllegalArgumentException(String.format("Unknown job %s", jobId));
    }
    return state;
  }

  @Override
  public int getInitBlocks() {
    return initBlocks;
  }

  @Override
  public int getMinBlocks() {
    return minBlocks;
  }

  @Override
  public int getMaxBlocks() {
    return maxBlocks;
  }

  @Override
  public int getWorkersPerBlock() {
    return workersPerBlock;
  }

}
