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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import net.viktorc.pe4j.api.BlockRequest;
import net.viktorc.pe4j.api.BlockState;
import net.viktorc.pe4j.api.ExecutionProvider;
import net.viktorc.pe4j.api.ExecutorBadStateException;
import net.viktorc.pe4j.api.ExecutorConfig;
import net.viktorc.pe4j.api.FailedStartupException;
import net.viktorc.pe4j.api.ProvisioningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An elastic executor that acquires its capacity in blocks from an {@link ExecutionProvider}. Every active block contributes
 * {@link ExecutionProvider#getWorkersPerBlock()} worker threads which take tasks off a shared FIFO submission queue. On startup, the
 * executor acquires {@link ExecutionProvider#getInitBlocks()} blocks and blocks until they are all active.
 * <p>
 * Scaling requests are executed one at a time on a dedicated background thread, in the order they were issued. Blocks requested by
 * {@link #scaleOut(int)} are registered as <code>PENDING</code> immediately and become <code>ACTIVE</code> or <code>FAILED</code>
 * depending on the provider's response. {@link #scaleIn(int)} retires the most recently acquired active blocks by draining them: the
 * workers of a retiring block finish the tasks they are executing but do not take new ones, and tasks still in the queue are left for
 * the remaining blocks. The block is given back to the provider once all its workers have stopped.
 * <p>
 * If the provider fails to deliver {@link ExecutorConfig#getMaxConsecutiveBlockFailures()} blocks in a row while the executor has no
 * active blocks, the executor enters a bad state: the tasks in its queue fail with an {@link ExecutorBadStateException} and so do all
 * tasks submitted afterwards. On shutdown, queued tasks are cancelled, running tasks are allowed to complete, and all blocks are released.
 *
 * @author Viktor Csomor
 */
public class BlockProviderExecutor extends AbstractTaskExecutor {

  private static final long WORKER_POLL_INTERVAL = 100L;
  private static final Logger LOGGER = LoggerFactory.getLogger(BlockProviderExecutor.class);

  private final ExecutionProvider provider;
  private final int workersPerBlock;
  private final Map<String, Block> blocks;
  private final BlockingDeque<InternalTask<?>> submissionQueue;
  private final Object mainLock;

  private ThreadPoolExecutor workerThreadPool;
  private ThreadPoolExecutor scalingThreadPool;
  private int blockIdCounter;
  private int consecutiveBlockFailures;
  private boolean shutdown;

  private volatile ExecutorBadStateException executorException;

  /**
   * Constructs an executor according to the specified parameters.
   *
   * @param config The configuration of the executor.
   * @param provider The provider to acquire blocks from.
   * @throws IllegalArgumentException If the configuration is invalid, or the provider is null or provides less than one worker per block.
   */
  public BlockProviderExecutor(ExecutorConfig config, ExecutionProvider provider) {
    super(config, provider, true);
    if (provider.getWorkersPerBlock() < 1) {
      throw new IllegalArgumentException("The number of workers per block must be at least 1");
    }
    this.provider = provider;
    workersPerBlock = provider.getWorkersPerBlock();
    blocks = new LinkedHashMap<>();
    submissionQueue = new LinkedBlockingDeque<>();
    mainLock = new Object();
  }

  /**
   * Returns the number of blocks whose workers are accepting tasks.
   *
   * @return The number of active blocks.
   */
  public int getActiveBlockCount() {
    synchronized (mainLock) {
      return (int) blocks.values().stream()
          .filter(b -> b.state == BlockState.ACTIVE)
          .count();
    }
  }

  /**
   * Returns the number of tasks waiting in the submission queue.
   *
   * @return The number of queued tasks.
   */
  public int getQueuedTaskCount() {
    return submissionQueue.size();
  }

  /**
   * Returns whether the executor has given up on acquiring capacity.
   *
   * @return Whether the executor is in a bad state.
   */
  public boolean isBadStateSet() {
    return executorException != null;
  }

  /**
   * Returns the exception the executor fails tasks with if it is in a bad state.
   *
   * @return The exception describing the bad state or an empty optional if the executor is not in a bad state.
   */
  public Optional<ExecutorBadStateException> getExecutorException() {
    return Optional.ofNullable(executorException);
  }

  /**
   * Queries the provider for the states of the active blocks and retires the ones the provider reports as lost. Lost blocks count as
   * block failures, and their jobs are cancelled at the provider on a best-effort basis.
   *
   * @return The states of the blocks after the update.
   */
  public Map<String, BlockState> pollProviderStatus() {
    List<Block> activeBlocks;
    synchronized (mainLock) {
      activeBlocks = new ArrayList<>();
      for (Block block : blocks.values()) {
        if (block.state == BlockState.ACTIVE) {
          activeBlocks.add(block);
        }
      }
    }
    for (Block block : activeBlocks) {
      BlockState providerState;
      try {
        providerState = provider.getBlockState(block.jobId);
      } catch (IllegalArgumentException e) {
        LOGGER.warn(String.format("Provider %s does not know of block %s", provider.getLabel(), block), e);
        providerState = BlockState.FAILED;
      }
      if (!providerState.isTerminal()) {
        continue;
      }
      List<InternalTask<?>> failedTasks;
      synchronized (mainLock) {
        if (block.state != BlockState.ACTIVE) {
          continue;
        }
        block.state = BlockState.FAILED;
        LOGGER.warn("Block {} lost; provider reports {}", block, providerState);
        consecutiveBlockFailures++;
        failedTasks = checkForBadState(new ProvisioningException(String.format("Block %s lost", block)));
      }
      failTasks(failedTasks);
      cancelLostBlock(block);
    }
    return getStatus();
  }

  /**
   * Returns the number of blocks, the number of active blocks, and the number of queued and outstanding tasks as a string.
   *
   * @return A string of statistics concerning the capacity and the load of the executor.
   */
  private String getExecutorStats() {
    return "Blocks: " + getBlockCount() + " (active: " + getActiveBlockCount() + "); queued tasks: " + submissionQueue.size() +
        "; outstanding tasks: " + getOutstanding();
  }

  /**
   * Registers the specified number of new blocks in the <code>PENDING</code> state. It must be called while holding the main lock.
   *
   * @param numOfBlocks The number of blocks to register.
   * @return The new blocks.
   */
  private List<Block> addPendingBlocks(int numOfBlocks) {
    List<Block> newBlocks = new ArrayList<>(numOfBlocks);
    for (int i = 0; i < numOfBlocks; i++) {
      Block block = new Block(Integer.toString(blockIdCounter++), workersPerBlock);
      blocks.put(block.id, block);
      newBlocks.add(block);
    }
    return newBlocks;
  }

  /**
   * Creates the request describing the specified block to the provider.
   *
   * @param block The block to describe.
   * @return The block request.
   */
  private BlockRequest newBlockRequest(Block block) {
    if (isMonitoringEnabled()) {
      LOGGER.trace("Wiring block {} to monitoring hub {}:{}", block, getHubAddress().orElse(null), getHubPort().orElse(null));
    }
    return new BlockRequest(getLabel(), block.id, workersPerBlock, getRunDir().orElse(null), getWorkingDir().orElse(null),
        getHubAddress().orElse(null), getHubPort().orElse(null));
  }

  /**
   * Acquires the specified pending block from the provider and starts its workers.
   *
   * @param block The block to acquire.
   * @return Whether the block became active. It is <code>false</code> if the executor was shut down in the meanwhile.
   * @throws ProvisioningException If the provider fails to deliver the block.
   */
  private boolean provisionBlock(Block block) throws ProvisioningException {
    BlockRequest request;
    synchronized (mainLock) {
      if (shutdown || block.state != BlockState.PENDING) {
        return false;
      }
      block.state = BlockState.PROVISIONING;
      request = newBlockRequest(block);
    }
    LOGGER.debug("Requesting block {} from provider {}", block, provider.getLabel());
    String jobId;
    try {
      jobId = provider.submitBlock(request);
    } catch (ProvisioningException | RuntimeException e) {
      List<InternalTask<?>> failedTasks;
      synchronized (mainLock) {
        block.state = BlockState.FAILED;
        consecutiveBlockFailures++;
        failedTasks = checkForBadState(e);
      }
      failTasks(failedTasks);
      if (e instanceof ProvisioningException) {
        throw (ProvisioningException) e;
      }
      throw new ProvisioningException(e);
    }
    synchronized (mainLock) {
      block.jobId = jobId;
      // Blocks acquired after the shutdown are released by the shutdown.
      if (shutdown) {
        return false;
      }
      consecutiveBlockFailures = 0;
      block.state = BlockState.ACTIVE;
      startWorkers(block);
      LOGGER.debug("Block {} active as job {}", block, jobId);
      LOGGER.debug(getExecutorStats());
      return true;
    }
  }

  /**
   * Gives the specified block back to the provider.
   *
   * @param block The block to release.
   * @return Whether the block was released successfully.
   */
  private boolean releaseBlock(Block block) {
    if (block.jobId == null) {
      synchronized (mainLock) {
        block.state = BlockState.RELEASED;
      }
      return true;
    }
    try {
      if (!provider.cancelBlock(block.jobId)) {
        LOGGER.debug("Block {} was no longer live at provider {}", block, provider.getLabel());
      }
      synchronized (mainLock) {
        block.state = BlockState.RELEASED;
      }
      LOGGER.debug("Block {} released", block);
      return true;
    } catch (ProvisioningException | RuntimeException e) {
      LOGGER.warn(String.format("Failed to release block %s", block), e);
      synchronized (mainLock) {
        block.state = BlockState.FAILED;
      }
      return false;
    }
  }

  /**
   * Starts the workers of a block that has just become active. It must be called while holding the main lock.
   *
   * @param block The block whose workers are to be started.
   */
  private void startWorkers(Block block) {
    for (int i = 0; i < workersPerBlock; i++) {
      try {
        workerThreadPool.execute(new Worker(block));
      } catch (RejectedExecutionException e) {
        LOGGER.warn(String.format("Could not start worker of block %s", block), e);
        block.workersExited.countDown();
      }
    }
  }

  /**
   * Puts the executor into the bad state if the provider failed to deliver too many blocks in a row and there are no active blocks left. It
   * must be called while holding the main lock. The queued tasks are taken off the queue, but they are to be failed by the caller after
   * releasing the lock.
   *
   * @param cause The last provisioning failure.
   * @return The tasks to fail with {@link #failTasks(List)}.
   */
  private List<InternalTask<?>> checkForBadState(Throwable cause) {
    List<InternalTask<?>> queuedTasks = new ArrayList<>();
    if (executorException != null || consecutiveBlockFailures < config.getMaxConsecutiveBlockFailures()) {
      return queuedTasks;
    }
    for (Block block : blocks.values()) {
      if (block.state == BlockState.ACTIVE) {
        return queuedTasks;
      }
    }
    executorException = new ExecutorBadStateException(String.format("Executor %s failed to acquire %d block(s) in a row", getLabel(),
        consecutiveBlockFailures), cause);
    LOGGER.error(executorException.getMessage(), cause);
    submissionQueue.drainTo(queuedTasks);
    return queuedTasks;
  }

  /**
   * Fails the specified tasks with the exception describing the bad state. It must not be called while holding the main lock.
   *
   * @param tasks The tasks to fail.
   */
  private void failTasks(List<InternalTask<?>> tasks) {
    if (tasks.isEmpty()) {
      return;
    }
    for (InternalTask<?> task : tasks) {
      task.fail(executorException);
    }
    LOGGER.debug("Failed {} queued task(s) of executor {}", tasks.size(), getLabel());
  }

  /**
   * Asks the provider to cancel the job of a block it reported as lost in case it is still holding on to it. The block remains
   * <code>FAILED</code> either way.
   *
   * @param block The lost block.
   */
  private void cancelLostBlock(Block block) {
    try {
      if (provider.cancelBlock(block.jobId)) {
        LOGGER.debug("Job {} of lost block {} cancelled", block.jobId, block);
      }
    } catch (ProvisioningException | RuntimeException e) {
      LOGGER.warn(String.format("Failed to cancel job %s of lost block %s", block.jobId, block), e);
    }
  }

  /**
   * Acquires the specified blocks one by one.
   *
   * @param newBlocks The pending blocks to acquire.
   * @return The number of blocks that became active.
   */
  private int provisionBlocks(List<Block> newBlocks) {
    int provisioned = 0;
    for (Block block : newBlocks) {
      if (Thread.currentThread().isInterrupted()) {
        LOGGER.debug("Scale-out of executor {} interrupted", getLabel());
        break;
      }
      try {
        if (provisionBlock(block)) {
          provisioned++;
        }
      } catch (ProvisioningException e) {
        LOGGER.warn(String.format("Failed to acquire block %s", block), e);
      }
    }
    return provisioned;
  }

  /**
   * Drains and releases up to the specified number of the most recently acquired active blocks.
   *
   * @param numOfBlocks The number of blocks to retire.
   * @return The number of blocks released.
   */
  private int retireBlocks(int numOfBlocks) {
    List<Block> retiringBlocks = new ArrayList<>();
    synchronized (mainLock) {
      if (shutdown) {
        return 0;
      }
      List<Block> activeBlocks = new ArrayList<>();
      for (Block block : blocks.values()) {
        if (block.state == BlockState.ACTIVE) {
          activeBlocks.add(block);
        }
      }
      if (numOfBlocks > activeBlocks.size()) {
        LOGGER.debug("Clamping scale-in request of {} block(s) to the {} active block(s) of executor {}", numOfBlocks,
            activeBlocks.size(), getLabel());
      }
      for (int i = activeBlocks.size() - 1; i >= 0 && retiringBlocks.size() < numOfBlocks; i--) {
        Block block = activeBlocks.get(i);
        block.state = BlockState.DRAINING;
        retiringBlocks.add(block);
      }
    }
    int released = 0;
    for (Block block : retiringBlocks) {
      try {
        LOGGER.debug("Waiting for the workers of block {} to finish...", block);
        block.workersExited.await();
      } catch (InterruptedException e) {
        LOGGER.debug("Scale-in of executor {} interrupted", getLabel());
        Thread.currentThread().interrupt();
        break;
      }
      if (releaseBlock(block)) {
        released++;
      }
    }
    LOGGER.debug(getExecutorStats());
    return released;
  }

  @Override
  protected void doStart() throws FailedStartupException {
    long keepAliveTime = config.getThreadKeepAliveTime();
    workerThreadPool = new ThreadPoolExecutor(0, Integer.MAX_VALUE, keepAliveTime, TimeUnit.MILLISECONDS, new SynchronousQueue<>(),
        new CustomizedThreadFactory(getLabel() + "-workerThreadPool"));
    scalingThreadPool = new ThreadPoolExecutor(1, 1, keepAliveTime, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
        new CustomizedThreadFactory(getLabel() + "-scalingThreadPool"));
    List<Block> initBlocks;
    synchronized (mainLock) {
      initBlocks = addPendingBlocks(provider.getInitBlocks());
    }
    LOGGER.debug("Acquiring {} initial block(s) for executor {}...", initBlocks.size(), getLabel());
    for (Block block : initBlocks) {
      try {
        provisionBlock(block);
      } catch (ProvisioningException e) {
        throw new FailedStartupException(String.format("Failed to acquire initial block %s", block), e);
      }
    }
  }

  @Override
  protected <T> Future<?> doSubmit(Callable<T> task, CompletableFuture<T> completion) {
    ExecutorBadStateException exception;
    synchronized (mainLock) {
      if (shutdown) {
        throw new RejectedExecutionException(String.format("Executor %s has already been shut down", getLabel()));
      }
      exception = executorException;
      if (exception == null) {
        submissionQueue.addLast(new InternalTask<>(task, completion));
      }
    }
    if (exception != null) {
      completion.completeExceptionally(exception);
    } else {
      LOGGER.trace(getExecutorStats());
    }
    return null;
  }

  @Override
  protected Future<Integer> doScaleOut(int numOfBlocks) {
    List<Block> newBlocks;
    synchronized (mainLock) {
      if (shutdown) {
        LOGGER.debug("Ignoring scale-out request of executor {} as it is shutting down", getLabel());
        return CompletableFuture.completedFuture(0);
      }
      newBlocks = addPendingBlocks(numOfBlocks);
    }
    try {
      return scalingThreadPool.submit(() -> provisionBlocks(newBlocks));
    } catch (RejectedExecutionException e) {
      // The shutdown releases the pending blocks.
      LOGGER.debug("Scale-out request of executor {} rejected as it is shutting down", getLabel());
      return CompletableFuture.completedFuture(0);
    }
  }

  @Override
  protected Future<Integer> doScaleIn(int numOfBlocks) {
    synchronized (mainLock) {
      if (shutdown) {
        LOGGER.debug("Ignoring scale-in request of executor {} as it is shutting down", getLabel());
        return CompletableFuture.completedFuture(0);
      }
    }
    try {
      return scalingThreadPool.submit(() -> retireBlocks(numOfBlocks));
    } catch (RejectedExecutionException e) {
      LOGGER.debug("Scale-in request of executor {} rejected as it is shutting down", getLabel());
      return CompletableFuture.completedFuture(0);
    }
  }

  @Override
  protected boolean doShutdown() {
    boolean success = true;
    synchronized (mainLock) {
      shutdown = true;
    }
    try {
      if (scalingThreadPool != null) {
        LOGGER.debug("Interrupting scaling operations of executor {}...", getLabel());
        scalingThreadPool.shutdownNow();
        scalingThreadPool.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
      }
      List<InternalTask<?>> queuedTasks = new ArrayList<>();
      synchronized (mainLock) {
        submissionQueue.drainTo(queuedTasks);
        for (Block block : blocks.values()) {
          if (block.state == BlockState.ACTIVE) {
            block.state = BlockState.DRAINING;
          }
        }
      }
      for (InternalTask<?> task : queuedTasks) {
        task.cancel();
      }
      LOGGER.debug("Cancelled {} queued task(s); waiting for running tasks to complete...", queuedTasks.size());
      if (workerThreadPool != null) {
        workerThreadPool.shutdown();
        workerThreadPool.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
      }
    } catch (InterruptedException e) {
      LOGGER.warn(e.getMessage(), e);
      if (workerThreadPool != null) {
        workerThreadPool.shutdownNow();
      }
      Thread.currentThread().interrupt();
      success = false;
    }
    List<Block> liveBlocks = new ArrayList<>();
    synchronized (mainLock) {
      for (Block block : blocks.values()) {
        if (!block.state.isTerminal()) {
          liveBlocks.add(block);
        }
      }
    }
    LOGGER.debug("Releasing {} block(s) of executor {}...", liveBlocks.size(), getLabel());
    for (Block block : liveBlocks) {
      success &= releaseBlock(block);
    }
    return success;
  }

  @Override
  public Map<String, BlockState> getStatus() {
    synchronized (mainLock) {
      Map<String, BlockState> status = new LinkedHashMap<>();
      for (Block block : blocks.values()) {
        status.put(block.id, block.state);
      }
      return Collections.unmodifiableMap(status);
    }
  }

  @Override
  public int getBlockCount() {
    synchronized (mainLock) {
      return (int) blocks.values().stream()
          .filter(b -> !b.state.isTerminal())
          .count();
    }
  }

  @Override
  public String toString() {
    return String.format("blockProviderExecutor-%s@%s", getLabel(), Integer.toHexString(hashCode()));
  }

  /**
   * A block of capacity as tracked by the executor. Its state is only modified while holding the main lock.
   *
   * @author Viktor Csomor
   */
  private class Block {

    private final String id;
    private final CountDownLatch workersExited;

    private volatile BlockState state;
    private volatile String jobId;

    /**
     * Constructs a pending block.
     *
     * @param id The executor-side ID of the block.
     * @param numOfWorkers The number of workers the block runs once it is active.
     */
    Block(String id, int numOfWorkers) {
      this.id = id;
      workersExited = new CountDownLatch(numOfWorkers);
      state = BlockState.PENDING;
    }

    @Override
    public String toString() {
      return String.format("%s/block-%s", getLabel(), id);
    }

  }

  /**
   * A task waiting in the submission queue along with the future to complete once it is executed.
   *
   * @param <T> The return type of the task.
   * @author Viktor Csomor
   */
  private static class InternalTask<T> {

    private final Callable<T> task;
    private final CompletableFuture<T> completion;

    /**
     * Constructs an instance according to the specified parameters.
     *
     * @param task The task to execute.
     * @param completion The future to complete with the outcome of the task.
     */
    InternalTask(Callable<T> task, CompletableFuture<T> completion) {
      this.task = task;
      this.completion = completion;
    }

    /**
     * Executes the task unless it has been cancelled.
     */
    void execute() {
      executeAndComplete(task, completion);
    }

    /**
     * Fails the task with the specified exception without executing it.
     *
     * @param e The cause of the failure.
     */
    void fail(Throwable e) {
      completion.completeExceptionally(e);
    }

    /**
     * Cancels the task without executing it.
     */
    void cancel() {
      completion.cancel(false);
    }

    @Override
    public String toString() {
      return String.format("%s@%s", task, Integer.toHexString(hashCode()));
    }

  }

  /**
   * A worker of a block that keeps taking tasks off the submission queue and executing them as long as its block is active.
   *
   * @author Viktor Csomor
   */
  private class Worker implements Runnable {

    private final Block block;

    /**
     * Constructs a worker for the specified block.
     *
     * @param block The block the worker belongs to.
     */
    Worker(Block block) {
      this.block = block;
    }

    /**
     * Puts a task taken off the queue by a worker whose block stopped being active in the meanwhile back to the front of the queue.
     *
     * @param task The task to return to the queue.
     */
    private void requeue(InternalTask<?> task) {
      boolean cancel;
      ExecutorBadStateException exception;
      synchronized (mainLock) {
        cancel = shutdown;
        exception = executorException;
        if (!cancel && exception == null) {
          submissionQueue.addFirst(task);
          LOGGER.trace("Task {} put back in queue", task);
          return;
        }
      }
      if (cancel) {
        task.cancel();
      } else {
        task.fail(exception);
      }
    }

    @Override
    public void run() {
      LOGGER.trace("Worker of block {} started", block);
      try {
        while (block.state == BlockState.ACTIVE) {
          InternalTask<?> task;
          try {
            task = submissionQueue.pollFirst(WORKER_POLL_INTERVAL, TimeUnit.MILLISECONDS);
          } catch (InterruptedException e) {
            LOGGER.trace("Worker of block {} interrupted while waiting", block);
            Thread.currentThread().interrupt();
            return;
          }
          if (task == null) {
            continue;
          }
          if (block.state != BlockState.ACTIVE) {
            requeue(task);
            return;
          }
          LOGGER.trace("Task {} taken off queue by block {}", task, block);
          task.execute();
        }
      } finally {
        block.workersExited.countDown();
        LOGGER.trace("Worker of block {} stopped", block);
      }
    }

  }

}
