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

import java.util.OptionalInt;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * The handle returned by {@link TaskExecutor#submit(java.util.concurrent.Callable)}. It wraps the completion of the task and, if the
 * backend has one, the future it natively returned, and it carries a retry counter. The counter belongs to the runtime's retry handling:
 * executors never read or write it. It is unset until the retry handler sets it and all updates to it are atomic.
 *
 * @param <T> The return type of the task.
 * @author Viktor Csomor
 */
public class SubmissionFuture<T> implements Future<T> {

  private static final int UNSET = -1;

  private final CompletableFuture<T> completion;
  private final Future<?> nativeFuture;
  private final AtomicInteger retriesLeft;

  /**
   * Constructs a submission future for the specified completion and native future. Cancelling the submission future cancels both.
   *
   * @param completion The future completed by the executor once the task is done.
   * @param nativeFuture The future the backend returned for the task or <code>null</code> if it did not return one.
   * @throws IllegalArgumentException If the completion future is null.
   */
  public SubmissionFuture(CompletableFuture<T> completion, Future<?> nativeFuture) {
    if (completion == null) {
      throw new IllegalArgumentException("The completion future cannot be null");
    }
    this.completion = completion;
    this.nativeFuture = nativeFuture;
    retriesLeft = new AtomicInteger(UNSET);
  }

  /**
   * Constructs a submission future for the specified completion.
   *
   * @param completion The future completed by the executor once the task is done.
   */
  public SubmissionFuture(CompletableFuture<T> completion) {
    this(completion, null);
  }

  /**
   * Returns a submission future that has already failed with the specified exception.
   *
   * @param e The cause of the failure.
   * @param <T> The return type of the task.
   * @return A failed submission future.
   */
  public static <T> SubmissionFuture<T> failed(Throwable e) {
    CompletableFuture<T> completion = new CompletableFuture<>();
    completion.completeExceptionally(e);
    return new SubmissionFuture<>(completion);
  }

  /**
   * Returns the number of retries left for the task if it has been set.
   *
   * @return The number of retries left or an empty optional if the counter has not been set.
   */
  public OptionalInt getRetriesLeft() {
    int retries = retriesLeft.get();
    return retries == UNSET ? OptionalInt.empty() : OptionalInt.of(retries);
  }

  /**
   * Sets the number of retries left for the task.
   *
   * @param retries The number of retries left.
   * @throws IllegalArgumentException If the number of retries is negative.
   */
  public void setRetriesLeft(int retries) {
    if (retries < 0) {
      throw new IllegalArgumentException("The number of retries left cannot be negative");
    }
    retriesLeft.set(retries);
  }

  /**
   * Atomically decrements the number of retries left unless it is already zero.
   *
   * @return The number of retries left after the decrement.
   * @throws IllegalStateException If the counter has not been set.
   */
  public int decrementRetriesLeft() {
    int retries = retriesLeft.getAndUpdate(r -> r > 0 ? r - 1 : r);
    if (retries == UNSET) {
      throw new IllegalStateException("The number of retries left has not been set");
    }
    return Math.max(0, retries - 1);
  }

  /**
   * Registers an action to be executed once the task completes, whether normally, exceptionally, or by cancellation. If the task is already
   * done, the action is executed immediately in the calling thread.
   *
   * @param action The action to execute with the result or the exception of the task.
   */
  public void whenDone(BiConsumer<? super T, ? super Throwable> action) {
    completion.whenComplete(action);
  }

  /**
   * Returns whether the task completed with an exception other than its cancellation.
   *
   * @return Whether the task failed.
   */
  public boolean isFailed() {
    return completion.isCompletedExceptionally() && !completion.isCancelled();
  }

  @Override
  public boolean cancel(boolean mayInterruptIfRunning) {
    boolean cancelled = completion.cancel(mayInterruptIfRunning);
    if (cancelled && nativeFuture != null) {
      nativeFuture.cancel(mayInterruptIfRunning);
    }
    return cancelled;
  }

  @Override
  public boolean isCancelled() {
    return completion.isCancelled();
  }

  @Override
  public boolean isDone() {
    return completion.isDone();
  }

  @Override
  public T get() throws InterruptedException, ExecutionException, CancellationException {
    return completion.get();
  }

  @Override
  public T get(long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException, CancellationException {
    return completion.get(timeout, unit);
  }

  @Override
  public String toString() {
    return String.format("submissionFuture@%s", Integer.toHexString(hashCode()));
  }

}
