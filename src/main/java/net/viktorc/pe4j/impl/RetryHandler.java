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

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import net.viktorc.pe4j.api.ExecutorBadStateException;
import net.viktorc.pe4j.api.SubmissionFuture;
import net.viktorc.pe4j.api.TaskExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The runtime's retry handling. It submits a task to an executor, sets the retry counter of the returned {@link SubmissionFuture}, and
 * whenever the task fails, it decrements the counter and resubmits the task until the counter reaches zero or the executor reports a bad
 * state. It is the only writer of the counters of the futures it handles, and each counter is decremented at most once.
 *
 * @author Viktor Csomor
 */
public class RetryHandler {

  private static final int SETTLED = -1;
  private static final Logger LOGGER = LoggerFactory.getLogger(RetryHandler.class);

  /**
   * Submits the task to the executor and returns a future that completes with the outcome of the first successful attempt or the failure
   * of the last one. Cancelled attempts are not retried.
   *
   * @param executor The executor to run the task on.
   * @param task The task to execute.
   * @param retries The number of times the task may be resubmitted after a failure.
   * @param <T> The return type of the task.
   * @return A future representing the outcome of the task across all attempts.
   * @throws IllegalArgumentException If the executor or the task is null, or the number of retries is negative.
   */
  public <T> CompletableFuture<T> submit(TaskExecutor executor, Callable<T> task, int retries) {
    if (executor == null || task == null) {
      throw new IllegalArgumentException("The executor and the task cannot be null");
    }
    if (retries < 0) {
      throw new IllegalArgumentException("The number of retries cannot be negative");
    }
    CompletableFuture<T> outcome = new CompletableFuture<>();
    attempt(executor, task, retries, outcome);
    return outcome;
  }

  /**
   * Makes attempts at executing the task until one of them is still in progress on return or the outcome is settled. Attempts whose
   * futures are already done when submission returns are handled in place, so the call depth does not grow with the number of retries.
   *
   * @param executor The executor to run the task on.
   * @param task The task to execute.
   * @param retriesLeft The number of retries left after the first attempt.
   * @param outcome The future to complete once no more attempts are to be made.
   * @param <T> The return type of the task.
   */
  private <T> void attempt(TaskExecutor executor, Callable<T> task, int retriesLeft, CompletableFuture<T> outcome) {
    int left = retriesLeft;
    while (left != SETTLED) {
      SubmissionFuture<T> future;
      try {
        future = executor.submit(task);
      } catch (RuntimeException e) {
        LOGGER.debug(String.format("Submission of task %s to executor %s failed", task, executor.getLabel()), e);
        outcome.completeExceptionally(e);
        return;
      }
      future.setRetriesLeft(left);
      if (!future.isDone()) {
        future.whenDone((result, exception) -> {
          int next = settle(executor, task, future, result, exception, outcome);
          if (next != SETTLED) {
            attempt(executor, task, next, outcome);
          }
        });
        return;
      }
      T result = null;
      Throwable exception = null;
      try {
        result = future.get();
      } catch (ExecutionException e) {
        exception = e.getCause();
      } catch (CancellationException e) {
        exception = e;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        outcome.completeExceptionally(e);
        return;
      }
      left = settle(executor, task, future, result, exception, outcome);
    }
  }

  /**
   * Completes the outcome with the result of the finished attempt unless the task failed and may be retried.
   *
   * @param executor The executor the attempt ran on.
   * @param task The task executed.
   * @param future The future of the finished attempt.
   * @param result The result of the attempt.
   * @param exception The exception the attempt failed with or <code>null</code> if it succeeded.
   * @param outcome The future representing the outcome of the task across all attempts.
   * @param <T> The return type of the task.
   * @return The number of retries left for the next attempt or {@link #SETTLED} if the outcome has been completed.
   */
  private <T> int settle(TaskExecutor executor, Callable<T> task, SubmissionFuture<T> future, T result, Throwable exception,
      CompletableFuture<T> outcome) {
    if (exception == null) {
      outcome.complete(result);
    } else if (future.isCancelled()) {
      outcome.cancel(false);
    } else if (exception instanceof ExecutorBadStateException) {
      LOGGER.trace("Task {} failed on executor {} in bad state; not retrying", task, executor.getLabel());
      outcome.completeExceptionally(exception);
    } else if (future.getRetriesLeft().orElse(0) > 0) {
      int left = future.decrementRetriesLeft();
      LOGGER.trace("Task {} failed on executor {}; retrying with {} retries left", task, executor.getLabel(), left);
      return left;
    } else {
      LOGGER.trace("Task {} failed on executor {}; no retries left", task, executor.getLabel());
      outcome.completeExceptionally(exception);
    }
    return SETTLED;
  }

}
