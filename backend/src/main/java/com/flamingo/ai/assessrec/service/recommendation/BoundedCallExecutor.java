package com.flamingo.ai.assessrec.service.recommendation;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs blocking calls to external models with a hard wall-clock bound. A call that overruns is
 * cancelled with interruption so the worker thread is released.
 *
 * <p>Embedding and reranking calls run on separate pools, so slow reranks never hold up the query
 * embedding of another request.
 */
@Component
@Slf4j
public class BoundedCallExecutor {

  /** Pool a call runs on. */
  public enum Lane {
    EMBEDDING,
    RERANK
  }

  private final AsyncTaskExecutor embeddingExecutor;
  private final AsyncTaskExecutor rerankExecutor;

  @Autowired
  public BoundedCallExecutor(
      @Qualifier("embeddingExecutor") AsyncTaskExecutor embeddingExecutor,
      @Qualifier("rerankExecutor") AsyncTaskExecutor rerankExecutor) {
    this.embeddingExecutor = embeddingExecutor;
    this.rerankExecutor = rerankExecutor;
  }

  /** Runs both lanes on one pool. */
  public BoundedCallExecutor(AsyncTaskExecutor executor) {
    this(executor, executor);
  }

  /**
   * Executes {@code task} on the lane's pool and waits at most {@code timeoutMs}.
   *
   * @param lane pool to run on
   * @param operation name used in logs and failure messages
   * @param timeoutMs wall-clock bound in milliseconds
   * @param task the blocking call
   * @param failure maps the failure cause (timeout, task exception, rejection) to the exception the
   *     caller expects
   * @return the task result
   */
  public <T> T call(
      Lane lane,
      String operation,
      long timeoutMs,
      Callable<T> task,
      Function<Throwable, ? extends RuntimeException> failure) {
    Future<T> future;
    try {
      future = executorFor(lane).submit(task);
    } catch (RejectedExecutionException e) {
      log.warn("{} rejected, {} pool is saturated", operation, lane);
      throw failure.apply(e);
    }

    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("{} timed out after {}ms", operation, timeoutMs);
      throw failure.apply(e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw failure.apply(cause);
    } catch (CancellationException e) {
      throw failure.apply(e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw failure.apply(e);
    }
  }

  private AsyncTaskExecutor executorFor(Lane lane) {
    return lane == Lane.RERANK ? rerankExecutor : embeddingExecutor;
  }
}
