package core.contracts;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Thin façade over a work-stealing pool used to score candidate moves in parallel.
 */
public interface TaskPool extends AutoCloseable {

    /** Submit a unit of work and get a {@link Future} for its result. */
    <T> Future<T> submit(Callable<T> task);

    /** Hint a new parallelism level (may be ignored by the pool). */
    default void setParallelism(int threads) {}

    /** Current number of workers. */
    int parallelism();

    /** Cancel all queued/running tasks immediately. */
    void shutdownNow();

    /** Identical to {@link #shutdownNow()}. */
    @Override default void close() { shutdownNow(); }
}
