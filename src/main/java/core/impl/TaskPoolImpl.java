package core.impl;

import core.contracts.TaskPool;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link TaskPool} that scores NPC candidate moves on a {@link ForkJoinPool}.
 * <p>
 * Workers are daemon threads named {@code dablo-scorer-N}, so an abandoned pool never keeps
 * the JVM alive. Changing the thread count publishes a new pool; moves already handed to the
 * old one are still scored before it winds down.
 * </p>
 * <pre>
 * try (TaskPool pool = new TaskPoolImpl(4)) {
 *     DecisionEngine npc = new DecisionEngineImpl(gen, eval, rng, pool);
 *     Move m = npc.selectMove(state, profile);
 * }
 * </pre>
 */
public final class TaskPoolImpl implements TaskPool {

    private static final AtomicInteger WORKER_IDS = new AtomicInteger();

    private final Object swapLock = new Object();

    /* null after shutdownNow() */
    private volatile ForkJoinPool workers;

    /**
     * @param parallelism number of scoring threads, at least 1
     */
    public TaskPoolImpl(int parallelism) {
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        this.workers = spawn(parallelism);
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        ForkJoinPool p = workers;
        if (p == null) throw new IllegalStateException("scoring pool is shut down");
        return p.submit(task);
    }

    /** Values below 1 are ignored, as is any call after {@link #shutdownNow()}. */
    @Override
    public void setParallelism(int threads) {
        if (threads < 1) return;
        ForkJoinPool retired;
        synchronized (swapLock) {
            if (workers == null || workers.getParallelism() == threads) return;
            retired = swap(spawn(threads));
        }
        retired.shutdown();
    }

    @Override
    public int parallelism() {
        ForkJoinPool p = workers;
        return p == null ? 0 : p.getParallelism();
    }

    @Override
    public void shutdownNow() {
        ForkJoinPool retired;
        synchronized (swapLock) {
            retired = swap(null);
        }
        if (retired != null) retired.shutdownNow();
    }

    private ForkJoinPool swap(ForkJoinPool next) {
        ForkJoinPool previous = workers;
        workers = next;
        return previous;
    }

    private static ForkJoinPool spawn(int parallelism) {
        return new ForkJoinPool(parallelism, TaskPoolImpl::newWorker, null, false);
    }

    private static ForkJoinWorkerThread newWorker(ForkJoinPool owner) {
        ForkJoinWorkerThread t = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(owner);
        t.setName("dablo-scorer-" + WORKER_IDS.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
