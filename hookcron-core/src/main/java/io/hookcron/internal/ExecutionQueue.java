package io.hookcron.internal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded-concurrency admission control for job executions.
 *
 * <p>At most {@code maxConcurrency} tasks run at once; the overflow waits in an unbounded FIFO
 * list and is started, in submission order, as running tasks complete. A task's completion is
 * observed whether it returns normally or throws.
 */
public class ExecutionQueue {
    private static final Logger log = LoggerFactory.getLogger(ExecutionQueue.class);

    private final int maxConcurrency;
    private final ExecutorService workerPool;

    private final Object lock = new Object();
    // guarded by lock
    private final Deque<Runnable> pending = new ArrayDeque<>();
    private int running;
    private boolean shutdown;

    public ExecutionQueue(int maxConcurrency) {
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }
        this.maxConcurrency = maxConcurrency;
        AtomicInteger seq = new AtomicInteger();
        this.workerPool = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r);
            t.setName("hookcron.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run {@code task} now if a slot is free, otherwise queue it behind earlier submissions.
     */
    public void submit(Runnable task) {
        Objects.requireNonNull(task, "task must not be null");
        synchronized (lock) {
            if (shutdown) {
                log.warn("hookcron queue is shut down; dropping submitted task");
                return;
            }
            if (running >= maxConcurrency) {
                pending.addLast(task);
                log.debug("hookcron queue saturated running={} pending={}", running, pending.size());
                return;
            }
            running++;
        }
        launch(task);
    }

    public int running() {
        synchronized (lock) {
            return running;
        }
    }

    public int pending() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Drop pending tasks and wait up to {@code timeout} for running ones. Idempotent.
     */
    public void shutdown(Duration timeout) {
        int dropped;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            dropped = pending.size();
            pending.clear();
        }
        if (dropped > 0) {
            log.warn("hookcron queue shutting down; dropped {} pending task(s)", dropped);
        }

        workerPool.shutdown();
        try {
            if (!workerPool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                workerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerPool.shutdownNow();
        }
    }

    private void launch(Runnable task) {
        try {
            workerPool.execute(() -> runTracked(task));
        } catch (RejectedExecutionException e) {
            log.error("hookcron queue rejected task msg={}", e.getMessage());
            taskDone();
        }
    }

    private void runTracked(Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("hookcron queued task failed msg={}", e.getMessage(), e);
        } finally {
            taskDone();
        }
    }

    private void taskDone() {
        Runnable next;
        synchronized (lock) {
            running = Math.max(0, running - 1);
            if (shutdown) {
                return;
            }
            next = pending.pollFirst();
            if (next == null) {
                return;
            }
            running++;
        }
        launch(next);
    }
}
