package pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import hw.BatteryMonitor;
import hw.BatteryMonitor.PowerState;

/**
 * Runs many independent pipelines on a bounded worker pool.
 * <p>
 * The queue holds at most a few jobs per worker; when it is full the
 * submitting thread runs the job itself. A closed processor takes no jobs. {@link #cancel()} stops scheduling:
 * jobs that have not started report {@link BatchResult.Status#CANCELLED},
 * jobs already running finish normally.
 */
public class BatchProcessor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    private static final long SCALER_PERIOD_MS = 5000;

    private final PipelineExecutor executor;
    private final ThreadPoolExecutor pool;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private Thread scaler;

    public BatchProcessor(int threads, PipelineExecutor executor) {
        if (threads < 1)
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        this.executor = executor;
        AtomicInteger n = new AtomicInteger();
        this.pool = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(2, threads)),
                r -> {
                    Thread t = new Thread(r, "batch-worker-" + n.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                // caller runs, also after shutdown
                (task, ex) -> task.run());
    }

    /**
     * Size the pool from the current power state and, with {@code rescale},
     * keep resizing it from a daemon thread while the processor is open.
     */
    public static BatchProcessor fromPowerPolicy(PipelineExecutor executor, boolean rescale) {
        PowerState state = BatteryMonitor.current();
        int threads = BatteryMonitor.threadsFor(state);
        logger.info("Power policy: onAC={}, battery={}%, threads={}", state.onAC(), state.batteryLevel(), threads);
        BatchProcessor bp = new BatchProcessor(threads, executor);
        if (rescale)
            bp.startScaler();
        return bp;
    }

    public int threads() {
        return pool.getCorePoolSize();
    }

    /** Resize the pool; running jobs are not affected. */
    public void setThreads(int threads) {
        if (threads < 1)
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        // core must never exceed max
        if (threads > pool.getMaximumPoolSize()) {
            pool.setMaximumPoolSize(threads);
            pool.setCorePoolSize(threads);
        } else {
            pool.setCorePoolSize(threads);
            pool.setMaximumPoolSize(threads);
        }
    }

    public void cancel() {
        if (!cancelled.getAndSet(true))
            logger.info("Batch cancelled, no further jobs will start");
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Run all jobs and wait for them. Results are in job order.
     *
     * @throws InterruptedException  if interrupted while waiting; jobs still
     *                               running keep going
     * @throws IllegalStateException after {@link #close()}
     */
    public List<BatchResult> process(List<BatchJob> jobs) throws InterruptedException {
        if (pool.isShutdown())
            throw new IllegalStateException("batch processor is closed");
        BatchResult[] results = new BatchResult[jobs.size()];
        CountDownLatch latch = new CountDownLatch(jobs.size());
        long t0 = System.nanoTime();

        for (int i = 0; i < jobs.size(); i++) {
            BatchJob job = jobs.get(i);
            int slot = i;
            if (cancelled.get()) {
                results[slot] = BatchResult.cancelled(job.id());
                latch.countDown();
                continue;
            }
            pool.execute(() -> {
                try {
                    results[slot] = runJob(job);
                } finally {
                    latch.countDown();
                }
            });
        }
        latch.await();

        long failed = Arrays.stream(results).filter(r -> r.status() == BatchResult.Status.FAILED).count();
        long skipped = Arrays.stream(results).filter(r -> r.status() == BatchResult.Status.CANCELLED).count();
        logger.info("Batch: jobs={} failed={} cancelled={} threads={} total={} ms",
                jobs.size(), failed, skipped, pool.getCorePoolSize(), Math.round((System.nanoTime() - t0) / 1e6));
        return new ArrayList<>(Arrays.asList(results));
    }

    private BatchResult runJob(BatchJob job) {
        if (cancelled.get())
            return BatchResult.cancelled(job.id());
        long t0 = System.nanoTime();
        try {
            BatchResult r = BatchResult.succeeded(job.id(), executor.execute(job.input(), job.pipeline()),
                    (System.nanoTime() - t0) / 1e6);
            logger.debug("{}: done in {} ms", job.id(), Math.round(r.millis()));
            return r;
        } catch (PipelineExecutionException e) {
            logger.warn("{}: {}", job.id(), e.getMessage());
            return BatchResult.failed(job.id(), e, (System.nanoTime() - t0) / 1e6);
        }
    }

    // ---------------- Live scaling ----------------

    private synchronized void startScaler() {
        if (scaler != null)
            return;
        scaler = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(SCALER_PERIOD_MS);
                    int target = BatteryMonitor.threadsFor(BatteryMonitor.current());
                    if (target != pool.getCorePoolSize()) {
                        setThreads(target);
                        logger.info("Scaler: target threads = {}", target);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "battery-scaler");
        scaler.setDaemon(true);
        scaler.start();
    }

    /** Stop the scaler and the pool, waiting for running jobs. */
    @Override
    public void close() {
        synchronized (this) {
            if (scaler != null)
                scaler.interrupt();
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS))
                logger.warn("Batch workers still running after 30 s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
