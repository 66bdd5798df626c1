package com.questrail.central.runtime;

import com.questrail.central.internal.time.SystemWallClock;
import com.questrail.central.observability.CentralErrorEvent;
import com.questrail.central.observability.CentralObservabilitySink;
import com.questrail.central.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CentralOperationalDriver
 * =============================================================================
 * Serialized event loop that owns all central coordination state.
 *
 * <h2>Purpose</h2>
 * Public operations, radio notifications and deadline firings are all
 * submitted here as tasks and run one at a time on a dedicated thread. This
 * gives the readiness gate, the scan slot and the two request maps a single
 * owner:
 * <ul>
 *   <li>No concurrent modification of coordinator state</li>
 *   <li>Resolution and removal of a request are atomic with respect to
 *       notifications and deadlines</li>
 *   <li>Callbacks run on the loop thread, in submission order</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()          → starts event loop thread
 *   driver.execute(...)     → enqueues a task
 *   driver.stop()           → stops the loop; queued tasks are discarded
 * </pre>
 *
 * Tasks submitted while the driver is not running are ignored.
 */
public final class CentralOperationalDriver implements Executor {

    private final CentralObservabilitySink observabilitySink;

    private final BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;

    public CentralOperationalDriver(CentralObservabilitySink observabilitySink) {
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public CentralOperationalDriver() {
        this(null);
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread thread = new Thread(this::runEventLoop, "central-event-loop");
            thread.setDaemon(true);
            eventLoopThread = thread;
            thread.start();
        }
    }

    /**
     * Stops the event loop thread gracefully.
     * Blocks until the event loop thread terminates, unless called from it.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread thread = eventLoopThread;
            if (thread != null) {
                thread.interrupt();
                if (thread != Thread.currentThread()) {
                    try {
                        thread.join(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            taskQueue.clear();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean inEventLoop() {
        return Thread.currentThread() == eventLoopThread;
    }

    /**
     * Submits a task for processing.
     * Tasks are processed sequentially in submission order.
     */
    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (running.get()) {
            taskQueue.offer(task);
        }
    }

    /**
     * Main event loop - runs on dedicated thread.
     */
    private void runEventLoop() {
        while (running.get()) {
            try {
                Runnable task = taskQueue.take();
                if (running.get()) {
                    task.run();
                }
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
            } catch (RuntimeException e) {
                observabilitySink.onError(new CentralErrorEvent(
                    SystemWallClock.INSTANCE.now(),
                    "Event loop task failed",
                    e
                ));
            }
        }
    }
}
