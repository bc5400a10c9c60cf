package alpha.nomagicbody.task;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A plain FIFO task destination drained by its owner.<p>
 *
 * Nothing runs until the owner calls {@link #runNext()} or {@link
 * #runPending()}, typically once per turn of a cooperative, single-threaded
 * event loop. This gives the owner a deterministic point at which all
 * callbacks execute:
 *
 * <pre>{@code
 *   TaskQueue queue = new TaskQueue();
 *   Body.of(bytes).fullyRead(this::onBytes, this::onError, queue);
 *   // Nothing has been called yet
 *   queue.runPending();
 *   // onBytes has been called
 * }</pre>
 *
 * The queue itself is thread-safe, so tasks may be enqueued from any thread.
 * Draining must not be done concurrently or recursively (from within a task);
 * this is detected and rejected.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class TaskQueue extends AbstractTaskDestination
{
    private final AtomicBoolean draining = new AtomicBoolean();

    /**
     * Constructs an empty queue.
     */
    public TaskQueue() {
        // super()
    }

    /**
     * Runs the next task, if there is one.
     *
     * @return {@code true} if a task was run
     *
     * @throws IllegalStateException
     *             if called concurrently or from within a task
     */
    public boolean runNext() {
        beginDrain();
        try {
            Runnable t = poll();
            if (t == null) {
                return false;
            }
            runSafely(t);
            return true;
        } finally {
            draining.set(false);
        }
    }

    /**
     * Runs tasks until the queue is empty, including tasks that were enqueued
     * by tasks run during this call.
     *
     * @return the number of tasks run
     *
     * @throws IllegalStateException
     *             if called concurrently or from within a task
     */
    public int runPending() {
        beginDrain();
        try {
            int n = 0;
            Runnable t;
            while ((t = poll()) != null) {
                runSafely(t);
                ++n;
            }
            return n;
        } finally {
            draining.set(false);
        }
    }

    /**
     * {@return the number of tasks waiting to run}
     */
    public int size() {
        return queued();
    }

    @Override
    void afterEnqueue(Runnable task) {
        // Drained by the owner
    }

    private void beginDrain() {
        if (!draining.compareAndSet(false, true)) {
            throw new IllegalStateException("Already draining.");
        }
    }
}
