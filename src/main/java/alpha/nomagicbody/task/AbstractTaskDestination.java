package alpha.nomagicbody.task;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Holds the task queue and implements the shutdown protocol of a {@link
 * TaskDestination}.<p>
 *
 * The concrete class decides when and by whom the queue is drained, using
 * {@link #poll()} and {@link #runSafely(Runnable)}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
abstract class AbstractTaskDestination implements TaskDestination
{
    private static final System.Logger LOG
            = System.getLogger(AbstractTaskDestination.class.getPackageName());

    private final Queue<Runnable> tasks;
    private volatile boolean shutdown;

    AbstractTaskDestination() {
        this.tasks = new ConcurrentLinkedQueue<>();
        this.shutdown = false;
    }

    @Override
    public final void enqueue(Runnable task) {
        requireNonNull(task);
        if (shutdown) {
            throw new DestinationClosedException();
        }
        tasks.add(task);
        // Shutdown may have drained the queue just before our add
        if (shutdown && tasks.remove(task)) {
            throw new DestinationClosedException();
        }
        afterEnqueue(task);
    }

    @Override
    public final List<Runnable> shutdown() {
        shutdown = true;
        List<Runnable> unstarted = new ArrayList<>();
        Runnable t;
        while ((t = tasks.poll()) != null) {
            unstarted.add(t);
        }
        if (!unstarted.isEmpty()) {
            LOG.log(WARNING, () -> getClass().getSimpleName() + " shut down with " +
                    unstarted.size() + " unstarted task(s), they will never run.");
        }
        return unstarted;
    }

    @Override
    public final boolean isShutdown() {
        return shutdown;
    }

    /**
     * Called after each successful enqueue.<p>
     *
     * The implementation may throw {@link DestinationClosedException}, if it
     * shut down the destination and the task will never run.
     *
     * @param task just enqueued
     */
    abstract void afterEnqueue(Runnable task);

    /**
     * Retrieves and removes the next task.
     *
     * @return the next task, or {@code null} if none is queued or the
     *         destination has been shut down
     */
    final Runnable poll() {
        return shutdown ? null : tasks.poll();
    }

    /**
     * {@return the number of queued tasks}
     */
    final int queued() {
        return tasks.size();
    }

    /**
     * Runs the given task, logging a failure.
     *
     * @param task to run
     */
    static void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            LOG.log(ERROR, "Task failed, proceeding with the next.", e);
        }
    }
}
