package alpha.nomagicbody.task;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * An execution context that accepts units of work to run later.<p>
 *
 * Every callback that a body delivers to application code passes through a
 * task destination exactly once. A destination never runs a task
 * synchronously within {@link #enqueue(Runnable)}, and tasks enqueued to the
 * same destination run one at a time, in FIFO order.<p>
 *
 * Two implementations are provided. A {@link TaskQueue} is drained explicitly
 * by its owner, for example once per turn of an event loop, and
 * {@link #serial(Executor)} returns a destination that drains itself on a
 * given executor.<p>
 *
 * A task that throws is logged, and the destination proceeds with the next
 * task.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface TaskDestination
{
    /**
     * Returns a destination that runs its tasks serially on the given
     * executor.<p>
     *
     * The executor may be multi-threaded; still, tasks never overlap, and each
     * task happens-before the next.<p>
     *
     * An executor that runs tasks on the calling thread, such as {@code
     * Runnable::run}, makes the destination run a task from within {@link
     * #enqueue(Runnable)}; callbacks queued by a body would then no longer be
     * deferred.
     *
     * @param executor to run tasks on
     * @return a new destination
     *
     * @throws NullPointerException if {@code executor} is {@code null}
     */
    static TaskDestination serial(Executor executor) {
        return new SerialTaskDestination(executor);
    }

    /**
     * Enqueues a task.
     *
     * @param task to run later
     *
     * @throws NullPointerException
     *             if {@code task} is {@code null}
     * @throws DestinationClosedException
     *             if the destination has been shut down
     */
    void enqueue(Runnable task);

    /**
     * Shuts down this destination.<p>
     *
     * Subsequent enqueues fail with {@link DestinationClosedException}. Tasks
     * not yet started will never run; they are returned to the caller.
     *
     * @return tasks that were enqueued but never started
     */
    List<Runnable> shutdown();

    /**
     * {@return {@code true} if this destination has been shut down}
     */
    boolean isShutdown();
}
