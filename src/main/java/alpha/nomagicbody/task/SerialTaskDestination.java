package alpha.nomagicbody.task;

import alpha.nomagicbody.util.SeriallyRunnable;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * A task destination that drains itself on an executor.<p>
 *
 * Enqueueing a task starts a pump, unless one is already active. The pump
 * submits one drain job to the executor, which runs all queued tasks and then
 * completes the pump. A {@link SeriallyRunnable} in asynchronous mode makes
 * sure that at most one drain job is active and that a task enqueued while a
 * job is finishing is picked up by a new job.<p>
 *
 * If the executor rejects a drain job, this destination shuts itself down.
 * The enqueue that triggered the job fails with a {@link
 * DestinationClosedException} caused by the rejection.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class SerialTaskDestination extends AbstractTaskDestination
{
    private final Executor executor;
    private final SeriallyRunnable pump;
    private volatile Rejection rejection;

    private record Rejection(RejectedExecutionException cause, List<Runnable> stranded) {
        boolean stranded(Runnable task) {
            return stranded.stream().anyMatch(t -> t == task);
        }
    }

    SerialTaskDestination(Executor executor) {
        this.executor = requireNonNull(executor);
        this.pump     = new SeriallyRunnable(this::submitDrain, true);
        this.rejection = null;
    }

    @Override
    void afterEnqueue(Runnable task) {
        pump.run();
        final var r = rejection;
        if (r != null && r.stranded(task)) {
            throw new DestinationClosedException(r.cause());
        }
    }

    private void submitDrain() {
        if (queued() == 0) {
            pump.complete();
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            // Terminal, the executor will not take more jobs
            pump.complete();
            rejection = new Rejection(e, shutdown());
        }
    }

    private void drain() {
        try {
            Runnable t;
            while ((t = poll()) != null) {
                runSafely(t);
            }
        } finally {
            pump.complete();
        }
    }
}
