package alpha.nomagicbody.util;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.ThreadLocal.withInitial;

/**
 * Executes actions serially in FIFO order without overlapping, using the
 * calling thread.<p>
 *
 * Actions are held in an unbounded concurrent queue and drained by a {@link
 * SeriallyRunnable} (same memory visibility rules apply). If the executor is
 * idle, the calling thread drains the queue before {@code execute} returns. If
 * the executor is busy, the action is queued and executed by the thread
 * already draining.<p>
 *
 * With {@code mayRecurse} {@code true}, an action submitted by the thread that
 * is currently executing an action runs immediately (recursively), ahead of
 * everything else in the queue.<p>
 *
 * With {@code mayRecurse} {@code false} (the default), every action is queued,
 * no matter which thread is calling. The submitting action completes before
 * the submitted action starts. This is what the reference byte stream relies
 * on: a read request that issues a new read from within its own callback never
 * receives the next event recursively.<p>
 *
 * An action that throws is logged and does not prevent subsequent actions
 * from executing.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class SerialExecutor implements Executor
{
    private static final System.Logger LOG
            = System.getLogger(SerialExecutor.class.getPackageName());

    private static final ThreadLocal<Boolean> EXECUTING = withInitial(() -> false);

    private final Queue<Runnable> actions;
    private final SeriallyRunnable serial;
    private final boolean mayRecurse;

    /**
     * Constructs a serial executor that never recurse.
     */
    public SerialExecutor() {
        this(false);
    }

    /**
     * Constructs a serial executor.
     *
     * @param mayRecurse {@code true} or {@code false}
     */
    public SerialExecutor(boolean mayRecurse) {
        this.actions    = new ConcurrentLinkedQueue<>();
        this.serial     = new SeriallyRunnable(this::pollAndExecute);
        this.mayRecurse = mayRecurse;
    }

    /**
     * Execute the given action or schedule it for future execution.
     *
     * @param action to execute
     *
     * @throws NullPointerException if {@code action} is {@code null}
     */
    @Override
    public void execute(Runnable action) {
        if (mayRecurse && EXECUTING.get()) {
            action.run();
        } else {
            actions.add(action);
            serial.run();
        }
    }

    private void pollAndExecute() {
        try {
            if (mayRecurse) EXECUTING.set(true);
            Runnable a;
            while ((a = actions.poll()) != null) {
                try {
                    a.run();
                } catch (RuntimeException e) {
                    LOG.log(ERROR, "Serial action failed, proceeding with the next.", e);
                }
            }
        } finally {
            if (mayRecurse) EXECUTING.set(false);
        }
    }
}
