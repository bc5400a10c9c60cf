package alpha.nomagicbody.util;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorates a {@code Runnable} called "the delegate" with the ability to
 * <i>run serially</i> despite recursive calls from the delegate itself or
 * concurrent calls by other threads.<p>
 *
 * If a party calls {@code run} when a run is already active, the call
 * schedules one extra run to execute immediately after the active one and then
 * returns without blocking. No reentrancy, no stack growth. The scheduled run
 * is executed either by the thread already running or by a competing thread,
 * whichever wins the race.<p>
 *
 * Calls made while a run is active are not counted; at most one extra
 * repetition is scheduled at any given moment. The delegate is therefore
 * expected to process everything available (for example, poll a queue until
 * empty).<p>
 *
 * In NoMagicBody, this class is the primitive behind the stream driver (see
 * {@link SerialExecutor}) and the pump of executor-backed task destinations.
 *
 *
 * <h2>Memory Synchronization</h2>
 *
 * Each run <i>happens-before</i> the subsequent run. State written by one run
 * is visible to the next run without external synchronization, even if the
 * next run executes on another thread. Scheduling a run (calling
 * {@code run()}) also happens-before the run that follows.
 *
 *
 * <h2>Asynchronous Mode</h2>
 *
 * By default, the delegate becomes eligible to run again as soon as the
 * run-method returns. In asynchronous mode (constructor argument), a logical
 * run lasts until both the run-method has returned and {@link #complete()}
 * has been called exactly once, by any thread. This supports handing the work
 * over to another thread (an executor) while still guaranteeing that runs
 * never overlap.
 *
 *
 * <h2>Error Handling</h2>
 *
 * If the delegate throws, a potentially scheduled repetition is voided and
 * the throwable propagates as-is. In asynchronous mode, an exceptional return
 * is assumed to mean that no asynchronous task was started, and the logical
 * run is implicitly completed. The instance remains usable.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class SeriallyRunnable implements Runnable
{
    private static final int
            END     = 0, // Not running, may start
            BEGIN_1 = 1, // Running, awaiting one completion
            BEGIN_2 = 2, // Running, awaiting two completions
            AGAIN_1 = 3, // BEGIN_1 with extra run scheduled
            AGAIN_2 = 4; // BEGIN_2 with extra run scheduled

    private final Runnable delegate;
    private final boolean async;
    private final AtomicInteger state;
    private final ThreadLocal<Boolean> initiator;

    /**
     * Constructs a {@code SeriallyRunnable} executing in synchronous mode.
     *
     * @param delegate which runnable to run
     *
     * @throws NullPointerException if {@code delegate} is {@code null}
     */
    public SeriallyRunnable(Runnable delegate) {
        this(delegate, false);
    }

    /**
     * Constructs a {@code SeriallyRunnable}.
     *
     * @param delegate which runnable to run
     * @param async async mode on/off
     *
     * @throws NullPointerException if {@code delegate} is {@code null}
     */
    public SeriallyRunnable(Runnable delegate, boolean async) {
        if (delegate == null) {
            throw new NullPointerException("delegate");
        }
        this.delegate  = delegate;
        this.async     = async;
        this.state     = new AtomicInteger(END);
        this.initiator = ThreadLocal.withInitial(() -> false);
    }

    @Override
    public void run() {
        boolean again = true;
        while (again) {
            if (!tryBegin()) {
                // A re-run has been scheduled for whoever is running
                return;
            }
            try {
                initiator.set(true);
                delegate.run();
            } catch (Throwable t) {
                if (async) {
                    // Assume the async task never started
                    try {
                        countDown();
                    } catch (IllegalStateException next) {
                        t.addSuppressed(next);
                    }
                }
                throw t;
            } finally {
                try {
                    again = countDown() == AGAIN_1;
                } finally {
                    initiator.set(false);
                }
            }
        }
    }

    /**
     * In asynchronous mode, marks the active logical run as completed.<p>
     *
     * If a re-run was scheduled and the calling thread is not the one
     * currently executing the run-method, the calling thread executes the
     * re-run.
     *
     * @throws IllegalStateException
     *             if running in synchronous mode, or
     *             if no run is active
     */
    public void complete() {
        if (!async) {
            throw new IllegalStateException("Call to complete() in synchronous mode.");
        }
        if (countDown() == AGAIN_1 && !initiator.get()) {
            run();
        }
    }

    private boolean tryBegin() {
        int old = state.getAndUpdate(v -> switch (v) {
            case END     -> async ? BEGIN_2 : BEGIN_1;
            case BEGIN_1 -> AGAIN_1;
            case BEGIN_2 -> AGAIN_2;
            case AGAIN_1, AGAIN_2 -> v;
            default -> throw new AssertionError(v);
        });
        return old == END;
    }

    private int countDown() {
        return state.getAndUpdate(v -> switch (v) {
            case END -> throw new IllegalStateException("No run active.");
            case BEGIN_1, AGAIN_1 -> END;
            case BEGIN_2 -> BEGIN_1;
            case AGAIN_2 -> AGAIN_1;
            default -> throw new AssertionError(v);
        });
    }
}
