package alpha.nomagicbody.stream;

import alpha.nomagicbody.util.SerialExecutor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static alpha.nomagicbody.stream.ByteStream.State.CLOSED;
import static alpha.nomagicbody.stream.ByteStream.State.ERRORED;
import static alpha.nomagicbody.stream.ByteStream.State.READABLE;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link ByteStream}.<p>
 *
 * All state transitions and all read request invocations are executed by the
 * stream driver; a non-recursive {@link SerialExecutor}. Consequently, read
 * requests are never invoked concurrently, events are delivered in the order
 * their reads were issued, and a read issued from within a read request is
 * fulfilled only after the request has returned.<p>
 *
 * Fields without a modifier are confined to the driver.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultByteStream implements ByteStream
{
    private static final System.Logger LOG
            = System.getLogger(DefaultByteStream.class.getPackageName());

    private final UnderlyingSource source;
    private final SerialExecutor driver;
    private final DefaultController controller;
    private final AtomicReference<DefaultReader> reader;
    private final Deque<Object> queue;
    private final Deque<ReadRequest> pending;
    private volatile State state;
    private volatile boolean disturbed;
    private boolean closeRequested, pullPending;
    private Throwable storedError;

    DefaultByteStream(UnderlyingSource source) {
        this.source     = requireNonNull(source);
        this.driver     = new SerialExecutor();
        this.controller = new DefaultController();
        this.reader     = new AtomicReference<>();
        this.queue      = new ArrayDeque<>();
        this.pending    = new ArrayDeque<>();
        this.state      = READABLE;
        this.disturbed  = false;
    }

    /**
     * Calls the underlying source's start method.<p>
     *
     * Must be called once, by the creator, after construction.
     *
     * @return this, for chaining
     */
    DefaultByteStream start() {
        driver.execute(() -> {
            try {
                source.start(controller);
            } catch (RuntimeException e) {
                LOG.log(DEBUG, "Underlying source failed to start.", e);
                onError(e);
            }
        });
        return this;
    }

    /**
     * {@return the controller of this stream}
     */
    DefaultController controller() {
        return controller;
    }

    @Override
    public Reader getReader() {
        final State s = state;
        if (s != READABLE && disturbed) {
            // Consumed or cancelled; a fresh stream may still be read
            throw new ReaderAcquisitionException("Stream is " + s + " and disturbed.");
        }
        var r = new DefaultReader();
        if (!reader.compareAndSet(null, r)) {
            throw new ReaderAcquisitionException("Stream is locked to a reader.");
        }
        return r;
    }

    @Override
    public Branches tee() {
        var r = new DefaultReader();
        if (!reader.compareAndSet(null, r)) {
            throw new StreamLockedException();
        }
        LOG.log(DEBUG, () -> "Teeing " + this);
        return TeeSource.split(r);
    }

    @Override
    public void cancel(Throwable reason) {
        requireNonNull(reason);
        if (isLocked()) {
            throw new StreamLockedException();
        }
        cancel0(reason);
    }

    @Override
    public State state() {
        return state;
    }

    @Override
    public boolean isLocked() {
        return reader.get() != null;
    }

    @Override
    public boolean isDisturbed() {
        return disturbed;
    }

    @Override
    public String toString() {
        return "DefaultByteStream{state=" + state +
               ", locked=" + isLocked() +
               ", disturbed=" + disturbed + "}";
    }

    private void cancel0(Throwable reason) {
        disturbed = true;
        controller.done.set(true);
        driver.execute(() -> {
            if (state != READABLE) {
                return;
            }
            LOG.log(DEBUG, () -> "Cancelled with reason: " + reason);
            queue.clear();
            state = CLOSED;
            ReadRequest r;
            while ((r = pending.poll()) != null) {
                deliver(r, ReadEvent.end());
            }
            try {
                source.cancel(reason);
            } catch (RuntimeException e) {
                LOG.log(WARNING, "Underlying source failed to cancel.", e);
            }
        });
    }

    private void onRead(ReadRequest r) {
        switch (state) {
            case CLOSED  -> deliver(r, ReadEvent.end());
            case ERRORED -> deliver(r, ReadEvent.error(storedError));
            case READABLE -> {
                final Object chunk = queue.poll();
                if (chunk != null) {
                    deliver(r, ReadEvent.chunk(chunk));
                    if (closeRequested && queue.isEmpty()) {
                        finishClose();
                    }
                } else {
                    pending.add(r);
                    pullIfNeeded();
                }
            }
        }
    }

    private void pullIfNeeded() {
        if (pullPending || closeRequested || state != READABLE) {
            return;
        }
        pullPending = true;
        try {
            source.pull(controller);
        } catch (RuntimeException e) {
            LOG.log(DEBUG, "Underlying source failed to pull.", e);
            onError(e);
        }
    }

    private void onEnqueue(Object chunk) {
        if (state != READABLE) {
            LOG.log(DEBUG, () -> "Discarding chunk, stream is " + state + ".");
            return;
        }
        pullPending = false;
        final ReadRequest r = pending.poll();
        if (r == null) {
            queue.add(chunk);
        } else {
            deliver(r, ReadEvent.chunk(chunk));
        }
    }

    private void onClose() {
        if (state != READABLE) {
            return;
        }
        closeRequested = true;
        if (queue.isEmpty()) {
            finishClose();
        }
    }

    private void finishClose() {
        state = CLOSED;
        ReadRequest r;
        while ((r = pending.poll()) != null) {
            deliver(r, ReadEvent.end());
        }
    }

    private void onError(Throwable reason) {
        if (state != READABLE) {
            return;
        }
        controller.done.set(true);
        storedError = reason;
        queue.clear();
        state = ERRORED;
        ReadRequest r;
        while ((r = pending.poll()) != null) {
            deliver(r, ReadEvent.error(reason));
        }
    }

    private static void deliver(ReadRequest r, ReadEvent e) {
        try {
            r.onEvent(e);
        } catch (RuntimeException ex) {
            LOG.log(ERROR, () -> "Read request failed to process " + e.kind() + ".", ex);
        }
    }

    final class DefaultController implements Controller {
        // Set on first terminal signal, including consumer cancel
        private final AtomicBoolean done = new AtomicBoolean();

        @Override
        public void enqueue(Object chunk) {
            if (!tryEnqueue(chunk)) {
                throw new IllegalStateException("Stream is closed, errored or cancelled.");
            }
        }

        @Override
        public void close() {
            if (!tryClose()) {
                throw new IllegalStateException("Stream is closed, errored or cancelled.");
            }
        }

        @Override
        public void error(Throwable reason) {
            if (!tryError(reason)) {
                throw new IllegalStateException("Stream is closed, errored or cancelled.");
            }
        }

        /**
         * Same as {@link #enqueue(Object)}, except a stream no longer
         * accepting chunks is signalled by returning {@code false}.
         *
         * @param chunk to enqueue
         * @return {@code true} if enqueued
         */
        boolean tryEnqueue(Object chunk) {
            requireNonNull(chunk);
            if (done.get()) {
                return false;
            }
            driver.execute(() -> onEnqueue(chunk));
            return true;
        }

        boolean tryClose() {
            if (!done.compareAndSet(false, true)) {
                return false;
            }
            driver.execute(DefaultByteStream.this::onClose);
            return true;
        }

        boolean tryError(Throwable reason) {
            requireNonNull(reason);
            if (!done.compareAndSet(false, true)) {
                return false;
            }
            driver.execute(() -> onError(reason));
            return true;
        }
    }

    private final class DefaultReader implements Reader {
        private final AtomicInteger outstanding = new AtomicInteger();
        private volatile boolean released;

        @Override
        public void read(ReadRequest request) {
            requireNonNull(request);
            requireHeld();
            disturbed = true;
            outstanding.incrementAndGet();
            driver.execute(() -> onRead(e -> {
                outstanding.decrementAndGet();
                request.onEvent(e);
            }));
        }

        @Override
        public void cancel(Throwable reason) {
            requireNonNull(reason);
            requireHeld();
            cancel0(reason);
        }

        @Override
        public void releaseLock() {
            if (released) {
                return;
            }
            if (outstanding.get() > 0) {
                throw new IllegalStateException("Reader has outstanding reads.");
            }
            released = true;
            reader.compareAndSet(this, null);
        }

        private void requireHeld() {
            if (released) {
                throw new IllegalStateException("Reader lock released.");
            }
        }
    }
}
