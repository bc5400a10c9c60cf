package alpha.nomagicbody.internal;

import alpha.nomagicbody.message.Body;
import alpha.nomagicbody.message.ChunkTypeException;
import alpha.nomagicbody.stream.ByteStream;
import alpha.nomagicbody.stream.ReadEvent;
import alpha.nomagicbody.stream.ReadRequest;
import alpha.nomagicbody.task.TaskDestination;

import java.nio.ByteBuffer;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static alpha.nomagicbody.internal.IncrementalReadLoop.State.DELIVERING;
import static alpha.nomagicbody.internal.IncrementalReadLoop.State.ENDED;
import static alpha.nomagicbody.internal.IncrementalReadLoop.State.ERRORED;
import static alpha.nomagicbody.internal.IncrementalReadLoop.State.READING;
import static alpha.nomagicbody.internal.IncrementalReadLoop.State.STOPPED;
import static alpha.nomagicbody.util.ByteBuffers.copy;
import static java.lang.System.Logger.Level.DEBUG;

/**
 * Reads a stream one chunk at a time, handing each chunk to a callback on a
 * task destination.<p>
 *
 * At most one read is outstanding. A chunk moves the loop from {@code READING}
 * to {@code DELIVERING}, and only when the chunk callback has executed on the
 * destination does the loop go back to {@code READING} and issue the next
 * read. The end and error events are terminal.<p>
 *
 * {@link #stop()} moves a non-terminal loop to {@code STOPPED} and cancels the
 * reader. A chunk that arrives or is queued thereafter is dropped.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class IncrementalReadLoop implements ReadRequest, Body.ReadSession
{
    private static final System.Logger LOG
            = System.getLogger(IncrementalReadLoop.class.getPackageName());

    enum State {
        READING, DELIVERING, ENDED, ERRORED, STOPPED;

        boolean isTerminal() {
            return this == ENDED || this == ERRORED || this == STOPPED;
        }
    }

    private final ByteStream.Reader reader;
    private final Consumer<byte[]> processChunk;
    private final Runnable processEnd;
    private final Consumer<Throwable> processError;
    private final TaskDestination destination;
    private final AtomicReference<State> state;

    IncrementalReadLoop(
            ByteStream.Reader reader,
            Consumer<byte[]> processChunk,
            Runnable processEnd,
            Consumer<Throwable> processError,
            TaskDestination destination)
    {
        this.reader       = reader;
        this.processChunk = processChunk;
        this.processEnd   = processEnd;
        this.processError = processError;
        this.destination  = destination;
        this.state        = new AtomicReference<>(READING);
    }

    /**
     * Issues the first read.
     */
    void start() {
        reader.read(this);
    }

    /**
     * {@return the current state}
     */
    State state() {
        return state.get();
    }

    @Override
    public void stop() {
        State prev;
        do {
            prev = state.get();
            if (prev.isTerminal()) {
                return;
            }
        } while (!state.compareAndSet(prev, STOPPED));
        LOG.log(DEBUG, "Incremental read stopped.");
        reader.cancel(new CancellationException("Read stopped."));
    }

    @Override
    public boolean isDone() {
        return state.get().isTerminal();
    }

    @Override
    public void onEvent(ReadEvent event) {
        if (state.get() != READING) {
            LOG.log(DEBUG, () -> "Dropping " + event.kind() + ", loop is " + state.get() + ".");
            return;
        }
        switch (event.kind()) {
            case CHUNK -> onChunk(event.value());
            case END   -> {
                if (state.compareAndSet(READING, ENDED)) {
                    DefaultBody.enqueue(destination, processEnd);
                }
            }
            case ERROR -> {
                if (state.compareAndSet(READING, ERRORED)) {
                    final Throwable r = event.reason();
                    DefaultBody.enqueue(destination, () -> processError.accept(r));
                }
            }
        }
    }

    private void onChunk(Object chunk) {
        if (!(chunk instanceof ByteBuffer buf)) {
            if (state.compareAndSet(READING, ERRORED)) {
                var e = new ChunkTypeException(chunk);
                reader.cancel(e);
                DefaultBody.enqueue(destination, () -> processError.accept(e));
            }
            return;
        }
        if (!state.compareAndSet(READING, DELIVERING)) {
            return;
        }
        final byte[] bytes = copy(buf);
        if (!DefaultBody.enqueue(destination, () -> deliver(bytes))) {
            // Nobody will ever run the continuation
            if (state.compareAndSet(DELIVERING, STOPPED)) {
                reader.cancel(new CancellationException("Task destination shut down."));
            }
        }
    }

    private void deliver(byte[] chunk) {
        if (state.get() != DELIVERING) {
            LOG.log(DEBUG, "Dropping chunk, loop was stopped.");
            return;
        }
        try {
            processChunk.accept(chunk);
        } finally {
            if (state.compareAndSet(DELIVERING, READING)) {
                reader.read(this);
            }
        }
    }
}
